package io.github.cartly.engine.store;

/*-
 * #%L
 * cartly
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.exc.InvalidTypeIdException;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Objects;

/**
 * Serialization into JSON by means of Jackson. Supports single payload version. Payloads of newer versions and
 * payloads naming a type this release does not know were written by a newer release, and are not deserialized.
 * Any other payload that cannot be read is corrupt and fails with {@link UncheckedIOException}.
 *
 * @param <T> base type of serialized objects
 */
public class JacksonSerialization<T> implements Serialization<T> {
    private static final Logger logger = LoggerFactory.getLogger(JacksonSerialization.class);

    private final ObjectMapper mapper;
    private final Class<T> type;
    private final int payloadVersion;

    public JacksonSerialization(ObjectMapper mapper, Class<T> type, int payloadVersion) {
        this.mapper = Objects.requireNonNull(mapper);
        this.type = Objects.requireNonNull(type);
        this.payloadVersion = payloadVersion;
    }

    public JacksonSerialization(Class<T> type) {
        this(defaultObjectMapper(), type, 1);
    }

    /**
     * Object mapper supporting java.time and Optional values, writing dates as ISO strings and ignoring unknown
     * properties.
     * @return new object mapper
     */
    public static ObjectMapper defaultObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModules(new Jdk8Module(), new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Override
    public int payloadVersion(T object) {
        return payloadVersion;
    }

    @Override
    public String serialize(T object) {
        try {
            return mapper.writeValueAsString(object);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Cannot serialize " + object, e);
        }
    }

    @Override
    public T deserialize(int payloadVersion, String payload, String type) {
        if (payloadVersion > this.payloadVersion) {
            logger.warn("Payload version {} of type {} is newer than supported version {}", payloadVersion, type,
                this.payloadVersion);
            return null;
        }
        try {
            return mapper.readValue(payload, this.type);
        } catch (InvalidTypeIdException e) {
            logger.warn("Type {} of payload version {} is not known to this release", e.getTypeId(), payloadVersion);
            return null;
        } catch (IOException e) {
            throw new UncheckedIOException("Payload of type " + type + " version " + payloadVersion
                    + " is corrupt", e);
        }
    }

    @Override
    public T toSerializable(Object o) {
        return type.isInstance(o) ? type.cast(o) : null;
    }

    public ObjectMapper getObjectMapper() {
        return mapper;
    }
}
