package io.github.cartly.engine.immutables;

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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.annotation.JsonTypeIdResolver;
import io.github.cartly.engine.Event;
import io.github.cartly.engine.EventHeader;
import io.github.cartly.engine.EventSourcedEntity;
import io.github.cartly.engine.EventType;

import java.util.function.Function;

/**
 * Event type for entities whose events are <a href="http://immutables.github.io">Immutables</a> values serialized by
 * Jackson.
 * <p>
 * An entity declares one abstract base extending this interface, and all its events in the same package, annotated
 * with {@link ImmutablesSupport} in {@code package-info.java}. The JSON {@code type} property names the event, and
 * {@link ImmutableEventTypeResolver} maps it back to the generated class.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.CUSTOM, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonTypeIdResolver(ImmutableEventTypeResolver.class)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({ "entityId", "entityStateVersion", "timestamp" })
@JsonInclude(JsonInclude.Include.NON_ABSENT)
public interface ImmutableEvent extends Event {

    /**
     * Name of the event without the generated {@code Immutable} prefix. The resolver writes it as the type property.
     */
    @Override
    @JsonIgnore
    default String getType() {
        return EventType.fromClassStripping(getClass(), "Immutable", "Event");
    }

    /**
     * Builder preset with the header of the entity's next event.
     *
     * @param from the generated builder's {@code from} method, as in {@code h -> new Builder().from(h)}
     */
    static <T> T builderForEntity(EventSourcedEntity entity, Function<Event, T> from) {
        return from.apply(new EventHeader(entity));
    }
}
