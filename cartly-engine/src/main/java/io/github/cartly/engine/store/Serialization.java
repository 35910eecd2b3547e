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

/**
 * Converts store payloads to and from text. Event and snapshot stores delegate to an instance of this per entity
 * type.
 * <p>
 * Each stored row carries the payload version it was written with. When the shape of a payload changes
 * incompatibly, {@link #payloadVersion(Object)} starts returning a new number, and {@link #deserialize} keeps
 * reading every version written before.
 */
public interface Serialization<T> {

    /** Payload version that {@link #serialize(Object)} produces for this object. */
    int payloadVersion(T object);

    String serialize(T object);

    /**
     * Read a stored payload.
     *
     * @param payloadVersion version stored alongside the payload
     * @param payload stored text
     * @param type type discriminator column, {@code null} when the store keeps none
     * @return the object, or {@code null} when the version or type is not known to this release
     * @throws RuntimeException when the payload is corrupt
     */
    T deserialize(int payloadVersion, String payload, String type);

    /**
     * Narrow an object produced by an entity to the serializable type.
     *
     * @return the same instance, or {@code null} when it is not of a type this serialization handles
     */
    T toSerializable(Object o);
}
