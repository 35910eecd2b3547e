package io.github.cartly.engine;

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

import java.time.Instant;

/**
 * Something that happened to an entity, in the entity's log. Events are the only input that changes an entity's
 * state, whether a request is being handled or the log is being replayed.
 * <p>
 * The header defined here is stored next to the payload, for ordering and for choosing the deserializer. How the
 * payload is written is up to the {@link io.github.cartly.engine.store.EventStore} in use. Jackson based events live in
 * {@link io.github.cartly.engine.immutables}.
 */
public interface Event {

    /**
     * Name of the event kind, unique within the entity type. It is stored with every event, so a renamed or removed
     * event still has to be readable under its old name.
     */
    default String getType() {
        return EventType.defaultTypeName(getClass());
    }

    /** @see EventSourcedEntity#getIdentity() */
    String entityId();

    Instant getTimestamp();

    /**
     * Position of the event in the entity's log, starting at 1. The entity has this version once the event is
     * applied.
     *
     * @see EventSourcedEntity#nextEventVersion()
     */
    long entityStateVersion();
}
