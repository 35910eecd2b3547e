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
import java.util.Objects;

/**
 * Metadata part of an event. Can serve as base class for events, or as source for builders of
 * {@linkplain io.github.cartly.engine.immutables.ImmutableEvent immutable events}.
 * <p>Creating a header from an entity allocates next version of that entity, therefore the header should be created
 * only for events that are going to be persisted.</p>
 */
public class EventHeader implements Event {
    private final String entityId;
    private final long entityStateVersion;
    private final Instant timestamp;

    public EventHeader(EventSourcedEntity source) {
        this(source.getIdentity(), source.nextEventVersion());
    }

    public EventHeader(String entityId, long entityStateVersion) {
        this(entityId, entityStateVersion, Instant.now());
    }

    public EventHeader(String entityId, long entityStateVersion, Instant timestamp) {
        this.entityId = Objects.requireNonNull(entityId, "Entity id must be specified");
        this.entityStateVersion = entityStateVersion;
        this.timestamp = Objects.requireNonNull(timestamp, "Timestamp must be specified");
    }

    @Override
    public String entityId() {
        return entityId;
    }

    @Override
    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public long entityStateVersion() {
        return entityStateVersion;
    }

    @Override
    public String toString() {
        return getType() + "{entityId=" + entityId + ", entityStateVersion=" + entityStateVersion + ", timestamp="
                + timestamp + '}';
    }
}
