package io.github.cartly.engine.store.jdbc;

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

import io.github.cartly.engine.Event;

import java.time.Instant;
import java.util.Objects;

public class JdbcTestEvent implements Event {
    private final String entityId;
    private final long version;
    private final Instant timestamp;
    private final int payload;

    public JdbcTestEvent(String entityId, long version, Instant timestamp, int payload) {
        this.entityId = entityId;
        this.version = version;
        this.timestamp = timestamp;
        this.payload = payload;
    }

    public JdbcTestEvent(String entityId, long version, int payload) {
        this(entityId, version, Instant.parse("2017-05-03T10:15:30Z").plusSeconds(version), payload);
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
        return version;
    }

    public int getPayload() {
        return payload;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        JdbcTestEvent that = (JdbcTestEvent) o;
        return version == that.version && payload == that.payload && entityId.equals(that.entityId)
                && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entityId, version);
    }

    @Override
    public String toString() {
        return "JdbcTestEvent{entityId=" + entityId + ", version=" + version + ", payload=" + payload + '}';
    }
}
