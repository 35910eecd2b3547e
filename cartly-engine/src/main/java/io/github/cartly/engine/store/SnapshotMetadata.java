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

import java.time.Instant;
import java.util.Objects;

/**
 * What a snapshot store knows about a snapshot besides its payload.
 */
public interface SnapshotMetadata {

    String entityId();

    /** When the snapshot was written. */
    Instant getTimestamp();

    /** Serialization version of the stored payload. */
    int payloadVersion();

    /** Entity version the snapshot state corresponds to. Replay continues after it. */
    long entityStateVersion();

    static SnapshotMetadata of(String entityId, Instant timestamp, int payloadVersion, long stateVersion) {
        return new Simple(entityId, timestamp, payloadVersion, stateVersion);
    }

    final class Simple implements SnapshotMetadata {

        private final String entityId;
        private final Instant timestamp;
        private final int payloadVersion;
        private final long stateVersion;

        private Simple(String entityId, Instant timestamp, int payloadVersion, long stateVersion) {
            this.entityId = Objects.requireNonNull(entityId, "entityId");
            this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
            this.payloadVersion = payloadVersion;
            this.stateVersion = stateVersion;
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
        public int payloadVersion() {
            return payloadVersion;
        }

        @Override
        public long entityStateVersion() {
            return stateVersion;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Simple)) {
                return false;
            }
            Simple other = (Simple) o;
            return payloadVersion == other.payloadVersion && stateVersion == other.stateVersion
                    && entityId.equals(other.entityId) && timestamp.equals(other.timestamp);
        }

        @Override
        public int hashCode() {
            return Objects.hash(entityId, timestamp, payloadVersion, stateVersion);
        }

        @Override
        public String toString() {
            return "Snapshot[" + entityId + "@" + stateVersion + ", payload v" + payloadVersion + ", " + timestamp
                    + "]";
        }
    }
}
