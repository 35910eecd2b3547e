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

import java.util.List;
import java.util.ListIterator;
import java.util.Optional;

import io.github.cartly.engine.EventSourcedEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Common logic for storing and reading snapshots.
 * <p>A store retains a limited number of most recent snapshots per entity. When the newest snapshot cannot be read,
 * the next older one is used, and when none can be read the entity is recovered from its full log.</p>
 *
 * @param <P> the type of payload. Most likely String.
 */
public abstract class SnapshotStore<P> {
    protected final Logger logger = LoggerFactory.getLogger(getClass());
    private final int retainedSnapshots;

    /**
     * Create store retaining given number of snapshots per entity.
     * @param retainedSnapshots how many most recent snapshots to keep, at least 1
     */
    protected SnapshotStore(int retainedSnapshots) {
        if (retainedSnapshots < 1) {
            throw new IllegalArgumentException("At least one snapshot must be retained, was " + retainedSnapshots);
        }
        this.retainedSnapshots = retainedSnapshots;
    }

    public static class Snapshot {
        private final long entityVersion;
        private final Object snapshot;

        Snapshot(long entityVersion, Object snapshot) {
            this.entityVersion = entityVersion;
            this.snapshot = snapshot;
        }

        public long getEntityVersion() {
            return entityVersion;
        }

        public Object getSnapshot() {
            return snapshot;
        }
    }

    public int getRetainedSnapshots() {
        return retainedSnapshots;
    }

    /**
     * Read latest readable snapshot of an entity.
     * @param entityId the identity of the entity
     * @return the snapshot and the version it was taken at, empty if no stored snapshot can be read
     */
    public Optional<Snapshot> readSnapshot(String entityId) {
        List<SnapshotRecord> records;
        try {
            records = retrieveSnapshotRecords(entityId);
        } catch (RuntimeException e) {
            logger.error("Cannot read snapshots of {}, will replay entire log", entityId, e);
            return Optional.empty();
        }
        for (SnapshotRecord snapshotRecord : records) {
            try {
                Object snapshot = deserializeSnapshot(snapshotRecord);
                if (snapshot != null) {
                    return Optional.of(new Snapshot(snapshotRecord.header.entityStateVersion(), snapshot));
                }
                logger.warn("Snapshot of {} at version {} is not supported", entityId,
                    snapshotRecord.header.entityStateVersion());
            } catch (Exception e) {
                logger.error("Failure during deserialization of snapshot of {} at version {}", entityId,
                    snapshotRecord.header.entityStateVersion(), e);
            }
        }
        return Optional.empty();
    }

    /**
     * Serialize and store the snapshot. Failures are logged, never thrown.
     *
     * @param entityId the identity of the entity
     * @param stateVersion version of the entity the snapshot reflects
     * @param snapshot snapshot provided by the entity
     * @return true if the snapshot was serialized and stored
     * @see EventSourcedEntity#createSnapshot()
     * @see #serializeSnapshot(String, long, Object)
     * @see #storeSnapshotRecord(SnapshotStore.SnapshotRecord)
     */
    public boolean store(String entityId, long stateVersion, Object snapshot) {
        try {
            SnapshotRecord snapshotRecord = serializeSnapshot(entityId, stateVersion, snapshot);
            if (snapshotRecord != null) {
                storeSnapshotRecord(snapshotRecord);
                logger.debug("Stored snapshot of entity {} at version {}", entityId, stateVersion);
                return true;
            }
        } catch (Exception e) {
            logger.error("Storing snapshot of entity {} at version {} failed", entityId, stateVersion, e);
        }
        return false;
    }

    /**
     * Transform stored payload into snapshot to be consumed by entity. Implementation will decide on header value, most
     * notably {@link SnapshotMetadata#payloadVersion()} on how to deserialize it.
     *
     * @param snapshotRecord the retrieved snapshot record
     * @return snapshot for deserialization, or null if the record is not supported
     */
    protected abstract Object deserializeSnapshot(SnapshotRecord snapshotRecord);

    /**
     * Serialize a snapshot of an entity.
     *
     * @param entityId     the identity of the entity
     * @param stateVersion version of the entity
     * @param snapshot     snapshot returned from {@link EventSourcedEntity#createSnapshot()}
     * @return header data and payload of the snapshot, null if snapshot is not supported
     */
    protected abstract SnapshotRecord serializeSnapshot(String entityId, long stateVersion, Object snapshot);

    /**
     * Retrieve retained snapshots of an entity, newest first.
     *
     * @param entityId the identity of an entity
     * @return header and payload of the snapshots, empty list if there are none
     */
    protected abstract List<SnapshotRecord> retrieveSnapshotRecords(String entityId);

    /**
     * Actually commit the snapshot record into underlying storage, and discard snapshots of the entity beyond
     * {@link #getRetainedSnapshots()}.
     *
     * @param snapshotRecord the record to store.
     */
    protected abstract void storeSnapshotRecord(SnapshotRecord snapshotRecord);

    /**
     * Put a record into a list ordered newest first, wherever its version belongs, so that a snapshot stored late
     * never shadows a newer one. A record of the same version is replaced and records beyond
     * {@link #getRetainedSnapshots()} are dropped. Callers guard the list.
     */
    protected void insertByVersion(List<SnapshotRecord> records, SnapshotRecord snapshotRecord) {
        long version = snapshotRecord.header.entityStateVersion();
        ListIterator<SnapshotRecord> position = records.listIterator();
        while (position.hasNext()) {
            long existing = position.next().header.entityStateVersion();
            if (existing == version) {
                position.set(snapshotRecord);
                return;
            }
            if (existing < version) {
                position.previous();
                break;
            }
        }
        position.add(snapshotRecord);
        while (records.size() > retainedSnapshots) {
            records.remove(records.size() - 1);
        }
    }

    /**
     * The record about a snapshot.
     */
    protected class SnapshotRecord {
        protected final SnapshotMetadata header;
        protected final P payload;

        /**
         * Create new record
         *
         * @param header  header
         * @param payload payload
         */
        public SnapshotRecord(SnapshotMetadata header, P payload) {
            this.header = header;
            this.payload = payload;
        }

        public SnapshotMetadata getHeader() {
            return header;
        }

        public P getPayload() {
            return payload;
        }
    }

}
