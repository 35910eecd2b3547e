package io.github.cartly.engine.store.inmemory;

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

import io.github.cartly.engine.store.SnapshotMetadata;
import io.github.cartly.engine.store.SnapshotStore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Snapshot store keeping snapshot objects in memory without serialization.
 */
public class InMemorySnapshotStore extends SnapshotStore<Object> {
    private final ConcurrentMap<String, List<SnapshotRecord>> snapshotRecords = new ConcurrentHashMap<>();

    public InMemorySnapshotStore(int retainedSnapshots) {
        super(retainedSnapshots);
    }

    public InMemorySnapshotStore() {
        this(1);
    }

    @Override
    protected Object deserializeSnapshot(SnapshotRecord snapshotRecord) {
        return snapshotRecord.getPayload();
    }

    @Override
    protected SnapshotRecord serializeSnapshot(String entityId, long stateVersion, Object snapshot) {
        return new SnapshotRecord(SnapshotMetadata.of(entityId, Instant.now(), 1, stateVersion), snapshot);
    }

    @Override
    protected List<SnapshotRecord> retrieveSnapshotRecords(String entityId) {
        List<SnapshotRecord> records = snapshotRecords.get(entityId);
        if (records == null) {
            return new ArrayList<>();
        }
        synchronized (records) {
            return new ArrayList<>(records);
        }
    }

    public long getSnapshottedVersion(String entityId) {
        List<SnapshotRecord> records = retrieveSnapshotRecords(entityId);
        return records.isEmpty() ? 0 : records.get(0).getHeader().entityStateVersion();
    }

    public int getSnapshotCount(String entityId) {
        return retrieveSnapshotRecords(entityId).size();
    }

    @Override
    protected void storeSnapshotRecord(SnapshotRecord snapshotRecord) {
        List<SnapshotRecord> records = snapshotRecords.computeIfAbsent(snapshotRecord.getHeader().entityId(),
            (id) -> new ArrayList<>());
        synchronized (records) {
            insertByVersion(records, snapshotRecord);
        }
    }
}
