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

import io.github.cartly.engine.store.Serialization;
import io.github.cartly.engine.store.SnapshotMetadata;
import io.github.cartly.engine.store.SnapshotStoreWithSerialization;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * InMemoryStore, that also exercises serialization.
 */
public class InMemorySnapshotStoreWithSerialization<T> extends SnapshotStoreWithSerialization<T> {
    private final ConcurrentMap<String, List<SnapshotRecord>> snapshotRecords = new ConcurrentHashMap<>();

    public InMemorySnapshotStoreWithSerialization(Serialization<T> serialization, int retainedSnapshots) {
        super(serialization, retainedSnapshots);
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

    @Override
    protected void storeSnapshotRecord(SnapshotRecord snapshotRecord) {
        List<SnapshotRecord> records = snapshotRecords.computeIfAbsent(snapshotRecord.getHeader().entityId(),
            (id) -> new ArrayList<>());
        synchronized (records) {
            insertByVersion(records, snapshotRecord);
        }
    }

    public Optional<String> getSerializedSnapshot(String entityId) {
        List<SnapshotRecord> records = retrieveSnapshotRecords(entityId);
        return records.isEmpty() ? Optional.empty() : Optional.of(records.get(0).getPayload());
    }

    /**
     * Put raw payload as snapshot at its version, e. g. one written by different version of the system.
     */
    public void storeSnapshot(String entityId, long stateVersion, int payloadVersion, String payload) {
        storeSnapshotRecord(new SnapshotRecord(SnapshotMetadata.of(entityId, Instant.now(), payloadVersion,
            stateVersion), payload));
    }
}
