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
 * Snapshot store with text payloads. Payload versions come from the {@link Serialization}, so older snapshots stay
 * readable after the snapshot type changes.
 *
 * @param <S> snapshot type
 */
public abstract class SnapshotStoreWithSerialization<S> extends SnapshotStore<String> {
    protected final Serialization<S> serialization;

    protected SnapshotStoreWithSerialization(Serialization<S> serialization, int retainedSnapshots) {
        super(retainedSnapshots);
        this.serialization = Objects.requireNonNull(serialization, "serialization");
    }

    @Override
    protected Object deserializeSnapshot(SnapshotRecord snapshotRecord) {
        SnapshotMetadata header = snapshotRecord.getHeader();
        return serialization.deserialize(header.payloadVersion(), snapshotRecord.getPayload(), null);
    }

    @Override
    protected SnapshotRecord serializeSnapshot(String entityId, long stateVersion, Object snapshot) {
        S value = serialization.toSerializable(snapshot);
        if (value == null) {
            logger.error("{} produced a snapshot of unsupported type {}", entityId,
                snapshot == null ? null : snapshot.getClass().getName());
            return null;
        }
        SnapshotMetadata header = SnapshotMetadata.of(entityId, Instant.now(), serialization.payloadVersion(value),
            stateVersion);
        return new SnapshotRecord(header, serialization.serialize(value));
    }
}
