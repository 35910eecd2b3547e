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

import io.github.cartly.engine.store.Serialization;
import io.github.cartly.engine.store.SnapshotMetadata;
import io.github.cartly.engine.store.SnapshotStoreWithSerialization;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Snapshot store keeping serialized snapshots in a table. Every snapshot is inserted as a new row, rows beyond
 * retained count are deleted afterwards.
 *
 * @param <S> type of supported snapshots
 */
public class JdbcSnapshotStore<S> extends SnapshotStoreWithSerialization<S> {
    private final DataSource ds;
    private final JdbcSchema schema;

    public JdbcSnapshotStore(DataSource ds, JdbcSchema schema, Serialization<S> serialization,
            int retainedSnapshots) {
        super(serialization, retainedSnapshots);
        this.ds = ds;
        this.schema = schema;
    }

    @Override
    protected List<SnapshotRecord> retrieveSnapshotRecords(String entityId) {
        List<SnapshotRecord> result = new ArrayList<>();
        try (Connection connection = ds.getConnection();
                PreparedStatement st = schema.selectSnapshots(connection, entityId);
                ResultSet rs = st.executeQuery()) {
            while (rs.next()) {
                SnapshotMetadata header = schema.readSnapshotMetadata(rs);
                result.add(new SnapshotRecord(header, schema.readSnapshotPayload(rs)));
            }
            return result;
        } catch (SQLException se) {
            throw new IllegalStateException("Cannot read snapshots of " + entityId, se);
        }
    }

    @Override
    protected void storeSnapshotRecord(SnapshotRecord snapshotRecord) {
        SnapshotMetadata sm = snapshotRecord.getHeader();
        String entityId = sm.entityId();
        try (Connection connection = ds.getConnection()) {
            try (PreparedStatement store = schema.insertSnapshot(connection, entityId, sm.entityStateVersion(),
                sm.payloadVersion(), snapshotRecord.getPayload())) {
                int result = store.executeUpdate();
                if (result != 1) {
                    logger.error("Snapshot insert did not create a row for entity {}", entityId);
                }
            }
            discardOldSnapshots(connection, entityId);
        } catch (SQLException se) {
            throw new IllegalStateException("Failed to store snapshot for " + entityId, se);
        }
    }

    private void discardOldSnapshots(Connection connection, String entityId) throws SQLException {
        long oldestRetained = -1;
        try (PreparedStatement st = schema.selectSnapshotVersions(connection, entityId);
                ResultSet rs = st.executeQuery()) {
            int count = 0;
            while (rs.next()) {
                count++;
                if (count == getRetainedSnapshots()) {
                    oldestRetained = rs.getLong(1);
                } else if (count > getRetainedSnapshots()) {
                    break;
                }
            }
            if (count <= getRetainedSnapshots()) {
                return;
            }
        }
        try (PreparedStatement delete = schema.deleteSnapshotsUpTo(connection, entityId, oldestRetained - 1)) {
            int deleted = delete.executeUpdate();
            logger.debug("Discarded {} snapshots of {} older than {}", deleted, entityId, oldestRetained);
        }
    }
}
