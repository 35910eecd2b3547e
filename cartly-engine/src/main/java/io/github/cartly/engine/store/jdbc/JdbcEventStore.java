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
import io.github.cartly.engine.store.EventStore;
import io.github.cartly.engine.store.EventStoreException;
import io.github.cartly.engine.store.Serialization;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Appends event batches to a {@link JdbcSchema} in one transaction.
 * <p>
 * The version table serves as the optimistic lock. The batch is accepted when the entity's version row still holds
 * the expected version, and the same transaction inserts the events and moves the row to the last event's version
 * with a conditional update. A writer whose update matches no row lost a race and gets
 * {@link EventStoreException.Fault#OPTIMISTIC_LOCK}.
 *
 * @param <E> base type of supported events
 */
public class JdbcEventStore<E> implements EventStore {

    private static final Logger logger = LoggerFactory.getLogger(JdbcEventStore.class);

    /**
     * Commits and rolls back on the connection itself, and restores auto-commit before the connection is closed.
     */
    public static final TxHandler LOCAL_HANDLER = new TxHandler() {
        @Override
        public void enroll(Connection connection) throws SQLException {
            connection.setAutoCommit(false);
        }

        @Override
        public void commit(Connection connection) throws SQLException {
            connection.commit();
        }

        @Override
        public void rollback(Connection connection) throws SQLException {
            connection.rollback();
        }

        @Override
        public void release(Connection connection) throws SQLException {
            connection.setAutoCommit(true);
        }
    };

    private final DataSource dataSource;
    private final JdbcSchema schema;
    private final Serialization<E> serialization;
    private final TxHandler txHandler;

    public JdbcEventStore(DataSource dataSource, JdbcSchema schema, Serialization<E> serialization) {
        this(dataSource, schema, serialization, LOCAL_HANDLER);
    }

    public JdbcEventStore(DataSource dataSource, JdbcSchema schema, Serialization<E> serialization, TxHandler handler) {
        this.dataSource = dataSource;
        this.schema = schema;
        this.serialization = serialization;
        this.txHandler = handler;
    }

    @Override
    public long appendBatch(String entityId, long expectedVersion, List<? extends Event> events)
            throws EventStoreException {
        List<Row> rows = toRows(entityId, expectedVersion, events);
        if (rows.isEmpty()) {
            return expectedVersion;
        }
        long lastVersion = expectedVersion + rows.size();
        try (Connection connection = dataSource.getConnection()) {
            txHandler.enroll(connection);
            try {
                write(connection, entityId, expectedVersion, lastVersion, rows);
                txHandler.commit(connection);
            } catch (SQLException | RuntimeException | EventStoreException e) {
                rollback(connection, entityId, e);
                throw e;
            } finally {
                release(connection, entityId);
            }
        } catch (SQLException e) {
            throw EventStoreException.storeFailed(entityId, e);
        }
        logger.debug("Appended versions {} to {} of {}", expectedVersion + 1, lastVersion, entityId);
        return lastVersion;
    }

    /**
     * Validate the batch and serialize every event before touching the database.
     */
    private List<Row> toRows(String entityId, long expectedVersion, List<? extends Event> events)
            throws EventStoreException {
        List<Row> rows = new ArrayList<>(events.size());
        long next = expectedVersion + 1;
        for (Event event : events) {
            if (!entityId.equals(event.entityId())) {
                throw EventStoreException.multipleEntities(entityId, event);
            }
            if (event.entityStateVersion() != next) {
                throw EventStoreException.nonMonotonic(entityId, next, event);
            }
            E serializable = serialization.toSerializable(event);
            if (serializable == null) {
                throw EventStoreException.unsupported(event);
            }
            rows.add(new Row(event, serialization.payloadVersion(serializable), serialization.serialize(serializable)));
            next++;
        }
        return rows;
    }

    private void write(Connection connection, String entityId, long expectedVersion, long lastVersion, List<Row> rows)
            throws SQLException, EventStoreException {
        lockVersion(connection, entityId, expectedVersion);
        try (PreparedStatement insert = schema.insertEvent(connection, entityId);
                PreparedStatement update = schema.updateEventVersion(connection, entityId, expectedVersion,
                    lastVersion)) {
            for (Row row : rows) {
                schema.prepareInsert(insert, row.event, row.payloadVersion, row.payload);
                insert.addBatch();
            }
            insert.executeBatch();
            if (update.executeUpdate() != 1) {
                throw EventStoreException.optimisticLock(entityId, expectedVersion);
            }
        }
    }

    /**
     * Check the version row against the expected version, creating the row for a new entity.
     */
    private void lockVersion(Connection connection, String entityId, long expectedVersion)
            throws SQLException, EventStoreException {
        try (PreparedStatement select = schema.selectEntityVersion(connection, entityId);
                ResultSet rs = select.executeQuery()) {
            if (rs.next()) {
                long current = schema.readEntityVersion(rs);
                if (current != expectedVersion) {
                    throw EventStoreException.optimisticLock(entityId, current, expectedVersion);
                }
                return;
            }
        }
        if (expectedVersion != 0) {
            throw EventStoreException.optimisticLock(entityId, 0, expectedVersion);
        }
        try (PreparedStatement create = schema.createEntityVersion(connection, entityId, 0)) {
            create.executeUpdate();
        }
    }

    private void rollback(Connection connection, String entityId, Exception cause) {
        try {
            txHandler.rollback(connection);
        } catch (SQLException e) {
            logger.warn("Rollback of append to {} failed", entityId, e);
            cause.addSuppressed(e);
        }
    }

    private void release(Connection connection, String entityId) {
        try {
            txHandler.release(connection);
        } catch (SQLException e) {
            logger.warn("Releasing connection after append to {} failed", entityId, e);
        }
    }

    private static final class Row {
        final Event event;
        final int payloadVersion;
        final String payload;

        Row(Event event, int payloadVersion, String payload) {
            this.event = event;
            this.payloadVersion = payloadVersion;
            this.payload = payload;
        }
    }

    /**
     * Transaction demarcation around an append.
     */
    public interface TxHandler {

        void enroll(Connection connection) throws SQLException;

        void commit(Connection connection) throws SQLException;

        void rollback(Connection connection) throws SQLException;

        /** Undo the effects of {@link #enroll(Connection)} once the transaction has ended. */
        void release(Connection connection) throws SQLException;
    }
}
