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
import io.github.cartly.engine.EventSourcedEntity;
import io.github.cartly.engine.store.EventLog;
import io.github.cartly.engine.store.Serialization;
import io.github.cartly.engine.store.UnrecognizedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.function.BiFunction;
import java.util.function.Consumer;

/**
 * Reads the events of a {@link JdbcSchema} and turns them back into objects with a {@link Serialization}.
 * <p>
 * A row the serialization declines is an event this build does not know, typically one written by a newer
 * release. A strict log fails the read with {@link IllegalArgumentException}. A lenient log logs the row and hands
 * out an {@link UnrecognizedEvent} in its place, which keeps the entity's version aligned with the log. A corrupt
 * row fails the read in both modes with the exception of the serialization.
 */
public class JdbcEventLog<E extends Event> implements EventLog {

    private static final Logger logger = LoggerFactory.getLogger(JdbcEventLog.class);

    private final DataSource ds;
    private final JdbcSchema schema;
    private final Serialization<E> serialization;
    private final boolean strict;

    public JdbcEventLog(DataSource ds, JdbcSchema schema, Serialization<E> serialization, boolean strict) {
        this.ds = ds;
        this.schema = schema;
        this.serialization = serialization;
        this.strict = strict;
    }

    public boolean isStrict() {
        return strict;
    }

    @Override
    public StoredEvents<Event> readEvents(String entityId, long afterVersion) {
        return new Cursor(entityId, afterVersion);
    }

    /**
     * Compares the entity with the version table. When the table cannot be read the entity is trusted, and a stale
     * entity is then caught by the optimistic lock on append.
     */
    @Override
    public boolean confirmsEntityReflectsCurrentState(EventSourcedEntity entity) {
        try (Connection connection = ds.getConnection();
                PreparedStatement query = schema.selectEntityVersion(connection, entity.getIdentity());
                ResultSet rs = query.executeQuery()) {
            return !rs.next() || schema.readEntityVersion(rs) <= entity.getStateVersion();
        } catch (SQLException e) {
            logger.error("Reading version of {} failed, assuming it is current", entity.getIdentity(), e);
            return true;
        }
    }

    private Event toEvent(String entityId, ResultSet rs) throws SQLException {
        String type = schema.readEventType(rs);
        int payloadVersion = schema.readEventPayloadVersion(rs);
        E event = serialization.deserialize(payloadVersion, schema.readEventPayload(rs), type);
        if (event != null) {
            return event;
        }
        long version = schema.readEventVersion(rs);
        if (strict) {
            throw new IllegalArgumentException("Event " + version + " of " + entityId + " with type " + type
                    + " and payload version " + payloadVersion + " cannot be read");
        }
        logger.error("Event {} of {} with type {} and payload version {} cannot be read, passing it as unrecognized",
            version, entityId, type, payloadVersion);
        return new UnrecognizedEvent(entityId, version, schema.readEventTimestamp(rs), type, payloadVersion);
    }

    /**
     * Streams rows of an open result set. The connection is held until {@link #close()}.
     */
    private class Cursor implements StoredEvents<Event> {

        private final String entityId;
        private final Connection connection;
        private final PreparedStatement statement;
        private final ResultSet rows;
        private boolean consumed;
        private boolean stopRequested;

        Cursor(String entityId, long afterVersion) {
            this.entityId = entityId;
            Connection c = null;
            PreparedStatement st = null;
            try {
                c = ds.getConnection();
                st = schema.selectEvents(c, entityId, afterVersion);
                this.rows = st.executeQuery();
            } catch (SQLException e) {
                release(st);
                release(c);
                throw new IllegalStateException("Cannot read events of " + entityId, e);
            }
            this.connection = c;
            this.statement = st;
        }

        @Override
        public void foreach(Consumer<? super Event> consumer) {
            reduce(null, (ignored, event) -> {
                consumer.accept(event);
                return null;
            });
        }

        @Override
        public <R> R reduce(R initial, BiFunction<R, ? super Event, R> reducer) {
            if (consumed) {
                throw new IllegalStateException("Events of " + entityId + " were already read");
            }
            consumed = true;
            R acc = initial;
            try {
                while (!stopRequested && rows.next()) {
                    acc = reducer.apply(acc, toEvent(entityId, rows));
                }
            } catch (SQLException e) {
                throw new IllegalStateException("Reading events of " + entityId + " failed", e);
            }
            return acc;
        }

        @Override
        public void stop() {
            stopRequested = true;
        }

        @Override
        public void close() {
            release(rows);
            release(statement);
            release(connection);
        }

        private void release(AutoCloseable resource) {
            if (resource == null) {
                return;
            }
            try {
                resource.close();
            } catch (Exception e) {
                logger.warn("Closing {} after reading events of {} failed", resource, entityId, e);
            }
        }
    }
}
