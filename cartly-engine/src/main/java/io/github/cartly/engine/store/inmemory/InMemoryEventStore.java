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

import io.github.cartly.engine.Event;
import io.github.cartly.engine.EventSourcedEntity;
import io.github.cartly.engine.store.EventLog;
import io.github.cartly.engine.store.EventStore;
import io.github.cartly.engine.store.EventStoreException;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.BiFunction;
import java.util.function.Consumer;

/**
 * Event store and log on heap, one list per entity. For tests and for running without a database.
 */
public class InMemoryEventStore implements EventStore, EventLog {

    private final ConcurrentMap<String, EntityLog> logs = new ConcurrentHashMap<>();

    public long lastVersionOf(String entityId) {
        return log(entityId).lastVersion();
    }

    @Override
    public long appendBatch(String entityId, long expectedVersion, List<? extends Event> events)
            throws EventStoreException {
        long next = expectedVersion + 1;
        for (Event event : events) {
            if (!entityId.equals(event.entityId())) {
                throw EventStoreException.multipleEntities(entityId, event);
            }
            if (event.entityStateVersion() != next) {
                throw EventStoreException.nonMonotonic(entityId, next, event);
            }
            next++;
        }
        return log(entityId).append(expectedVersion, events);
    }

    @Override
    public boolean confirmsEntityReflectsCurrentState(EventSourcedEntity entity) {
        return lastVersionOf(entity.getIdentity()) <= entity.getStateVersion();
    }

    @Override
    public StoredEvents<Event> readEvents(String entityId, long afterVersion) {
        return new ListedEvents(log(entityId).after(afterVersion));
    }

    private EntityLog log(String entityId) {
        return logs.computeIfAbsent(entityId, EntityLog::new);
    }

    private static final class EntityLog {
        private final String entityId;
        private final List<Event> events = new ArrayList<>();

        EntityLog(String entityId) {
            this.entityId = entityId;
        }

        synchronized long lastVersion() {
            return events.isEmpty() ? 0 : events.get(events.size() - 1).entityStateVersion();
        }

        synchronized long append(long expectedVersion, List<? extends Event> batch) throws EventStoreException {
            long last = lastVersion();
            if (last != expectedVersion) {
                throw EventStoreException.optimisticLock(entityId, last, expectedVersion);
            }
            events.addAll(batch);
            return expectedVersion + batch.size();
        }

        synchronized List<Event> after(long version) {
            List<Event> result = new ArrayList<>();
            for (Event event : events) {
                if (event.entityStateVersion() > version) {
                    result.add(event);
                }
            }
            return result;
        }
    }

    /**
     * Copy of the matching events taken when the read started.
     */
    private static final class ListedEvents implements StoredEvents<Event> {
        private final List<Event> events;
        private boolean stopped;

        ListedEvents(List<Event> events) {
            this.events = events;
        }

        @Override
        public void foreach(Consumer<? super Event> consumer) {
            for (int i = 0; i < events.size() && !stopped; i++) {
                consumer.accept(events.get(i));
            }
        }

        @Override
        public <R> R reduce(R initial, BiFunction<R, ? super Event, R> reducer) {
            R acc = initial;
            for (int i = 0; i < events.size() && !stopped; i++) {
                acc = reducer.apply(acc, events.get(i));
            }
            return acc;
        }

        @Override
        public void stop() {
            stopped = true;
        }

        @Override
        public void close() {
            // nothing held
        }
    }
}
