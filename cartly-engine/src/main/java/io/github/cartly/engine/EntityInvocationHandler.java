package io.github.cartly.engine;

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

import io.github.cartly.engine.store.EventLog;
import io.github.cartly.engine.store.EventStoreException;
import io.github.cartly.engine.store.SnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Keeps live entity instances and drives one invocation at a time on them.
 *
 * <h2 id="request-lifecycle">Request lifecycle</h2>
 * <ol>
 * <li>Look the instance up. A missing instance is created and recovered from the newest readable snapshot plus the
 * events after it. A cached instance behind the log catches up on the events it missed. Failing recovery throws
 * {@link EntityRecoveryException} and leaves no instance behind.</li>
 * <li>Run the action on the instance.</li>
 * <li>When the event store failed during the action, the call ends with that {@link EventStoreException} even if the
 * entity swallowed it. The instance is discarded.</li>
 * <li>When the action threw, the instance is discarded, so the next request recovers a fresh one.</li>
 * <li>Otherwise the host may ask for a snapshot, which is written on the snapshot executor.</li>
 * </ol>
 * Callers guarantee that at most one invocation per entity id runs at a time.
 *
 * @param <E> entity type
 */
public class EntityInvocationHandler<E extends EventSourcedEntity> {

    /**
     * What the handler needs from the runtime that owns it.
     */
    public interface EntityHost<E extends EventSourcedEntity> {

        /** Fresh instance with dependencies wired and no state. */
        E instantiate(String id);

        /** Called once an instance is discarded. */
        void dispose(E entity);

        boolean shouldStoreSnapshot(E entity, int eventsSinceSnapshot);

        /** Log consistent with the store the entities append to. */
        EventLog getEventLog();

        SnapshotStore<?> getSnapshotStore();

        Executor getSnapshotExecutor();

        default boolean isInLatestKnownState(EventSourcedEntity entity) {
            return getEventLog().confirmsEntityReflectsCurrentState(entity);
        }
    }

    @FunctionalInterface
    public interface ThrowingInvocation<E, R> {
        R invoke(E entity) throws Exception;
    }

    protected final Logger logger = LoggerFactory.getLogger(getClass());

    private final EntityHost<E> host;
    private final ConcurrentMap<String, E> live = new ConcurrentHashMap<>();

    public EntityInvocationHandler(EntityHost<E> host) {
        this.host = host;
    }

    public boolean isInMemory(String entityId) {
        return live.containsKey(entityId);
    }

    /**
     * Run an action on the up-to-date instance of an entity.
     *
     * @throws EntityRecoveryException when the instance could not be recovered
     * @throws EventStoreException when appending failed during the action, whatever the action did with it
     * @throws Exception thrown by the action
     */
    public <R> R invoke(String entityId, ThrowingInvocation<? super E, R> action) throws Exception {
        E entity = current(entityId);
        entity.getInvocationState().preInvocation();
        R result;
        try {
            result = action.invoke(entity);
        } catch (Exception e) {
            logger.info("Invocation of {} failed", entity, e);
            afterInvocation(entityId, entity, e);
            throw e;
        }
        afterInvocation(entityId, entity, null);
        return result;
    }

    private void afterInvocation(String entityId, E entity, Exception thrown) throws EventStoreException {
        EventSourcedEntity.InvocationState state = entity.getInvocationState();
        if (state.getState() == EventSourcedEntity.EntityInvocationState.EVENT_STORE_FAILED) {
            EventStoreException storeFailure = asStoreException(entityId, state.getThrowable());
            state.postInvocation();
            discard(entityId, entity);
            if (storeFailure != thrown) {
                if (thrown != null) {
                    storeFailure.addSuppressed(thrown);
                }
                throw storeFailure;
            }
            return;
        }
        if (thrown != null) {
            state.failed(thrown);
            state.postInvocation();
            discard(entityId, entity);
            return;
        }
        state.completed();
        state.postInvocation();
        if (host.shouldStoreSnapshot(entity, entity.getEventsSinceSnapshot())) {
            snapshot(entityId, entity);
        }
    }

    private static EventStoreException asStoreException(String entityId, Throwable failure) {
        return failure instanceof EventStoreException
                ? (EventStoreException) failure
                : EventStoreException.suppressed(entityId, failure);
    }

    private void snapshot(String entityId, E entity) {
        Object snapshot;
        try {
            snapshot = entity.createSnapshot();
        } catch (RuntimeException e) {
            logger.error("Creating snapshot of {} failed", entity, e);
            return;
        }
        if (snapshot == null) {
            return;
        }
        long version = entity.getStateVersion();
        SnapshotStore<?> store = host.getSnapshotStore();
        try {
            host.getSnapshotExecutor().execute(() -> store.store(entityId, version, snapshot));
            entity.snapshotStored();
        } catch (RejectedExecutionException e) {
            logger.warn("Snapshot executor rejected snapshot of {} at version {}", entityId, version, e);
        }
    }

    private void discard(String entityId, E entity) {
        live.remove(entityId, entity);
        host.dispose(entity);
    }

    private E current(String entityId) {
        E entity = live.computeIfAbsent(entityId, this::recoverNew);
        if (host.isInLatestKnownState(entity)) {
            return entity;
        }
        logger.info("{} is behind the log, catching up", entity);
        try {
            recover(entity);
        } catch (EntityRecoveryException e) {
            discard(entityId, entity);
            throw e;
        }
        return entity;
    }

    private E recoverNew(String entityId) {
        E entity = host.instantiate(entityId);
        if (entity == null) {
            throw new IllegalStateException("Runtime instantiated null for " + entityId);
        }
        try {
            recover(entity);
        } catch (EntityRecoveryException e) {
            host.dispose(entity);
            throw e;
        }
        return entity;
    }

    private void recover(E entity) {
        String entityId = entity.getIdentity();
        long started = System.currentTimeMillis();
        entity.getInvocationState().recovering();
        int replayed = 0;
        try {
            if (entity.getStateVersion() == 0) {
                restoreSnapshot(entity);
            }
            try (EventLog.StoredEvents<? extends Event> events =
                    host.getEventLog().readEvents(entityId, entity.getStateVersion())) {
                replayed = events.reduce(0, (count, event) -> {
                    try {
                        entity.applyEvent(event);
                    } catch (RuntimeException e) {
                        logger.error("{} cannot apply event {}", entity, event.entityStateVersion(), e);
                        throw e;
                    }
                    return count + 1;
                });
            }
        } catch (RuntimeException e) {
            throw new EntityRecoveryException(entityId, e);
        }
        entity.getInvocationState().initialized();
        logger.info("Recovered {} replaying {} events in {} ms", entity, replayed,
            System.currentTimeMillis() - started);
    }

    private void restoreSnapshot(E entity) {
        Optional<SnapshotStore.Snapshot> found = host.getSnapshotStore().readSnapshot(entity.getIdentity());
        if (!found.isPresent()) {
            return;
        }
        SnapshotStore.Snapshot snapshot = found.get();
        if (entity.restoreFromSnapshot(snapshot.getSnapshot())) {
            entity.updateStateVersion(snapshot.getEntityVersion());
            logger.debug("{} restored from snapshot", entity);
        } else {
            logger.warn("{} rejected snapshot at version {}, replaying entire log", entity.getIdentity(),
                snapshot.getEntityVersion());
        }
    }
}
