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
import io.github.cartly.engine.store.SnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * Base of runtimes. Subclasses supply the stores and the entity factory, and decide how requests are scheduled. The
 * shared {@link EntityInvocationHandler} recovers, invokes and snapshots the entities.
 *
 * @param <E> entity type
 * @see EntityInvocationHandler request lifecycle
 */
public abstract class EventSourcingRuntimeBase<E extends EventSourcedEntity> {

    protected final Logger logger = LoggerFactory.getLogger(getClass());

    protected final EntityInvocationHandler<E> invocationHandler = new EntityInvocationHandler<>(new Host());

    /**
     * Entity object for the id, wired with its event store but without state. The runtime recovers it.
     */
    protected abstract E instantiate(String entityId);

    /**
     * Release what the instance holds. The runtime no longer uses it.
     */
    protected abstract void dispose(E entity);

    protected abstract SnapshotStore<?> getSnapshotStore();

    /**
     * Log the entities recover from. It must see every event the entities' store accepted.
     */
    protected abstract EventLog getEventLog();

    protected Executor getSnapshotExecutor() {
        return ForkJoinPool.commonPool();
    }

    /**
     * Pass a request to an entity. Requests for one entity id run one at a time against the single live instance.
     *
     * @return the response. Completing it from outside throws {@link UnsupportedOperationException}.
     */
    public abstract <R extends Request<RS>, RS> CompletableFuture<RS> execute(String entityId, R request);

    /**
     * Asked after every successful invocation.
     */
    protected abstract boolean shouldStoreSnapshot(E entity, int eventsSinceSnapshot);

    protected boolean isInLatestKnownState(EventSourcedEntity entity) {
        return getEventLog().confirmsEntityReflectsCurrentState(entity);
    }

    public boolean isInMemory(String entityId) {
        return invocationHandler.isInMemory(entityId);
    }

    private final class Host implements EntityInvocationHandler.EntityHost<E> {

        @Override
        public E instantiate(String id) {
            return EventSourcingRuntimeBase.this.instantiate(id);
        }

        @Override
        public void dispose(E entity) {
            EventSourcingRuntimeBase.this.dispose(entity);
        }

        @Override
        public boolean shouldStoreSnapshot(E entity, int eventsSinceSnapshot) {
            return EventSourcingRuntimeBase.this.shouldStoreSnapshot(entity, eventsSinceSnapshot);
        }

        @Override
        public EventLog getEventLog() {
            return EventSourcingRuntimeBase.this.getEventLog();
        }

        @Override
        public SnapshotStore<?> getSnapshotStore() {
            return EventSourcingRuntimeBase.this.getSnapshotStore();
        }

        @Override
        public Executor getSnapshotExecutor() {
            return EventSourcingRuntimeBase.this.getSnapshotExecutor();
        }

        @Override
        public boolean isInLatestKnownState(EventSourcedEntity entity) {
            return EventSourcingRuntimeBase.this.isInLatestKnownState(entity);
        }
    }
}
