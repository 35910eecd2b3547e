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

import io.github.cartly.engine.store.EventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Base of all entities driven by a {@linkplain EventSourcingRuntimeBase runtime}. The runtime creates at most one
 * instance per identity, recovers it from snapshots and the event log, and then passes it one {@link Request} at a
 * time.
 * <p>
 * State lives in subclass fields and changes only in {@link #updateState(Event)}, or when a snapshot is restored.
 * Handling a request decides which events happen and writes them to an {@link EventStore}. How requests reach the
 * entity is up to subclasses.
 *
 * @see SyncEntity
 */
public abstract class EventSourcedEntity {

    private final Logger logger = LoggerFactory.getLogger(getClass());
    private final String identity;
    private final InvocationState invocationState = new InvocationState();

    /** Version of the last applied event. */
    private long stateVersion;
    /** Version handed to the last event the entity produced in the current invocation. */
    private long issuedVersion;
    private int eventsSinceSnapshot;

    protected EventSourcedEntity(String identity) {
        this.identity = Objects.requireNonNull(identity, "identity");
    }

    public final String getIdentity() {
        return identity;
    }

    /**
     * Number of the last event reflected in the state. Starts at 0 and grows by one with every applied event.
     */
    public final long getStateVersion() {
        return stateVersion;
    }

    final void updateStateVersion(long snapshotVersion) {
        stateVersion = snapshotVersion;
        issuedVersion = snapshotVersion;
        eventsSinceSnapshot = 0;
    }

    final void snapshotStored() {
        eventsSinceSnapshot = 0;
    }

    /**
     * Apply events the store has accepted and record them as the outcome of the current invocation.
     */
    protected final void eventsPersisted(Collection<? extends Event> events) {
        for (Event event : events) {
            applyEvent(event);
        }
        invocationState.eventsPersisted(events);
    }

    /**
     * Mark the current invocation as failed by the event store. The runtime then reports the store failure whatever
     * the entity returns, and discards this instance.
     */
    protected final void handlePersistenceFailure(Throwable eventStoreError) {
        invocationState.eventStoreFailed(eventStoreError);
    }

    void applyEvent(Event event) {
        updateState(event);
        // a gap in the log still moves the version forward
        stateVersion = Math.max(event.entityStateVersion(), stateVersion + 1);
        issuedVersion = stateVersion;
        eventsSinceSnapshot++;
    }

    /**
     * Fold a persisted event into the state. Runs on replay as well as after each successful append, so it must
     * accept any event of the log without throwing. An entity whose log cannot be applied can never be recovered.
     */
    protected abstract void updateState(Event event);

    /**
     * Snapshot of the current state, or {@code null} when the entity does not snapshot. The snapshot store may
     * serialize it on another thread, so return an immutable value.
     */
    protected Object createSnapshot() {
        return null;
    }

    /**
     * Replace the state with a stored snapshot. Snapshots written by older versions of the entity may arrive here, so
     * check the type. When this returns false the runtime replays the entire log instead.
     *
     * @return whether the snapshot was applied
     */
    protected boolean restoreFromSnapshot(Object snapshot) {
        return false;
    }

    protected final int getEventsSinceSnapshot() {
        return eventsSinceSnapshot;
    }

    protected final InvocationState getInvocationState() {
        return invocationState;
    }

    /**
     * Version for the next event this entity produces within the current invocation.
     */
    protected final long nextEventVersion() {
        return ++issuedVersion;
    }

    public enum EntityInvocationState {
        RECOVERING, READY, PROCESSING, SUCCESSFUL, EVENT_STORE_FAILED, FAILED
    }

    /**
     * Where the entity is in the current invocation, and what the invocation produced so far.
     */
    public final class InvocationState {

        private EntityInvocationState state = EntityInvocationState.RECOVERING;
        private long initialStateVersion;
        private final List<Event> committed = new ArrayList<>();
        private Throwable failure;

        private InvocationState() {
        }

        public EntityInvocationState getState() {
            return state;
        }

        /** State version when the current invocation started. */
        public long getInitialStateVersion() {
            return initialStateVersion;
        }

        public Throwable getThrowable() {
            return failure;
        }

        void recovering() {
            state = EntityInvocationState.RECOVERING;
        }

        void initialized() {
            state = EntityInvocationState.READY;
        }

        void preInvocation() {
            if (state != EntityInvocationState.READY) {
                logger.error("Entity {} entered an invocation in state {}, concurrent access?", identity, state);
            }
            initialStateVersion = stateVersion;
            state = EntityInvocationState.PROCESSING;
        }

        void eventsPersisted(Collection<? extends Event> events) {
            committed.addAll(events);
        }

        void eventStoreFailed(Throwable t) {
            end(EntityInvocationState.EVENT_STORE_FAILED, t);
        }

        void completed() {
            end(EntityInvocationState.SUCCESSFUL, null);
        }

        void failed(Throwable t) {
            end(EntityInvocationState.FAILED, t);
        }

        private void end(EntityInvocationState outcome, Throwable t) {
            state = outcome;
            failure = t;
        }

        void postInvocation() {
            logger.debug("Entity {} ended invocation {} at version {} with events {}", identity, state, stateVersion,
                committed);
            committed.clear();
            failure = null;
            state = EntityInvocationState.READY;
        }

        @Override
        public String toString() {
            return state + " since version " + initialStateVersion + ", committed " + committed.size() + " events"
                    + (failure == null ? "" : ", failure " + failure);
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + identity + "@" + stateVersion + "]";
    }
}
