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

import io.github.cartly.engine.store.EventStoreException;
import io.github.cartly.engine.store.EventLog;
import io.github.cartly.engine.store.SnapshotStore;
import io.github.cartly.engine.store.inmemory.InMemorySnapshotStore;
import io.github.cartly.engine.supervision.BackoffRestartStrategy;
import io.github.cartly.engine.supervision.EntityStoppedException;
import io.github.cartly.engine.supervision.EntitySupervisor;
import org.junit.AfterClass;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TestName;

import java.time.Duration;
import java.util.Collections;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class SyncRuntimeTest {

    private static final ExecutorService testExecutorService = Executors.newFixedThreadPool(3);
    private static final ScheduledExecutorService testScheduler = Executors.newSingleThreadScheduledExecutor();

    @Rule
    public TestName testName = new TestName();

    private MockEventStore eventStore;
    private InMemorySnapshotStore snapshotStore;
    private TestRuntime runtime;
    private final AtomicBoolean sideEffectFired = new AtomicBoolean();

    @Before
    public void setUp() {
        eventStore = new MockEventStore();
        snapshotStore = new InMemorySnapshotStore();
        runtime = new TestRuntime(BackoffRestartStrategy.UNLIMITED);
    }

    @AfterClass
    public static void shutdown() {
        testExecutorService.shutdown();
        testScheduler.shutdown();
    }

    class TestRuntime extends SyncEventSourcingRuntime<SyncTestEntity> {
        final Map<String, SyncTestEntity> disposed = new ConcurrentHashMap<>();
        final Map<String, AtomicInteger> instantiations = new ConcurrentHashMap<>();
        private final int maxRestarts;

        TestRuntime(int maxRestarts) {
            this.maxRestarts = maxRestarts;
        }

        @Override
        protected ExecutorService getExecutorService() {
            return testExecutorService;
        }

        @Override
        protected ScheduledExecutorService getScheduler() {
            return testScheduler;
        }

        @Override
        protected String getEntityName() {
            return "SyncEntity";
        }

        @Override
        protected SyncTestEntity instantiate(String entityId) {
            instantiations.computeIfAbsent(entityId, (id) -> new AtomicInteger()).incrementAndGet();
            return new SyncTestEntity(eventStore, entityId, shouldEntityAcceptSnapshot(entityId));
        }

        @Override
        protected void dispose(SyncTestEntity entity) {
            disposed.put(entity.getIdentity(), entity);
        }

        @Override
        protected SnapshotStore<?> getSnapshotStore() {
            return snapshotStore;
        }

        @Override
        protected EventLog getEventLog() {
            return eventStore;
        }

        @Override
        protected Executor getSnapshotExecutor() {
            return Runnable::run;
        }

        @Override
        protected BackoffRestartStrategy getRestartStrategy() {
            return new BackoffRestartStrategy(Duration.ofMillis(10), Duration.ofMillis(50), 0, maxRestarts);
        }

        @Override
        protected boolean shouldStoreSnapshot(SyncTestEntity entity, int eventsSinceSnapshot) {
            return "entity_snapshot_is_stored_when_requested".equals(entity.getIdentity());
        }

        int instantiations(String id) {
            AtomicInteger count = instantiations.get(id);
            return count == null ? 0 : count.get();
        }
    }

    private static boolean shouldEntityAcceptSnapshot(String id) {
        return !"journal_is_replayed_when_snapshot_is_ignored".equals(id);
    }

    private String id() {
        return testName.getMethodName();
    }

    private <R extends Request<RS>, RS> RS sync(String id, R request) {
        try {
            return runtime.execute(id, request).get(1, TimeUnit.SECONDS);
        } catch (Exception e) {
            throw new AssertionError("Request should have completed under 1 second", e);
        }
    }

    private Throwable failure(String id, Request<?> request) {
        CompletableFuture<?> result = runtime.execute(id, request);
        try {
            result.get(1, TimeUnit.SECONDS);
            fail("Request should have failed");
        } catch (ExecutionException e) {
            assertTrue(result.isCompletedExceptionally());
            return e.getCause();
        } catch (Exception e) {
            throw new AssertionError("Request should have completed under 1 second", e);
        }
        return null;
    }

    private TestRequests.StatusProbe probe(String id) {
        return sync(id, new TestRequests.GetProbe());
    }

    private void appendEvents(String id, int count) throws EventStoreException {
        long version = eventStore.lastVersionOf(id);
        for (int i = 0; i < count; i++) {
            eventStore.appendBatch(id, version, Collections.singletonList(
                new TestRequests.DummyRecoveredEvent(id, ++version)));
        }
    }

    private Void successfulSideEffect() {
        sideEffectFired.set(true);
        return null;
    }

    private Void failedSideEffect() throws Exception {
        sideEffectFired.set(true);
        throw new Exception("The side effect failed");
    }

    @Test
    public void successful_call_will_give_results() {
        probe(id()).assertOfferedSnapshot(false)
                .assertAcceptedSnapshot(false)
                .assertEventsPastSnapshot(0)
                .assertInitialVersion(true);
    }

    @Test
    public void snapshot_is_restored_before_execution() throws EventStoreException {
        appendEvents(id(), 10);
        snapshotStore.store(id(), 10, "snapshot");
        probe(id()).assertOfferedSnapshot(true)
                .assertAcceptedSnapshot(true)
                .assertVersion(10)
                .assertEventsPastSnapshot(0);
    }

    @Test
    public void entity_is_instantiated_once() {
        probe(id()).assertInitialVersion(true);
        probe(id()).assertVersion(1);
        assertEquals(1, runtime.instantiations(id()));
        assertTrue(runtime.isInMemory(id()));
    }

    @Test
    public void entity_catches_up_when_not_in_last_state() throws EventStoreException {
        probe(id()).assertInitialVersion(true);
        appendEvents(id(), 1);
        probe(id()).assertVersion(2);
        assertEquals("Stale instance should be caught up rather than replaced", 1, runtime.instantiations(id()));
    }

    @Test
    public void outstanding_events_are_replayed_before_execution() throws EventStoreException {
        appendEvents(id(), 3);
        probe(id()).assertOfferedSnapshot(false)
                .assertVersion(3)
                .assertEventsPastSnapshot(3);
    }

    @Test
    public void events_past_snapshot_are_replayed_before_execution() throws EventStoreException {
        appendEvents(id(), 11);
        snapshotStore.store(id(), 10, "snapshot");
        probe(id()).assertOfferedSnapshot(true)
                .assertAcceptedSnapshot(true)
                .assertVersion(11)
                .assertEventsPastSnapshot(1);
    }

    @Test
    public void journal_is_replayed_when_snapshot_is_ignored() throws EventStoreException {
        appendEvents(id(), 3);
        snapshotStore.store(id(), 3, "snapshot");
        probe(id()).assertOfferedSnapshot(true)
                .assertAcceptedSnapshot(false)
                .assertVersion(3)
                .assertEventsPastSnapshot(3);
    }

    @Test
    public void journal_is_not_replayed_when_snapshot_is_accepted() throws EventStoreException {
        appendEvents(id(), 3);
        snapshotStore.store(id(), 3, "snapshot");
        probe(id()).assertOfferedSnapshot(true)
                .assertAcceptedSnapshot(true)
                .assertVersion(3)
                .assertEventsPastSnapshot(0);
    }

    @Test
    public void event_store_exception_will_not_run_side_effects() {
        EventStoreException ex = EventStoreException.optimisticLock(id(), 1);
        eventStore.throwExceptionOnce(ex);
        Throwable failure = failure(id(), new TestRequests.DoSideEffect(this::successfulSideEffect));
        assertSame(ex, failure);
        assertFalse("Side effect should not be invoked on event store exception", sideEffectFired.get());
    }

    @Test
    public void compensating_transaction_is_persisted_when_side_effect_fails() {
        TestRequests.StatusProbe result = sync(id(), new TestRequests.DoSideEffect(this::failedSideEffect));
        assertTrue("Side effect should have fired", sideEffectFired.get());
        result.assertTransitionedToSideEffect(true).assertCompensatingEvent(true).assertVersion(2);
    }

    @Test
    public void entity_is_disposed_after_persistence_error() {
        eventStore.throwExceptionOnce(EventStoreException.optimisticLock(id(), 1));
        failure(id(), new TestRequests.DoSideEffect(this::successfulSideEffect));
        assertTrue("Entity should have been disposed", runtime.disposed.containsKey(id()));
        assertFalse(runtime.isInMemory(id()));
    }

    @Test
    public void swallowed_persistence_error_still_fails_the_request() {
        EventStoreException ex = EventStoreException.optimisticLock(id(), 1);
        eventStore.throwExceptionOnce(ex);
        assertSame(ex, failure(id(), new TestRequests.SwallowException()));
        probe(id()).assertInitialVersion(true);
        assertEquals(2, runtime.instantiations(id()));
    }

    @Test
    public void entity_snapshot_is_stored_when_requested() {
        TestRequests.StatusProbe result = probe(id());
        // the probe persisted an event after it was created
        assertEquals(result.entityVersion + 1, snapshotStore.getSnapshottedVersion(id()));
        result = probe(id());
        assertEquals("Event counter should be reset after snapshot", 0, result.eventsSinceSnapshot);
    }

    @Test
    public void crashed_entity_is_restarted_after_backoff() {
        probe(id());
        assertThat(failure(id(), new TestRequests.Crash()), instanceOf(IllegalStateException.class));
        assertTrue(runtime.disposed.containsKey(id()));
        assertEquals(EntitySupervisor.Phase.RESTARTING, runtime.getSupervisionPhase(id()));

        probe(id()).assertVersion(1);
        assertEquals(2, runtime.instantiations(id()));
        assertEquals(EntitySupervisor.Phase.RUNNING, runtime.getSupervisionPhase(id()));
    }

    @Test
    public void recovery_is_retried_until_it_succeeds() throws EventStoreException {
        appendEvents(id(), 2);
        eventStore.failReads(2);
        probe(id()).assertVersion(2);
        assertEquals(3, runtime.instantiations(id()));
        assertEquals(EntitySupervisor.Phase.RUNNING, runtime.getSupervisionPhase(id()));
    }

    @Test
    public void entity_is_stopped_when_restarts_are_exhausted() {
        runtime = new TestRuntime(1);
        eventStore.failReads(5);
        Throwable failure = failure(id(), new TestRequests.GetProbe());
        assertThat(failure, instanceOf(EntityStoppedException.class));
        assertThat(failure.getCause(), instanceOf(EntityRecoveryException.class));
        assertEquals(EntitySupervisor.Phase.STOPPED, runtime.getSupervisionPhase(id()));

        assertThat(failure(id(), new TestRequests.GetProbe()), instanceOf(EntityStoppedException.class));
        assertEquals("Stopped entity should not be recovered", 2, runtime.instantiations(id()));

        eventStore.failReads(0);
        assertTrue(runtime.restart(id()));
        probe(id()).assertInitialVersion(true);
        assertEquals(EntitySupervisor.Phase.RUNNING, runtime.getSupervisionPhase(id()));
    }
}
