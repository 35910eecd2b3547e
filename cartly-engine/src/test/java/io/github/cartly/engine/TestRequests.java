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

import java.util.concurrent.Callable;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.is;

/**
 * Requests and events understood by {@link SyncTestEntity}.
 */
public class TestRequests {

    /** Records a probe event and answers with the entity's status before it. */
    public static class GetProbe implements Request<StatusProbe> {
    }

    /** Like {@link GetProbe}, but ignores a failing append. */
    public static class SwallowException implements Request<StatusProbe> {
    }

    public static class Crash implements Request<StatusProbe> {
    }

    /** Records a request event, calls the side effect, and compensates when it throws. */
    public static class DoSideEffect implements Request<StatusProbe> {
        private final Callable<Void> sideEffect;

        public DoSideEffect(Callable<Void> sideEffect) {
            this.sideEffect = sideEffect;
        }

        void fire() throws Exception {
            sideEffect.call();
        }
    }

    /**
     * What the entity looked like when it handled a request.
     */
    public static final class StatusProbe {
        public final long entityVersion;
        public final int eventsSinceSnapshot;
        public final boolean offeredSnapshot;
        public final boolean acceptedSnapshot;
        public final boolean sideEffectRequested;
        public final boolean compensated;

        StatusProbe(SyncTestEntity entity) {
            entityVersion = entity.getStateVersion();
            eventsSinceSnapshot = entity.eventsSinceSnapshot();
            offeredSnapshot = entity.snapshotOffered;
            acceptedSnapshot = entity.snapshotOffered && entity.acceptsSnapshot;
            sideEffectRequested = entity.sideEffectRequested;
            compensated = entity.compensated;
        }

        public StatusProbe assertInitialVersion(boolean initial) {
            assertThat("entity version", entityVersion, initial ? is(0L) : greaterThan(0L));
            return this;
        }

        public StatusProbe assertVersion(long expected) {
            return check("entity version", expected, entityVersion);
        }

        public StatusProbe assertOfferedSnapshot(boolean expected) {
            return check("snapshot offered", expected, offeredSnapshot);
        }

        public StatusProbe assertAcceptedSnapshot(boolean expected) {
            return check("snapshot accepted", expected, acceptedSnapshot);
        }

        public StatusProbe assertEventsPastSnapshot(int expected) {
            return check("events since snapshot", expected, eventsSinceSnapshot);
        }

        public StatusProbe assertTransitionedToSideEffect(boolean expected) {
            return check("side effect requested", expected, sideEffectRequested);
        }

        public StatusProbe assertCompensatingEvent(boolean expected) {
            return check("side effect compensated", expected, compensated);
        }

        private <T> StatusProbe check(String what, T expected, T actual) {
            assertThat(what, actual, is(expected));
            return this;
        }
    }

    public static class SideEffectRequestedEvent extends EventHeader {
        SideEffectRequestedEvent(EventSourcedEntity source) {
            super(source);
        }
    }

    public static class SideEffectCompensated extends EventHeader {
        SideEffectCompensated(EventSourcedEntity source) {
            super(source);
        }
    }

    /** Event written straight to the store, as another node would. */
    public static class DummyRecoveredEvent extends EventHeader {
        public DummyRecoveredEvent(String entityId, long entityVersion) {
            super(entityId, entityVersion);
        }
    }

    public static class ProbeExecutedEvent extends EventHeader {
        ProbeExecutedEvent(EventSourcedEntity source) {
            super(source);
        }
    }
}
