package io.github.cartly.engine.supervision;

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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Tracks crashes of entities and decides about their restarts.
 * <p>Every failure of an entity counts as a restart. While the strategy allows it, the entity is restarting and
 * the pause it should take before its next invocation is recorded. Once restarts are exhausted, the entity is stopped
 * until {@link #restart(String)} is called. Successful invocation resets the count.</p>
 * <p>Calls for a single entity are expected to be serialized by the dispatcher, distinct entities may be supervised
 * concurrently.</p>
 */
public class EntitySupervisor {
    private static final Logger logger = LoggerFactory.getLogger(EntitySupervisor.class);

    public enum Phase {
        RUNNING, RESTARTING, STOPPED
    }

    private final BackoffRestartStrategy strategy;
    private final String entityName;
    private final ConcurrentMap<String, State> states = new ConcurrentHashMap<>();

    public EntitySupervisor(String entityName, BackoffRestartStrategy strategy) {
        this.entityName = entityName;
        this.strategy = strategy;
    }

    private static class State {
        private Phase phase = Phase.RESTARTING;
        private int restarts;
        private long pendingBackoff;
        private Throwable lastFailure;
    }

    public Phase getPhase(String entityId) {
        State state = states.get(entityId);
        return state == null ? Phase.RUNNING : state.phase;
    }

    public int getRestarts(String entityId) {
        State state = states.get(entityId);
        return state == null ? 0 : state.restarts;
    }

    public boolean isStopped(String entityId) {
        return getPhase(entityId) == Phase.STOPPED;
    }

    /**
     * Exception to fail requests of stopped entity with.
     * @param entityId the entity
     * @return new exception carrying the failure that stopped the entity
     */
    public EntityStoppedException stoppedException(String entityId) {
        State state = states.get(entityId);
        return new EntityStoppedException(entityId, state == null ? null : state.lastFailure);
    }

    /**
     * Record a crash of the entity.
     * @param entityId the entity
     * @param failure cause of the crash
     * @return the phase the entity ends in, either RESTARTING or STOPPED
     */
    public Phase failed(String entityId, Throwable failure) {
        State state = states.computeIfAbsent(entityId, (id) -> new State());
        synchronized (state) {
            state.lastFailure = failure;
            if (state.phase == Phase.STOPPED) {
                return Phase.STOPPED;
            }
            state.restarts++;
            if (strategy.canRestart(state.restarts)) {
                Duration backoff = strategy.backoff(state.restarts);
                state.pendingBackoff = backoff.toMillis();
                state.phase = Phase.RESTARTING;
                logger.warn("{} {} crashed, restart {} in {} ms", entityName, entityId, state.restarts,
                    state.pendingBackoff, failure);
            } else {
                state.pendingBackoff = 0;
                state.phase = Phase.STOPPED;
                logger.error("{} {} crashed and is stopped after {} restarts", entityName, entityId,
                    state.restarts - 1, failure);
            }
            return state.phase;
        }
    }

    /**
     * Obtain the pause the entity should take before processing next request, and clear it.
     * @param entityId the entity
     * @return pause in milliseconds, 0 if there is none
     */
    public long takeBackoff(String entityId) {
        State state = states.get(entityId);
        if (state == null) {
            return 0;
        }
        synchronized (state) {
            long backoff = state.pendingBackoff;
            state.pendingBackoff = 0;
            return backoff;
        }
    }

    /**
     * Record successful invocation, resetting the restart count.
     * @param entityId the entity
     */
    public void invocationSucceeded(String entityId) {
        State state = states.get(entityId);
        if (state != null) {
            synchronized (state) {
                if (state.phase == Phase.RESTARTING) {
                    logger.info("{} {} is running again after {} restarts", entityName, entityId, state.restarts);
                    states.remove(entityId, state);
                }
            }
        }
    }

    /**
     * Let a stopped entity process requests again.
     * @param entityId the entity
     * @return true if entity was stopped
     */
    public boolean restart(String entityId) {
        State state = states.remove(entityId);
        if (state != null && state.phase == Phase.STOPPED) {
            logger.info("{} {} restarted manually", entityName, entityId);
            return true;
        }
        return false;
    }
}
