package io.github.cartly.engine.dispatch;

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

import io.github.cartly.engine.EntityRecoveryException;
import io.github.cartly.engine.EventSourcedEntity;
import io.github.cartly.engine.EventSourcingRuntimeBase;
import io.github.cartly.engine.Request;
import io.github.cartly.engine.supervision.BackoffRestartStrategy;
import io.github.cartly.engine.supervision.EntityStoppedException;
import io.github.cartly.engine.supervision.EntitySupervisor;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.BiConsumer;

/**
 * Runtime that queues requests per entity on a {@link Dispatcher} and supervises the entities.
 *
 * <h2>Supervision</h2>
 * An invocation that throws crashes the entity. The instance is discarded, the request fails with the exception, and
 * the entity's mailbox pauses for the backoff of {@link #getRestartStrategy()}. A request whose entity could not be
 * recovered never reached it, so it stays first in the mailbox and is retried after the backoff. Once the strategy's
 * restarts are used up the entity is stopped and every request fails with {@link EntityStoppedException} until
 * {@link #restart(String)}.
 */
public abstract class DispatchingEventSourcingRuntime<E extends EventSourcedEntity> extends EventSourcingRuntimeBase<E> {

    public static final long RETRY_NEVER = -1;
    public static final long RETRY_NOW = 0;

    private volatile Wiring wiring;

    /**
     * Threads that run invocations.
     */
    protected abstract ExecutorService getExecutorService();

    /**
     * Threads for delayed requests, timeouts and backoff. Must not be the invocation pool, or timeouts stop firing
     * when that pool is saturated.
     */
    protected abstract ScheduledExecutorService getScheduler();

    /**
     * Short name of the entity type, used in log categories and messages.
     */
    protected abstract String getEntityName();

    protected abstract <RS, R extends Request<RS>> RS invokeEntity(E entity, R request) throws Exception;

    /**
     * Unlimited restarts, backing off from 200 ms up to 5 s with 10 % jitter.
     */
    protected BackoffRestartStrategy getRestartStrategy() {
        return new BackoffRestartStrategy(Duration.ofMillis(200), Duration.ofSeconds(5), 0.1,
                BackoffRestartStrategy.UNLIMITED);
    }

    /**
     * Retry only requests that failed in recovery, they did not reach the entity.
     *
     * @see DispatcherConfiguration#retryDelay(String, Request, Throwable, int)
     */
    protected long retryDelay(String id, Request<?> request, Throwable error, int attempts) {
        return error instanceof EntityRecoveryException ? RETRY_NOW : RETRY_NEVER;
    }

    @Override
    public <R extends Request<RS>, RS> CompletableFuture<RS> execute(String id, R request) {
        return getDispatcher().execute(id, request);
    }

    /**
     * Like {@link #execute(String, Request)}, but the response is cancelled when the request has not started within
     * the timeout. A running invocation is not interrupted.
     */
    public <R extends Request<RS>, RS> CompletableFuture<RS> executeWithTimeout(String id, R request, long timeout,
            TimeUnit unit) {
        return getDispatcher().executeWithTimeout(id, request, timeout, unit);
    }

    /**
     * Like {@link #execute(String, Request)}, with the request entering the mailbox after the delay.
     */
    public <R extends Request<RS>, RS> CompletableFuture<RS> executeLater(String id, R request, long delay,
            TimeUnit unit) {
        return getDispatcher().executeLater(id, request, delay, unit);
    }

    /**
     * Resume a stopped entity with a fresh restart budget.
     *
     * @return false when the entity was not stopped
     */
    public boolean restart(String id) {
        return getSupervisor().restart(id);
    }

    public EntitySupervisor.Phase getSupervisionPhase(String id) {
        return getSupervisor().getPhase(id);
    }

    protected Dispatcher getDispatcher() {
        return wiring().dispatcher;
    }

    protected EntitySupervisor getSupervisor() {
        return wiring().supervisor;
    }

    private Wiring wiring() {
        Wiring w = wiring;
        if (w == null) {
            synchronized (this) {
                w = wiring;
                if (w == null) {
                    w = new Wiring(new EntitySupervisor(getEntityName(), getRestartStrategy()));
                    wiring = w;
                }
            }
        }
        return w;
    }

    /**
     * Supervisor and dispatcher, created together on first use because subclasses provide their dependencies.
     */
    private final class Wiring implements DispatcherConfiguration {
        private final EntitySupervisor supervisor;
        private final Dispatcher dispatcher;

        Wiring(EntitySupervisor supervisor) {
            this.supervisor = supervisor;
            this.dispatcher = new Dispatcher(this);
        }

        @Override
        public String dispatcherName() {
            return getEntityName();
        }

        @Override
        public ExecutorService executorService() {
            return getExecutorService();
        }

        @Override
        public ScheduledExecutorService schedulerService() {
            return getScheduler();
        }

        @Override
        public <R extends Request<RS>, RS> void execute(String entityId, R request,
                BiConsumer<RS, Throwable> callback) {
            if (supervisor.isStopped(entityId)) {
                callback.accept(null, supervisor.stoppedException(entityId));
                return;
            }
            RS response;
            try {
                response = invocationHandler.invoke(entityId, entity -> invokeEntity(entity, request));
            } catch (EntityRecoveryException e) {
                boolean stopped = supervisor.failed(entityId, e) == EntitySupervisor.Phase.STOPPED;
                callback.accept(null, stopped ? supervisor.stoppedException(entityId) : e);
                return;
            } catch (Exception e) {
                Throwable crash = Dispatcher.unwrapCompletionException(e);
                supervisor.failed(entityId, crash);
                callback.accept(null, crash);
                return;
            }
            supervisor.invocationSucceeded(entityId);
            callback.accept(response, null);
        }

        @Override
        public long retryDelay(String id, Request<?> request, Throwable t, int completedAttempts) {
            return DispatchingEventSourcingRuntime.this.retryDelay(id, request, t, completedAttempts);
        }

        @Override
        public long suspendDelay(String id) {
            return supervisor.takeBackoff(id);
        }
    }
}
