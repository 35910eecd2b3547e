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

import io.github.cartly.engine.Request;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Runs requests on entities, at most one request per entity id at any time.
 * <p>
 * Every id has a mailbox. Enqueuing into an idle mailbox submits a drain task to the executor. The drain task runs
 * one invocation, and when that invocation finishes, possibly on another thread, the task is submitted again, after
 * the {@linkplain DispatcherConfiguration#suspendDelay(String) suspend delay} when the configuration asks for one.
 * The mailbox goes idle once it finds its queue empty. Failed invocations are retried according to
 * {@link DispatcherConfiguration#retryDelay(String, Request, Throwable, int)}.
 */
public class Dispatcher {

    private final DispatcherConfiguration conf;
    private final ConcurrentMap<String, Mailbox> mailboxes = new ConcurrentHashMap<>();
    private final Logger logger;

    public Dispatcher(DispatcherConfiguration conf) {
        this.conf = conf;
        this.logger = LoggerFactory.getLogger(getClass().getName() + "." + conf.dispatcherName());
    }

    /**
     * Queue a request for the entity.
     *
     * @return response completed when the request has been processed. Callers cannot complete it themselves.
     */
    public <R extends Request<RS>, RS> CompletableFuture<RS> execute(String id, R request) {
        Invocation<R, RS> invocation = new Invocation<>(mailbox(id), request);
        invocation.mailbox.offer(invocation);
        return invocation.result;
    }

    /**
     * Queue a request that is cancelled when it has not started within the timeout. A request that already runs is
     * not interrupted.
     */
    public <R extends Request<RS>, RS> CompletableFuture<RS> executeWithTimeout(String id, R request, long timeout,
            TimeUnit unit) {
        Invocation<R, RS> invocation = new Invocation<>(mailbox(id), request);
        invocation.expireAfter(timeout, unit);
        invocation.mailbox.offer(invocation);
        return invocation.result;
    }

    /**
     * Queue a request after a delay.
     */
    public <R extends Request<RS>, RS> CompletableFuture<RS> executeLater(String id, R request, long delay,
            TimeUnit unit) {
        Invocation<R, RS> invocation = new Invocation<>(mailbox(id), request);
        conf.schedulerService().schedule(() -> invocation.mailbox.offer(invocation), delay, unit);
        return invocation.result;
    }

    public static Throwable unwrapCompletionException(Throwable ex) {
        Throwable cause = ex;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    private Mailbox mailbox(String id) {
        return mailboxes.computeIfAbsent(id, Mailbox::new);
    }

    /**
     * Queue of one entity. {@code active} is true from the moment a drain task is submitted until the task finds the
     * queue empty, so at most one task drains the queue.
     */
    private final class Mailbox implements Runnable {
        private final String id;
        private final Deque<Invocation<?, ?>> queue = new ArrayDeque<>();
        private boolean active;
        private volatile Invocation<?, ?> current;

        Mailbox(String id) {
            this.id = id;
        }

        void offer(Invocation<?, ?> invocation) {
            boolean start;
            synchronized (this) {
                queue.addLast(invocation);
                start = !active;
                active = true;
            }
            if (start) {
                logger.debug("Mailbox of {} starts draining", id);
                conf.executorService().submit(this);
            } else {
                logger.debug("Request for {} queued behind running invocation", id);
            }
        }

        synchronized void retryNext(Invocation<?, ?> invocation) {
            queue.addFirst(invocation);
        }

        synchronized void withdraw(Invocation<?, ?> invocation) {
            queue.remove(invocation);
        }

        private synchronized Invocation<?, ?> poll() {
            Invocation<?, ?> next = queue.pollFirst();
            if (next == null) {
                active = false;
            }
            return next;
        }

        @Override
        public void run() {
            Invocation<?, ?> next = poll();
            if (next == null) {
                logger.debug("Mailbox of {} is drained", id);
                return;
            }
            current = next;
            next.run();
        }

        void finished(Invocation<?, ?> invocation) {
            if (current != invocation) {
                logger.error("Invocation {} finished while {} was current", invocation, current);
            }
            current = null;
            long pause = conf.suspendDelay(id);
            if (pause > 0) {
                logger.debug("Mailbox of {} suspended for {} ms", id, pause);
                conf.schedulerService().schedule(() -> conf.executorService().submit(this), pause,
                    TimeUnit.MILLISECONDS);
            } else {
                conf.executorService().submit(this);
            }
        }
    }

    /**
     * One request and the response promised for it. Holds the attempt count for retries.
     */
    private final class Invocation<R extends Request<RS>, RS> implements Runnable {
        private final Mailbox mailbox;
        private final R request;
        private final FutureResponse<RS> result;
        private final Instant submitted = Instant.now();
        private int attempts;
        private Instant started;
        private ScheduledFuture<?> expiry;

        Invocation(Mailbox mailbox, R request) {
            this.mailbox = mailbox;
            this.request = request;
            this.result = new FutureResponse<>(() -> mailbox.withdraw(this));
        }

        void expireAfter(long timeout, TimeUnit unit) {
            expiry = conf.schedulerService().schedule(this::expire, timeout, unit);
        }

        @Override
        public void run() {
            if (!result.couldStart()) {
                logger.info("Skipping cancelled invocation {}", this);
                end();
                return;
            }
            attempts++;
            started = Instant.now();
            try {
                conf.execute(mailbox.id, request, this::completed);
            } catch (RuntimeException e) {
                logger.error("Dispatching {} failed", this, e);
                completed(null, e);
            }
        }

        private void completed(RS response, Throwable failure) {
            if (failure == null) {
                stopExpiry();
                result.doComplete(response);
            } else {
                long delay = conf.retryDelay(mailbox.id, request, failure, attempts);
                if (delay == 0) {
                    mailbox.retryNext(this);
                } else if (delay > 0) {
                    logger.debug("Retrying {} in {} ms", this, delay);
                    conf.schedulerService().schedule(() -> mailbox.offer(this), delay, TimeUnit.MILLISECONDS);
                } else {
                    stopExpiry();
                    result.doCompleteExceptionally(unwrapCompletionException(failure));
                }
            }
            end();
        }

        private void end() {
            started = null;
            result.stoppedExecuting();
            mailbox.finished(this);
        }

        private void expire() {
            if (result.cancel(true)) {
                logger.info("Invocation {} timed out before it started", this);
            } else if (!result.isDone()) {
                logger.warn("Invocation {} timed out while running", this);
            }
        }

        private void stopExpiry() {
            if (expiry != null) {
                expiry.cancel(false);
            }
        }

        @Override
        public String toString() {
            return "Invocation[" + mailbox.id + ": " + request + ", submitted " + submitted + ", attempts " + attempts
                    + (started == null ? "" : ", running since " + started) + "]";
        }
    }
}
