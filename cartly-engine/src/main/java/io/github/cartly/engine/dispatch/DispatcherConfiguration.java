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

import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.BiConsumer;

/**
 * What a {@link Dispatcher} needs: threads, the invocation itself, and the retry and pause policies.
 */
public interface DispatcherConfiguration {

    /** Suffix of the dispatcher's logger. */
    String dispatcherName();

    /** Threads that run invocations. */
    ExecutorService executorService();

    /**
     * Threads for delayed requests, timeouts and paused mailboxes. Use a pool separate from
     * {@link #executorService()}, so that timeouts fire while every invocation thread is blocked.
     */
    ScheduledExecutorService schedulerService();

    /**
     * Run the request on the entity and report the outcome to the callback, on this thread or later on another.
     */
    <R extends Request<RS>, RS> void execute(String id, R request, BiConsumer<RS, Throwable> callback);

    /**
     * Retry policy for a failed request.
     *
     * @param completedAttempts attempts so far, at least 1
     * @return negative to fail the request, 0 to run it again before anything else in the mailbox, positive for a
     *     delay in milliseconds during which other requests may run
     */
    long retryDelay(String id, Request<?> request, Throwable t, int completedAttempts);

    /**
     * Pause before the mailbox of the entity runs its next request. Requests keep queuing meanwhile.
     *
     * @return milliseconds, 0 or less for no pause
     */
    default long suspendDelay(String id) {
        return 0;
    }
}
