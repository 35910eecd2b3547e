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

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.AppenderBase;
import io.github.cartly.engine.Request;
import org.junit.After;
import org.junit.AfterClass;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ErrorCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiConsumer;

import static io.github.cartly.engine.dispatch.DispatchingEventSourcingRuntime.RETRY_NEVER;
import static io.github.cartly.engine.dispatch.DispatchingEventSourcingRuntime.RETRY_NOW;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

public class DispatcherTest {
    private static final Logger logger = LoggerFactory.getLogger(DispatcherTest.class);
    private static final String NAME = "Tally";

    private static final ExecutorService workers = Executors.newFixedThreadPool(4);
    private static final ScheduledExecutorService scheduler = Executors.newScheduledThreadPool(2);

    @Rule
    public ErrorCollector collector = new ErrorCollector();

    private AppenderBase<ILoggingEvent> errorsAsFailures;

    private final TallyConfig conf = new TallyConfig();
    private final Dispatcher dispatcher = new Dispatcher(conf);

    @Before
    public void failOnLoggedErrors() {
        errorsAsFailures = new AppenderBase<ILoggingEvent>() {
            @Override
            protected void append(ILoggingEvent event) {
                if (event.getLevel().isGreaterOrEqual(Level.ERROR)) {
                    collector.addError(new AssertionError("Dispatcher logged: " + event.getFormattedMessage()));
                }
            }
        };
        errorsAsFailures.start();
        dispatcherLogger().addAppender(errorsAsFailures);
    }

    @After
    public void detachAppender() {
        dispatcherLogger().detachAppender(errorsAsFailures);
    }

    @AfterClass
    public static void shutdownPools() {
        workers.shutdownNow();
        scheduler.shutdownNow();
    }

    private static ch.qos.logback.classic.Logger dispatcherLogger() {
        LoggerContext ctx = (LoggerContext) LoggerFactory.getILoggerFactory();
        return ctx.getLogger(Dispatcher.class.getName() + "." + NAME);
    }

    enum Op implements Request<Integer> {
        INCREMENT, DECREMENT, SLOW_READ, FAIL
    }

    /**
     * Not thread safe on purpose. Lost updates show up if the dispatcher ever runs two requests of one id at once.
     */
    static class Tally {
        private int value;
        private boolean busy;

        Integer apply(Op op, boolean flaky) {
            if (busy) {
                throw new AssertionError("Concurrent access to tally");
            }
            busy = true;
            try {
                if (flaky && ThreadLocalRandom.current().nextBoolean()) {
                    throw new IllegalStateException("flaky failure");
                }
                switch (op) {
                    case INCREMENT:
                        return ++value;
                    case DECREMENT:
                        return --value;
                    case SLOW_READ:
                        sleep(10);
                        return value;
                    default:
                        throw new IllegalArgumentException(op + " always fails");
                }
            } finally {
                busy = false;
            }
        }
    }

    static class TallyConfig implements DispatcherConfiguration {
        final ConcurrentMap<String, Tally> tallies = new ConcurrentHashMap<>();
        volatile boolean flaky;
        volatile long retryPause = RETRY_NOW;

        @Override
        public String dispatcherName() {
            return NAME;
        }

        @Override
        public ExecutorService executorService() {
            return workers;
        }

        @Override
        public ScheduledExecutorService schedulerService() {
            return scheduler;
        }

        @Override
        @SuppressWarnings("unchecked")
        public <R extends Request<RS>, RS> void execute(String id, R request, BiConsumer<RS, Throwable> callback) {
            Tally tally = tallies.computeIfAbsent(id, k -> new Tally());
            RS result;
            try {
                result = (RS) tally.apply((Op) request, flaky);
            } catch (RuntimeException e) {
                callback.accept(null, e);
                return;
            }
            callback.accept(result, null);
        }

        @Override
        public long retryDelay(String id, Request<?> request, Throwable t, int completedAttempts) {
            return completedAttempts < 5 ? retryPause : RETRY_NEVER;
        }
    }

    @Test
    public void concurrent_clients_see_every_entity_serialized() throws Exception {
        conf.flaky = true;
        String[] ids = {"A", "B", "C", "D", "E"};
        ExecutorService clients = Executors.newFixedThreadPool(8);
        List<Future<Map<String, Integer>>> outcomes = new ArrayList<>();
        try {
            for (int c = 0; c < 8; c++) {
                outcomes.add(clients.submit(() -> runClient(ids, 500)));
            }
            Map<String, Integer> expected = new HashMap<>();
            for (Future<Map<String, Integer>> outcome : outcomes) {
                outcome.get(60, TimeUnit.SECONDS).forEach((id, delta) -> expected.merge(id, delta, Integer::sum));
            }
            for (Map.Entry<String, Integer> entry : expected.entrySet()) {
                assertEquals("Tally " + entry.getKey(), (int) entry.getValue(), conf.tallies.get(entry.getKey()).value);
            }
        } finally {
            clients.shutdownNow();
        }
    }

    /**
     * Fire random increments and decrements, cancelling some, and sum up the ones that succeeded.
     */
    private Map<String, Integer> runClient(String[] ids, int requests) throws Exception {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        Map<String, Integer> applied = new HashMap<>();
        for (int i = 0; i < requests; i++) {
            String id = ids[random.nextInt(ids.length)];
            Op op = random.nextBoolean() ? Op.INCREMENT : Op.DECREMENT;
            CompletableFuture<Integer> response = dispatcher.execute(id, op);
            if (random.nextInt(5) == 0 && response.cancel(true)) {
                continue;
            }
            try {
                response.get(5, TimeUnit.SECONDS);
                applied.merge(id, op == Op.INCREMENT ? 1 : -1, Integer::sum);
            } catch (ExecutionException e) {
                logger.debug("{} on {} failed after retries", op, id, e.getCause());
            } catch (CancellationException e) {
                logger.debug("{} on {} cancelled", op, id);
            }
        }
        return applied;
    }

    @Test
    public void requests_not_started_before_timeout_are_cancelled() throws Exception {
        List<CompletableFuture<Integer>> responses = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            responses.add(dispatcher.executeWithTimeout("timeout", Op.SLOW_READ, 100, TimeUnit.MILLISECONDS));
        }
        int completed = 0;
        int cancelled = 0;
        for (CompletableFuture<Integer> response : responses) {
            try {
                response.get(2, TimeUnit.SECONDS);
                completed++;
            } catch (CancellationException e) {
                cancelled++;
            }
        }
        assertThat(completed, greaterThanOrEqualTo(1));
        assertThat(cancelled, greaterThanOrEqualTo(50));
        assertThat(completed + cancelled, equalTo(100));
    }

    @Test
    public void delayed_request_runs_after_queued_ones() throws Exception {
        CompletableFuture<Integer> later = dispatcher.executeLater("later", Op.SLOW_READ, 50, TimeUnit.MILLISECONDS);
        for (int i = 0; i < 10; i++) {
            dispatcher.execute("later", Op.INCREMENT);
        }
        assertEquals(10, later.get(1, TimeUnit.SECONDS).intValue());
    }

    @Test(expected = CancellationException.class)
    public void timeout_counts_from_submission_across_retries() throws Exception {
        conf.retryPause = 30;
        dispatcher.executeWithTimeout("retrying", Op.FAIL, 100, TimeUnit.MILLISECONDS).get(500, TimeUnit.MILLISECONDS);
    }

    @Test
    public void exhausted_retries_fail_with_the_last_exception() throws Exception {
        try {
            dispatcher.execute("failing", Op.FAIL).get(1, TimeUnit.SECONDS);
            fail("FAIL should not succeed");
        } catch (ExecutionException e) {
            assertThat(e.getCause(), instanceOf(IllegalArgumentException.class));
        }
    }

    @Test(expected = UnsupportedOperationException.class)
    public void response_is_read_only_for_callers() {
        dispatcher.executeLater("readonly", Op.INCREMENT, 1, TimeUnit.SECONDS).complete(42);
    }

    @Test
    public void suspended_mailbox_holds_next_request() throws Exception {
        AtomicInteger finishedInvocations = new AtomicInteger();
        TallyConfig pausing = new TallyConfig() {
            @Override
            public long suspendDelay(String id) {
                return finishedInvocations.getAndIncrement() == 0 ? 200 : 0;
            }
        };
        Dispatcher paused = new Dispatcher(pausing);
        CompletableFuture<Integer> first = paused.execute("paused", Op.INCREMENT);
        CompletableFuture<Integer> second = paused.execute("paused", Op.INCREMENT);
        assertEquals(1, first.get(1, TimeUnit.SECONDS).intValue());
        long firstDone = System.nanoTime();
        assertEquals(2, second.get(1, TimeUnit.SECONDS).intValue());
        long waited = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - firstDone);
        assertThat("ms between first and second response", waited, greaterThanOrEqualTo(150L));
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
