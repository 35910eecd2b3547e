package io.github.cartly.cart;

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

import io.github.cartly.cart.event.CartEvent;
import io.github.cartly.engine.SyncEventSourcingRuntime;
import io.github.cartly.engine.store.EventLog;
import io.github.cartly.engine.store.EventStore;
import io.github.cartly.engine.store.SnapshotStore;
import io.github.cartly.engine.store.inmemory.InMemoryEventStore;
import io.github.cartly.engine.store.inmemory.InMemorySnapshotStore;
import io.github.cartly.engine.store.jdbc.DefaultJdbcSchema;
import io.github.cartly.engine.store.jdbc.JdbcEventLog;
import io.github.cartly.engine.store.jdbc.JdbcEventStore;
import io.github.cartly.engine.store.jdbc.JdbcSchema;
import io.github.cartly.engine.store.jdbc.JdbcSnapshotStore;
import io.github.cartly.engine.supervision.BackoffRestartStrategy;

import javax.sql.DataSource;
import java.time.Clock;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Runtime of shopping carts. Carts are addressed by their id, e. g.
 * <pre>
 * runtime.execute("cart-1", new AddItem("sku1", 2)).thenAccept(reply -&gt; ...);
 * </pre>
 */
public class CartRuntime extends SyncEventSourcingRuntime<CartEntity> {
    public static final String ENTITY_NAME = "Cart";

    private final CartRuntimeSettings settings;
    private final EventStore eventStore;
    private final EventLog eventLog;
    private final SnapshotStore<?> snapshotStore;
    private final ExecutorService executorService;
    private final ScheduledExecutorService scheduler;
    private final Executor snapshotExecutor;
    private final Clock clock;

    public CartRuntime(CartRuntimeSettings settings, EventStore eventStore, EventLog eventLog,
            SnapshotStore<?> snapshotStore, ExecutorService executorService, ScheduledExecutorService scheduler,
            Executor snapshotExecutor, Clock clock) {
        this.settings = settings;
        this.eventStore = eventStore;
        this.eventLog = eventLog;
        this.snapshotStore = snapshotStore;
        this.executorService = executorService;
        this.scheduler = scheduler;
        this.snapshotExecutor = snapshotExecutor;
        this.clock = clock;
    }

    public CartRuntime(CartRuntimeSettings settings, EventStore eventStore, EventLog eventLog,
            SnapshotStore<?> snapshotStore, ExecutorService executorService, ScheduledExecutorService scheduler) {
        this(settings, eventStore, eventLog, snapshotStore, executorService, scheduler, ForkJoinPool.commonPool(),
                Clock.systemUTC());
    }

    /**
     * Runtime keeping the carts in memory only.
     * @param settings runtime settings
     * @param executorService executor of cart requests
     * @param scheduler scheduler for timeouts and backoff
     * @return new runtime
     */
    public static CartRuntime inMemory(CartRuntimeSettings settings, ExecutorService executorService,
            ScheduledExecutorService scheduler) {
        InMemoryEventStore store = new InMemoryEventStore();
        return new CartRuntime(settings, store, store, new InMemorySnapshotStore(settings.getKeepSnapshots()),
                executorService, scheduler);
    }

    /**
     * Runtime storing carts in tables of {@link DefaultJdbcSchema#forEntity(String)} for entity {@code CART}.
     * @param settings runtime settings
     * @param dataSource data source with the tables
     * @param executorService executor of cart requests
     * @param scheduler scheduler for timeouts and backoff
     * @return new runtime
     */
    public static CartRuntime jdbc(CartRuntimeSettings settings, DataSource dataSource,
            ExecutorService executorService, ScheduledExecutorService scheduler) {
        return jdbc(settings, dataSource, executorService, scheduler, ForkJoinPool.commonPool(), Clock.systemUTC());
    }

    public static CartRuntime jdbc(CartRuntimeSettings settings, DataSource dataSource,
            ExecutorService executorService, ScheduledExecutorService scheduler, Executor snapshotExecutor,
            Clock clock) {
        JdbcSchema schema = DefaultJdbcSchema.forEntity("CART");
        return new CartRuntime(settings,
                new JdbcEventStore<CartEvent>(dataSource, schema, CartSerialization.events()),
                new JdbcEventLog<CartEvent>(dataSource, schema, CartSerialization.events(), false),
                new JdbcSnapshotStore<CartState>(dataSource, schema, CartSerialization.snapshots(),
                        settings.getKeepSnapshots()),
                executorService, scheduler, snapshotExecutor, clock);
    }

    @Override
    protected CartEntity instantiate(String entityId) {
        return new CartEntity(entityId, eventStore, clock);
    }

    @Override
    protected void dispose(CartEntity entity) {
        logger.debug("Disposing {}", entity);
    }

    @Override
    protected SnapshotStore<?> getSnapshotStore() {
        return snapshotStore;
    }

    @Override
    protected EventLog getEventLog() {
        return eventLog;
    }

    @Override
    protected Executor getSnapshotExecutor() {
        return snapshotExecutor;
    }

    @Override
    protected boolean shouldStoreSnapshot(CartEntity entity, int eventsSinceSnapshot) {
        return eventsSinceSnapshot >= settings.getSnapshotEvery();
    }

    @Override
    protected ExecutorService getExecutorService() {
        return executorService;
    }

    @Override
    protected ScheduledExecutorService getScheduler() {
        return scheduler;
    }

    @Override
    protected String getEntityName() {
        return ENTITY_NAME;
    }

    @Override
    protected BackoffRestartStrategy getRestartStrategy() {
        return settings.toRestartStrategy();
    }

    public CartRuntimeSettings getSettings() {
        return settings;
    }

    EventStore getEventStore() {
        return eventStore;
    }
}
