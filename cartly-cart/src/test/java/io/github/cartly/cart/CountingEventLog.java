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

import io.github.cartly.engine.Event;
import io.github.cartly.engine.EventSourcedEntity;
import io.github.cartly.engine.store.EventLog;
import io.github.cartly.engine.store.inmemory.InMemoryEventStore;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;
import java.util.function.Consumer;

/**
 * Event log counting the events delivered to recovering carts.
 */
class CountingEventLog implements EventLog {
    private final InMemoryEventStore delegate;
    private final AtomicInteger replayed = new AtomicInteger();

    CountingEventLog(InMemoryEventStore delegate) {
        this.delegate = delegate;
    }

    int getReplayed() {
        return replayed.get();
    }

    @Override
    public StoredEvents<Event> readEvents(String entityId, long afterVersion) {
        StoredEvents<Event> events = delegate.readEvents(entityId, afterVersion);
        return new StoredEvents<Event>() {
            @Override
            public void foreach(Consumer<? super Event> consumer) {
                events.foreach(e -> {
                    replayed.incrementAndGet();
                    consumer.accept(e);
                });
            }

            @Override
            public <R> R reduce(R initial, BiFunction<R, ? super Event, R> reducer) {
                return events.reduce(initial, (r, e) -> {
                    replayed.incrementAndGet();
                    return reducer.apply(r, e);
                });
            }

            @Override
            public void stop() {
                events.stop();
            }

            @Override
            public void close() {
                events.close();
            }
        };
    }

    @Override
    public boolean confirmsEntityReflectsCurrentState(EventSourcedEntity entity) {
        return delegate.confirmsEntityReflectsCurrentState(entity);
    }
}
