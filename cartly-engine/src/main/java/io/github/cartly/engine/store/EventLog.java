package io.github.cartly.engine.store;

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
import io.github.cartly.engine.EventSourcingRuntimeBase;

import java.util.function.BiFunction;
import java.util.function.Consumer;

/**
 * Read side of an event store. Implementations own the deserialization of the entity's events.
 */
public interface EventLog {

    /**
     * Events of an entity with version greater than {@code afterVersion}, oldest first. Pass 0 to read the whole
     * history.
     */
    StoredEvents<? extends Event> readEvents(String entityId, long afterVersion);

    /**
     * Check that no events newer than the entity's state version exist. {@link EventSourcingRuntimeBase} asks this
     * before handing a command to a cached instance.
     *
     * @see EventSourcedEntity#getStateVersion()
     */
    boolean confirmsEntityReflectsCurrentState(EventSourcedEntity entity);

    /**
     * One-shot cursor over a query result. It may stream from an open result set, so exactly one call to either
     * {@code foreach} or {@code reduce} is allowed per instance.
     */
    interface StoredEvents<E extends Event> extends AutoCloseable {

        /** Feed every event to the consumer until the end or until {@link #stop()} is called. */
        void foreach(Consumer<? super E> consumer);

        /** Fold the events into a value. {@link #stop()} ends the fold after the current event. */
        <R> R reduce(R initial, BiFunction<R, ? super E, R> reducer);

        /** Request the iteration to end after the event being processed. */
        void stop();

        /** Releases underlying resources. Never throws. */
        @Override
        void close();
    }
}
