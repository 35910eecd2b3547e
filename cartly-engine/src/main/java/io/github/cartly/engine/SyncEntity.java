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

import io.github.cartly.engine.store.EventStore;
import io.github.cartly.engine.store.EventStoreException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Entity that handles a request on the calling thread and returns the response directly. Runs under a
 * {@link SyncEventSourcingRuntime}.
 */
public abstract class SyncEntity extends EventSourcedEntity {

    private final EventStore store;

    protected SyncEntity(String id, EventStore store) {
        super(id);
        this.store = store;
    }

    /**
     * Handle a request in three steps. First validate against the current state and answer rejections without
     * persisting anything. Then persist the resulting events with {@link #persistAndUpdate(Event)} or
     * {@link #persistAllAndUpdate(Collection)}, letting an {@link EventStoreException} propagate. Finally build the
     * response from the updated state.
     */
    protected abstract <R extends Request<RS>, RS> RS execute(R request) throws Exception;

    protected void persistAndUpdate(Event event) throws EventStoreException {
        persistAllAndUpdate(Collections.singletonList(event));
    }

    /**
     * Append the events as one batch and apply them. When the append fails nothing is applied.
     */
    protected void persistAllAndUpdate(Collection<? extends Event> events) throws EventStoreException {
        List<Event> batch = new ArrayList<>(events);
        try {
            store.appendBatch(getIdentity(), getStateVersion(), batch);
        } catch (EventStoreException e) {
            handlePersistenceFailure(e);
            throw e;
        }
        eventsPersisted(batch);
    }
}
