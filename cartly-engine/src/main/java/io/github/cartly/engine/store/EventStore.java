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

import java.util.List;

/**
 * Storage for entity's events.
 *
 * <p>Storing a batch of events constitutes a separate non-distributed transaction: either all events of the batch
 * are appended, or none.</p>
 * <p>Event store needs also guarantee the consistency of event log across processes, by employing optimistic locks
 * to prevent two writers to append events for single entity from the same version.</p>
 */
public interface EventStore {

    /**
     * Append events synchronously. Callers may reply to the request when this method completes without exception.
     * Any exception thrown from this method must be treated as non-recoverable for current entity instance.
     *
     * @param entityId the entity all events belong to
     * @param expectedVersion version of the entity the events were produced from, i. e. offset of the last event
     *                        in entity's log known to the writer
     * @param events events to store, their versions continuing from {@code expectedVersion + 1}
     * @return the version of the entity after the append
     * @throws EventStoreException when storing fails, or with {@link EventStoreException.Fault#OPTIMISTIC_LOCK} if
     * the log has moved past {@code expectedVersion}
     */
    long appendBatch(String entityId, long expectedVersion, List<? extends Event> events) throws EventStoreException;
}
