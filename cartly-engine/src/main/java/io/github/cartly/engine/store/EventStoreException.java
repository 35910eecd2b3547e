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

/**
 * An append was refused or failed. {@link #getFault()} tells whether retrying with fresh state can help.
 */
public class EventStoreException extends Exception {

    public enum Fault {
        /** Someone else appended first, the entity's state is stale. */
        OPTIMISTIC_LOCK,
        /** The storage failed. */
        TX_ERROR,
        /** The batch violates the append contract. Retrying will not help. */
        PROGRAMMATIC_ERROR
    }

    private final Fault fault;

    protected EventStoreException(Fault fault, String message, Throwable cause) {
        super(message, cause);
        this.fault = fault;
    }

    public Fault getFault() {
        return fault;
    }

    public static EventStoreException optimisticLock(String entityId, long expectedVersion) {
        return new EventStoreException(Fault.OPTIMISTIC_LOCK,
            entityId + " moved past version " + expectedVersion, null);
    }

    public static EventStoreException optimisticLock(String entityId, long knownVersion, long expectedVersion) {
        return new EventStoreException(Fault.OPTIMISTIC_LOCK,
            entityId + " is at version " + knownVersion + ", append expected version " + expectedVersion, null);
    }

    public static EventStoreException storeFailed(String entityId, Throwable cause) {
        return new EventStoreException(Fault.TX_ERROR, "Appending to " + entityId + " failed: " + cause.getMessage(),
            cause);
    }

    public static EventStoreException multipleEntities(String entityId, Event foreign) {
        return new EventStoreException(Fault.PROGRAMMATIC_ERROR,
            "Batch of " + entityId + " contains an event of " + foreign.entityId(), null);
    }

    public static EventStoreException nonMonotonic(String entityId, long expectedVersion, Event violating) {
        return new EventStoreException(Fault.PROGRAMMATIC_ERROR, "Batch of " + entityId + " expected version "
                + expectedVersion + " but got " + violating.entityStateVersion(), null);
    }

    /**
     * Store failure that the entity caught instead of propagating.
     */
    public static EventStoreException suppressed(String entityId, Throwable original) {
        return new EventStoreException(Fault.PROGRAMMATIC_ERROR,
            entityId + " swallowed a failed append", original);
    }

    public static EventStoreException unsupported(Event event) {
        return new EventStoreException(Fault.PROGRAMMATIC_ERROR, "No serialization for event " + event, null);
    }
}
