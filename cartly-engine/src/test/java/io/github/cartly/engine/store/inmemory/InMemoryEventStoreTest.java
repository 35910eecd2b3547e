package io.github.cartly.engine.store.inmemory;

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
import io.github.cartly.engine.EventHeader;
import io.github.cartly.engine.store.EventLog;
import io.github.cartly.engine.store.EventStoreException;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

public class InMemoryEventStoreTest {
    private final InMemoryEventStore store = new InMemoryEventStore();

    private static List<Event> events(String id, long from, long to) {
        List<Event> result = new ArrayList<>();
        for (long v = from; v <= to; v++) {
            result.add(new EventHeader(id, v));
        }
        return result;
    }

    private List<Long> versions(String id, long after) {
        List<Long> result = new ArrayList<>();
        try (EventLog.StoredEvents<Event> stored = store.readEvents(id, after)) {
            stored.foreach(e -> result.add(e.entityStateVersion()));
        }
        return result;
    }

    @Test
    public void appended_events_are_read_in_order() throws EventStoreException {
        assertEquals(2, store.appendBatch("a", 0, events("a", 1, 2)));
        assertEquals(4, store.appendBatch("a", 2, events("a", 3, 4)));
        assertThat(versions("a", 0), contains(1L, 2L, 3L, 4L));
        assertThat(versions("a", 2), contains(3L, 4L));
        assertEquals(4, store.lastVersionOf("a"));
    }

    @Test
    public void stale_expected_version_is_rejected() throws EventStoreException {
        store.appendBatch("a", 0, events("a", 1, 2));
        try {
            store.appendBatch("a", 1, events("a", 2, 2));
            fail("Stale append should fail");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.OPTIMISTIC_LOCK, e.getFault());
        }
        assertThat(versions("a", 0), contains(1L, 2L));
    }

    @Test
    public void batch_must_be_contiguous_and_single_entity() throws EventStoreException {
        try {
            store.appendBatch("a", 0, Arrays.asList(new EventHeader("a", 1), new EventHeader("a", 3)));
            fail("Gap should be rejected");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.PROGRAMMATIC_ERROR, e.getFault());
        }
        try {
            store.appendBatch("a", 0, Arrays.asList(new EventHeader("a", 1), new EventHeader("b", 2)));
            fail("Foreign entity should be rejected");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.PROGRAMMATIC_ERROR, e.getFault());
        }
        assertEquals(0, store.lastVersionOf("a"));
        assertEquals(0, store.appendBatch("a", 0, Collections.emptyList()));
    }

    @Test
    public void reduction_can_be_stopped() throws EventStoreException {
        store.appendBatch("a", 0, events("a", 1, 5));
        try (EventLog.StoredEvents<Event> stored = store.readEvents("a", 0)) {
            long last = stored.reduce(0L, (acc, e) -> {
                if (e.entityStateVersion() == 3) {
                    stored.stop();
                }
                return e.entityStateVersion();
            });
            assertEquals(3L, last);
        }
    }
}
