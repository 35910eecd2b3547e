package io.github.cartly.engine.matching;

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
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.fail;

public class SyncRequestHandlerTest {

    static class Greet implements Request<String> {
        final String name;

        Greet(String name) {
            this.name = name;
        }
    }

    static class Count implements Request<Integer> {
    }

    static class Unhandled implements Request<Void> {
    }

    private final SyncRequestHandler handler = SyncRequestHandler.withDefaultFallback()
            .on(Greet.class, g -> g.name.isEmpty(), g -> "Hello, stranger")
            .on(Greet.class, g -> "Hello, " + g.name)
            .on(Count.class, c -> 42)
            .build();

    @Test
    public void first_matching_branch_handles_request() throws Exception {
        String greeting = handler.handle(new Greet("cart"));
        assertEquals("Hello, cart", greeting);
        assertEquals("Hello, stranger", handler.<Greet, String>handle(new Greet("")));
        assertEquals(Integer.valueOf(42), handler.<Count, Integer>handle(new Count()));
    }

    @Test(expected = UnsupportedOperationException.class)
    public void unmatched_request_throws_default_exception() throws Exception {
        handler.handle(new Unhandled());
    }

    @Test
    public void custom_fallback_exception_is_thrown() throws Exception {
        SyncRequestHandler custom = SyncRequestHandler.withFallbackException(
            r -> new IllegalArgumentException("No " + r.getClass().getSimpleName())).build();
        try {
            custom.handle(new Count());
            fail("Fallback should throw");
        } catch (IllegalArgumentException e) {
            assertEquals("No Count", e.getMessage());
        }
    }

    @Test
    public void handler_exception_propagates() {
        SyncRequestHandler failing = SyncRequestHandler.withDefaultFallback()
                .on(Count.class, c -> {
                    throw new IllegalStateException("counting failed");
                })
                .build();
        try {
            failing.handle(new Count());
            fail("Exception should propagate");
        } catch (Exception e) {
            assertEquals("counting failed", e.getMessage());
        }
    }

    @Test
    public void null_request_gives_null() throws Exception {
        assertNull(handler.handle(null));
    }
}
