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
import io.github.cartly.engine.store.JacksonSerialization;

/**
 * JSON codecs of cart events and cart snapshots.
 */
public final class CartSerialization {
    static final int EVENT_PAYLOAD_VERSION = 1;
    static final int SNAPSHOT_PAYLOAD_VERSION = 1;

    private CartSerialization() {
    }

    public static JacksonSerialization<CartEvent> events() {
        return new JacksonSerialization<>(JacksonSerialization.defaultObjectMapper(), CartEvent.class,
                EVENT_PAYLOAD_VERSION);
    }

    public static JacksonSerialization<CartState> snapshots() {
        return new JacksonSerialization<>(JacksonSerialization.defaultObjectMapper(), CartState.class,
                SNAPSHOT_PAYLOAD_VERSION);
    }
}
