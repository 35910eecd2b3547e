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

import io.github.cartly.cart.event.CheckedOutEvent;
import io.github.cartly.cart.event.ItemAddedEvent;
import io.github.cartly.cart.event.ItemQuantityAdjustedEvent;
import io.github.cartly.cart.event.ItemRemovedEvent;
import io.github.cartly.engine.EventHeader;
import io.github.cartly.engine.store.UnrecognizedEvent;
import org.junit.Test;

import java.time.Instant;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasEntry;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class CartStateMachineTest {
    private static final String CART = "cart";
    private static final Instant CHECKOUT = Instant.parse("2017-05-03T10:15:30Z");

    static ItemAddedEvent added(long version, String item, int quantity) {
        return new ItemAddedEvent.Builder().from(new EventHeader(CART, version)).itemId(item).quantity(quantity)
                .build();
    }

    static ItemQuantityAdjustedEvent adjusted(long version, String item, int quantity) {
        return new ItemQuantityAdjustedEvent.Builder().from(new EventHeader(CART, version)).itemId(item)
                .quantity(quantity).build();
    }

    static ItemRemovedEvent removed(long version, String item) {
        return new ItemRemovedEvent.Builder().from(new EventHeader(CART, version)).itemId(item).build();
    }

    static CheckedOutEvent checkedOut(long version) {
        return new CheckedOutEvent.Builder().from(new EventHeader(CART, version)).checkedOutAt(CHECKOUT).build();
    }

    @Test
    public void events_fold_into_state() {
        CartState state = CartState.EMPTY;
        state = CartStateMachine.apply(state, added(1, "sku1", 2));
        state = CartStateMachine.apply(state, added(2, "sku2", 1));
        state = CartStateMachine.apply(state, adjusted(3, "sku1", 7));
        state = CartStateMachine.apply(state, removed(4, "sku2"));
        assertEquals(1, state.getItems().size());
        assertThat(state.getItems(), hasEntry("sku1", 7));
    }

    @Test
    public void removal_of_absent_item_is_noop() {
        CartState state = CartState.EMPTY.withItem("sku1", 1);
        assertEquals(state, CartStateMachine.apply(state, removed(2, "sku2")));
    }

    @Test
    public void checkout_sets_timestamp_and_keeps_items() {
        CartState state = CartStateMachine.apply(CartState.EMPTY.withItem("sku1", 1), checkedOut(2));
        assertTrue(state.isCheckedOut());
        assertEquals(CHECKOUT, state.getCheckoutTimestamp().get());
        assertThat(state.getItems(), hasEntry("sku1", 1));
    }

    @Test
    public void checked_out_state_still_folds_late_events() {
        CartState state = CartState.EMPTY.withItem("sku1", 1).checkedOut(CHECKOUT);
        CartState folded = CartStateMachine.apply(state, added(3, "sku2", 4));
        assertThat(folded.getItems(), hasEntry("sku2", 4));
        assertTrue(folded.isCheckedOut());
    }

    @Test
    public void unknown_events_are_ignored() {
        CartState state = CartState.EMPTY.withItem("sku1", 1);
        assertSame(state, CartStateMachine.apply(state, new EventHeader(CART, 2)));
        assertSame(state, CartStateMachine.apply(state, new UnrecognizedEvent(CART, 3, CHECKOUT, "ItemGifted", 2)));
    }
}
