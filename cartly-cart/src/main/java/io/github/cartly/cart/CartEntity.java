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

import io.github.cartly.cart.command.AddItem;
import io.github.cartly.cart.command.AdjustItemQuantity;
import io.github.cartly.cart.command.Checkout;
import io.github.cartly.cart.command.GetCart;
import io.github.cartly.cart.command.RemoveItem;
import io.github.cartly.cart.event.CheckedOutEvent;
import io.github.cartly.cart.event.ItemAddedEvent;
import io.github.cartly.cart.event.ItemQuantityAdjustedEvent;
import io.github.cartly.cart.event.ItemRemovedEvent;
import io.github.cartly.engine.Event;
import io.github.cartly.engine.Request;
import io.github.cartly.engine.StatusReply;
import io.github.cartly.engine.SyncEntity;
import io.github.cartly.engine.matching.SyncRequestHandler;
import io.github.cartly.engine.store.EventStore;
import io.github.cartly.engine.store.EventStoreException;

import java.time.Clock;

/**
 * The shopping cart. An open cart accepts changes of its items and checkout, a checked out cart rejects every change.
 * Therefore the requests are delegated to one of two request handlers, depending on the state of the cart.
 */
public class CartEntity extends SyncEntity {

    private final Clock clock;
    private CartState state = CartState.EMPTY;

    private final SyncRequestHandler openCart = SyncRequestHandler.withDefaultFallback()
            .on(AddItem.class, this::addItem)
            .on(RemoveItem.class, this::removeItem)
            .on(AdjustItemQuantity.class, this::adjustItemQuantity)
            .on(Checkout.class, this::checkout)
            .on(GetCart.class, this::getCart)
            .build();

    private final SyncRequestHandler checkedOutCart = SyncRequestHandler.withDefaultFallback()
            .on(AddItem.class, r -> alreadyCheckedOut("Can't add an item to an already checked out shopping cart"))
            .on(RemoveItem.class,
                r -> alreadyCheckedOut("Can't remove an item from an already checked out shopping cart"))
            .on(AdjustItemQuantity.class,
                r -> alreadyCheckedOut("Can't adjust item on an already checked out shopping cart"))
            .on(Checkout.class, r -> alreadyCheckedOut("Can't checkout already checked out shopping cart"))
            .on(GetCart.class, this::getCart)
            .build();

    public CartEntity(String id, EventStore store, Clock clock) {
        super(id, store);
        this.clock = clock;
    }

    @Override
    protected <R extends Request<RS>, RS> RS execute(R request) throws Exception {
        return (state.isCheckedOut() ? checkedOutCart : openCart).handle(request);
    }

    @Override
    protected void updateState(Event event) {
        state = CartStateMachine.apply(state, event);
    }

    @Override
    protected Object createSnapshot() {
        return state;
    }

    @Override
    protected boolean restoreFromSnapshot(Object snapshot) {
        if (snapshot instanceof CartState) {
            this.state = (CartState) snapshot;
            return true;
        }
        return false;
    }

    CartState getState() {
        return state;
    }

    private StatusReply<Summary> addItem(AddItem request) throws EventStoreException {
        if (state.hasItem(request.getItemId())) {
            return StatusReply.error(CartRejection.ALREADY_PRESENT,
                "Item '" + request.getItemId() + "' was already added to this shopping cart");
        }
        if (request.getQuantity() <= 0) {
            return invalidQuantity();
        }
        persistAndUpdate(ItemAddedEvent.builder(this)
                .itemId(request.getItemId())
                .quantity(request.getQuantity())
                .build());
        return StatusReply.success(state.toSummary());
    }

    private StatusReply<Summary> removeItem(RemoveItem request) throws EventStoreException {
        if (state.hasItem(request.getItemId())) {
            persistAndUpdate(ItemRemovedEvent.builder(this).itemId(request.getItemId()).build());
        }
        return StatusReply.success(state.toSummary());
    }

    private StatusReply<Summary> adjustItemQuantity(AdjustItemQuantity request) throws EventStoreException {
        if (request.getQuantity() <= 0) {
            return invalidQuantity();
        }
        if (!state.hasItem(request.getItemId())) {
            return StatusReply.error(CartRejection.ITEM_NOT_PRESENT,
                "Cannot adjust quantity for item '" + request.getItemId() + "'. Item not present on cart");
        }
        persistAndUpdate(ItemQuantityAdjustedEvent.builder(this)
                .itemId(request.getItemId())
                .quantity(request.getQuantity())
                .build());
        return StatusReply.success(state.toSummary());
    }

    private StatusReply<Summary> checkout(Checkout request) throws EventStoreException {
        if (state.isEmpty()) {
            return StatusReply.error(CartRejection.EMPTY_CART, "Cannot checkout an empty shopping cart");
        }
        persistAndUpdate(CheckedOutEvent.builder(this).checkedOutAt(clock.instant()).build());
        return StatusReply.success(state.toSummary());
    }

    private Summary getCart(GetCart request) {
        return state.toSummary();
    }

    private static StatusReply<Summary> invalidQuantity() {
        return StatusReply.error(CartRejection.INVALID_QUANTITY, "Quantity must be greater than zero");
    }

    private static StatusReply<Summary> alreadyCheckedOut(String message) {
        return StatusReply.error(CartRejection.CART_ALREADY_CHECKED_OUT, message);
    }
}
