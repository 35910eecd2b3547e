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
import io.github.cartly.engine.Event;
import io.github.cartly.engine.matching.TypeSwitchExpression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Function;

/**
 * Transitions of {@link CartState} by persisted events. Applies to open and checked out carts alike, and never
 * throws, as it is used for recovery of carts from their history.
 */
public final class CartStateMachine {
    private static final Logger logger = LoggerFactory.getLogger(CartStateMachine.class);

    private static final TypeSwitchExpression<Function<CartState, CartState>> TRANSITIONS =
            TypeSwitchExpression.<Function<CartState, CartState>>builder()
                    .on(ItemAddedEvent.class, e -> s -> s.withItem(e.itemId(), e.quantity()))
                    .on(ItemQuantityAdjustedEvent.class, e -> s -> s.withItem(e.itemId(), e.quantity()))
                    .on(ItemRemovedEvent.class, e -> s -> s.withoutItem(e.itemId()))
                    .on(CheckedOutEvent.class, e -> s -> s.checkedOut(e.checkedOutAt()))
                    .otherwise(CartStateMachine::ignore)
                    .build();

    private CartStateMachine() {
    }

    public static CartState apply(CartState state, Event event) {
        Function<CartState, CartState> transition = TRANSITIONS.match(event);
        return transition == null ? state : transition.apply(state);
    }

    private static Function<CartState, CartState> ignore(Object event) {
        logger.warn("Ignoring unsupported event {}", event);
        return Function.identity();
    }
}
