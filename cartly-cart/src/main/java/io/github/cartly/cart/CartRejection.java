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

/**
 * Reasons a cart command is rejected without changing the cart.
 */
public enum CartRejection {
    ALREADY_PRESENT,
    INVALID_QUANTITY,
    ITEM_NOT_PRESENT,
    EMPTY_CART,
    CART_ALREADY_CHECKED_OUT
}
