package io.github.cartly.cart.command;

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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.github.cartly.cart.Summary;
import io.github.cartly.engine.Request;
import io.github.cartly.engine.StatusReply;

import java.util.Objects;

/**
 * Set quantity of an item already present in the cart.
 */
public final class AdjustItemQuantity implements Request<StatusReply<Summary>> {
    private final String itemId;
    private final int quantity;

    @JsonCreator
    public AdjustItemQuantity(@JsonProperty("itemId") String itemId, @JsonProperty("quantity") int quantity) {
        this.itemId = Objects.requireNonNull(itemId, "Item id must be specified");
        this.quantity = quantity;
    }

    public String getItemId() {
        return itemId;
    }

    public int getQuantity() {
        return quantity;
    }

    @Override
    public String toString() {
        return "AdjustItemQuantity{itemId=" + itemId + ", quantity=" + quantity + '}';
    }
}
