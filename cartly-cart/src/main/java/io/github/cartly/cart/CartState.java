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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * State of a single shopping cart. Instances are immutable, every transition returns a new instance, so that the
 * state can be handed over to a snapshot store while the entity keeps processing.
 * <p>Quantities of present items are always positive, setting a quantity to zero or less removes the item.</p>
 */
public final class CartState {
    public static final CartState EMPTY = new CartState(Collections.emptyMap(), Optional.empty());

    private final Map<String, Integer> items;
    private final Optional<Instant> checkoutTimestamp;

    @JsonCreator
    public CartState(@JsonProperty("items") Map<String, Integer> items,
            @JsonProperty("checkoutTimestamp") Optional<Instant> checkoutTimestamp) {
        Map<String, Integer> positive = new LinkedHashMap<>();
        if (items != null) {
            items.forEach((item, quantity) -> {
                if (quantity != null && quantity > 0) {
                    positive.put(item, quantity);
                }
            });
        }
        this.items = Collections.unmodifiableMap(positive);
        this.checkoutTimestamp = checkoutTimestamp == null ? Optional.empty() : checkoutTimestamp;
    }

    public Map<String, Integer> getItems() {
        return items;
    }

    public Optional<Instant> getCheckoutTimestamp() {
        return checkoutTimestamp;
    }

    @JsonIgnore
    public boolean isCheckedOut() {
        return checkoutTimestamp.isPresent();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return items.isEmpty();
    }

    public boolean hasItem(String itemId) {
        return items.containsKey(itemId);
    }

    public CartState withItem(String itemId, int quantity) {
        Map<String, Integer> updated = new LinkedHashMap<>(items);
        if (quantity <= 0) {
            updated.remove(itemId);
        } else {
            updated.put(itemId, quantity);
        }
        return new CartState(updated, checkoutTimestamp);
    }

    public CartState withoutItem(String itemId) {
        if (!hasItem(itemId)) {
            return this;
        }
        Map<String, Integer> updated = new LinkedHashMap<>(items);
        updated.remove(itemId);
        return new CartState(updated, checkoutTimestamp);
    }

    public CartState checkedOut(Instant when) {
        return new CartState(items, Optional.of(when));
    }

    public Summary toSummary() {
        return new Summary(items, isCheckedOut());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        CartState that = (CartState) o;
        return items.equals(that.items) && checkoutTimestamp.equals(that.checkoutTimestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(items, checkoutTimestamp);
    }

    @Override
    public String toString() {
        return "CartState{items=" + items + ", checkoutTimestamp=" + checkoutTimestamp.orElse(null) + '}';
    }
}
