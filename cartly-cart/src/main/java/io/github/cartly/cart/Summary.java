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
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Read model of a cart returned to callers.
 */
public final class Summary {
    private final Map<String, Integer> items;
    private final boolean checkedOut;

    @JsonCreator
    public Summary(@JsonProperty("items") Map<String, Integer> items,
            @JsonProperty("checkedOut") boolean checkedOut) {
        this.items = items == null ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(items));
        this.checkedOut = checkedOut;
    }

    public Map<String, Integer> getItems() {
        return items;
    }

    public boolean isCheckedOut() {
        return checkedOut;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Summary summary = (Summary) o;
        return checkedOut == summary.checkedOut && items.equals(summary.items);
    }

    @Override
    public int hashCode() {
        return Objects.hash(items, checkedOut);
    }

    @Override
    public String toString() {
        return "Summary{items=" + items + ", checkedOut=" + checkedOut + '}';
    }
}
