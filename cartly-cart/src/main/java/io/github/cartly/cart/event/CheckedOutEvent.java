package io.github.cartly.cart.event;

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

import io.github.cartly.engine.EventSourcedEntity;
import org.immutables.value.Value;

import java.time.Instant;

import static io.github.cartly.engine.immutables.ImmutableEvent.builderForEntity;

/**
 * The cart was checked out and does not accept any further changes.
 */
@Value.Immutable
public interface CheckedOutEvent extends CartEvent {
    Instant checkedOutAt();

    static Builder builder(EventSourcedEntity source) {
        return builderForEntity(source, (h) -> new Builder().from(h));
    }

    class Builder extends ImmutableCheckedOutEvent.Builder {

    }
}
