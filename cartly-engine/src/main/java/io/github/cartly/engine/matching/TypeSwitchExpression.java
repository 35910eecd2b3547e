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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Picks a value by the runtime type of an object. Like {@link SyncRequestHandler}, but for arbitrary objects and
 * without checked exceptions. The first branch that accepts the object produces the result. {@code null} never
 * matches.
 */
public class TypeSwitchExpression<E> {

    private final List<Branch<?, ? extends E>> branches;
    private final Function<Object, ? extends E> otherwise;

    private TypeSwitchExpression(List<Branch<?, ? extends E>> branches, Function<Object, ? extends E> otherwise) {
        this.branches = Collections.unmodifiableList(new ArrayList<>(branches));
        this.otherwise = otherwise;
    }

    public static <E> Builder<E> builder() {
        return new Builder<>();
    }

    /**
     * @return value of the first accepting branch, the fallback's value, or {@code null} when neither applies
     */
    public E match(Object message) {
        if (message == null) {
            return null;
        }
        for (Branch<?, ? extends E> branch : branches) {
            if (branch.accepts(message)) {
                return branch.apply(message);
            }
        }
        return otherwise == null ? null : otherwise.apply(message);
    }

    public static class Builder<E> {

        private final List<Branch<?, ? extends E>> branches = new ArrayList<>();
        private Function<Object, ? extends E> otherwise;

        public <T> Builder<E> on(Class<T> clazz, Function<T, ? extends E> callback) {
            return on(clazz, null, callback);
        }

        public <T> Builder<E> on(Class<T> clazz, Predicate<T> predicate, Function<T, ? extends E> callback) {
            branches.add(new Branch<>(clazz, predicate, callback));
            return this;
        }

        /** Value for objects no branch accepts. */
        public Builder<E> otherwise(Function<Object, ? extends E> fallback) {
            this.otherwise = Objects.requireNonNull(fallback, "fallback");
            return this;
        }

        public TypeSwitchExpression<E> build() {
            return new TypeSwitchExpression<>(branches, otherwise);
        }
    }

    private static final class Branch<T, E> {

        private final Class<T> type;
        private final Predicate<T> guard;
        private final Function<T, E> mapping;

        Branch(Class<T> type, Predicate<T> guard, Function<T, E> mapping) {
            this.type = Objects.requireNonNull(type, "type");
            this.guard = guard;
            this.mapping = Objects.requireNonNull(mapping, "mapping");
        }

        boolean accepts(Object o) {
            return type.isInstance(o) && (guard == null || guard.test(type.cast(o)));
        }

        E apply(Object o) {
            return mapping.apply(type.cast(o));
        }
    }
}
