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

import io.github.cartly.engine.Request;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Routes a {@link Request} to the first registered handler whose type and optional guard accept it. Handlers may
 * throw checked exceptions, which is what synchronous entities need. A request that no handler accepts is turned
 * into an exception by the fallback.
 */
public class SyncRequestHandler {

    private final List<Case<?, ?>> cases;
    private final Function<Request<?>, Exception> fallback;

    private SyncRequestHandler(List<Case<?, ?>> cases, Function<Request<?>, Exception> fallback) {
        this.cases = Collections.unmodifiableList(new ArrayList<>(cases));
        this.fallback = fallback;
    }

    public static Builder withDefaultFallback() {
        return new Builder(SyncRequestHandler::defaultUnsupportedRequestHandler);
    }

    /**
     * @param unsupportedRequestHandler produces the exception thrown for requests no handler accepts
     */
    public static Builder withFallbackException(Function<Request<?>, Exception> unsupportedRequestHandler) {
        return new Builder(unsupportedRequestHandler);
    }

    public static Exception defaultUnsupportedRequestHandler(Request<?> request) {
        return new UnsupportedOperationException(request.getClass().getSimpleName() + " is not handled here");
    }

    /**
     * Run the first accepting handler.
     *
     * @return the handler's response, {@code null} for a {@code null} request
     * @throws Exception whatever the handler throws, or the fallback exception when nothing accepted the request
     */
    @SuppressWarnings("unchecked")
    public <R extends Request<RESPONSE>, RESPONSE> RESPONSE handle(R request) throws Exception {
        if (request == null) {
            return null;
        }
        for (Case<?, ?> candidate : cases) {
            if (candidate.accepts(request)) {
                return (RESPONSE) candidate.run(request);
            }
        }
        throw fallback.apply(request);
    }

    public static class Builder {

        private final List<Case<?, ?>> cases = new ArrayList<>();
        private final Function<Request<?>, Exception> fallback;

        Builder(Function<Request<?>, Exception> fallback) {
            this.fallback = Objects.requireNonNull(fallback, "fallback");
        }

        public <R extends Request<RESPONSE>, RESPONSE> Builder on(Class<R> clazz, Handler<R, RESPONSE> callback) {
            return on(clazz, r -> true, callback);
        }

        /**
         * Register a handler for requests of {@code clazz} that also pass {@code check}. Cases are tried in
         * registration order.
         */
        public <R extends Request<RESPONSE>, RESPONSE> Builder on(Class<R> clazz, Predicate<R> check,
                Handler<R, RESPONSE> callback) {
            cases.add(new Case<>(clazz, check, callback));
            return this;
        }

        public SyncRequestHandler build() {
            return new SyncRequestHandler(cases, fallback);
        }
    }

    @FunctionalInterface
    public interface Handler<T, U> {
        U apply(T argument) throws Exception;
    }

    private static final class Case<R extends Request<RESPONSE>, RESPONSE> {
        private final Class<R> type;
        private final Predicate<R> guard;
        private final Handler<R, RESPONSE> handler;

        Case(Class<R> type, Predicate<R> guard, Handler<R, RESPONSE> handler) {
            this.type = Objects.requireNonNull(type, "type");
            this.guard = guard == null ? r -> true : guard;
            this.handler = Objects.requireNonNull(handler, "handler");
        }

        boolean accepts(Request<?> request) {
            return type.isInstance(request) && guard.test(type.cast(request));
        }

        RESPONSE run(Request<?> request) throws Exception {
            return handler.apply(type.cast(request));
        }

        @Override
        public String toString() {
            return "Case[" + type.getSimpleName() + "]";
        }
    }
}
