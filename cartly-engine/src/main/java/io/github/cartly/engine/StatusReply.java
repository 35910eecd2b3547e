package io.github.cartly.engine;

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

import java.util.Objects;

/**
 * Response of a request that may be rejected by entity's validation.
 * <p>Rejection is a regular outcome of a request, therefore it is delivered as a value rather than by exceptional
 * completion of the response. Exceptional completion is reserved for failures of the runtime and persistence.</p>
 *
 * @param <T> type of successful response
 */
public final class StatusReply<T> {
    private final T value;
    private final Enum<?> reason;
    private final String message;

    private StatusReply(T value, Enum<?> reason, String message) {
        this.value = value;
        this.reason = reason;
        this.message = message;
    }

    public static <T> StatusReply<T> success(T value) {
        return new StatusReply<>(Objects.requireNonNull(value, "Successful reply needs a value"), null, null);
    }

    public static <T> StatusReply<T> error(Enum<?> reason, String message) {
        return new StatusReply<>(null, Objects.requireNonNull(reason, "Rejection needs a reason"), message);
    }

    public boolean isSuccess() {
        return reason == null;
    }

    public boolean isError() {
        return reason != null;
    }

    /**
     * Value of successful reply.
     * @return the value
     * @throws IllegalStateException when the request was rejected
     */
    public T getValue() {
        if (isError()) {
            throw new IllegalStateException("Request was rejected: " + reason + " " + message);
        }
        return value;
    }

    /**
     * Reason of rejection.
     * @return the reason, null for successful reply
     */
    public Enum<?> getReason() {
        return reason;
    }

    /**
     * Human readable description of rejection.
     * @return the message, null for successful reply
     */
    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        StatusReply<?> that = (StatusReply<?>) o;
        return Objects.equals(value, that.value) && Objects.equals(reason, that.reason)
                && Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, reason, message);
    }

    @Override
    public String toString() {
        return isSuccess() ? "StatusReply{success=" + value + '}'
                : "StatusReply{error=" + reason + ", message=" + message + '}';
    }
}
