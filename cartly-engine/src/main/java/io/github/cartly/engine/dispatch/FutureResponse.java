package io.github.cartly.engine.dispatch;

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

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Response handed out by {@link Dispatcher}. Callers may observe or cancel it, only the dispatcher completes it.
 * <p>
 * Cancellation and the start of an attempt race for the same claim. Whoever claims first wins, so a command that
 * is already running is never reported as cancelled, and a cancelled command is never run.
 */
final class FutureResponse<T> extends CompletableFuture<T> {

    private enum Claim {
        IDLE, RUNNING
    }

    private final AtomicReference<Claim> claim = new AtomicReference<>(Claim.IDLE);
    private final Runnable onCancel;

    FutureResponse(Runnable onCancel) {
        this.onCancel = onCancel;
    }

    /**
     * Claim the response for a processing attempt.
     * @return false when the response was cancelled or another attempt holds the claim
     */
    boolean couldStart() {
        return claim.compareAndSet(Claim.IDLE, Claim.RUNNING) && !isDone();
    }

    /**
     * Release the claim after an attempt, so that a retried command can be claimed again.
     */
    void stoppedExecuting() {
        claim.set(Claim.IDLE);
    }

    void doComplete(T value) {
        super.complete(value);
    }

    void doCompleteExceptionally(Throwable t) {
        super.completeExceptionally(t);
    }

    @Override
    public boolean cancel(boolean mayInterruptIfRunning) {
        if (!claim.compareAndSet(Claim.IDLE, Claim.RUNNING)) {
            return false;
        }
        onCancel.run();
        return super.cancel(mayInterruptIfRunning);
    }

    @Override
    public boolean complete(T value) {
        throw readOnly();
    }

    @Override
    public boolean completeExceptionally(Throwable ex) {
        throw readOnly();
    }

    @Override
    public void obtrudeValue(T value) {
        throw readOnly();
    }

    @Override
    public void obtrudeException(Throwable ex) {
        throw readOnly();
    }

    private static UnsupportedOperationException readOnly() {
        return new UnsupportedOperationException("Dispatcher responses cannot be completed by the caller");
    }
}
