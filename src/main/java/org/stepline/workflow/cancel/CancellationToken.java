/*
 * Copyright 2025 Firefly Software Solutions Inc
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.stepline.workflow.cancel;

import org.stepline.workflow.exception.WorkflowAbortedException;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Cooperative cancellation signal observed by runs and step handlers.
 * <p>
 * A token is tripped at most once, by its owning {@link CancellationSource}. Handlers may
 * poll {@link #isCancelled()}, fail fast with {@link #throwIfCancelled()}, register a
 * callback with {@link #onCancel(Consumer)} or compose {@link #whenCancelled()} into a
 * reactive chain (for example with {@code takeUntilOther}).
 */
public final class CancellationToken {

    private final AtomicReference<Throwable> reason = new AtomicReference<>();
    private final Sinks.One<Throwable> signal = Sinks.one();
    private final List<Consumer<Throwable>> listeners = new CopyOnWriteArrayList<>();

    CancellationToken() {
    }

    /**
     * Returns a token that is never cancelled.
     */
    public static CancellationToken none() {
        return new CancellationToken();
    }

    /**
     * Returns a token that trips as soon as any of the given tokens trips.
     */
    public static CancellationToken anyOf(CancellationToken... tokens) {
        return CancellationSource.linkedTo(tokens).token();
    }

    public boolean isCancelled() {
        return reason.get() != null;
    }

    /**
     * Returns the cancellation reason, or {@code null} while the token is live.
     */
    public Throwable reason() {
        return reason.get();
    }

    /**
     * Throws a {@link WorkflowAbortedException} when the token has been tripped.
     */
    public void throwIfCancelled() {
        Throwable cause = reason.get();
        if (cause == null) {
            return;
        }
        throw toAbortException(cause);
    }

    /**
     * Emits the cancellation reason once the token trips; never completes otherwise.
     */
    public Mono<Throwable> whenCancelled() {
        return signal.asMono();
    }

    /**
     * Registers a callback invoked with the reason when the token trips. Callbacks
     * registered after cancellation run immediately.
     *
     * @return a handle that removes the callback
     */
    public Disposable onCancel(Consumer<Throwable> listener) {
        listeners.add(listener);
        Throwable cause = reason.get();
        if (cause != null && listeners.remove(listener)) {
            listener.accept(cause);
        }
        return () -> listeners.remove(listener);
    }

    /**
     * Number of callbacks still registered on this token.
     */
    public int listenerCount() {
        return listeners.size();
    }

    boolean trip(Throwable cause) {
        if (!reason.compareAndSet(null, cause)) {
            return false;
        }
        signal.tryEmitValue(cause);
        for (Consumer<Throwable> listener : listeners) {
            if (listeners.remove(listener)) {
                listener.accept(cause);
            }
        }
        return true;
    }

    static WorkflowAbortedException toAbortException(Throwable cause) {
        if (cause instanceof WorkflowAbortedException aborted) {
            return aborted;
        }
        return new WorkflowAbortedException("Workflow run aborted: " + cause.getMessage(), cause);
    }
}
