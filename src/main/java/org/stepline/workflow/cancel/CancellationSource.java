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

import lombok.extern.slf4j.Slf4j;
import org.stepline.workflow.exception.WorkflowAbortedException;
import reactor.core.Disposable;

import java.util.ArrayList;
import java.util.List;

/**
 * Owner side of a {@link CancellationToken}.
 * <p>
 * A source may be linked to parent tokens; tripping any parent trips this source with
 * the parent's reason. This is how a run composes its internal controller with a
 * caller-supplied token, and how a concurrent group derives a token it can trip for
 * its own children without affecting the run.
 */
@Slf4j
public final class CancellationSource {

    private final CancellationToken token = new CancellationToken();
    private final List<Disposable> parentRegistrations = new ArrayList<>();

    public CancellationSource() {
    }

    /**
     * Creates a source that is cancelled whenever one of the given parents is cancelled.
     * Null parents are ignored.
     */
    public static CancellationSource linkedTo(CancellationToken... parents) {
        CancellationSource source = new CancellationSource();
        if (parents == null) {
            return source;
        }
        for (CancellationToken parent : parents) {
            if (parent == null) {
                continue;
            }
            if (parent.isCancelled()) {
                source.cancel(parent.reason());
                break;
            }
            synchronized (source.parentRegistrations) {
                source.parentRegistrations.add(parent.onCancel(source::cancel));
            }
        }
        return source;
    }

    public CancellationToken token() {
        return token;
    }

    public boolean isCancelled() {
        return token.isCancelled();
    }

    /**
     * Cancels with a default {@link WorkflowAbortedException}.
     *
     * @return true if this call tripped the token
     */
    public boolean cancel() {
        return cancel(new WorkflowAbortedException());
    }

    /**
     * Cancels with the given reason.
     *
     * @return true if this call tripped the token
     */
    public boolean cancel(Throwable reason) {
        Throwable cause = reason != null ? reason : new WorkflowAbortedException();
        boolean tripped = token.trip(cause);
        if (tripped) {
            log.debug("Cancellation source tripped: reason={}", cause.getMessage());
            release();
        }
        return tripped;
    }

    /**
     * Detaches this source from its parents without cancelling it.
     */
    public void release() {
        synchronized (parentRegistrations) {
            parentRegistrations.forEach(Disposable::dispose);
            parentRegistrations.clear();
        }
    }
}
