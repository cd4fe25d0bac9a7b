package dev.mars.commitstream.core.concurrent;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * One-shot cancellation signal shared between a loop and whoever may stop it.
 *
 * <p>Loops check {@link #isAborted()} at their heads and wait through {@link #await(Duration)}
 * so that an abort cuts an in-progress delay short.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public final class AbortSignal {

    private final CompletableFuture<Void> aborted;

    private AbortSignal(CompletableFuture<Void> aborted) {
        this.aborted = aborted;
    }

    public static AbortSignal create() {
        return new AbortSignal(new CompletableFuture<>());
    }

    /**
     * A signal that fires when the given future completes, normally or not.
     */
    public static AbortSignal when(CompletableFuture<?> trigger) {
        AbortSignal signal = create();
        trigger.whenComplete((value, error) -> signal.abort());
        return signal;
    }

    public void abort() {
        aborted.complete(null);
    }

    public boolean isAborted() {
        return aborted.isDone();
    }

    public void onAbort(Runnable action) {
        aborted.thenRun(action);
    }

    /**
     * Blocks until the signal fires or the timeout elapses.
     *
     * @return {@code true} if aborted
     */
    public boolean await(Duration timeout) throws InterruptedException {
        if (isAborted()) {
            return true;
        }
        try {
            aborted.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (ExecutionException e) {
            return true;
        }
    }
}
