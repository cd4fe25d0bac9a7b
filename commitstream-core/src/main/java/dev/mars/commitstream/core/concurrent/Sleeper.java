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

/**
 * Waits for a duration unless the abort signal fires first.
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * @return {@code true} if the full duration elapsed, {@code false} if cut short by an abort
     */
    boolean sleep(Duration duration, AbortSignal abortSignal) throws InterruptedException;

    static Sleeper system() {
        return (duration, abortSignal) -> !abortSignal.await(duration);
    }
}
