package dev.mars.commitstream.api.error;

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

/**
 * Raised when a retried operation kept failing with retryable errors until its time budget ran out.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public class RetriesExhaustedException extends CommitStreamException {

    private final int attempts;

    public RetriesExhaustedException(String message, Throwable lastError, int attempts) {
        super(message, lastError);
        this.attempts = attempts;
    }

    public RetriesExhaustedException(Throwable lastError, int attempts) {
        this("Gave up after " + attempts + " attempts: " + lastError.getMessage(), lastError, attempts);
    }

    public Throwable getLastError() {
        return getCause();
    }

    public int getAttempts() {
        return attempts;
    }
}
