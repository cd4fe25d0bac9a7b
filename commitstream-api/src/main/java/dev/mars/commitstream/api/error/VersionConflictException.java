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

import dev.mars.commitstream.api.Commit;

/**
 * Raised by a store when a commit targets a version that a concurrent writer already used.
 *
 * This is the expected outcome of an optimistic-concurrency collision and is the error
 * that version-conflict retries classify as retryable.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public class VersionConflictException extends CommitStreamException {

    private final transient Commit commit;

    public VersionConflictException(Commit commit) {
        super(commit.getAggregateType() + "<" + commit.getAggregateKey() + "> already has version " +
              commit.getAggregateVersion());
        this.commit = commit;
    }

    public VersionConflictException(String message) {
        super(message);
        this.commit = null;
    }

    /**
     * The rejected commit, or {@code null} when the store could not supply it.
     */
    public Commit getCommit() {
        return commit;
    }
}
