package dev.mars.commitstream.api.store;

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

import java.util.List;

/**
 * One page of a commit query.
 *
 * @param commits       the commits of this page, in query order
 * @param cursor        a resume position reported by the store, or {@code null}; when present it may be
 *                      ahead of the last commit because the store scanned a range with no matching commits
 * @param scannedCount  number of records the store examined to produce this page
 * @param throttleCount number of times the store throttled while producing this page
 */
public record CommitResultSet(List<Commit> commits, String cursor, int scannedCount, int throttleCount) {

    public CommitResultSet {
        commits = commits != null ? List.copyOf(commits) : List.of();
    }

    public static CommitResultSet of(List<Commit> commits) {
        return new CommitResultSet(commits, null, commits.size(), 0);
    }

    public static CommitResultSet of(List<Commit> commits, String cursor) {
        return new CommitResultSet(commits, cursor, commits.size(), 0);
    }

    public boolean isEmpty() {
        return commits.isEmpty();
    }
}
