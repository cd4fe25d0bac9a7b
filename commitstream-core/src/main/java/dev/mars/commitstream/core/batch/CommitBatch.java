package dev.mars.commitstream.core.batch;

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
 * One batch of mutually independent commits.
 *
 * @param commits commits safe to process concurrently
 * @param progressCursor highest chronological key with no unprocessed commit at or below it,
 *                       or {@code null} while no such point exists yet
 */
public record CommitBatch(List<Commit> commits, String progressCursor) {

    public CommitBatch {
        commits = List.copyOf(commits);
    }

    public int size() {
        return commits.size();
    }
}
