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

/**
 * Caller-declared ordering between commits of different streams.
 *
 * <p>{@code isDependent(candidate, existing)} returns {@code true} when {@code candidate} must
 * be processed after {@code existing}. The relation need not be symmetric; the batcher checks
 * both argument orders where that matters.</p>
 */
@FunctionalInterface
public interface CommitDependency {

    CommitDependency NONE = (candidate, existing) -> false;

    boolean isDependent(Commit candidate, Commit existing);

    /**
     * Every commit of {@code dependerType} follows every commit of {@code dependeeType}.
     */
    static CommitDependency byType(String dependerType, String dependeeType) {
        return (candidate, existing) -> candidate.getAggregateType().equals(dependerType)
            && existing.getAggregateType().equals(dependeeType);
    }

    default CommitDependency or(CommitDependency other) {
        return (candidate, existing) -> isDependent(candidate, existing) || other.isDependent(candidate, existing);
    }
}
