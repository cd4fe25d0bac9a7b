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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NavigableSet;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Splits an ordered commit stream into batches whose commits may be processed concurrently.
 *
 * <p>No batch holds two commits of the same stream, and no batch holds a pair for which the
 * {@link CommitDependency} holds in either order. Commits that cannot join the current batch wait
 * in a bounded backlog and are promoted, in arrival order, as soon as they can. A backlogged
 * commit never lets a later commit of its own stream, or a later commit that depends on it, get
 * ahead of it.</p>
 *
 * <p>Each batch carries a progress cursor: the highest chronological key yielded so far that is
 * still below every backlogged commit. Persisting it after the batch is processed gives a resume
 * point that never skips unprocessed work. The cursor never moves backwards.</p>
 *
 * <p>The input may be finite ({@link #of}) or a live feed ({@link #live}) whose
 * {@code Optional.empty()} markers flush a partial batch instead of waiting for more commits.
 * Input is expected in chronological key order.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public class ParallelizableCommitBatcher implements Iterable<CommitBatch> {
    private static final Logger logger = LoggerFactory.getLogger(ParallelizableCommitBatcher.class);

    private final Iterable<Optional<Commit>> source;
    private final BatcherOptions options;

    private ParallelizableCommitBatcher(Iterable<Optional<Commit>> source, BatcherOptions options) {
        this.source = source;
        this.options = options;
    }

    public static ParallelizableCommitBatcher of(Iterable<Commit> commits, BatcherOptions options) {
        Iterable<Optional<Commit>> source = () -> {
            Iterator<Commit> iterator = commits.iterator();
            return new Iterator<>() {
                @Override
                public boolean hasNext() {
                    return iterator.hasNext();
                }

                @Override
                public Optional<Commit> next() {
                    return Optional.of(iterator.next());
                }
            };
        };
        return new ParallelizableCommitBatcher(source, options);
    }

    public static ParallelizableCommitBatcher live(Iterable<Optional<Commit>> feed, BatcherOptions options) {
        return new ParallelizableCommitBatcher(feed, options);
    }

    @Override
    public Iterator<CommitBatch> iterator() {
        return new BatchIterator(source.iterator());
    }

    private final class BatchIterator implements Iterator<CommitBatch> {
        private final Iterator<Optional<Commit>> upstream;
        private final List<Commit> backlog = new ArrayList<>();
        private final NavigableSet<String> yieldedKeys = new TreeSet<>();
        private boolean upstreamExhausted;
        private String reportedCursor;
        private CommitBatch next;
        private boolean finished;

        BatchIterator(Iterator<Optional<Commit>> upstream) {
            this.upstream = upstream;
        }

        @Override
        public boolean hasNext() {
            if (next != null) {
                return true;
            }
            if (finished) {
                return false;
            }
            next = computeNext();
            if (next == null) {
                finished = true;
                return false;
            }
            return true;
        }

        @Override
        public CommitBatch next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            CommitBatch batch = next;
            next = null;
            return batch;
        }

        private CommitBatch computeNext() {
            int maxBatchSize = options.getMaxBatchSize();

            while (true) {
                if (options.getAbortSignal().isAborted()) {
                    logger.debug("Batcher aborted with {} commits in backlog", backlog.size());
                    return null;
                }

                List<Commit> batch = new ArrayList<>();
                promoteFromBacklog(batch);

                while (!upstreamExhausted && batch.size() < maxBatchSize
                        && backlog.size() < options.getMaxBacklogSize()) {
                    if (!upstream.hasNext()) {
                        upstreamExhausted = true;
                        break;
                    }
                    Optional<Commit> item = upstream.next();
                    if (item.isEmpty()) {
                        break;
                    }
                    Commit commit = item.get();
                    if (isIndependent(commit, batch, backlog)) {
                        batch.add(commit);
                    } else {
                        backlog.add(commit);
                    }
                }

                if (!batch.isEmpty()) {
                    String cursor = progressCursor(batch);
                    options.getMetrics().recordBatch(batch.size(), backlog.size());
                    logger.debug("Yielding batch of {} commits, backlog {}, progress cursor {}",
                        batch.size(), backlog.size(), cursor);
                    return new CommitBatch(batch, cursor);
                }

                if (upstreamExhausted && backlog.isEmpty()) {
                    return null;
                }
            }
        }

        private void promoteFromBacklog(List<Commit> batch) {
            int i = 0;
            while (i < backlog.size() && batch.size() < options.getMaxBatchSize()) {
                Commit candidate = backlog.get(i);
                if (isIndependent(candidate, batch, backlog.subList(0, i))) {
                    batch.add(candidate);
                    backlog.remove(i);
                } else {
                    i++;
                }
            }
        }

        private boolean isIndependent(Commit candidate, List<Commit> batch, List<Commit> earlierBacklog) {
            CommitDependency dependency = options.getIsDependent();
            for (Commit member : batch) {
                if (candidate.isSameStream(member)
                        || dependency.isDependent(candidate, member)
                        || dependency.isDependent(member, candidate)) {
                    return false;
                }
            }
            for (Commit waiting : earlierBacklog) {
                if (candidate.isSameStream(waiting) || dependency.isDependent(candidate, waiting)) {
                    return false;
                }
            }
            return true;
        }

        private String progressCursor(List<Commit> batch) {
            for (Commit commit : batch) {
                yieldedKeys.add(commit.getChronologicalKey());
            }

            String candidate;
            if (backlog.isEmpty()) {
                candidate = yieldedKeys.last();
            } else {
                String earliestWaiting = backlog.get(0).getChronologicalKey();
                for (Commit waiting : backlog) {
                    if (waiting.getChronologicalKey().compareTo(earliestWaiting) < 0) {
                        earliestWaiting = waiting.getChronologicalKey();
                    }
                }
                candidate = yieldedKeys.lower(earliestWaiting);
            }

            if (candidate != null && (reportedCursor == null || candidate.compareTo(reportedCursor) > 0)) {
                reportedCursor = candidate;
                yieldedKeys.headSet(reportedCursor, false).clear();
            }
            return reportedCursor;
        }
    }
}
