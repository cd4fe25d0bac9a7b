package dev.mars.commitstream.core.poll;

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

import dev.mars.commitstream.core.backoff.BackoffParams;
import dev.mars.commitstream.core.backoff.JitteredBackoff;
import dev.mars.commitstream.core.concurrent.AbortSignal;
import dev.mars.commitstream.core.concurrent.Sleeper;
import dev.mars.commitstream.core.metrics.CommitStreamMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.function.DoubleSupplier;
import java.util.function.Supplier;

/**
 * Turns a finite poll function into an unbounded, blocking sequence.
 *
 * <p>Every item of a poll is yielded as {@code Optional.of(item)} as soon as the poll produces
 * it. A poll that produces nothing yields a single {@code Optional.empty()} marker and is followed
 * by a backoff delay that grows with the number of consecutive empty polls; any real item resets
 * that count. Only one poll is in flight at a time.</p>
 *
 * <p>Aborting cuts a pending delay short and ends the sequence once the current poll has been
 * read; no poll is started after the abort.</p>
 *
 * @param <T> item type
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public class PollLoop<T> implements Iterable<Optional<T>> {
    private static final Logger logger = LoggerFactory.getLogger(PollLoop.class);

    private final Supplier<? extends Iterable<? extends T>> pollFn;
    private final JitteredBackoff backoff;
    private final AbortSignal abortSignal;
    private final Sleeper sleeper;
    private final CommitStreamMetrics metrics;

    private PollLoop(Builder<T> builder) {
        this.pollFn = Objects.requireNonNull(builder.pollFn, "Poll function cannot be null");
        this.backoff = builder.random != null
            ? new JitteredBackoff(builder.backoff, builder.random)
            : new JitteredBackoff(builder.backoff);
        this.abortSignal = builder.abortSignal != null ? builder.abortSignal : AbortSignal.create();
        this.sleeper = builder.sleeper != null ? builder.sleeper : Sleeper.system();
        this.metrics = builder.metrics != null ? builder.metrics : CommitStreamMetrics.noop();
    }

    public static <T> Builder<T> builder(Supplier<? extends Iterable<? extends T>> pollFn) {
        return new Builder<T>().pollFn(pollFn);
    }

    @Override
    public Iterator<Optional<T>> iterator() {
        return new PollIterator();
    }

    public AbortSignal getAbortSignal() {
        return abortSignal;
    }

    private final class PollIterator implements Iterator<Optional<T>> {
        private Iterator<? extends T> currentPoll;
        private int itemsInCurrentPoll;
        private int consecutiveEmptyPolls;
        private boolean sleepPending;
        private Optional<T> next;
        private boolean finished;

        @Override
        public boolean hasNext() {
            if (next != null) {
                return true;
            }
            if (finished) {
                return false;
            }

            while (true) {
                if (currentPoll == null) {
                    if (abortSignal.isAborted()) {
                        finished = true;
                        return false;
                    }
                    if (sleepPending && !sleepBeforeNextPoll()) {
                        finished = true;
                        return false;
                    }
                    currentPoll = pollFn.get().iterator();
                    itemsInCurrentPoll = 0;
                }

                if (currentPoll.hasNext()) {
                    next = Optional.of(currentPoll.next());
                    itemsInCurrentPoll++;
                    consecutiveEmptyPolls = 0;
                    return true;
                }

                metrics.recordPoll(itemsInCurrentPoll);
                currentPoll = null;
                if (itemsInCurrentPoll == 0) {
                    consecutiveEmptyPolls++;
                    sleepPending = true;
                    next = Optional.empty();
                    return true;
                }
            }
        }

        @Override
        public Optional<T> next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            Optional<T> result = next;
            next = null;
            return result;
        }

        private boolean sleepBeforeNextPoll() {
            sleepPending = false;
            Duration delay = backoff.delay(consecutiveEmptyPolls);
            logger.debug("{} consecutive empty polls, sleeping {} ms", consecutiveEmptyPolls, delay.toMillis());
            try {
                return sleeper.sleep(delay, abortSignal) && !abortSignal.isAborted();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.debug("Poll loop interrupted while sleeping, stopping");
                return false;
            }
        }
    }

    public static class Builder<T> {
        private Supplier<? extends Iterable<? extends T>> pollFn;
        private BackoffParams backoff = new BackoffParams(10, 1000, 2);
        private AbortSignal abortSignal;
        private Sleeper sleeper;
        private DoubleSupplier random;
        private CommitStreamMetrics metrics;

        public Builder<T> pollFn(Supplier<? extends Iterable<? extends T>> pollFn) {
            this.pollFn = pollFn;
            return this;
        }

        public Builder<T> backoff(BackoffParams backoff) {
            this.backoff = Objects.requireNonNull(backoff, "Backoff cannot be null");
            return this;
        }

        public Builder<T> abortSignal(AbortSignal abortSignal) {
            this.abortSignal = abortSignal;
            return this;
        }

        public Builder<T> sleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        public Builder<T> random(DoubleSupplier random) {
            this.random = random;
            return this;
        }

        public Builder<T> metrics(CommitStreamMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public PollLoop<T> build() {
            return new PollLoop<>(this);
        }
    }
}
