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

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

import dev.mars.commitstream.test.fixtures.MutableClock;

/**
 * Sleeper for tests: records requested delays and returns at once, optionally moving a
 * {@link MutableClock} forward by the delay.
 */
public class RecordingSleeper implements Sleeper {

    private final List<Duration> sleeps = new CopyOnWriteArrayList<>();
    private final MutableClock clock;
    private volatile Consumer<Integer> onSleep = count -> { };

    public RecordingSleeper() {
        this(null);
    }

    public RecordingSleeper(MutableClock clock) {
        this.clock = clock;
    }

    /**
     * Runs after each recorded sleep with the number of sleeps so far.
     */
    public RecordingSleeper onSleep(Consumer<Integer> action) {
        this.onSleep = action;
        return this;
    }

    @Override
    public boolean sleep(Duration duration, AbortSignal abortSignal) {
        if (abortSignal.isAborted()) {
            return false;
        }
        sleeps.add(duration);
        if (clock != null) {
            clock.advance(duration);
        }
        onSleep.accept(sleeps.size());
        return !abortSignal.isAborted();
    }

    public List<Duration> getSleeps() {
        return List.copyOf(sleeps);
    }

    public Clock getClock() {
        return clock;
    }
}
