package io.github.goodees.decider.store.inmemory;

/*-
 * #%L
 * decider
 * %%
 * Copyright (C) 2017 - 2018 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import io.github.goodees.decider.core.StreamId;
import io.github.goodees.decider.core.store.EventData;
import io.github.goodees.decider.core.store.EventRecord;
import io.github.goodees.decider.core.store.StoredEvents;
import io.github.goodees.decider.core.store.StreamStore;
import io.github.goodees.decider.core.store.StreamStoreException;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.BiFunction;
import java.util.function.Consumer;

/**
 * Keeps streams in memory. Suitable for tests, and for aggregates that need not survive the process.
 */
public class InMemoryStreamStore implements StreamStore {
    private final ConcurrentMap<StreamId, List<EventRecord>> storage = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryStreamStore() {
        this(Clock.systemUTC());
    }

    public InMemoryStreamStore(Clock clock) {
        this.clock = clock;
    }

    private List<EventRecord> streamLog(StreamId streamId) {
        return storage.computeIfAbsent(streamId, (i) -> new ArrayList<>());
    }

    @Override
    public long append(StreamId streamId, long expectedVersion, List<EventData> events) throws StreamStoreException {
        if (expectedVersion < NO_STREAM) {
            throw StreamStoreException.invalidVersion(streamId, expectedVersion);
        }
        if (events.isEmpty()) {
            return expectedVersion;
        }
        List<EventRecord> log = streamLog(streamId);
        synchronized (log) {
            long actualVersion = log.size();
            if (actualVersion != expectedVersion) {
                throw StreamStoreException.versionConflict(streamId, expectedVersion, actualVersion);
            }
            Instant now = clock.instant();
            long version = expectedVersion;
            for (EventData event : events) {
                log.add(EventRecord.of(streamId, ++version, event, now));
            }
            return version;
        }
    }

    @Override
    public long currentVersion(StreamId streamId) {
        List<EventRecord> log = storage.get(streamId);
        if (log == null) {
            return NO_STREAM;
        }
        synchronized (log) {
            return log.size();
        }
    }

    @Override
    public StoredEvents readForward(StreamId streamId, long afterVersion) {
        List<EventRecord> log = storage.get(streamId);
        List<EventRecord> found = new ArrayList<>();
        if (log != null) {
            synchronized (log) {
                // versions are positions, so the tail is a plain sublist
                if (afterVersion < log.size()) {
                    found.addAll(log.subList((int) Math.max(afterVersion, 0), log.size()));
                }
            }
        }
        return new ListStoredEvents(found);
    }

    static class ListStoredEvents implements StoredEvents {
        private final List<EventRecord> records;
        private boolean stop = false;

        ListStoredEvents(List<EventRecord> records) {
            this.records = records;
        }

        @Override
        public void foreach(Consumer<? super EventRecord> consumer) {
            for (EventRecord record : records) {
                if (stop) {
                    break;
                }
                consumer.accept(record);
            }
        }

        @Override
        public <R> R reduce(R initial, BiFunction<R, ? super EventRecord, R> reducer) {
            R result = initial;
            for (EventRecord record : records) {
                if (stop) {
                    break;
                }
                result = reducer.apply(result, record);
            }
            return result;
        }

        @Override
        public void stop() {
            stop = true;
        }

        @Override
        public void close() {
        }
    }
}
