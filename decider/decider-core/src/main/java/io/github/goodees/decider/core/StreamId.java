package io.github.goodees.decider.core;

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

import java.util.Objects;

/**
 * Identity of a single event stream. A stream belongs to a category (the kind of aggregate, e. g. {@code ShoppingCart})
 * and is distinguished within it by a key. The string form {@code category-key} identifies the physical stream in the
 * store.
 */
public final class StreamId {
    public static final char SEPARATOR = '-';

    private final String category;
    private final String key;

    private StreamId(String category, String key) {
        this.category = category;
        this.key = key;
    }

    /**
     * Create stream identity.
     * @param category the category, non-empty and without {@value #SEPARATOR}
     * @param key the key within category, non-empty
     * @return the identity
     */
    public static StreamId of(String category, String key) {
        checkCategory(category);
        Objects.requireNonNull(key, "Key must be specified");
        if (key.isEmpty()) {
            throw new IllegalArgumentException("Stream key of category " + category + " is empty");
        }
        return new StreamId(category, key);
    }

    static String checkCategory(String category) {
        Objects.requireNonNull(category, "Category must be specified");
        if (category.isEmpty() || category.indexOf(SEPARATOR) >= 0) {
            throw new IllegalArgumentException("Invalid stream category '" + category + "'");
        }
        return category;
    }

    /**
     * Parse the string form. Category ends at first separator, rest is the key.
     * @param streamName stream name as returned by {@link #toString()}
     * @return the identity
     */
    public static StreamId parse(String streamName) {
        Objects.requireNonNull(streamName, "Stream name must be specified");
        int separator = streamName.indexOf(SEPARATOR);
        if (separator < 0) {
            throw new IllegalArgumentException("Stream name '" + streamName + "' has no category");
        }
        return of(streamName.substring(0, separator), streamName.substring(separator + 1));
    }

    public String getCategory() {
        return category;
    }

    public String getKey() {
        return key;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        StreamId that = (StreamId) o;
        return category.equals(that.category) && key.equals(that.key);
    }

    @Override
    public int hashCode() {
        return Objects.hash(category, key);
    }

    @Override
    public String toString() {
        return category + SEPARATOR + key;
    }
}
