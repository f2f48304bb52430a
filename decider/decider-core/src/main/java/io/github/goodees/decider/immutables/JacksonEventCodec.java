package io.github.goodees.decider.immutables;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.github.goodees.decider.core.codec.EventCodec;
import io.github.goodees.decider.core.codec.EventType;
import io.github.goodees.decider.core.store.EventData;
import io.github.goodees.decider.core.store.EventRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;

/**
 * JSON codec of events. Every event class is registered under a type tag, the tag is stored alongside the JSON payload
 * and selects the class to read the payload into.
 *
 * <p>Events are usually <a href="http://immutables.github.io">Immutables</a> values in a package annotated with
 * {@link ImmutablesSupport}, and the abstract value type is registered:
 * <pre>
 * JacksonEventCodec.builder(CartEvent.class)
 *         .register(ItemAdded.class)          // tag ItemAdded
 *         .register("ProductAdded", ItemAdded.class) // legacy tag, still readable
 *         .build();
 * </pre>
 * The mapper ignores unknown properties, and missing optional properties or properties with
 * {@code @Value.Default} get their defaults, so additive changes of events need no new tag.</p>
 *
 * @param <E> base type of events
 */
public class JacksonEventCodec<E> implements EventCodec<E> {
    private static final Logger logger = LoggerFactory.getLogger(JacksonEventCodec.class);
    private static final byte[] NO_METADATA = new byte[0];
    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<Map<String, Object>>() {
    };

    private final ObjectMapper mapper;
    private final Map<String, Class<? extends E>> classesByType;
    private final Map<Class<? extends E>, String> typesByClass;
    private final ConcurrentMap<Class<?>, String> resolvedTypes = new ConcurrentHashMap<>();
    private final Function<? super E, ? extends Map<String, ?>> metadata;

    private JacksonEventCodec(Builder<E> b) {
        this.mapper = b.mapper;
        this.classesByType = Collections.unmodifiableMap(new LinkedHashMap<>(b.classesByType));
        this.typesByClass = Collections.unmodifiableMap(new LinkedHashMap<>(b.typesByClass));
        this.metadata = b.metadata;
    }

    public static <E> Builder<E> builder(Class<E> baseType) {
        return new Builder<>(baseType);
    }

    /**
     * Object mapper with the settings the codec needs: JDK 8 and java.time support, ISO dates and tolerance to
     * unknown properties.
     * @return new mapper instance
     */
    public static ObjectMapper createMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModules(new Jdk8Module(), new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Override
    public EventData encode(E event) {
        Objects.requireNonNull(event, "Event must be specified");
        String type = typeOf(event);
        try {
            byte[] payload = mapper.writeValueAsBytes(event);
            byte[] meta = metadata == null ? NO_METADATA : mapper.writeValueAsBytes(metadata.apply(event));
            return new EventData(type, payload, meta);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize event " + event, e);
        }
    }

    @Override
    public Optional<E> tryDecode(EventRecord record) {
        Class<? extends E> eventClass = classesByType.get(record.getType());
        if (eventClass == null) {
            logger.debug("{} skipping event {} of unknown type {}", record.getStreamId(), record.getVersion(),
                record.getType());
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readValue(record.getPayload(), eventClass));
        } catch (IOException e) {
            throw new IllegalArgumentException(record.getStreamId() + " could not deserialize event "
                    + record.getVersion() + " of type " + record.getType(), e);
        }
    }

    /**
     * Read metadata written by the metadata function.
     * @param record stored record
     * @return metadata entries, empty if the record has no metadata
     */
    public Map<String, Object> readMetadata(EventRecord record) {
        byte[] meta = record.getMetadata();
        if (meta.length == 0) {
            return Collections.emptyMap();
        }
        try {
            return mapper.readValue(meta, METADATA_TYPE);
        } catch (IOException e) {
            throw new IllegalArgumentException(record.getStreamId() + " has unreadable metadata at version "
                    + record.getVersion(), e);
        }
    }

    /**
     * Type tag an event is encoded with.
     * @param event the event
     * @return tag of the first registered class the event is instance of
     * @throws IllegalArgumentException when no registered class matches
     */
    public String typeOf(E event) {
        return resolvedTypes.computeIfAbsent(event.getClass(), this::resolveType);
    }

    private String resolveType(Class<?> eventClass) {
        for (Map.Entry<Class<? extends E>, String> entry : typesByClass.entrySet()) {
            if (entry.getKey().isAssignableFrom(eventClass)) {
                return entry.getValue();
            }
        }
        throw new IllegalArgumentException("Unsupported event type: " + eventClass.getName());
    }

    public static class Builder<E> {
        private final Class<E> baseType;
        private ObjectMapper mapper;
        private final Map<String, Class<? extends E>> classesByType = new LinkedHashMap<>();
        private final Map<Class<? extends E>, String> typesByClass = new LinkedHashMap<>();
        private Function<? super E, ? extends Map<String, ?>> metadata;

        Builder(Class<E> baseType) {
            this.baseType = Objects.requireNonNull(baseType, "Base type must be specified");
        }

        /**
         * Use specific mapper. It should be configured at least like {@link #createMapper()}.
         * @param mapper the mapper
         * @return this builder
         */
        public Builder<E> mapper(ObjectMapper mapper) {
            this.mapper = Objects.requireNonNull(mapper, "Mapper must be specified");
            return this;
        }

        /**
         * Register event class under its {@linkplain EventType#defaultTypeName(Class) default type name}.
         * @param eventClass the class
         * @return this builder
         */
        public Builder<E> register(Class<? extends E> eventClass) {
            return register(EventType.defaultTypeName(eventClass), eventClass);
        }

        /**
         * Register event class under a tag. The first tag registered for a class is used for encoding, further ones
         * are only read.
         * @param type type tag
         * @param eventClass the class
         * @return this builder
         */
        public Builder<E> register(String type, Class<? extends E> eventClass) {
            Objects.requireNonNull(type, "Type must be specified");
            Objects.requireNonNull(eventClass, "Event class must be specified");
            if (!baseType.isAssignableFrom(eventClass)) {
                throw new IllegalArgumentException(eventClass.getName() + " is not a " + baseType.getName());
            }
            Class<? extends E> previous = classesByType.putIfAbsent(type, eventClass);
            if (previous != null && previous != eventClass) {
                throw new IllegalArgumentException("Type " + type + " is already registered for " + previous.getName());
            }
            typesByClass.putIfAbsent(eventClass, type);
            return this;
        }

        /**
         * Metadata stored with every event, as JSON object.
         * @param metadata function creating metadata entries of an event
         * @return this builder
         */
        public Builder<E> metadata(Function<? super E, ? extends Map<String, ?>> metadata) {
            this.metadata = metadata;
            return this;
        }

        public JacksonEventCodec<E> build() {
            if (classesByType.isEmpty()) {
                throw new IllegalStateException("No event types of " + baseType.getName() + " registered");
            }
            if (mapper == null) {
                mapper = createMapper();
            }
            return new JacksonEventCodec<>(this);
        }
    }
}
