package me.golemcore.chains.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.chains.domain.exception.KeyMismatchException;
import me.golemcore.chains.domain.exception.MissingVariableException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable mapping of variable names to values flowing in and out of chains.
 * Values are text, a list of {@link Message}, a list of {@link Document} or
 * nested maps. Every mutator returns a new instance.
 */
public final class ChainValues {

    private static final ChainValues EMPTY = new ChainValues(Map.of());

    private final Map<String, Object> values;

    private ChainValues(Map<String, Object> values) {
        this.values = values;
    }

    public static ChainValues empty() {
        return EMPTY;
    }

    public static ChainValues of(String key, Object value) {
        return empty().with(key, value);
    }

    public static ChainValues of(String k1, Object v1, String k2, Object v2) {
        return empty().with(k1, v1).with(k2, v2);
    }

    public static ChainValues from(Map<String, ?> source) {
        if (source == null || source.isEmpty()) {
            return EMPTY;
        }
        return new ChainValues(Collections.unmodifiableMap(new LinkedHashMap<>(source)));
    }

    /**
     * Returns a copy with {@code key} set to {@code value}, replacing any previous
     * value.
     */
    public ChainValues with(String key, Object value) {
        Objects.requireNonNull(key, "key");
        Map<String, Object> copy = new LinkedHashMap<>(values);
        copy.put(key, value);
        return new ChainValues(Collections.unmodifiableMap(copy));
    }

    /**
     * Returns a copy without the given key.
     */
    public ChainValues without(String key) {
        if (!values.containsKey(key)) {
            return this;
        }
        Map<String, Object> copy = new LinkedHashMap<>(values);
        copy.remove(key);
        return new ChainValues(Collections.unmodifiableMap(copy));
    }

    /**
     * Combines two mappings. A key present in both is a wiring error.
     *
     * @throws KeyMismatchException
     *             if a key is present on both sides
     */
    public ChainValues merge(ChainValues other) {
        if (other == null || other.isEmpty()) {
            return this;
        }
        Map<String, Object> copy = new LinkedHashMap<>(values);
        for (Map.Entry<String, Object> entry : other.values.entrySet()) {
            if (copy.containsKey(entry.getKey())) {
                throw new KeyMismatchException("Output key '" + entry.getKey() + "' collides with an existing value");
            }
            copy.put(entry.getKey(), entry.getValue());
        }
        return new ChainValues(Collections.unmodifiableMap(copy));
    }

    public boolean containsKey(String key) {
        return values.containsKey(key);
    }

    public Object get(String key) {
        return values.get(key);
    }

    /**
     * Reads a required text value.
     *
     * @throws MissingVariableException
     *             if the key is absent
     */
    public String getText(String key) {
        if (!values.containsKey(key)) {
            throw new MissingVariableException(key);
        }
        Object value = values.get(key);
        return value != null ? value.toString() : "";
    }

    /**
     * Reads a message list, returning an empty list when the key is absent.
     */
    @SuppressWarnings("unchecked")
    public List<Message> getMessages(String key) {
        Object value = values.get(key);
        if (value == null) {
            return List.of();
        }
        if (value instanceof List<?> list && list.stream().allMatch(Message.class::isInstance)) {
            return (List<Message>) list;
        }
        throw new IllegalArgumentException("Value '" + key + "' is not a message list");
    }

    /**
     * Reads a document list, returning an empty list when the key is absent.
     */
    @SuppressWarnings("unchecked")
    public List<Document> getDocuments(String key) {
        Object value = values.get(key);
        if (value == null) {
            return List.of();
        }
        if (value instanceof List<?> list && list.stream().allMatch(Document.class::isInstance)) {
            return (List<Document>) list;
        }
        throw new IllegalArgumentException("Value '" + key + "' is not a document list");
    }

    public Set<String> keySet() {
        return values.keySet();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ChainValues other)) {
            return false;
        }
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "ChainValues" + values;
    }
}
