package com.agentorchestra.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Structured output of one capability invocation.
 *
 * Every agent returns a JSON object with at least a {@code summary} field
 * plus agent-specific detail ({@code structure}, {@code requirements},
 * {@code architecture}, {@code plan}, ...). Pipeline stages read those
 * fields through {@link #section(String)}, which substitutes an empty
 * object when a field is missing so a sparse upstream answer degrades the
 * next stage's input instead of failing the run.
 *
 * The content is frozen on construction, nested values included, so an
 * output handed to a later stage cannot change what an earlier stage reported.
 */
public final class AgentOutput {

    public static final String SUMMARY = "summary";

    private final Map<String, Object> fields;

    /** Deep-copies {@code fields}; nested objects and arrays are frozen as well. */
    @JsonCreator
    public AgentOutput(Map<String, Object> fields) {
        this.fields = freezeObject(fields == null ? Map.of() : fields);
    }

    public static AgentOutput of(Map<String, Object> fields) {
        return new AgentOutput(fields);
    }

    @JsonValue
    public Map<String, Object> fields() {
        return fields;
    }

    public Optional<String> summary() {
        return field(SUMMARY).map(String::valueOf);
    }

    public Optional<Object> field(String name) {
        return Optional.ofNullable(fields.get(name));
    }

    /**
     * The named field as a JSON object, following the substitution rule
     * of {@link #asObject(Object)}.
     */
    public Map<String, Object> section(String name) {
        return asObject(fields.get(name));
    }

    /**
     * Coerce a loosely-typed JSON value into an object.
     *
     * <ul>
     *   <li>null / absent: empty object</li>
     *   <li>an object: a copy of it, keys stringified</li>
     *   <li>anything else (list, string, number): {@code {"value": v}}</li>
     * </ul>
     */
    public static Map<String, Object> asObject(Object value) {
        if (value == null) {
            return new LinkedHashMap<>();
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), v));
            return copy;
        }
        Map<String, Object> wrapped = new LinkedHashMap<>();
        wrapped.put("value", value);
        return wrapped;
    }

    /**
     * Immutable deep copy of a JSON-like value: objects become unmodifiable
     * ordered maps, arrays unmodifiable lists, scalars are kept as they are.
     */
    static Object freeze(Object value) {
        if (value instanceof Map<?, ?> map) {
            return freezeObject(map);
        }
        if (value instanceof Collection<?> items) {
            List<Object> copy = new ArrayList<>(items.size());
            for (Object item : items) {
                copy.add(freeze(item));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }

    private static Map<String, Object> freezeObject(Map<?, ?> map) {
        Map<String, Object> copy = new LinkedHashMap<>();
        map.forEach((k, v) -> copy.put(String.valueOf(k), freeze(v)));
        return Collections.unmodifiableMap(copy);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof AgentOutput other && fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "AgentOutput" + fields;
    }
}
