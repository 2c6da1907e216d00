package com.quakesieve.core.record;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One row of an output catalog.
 *
 * <p>
 * Fields keep their insertion order: first the input record's fields,
 * verbatim, then (for attributed dependent records) the attribution columns.
 * Jackson serialises the record as a flat object.
 * </p>
 *
 * @since 1.0.0
 */
public class OutputRecord implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Map<String, Object> fields = new LinkedHashMap<>();

    /**
     * Set a field value. Also called by Jackson for every JSON property.
     *
     * @param key   the column name; must not be {@code null}
     * @param value the value
     */
    @JsonAnySetter
    public void setField(String key, Object value) {
        Objects.requireNonNull(key, "Field key must not be null");
        fields.put(key, value);
    }

    /**
     * @return unmodifiable map of column names to values, in column order
     */
    @JsonAnyGetter
    public Map<String, Object> getFields() {
        return Collections.unmodifiableMap(fields);
    }

    public Optional<Object> getField(String key) {
        return Optional.ofNullable(fields.get(key));
    }

    public boolean hasField(String key) {
        return fields.containsKey(key);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof OutputRecord that))
            return false;
        return fields.equals(that.fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "OutputRecord" + fields;
    }
}
