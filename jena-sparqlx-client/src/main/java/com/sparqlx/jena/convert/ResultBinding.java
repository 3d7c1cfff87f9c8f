package com.sparqlx.jena.convert;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One result row: every variable declared in the results header mapped to
 * its {@link BindingValue}, possibly {@link BindingValue#UNBOUND}.
 *
 * <p>Iteration follows the header's variable order. Equality compares the
 * variable-to-value mapping only.</p>
 */
public final class ResultBinding {
    /** Values keyed by variable name, in header order. */
    private final Map<String, BindingValue> values;

    /**
     * Create a binding from values in header order.
     *
     * @param values variable to value mapping; copied
     */
    public ResultBinding(final Map<String, BindingValue> values) {
        this.values = Collections.unmodifiableMap(
            new LinkedHashMap<>(Objects.requireNonNull(values, "values")));
    }

    /**
     * Returns the value bound to a variable.
     *
     * @param variable the variable name, without {@code ?}
     * @return the value, or {@link BindingValue#UNBOUND} for a variable
     *     that is declared but has no value
     * @throws IllegalArgumentException if the variable is not declared
     */
    public BindingValue get(final String variable) {
        BindingValue value = values.get(variable);
        if (value == null) {
            throw new IllegalArgumentException(
                "Unknown variable '" + variable + "'; declared: "
                    + values.keySet());
        }
        return value;
    }

    /**
     * Returns the plain Java value bound to a variable.
     *
     * @param variable the variable name
     * @return the native value, or null if unbound
     * @see BindingValue#toNative()
     */
    public Object getNative(final String variable) {
        return get(variable).toNative();
    }

    /**
     * Whether the variable has a value in this row.
     *
     * @param variable the variable name
     * @return true if bound
     */
    public boolean isBound(final String variable) {
        BindingValue value = values.get(variable);
        return value != null && !value.isUnbound();
    }

    /**
     * Returns the declared variables in header order.
     *
     * @return the variable names
     */
    public List<String> variables() {
        return List.copyOf(values.keySet());
    }

    /**
     * Returns the row as an unmodifiable map in header order.
     *
     * @return variable to value mapping
     */
    public Map<String, BindingValue> asMap() {
        return values;
    }

    /**
     * Returns the row as a map of plain Java values; unbound variables map
     * to null.
     *
     * @return variable to native value mapping, in header order
     */
    public Map<String, Object> toNativeMap() {
        Map<String, Object> result = new LinkedHashMap<>();
        for (Map.Entry<String, BindingValue> entry : values.entrySet()) {
            result.put(entry.getKey(), entry.getValue().toNative());
        }
        return result;
    }

    @Override
    public boolean equals(final Object other) {
        if (this == other) {
            return true;
        }
        return other instanceof ResultBinding that
            && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
