package com.java.vidigal.deepl.request;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;

/**
 * The form fields of one outbound request, before encoding.
 * <p>
 * A name maps to one or more values. {@link #set(String, String)} replaces whatever the name held,
 * {@link #add(String, String)} appends. Not thread-safe: a bag belongs to the request being built.
 * </p>
 *
 * @author Vidigal
 */
public final class FormParameters {

    private final Map<String, List<String>> values = new LinkedHashMap<>();

    /**
     * Replaces all values of a parameter with a single value.
     *
     * @param name  the parameter name
     * @param value the value
     * @return this bag
     */
    public FormParameters set(String name, String value) {
        List<String> single = new ArrayList<>(1);
        single.add(requireValue(name, value));
        values.put(requireName(name), single);
        return this;
    }

    /**
     * Appends a value to a parameter, keeping the values it already has.
     *
     * @param name  the parameter name
     * @param value the value
     * @return this bag
     */
    public FormParameters add(String name, String value) {
        values.computeIfAbsent(requireName(name), k -> new ArrayList<>()).add(requireValue(name, value));
        return this;
    }

    /**
     * Replaces all values of a parameter with the given values, in order.
     *
     * @param name      the parameter name
     * @param newValues the values
     * @return this bag
     */
    public FormParameters setAll(String name, List<String> newValues) {
        List<String> copy = new ArrayList<>(newValues.size());
        for (String value : newValues) {
            copy.add(requireValue(name, value));
        }
        values.put(requireName(name), copy);
        return this;
    }

    /**
     * Removes a parameter.
     *
     * @param name the parameter name
     * @return this bag
     */
    public FormParameters remove(String name) {
        values.remove(name);
        return this;
    }

    /**
     * Returns the first value of a parameter.
     *
     * @param name the parameter name
     * @return the value, or null if the parameter is absent
     */
    public String get(String name) {
        List<String> list = values.get(name);
        return list == null || list.isEmpty() ? null : list.get(0);
    }

    /**
     * Returns all values of a parameter.
     *
     * @param name the parameter name
     * @return an unmodifiable list, empty if the parameter is absent
     */
    public List<String> getAll(String name) {
        List<String> list = values.get(name);
        return list == null ? List.of() : Collections.unmodifiableList(list);
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(values.keySet());
    }

    /**
     * Returns an independent copy of this bag.
     *
     * @return the copy
     */
    public FormParameters copy() {
        FormParameters copy = new FormParameters();
        values.forEach((name, list) -> copy.values.put(name, new ArrayList<>(list)));
        return copy;
    }

    /**
     * Encodes the bag as {@code application/x-www-form-urlencoded} UTF-8 text. A parameter with several
     * values appears once per value.
     *
     * @return the encoded form
     */
    public String encode() {
        StringJoiner joiner = new StringJoiner("&");
        values.forEach((name, list) -> {
            String encodedName = URLEncoder.encode(name, StandardCharsets.UTF_8);
            for (String value : list) {
                joiner.add(encodedName + "=" + URLEncoder.encode(value, StandardCharsets.UTF_8));
            }
        });
        return joiner.toString();
    }

    @Override
    public boolean equals(Object o) {
        return this == o || o instanceof FormParameters other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }

    private static String requireName(String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Parameter name cannot be null or empty");
        }
        return name;
    }

    private static String requireValue(String name, String value) {
        if (value == null) {
            throw new IllegalArgumentException("Value of parameter '" + name + "' cannot be null");
        }
        return value;
    }
}
