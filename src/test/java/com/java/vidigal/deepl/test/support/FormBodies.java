package com.java.vidigal.deepl.test.support;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decodes {@code application/x-www-form-urlencoded} bodies so tests can assert on single fields.
 */
public final class FormBodies {

    private FormBodies() {
    }

    /**
     * Parses a form body into a multi-map, keeping value order.
     *
     * @param body the encoded body
     * @return parameter name to values
     */
    public static Map<String, List<String>> parse(String body) {
        Map<String, List<String>> fields = new LinkedHashMap<>();
        if (body == null || body.isEmpty()) {
            return fields;
        }
        for (String pair : body.split("&")) {
            int eq = pair.indexOf('=');
            String name = URLDecoder.decode(eq < 0 ? pair : pair.substring(0, eq), StandardCharsets.UTF_8);
            String value = eq < 0 ? "" : URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8);
            fields.computeIfAbsent(name, k -> new ArrayList<>()).add(value);
        }
        return fields;
    }

    /**
     * Returns the single value of a field.
     *
     * @param body the encoded body
     * @param name the field name
     * @return the first value, or null if the field is absent
     */
    public static String field(String body, String name) {
        List<String> values = parse(body).get(name);
        return values == null ? null : values.get(0);
    }
}
