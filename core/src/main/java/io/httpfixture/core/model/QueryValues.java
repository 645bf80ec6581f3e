package io.httpfixture.core.model;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parsing and flattening of {@code application/x-www-form-urlencoded} text,
 * used for both query strings and url-encoded request bodies.
 */
public final class QueryValues {

    private QueryValues() {
        // utility class
    }

    /**
     * Decodes url-encoded text into name → values. Keys keep their first-seen
     * order and repeated keys collect their values in order. A pair without
     * {@code =} yields an empty value; empty pairs are skipped.
     *
     * @param raw the raw text, e.g. {@code k=v1&k=v2&j=w}; may be {@code null}
     * @return an unmodifiable, insertion-ordered map
     */
    public static Map<String, List<String>> parse(String raw) {
        if (raw == null || raw.isEmpty()) {
            return Map.of();
        }
        Map<String, List<String>> result = new LinkedHashMap<>();
        for (String pair : raw.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String name = decode(eq >= 0 ? pair.substring(0, eq) : pair);
            String value = eq >= 0 ? decode(pair.substring(eq + 1)) : "";
            result.computeIfAbsent(name, k -> new ArrayList<>()).add(value);
        }
        return Collections.unmodifiableMap(result);
    }

    /**
     * Flattens multi-valued parameters: a name with one value maps to that
     * string, a name with several values maps to the ordered list of them.
     *
     * @param values name → values
     * @return an insertion-ordered map of {@code String} or {@code List<String>}
     */
    public static Map<String, Object> flatten(Map<String, List<String>> values) {
        Map<String, Object> flat = new LinkedHashMap<>();
        values.forEach((name, list) -> {
            if (list.size() == 1) {
                flat.put(name, list.get(0));
            } else {
                flat.put(name, List.copyOf(list));
            }
        });
        return flat;
    }

    private static String decode(String text) {
        try {
            return URLDecoder.decode(text, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            // malformed %-escape: keep the text as sent
            return text;
        }
    }
}
