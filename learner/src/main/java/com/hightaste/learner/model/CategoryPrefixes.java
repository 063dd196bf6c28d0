package com.hightaste.learner.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Immutable category to rule-id prefix table. Categories outside the table
 * are still accepted and map to {@link #FALLBACK_PREFIX}.
 */
public final class CategoryPrefixes {

    public static final String FALLBACK_PREFIX = "MISC";

    private final Map<String, String> prefixes;

    public CategoryPrefixes(Map<String, String> prefixes) {
        this.prefixes = Collections.unmodifiableMap(new LinkedHashMap<>(prefixes));
    }

    public static CategoryPrefixes defaults() {
        Map<String, String> table = new LinkedHashMap<>();
        table.put("boundaries", "BND");
        table.put("concurrency", "CON");
        table.put("control_flow", "CTRL");
        table.put("functions", "FUNC");
        table.put("naming", "NAME");
        table.put("performance", "PERF");
        table.put("refactoring", "REF");
        table.put("structure", "STRUCT");
        table.put("style", "STYLE");
        table.put("testing", "TEST");
        return new CategoryPrefixes(table);
    }

    public String prefixFor(String category) {
        return prefixes.getOrDefault(category, FALLBACK_PREFIX);
    }

    /** Known categories, in table order. */
    public Set<String> categories() {
        return prefixes.keySet();
    }
}
