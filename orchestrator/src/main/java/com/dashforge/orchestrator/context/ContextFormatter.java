package com.dashforge.orchestrator.context;

import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Renders retrieved context as prompt text.
 *
 * <pre>
 * ## Metrics Examples          ← top-level key
 * - Cpu Usage: rate(...)       ← scalar leaf
 *
 * ### Mysql                    ← nested map
 * - Query Rate: SELECT ...
 * </pre>
 * Sections are separated by a blank line.
 */
@Component
public class ContextFormatter {

    static final String EMPTY = "No additional context available.";

    public String format(Map<String, Object> context) {
        if (context == null || context.isEmpty()) {
            return EMPTY;
        }
        StringJoiner out = new StringJoiner("\n");
        context.forEach((key, value) -> {
            out.add("## " + titleCase(key));
            if (value instanceof Map<?, ?> map) {
                appendEntries(out, map, 3);
            } else {
                out.add(leaf(value));
            }
            out.add("");
        });
        return out.toString();
    }

    private void appendEntries(StringJoiner out, Map<?, ?> entries, int level) {
        entries.forEach((key, value) -> {
            if (value instanceof Map<?, ?> nested) {
                out.add("\n" + "#".repeat(Math.min(level, 6)) + " " + titleCase(String.valueOf(key)));
                appendEntries(out, nested, level + 1);
            } else {
                out.add("- " + titleCase(String.valueOf(key)) + ": " + leaf(value));
            }
        });
    }

    private static String leaf(Object value) {
        if (value instanceof Collection<?> items) {
            return String.join(", ", items.stream().map(String::valueOf).toList());
        }
        return String.valueOf(value);
    }

    /** "sql_examples" → "Sql Examples". */
    static String titleCase(String key) {
        List<String> words = List.of(key.replace('_', ' ').trim().split("\\s+"));
        StringJoiner joiner = new StringJoiner(" ");
        for (String word : words) {
            if (word.isEmpty()) continue;
            joiner.add(Character.toUpperCase(word.charAt(0)) + word.substring(1).toLowerCase());
        }
        return joiner.toString();
    }
}
