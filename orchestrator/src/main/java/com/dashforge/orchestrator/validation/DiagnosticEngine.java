package com.dashforge.orchestrator.validation;

import com.dashforge.orchestrator.model.Candidate;
import com.dashforge.orchestrator.model.Diagnostic;
import com.dashforge.orchestrator.model.RepairHint;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Validates candidate dashboards against the {@link SchemaCatalogue} and turns
 * the violations into repair hints.
 *
 * The walk is depth-first in a fixed order, so the same document always
 * yields the same diagnostics in the same order:
 * <ol>
 *   <li>type: on mismatch the node is reported and not descended into</li>
 *   <li>enum</li>
 *   <li>oneOf: alternatives are checked in isolation, only the summary is reported</li>
 *   <li>required, in declared order (reported at the object's own path)</li>
 *   <li>properties, in declared order</li>
 *   <li>items, by index</li>
 * </ol>
 *
 * Messages use the usual JSON-Schema wording, which {@link HintExtractor}
 * relies on. Malformed input is the expected case and is never an exception:
 * anything unexpected during the walk becomes a single diagnostic at "root".
 */
@Component
public class DiagnosticEngine {

    private static final Logger log = LoggerFactory.getLogger(DiagnosticEngine.class);

    private static final int REPR_LIMIT = 80;

    private final SchemaCatalogue catalogue;
    private final HintExtractor   hintExtractor;
    private final int             maxDiagnostics;

    public DiagnosticEngine(SchemaCatalogue catalogue,
                            HintExtractor hintExtractor,
                            @Value("${dashforge.validation.max-diagnostics:25}") int maxDiagnostics) {
        this.catalogue      = catalogue;
        this.hintExtractor  = hintExtractor;
        this.maxDiagnostics = Math.max(1, maxDiagnostics);
    }

    // ------------------------------------------------------------------
    // Public API
    // ------------------------------------------------------------------

    public List<Diagnostic> validate(Candidate candidate) {
        return validate(candidate == null ? null : candidate.document());
    }

    /** Empty list means the document is valid. */
    public List<Diagnostic> validate(JsonNode document) {
        if (document == null || document.isMissingNode()) {
            return List.of(Diagnostic.atRoot("document is empty"));
        }
        try {
            Walk walk = new Walk(maxDiagnostics);
            walk.check(document, catalogue.root());
            if (!walk.found.isEmpty()) {
                log.debug("Validation found {} diagnostic(s), first: {} {}",
                        walk.found.size(), walk.found.get(0).path(), walk.found.get(0).message());
            }
            return List.copyOf(walk.found);
        } catch (RuntimeException e) {
            log.warn("Validator fault, reporting at root: {}", e.getMessage());
            return List.of(Diagnostic.atRoot("validation could not complete: " + e.getMessage()));
        }
    }

    public List<RepairHint> extractHints(List<Diagnostic> diagnostics) {
        return hintExtractor.extract(diagnostics);
    }

    // ------------------------------------------------------------------
    // Grammar walk
    // ------------------------------------------------------------------

    private static final class Walk {

        private final int              limit;
        private final List<Diagnostic> found = new ArrayList<>();
        private final Deque<String>    path  = new ArrayDeque<>();

        Walk(int limit) {
            this.limit = limit;
        }

        boolean full() {
            return found.size() >= limit;
        }

        void report(String message) {
            if (!full()) {
                found.add(new Diagnostic(Diagnostic.pathOf(new ArrayList<>(path)), message));
            }
        }

        void check(JsonNode node, JsonNode schema) {
            if (full()) return;

            JsonNode type = schema.get("type");
            if (type != null && !matchesType(node, type)) {
                report(repr(node) + " is not of type " + typeNames(type));
                return;
            }

            JsonNode allowed = schema.get("enum");
            if (allowed != null && !contains(allowed, node)) {
                report(repr(node) + " is not one of " + reprList(allowed));
            }

            JsonNode oneOf = schema.get("oneOf");
            if (oneOf != null && oneOf.isArray()) {
                int matches = 0;
                for (JsonNode alternative : oneOf) {
                    if (isValid(node, alternative)) matches++;
                }
                if (matches == 0) {
                    report(repr(node) + " is not valid under any of the given schemas");
                } else if (matches > 1) {
                    report(repr(node) + " is valid under each of " + matches + " of the given schemas");
                }
            }

            if (node.isObject()) {
                JsonNode required = schema.get("required");
                if (required != null) {
                    for (JsonNode name : required) {
                        if (!node.has(name.asText())) {
                            report("'" + name.asText() + "' is a required property");
                        }
                    }
                }
                JsonNode properties = schema.get("properties");
                if (properties != null) {
                    Iterator<Map.Entry<String, JsonNode>> fields = properties.fields();
                    while (fields.hasNext() && !full()) {
                        Map.Entry<String, JsonNode> field = fields.next();
                        JsonNode child = node.get(field.getKey());
                        if (child != null) {
                            path.addLast(field.getKey());
                            check(child, field.getValue());
                            path.removeLast();
                        }
                    }
                }
            }

            JsonNode items = schema.get("items");
            if (node.isArray() && items != null) {
                for (int i = 0; i < node.size() && !full(); i++) {
                    path.addLast(String.valueOf(i));
                    check(node.get(i), items);
                    path.removeLast();
                }
            }
        }

        private static boolean isValid(JsonNode node, JsonNode schema) {
            Walk probe = new Walk(1);
            probe.check(node, schema);
            return probe.found.isEmpty();
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    static boolean matchesType(JsonNode node, JsonNode type) {
        if (type.isArray()) {
            for (JsonNode t : type) {
                if (matchesType(node, t.asText())) return true;
            }
            return false;
        }
        return matchesType(node, type.asText());
    }

    static boolean matchesType(JsonNode node, String type) {
        return switch (type) {
            case "object"  -> node.isObject();
            case "array"   -> node.isArray();
            case "string"  -> node.isTextual();
            case "boolean" -> node.isBoolean();
            case "null"    -> node.isNull();
            case "number"  -> node.isNumber();
            case "integer" -> isInteger(node);
            default        -> true;
        };
    }

    // 8.0 counts as an integer, 8.5 and overflowed doubles (1e400) do not
    private static boolean isInteger(JsonNode node) {
        if (node.isIntegralNumber()) return true;
        if (!node.isNumber()) return false;
        if ((node.isDouble() || node.isFloat()) && !Double.isFinite(node.doubleValue())) return false;
        return node.decimalValue().stripTrailingZeros().scale() <= 0;
    }

    private static boolean contains(JsonNode values, JsonNode node) {
        for (JsonNode v : values) {
            if (v.equals(node)) return true;
        }
        return false;
    }

    private static String typeNames(JsonNode type) {
        if (!type.isArray()) {
            return "'" + type.asText() + "'";
        }
        StringJoiner joiner = new StringJoiner(", ");
        type.forEach(t -> joiner.add("'" + t.asText() + "'"));
        return joiner.toString();
    }

    private static String reprList(JsonNode values) {
        StringJoiner joiner = new StringJoiner(", ", "[", "]");
        values.forEach(v -> joiner.add(repr(v)));
        return joiner.toString();
    }

    static String repr(JsonNode node) {
        String text = node.isTextual() ? "'" + node.asText() + "'" : node.toString();
        return text.length() > REPR_LIMIT ? text.substring(0, REPR_LIMIT) + "..." : text;
    }
}
