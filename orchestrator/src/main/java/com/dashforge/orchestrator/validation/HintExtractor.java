package com.dashforge.orchestrator.validation;

import com.dashforge.orchestrator.model.Diagnostic;
import com.dashforge.orchestrator.model.RepairHint;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Classifies diagnostics into repair hints.
 *
 * Each diagnostic goes through the ordered {@link HintRule}s; unrecognised
 * messages are passed through verbatim. Hints with identical instructions are
 * collapsed, keeping first-seen order.
 */
@Component
public class HintExtractor {

    private final List<HintRule> rules;

    public HintExtractor(List<HintRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public List<RepairHint> extract(List<Diagnostic> diagnostics) {
        Map<String, RepairHint> unique = new LinkedHashMap<>();
        for (Diagnostic diagnostic : diagnostics) {
            RepairHint hint = classify(diagnostic);
            unique.putIfAbsent(hint.instruction(), hint);
        }
        return new ArrayList<>(unique.values());
    }

    private RepairHint classify(Diagnostic diagnostic) {
        for (HintRule rule : rules) {
            Optional<RepairHint> hint = rule.apply(diagnostic);
            if (hint.isPresent()) {
                return hint.get();
            }
        }
        return new RepairHint(RepairHint.Kind.OTHER, diagnostic.path(),
                "Validation error at '%s': %s".formatted(diagnostic.path(), diagnostic.message()));
    }
}
