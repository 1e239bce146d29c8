package com.dashforge.orchestrator.validation.rules;

import com.dashforge.orchestrator.model.Diagnostic;
import com.dashforge.orchestrator.model.RepairHint;
import com.dashforge.orchestrator.validation.HintRule;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

/** Value fits none of the alternatives of a oneOf. */
@Component
@Order(30)
public class NoMatchingSchemaRule implements HintRule {

    @Override
    public Optional<RepairHint> apply(Diagnostic diagnostic) {
        String message = diagnostic.message();
        if (message == null || !message.contains("is not valid under any of the given schemas")) {
            return Optional.empty();
        }
        return Optional.of(new RepairHint(RepairHint.Kind.NO_MATCHING_SCHEMA, diagnostic.path(),
                "Invalid value at '%s': doesn't match any valid schema".formatted(diagnostic.path())));
    }
}
