package com.dashforge.orchestrator.validation.rules;

import com.dashforge.orchestrator.model.Diagnostic;
import com.dashforge.orchestrator.model.RepairHint;
import com.dashforge.orchestrator.validation.HintRule;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

/** {@code 'abc' is not of type 'integer'} → expected type at path. */
@Component
@Order(20)
public class TypeMismatchRule implements HintRule {

    private static final String MARKER = "is not of type ";

    @Override
    public Optional<RepairHint> apply(Diagnostic diagnostic) {
        String message = diagnostic.message();
        int idx = message == null ? -1 : message.lastIndexOf(MARKER);
        if (idx < 0) {
            return Optional.empty();
        }
        String expected = message.substring(idx + MARKER.length()).replace("'", "").strip();
        return Optional.of(new RepairHint(RepairHint.Kind.TYPE_MISMATCH, diagnostic.path(),
                "Type error at '%s': expected %s".formatted(diagnostic.path(), expected)));
    }
}
