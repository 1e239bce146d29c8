package com.dashforge.orchestrator.validation.rules;

import com.dashforge.orchestrator.model.Diagnostic;
import com.dashforge.orchestrator.model.RepairHint;
import com.dashforge.orchestrator.validation.HintRule;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** {@code 'id' is a required property} → missing field name at the object's path. */
@Component
@Order(10)
public class MissingPropertyRule implements HintRule {

    private static final Pattern QUOTED_NAME = Pattern.compile("'([^']*)'");

    @Override
    public Optional<RepairHint> apply(Diagnostic diagnostic) {
        String message = diagnostic.message();
        if (message == null || !message.contains("required property")) {
            return Optional.empty();
        }
        Matcher m = QUOTED_NAME.matcher(message);
        String property = m.find() ? m.group(1) : "unknown";
        return Optional.of(new RepairHint(RepairHint.Kind.MISSING_PROPERTY, diagnostic.path(),
                "Missing required property '%s' at path '%s'".formatted(property, diagnostic.path())));
    }
}
