package com.dashforge.orchestrator.validation;

import com.dashforge.orchestrator.model.Diagnostic;
import com.dashforge.orchestrator.model.RepairHint;

import java.util.Optional;

/**
 * Turns one recognised diagnostic message shape into a repair hint.
 *
 * Rules are Spring beans; {@link HintExtractor} tries them in {@code @Order}
 * and uses the first that matches. A new message shape only needs a new bean.
 */
public interface HintRule {

    Optional<RepairHint> apply(Diagnostic diagnostic);
}
