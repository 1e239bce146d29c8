package com.dashforge.orchestrator.workflow;

import com.dashforge.orchestrator.model.Diagnostic;

import java.util.List;
import java.util.function.Predicate;

/**
 * Branch selection after a validation pass, as an ordered decision table.
 * The first matching rule wins; the last rule always matches.
 *
 * <pre>
 *   1. no diagnostics            → FINALIZE
 *   2. attempt &gt;= maxRetries     → ESCALATE
 *   3. otherwise                 → REPAIR
 * </pre>
 */
public final class RoutingTable {

    public enum Route { FINALIZE, ESCALATE, REPAIR }

    /** What the table looks at. */
    public record Verdict(List<Diagnostic> diagnostics, int attempt, int maxRetries) {}

    private record Rule(String name, Predicate<Verdict> when, Route route) {}

    private static final List<Rule> RULES = List.of(
            new Rule("valid",            v -> v.diagnostics().isEmpty(),      Route.FINALIZE),
            new Rule("budget-exhausted", v -> v.attempt() >= v.maxRetries(),  Route.ESCALATE),
            new Rule("repairable",       v -> true,                           Route.REPAIR)
    );

    private RoutingTable() {}

    public static Route decide(List<Diagnostic> diagnostics, int attempt, int maxRetries) {
        Verdict verdict = new Verdict(diagnostics, attempt, maxRetries);
        for (Rule rule : RULES) {
            if (rule.when().test(verdict)) {
                return rule.route();
            }
        }
        throw new IllegalStateException("Routing table has no catch-all rule");
    }
}
