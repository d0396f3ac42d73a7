package dev.evalkit.orchestrator;

import dev.evalkit.alert.AlertRecord;
import dev.evalkit.baseline.Comparison;
import dev.evalkit.cost.BudgetEvent;
import dev.evalkit.eval.EvalRun;
import dev.evalkit.metrics.EvalReport;
import java.util.List;

/** Everything one orchestrated run produced. */
public record OrchestratorResult(
        EvalRun run,
        EvalReport report,
        Comparison comparison,
        List<BudgetEvent> budgetEvents,
        List<AlertRecord> alerts) {

    public OrchestratorResult {
        budgetEvents = List.copyOf(budgetEvents);
        alerts = List.copyOf(alerts);
    }
}
