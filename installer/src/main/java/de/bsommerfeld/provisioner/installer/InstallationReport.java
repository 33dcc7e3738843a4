package de.bsommerfeld.provisioner.installer;

import de.bsommerfeld.provisioner.execution.ExecutionResult;
import de.bsommerfeld.provisioner.execution.ExecutionSession;
import de.bsommerfeld.provisioner.rollback.RollbackOutcome;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * What an installation run did.
 *
 * @param skipped         modules already completed by the resumed run
 * @param results         results of this run in completion order, cancelled
 *                        modules included
 * @param rollbackSummary action counts taken before an automatic rollback,
 *                        {@code null} if none ran
 * @param rollback        outcome of the automatic rollback, {@code null} if
 *                        none ran
 */
public record InstallationReport(
        String installationId,
        boolean success,
        boolean resumed,
        List<Set<String>> batches,
        Set<String> skipped,
        Map<String, ExecutionResult> results,
        Map<String, ExecutionSession.ModuleTiming> timings,
        String rollbackSummary,
        RollbackOutcome rollback) {

    public InstallationReport {
        batches = List.copyOf(batches);
        skipped = Set.copyOf(skipped);
        results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
        timings = Collections.unmodifiableMap(new LinkedHashMap<>(timings));
    }

    public List<String> failedModules() {
        return results.values().stream()
                .filter(result -> !result.success() && !result.isCancelled())
                .map(ExecutionResult::moduleName)
                .sorted()
                .toList();
    }

    public List<String> cancelledModules() {
        return results.values().stream()
                .filter(ExecutionResult::isCancelled)
                .map(ExecutionResult::moduleName)
                .sorted()
                .toList();
    }

    public Optional<RollbackOutcome> getRollback() {
        return Optional.ofNullable(rollback);
    }
}
