package de.bsommerfeld.provisioner.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs modules one at a time on the calling thread. Used for modules that
 * must not share the machine with others (desktop environments, user
 * management) or that are heavy enough to saturate it alone.
 */
public class PipelineStrategy implements ExecutionStrategy {

    private static final Logger LOG = LoggerFactory.getLogger(PipelineStrategy.class);

    @Override
    public Map<String, ExecutionResult> execute(List<ExecutionContext> contexts, ExecutionSession session,
            ProgressCallback callback) {
        LOG.info("Executing {} module(s) sequentially", contexts.size());

        Map<String, ExecutionResult> results = new LinkedHashMap<>();
        for (ExecutionContext context : contexts) {
            MDC.put("module", context.moduleName());
            try {
                results.put(context.moduleName(), ModuleRunner.run(context, session, callback));
            } finally {
                MDC.remove("module");
            }
        }
        return results;
    }

    /** Best suited for a single module that asks to run alone. */
    @Override
    public boolean canHandle(List<ExecutionContext> contexts) {
        return contexts.size() == 1 && contexts.get(0).hints().prefersPipeline();
    }

    @Override
    public String getName() {
        return "pipeline";
    }
}
