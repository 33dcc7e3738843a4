package de.bsommerfeld.provisioner.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Default strategy. Splits a batch by scheduling hints: force-sequential and
 * large modules go through {@link PipelineStrategy} one at a time in batch
 * order, everything else runs as one sub-batch on {@link ParallelStrategy}.
 */
public class HybridStrategy implements ExecutionStrategy {

    private static final Logger LOG = LoggerFactory.getLogger(HybridStrategy.class);

    private final ParallelStrategy parallel;
    private final PipelineStrategy pipeline;

    public HybridStrategy(int maxWorkers) {
        this(new ParallelStrategy(maxWorkers), new PipelineStrategy());
    }

    public HybridStrategy(ParallelStrategy parallel, PipelineStrategy pipeline) {
        this.parallel = parallel;
        this.pipeline = pipeline;
    }

    @Override
    public Map<String, ExecutionResult> execute(List<ExecutionContext> contexts, ExecutionSession session,
            ProgressCallback callback) {
        List<ExecutionContext> sequential = new ArrayList<>();
        List<ExecutionContext> concurrent = new ArrayList<>();
        for (ExecutionContext context : contexts) {
            if (context.hints().prefersPipeline()) {
                LOG.debug("Routing {} to {} (forceSequential={}, large={})", context.moduleName(),
                        pipeline.getName(), context.hints().forceSequential(), context.hints().largeModule());
                sequential.add(context);
            } else {
                LOG.debug("Routing {} to {}", context.moduleName(), parallel.getName());
                concurrent.add(context);
            }
        }

        Map<String, ExecutionResult> results = new LinkedHashMap<>();
        for (ExecutionContext context : sequential) {
            results.putAll(pipeline.execute(List.of(context), session, callback));
        }
        if (!concurrent.isEmpty()) {
            results.putAll(parallel.execute(concurrent, session, callback));
        }
        return results;
    }

    @Override
    public boolean canHandle(List<ExecutionContext> contexts) {
        return true;
    }

    @Override
    public String getName() {
        return "hybrid";
    }
}
