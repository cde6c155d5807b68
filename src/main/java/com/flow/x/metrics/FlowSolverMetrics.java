package com.flow.x.metrics;

import com.flow.x.utils.basic.Constant;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

@Component
public class FlowSolverMetrics {
    private final MeterRegistry meterRegistry;
    private final DistributionSummary solutionCostSummary;


    public FlowSolverMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.solutionCostSummary = DistributionSummary.builder("flow_solution_cost")
                .description("Total cost of solved min-cost max flows")
                .register(meterRegistry);
    }

    public void recordSolutionCost(long cost) {
        solutionCostSummary.record(cost);
    }

    public void incrementAugmentations(long count) {
        meterRegistry.counter("flow_augmentations").increment(count);
    }

    public void incrementCancelledCycles(long count) {
        meterRegistry.counter("flow_cycles_cancelled").increment(count);
    }

    public void recordSolveError(String mode) {
        meterRegistry.counter("flow_solve_errors", Constant.MODE, mode).increment();
    }

    public void recordSolveDuration(long durationMs, String mode) {
        meterRegistry.timer("flow_solve_duration", Constant.MODE, mode)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }
}
