package com.airline.warehouse.batch;

import com.airline.warehouse.pipeline.WarehouseLoadPipeline;
import com.airline.warehouse.quality.QualityFinding;
import lombok.RequiredArgsConstructor;
import org.springframework.batch.core.StepContribution;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.step.tasklet.Tasklet;
import org.springframework.batch.item.ExecutionContext;
import org.springframework.batch.repeat.RepeatStatus;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Runs the quality audit after the load. Failing findings are reported in the step
 * execution context; they do not fail the job.
 */
@Component
@RequiredArgsConstructor
public class AuditTasklet implements Tasklet {

    private final WarehouseLoadPipeline pipeline;

    @Override
    public RepeatStatus execute(StepContribution contribution, ChunkContext chunkContext) {
        List<QualityFinding> findings = pipeline.audit();
        ExecutionContext context = contribution.getStepExecution().getExecutionContext();
        long failed = 0;
        for (QualityFinding finding : findings) {
            context.putLong("quality." + finding.getRuleName(), finding.getViolationCount());
            if (!finding.isPassed()) {
                failed++;
            }
        }
        context.putInt("qualityChecks", findings.size());
        context.putLong("qualityChecksFailed", failed);
        return RepeatStatus.FINISHED;
    }
}
