package com.airline.warehouse.batch;

import com.airline.warehouse.config.LoaderProperties;
import com.airline.warehouse.exception.LoaderConfigurationException;
import com.airline.warehouse.pipeline.CancellationToken;
import com.airline.warehouse.pipeline.LoadSummary;
import com.airline.warehouse.pipeline.WarehouseLoadPipeline;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.StepContribution;
import org.springframework.batch.core.configuration.annotation.StepScope;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.step.tasklet.StoppableTasklet;
import org.springframework.batch.item.ExecutionContext;
import org.springframework.batch.repeat.RepeatStatus;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;
import org.springframework.util.ResourceUtils;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;

/**
 * Runs the load stage of the pipeline for the job's input file.
 *
 * <p>Job parameters: {@code input} (defaults to {@code warehouse.loader.input}) and
 * {@code asOf}, an ISO local date-time (defaults to now). Stopping the job cancels the
 * load between records. The summary counts are stored in the step execution context.
 */
@Slf4j
@Component
@StepScope
public class LoadTasklet implements StoppableTasklet {

    private final WarehouseLoadPipeline pipeline;
    private final ResourceLoader resourceLoader;
    private final Clock clock;
    private final String input;
    private final String asOf;
    private final CancellationToken cancellation = new CancellationToken();

    public LoadTasklet(WarehouseLoadPipeline pipeline,
                       ResourceLoader resourceLoader,
                       LoaderProperties properties,
                       Clock clock,
                       @Value("#{jobParameters['" + WarehouseLoadJobConfig.INPUT_PARAMETER + "']}") String input,
                       @Value("#{jobParameters['" + WarehouseLoadJobConfig.AS_OF_PARAMETER + "']}") String asOf) {
        this.pipeline = pipeline;
        this.resourceLoader = resourceLoader;
        this.clock = clock;
        this.input = StringUtils.hasText(input) ? input : properties.getInput();
        this.asOf = asOf;
    }

    @Override
    public RepeatStatus execute(StepContribution contribution, ChunkContext chunkContext) {
        if (!StringUtils.hasText(input)) {
            throw new LoaderConfigurationException(
                "No input file: pass the 'input' job parameter or set warehouse.loader.input");
        }
        Resource resource = resolve(input);
        if (!resource.exists()) {
            throw new LoaderConfigurationException("Input file not found: " + input);
        }

        String runId = "job-" + chunkContext.getStepContext().getStepExecution().getJobExecutionId();
        LoadSummary summary = pipeline.load(runId, resource, asOfTime(), cancellation);

        contribution.incrementFilterCount(summary.getRecordsRejected());
        contribution.incrementWriteCount(summary.getEntitiesCreated() + summary.getVersionsCreated()
            + summary.getFactsInserted() + summary.getFactsUpdated());
        store(summary, contribution.getStepExecution().getExecutionContext());
        return RepeatStatus.FINISHED;
    }

    @Override
    public void stop() {
        log.info("Stop requested, cancelling the load");
        cancellation.cancel();
    }

    private Resource resolve(String location) {
        return ResourceUtils.isUrl(location) ? resourceLoader.getResource(location) : new FileSystemResource(location);
    }

    private LocalDateTime asOfTime() {
        if (!StringUtils.hasText(asOf)) {
            return LocalDateTime.now(clock);
        }
        try {
            return LocalDateTime.parse(asOf);
        } catch (DateTimeParseException e) {
            throw new LoaderConfigurationException("Invalid asOf job parameter '" + asOf + "': " + e.getMessage());
        }
    }

    private static void store(LoadSummary summary, ExecutionContext context) {
        context.putString("runId", summary.getRunId());
        context.putInt("recordsRead", summary.getRecordsRead());
        context.putInt("recordsValidated", summary.getRecordsValidated());
        context.putInt("recordsRejected", summary.getRecordsRejected());
        context.putInt("entitiesCreated", summary.getEntitiesCreated());
        context.putInt("versionsCreated", summary.getVersionsCreated());
        context.putInt("dimensionsUnchanged", summary.getDimensionsUnchanged());
        context.putInt("mergeFailures", summary.getMergeFailures());
        context.putInt("factsInserted", summary.getFactsInserted());
        context.putInt("factsUpdated", summary.getFactsUpdated());
        context.putInt("factsUnchanged", summary.getFactsUnchanged());
        context.putInt("factFailures", summary.getFactFailures());
        context.putString("cancelled", Boolean.toString(summary.isCancelled()));
    }
}
