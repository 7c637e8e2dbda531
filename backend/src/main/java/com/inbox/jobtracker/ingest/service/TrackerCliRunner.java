package com.inbox.jobtracker.ingest.service;

import com.inbox.jobtracker.config.TrackerProperties;
import com.inbox.jobtracker.ingest.model.FailureReport;
import com.inbox.jobtracker.ingest.model.PipelineRunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
public class TrackerCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(TrackerCliRunner.class);

    private final TrackerProperties properties;
    private final IngestionPipelineService pipelineService;
    private final ConfigurableApplicationContext applicationContext;

    public TrackerCliRunner(
        TrackerProperties properties,
        IngestionPipelineService pipelineService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.pipelineService = pipelineService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        PipelineRunSummary summary = pipelineService.run();
        log.info(
            "Run {} in {}s: messages={}, candidates={}, upserted={}, failures={}",
            summary.status(),
            Duration.between(summary.startedAt(), summary.finishedAt()).toSeconds(),
            summary.messagesFound(),
            summary.candidatesExtracted(),
            summary.recordsUpserted(),
            summary.failures().size()
        );
        FailureReport report = summary.failureReport();
        if (report.errorMessage() != null) {
            log.warn("Failure report could not be written to {}: {}", report.path(), report.errorMessage());
        }

        if (properties.getCli().isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> 0);
            System.exit(exitCode);
        }
    }
}
