package com.inbox.jobtracker.ingest.service;

import com.inbox.jobtracker.config.TrackerProperties;
import com.inbox.jobtracker.ingest.extract.BodyExtractor;
import com.inbox.jobtracker.ingest.extract.SenderExtractor;
import com.inbox.jobtracker.ingest.extract.SubjectFilter;
import com.inbox.jobtracker.ingest.mail.MailboxReader;
import com.inbox.jobtracker.ingest.mail.MessageBatch;
import com.inbox.jobtracker.ingest.model.CandidateRecord;
import com.inbox.jobtracker.ingest.model.FailureEntry;
import com.inbox.jobtracker.ingest.model.FailureReport;
import com.inbox.jobtracker.ingest.model.MessageEnvelope;
import com.inbox.jobtracker.ingest.model.ParseOutcome;
import com.inbox.jobtracker.ingest.model.PipelineRunSummary;
import com.inbox.jobtracker.ingest.model.RawMessage;
import com.inbox.jobtracker.ingest.model.StructuredRecord;
import com.inbox.jobtracker.ingest.model.UpsertResult;
import com.inbox.jobtracker.ingest.parse.SemanticParser;
import com.inbox.jobtracker.ingest.pipeline.ParsedCandidate;
import com.inbox.jobtracker.ingest.pipeline.StageChannel;
import com.inbox.jobtracker.ingest.report.FailureReporter;
import com.inbox.jobtracker.ingest.store.StoreReconciler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one ingestion pass: fetch, filter+extract and parse run concurrently on
 * {@code pipelineExecutor}; reconciliation runs on the calling thread and paces the rest
 * through the bounded channels. Upserts happen in mailbox order.
 *
 * <p>Only the reconcile stage appends to the failure list, and the list is handed to the
 * {@link FailureReporter} once every stage has finished. A stage that dies abandons its input
 * channel so upstream stages can finish, and the run is reported as {@code STAGE_FAILED}.
 */
@Service
public class IngestionPipelineService {
    private static final Logger log = LoggerFactory.getLogger(IngestionPipelineService.class);

    public static final String EMPTY_PARSER_OUTPUT = "Empty LLM output";

    private final MailboxReader mailboxReader;
    private final SubjectFilter subjectFilter;
    private final BodyExtractor bodyExtractor;
    private final SenderExtractor senderExtractor;
    private final SemanticParser semanticParser;
    private final StoreReconciler storeReconciler;
    private final FailureReporter failureReporter;
    private final ExecutorService pipelineExecutor;
    private final TrackerProperties properties;
    private final Clock clock;

    public IngestionPipelineService(
        MailboxReader mailboxReader,
        SubjectFilter subjectFilter,
        BodyExtractor bodyExtractor,
        SenderExtractor senderExtractor,
        SemanticParser semanticParser,
        StoreReconciler storeReconciler,
        FailureReporter failureReporter,
        @Qualifier("pipelineExecutor") ExecutorService pipelineExecutor,
        TrackerProperties properties,
        Clock clock
    ) {
        this.mailboxReader = mailboxReader;
        this.subjectFilter = subjectFilter;
        this.bodyExtractor = bodyExtractor;
        this.senderExtractor = senderExtractor;
        this.semanticParser = semanticParser;
        this.storeReconciler = storeReconciler;
        this.failureReporter = failureReporter;
        this.pipelineExecutor = pipelineExecutor;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * @throws TrackerSetupException if the mailbox or an external service cannot be used;
     *     no stage has started in that case
     */
    public PipelineRunSummary run() {
        Instant startedAt = clock.instant();
        semanticParser.verifySetup();
        storeReconciler.verifySetup();

        Instant since = startedAt.atZone(clock.getZone())
            .minusMonths(properties.getLookbackMonths())
            .toInstant();

        try (MessageBatch batch = mailboxReader.fetch(since)) {
            int messagesFound = batch.size();
            log.info("Found {} messages.", messagesFound);
            if (messagesFound == 0) {
                return new PipelineRunSummary(
                    startedAt,
                    clock.instant(),
                    PipelineRunSummary.NO_MESSAGES,
                    0,
                    0,
                    0,
                    List.of(),
                    FailureReport.nothingToReport()
                );
            }
            return runStages(startedAt, messagesFound, batch);
        }
    }

    private PipelineRunSummary runStages(Instant startedAt, int messagesFound, MessageBatch batch) {
        int capacity = properties.getPipeline().getChannelCapacity();
        StageChannel<RawMessage> rawChannel = new StageChannel<>("raw", capacity);
        StageChannel<ParsedCandidate> candidateChannel = new StageChannel<>("candidates", capacity);
        StageChannel<ParsedCandidate> parsedChannel = new StageChannel<>("parsed", capacity);
        AtomicInteger candidates = new AtomicInteger();

        Future<Boolean> fetch = pipelineExecutor.submit(() -> fetchStage(batch, rawChannel));
        Future<?> extract = pipelineExecutor.submit(() -> extractStage(rawChannel, candidateChannel, candidates));
        Future<?> parse = pipelineExecutor.submit(() -> parseStage(candidateChannel, parsedChannel));

        List<FailureEntry> failures = new ArrayList<>();
        int upserted;
        boolean drained = false;
        try {
            upserted = reconcileStage(parsedChannel, failures);
            drained = true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Pipeline interrupted while reconciling", e);
        } finally {
            if (!drained) {
                fetch.cancel(true);
                extract.cancel(true);
                parse.cancel(true);
            }
        }

        List<String> failedStages = new ArrayList<>();
        boolean fetchComplete = Boolean.TRUE.equals(await("fetch", fetch, failedStages));
        await("extract", extract, failedStages);
        await("parse", parse, failedStages);

        FailureReport report = failureReporter.report(failures);
        String status;
        if (!failedStages.isEmpty()) {
            log.warn("Pipeline stages ended abnormally: {}", failedStages);
            status = PipelineRunSummary.STAGE_FAILED;
        } else if (!fetchComplete) {
            status = PipelineRunSummary.FETCH_INCOMPLETE;
        } else if (failures.isEmpty()) {
            status = PipelineRunSummary.COMPLETED;
        } else {
            status = PipelineRunSummary.COMPLETED_WITH_FAILURES;
        }
        log.info(
            "Pipeline finished: status={} messages={} candidates={} upserted={} failures={}",
            status,
            messagesFound,
            candidates.get(),
            upserted,
            failures.size()
        );
        return new PipelineRunSummary(
            startedAt,
            clock.instant(),
            status,
            messagesFound,
            candidates.get(),
            upserted,
            failures,
            report
        );
    }

    private boolean fetchStage(MessageBatch batch, StageChannel<RawMessage> out) throws InterruptedException {
        try {
            for (RawMessage message : batch) {
                if (out.isAbandoned()) {
                    log.warn("Extract stage stopped reading; ending fetch early");
                    return false;
                }
                out.send(message);
            }
            return true;
        } catch (RuntimeException e) {
            log.error("Mailbox fetch stopped early; continuing with messages already fetched", e);
            return false;
        } finally {
            out.close();
        }
    }

    private void extractStage(
        StageChannel<RawMessage> in,
        StageChannel<ParsedCandidate> out,
        AtomicInteger candidates
    ) {
        boolean drained = false;
        try {
            Optional<RawMessage> next;
            while ((next = in.receive()).isPresent()) {
                ParsedCandidate item = extractOne(next.get());
                if (item == null) {
                    continue;
                }
                out.send(item);
                if (item.isPending()) {
                    candidates.incrementAndGet();
                }
            }
            drained = true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            if (!drained) {
                in.abandon();
            }
            out.close();
        }
    }

    /**
     * @return null when the message is not a candidate
     */
    private ParsedCandidate extractOne(RawMessage message) {
        if (!message.hasEnvelope()) {
            return null;
        }
        MessageEnvelope envelope = message.envelope();
        try {
            if (!subjectFilter.isJobRelated(envelope.subject())) {
                return null;
            }
            return ParsedCandidate.pending(new CandidateRecord(
                envelope.subject(),
                bodyExtractor.extractBody(message),
                senderExtractor.extractSender(message),
                envelope.receivedAt()
            ));
        } catch (RuntimeException e) {
            log.warn("Extraction failed for '{}'", envelope.subject(), e);
            CandidateRecord partial = new CandidateRecord(envelope.subject(), "", "", envelope.receivedAt());
            return ParsedCandidate.failed(partial, "Extraction error: " + e.getMessage());
        }
    }

    private void parseStage(StageChannel<ParsedCandidate> in, StageChannel<ParsedCandidate> out) {
        boolean drained = false;
        try {
            Optional<ParsedCandidate> next;
            while ((next = in.receive()).isPresent()) {
                ParsedCandidate item = next.get();
                out.send(item.isPending() ? parseOne(item.candidate()) : item);
            }
            drained = true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            if (!drained) {
                in.abandon();
            }
            out.close();
        }
    }

    private ParsedCandidate parseOne(CandidateRecord candidate) {
        ParseOutcome outcome;
        try {
            outcome = semanticParser.parse(
                candidate.subject(),
                candidate.normalizedBody(),
                candidate.sender(),
                candidate.receivedAt()
            );
        } catch (RuntimeException e) {
            log.warn("Parser threw for '{}'", candidate.subject(), e);
            return ParsedCandidate.failed(candidate, "Parser error: " + e.getMessage());
        }

        if (outcome instanceof ParseOutcome.Parsed parsed && !parsed.record().isBlank()) {
            log.info("Parsed job: {}", parsed.record());
            return ParsedCandidate.parsed(candidate, parsed.record());
        }
        if (outcome instanceof ParseOutcome.Empty empty) {
            log.info("No job details in '{}': {}", candidate.subject(), empty.detail());
        }
        return ParsedCandidate.failed(candidate, EMPTY_PARSER_OUTPUT);
    }

    private int reconcileStage(StageChannel<ParsedCandidate> in, List<FailureEntry> failures)
        throws InterruptedException {
        int upserted = 0;
        Optional<ParsedCandidate> next;
        while ((next = in.receive()).isPresent()) {
            ParsedCandidate item = next.get();
            if (!item.isParsed()) {
                failures.add(FailureEntry.of(item.candidate(), item.failureReason()));
                continue;
            }
            String failureReason = reconcileOne(item.record());
            if (failureReason == null) {
                upserted++;
            } else {
                failures.add(FailureEntry.of(item.candidate(), failureReason));
            }
        }
        return upserted;
    }

    private String reconcileOne(StructuredRecord record) {
        try {
            UpsertResult result = storeReconciler.upsert(record);
            if (result != null && result.successful()) {
                return null;
            }
            return result == null ? "Store returned no result" : result.failureReason();
        } catch (RuntimeException e) {
            log.warn("Store upsert threw for {} / {}", record.company(), record.position(), e);
            return "Store error: " + e.getMessage();
        }
    }

    private Object await(String stage, Future<?> future, List<String> failedStages) {
        try {
            return future.get();
        } catch (ExecutionException e) {
            log.error("Pipeline stage {} failed", stage, e.getCause());
            failedStages.add(stage);
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted waiting for stage " + stage, e);
        }
    }
}
