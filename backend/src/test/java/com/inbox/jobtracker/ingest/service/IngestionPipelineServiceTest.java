package com.inbox.jobtracker.ingest.service;

import com.inbox.jobtracker.config.TrackerProperties;
import com.inbox.jobtracker.ingest.extract.BodyExtractor;
import com.inbox.jobtracker.ingest.extract.SenderExtractor;
import com.inbox.jobtracker.ingest.extract.SubjectFilter;
import com.inbox.jobtracker.ingest.mail.MailboxReadException;
import com.inbox.jobtracker.ingest.mail.MailboxReader;
import com.inbox.jobtracker.ingest.mail.MessageBatch;
import com.inbox.jobtracker.ingest.model.BodyPart;
import com.inbox.jobtracker.ingest.model.FailureEntry;
import com.inbox.jobtracker.ingest.model.MailAddress;
import com.inbox.jobtracker.ingest.model.MessageEnvelope;
import com.inbox.jobtracker.ingest.model.ParseOutcome;
import com.inbox.jobtracker.ingest.model.PipelineRunSummary;
import com.inbox.jobtracker.ingest.model.RawMessage;
import com.inbox.jobtracker.ingest.model.StructuredRecord;
import com.inbox.jobtracker.ingest.model.UpsertResult;
import com.inbox.jobtracker.ingest.parse.SemanticParser;
import com.inbox.jobtracker.ingest.report.CsvFailureReporter;
import com.inbox.jobtracker.ingest.report.FailureReporter;
import com.inbox.jobtracker.ingest.store.StoreReconciler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IngestionPipelineServiceTest {
    private static final Instant NOW = Instant.parse("2025-10-01T00:00:00Z");
    private static final Instant RECEIVED = Instant.parse("2025-09-15T08:00:00Z");

    @Mock
    private MailboxReader mailboxReader;
    @Mock
    private SemanticParser semanticParser;
    @Mock
    private StoreReconciler storeReconciler;

    @TempDir
    Path tempDir;

    private final ExecutorService executor = Executors.newFixedThreadPool(3);
    private TrackerProperties properties;
    private FailureReporter failureReporter;

    @BeforeEach
    void setUp() {
        properties = new TrackerProperties();
        properties.getReport().setOutputDir(tempDir.resolve("unparsed").toString());
        properties.getReport().setZoneId("UTC");
        failureReporter = spy(new CsvFailureReporter(properties));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void emptyMailboxEndsRunWithoutStagesOrReport() {
        when(mailboxReader.fetch(any())).thenReturn(MessageBatch.of(List.of()));

        PipelineRunSummary summary = createService(storeReconciler).run();

        assertThat(summary.status()).isEqualTo(PipelineRunSummary.NO_MESSAGES);
        assertThat(summary.messagesFound()).isZero();
        verify(mailboxReader).fetch(Instant.parse("2025-06-01T00:00:00Z"));
        verify(semanticParser, never()).parse(anyString(), anyString(), anyString(), any());
        verify(storeReconciler, never()).upsert(any());
        verify(failureReporter, never()).report(any());
        assertThat(Files.exists(reportPath())).isFalse();
    }

    @Test
    void matchingMessageIsParsedAndUpsertedOnce() {
        StructuredRecord acme = new StructuredRecord("Acme", "Engineer", "Applied", RECEIVED, "jobs@acme.com");
        when(mailboxReader.fetch(any())).thenReturn(MessageBatch.of(List.of(
            message("Thanks for applying to Acme", "jobs@acme.com", "We received your application.")
        )));
        when(semanticParser.parse(anyString(), anyString(), anyString(), any())).thenReturn(ParseOutcome.of(acme));
        when(storeReconciler.upsert(any())).thenReturn(UpsertResult.created());

        PipelineRunSummary summary = createService(storeReconciler).run();

        verify(semanticParser).parse(
            "Thanks for applying to Acme",
            "We received your application.",
            "jobs@acme.com",
            RECEIVED
        );
        verify(storeReconciler, times(1)).upsert(acme);
        assertThat(summary.status()).isEqualTo(PipelineRunSummary.COMPLETED);
        assertThat(summary.recordsUpserted()).isEqualTo(1);
        assertThat(summary.failures()).isEmpty();
        verify(failureReporter, times(1)).report(List.of());
        assertThat(Files.exists(reportPath())).isFalse();
    }

    @Test
    void emptyParserOutputBecomesOneFailureRow() throws Exception {
        when(mailboxReader.fetch(any())).thenReturn(MessageBatch.of(List.of(
            message("Your application", "hr@globex.io", "Hello \"candidate\"\nSee you")
        )));
        when(semanticParser.parse(anyString(), anyString(), anyString(), any()))
            .thenReturn(ParseOutcome.empty("no company or position extracted"));

        PipelineRunSummary summary = createService(storeReconciler).run();

        verify(storeReconciler, never()).upsert(any());
        assertThat(summary.status()).isEqualTo(PipelineRunSummary.COMPLETED_WITH_FAILURES);
        assertThat(summary.failures()).hasSize(1);
        FailureEntry failure = summary.failures().get(0);
        assertThat(failure.reason()).isEqualTo("Empty LLM output");
        assertThat(failure.sender()).isEqualTo("hr@globex.io");
        assertThat(failure.receivedAt()).isEqualTo(RECEIVED);

        List<String> lines = Files.readAllLines(reportPath(), StandardCharsets.UTF_8);
        assertThat(lines).containsExactly(
            "Date,Email,Subject,Body,Reason",
            "\"2025-09-15 08:00\",\"hr@globex.io\",\"Your application\",\"Hello 'candidate' See you\",\"Empty LLM output\""
        );
    }

    @Test
    void nonMatchingSubjectIsDiscardedBeforeExtraction() {
        when(mailboxReader.fetch(any())).thenReturn(MessageBatch.of(List.of(
            message("Weekly newsletter", "news@example.com", "Top stories")
        )));

        PipelineRunSummary summary = createService(storeReconciler).run();

        verify(semanticParser, never()).parse(anyString(), anyString(), anyString(), any());
        verify(storeReconciler, never()).upsert(any());
        assertThat(summary.messagesFound()).isEqualTo(1);
        assertThat(summary.candidatesExtracted()).isZero();
        assertThat(summary.failures()).isEmpty();
        assertThat(summary.status()).isEqualTo(PipelineRunSummary.COMPLETED);
    }

    @Test
    void upsertsFollowMailboxOrder() {
        properties.getPipeline().setChannelCapacity(4);
        when(mailboxReader.fetch(any())).thenReturn(MessageBatch.of(List.of(
            message("Application 1", "a@one.com", "first"),
            message("Weekly newsletter", "news@example.com", "skip me"),
            message("Application 2", "b@two.com", "second"),
            message("Application 3", "c@three.com", "third")
        )));
        when(semanticParser.parse(anyString(), anyString(), anyString(), any())).thenAnswer(invocation -> {
            String subject = invocation.getArgument(0);
            String sender = invocation.getArgument(2);
            Thread.sleep(subject.endsWith("1") ? 30 : 1);
            return ParseOutcome.of(new StructuredRecord("Company " + subject, "Engineer", "Applied", RECEIVED, sender));
        });
        when(storeReconciler.upsert(any())).thenReturn(UpsertResult.created());

        PipelineRunSummary summary = createService(storeReconciler).run();

        InOrder order = inOrder(storeReconciler);
        order.verify(storeReconciler).upsert(recordFor("Application 1", "a@one.com"));
        order.verify(storeReconciler).upsert(recordFor("Application 2", "b@two.com"));
        order.verify(storeReconciler).upsert(recordFor("Application 3", "c@three.com"));
        assertThat(summary.recordsUpserted()).isEqualTo(3);
        assertThat(summary.candidatesExtracted()).isEqualTo(3);
    }

    @Test
    void rerunAgainstUnchangedMailboxCreatesNoDuplicates() {
        List<RawMessage> mailbox = List.of(
            message("Thanks for applying to Acme", "jobs@acme.com", "first"),
            message("Application update from Acme", "jobs@acme.com", "second"),
            message("Recruiting: Globex", "hr@globex.io", "third")
        );
        when(mailboxReader.fetch(any())).thenAnswer(invocation -> MessageBatch.of(mailbox));
        when(semanticParser.parse(anyString(), anyString(), anyString(), any())).thenAnswer(invocation -> {
            String subject = invocation.getArgument(0);
            String company = subject.contains("Globex") ? "Globex" : "Acme";
            return ParseOutcome.of(new StructuredRecord(company, "Engineer", "Applied", RECEIVED, invocation.getArgument(2)));
        });
        InMemoryStore store = new InMemoryStore();

        IngestionPipelineService service = createService(store);
        service.run();
        service.run();

        assertThat(store.entries).containsOnlyKeys("Acme|Engineer", "Globex|Engineer");
        assertThat(store.creates).isEqualTo(2);
    }

    @Test
    void storeFailureIsRecordedAndLaterRecordsContinue() {
        StructuredRecord acme = new StructuredRecord("Acme", "Engineer", "Applied", RECEIVED, "jobs@acme.com");
        StructuredRecord globex = new StructuredRecord("Globex", "Analyst", "Applied", RECEIVED, "hr@globex.io");
        when(mailboxReader.fetch(any())).thenReturn(MessageBatch.of(List.of(
            message("Application to Acme", "jobs@acme.com", "a"),
            message("Application to Globex", "hr@globex.io", "b")
        )));
        when(semanticParser.parse(anyString(), anyString(), anyString(), any())).thenAnswer(invocation ->
            ParseOutcome.of(((String) invocation.getArgument(0)).contains("Acme") ? acme : globex));
        when(storeReconciler.upsert(acme)).thenReturn(UpsertResult.failure("Notion create failed: HTTP 502"));
        when(storeReconciler.upsert(globex)).thenReturn(UpsertResult.updated());

        PipelineRunSummary summary = createService(storeReconciler).run();

        assertThat(summary.recordsUpserted()).isEqualTo(1);
        assertThat(summary.failures()).hasSize(1);
        assertThat(summary.failures().get(0).reason()).isEqualTo("Notion create failed: HTTP 502");
        assertThat(summary.failures().get(0).subject()).isEqualTo("Application to Acme");
        assertThat(summary.failureReport().rowsWritten()).isEqualTo(1);
    }

    @Test
    void parserExceptionIsCapturedPerMessage() {
        StructuredRecord globex = new StructuredRecord("Globex", "Analyst", "Applied", RECEIVED, "hr@globex.io");
        when(mailboxReader.fetch(any())).thenReturn(MessageBatch.of(List.of(
            message("Application to Acme", "jobs@acme.com", "a"),
            message("Application to Globex", "hr@globex.io", "b")
        )));
        when(semanticParser.parse(anyString(), anyString(), anyString(), any())).thenAnswer(invocation -> {
            if (((String) invocation.getArgument(0)).contains("Acme")) {
                throw new IllegalStateException("model overloaded");
            }
            return ParseOutcome.of(globex);
        });
        when(storeReconciler.upsert(any())).thenReturn(UpsertResult.created());

        PipelineRunSummary summary = createService(storeReconciler).run();

        verify(storeReconciler).upsert(globex);
        assertThat(summary.failures()).extracting(FailureEntry::reason)
            .containsExactly("Parser error: model overloaded");
    }

    @Test
    void messagesWithoutEnvelopeAreSkippedAndMissingSenderStillParses() {
        RawMessage noEnvelope = new RawMessage(null, List.of(plain("orphan")));
        RawMessage noSender = new RawMessage(
            new MessageEnvelope("Application received", List.of(), RECEIVED),
            List.of(plain("body text"))
        );
        when(mailboxReader.fetch(any())).thenReturn(MessageBatch.of(List.of(noEnvelope, noSender)));
        when(semanticParser.parse(anyString(), anyString(), anyString(), any()))
            .thenReturn(ParseOutcome.of(new StructuredRecord("Acme", "Engineer", "Applied", RECEIVED, "")));
        when(storeReconciler.upsert(any())).thenReturn(UpsertResult.created());

        PipelineRunSummary summary = createService(storeReconciler).run();

        verify(semanticParser, times(1)).parse(eq("Application received"), eq("body text"), eq(""), any());
        assertThat(summary.candidatesExtracted()).isEqualTo(1);
        assertThat(summary.recordsUpserted()).isEqualTo(1);
    }

    @Test
    void mailboxSetupFailureAbortsBeforeAnyStage() {
        when(mailboxReader.fetch(any())).thenThrow(new TrackerSetupException("login rejected"));

        assertThatThrownBy(() -> createService(storeReconciler).run())
            .isInstanceOf(TrackerSetupException.class)
            .hasMessageContaining("login rejected");
        verify(semanticParser, never()).parse(anyString(), anyString(), anyString(), any());
        verify(failureReporter, never()).report(any());
    }

    @Test
    void storeSetupFailureAbortsBeforeFetching() {
        doThrow(new TrackerSetupException("Notion store is not configured")).when(storeReconciler).verifySetup();

        assertThatThrownBy(() -> createService(storeReconciler).run()).isInstanceOf(TrackerSetupException.class);
        verify(mailboxReader, never()).fetch(any());
    }

    @Test
    void fetchInterruptedMidStreamStillReconcilesAndReports() {
        StructuredRecord acme = new StructuredRecord("Acme", "Engineer", "Applied", RECEIVED, "jobs@acme.com");
        when(mailboxReader.fetch(any())).thenReturn(new FailingBatch(
            message("Application to Acme", "jobs@acme.com", "a"),
            3
        ));
        when(semanticParser.parse(anyString(), anyString(), anyString(), any())).thenReturn(ParseOutcome.of(acme));
        when(storeReconciler.upsert(any())).thenReturn(UpsertResult.created());

        PipelineRunSummary summary = createService(storeReconciler).run();

        assertThat(summary.status()).isEqualTo(PipelineRunSummary.FETCH_INCOMPLETE);
        assertThat(summary.messagesFound()).isEqualTo(3);
        assertThat(summary.recordsUpserted()).isEqualTo(1);
        verify(failureReporter, times(1)).report(any());
    }

    @Test
    void extractorExceptionsBecomeFailuresWithoutStallingTheRun() throws Exception {
        when(mailboxReader.fetch(any())).thenReturn(MessageBatch.of(List.of(
            message("Application 1", "a@one.com", "first"),
            message("Application 2", "b@two.com", "second"),
            message("Application 3", "c@three.com", "third")
        )));
        BodyExtractor brokenExtractor = new BodyExtractor() {
            @Override
            public String extractBody(RawMessage raw) {
                throw new IllegalStateException("charset table missing");
            }
        };
        IngestionPipelineService service = createService(storeReconciler, new SubjectFilter(properties), brokenExtractor);

        PipelineRunSummary summary = runWithin(service, 5);

        verify(semanticParser, never()).parse(anyString(), anyString(), anyString(), any());
        verify(storeReconciler, never()).upsert(any());
        assertThat(summary.status()).isEqualTo(PipelineRunSummary.COMPLETED_WITH_FAILURES);
        assertThat(summary.candidatesExtracted()).isZero();
        assertThat(summary.failures()).extracting(FailureEntry::subject)
            .containsExactly("Application 1", "Application 2", "Application 3");
        assertThat(summary.failures()).extracting(FailureEntry::reason)
            .containsOnly("Extraction error: charset table missing");
        assertThat(summary.failureReport().rowsWritten()).isEqualTo(3);
    }

    @Test
    void crashedExtractStageReleasesFetchAndMarksRunFailed() throws Exception {
        when(mailboxReader.fetch(any())).thenReturn(MessageBatch.of(List.of(
            message("Application 1", "a@one.com", "first"),
            message("Application 2", "b@two.com", "second"),
            message("Application 3", "c@three.com", "third"),
            message("Application 4", "d@four.com", "fourth")
        )));
        SubjectFilter crashingFilter = new SubjectFilter(properties) {
            @Override
            public boolean isJobRelated(String subject) {
                throw new LinkageError("keyword table failed to load");
            }
        };
        IngestionPipelineService service = createService(storeReconciler, crashingFilter, new BodyExtractor());

        PipelineRunSummary summary = runWithin(service, 5);

        assertThat(summary.status()).isEqualTo(PipelineRunSummary.STAGE_FAILED);
        assertThat(summary.messagesFound()).isEqualTo(4);
        assertThat(summary.recordsUpserted()).isZero();
        verify(failureReporter, times(1)).report(any());
    }

    private IngestionPipelineService createService(StoreReconciler store) {
        return createService(store, new SubjectFilter(properties), new BodyExtractor());
    }

    private IngestionPipelineService createService(
        StoreReconciler store,
        SubjectFilter subjectFilter,
        BodyExtractor bodyExtractor
    ) {
        return new IngestionPipelineService(
            mailboxReader,
            subjectFilter,
            bodyExtractor,
            new SenderExtractor(),
            semanticParser,
            store,
            failureReporter,
            executor,
            properties,
            Clock.fixed(NOW, ZoneOffset.UTC)
        );
    }

    private PipelineRunSummary runWithin(IngestionPipelineService service, int seconds) throws Exception {
        ExecutorService caller = Executors.newSingleThreadExecutor();
        try {
            Future<PipelineRunSummary> pending = caller.submit(service::run);
            return pending.get(seconds, TimeUnit.SECONDS);
        } finally {
            caller.shutdownNow();
        }
    }

    private Path reportPath() {
        return tempDir.resolve("unparsed").resolve("unparsed_emails.csv");
    }

    private static StructuredRecord recordFor(String subject, String sender) {
        return new StructuredRecord("Company " + subject, "Engineer", "Applied", RECEIVED, sender);
    }

    private static RawMessage message(String subject, String sender, String body) {
        int at = sender.indexOf('@');
        MailAddress from = new MailAddress(sender.substring(0, at), sender.substring(at + 1));
        return new RawMessage(new MessageEnvelope(subject, List.of(from), RECEIVED), List.of(plain(body)));
    }

    private static BodyPart plain(String body) {
        return new BodyPart("text/plain; charset=utf-8", body.getBytes(StandardCharsets.UTF_8));
    }

    private static final class InMemoryStore implements StoreReconciler {
        private final Map<String, StructuredRecord> entries = new LinkedHashMap<>();
        private int creates;

        @Override
        public UpsertResult upsert(StructuredRecord record) {
            String key = record.company() + "|" + record.position();
            if (entries.put(key, record) == null) {
                creates++;
                return UpsertResult.created();
            }
            return UpsertResult.updated();
        }
    }

    /**
     * Reports {@code size} search hits but loses the connection after the first message.
     */
    private static final class FailingBatch implements MessageBatch {
        private final RawMessage first;
        private final int size;

        private FailingBatch(RawMessage first, int size) {
            this.first = first;
            this.size = size;
        }

        @Override
        public int size() {
            return size;
        }

        @Override
        public Iterator<RawMessage> iterator() {
            List<RawMessage> delivered = new ArrayList<>();
            return new Iterator<>() {
                @Override
                public boolean hasNext() {
                    return true;
                }

                @Override
                public RawMessage next() {
                    if (delivered.isEmpty()) {
                        delivered.add(first);
                        return first;
                    }
                    throw new MailboxReadException("connection reset", new IllegalStateException("socket closed"));
                }
            };
        }

        @Override
        public void close() {
        }
    }
}
