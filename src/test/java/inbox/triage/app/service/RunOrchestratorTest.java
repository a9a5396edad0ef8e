package inbox.triage.app.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import inbox.triage.app.config.RunSettings;
import inbox.triage.app.model.Category;
import inbox.triage.app.model.MailMessage;
import inbox.triage.app.model.RunMode;
import inbox.triage.app.model.RunOutcome;
import inbox.triage.app.model.RunResult;
import inbox.triage.app.model.RunState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RunOrchestratorTest {

    private static final Instant NOW = Instant.parse("2024-05-10T12:00:00Z");
    private static final Pattern SUBJECT_WIRE_NAME = Pattern.compile("Subject: ([a-z_]+)");

    @Mock
    private LanguageModelClient languageModelClient;

    private InMemoryMailStore mailStore;
    private RunSettings settings;

    @BeforeEach
    void setUp() {
        mailStore = new InMemoryMailStore();
        settings = RunSettings.builder()
                .reportRecipient("me@example.com")
                .reportSender("digest@example.com")
                .operatorRecipient("ops@example.com")
                .socialDigestEnabled(false)
                .build();

        // the first word of each subject is the category the model answers with
        lenient().when(languageModelClient.complete(anyString(), anyInt(), anyDouble(), eq(true)))
                .thenAnswer(invocation -> {
                    Matcher matcher = SUBJECT_WIRE_NAME.matcher(invocation.getArgument(0, String.class));
                    String category = matcher.find() ? matcher.group(1) : "misc";
                    return "{\"category\": \"" + category + "\", \"confidence\": 0.9, " +
                            "\"summary\": \"About " + category + "\", \"reasoning\": \"test\"}";
                });
    }

    private RunOrchestrator orchestrator(MailStore store, RunSettings runSettings) {
        LabelStateManager labelStateManager = new LabelStateManager(store);
        return new RunOrchestrator(
                store,
                new ClassificationGateway(languageModelClient, new ClassificationPromptBuilder(),
                        new VerdictParser(new ObjectMapper()), new ClassificationDecoder()),
                new RetentionPolicyEngine(new RetentionPolicyTable(runSettings), store),
                labelStateManager,
                new RunAggregator(new SocialDigestService(languageModelClient)),
                new SelfReportDetector(runSettings),
                new BasicHtmlReportRenderer(runSettings),
                runSettings,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private MailMessage message(String id, String subject, long daysOld) {
        return MailMessage.builder()
                .id(id)
                .threadId("t-" + id)
                .subject(subject)
                .sender("someone@example.com")
                .bodyExcerpt("body of " + id)
                .receivedAt(NOW.minus(Duration.ofDays(daysOld)))
                .unread(true)
                .build();
    }

    @Test
    void run_InPreview_ShouldNotMutateButStillReport() {
        mailStore.addMessage(message("m1", "urgent server down", 0));
        mailStore.addMessage(message("m2", "promotions spring sale", 0));
        mailStore.addMessage(message("m3", "financial old statement", 10));

        RunOutcome outcome = orchestrator(mailStore, settings).run(RunMode.PREVIEW);

        assertTrue(outcome.isSuccessful());
        assertTrue(mailStore.mutations.isEmpty());
        assertTrue(mailStore.isInInbox("t-m2"));
        assertTrue(mailStore.isInInbox("t-m3"));

        RunResult result = outcome.getResult();
        assertEquals(3, result.getProcessedCount());
        assertEquals(1, result.getItems(Category.URGENT).size());
        assertEquals(1, result.getItems(Category.PROMOTIONS).size());
        assertEquals(1, result.getAgedArchivedCount());
        assertFalse(result.getItems(Category.URGENT).get(0).isLabeled());

        assertEquals(1, mailStore.sent.size());
        assertEquals("me@example.com", mailStore.sent.get(0).to);
        assertTrue(mailStore.sent.get(0).subject.endsWith("(preview)"));
        assertTrue(mailStore.sent.get(0).html.contains("urgent server down"));
    }

    @Test
    void run_InFull_ShouldApplyLabelsAndRetention() {
        mailStore.addMessage(message("m1", "security_alert new login", 0));
        mailStore.addMessage(message("m2", "promotions spring sale", 0));
        mailStore.addMessage(message("m3", "financial old statement", 10));
        mailStore.addMessage(message("m4", "financial fresh invoice", 1));

        RunOutcome outcome = orchestrator(mailStore, settings).run(RunMode.FULL);

        assertTrue(outcome.isSuccessful());
        assertTrue(mailStore.isStarred("m1"));
        assertTrue(mailStore.isImportant("t-m1"));
        assertTrue(mailStore.isInInbox("t-m1"));
        assertFalse(mailStore.isInInbox("t-m2"));
        assertFalse(mailStore.isInInbox("t-m3"));
        assertTrue(mailStore.isInInbox("t-m4"));
        assertEquals(Category.PROMOTIONS.getLabelName(), mailStore.labelNames("t-m2").iterator().next());
        assertEquals(Category.FINANCIAL.getLabelName(), mailStore.labelNames("t-m4").iterator().next());

        RunResult result = outcome.getResult();
        assertEquals(1, result.getAutoArchivedCount(Category.PROMOTIONS));
        assertEquals(1, result.getAgedArchivedCount());
        assertEquals(1, result.getItems(Category.FINANCIAL).size());
        assertTrue(result.isFinished());
        assertEquals(RunState.DONE, outcome.getState());
    }

    @Test
    void run_TwiceOverSameThread_ShouldKeepSingleManagedLabel() {
        mailStore.addMessage(message("m1", "promotions spring sale", 0));

        RunOrchestrator orchestrator = orchestrator(mailStore, settings);
        orchestrator.run(RunMode.FULL);
        orchestrator.run(RunMode.FULL);

        assertEquals(1, mailStore.labelNames("t-m1").size());
        assertEquals(1, mailStore.labelCreates);
        assertEquals(1, mailStore.mutationCount("addLabel:"));
        assertEquals(1, mailStore.mutationCount("archive:"));
        assertFalse(mailStore.isInInbox("t-m1"));
    }

    @Test
    void run_WithSeveralMessagesInOneConversation_ShouldClassifyNewestOnly() {
        MailMessage newer = message("m2", "urgent server down", 0).toBuilder().threadId("t-shared").build();
        MailMessage older = message("m1", "promotions spring sale", 2).toBuilder().threadId("t-shared").build();
        mailStore.addMessage(newer);
        mailStore.addMessage(older);

        RunOutcome outcome = orchestrator(mailStore, settings).run(RunMode.FULL);

        RunResult result = outcome.getResult();
        assertEquals(1, result.getProcessedCount());
        assertEquals(1, result.getItems(Category.URGENT).size());
        assertTrue(result.getItems(Category.PROMOTIONS).isEmpty());
        assertEquals(java.util.Set.of(Category.URGENT.getLabelName()), mailStore.labelNames("t-shared"));
        assertTrue(mailStore.isInInbox("t-shared"));
        assertEquals(0, mailStore.mutationCount("archive:"));
        verify(languageModelClient, times(1)).complete(anyString(), anyInt(), anyDouble(), eq(true));
    }

    @Test
    void newestPerConversation_ShouldKeepFirstSeenOrder() {
        MailMessage a1 = message("a1", "misc a", 3).toBuilder().threadId("A").build();
        MailMessage b1 = message("b1", "misc b", 1).toBuilder().threadId("B").build();
        MailMessage a2 = message("a2", "misc a reply", 0).toBuilder().threadId("A").build();

        List<MailMessage> conversations = RunOrchestrator.newestPerConversation(List.of(a1, b1, a2));

        assertEquals(List.of("a2", "b1"), conversations.stream().map(MailMessage::getId).toList());
    }

    @Test
    void run_ShouldArchiveOwnReportWithoutClassifyingIt() {
        MailMessage ownReport = MailMessage.builder()
                .id("r1")
                .threadId("t-r1")
                .subject("[Inbox Digest] 2024-05-09: 2 need action, 5 total")
                .sender("Digest <digest@example.com>")
                .receivedAt(NOW.minus(Duration.ofDays(1)))
                .build();
        mailStore.addMessage(ownReport);
        mailStore.addMessage(message("m1", "todo reply to contract", 0));

        RunOutcome outcome = orchestrator(mailStore, settings).run(RunMode.FULL);

        RunResult result = outcome.getResult();
        assertEquals(1, result.getSkippedReportCount());
        assertEquals(1, result.getProcessedCount());
        assertEquals(1, result.getItems(Category.TODO).size());
        assertFalse(mailStore.isInInbox("t-r1"));
        assertTrue(mailStore.labelNames("t-r1").isEmpty());
        verify(languageModelClient, times(1)).complete(anyString(), anyInt(), anyDouble(), eq(true));
    }

    @Test
    void run_WhenOneMessageFails_ShouldRecordErrorAndContinue() {
        InMemoryMailStore failingStore = new InMemoryMailStore() {
            @Override
            public void starMessage(String messageId) {
                if (messageId.equals("m1")) {
                    throw new IllegalStateException("star rejected");
                }
                super.starMessage(messageId);
            }
        };
        failingStore.addMessage(message("m1", "security_alert new login", 0));
        failingStore.addMessage(message("m2", "todo sign form", 0));

        RunOutcome outcome = orchestrator(failingStore, settings).run(RunMode.FULL);

        assertTrue(outcome.isSuccessful());
        RunResult result = outcome.getResult();
        assertEquals(1, result.getErrors().size());
        assertEquals("m1", result.getErrors().get(0).getMessageId());
        assertEquals("star rejected", result.getErrors().get(0).getError());
        assertEquals(1, result.getItems(Category.TODO).size());
        assertTrue(failingStore.sent.get(0).html.contains("star rejected"));
    }

    @Test
    void run_WhenFetchFails_ShouldFailAndAlertOperator() {
        mailStore.failFetch = true;
        RunOrchestrator orchestrator = orchestrator(mailStore, settings);

        RunOutcome outcome = orchestrator.run(RunMode.FULL);

        assertEquals(RunState.FAILED, outcome.getState());
        assertNull(outcome.getResult());
        assertTrue(outcome.getFailure().contains("connection reset"));
        assertEquals(RunState.FAILED, orchestrator.getState());
        assertEquals(1, mailStore.sent.size());
        assertEquals("ops@example.com", mailStore.sent.get(0).to);
        assertEquals("[Inbox Digest] Run failed", mailStore.sent.get(0).subject);
        verifyNoInteractions(languageModelClient);
    }

    @Test
    void run_WhenReportSendFails_ShouldEndFailed() {
        mailStore.addMessage(message("m1", "todo sign form", 0));
        mailStore.failSend = true;

        RunOutcome outcome = orchestrator(mailStore, settings).run(RunMode.FULL);

        assertFalse(outcome.isSuccessful());
        assertTrue(outcome.getFailure().contains("smtp unavailable"));
    }

    @Test
    void run_WithoutRecipient_ShouldFail() {
        mailStore.addMessage(message("m1", "todo sign form", 0));
        RunSettings noRecipient = settings.toBuilder().reportRecipient(null).operatorRecipient(null).build();

        RunOutcome outcome = orchestrator(mailStore, noRecipient).run(RunMode.PREVIEW);

        assertEquals(RunState.FAILED, outcome.getState());
        assertTrue(mailStore.sent.isEmpty());
    }

    @Test
    void run_InLimitedMode_ShouldRespectBatchCap() {
        for (int i = 0; i < 5; i++) {
            mailStore.addMessage(message("m" + i, "misc note " + i, 0));
        }
        RunSettings capped = settings.toBuilder().batchCap(2).build();

        RunOutcome outcome = orchestrator(mailStore, capped).run(RunMode.LIMITED);

        assertEquals(2, outcome.getResult().getProcessedCount());
        assertEquals(2, outcome.getResult().getItems(Category.MISC).size());
        assertEquals(2, mailStore.mutationCount("addLabel:"));
    }

    @Test
    void run_WithDuplicateMessageIds_ShouldProcessOnce() {
        mailStore.addMessage(message("m1", "waiting on vendor", 0));
        mailStore.addMessage(message("m1", "waiting on vendor", 0));

        RunOutcome outcome = orchestrator(mailStore, settings).run(RunMode.FULL);

        assertEquals(1, outcome.getResult().getProcessedCount());
    }

    @Test
    void run_WithSocialDigest_ShouldSummarizePerPlatform() {
        doReturn("Three new replies on your thread.")
                .when(languageModelClient).complete(anyString(), anyInt(), anyDouble(), eq(false));
        mailStore.addMessage(message("m1", "social_community reply on thread", 0));
        RunSettings withDigest = settings.toBuilder().socialDigestEnabled(true).build();

        RunOutcome outcome = orchestrator(mailStore, withDigest).run(RunMode.FULL);

        assertEquals("Three new replies on your thread.", outcome.getResult().getSocialDigests().get("Other"));
        assertTrue(mailStore.sent.get(0).html.contains("Three new replies on your thread."));
    }
}
