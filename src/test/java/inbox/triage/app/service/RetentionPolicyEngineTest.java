package inbox.triage.app.service;

import inbox.triage.app.config.RunSettings;
import inbox.triage.app.model.AgingAction;
import inbox.triage.app.model.Category;
import inbox.triage.app.model.MailMessage;
import inbox.triage.app.model.MailboxAction;
import inbox.triage.app.model.RetentionDecision;
import inbox.triage.app.model.RunContext;
import inbox.triage.app.model.RunMode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RetentionPolicyEngineTest {

    private static final Instant NOW = Instant.parse("2024-05-10T12:00:00Z");

    @Mock
    private MailStore mailStore;

    private RetentionPolicyEngine engine;
    private MailMessage message;

    @BeforeEach
    void setUp() {
        RunSettings settings = RunSettings.builder()
                .financialWarningDays(5)
                .financialArchiveDays(7)
                .build();
        engine = new RetentionPolicyEngine(new RetentionPolicyTable(settings), mailStore);
        message = MailMessage.builder().id("m1").threadId("t1").receivedAt(NOW.minus(Duration.ofDays(2))).build();
    }

    @Test
    void decide_FinancialPastArchiveThreshold_ShouldArchiveAsAgedOut() {
        RetentionDecision decision = engine.decide(Category.FINANCIAL, 8);

        assertEquals(AgingAction.ARCHIVE, decision.getAging().getAction());
        assertTrue(decision.isAgedOut());
        assertTrue(decision.archives());
        assertFalse(decision.archivesImmediately());
    }

    @Test
    void decide_FinancialAtWarningThreshold_ShouldKeepWithWarning() {
        RetentionDecision decision = engine.decide(Category.FINANCIAL, 5);

        assertEquals(AgingAction.WARN, decision.getAging().getAction());
        assertFalse(decision.archives());
        assertFalse(decision.getAging().getWarningText().isBlank());
    }

    @Test
    void decide_FinancialAtArchiveThreshold_ShouldStillWarn() {
        RetentionDecision decision = engine.decide(Category.FINANCIAL, 7);

        assertEquals(AgingAction.WARN, decision.getAging().getAction());
        assertEquals("7 days old, auto-archives in 1 day", decision.getAging().getWarningText());
    }

    @Test
    void decide_FinancialBelowWarningThreshold_ShouldKeepWithoutWarning() {
        RetentionDecision decision = engine.decide(Category.FINANCIAL, 4);

        assertEquals(AgingAction.KEEP, decision.getAging().getAction());
        assertTrue(decision.getAging().warning().isEmpty());
        assertTrue(decision.getActions().isEmpty());
    }

    @Test
    void decide_ActionTier_ShouldNeverArchiveRegardlessOfAge() {
        assertEquals(Set.of(MailboxAction.MARK_IMPORTANT, MailboxAction.MARK_UNREAD),
                engine.decide(Category.URGENT, 400).getActions());
        assertEquals(Set.of(MailboxAction.MARK_UNREAD), engine.decide(Category.TODO, 400).getActions());
        assertEquals(Set.of(MailboxAction.MARK_UNREAD), engine.decide(Category.WAITING, 400).getActions());
        assertEquals(Set.of(MailboxAction.STAR, MailboxAction.MARK_IMPORTANT, MailboxAction.MARK_UNREAD),
                engine.decide(Category.SECURITY_ALERT, 400).getActions());
    }

    @Test
    void decide_ImmediateArchiveCategories_ShouldArchiveOnSight() {
        for (Category category : new Category[]{Category.CREATOR_NEWSLETTERS, Category.SOCIAL_COMMUNITY,
                Category.PROMOTIONS, Category.PURCHASES}) {
            RetentionDecision decision = engine.decide(category, 0);
            assertTrue(decision.archivesImmediately(), category + " should archive immediately");
            assertEquals(Set.of(MailboxAction.ARCHIVE), decision.getActions());
        }
        assertTrue(engine.decide(Category.MISC, 90).getActions().isEmpty());
    }

    @Test
    void decide_PurchasesWithAgingVariant_ShouldFollowPurchaseThresholds() {
        RunSettings settings = RunSettings.builder()
                .purchasesPolicy(RunSettings.PurchasesPolicy.AGING)
                .purchasesWarningDays(3)
                .purchasesArchiveDays(5)
                .build();
        RetentionPolicyEngine agingEngine = new RetentionPolicyEngine(new RetentionPolicyTable(settings), mailStore);

        assertEquals(AgingAction.KEEP, agingEngine.decide(Category.PURCHASES, 2).getAging().getAction());
        assertEquals(AgingAction.WARN, agingEngine.decide(Category.PURCHASES, 3).getAging().getAction());
        assertTrue(agingEngine.decide(Category.PURCHASES, 6).isAgedOut());
    }

    @Test
    void ageInDays_ShouldFloorElapsedWholeDays() {
        Instant received = NOW.minus(Duration.ofDays(5)).minus(Duration.ofHours(23));

        assertEquals(5, RetentionPolicyEngine.ageInDays(received, NOW));
        assertEquals(0, RetentionPolicyEngine.ageInDays(NOW.minus(Duration.ofHours(23)), NOW));
        assertEquals(0, RetentionPolicyEngine.ageInDays(NOW.plus(Duration.ofDays(1)), NOW));
    }

    @Test
    void decide_ForMessage_ShouldUseContextClock() {
        message.setReceivedAt(NOW.minus(Duration.ofDays(8)));

        RetentionDecision decision = engine.decide(message, Category.FINANCIAL, new RunContext(RunMode.FULL, NOW));

        assertTrue(decision.isAgedOut());
        assertEquals(8, decision.getAging().getDaysOld());
    }

    @Test
    void apply_InPreviewMode_ShouldNotMutate() throws Exception {
        RetentionDecision decision = engine.decide(Category.SECURITY_ALERT, 0);

        engine.apply(message, decision, new RunContext(RunMode.PREVIEW, NOW));

        verifyNoInteractions(mailStore);
    }

    @Test
    void apply_SecurityAlert_ShouldStarMarkImportantAndUnread() throws Exception {
        RetentionDecision decision = engine.decide(Category.SECURITY_ALERT, 0);

        engine.apply(message, decision, new RunContext(RunMode.FULL, NOW));

        verify(mailStore).starMessage("m1");
        verify(mailStore).markThreadImportant("t1");
        verify(mailStore).markUnread("m1");
        verify(mailStore, never()).archiveThread(anyString());
    }

    @Test
    void apply_Promotions_ShouldArchiveThread() throws Exception {
        engine.apply(message, engine.decide(Category.PROMOTIONS, 0), new RunContext(RunMode.LIMITED, NOW));

        verify(mailStore).archiveThread("t1");
        verifyNoMoreInteractions(mailStore);
    }

    @Test
    void apply_AlreadyArchivedThread_ShouldNotArchiveAgain() throws Exception {
        MailMessage archived = message.toBuilder().archived(true).build();

        engine.apply(archived, engine.decide(Category.PROMOTIONS, 0), new RunContext(RunMode.FULL, NOW));

        verifyNoInteractions(mailStore);
    }

    @Test
    void apply_WhenStoreRejects_ShouldPropagate() throws Exception {
        doThrow(new java.io.IOException("503")).when(mailStore).archiveThread("t1");

        assertThrows(java.io.IOException.class,
                () -> engine.apply(message, engine.decide(Category.PROMOTIONS, 0), new RunContext(RunMode.FULL, NOW)));
    }
}
