package inbox.triage.app.service;

import inbox.triage.app.model.Category;
import inbox.triage.app.model.Classification;
import inbox.triage.app.model.ReportItem;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SocialDigestServiceTest {

    @Mock
    private LanguageModelClient languageModelClient;

    @InjectMocks
    private SocialDigestService socialDigestService;

    private ReportItem item(String subject) {
        return ReportItem.builder()
                .messageId(subject)
                .subject(subject)
                .sender("notifications@linkedin.com")
                .classification(Classification.builder()
                        .category(Category.SOCIAL_COMMUNITY)
                        .confidence(0.8)
                        .summary("Highlight for " + subject)
                        .reasoning("")
                        .build())
                .build();
    }

    @Test
    void summarize_ShouldReturnTrimmedDigestAndSendTriples() {
        when(languageModelClient.complete(anyString(), anyInt(), anyDouble(), eq(false)))
                .thenReturn("  Two people viewed your profile and a post got comments.  ");

        String digest = socialDigestService.summarize("LinkedIn", List.of(item("Profile views"), item("New comment")));

        assertEquals("Two people viewed your profile and a post got comments.", digest);
        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(languageModelClient).complete(prompt.capture(), anyInt(), anyDouble(), eq(false));
        assertTrue(prompt.getValue().contains("Subject: Profile views | From: notifications@linkedin.com | Summary: Highlight for Profile views"));
        assertTrue(prompt.getValue().contains("LinkedIn"));
    }

    @Test
    void summarize_WhenClientFails_ShouldDegradeToCount() {
        when(languageModelClient.complete(anyString(), anyInt(), anyDouble(), anyBoolean()))
                .thenThrow(new RuntimeException("timeout"));

        assertEquals("3 updates", socialDigestService.summarize("Reddit", List.of(item("a"), item("b"), item("c"))));
    }

    @Test
    void summarize_WithUnusableOutput_ShouldDegradeToCount() {
        when(languageModelClient.complete(anyString(), anyInt(), anyDouble(), anyBoolean()))
                .thenReturn("   ")
                .thenReturn("{\"digest\": \"json instead of text\"}")
                .thenReturn("z".repeat(1000));
        when(languageModelClient.providerName()).thenReturn("openai");

        assertEquals("1 update", socialDigestService.summarize("GitHub", List.of(item("a"))));
        assertEquals("1 update", socialDigestService.summarize("GitHub", List.of(item("a"))));
        assertEquals("1 update", socialDigestService.summarize("GitHub", List.of(item("a"))));
    }

    @Test
    void summarize_WithNoItems_ShouldNotCallClient() {
        assertEquals("0 updates", socialDigestService.summarize("Discord", List.of()));

        verifyNoInteractions(languageModelClient);
    }
}
