package uk.gegc.learnpath.features.ai.application.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.ChatOptions;
import uk.gegc.learnpath.features.ai.api.dto.AuthoringResult;
import uk.gegc.learnpath.features.ai.config.AuthoringProperties;
import uk.gegc.learnpath.features.ai.domain.model.Audience;
import uk.gegc.learnpath.features.content.domain.model.ContentKind;
import uk.gegc.learnpath.shared.config.AiRateLimitConfig;
import uk.gegc.learnpath.shared.exception.AiServiceUnavailableException;
import uk.gegc.learnpath.shared.exception.ForbiddenException;
import uk.gegc.learnpath.shared.exception.UpstreamServiceException;
import uk.gegc.learnpath.shared.exception.ValidationException;
import uk.gegc.learnpath.shared.security.AccessPolicy;
import uk.gegc.learnpath.shared.security.CurrentUser;
import uk.gegc.learnpath.shared.security.CurrentUserResolver;
import uk.gegc.learnpath.shared.security.UserRole;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("AuthoringServiceImpl Tests")
class AuthoringServiceImplTest {

    @Mock
    private ChatClient chatClient;
    @Mock
    private ChatClient.ChatClientRequestSpec requestSpec;
    @Mock
    private ChatClient.CallResponseSpec callResponseSpec;
    @Mock
    private CurrentUserResolver currentUserResolver;

    private AuthoringProperties properties;
    private int sleepCallCount;
    private AuthoringServiceImpl service;

    @BeforeEach
    void setUp() {
        AiRateLimitConfig rateLimitConfig = new AiRateLimitConfig();
        rateLimitConfig.setMaxRetries(3);
        properties = new AuthoringProperties();
        sleepCallCount = 0;
        service = new AuthoringServiceImpl(chatClient, rateLimitConfig, properties, currentUserResolver,
                new AccessPolicy(), new ObjectMapper()) {
            @Override
            protected void sleepForRateLimit(long delayMs) {
                sleepCallCount++;
            }
        };
        lenient().when(chatClient.prompt()).thenReturn(requestSpec);
        lenient().when(requestSpec.system(anyString())).thenReturn(requestSpec);
        lenient().when(requestSpec.user(anyString())).thenReturn(requestSpec);
        lenient().when(requestSpec.options(any())).thenReturn(requestSpec);
        lenient().when(requestSpec.call()).thenReturn(callResponseSpec);
        actAs(UserRole.CONTENT_MANAGER);
    }

    private void actAs(UserRole role) {
        lenient().when(currentUserResolver.requireCurrentUser()).thenReturn(new CurrentUser(UUID.randomUUID(), role));
    }

    private static ChatResponse reply(String text) {
        return new ChatResponse(List.of(new Generation(new AssistantMessage(text))));
    }

    private String capturedSystemPrompt() {
        ArgumentCaptor<String> captor = ArgumentCaptor.forClass(String.class);
        verify(requestSpec, atLeastOnce()).system(captor.capture());
        return captor.getValue();
    }

    @Nested
    @DisplayName("prompts")
    class Prompts {

        @Test
        @DisplayName("summary prompt carries the requested length and a matching token budget")
        void summarize() {
            when(callResponseSpec.chatResponse()).thenReturn(reply("  Streams process data lazily.  "));

            AuthoringResult result = service.summarize("A long lesson about Java streams", 300);

            assertThat(result.text()).isEqualTo("Streams process data lazily.");
            assertThat(capturedSystemPrompt()).contains("under 300 characters");
            ArgumentCaptor<ChatOptions> options = ArgumentCaptor.forClass(ChatOptions.class);
            verify(requestSpec).options(options.capture());
            assertThat(options.getValue().getMaxTokens()).isEqualTo(150);
            assertThat(options.getValue().getTemperature()).isEqualTo(0.3);
        }

        @Test
        @DisplayName("summary length defaults from configuration")
        void summarize_defaultLength() {
            when(callResponseSpec.chatResponse()).thenReturn(reply("Short."));

            service.summarize("Body", null);

            assertThat(capturedSystemPrompt()).contains("under 200 characters");
        }

        @Test
        @DisplayName("rewrites lead with the audience persona")
        void rewrite_usesPersona() {
            when(callResponseSpec.chatResponse()).thenReturn(reply("Rewritten"));

            service.rewriteForAudience("Kubernetes schedules pods", Audience.FOUNDER);

            assertThat(capturedSystemPrompt())
                    .startsWith(Audience.FOUNDER.getPersona())
                    .contains("Rewrite the following content");
        }

        @Test
        @DisplayName("module drafts ask for an outline of lessons")
        void generate_module() {
            when(callResponseSpec.chatResponse()).thenReturn(reply("# Module"));

            service.generateContent("Observability", Audience.GENERAL, ContentKind.MODULE);

            assertThat(capturedSystemPrompt()).contains("outline for a learning module");
            verify(requestSpec).user("Create content about: Observability");
        }

        @Test
        @DisplayName("drafts are limited to lessons, modules and courses")
        void generate_challengeRejected() {
            assertThatThrownBy(() -> service.generateContent("Quiz", Audience.GENERAL, ContentKind.CHALLENGE))
                    .isInstanceOf(ValidationException.class);
            verifyNoInteractions(chatClient);
        }

        @Test
        @DisplayName("meta descriptions send only an excerpt of the body")
        void metaDescription_excerpt() {
            when(callResponseSpec.chatResponse()).thenReturn(reply("Learn streams in minutes."));
            String body = "x".repeat(1200);

            service.generateMetaDescription("Java Streams", body);

            ArgumentCaptor<String> user = ArgumentCaptor.forClass(String.class);
            verify(requestSpec).user(user.capture());
            assertThat(user.getValue())
                    .startsWith("Title: Java Streams")
                    .endsWith("x".repeat(500) + "...")
                    .hasSizeLessThan(600);
        }
    }

    @Nested
    @DisplayName("suggestions")
    class Suggestions {

        @Test
        @DisplayName("a JSON array reply becomes the suggestion list")
        void jsonArray() {
            when(callResponseSpec.chatResponse()).thenReturn(reply("""
                    ```json
                    ["Add a diagram", "Shorten the intro", " "]
                    ```"""));

            assertThat(service.suggestImprovements("Lesson body"))
                    .containsExactly("Add a diagram", "Shorten the intro");
        }

        @Test
        @DisplayName("a plain list reply is split into lines without markers")
        void plainLines() {
            when(callResponseSpec.chatResponse()).thenReturn(reply("""
                    1. Add a worked example

                    - Link to the glossary
                    * End with a recap"""));

            assertThat(service.suggestImprovements("Lesson body"))
                    .containsExactly("Add a worked example", "Link to the glossary", "End with a recap");
        }
    }

    @Nested
    @DisplayName("guards and failures")
    class Guards {

        @Test
        @DisplayName("learners cannot use the assistant")
        void learnerForbidden() {
            actAs(UserRole.USER);

            assertThatThrownBy(() -> service.improveWriting("text"))
                    .isInstanceOf(ForbiddenException.class);
            verifyNoInteractions(chatClient);
        }

        @Test
        @DisplayName("a disabled assistant fails fast")
        void disabled() {
            properties.setEnabled(false);

            assertThat(service.isAvailable()).isFalse();
            assertThatThrownBy(() -> service.improveWriting("text"))
                    .isInstanceOf(AiServiceUnavailableException.class);
            verifyNoInteractions(chatClient);
        }

        @Test
        @DisplayName("oversized input is rejected before calling the model")
        void oversized() {
            properties.setMaxInputLength(10);

            assertThatThrownBy(() -> service.improveWriting("more than ten characters"))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("at most 10");
            verifyNoInteractions(chatClient);
        }

        @Test
        @DisplayName("rate limit errors back off and retry")
        void rateLimit_retries() {
            when(callResponseSpec.chatResponse())
                    .thenThrow(new RuntimeException("429 Too Many Requests"))
                    .thenReturn(reply("Better text"));

            assertThat(service.improveWriting("text").text()).isEqualTo("Better text");
            assertThat(sleepCallCount).isEqualTo(1);
        }

        @Test
        @DisplayName("blank replies count as failures and surface after the last attempt")
        void blankReply_exhausts() {
            when(callResponseSpec.chatResponse()).thenReturn(reply("   "));

            assertThatThrownBy(() -> service.improveWriting("text"))
                    .isInstanceOf(UpstreamServiceException.class)
                    .hasMessageContaining("empty reply");
            verify(callResponseSpec, times(3)).chatResponse();
        }
    }
}
