package uk.gegc.learnpath.features.ai.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import uk.gegc.learnpath.shared.config.AiRateLimitConfig;
import uk.gegc.learnpath.shared.exception.UpstreamServiceException;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("SpringAiScoringOracle Tests")
class SpringAiScoringOracleTest {

    @Mock
    private ChatClient chatClient;

    @Mock
    private ChatClient.ChatClientRequestSpec requestSpec;

    @Mock
    private ChatClient.CallResponseSpec callResponseSpec;

    private AiRateLimitConfig rateLimitConfig;
    private int sleepCallCount;
    private SpringAiScoringOracle oracle;

    @BeforeEach
    void setUp() {
        rateLimitConfig = new AiRateLimitConfig();
        rateLimitConfig.setMaxRetries(3);
        sleepCallCount = 0;
        oracle = new SpringAiScoringOracle(chatClient, rateLimitConfig) {
            @Override
            protected void sleepForRateLimit(long delayMs) {
                sleepCallCount++;
            }
        };
        lenient().when(chatClient.prompt()).thenReturn(requestSpec);
        lenient().when(requestSpec.user(anyString())).thenReturn(requestSpec);
        lenient().when(requestSpec.call()).thenReturn(callResponseSpec);
    }

    private static ChatResponse reply(String text) {
        return new ChatResponse(List.of(new Generation(new AssistantMessage(text))));
    }

    @Nested
    @DisplayName("reply parsing")
    class Parsing {

        @Test
        @DisplayName("takes the first integer in the reply")
        void firstInteger() {
            when(callResponseSpec.chatResponse()).thenReturn(reply("Score: 85. Good answer, 10/10 effort"));

            assertThat(oracle.score("q", "a", "r", "rubric")).isEqualTo(85);
        }

        @Test
        @DisplayName("clamps out-of-range values")
        void clamps() {
            assertThat(SpringAiScoringOracle.parseScore("150")).isEqualTo(100);
            assertThat(SpringAiScoringOracle.parseScore("-5")).isZero();
        }

        @Test
        @DisplayName("a reply without a number is an upstream failure")
        void noNumber_throws() {
            assertThatThrownBy(() -> SpringAiScoringOracle.parseScore("excellent"))
                    .isInstanceOf(UpstreamServiceException.class);
        }
    }

    @Nested
    @DisplayName("retries")
    class Retries {

        @Test
        @DisplayName("rate limit errors back off and retry")
        void rateLimit_retriesThenSucceeds() {
            when(callResponseSpec.chatResponse())
                    .thenThrow(new RuntimeException("429 Too Many Requests"))
                    .thenReturn(reply("72"));

            assertThat(oracle.score("q", "a", "r", "rubric")).isEqualTo(72);
            assertThat(sleepCallCount).isEqualTo(1);
        }

        @Test
        @DisplayName("persistent failure raises UpstreamServiceException after max retries")
        void persistentFailure_throws() {
            when(callResponseSpec.chatResponse()).thenThrow(new RuntimeException("connection refused"));

            assertThatThrownBy(() -> oracle.score("q", "a", "r", "rubric"))
                    .isInstanceOf(UpstreamServiceException.class)
                    .hasMessageContaining("3 attempts");
            verify(callResponseSpec, times(3)).chatResponse();
            assertThat(sleepCallCount).isZero();
        }
    }
}
