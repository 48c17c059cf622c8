package uk.gegc.learnpath.features.ai.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.stereotype.Service;
import uk.gegc.learnpath.features.ai.application.ScoringOracle;
import uk.gegc.learnpath.shared.config.AiRateLimitConfig;
import uk.gegc.learnpath.shared.exception.UpstreamServiceException;

import java.time.Duration;
import java.time.Instant;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Service
@RequiredArgsConstructor
@Slf4j
public class SpringAiScoringOracle implements ScoringOracle {

    private static final Pattern FIRST_INTEGER = Pattern.compile("-?\\d+");

    private final ChatClient chatClient;
    private final AiRateLimitConfig rateLimitConfig;

    @Override
    public int score(String question, String answer, String referenceAnswer, String rubric) {
        Instant start = Instant.now();
        String prompt = buildPrompt(question, answer, referenceAnswer, rubric);

        int maxRetries = Math.max(1, rateLimitConfig.getMaxRetries());
        int retryCount = 0;

        while (true) {
            try {
                ChatResponse response = chatClient.prompt()
                        .user(prompt)
                        .call()
                        .chatResponse();

                if (response == null || response.getResult() == null) {
                    throw new UpstreamServiceException("No response received from scoring model");
                }

                int score = parseScore(response.getResult().getOutput().getText());
                log.debug("Scoring model returned {} in {}ms", score, Duration.between(start, Instant.now()).toMillis());
                return score;

            } catch (Exception e) {
                log.warn("Scoring model call failed (attempt {} of {}): {}", retryCount + 1, maxRetries, e.getMessage());

                if (retryCount >= maxRetries - 1) {
                    if (e instanceof UpstreamServiceException upstream) {
                        throw upstream;
                    }
                    throw new UpstreamServiceException("Scoring model failed after " + maxRetries + " attempts: " + e.getMessage(), e);
                }

                if (isRateLimitError(e)) {
                    long delayMs = calculateBackoffDelay(retryCount);
                    log.warn("Rate limit hit for scoring call. Waiting {} ms before retry.", delayMs);
                    sleepForRateLimit(delayMs);
                }
                retryCount++;
            }
        }
    }

    static String buildPrompt(String question, String answer, String referenceAnswer, String rubric) {
        return """
                You are grading a learner's answer.
                Question: %s
                Reference answer: %s
                Learner answer: %s
                Rubric: %s
                Reply with a single integer between 0 and 100 and nothing else.
                """.formatted(nullToEmpty(question), nullToEmpty(referenceAnswer), nullToEmpty(answer), nullToEmpty(rubric));
    }

    /**
     * Takes the first integer in the reply and clamps it to 0-100.
     */
    static int parseScore(String text) {
        if (text == null) {
            throw new UpstreamServiceException("Scoring model returned an empty reply");
        }
        Matcher matcher = FIRST_INTEGER.matcher(text);
        if (!matcher.find()) {
            throw new UpstreamServiceException("Scoring model reply contained no score: " + text);
        }
        try {
            int value = Integer.parseInt(matcher.group());
            return Math.max(0, Math.min(100, value));
        } catch (NumberFormatException e) {
            throw new UpstreamServiceException("Scoring model reply contained an unreadable score: " + text, e);
        }
    }

    private boolean isRateLimitError(Exception e) {
        String message = e.getMessage();
        if (message == null) {
            return false;
        }
        return message.contains("429") ||
               message.contains("rate limit") ||
               message.contains("rate_limit_exceeded") ||
               message.contains("Too Many Requests");
    }

    /**
     * Exponential backoff with jitter, capped at the configured maximum.
     */
    private long calculateBackoffDelay(int retryCount) {
        long exponentialDelay = rateLimitConfig.getBaseDelayMs() * (long) Math.pow(2, retryCount);
        double jitterRange = rateLimitConfig.getJitterFactor();
        double jitter = (1.0 - jitterRange) + (Math.random() * 2 * jitterRange);
        return Math.min((long) (exponentialDelay * jitter), rateLimitConfig.getMaxDelayMs());
    }

    /**
     * Overridden in tests to avoid sleeping.
     */
    protected void sleepForRateLimit(long delayMs) {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new UpstreamServiceException("Interrupted while waiting for rate limit", ie);
        }
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
