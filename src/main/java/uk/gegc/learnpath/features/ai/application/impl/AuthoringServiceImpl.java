package uk.gegc.learnpath.features.ai.application.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.stereotype.Service;
import uk.gegc.learnpath.features.ai.api.dto.AuthoringResult;
import uk.gegc.learnpath.features.ai.application.AuthoringService;
import uk.gegc.learnpath.features.ai.config.AuthoringProperties;
import uk.gegc.learnpath.features.ai.domain.model.Audience;
import uk.gegc.learnpath.features.content.domain.model.ContentKind;
import uk.gegc.learnpath.shared.config.AiRateLimitConfig;
import uk.gegc.learnpath.shared.exception.AiServiceUnavailableException;
import uk.gegc.learnpath.shared.exception.UpstreamServiceException;
import uk.gegc.learnpath.shared.exception.ValidationException;
import uk.gegc.learnpath.shared.security.AccessPolicy;
import uk.gegc.learnpath.shared.security.CurrentUser;
import uk.gegc.learnpath.shared.security.CurrentUserResolver;
import uk.gegc.learnpath.shared.security.PermissionName;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

@Service
@RequiredArgsConstructor
@Slf4j
public class AuthoringServiceImpl implements AuthoringService {

    private static final String IMPROVE_SYSTEM_PROMPT = """
            You are an expert technical writer and editor. Improve the clarity, flow and engagement of the content \
            while maintaining all technical accuracy. Fix grammar, improve sentence structure and enhance readability. \
            Keep the same markdown formatting and structure.""";

    private static final String META_SYSTEM_PROMPT = """
            You are an SEO expert. Write a compelling meta description of 150 to 160 characters that includes \
            relevant keywords, encourages clicks and accurately describes the content.""";

    private static final String SUGGEST_SYSTEM_PROMPT = """
            You are an instructional design expert. Analyze the lesson content and provide 3-5 specific, actionable \
            suggestions for improvement. Focus on clarity, engagement, practical application and learning effectiveness. \
            Return the suggestions as a JSON array of strings.""";

    private static final Pattern LIST_MARKER = Pattern.compile("^(?:[-*•]|\\d+[.)])\\s*");
    private static final Pattern CODE_FENCE = Pattern.compile("^```[a-zA-Z]*\\s*|\\s*```$");

    private final ChatClient chatClient;
    private final AiRateLimitConfig rateLimitConfig;
    private final AuthoringProperties properties;
    private final CurrentUserResolver currentUserResolver;
    private final AccessPolicy accessPolicy;
    private final ObjectMapper objectMapper;

    @Override
    public boolean isAvailable() {
        return properties.isEnabled();
    }

    @Override
    public AuthoringResult summarize(String content, Integer maxLength) {
        authorize();
        requireText(content, "Content");
        int length = maxLength != null ? maxLength : properties.getDefaultSummaryLength();
        if (length < 20 || length > 2000) {
            throw new ValidationException("Summary length must be between 20 and 2000 characters");
        }
        String system = "You are a content summarization expert. Create concise, informative summaries that capture "
                + "the key points. Keep summaries under " + length + " characters.";
        return call("summarize", system, "Please summarize this content:\n\n" + content, 0.3, Math.max(16, length / 2));
    }

    @Override
    public AuthoringResult rewriteForAudience(String content, Audience audience) {
        authorize();
        requireText(content, "Content");
        Audience target = audience != null ? audience : Audience.GENERAL;
        String system = target.getPersona() + "\n\nRewrite the following content to be perfectly suited for this audience. "
                + "Maintain the core information but adjust the tone, examples and level of technical detail appropriately. "
                + "Use markdown formatting.";
        return call("rewrite", system, content, 0.4, 2000);
    }

    @Override
    public AuthoringResult improveWriting(String content) {
        authorize();
        requireText(content, "Content");
        return call("improve", IMPROVE_SYSTEM_PROMPT, content, 0.3, 2000);
    }

    @Override
    public AuthoringResult generateContent(String topic, Audience audience, ContentKind kind) {
        authorize();
        requireText(topic, "Topic");
        ContentKind target = kind != null ? kind : ContentKind.LESSON;
        Audience reader = audience != null ? audience : Audience.GENERAL;
        String system = reader.getPersona() + "\n\n" + draftInstruction(target)
                + " Use markdown formatting for clear structure and readability. Focus on practical, actionable content "
                + "that helps business professionals understand and apply technical concepts.";
        return call("generate-" + target.getKey(), system, "Create content about: " + topic.trim(), 0.6, 2500);
    }

    @Override
    public AuthoringResult generateMetaDescription(String title, String content) {
        authorize();
        requireText(title, "Title");
        requireText(content, "Content");
        int excerptLength = properties.getMetaDescriptionExcerptLength();
        String excerpt = content.length() > excerptLength ? content.substring(0, excerptLength) + "..." : content;
        return call("meta-description", META_SYSTEM_PROMPT,
                "Title: " + title.trim() + "\n\nContent summary: " + excerpt, 0.3, 100);
    }

    @Override
    public List<String> suggestImprovements(String content) {
        authorize();
        requireText(content, "Content");
        AuthoringResult result = call("suggest", SUGGEST_SYSTEM_PROMPT, content, 0.4, 500);
        return parseSuggestions(result.text());
    }

    /**
     * Reads a JSON array of strings; a reply that is not one is split into its non-blank lines.
     */
    List<String> parseSuggestions(String reply) {
        String body = CODE_FENCE.matcher(reply.trim()).replaceAll("").trim();
        try {
            List<String> parsed = objectMapper.readValue(body, new TypeReference<List<String>>() {
            });
            return parsed.stream()
                    .filter(Objects::nonNull)
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .toList();
        } catch (JsonProcessingException e) {
            log.debug("Suggestions reply was not a JSON array, falling back to lines: {}", e.getOriginalMessage());
            return Arrays.stream(body.split("\\R"))
                    .map(line -> LIST_MARKER.matcher(line.trim()).replaceFirst("").trim())
                    .filter(line -> !line.isEmpty())
                    .toList();
        }
    }

    private static String draftInstruction(ContentKind kind) {
        return switch (kind) {
            case LESSON -> "Create a comprehensive lesson that includes an introduction, main concepts, practical examples and key takeaways.";
            case MODULE -> "Create an outline for a learning module that breaks down the topic into logical lessons.";
            case COURSE -> "Create a course overview that outlines the learning objectives, target audience and module structure.";
            default -> throw new ValidationException("Drafts can be generated for lessons, modules and courses only");
        };
    }

    private void authorize() {
        CurrentUser user = currentUserResolver.requireCurrentUser();
        accessPolicy.requireAny(user, PermissionName.CONTENT_CREATE, PermissionName.CONTENT_UPDATE);
        if (!properties.isEnabled()) {
            throw new AiServiceUnavailableException("The authoring assistant is disabled");
        }
    }

    private void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field + " cannot be blank");
        }
        if (value.length() > properties.getMaxInputLength()) {
            throw new ValidationException(field + " must be at most " + properties.getMaxInputLength() + " characters long");
        }
    }

    private AuthoringResult call(String operation, String systemPrompt, String userPrompt, double temperature, int maxTokens) {
        Instant start = Instant.now();
        ChatOptions options = ChatOptions.builder()
                .temperature(temperature)
                .maxTokens(maxTokens)
                .build();

        int maxRetries = Math.max(1, rateLimitConfig.getMaxRetries());
        int retryCount = 0;

        while (true) {
            try {
                ChatResponse response = chatClient.prompt()
                        .system(systemPrompt)
                        .user(userPrompt)
                        .options(options)
                        .call()
                        .chatResponse();

                if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
                    throw new UpstreamServiceException("No response received from the authoring model");
                }
                String text = response.getResult().getOutput().getText();
                if (text == null || text.isBlank()) {
                    throw new UpstreamServiceException("Authoring model returned an empty reply");
                }

                String model = response.getMetadata() != null ? response.getMetadata().getModel() : null;
                long latency = Duration.between(start, Instant.now()).toMillis();
                log.info("Authoring '{}' answered by {} in {}ms", operation, model, latency);
                return new AuthoringResult(text.trim(), model == null || model.isBlank() ? "unknown" : model, latency);

            } catch (Exception e) {
                log.warn("Authoring '{}' call failed (attempt {} of {}): {}", operation, retryCount + 1, maxRetries, e.getMessage());

                if (retryCount >= maxRetries - 1) {
                    if (e instanceof UpstreamServiceException upstream) {
                        throw upstream;
                    }
                    throw new UpstreamServiceException("Authoring model failed after " + maxRetries + " attempts: " + e.getMessage(), e);
                }

                if (isRateLimitError(e)) {
                    long delayMs = calculateBackoffDelay(retryCount);
                    log.warn("Rate limit hit for authoring '{}'. Waiting {} ms before retry.", operation, delayMs);
                    sleepForRateLimit(delayMs);
                }
                retryCount++;
            }
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
}
