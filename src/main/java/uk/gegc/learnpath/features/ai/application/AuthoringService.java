package uk.gegc.learnpath.features.ai.application;

import uk.gegc.learnpath.features.ai.api.dto.AuthoringResult;
import uk.gegc.learnpath.features.ai.domain.model.Audience;
import uk.gegc.learnpath.features.content.domain.model.ContentKind;

import java.util.List;

/**
 * Writing help for content authors. Every call needs content create or update permission and fails with
 * {@link uk.gegc.learnpath.shared.exception.AiServiceUnavailableException} when the assistant is switched off.
 */
public interface AuthoringService {

    boolean isAvailable();

    /**
     * @param maxLength target length in characters; the configured default when null
     */
    AuthoringResult summarize(String content, Integer maxLength);

    AuthoringResult rewriteForAudience(String content, Audience audience);

    AuthoringResult improveWriting(String content);

    /**
     * Drafts a lesson body, a module outline or a course overview for {@code topic}.
     */
    AuthoringResult generateContent(String topic, Audience audience, ContentKind kind);

    AuthoringResult generateMetaDescription(String title, String content);

    /**
     * Three to five concrete suggestions, as the model returned them.
     */
    List<String> suggestImprovements(String content);
}
