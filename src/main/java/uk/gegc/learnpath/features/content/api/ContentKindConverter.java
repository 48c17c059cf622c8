package uk.gegc.learnpath.features.content.api;

import org.springframework.core.convert.converter.Converter;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import uk.gegc.learnpath.features.content.domain.model.ContentKind;

/**
 * Binds path segments such as {@code courses} or {@code learning-paths} to {@link ContentKind}.
 */
@Component
public class ContentKindConverter implements Converter<String, ContentKind> {

    @Override
    public ContentKind convert(@NonNull String source) {
        return ContentKind.fromKey(source);
    }
}
