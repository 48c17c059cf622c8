package uk.gegc.learnpath.features.content.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.repository.NoRepositoryBean;
import uk.gegc.learnpath.features.content.domain.model.ContentNode;
import uk.gegc.learnpath.shared.query.QueryableRepository;

import java.util.UUID;

@NoRepositoryBean
public interface ContentNodeRepository<T extends ContentNode> extends JpaRepository<T, UUID>, QueryableRepository<T> {
}
