package uk.gegc.learnpath.features.progress.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import uk.gegc.learnpath.features.progress.domain.model.XpLevel;

import java.util.List;

@Repository
public interface XpLevelRepository extends JpaRepository<XpLevel, Integer> {

    List<XpLevel> findAllByOrderByXpRequiredAsc();
}
