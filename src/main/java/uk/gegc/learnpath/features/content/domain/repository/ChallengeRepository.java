package uk.gegc.learnpath.features.content.domain.repository;

import org.springframework.stereotype.Repository;
import uk.gegc.learnpath.features.content.domain.model.Challenge;

@Repository
public interface ChallengeRepository extends ContentNodeRepository<Challenge> {
}
