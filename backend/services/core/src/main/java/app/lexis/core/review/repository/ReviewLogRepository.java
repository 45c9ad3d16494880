package app.lexis.core.review.repository;

import app.lexis.core.review.entity.ReviewLogEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface ReviewLogRepository extends JpaRepository<ReviewLogEntity, String> {

    long countByReviewedAtGreaterThanEqual(Instant since);

    List<ReviewLogEntity> findByReviewedAtGreaterThanEqual(Instant since);
}
