package app.lexis.core.review.repository;

import app.lexis.core.review.entity.StudyPreferencesEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface StudyPreferencesRepository extends JpaRepository<StudyPreferencesEntity, Short> {
}
