package app.lexis.core.review.service;

import app.lexis.core.config.StudyProps;
import app.lexis.core.review.controller.dto.StudyPreferencesDto;
import app.lexis.core.review.entity.StudyPreferencesEntity;
import app.lexis.core.review.repository.StudyPreferencesRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;

/**
 * Local study settings. Only the daily review limit for now; the row is
 * created lazily with the configured default.
 */
@Service
public class StudyPreferencesService {

    private static final Logger log = LoggerFactory.getLogger(StudyPreferencesService.class);

    private final StudyPreferencesRepository repository;
    private final StudyProps props;
    private final Clock clock;

    public StudyPreferencesService(StudyPreferencesRepository repository, StudyProps props, Clock clock) {
        this.repository = repository;
        this.props = props;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public int getDailyLimit() {
        return repository.findById(StudyPreferencesEntity.SINGLETON_ID)
                .map(StudyPreferencesEntity::getDailyLimit)
                .orElse(props.defaultDailyLimit());
    }

    @Transactional(readOnly = true)
    public StudyPreferencesDto getPreferences() {
        return repository.findById(StudyPreferencesEntity.SINGLETON_ID)
                .map(e -> new StudyPreferencesDto(e.getDailyLimit(), e.getUpdatedAt()))
                .orElseGet(() -> new StudyPreferencesDto(props.defaultDailyLimit(), null));
    }

    @Transactional
    public StudyPreferencesDto setDailyLimit(int dailyLimit) {
        if (dailyLimit <= 0) {
            throw new IllegalArgumentException("Daily limit must be positive: " + dailyLimit);
        }
        StudyPreferencesEntity entity = repository.findById(StudyPreferencesEntity.SINGLETON_ID)
                .orElseGet(() -> {
                    StudyPreferencesEntity created = new StudyPreferencesEntity();
                    created.setPreferencesId(StudyPreferencesEntity.SINGLETON_ID);
                    return created;
                });
        entity.setDailyLimit(dailyLimit);
        entity.setUpdatedAt(clock.instant());
        StudyPreferencesEntity saved = repository.save(entity);
        log.info("Daily review limit set to {}", dailyLimit);
        return new StudyPreferencesDto(saved.getDailyLimit(), saved.getUpdatedAt());
    }
}
