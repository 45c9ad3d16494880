package app.lexis.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.ZoneId;
import java.util.List;

@ConfigurationProperties(prefix = "app.study")
public record StudyProps(
        List<Integer> learningStepsMinutes,
        Integer hardStepMinutes,
        Double initialEaseFactor,
        Integer defaultDailyLimit,
        String timeZone
) {
    public StudyProps {
        if (learningStepsMinutes == null || learningStepsMinutes.isEmpty()) {
            learningStepsMinutes = List.of(1, 10);
        } else {
            learningStepsMinutes = List.copyOf(learningStepsMinutes);
        }
        if (hardStepMinutes == null || hardStepMinutes <= 0) hardStepMinutes = 6;
        if (initialEaseFactor == null || initialEaseFactor < 1.3) initialEaseFactor = 2.5;
        if (defaultDailyLimit == null || defaultDailyLimit <= 0) defaultDailyLimit = 50;
    }

    public static StudyProps defaults() {
        return new StudyProps(null, null, null, null, null);
    }

    public ZoneId zoneId() {
        if (timeZone == null || timeZone.isBlank()) {
            return ZoneId.systemDefault();
        }
        return ZoneId.of(timeZone.trim());
    }
}
