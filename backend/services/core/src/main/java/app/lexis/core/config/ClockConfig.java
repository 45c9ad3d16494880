package app.lexis.core.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfig {

    @Bean
    public Clock clock(StudyProps props) {
        return Clock.system(props.zoneId());
    }
}
