package app.lexis.core.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.List;

@Configuration
@EnableConfigurationProperties(CorsProps.class)
public class WebConfig implements WebMvcConfigurer {

    private final CorsProps corsProps;

    public WebConfig(CorsProps corsProps) {
        this.corsProps = corsProps;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        // UI dev server runs on its own origin
        List<String> origins = (corsProps.origins() == null || corsProps.origins().isEmpty())
                ? List.of("http://localhost:3000", "http://localhost:5173")
                : corsProps.origins();

        registry.addMapping("/**")
                .allowedOrigins(origins.toArray(String[]::new))
                .allowedMethods("GET", "POST", "PUT", "PATCH", "DELETE", "OPTIONS")
                .allowedHeaders("*")
                .exposedHeaders("Content-Type")
                .maxAge(3600L);
    }
}
