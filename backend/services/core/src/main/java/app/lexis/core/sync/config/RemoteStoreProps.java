package app.lexis.core.sync.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.remote")
public record RemoteStoreProps(
        String baseUrl,
        String authToken
) {
    public boolean configured() {
        return baseUrl != null && !baseUrl.isBlank();
    }
}
