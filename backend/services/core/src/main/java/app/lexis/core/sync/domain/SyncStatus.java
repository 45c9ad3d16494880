package app.lexis.core.sync.domain;

public record SyncStatus(
        boolean active,
        String syncKey,
        SyncReport lastReport
) {
}
