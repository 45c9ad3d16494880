package app.lexis.core.sync.domain;

import java.time.Instant;
import java.util.List;

public record SyncReport(
        String syncKey,
        Instant activatedAt,
        int cardsAdopted,
        int cardsOverwritten,
        int cardsKeptLocal,
        int decksAdopted,
        int reviewLogsAdopted,
        List<RemoteEntityKind> failedKinds
) {
    public SyncReport {
        failedKinds = failedKinds == null ? List.of() : List.copyOf(failedKinds);
    }

    public static SyncReport localOnly(Instant at) {
        return new SyncReport(null, at, 0, 0, 0, 0, 0, List.of());
    }

    public boolean complete() {
        return failedKinds.isEmpty();
    }
}
