package app.lexis.core.sync.service;

import app.lexis.core.config.AsyncConfig;
import app.lexis.core.sync.client.RemoteRecordMapper;
import app.lexis.core.sync.client.RemoteStoreClient;
import app.lexis.core.sync.domain.LocalChangeEvent;
import app.lexis.core.sync.domain.SyncIdentity;
import app.lexis.core.sync.domain.SyncReport;
import app.lexis.core.sync.domain.SyncStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicReference;

@Service
public class SyncService {

    private static final Logger log = LoggerFactory.getLogger(SyncService.class);

    private final RemoteStoreClient remote;
    private final ReplicaReconciler reconciler;
    private final RemoteRecordMapper mapper;
    private final Clock clock;

    private final AtomicReference<SyncSession> current = new AtomicReference<>();

    public SyncService(RemoteStoreClient remote,
                       ReplicaReconciler reconciler,
                       RemoteRecordMapper mapper,
                       Clock clock) {
        this.remote = remote;
        this.reconciler = reconciler;
        this.mapper = mapper;
        this.clock = clock;
    }

    /**
     * Starts a new login. Without an identity the node stays local-only and
     * local data is left untouched. Otherwise local data is replaced by the
     * remote replica; the new session becomes current only after that.
     */
    public synchronized SyncReport activate(SyncIdentity identity) {
        if (identity == null) {
            current.set(null);
            log.info("No sync key, running local-only");
            return SyncReport.localOnly(clock.instant());
        }

        // pushes issued while the replica is being replaced would race the wipe
        current.set(null);

        SyncSession session = new SyncSession(identity, remote, reconciler, mapper, clock);
        SyncReport report = session.activate();
        current.set(session);
        return report;
    }

    public synchronized void deactivate() {
        SyncSession previous = current.getAndSet(null);
        if (previous != null) {
            log.info("Sync deactivated for {}", previous.identity());
        }
    }

    public SyncStatus status() {
        SyncSession session = current.get();
        if (session == null) {
            return new SyncStatus(false, null, null);
        }
        return new SyncStatus(true, session.identity().key(), session.report());
    }

    public SyncSession currentSession() {
        return current.get();
    }

    /**
     * Mirrors one committed write for the login it was committed under. The
     * write is dropped when that login has ended since, so it can never reach
     * another learner's partition.
     */
    @Async(AsyncConfig.SYNC_PUSH_EXECUTOR)
    public void push(SyncSession origin, LocalChangeEvent event) {
        if (origin != current.get()) {
            log.debug("Sync session for {} ended, {} {} not pushed", origin.identity(), event.kind(), event.id());
            return;
        }
        origin.push(event);
    }
}
