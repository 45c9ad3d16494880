package app.lexis.core.sync.service;

import app.lexis.core.sync.domain.LocalChangeEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Mirrors committed local writes to the remote store. The session is taken on
 * the committing thread; the push itself runs on the push executor.
 */
@Component
public class SyncPushListener {

    private static final Logger log = LoggerFactory.getLogger(SyncPushListener.class);

    private final SyncService syncService;

    public SyncPushListener(SyncService syncService) {
        this.syncService = syncService;
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onLocalChange(LocalChangeEvent event) {
        SyncSession session = syncService.currentSession();
        if (session == null) {
            log.debug("No active sync session, {} {} stays local", event.kind(), event.id());
            return;
        }
        syncService.push(session, event);
    }
}
