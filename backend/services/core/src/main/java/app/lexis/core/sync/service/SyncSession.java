package app.lexis.core.sync.service;

import app.lexis.core.deck.domain.dto.CardDTO;
import app.lexis.core.deck.domain.entity.CardEntity;
import app.lexis.core.deck.domain.entity.DeckEntity;
import app.lexis.core.review.entity.ReviewLogEntity;
import app.lexis.core.sync.client.RemoteCard;
import app.lexis.core.sync.client.RemoteDeck;
import app.lexis.core.sync.client.RemoteRecordMapper;
import app.lexis.core.sync.client.RemoteReviewLog;
import app.lexis.core.sync.client.RemoteStoreClient;
import app.lexis.core.sync.domain.LocalChangeEvent;
import app.lexis.core.sync.domain.RemoteEntityKind;
import app.lexis.core.sync.domain.SyncIdentity;
import app.lexis.core.sync.domain.SyncReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Replication state of one login. Created by {@link SyncService#activate},
 * dropped on logout or when another identity activates.
 */
public class SyncSession {

    private static final Logger log = LoggerFactory.getLogger(SyncSession.class);

    private final SyncIdentity identity;
    private final RemoteStoreClient remote;
    private final ReplicaReconciler reconciler;
    private final RemoteRecordMapper mapper;
    private final Clock clock;

    private volatile SyncReport report;

    SyncSession(SyncIdentity identity,
                RemoteStoreClient remote,
                ReplicaReconciler reconciler,
                RemoteRecordMapper mapper,
                Clock clock) {
        this.identity = Objects.requireNonNull(identity, "identity");
        this.remote = remote;
        this.reconciler = reconciler;
        this.mapper = mapper;
        this.clock = clock;
    }

    public SyncIdentity identity() {
        return identity;
    }

    public SyncReport report() {
        return report;
    }

    /**
     * Replaces the local replica with the remote one. A collection that cannot
     * be fetched or stored is skipped and reported; local clearing failures
     * propagate.
     */
    SyncReport activate() {
        log.info("Activating sync for {}", identity);
        reconciler.clearLocal();

        List<RemoteEntityKind> failed = new ArrayList<>();

        List<CardEntity> cards = fetch(RemoteEntityKind.CARDS, RemoteCard.class, mapper::toEntity, failed);
        ReplicaReconciler.CardMergeOutcome merge = adopt(RemoteEntityKind.CARDS,
                () -> reconciler.mergeCards(cards), ReplicaReconciler.CardMergeOutcome.EMPTY, failed);
        for (CardEntity winner : merge.keptLocal()) {
            push(LocalChangeEvent.upsert(CardDTO.of(winner)));
        }

        List<DeckEntity> decks = fetch(RemoteEntityKind.DECKS, RemoteDeck.class, mapper::toEntity, failed);
        int decksAdopted = adopt(RemoteEntityKind.DECKS, () -> reconciler.adoptDecks(decks), 0, failed);

        List<ReviewLogEntity> logs = fetch(RemoteEntityKind.REVIEW_LOGS, RemoteReviewLog.class, mapper::toEntity, failed);
        int logsAdopted = adopt(RemoteEntityKind.REVIEW_LOGS, () -> reconciler.adoptReviewLogs(logs), 0, failed);

        SyncReport result = new SyncReport(
                identity.key(),
                clock.instant(),
                merge.adopted(),
                merge.overwritten(),
                merge.keptLocal().size(),
                decksAdopted,
                logsAdopted,
                failed
        );
        this.report = result;
        log.info("Sync activated for {}: cards={} (+{} overwritten, {} kept local), decks={}, logs={}, failed={}",
                identity, result.cardsAdopted(), result.cardsOverwritten(), result.cardsKeptLocal(),
                result.decksAdopted(), result.reviewLogsAdopted(), result.failedKinds());
        return result;
    }

    /**
     * Mirrors one local write. Failures are logged and dropped; the next
     * activation reconciles whatever was missed.
     */
    void push(LocalChangeEvent event) {
        try {
            if (event.isDelete()) {
                remote.delete(event.kind(), identity, event.id());
            } else {
                remote.upsert(event.kind(), identity, event.id(), mapper.toRemote(event.snapshot()));
            }
            log.debug("Pushed {} {} {}", event.isDelete() ? "delete" : "upsert", event.kind(), event.id());
        } catch (RuntimeException ex) {
            log.warn("Remote push failed for {} {}: {}", event.kind(), event.id(), ex.getMessage());
        }
    }

    private <T> T adopt(RemoteEntityKind kind,
                        Supplier<T> step,
                        T fallback,
                        List<RemoteEntityKind> failed) {
        try {
            return step.get();
        } catch (RuntimeException ex) {
            log.warn("Storing remote {} failed for {}, collection skipped: {}",
                    kind.collection(), identity, ex.getMessage());
            if (!failed.contains(kind)) {
                failed.add(kind);
            }
            return fallback;
        }
    }

    private <R, E> List<E> fetch(RemoteEntityKind kind,
                                 Class<R> type,
                                 Function<R, E> toEntity,
                                 List<RemoteEntityKind> failed) {
        List<R> documents;
        try {
            documents = remote.fetchAll(kind, identity, type);
        } catch (RuntimeException ex) {
            log.warn("Remote fetch of {} failed for {}, continuing with local data: {}",
                    kind.collection(), identity, ex.getMessage());
            failed.add(kind);
            return List.of();
        }
        List<E> out = new ArrayList<>(documents.size());
        for (R document : documents) {
            E entity = toEntity.apply(document);
            if (entity != null) {
                out.add(entity);
            }
        }
        return out;
    }
}
