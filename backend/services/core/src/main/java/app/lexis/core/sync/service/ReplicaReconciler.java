package app.lexis.core.sync.service;

import app.lexis.core.deck.domain.entity.CardEntity;
import app.lexis.core.deck.domain.entity.DeckEntity;
import app.lexis.core.deck.repository.CardRepository;
import app.lexis.core.deck.repository.DeckRepository;
import app.lexis.core.review.entity.ReviewLogEntity;
import app.lexis.core.review.repository.ReviewLogRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Local side of activation: wipes the local replica and adopts remote records.
 */
@Service
public class ReplicaReconciler {

    private final CardRepository cardRepository;
    private final DeckRepository deckRepository;
    private final ReviewLogRepository reviewLogRepository;

    public ReplicaReconciler(CardRepository cardRepository,
                             DeckRepository deckRepository,
                             ReviewLogRepository reviewLogRepository) {
        this.cardRepository = cardRepository;
        this.deckRepository = deckRepository;
        this.reviewLogRepository = reviewLogRepository;
    }

    @Transactional
    public void clearLocal() {
        reviewLogRepository.deleteAllInBatch();
        cardRepository.deleteAllInBatch();
        deckRepository.deleteAllInBatch();
    }

    /**
     * Adopts remote cards. When a card with the same id already exists locally
     * the replica with more progress ({@code repetitions + intervalDays}) wins;
     * ties go to the remote replica.
     */
    @Transactional
    public CardMergeOutcome mergeCards(List<CardEntity> remoteCards) {
        int adopted = 0;
        int overwritten = 0;
        List<CardEntity> keptLocal = new ArrayList<>();

        for (CardEntity remote : remoteCards) {
            Optional<CardEntity> existing = cardRepository.findById(remote.getCardId());
            if (existing.isEmpty()) {
                cardRepository.save(remote);
                adopted++;
                continue;
            }
            CardEntity local = existing.get();
            if (local.schedulingState().progress() > remote.schedulingState().progress()) {
                keptLocal.add(local);
            } else {
                cardRepository.save(remote);
                overwritten++;
            }
        }
        return new CardMergeOutcome(adopted, overwritten, keptLocal);
    }

    @Transactional
    public int adoptDecks(List<DeckEntity> remoteDecks) {
        deckRepository.saveAll(remoteDecks);
        return remoteDecks.size();
    }

    @Transactional
    public int adoptReviewLogs(List<ReviewLogEntity> remoteLogs) {
        reviewLogRepository.saveAll(remoteLogs);
        return remoteLogs.size();
    }

    public record CardMergeOutcome(int adopted, int overwritten, List<CardEntity> keptLocal) {
        public static final CardMergeOutcome EMPTY = new CardMergeOutcome(0, 0, List.of());
    }
}
