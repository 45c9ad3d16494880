package app.lexis.core.deck.repository;

import app.lexis.core.deck.domain.entity.CardEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface CardRepository extends JpaRepository<CardEntity, String> {

    List<CardEntity> findByDeckIdOrderByCreatedAtAsc(String deckId);

    List<CardEntity> findAllByOrderByCreatedAtAsc();

    List<CardEntity> findByDeckId(String deckId);

    boolean existsByDeckIdIsNullAndTermIgnoreCase(String term);

    boolean existsByDeckIdAndTermIgnoreCase(String deckId, String term);

    @Query("""
        select c from CardEntity c
        where c.intervalDays < :masteredIntervalDays
          and c.nextReviewAt is not null
          and c.nextReviewAt <= :now
        """)
    List<CardEntity> findDueCandidates(@Param("now") Instant now,
                                       @Param("masteredIntervalDays") double masteredIntervalDays);

    @Query("""
        select c from CardEntity c
        where c.deckId = :deckId
          and c.intervalDays < :masteredIntervalDays
          and c.nextReviewAt is not null
          and c.nextReviewAt <= :now
        """)
    List<CardEntity> findDueCandidatesInDeck(@Param("deckId") String deckId,
                                             @Param("now") Instant now,
                                             @Param("masteredIntervalDays") double masteredIntervalDays);
}
