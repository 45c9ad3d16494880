package app.lexis.core.sync.client;

import app.lexis.core.deck.domain.dto.CardDTO;
import app.lexis.core.deck.domain.entity.CardEntity;
import app.lexis.core.review.domain.Rating;
import app.lexis.core.review.domain.dto.ReviewLogDTO;
import app.lexis.core.review.entity.ReviewLogEntity;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static app.lexis.core.support.CardFixtures.card;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RemoteRecordMapperTest {

    private static final Instant NOW = Instant.parse("2024-03-10T12:00:00Z");

    private final RemoteRecordMapper mapper = new RemoteRecordMapper(Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void toRemote_usesEpochMillisAndWireNames() {
        CardEntity entity = card("c1", "d1", 3.0, 2, NOW);

        RemoteCard remote = mapper.toRemote(CardDTO.of(entity));

        assertThat(remote.id()).isEqualTo("c1");
        assertThat(remote.interval()).isEqualTo(3.0);
        assertThat(remote.nextReview()).isEqualTo(NOW.toEpochMilli());
        assertThat(remote.createdAt()).isEqualTo(Instant.parse("2024-01-01T00:00:00Z").toEpochMilli());
    }

    @Test
    void toRemote_writesRatingAsLowercaseCode() {
        RemoteReviewLog remote = mapper.toRemote(new ReviewLogDTO("l1", "c1", Rating.HARD, NOW));

        assertThat(remote.rating()).isEqualTo("hard");
        assertThat(remote.timestamp()).isEqualTo(NOW.toEpochMilli());
    }

    @Test
    void toRemote_rejectsUnknownSnapshots() {
        assertThatThrownBy(() -> mapper.toRemote((Object) "not a record"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void toEntity_normalizesMissingAndInvalidSchedulingFields() {
        RemoteCard remote = new RemoteCard("c1", "  apple ", "a fruit", null, null, "",
                null, null, 0.9, -4.0, null, null, null);

        CardEntity entity = mapper.toEntity(remote);

        assertThat(entity.getTerm()).isEqualTo("apple");
        assertThat(entity.getDeckId()).isNull();
        assertThat(entity.getEaseFactor()).isEqualTo(1.3);
        assertThat(entity.getIntervalDays()).isZero();
        assertThat(entity.getRepetitions()).isZero();
        assertThat(entity.getCreatedAt()).isEqualTo(NOW);
        assertThat(entity.getUpdatedAt()).isEqualTo(NOW);
        assertThat(entity.getNextReviewAt()).isNull();
    }

    @Test
    void toEntity_dropsDocumentsThatCannotBeAdopted() {
        assertThat(mapper.toEntity(new RemoteCard(null, "apple", null, null, null, null,
                null, null, null, null, null, null, null))).isNull();
        assertThat(mapper.toEntity(new RemoteDeck("d1", " ", null, null))).isNull();
        assertThat(mapper.toEntity(new RemoteReviewLog("l1", "c1", "perfect", 1L))).isNull();
    }

    @Test
    void toEntity_dropsDocumentsThatDoNotFitLocalColumns() {
        assertThat(mapper.toEntity(new RemoteCard("c2", "pear", "a fruit", "x".repeat(5000), null, null,
                null, null, null, null, null, null, null))).isNull();
        assertThat(mapper.toEntity(new RemoteCard("c".repeat(65), "pear", null, null, null, null,
                null, null, null, null, null, null, null))).isNull();
        assertThat(mapper.toEntity(new RemoteDeck("d1", "n".repeat(256), null, null))).isNull();
        assertThat(mapper.toEntity(new RemoteReviewLog("l1", "c".repeat(65), "good", 1L))).isNull();

        assertThat(mapper.toEntity(new RemoteCard("c3", "pear", "a fruit", "x".repeat(4000), null, null,
                null, null, null, null, null, null, null))).isNotNull();
    }

    @Test
    void toEntity_acceptsRatingInAnyCase() {
        ReviewLogEntity entity = mapper.toEntity(new RemoteReviewLog("l1", "c1", "Good", NOW.toEpochMilli()));

        assertThat(entity.getRating()).isEqualTo(Rating.GOOD);
        assertThat(entity.getReviewedAt()).isEqualTo(NOW);
    }
}
