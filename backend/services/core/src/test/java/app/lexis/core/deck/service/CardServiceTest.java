package app.lexis.core.deck.service;

import app.lexis.core.config.StudyProps;
import app.lexis.core.deck.domain.dto.SaveCardResult;
import app.lexis.core.deck.domain.entity.CardEntity;
import app.lexis.core.deck.domain.request.CreateCardRequest;
import app.lexis.core.deck.repository.CardRepository;
import app.lexis.core.deck.repository.DeckRepository;
import app.lexis.core.review.algorithm.impl.LadderAlgorithm;
import app.lexis.core.review.domain.CardPhase;
import app.lexis.core.sync.domain.LocalChangeEvent;
import app.lexis.core.sync.domain.RemoteEntityKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CardServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-10T12:00:00Z");

    @Mock
    CardRepository cardRepository;

    @Mock
    DeckRepository deckRepository;

    @Mock
    ApplicationEventPublisher events;

    CardService service;

    @BeforeEach
    void setup() {
        service = new CardService(
                cardRepository,
                deckRepository,
                new LadderAlgorithm(StudyProps.defaults()),
                events,
                Clock.fixed(NOW, ZoneOffset.UTC)
        );
    }

    @Test
    void saveCard_createsFreshCardThatIsImmediatelyDue() {
        when(deckRepository.existsById("d1")).thenReturn(true);
        when(cardRepository.existsByDeckIdAndTermIgnoreCase("d1", "serendipity")).thenReturn(false);
        when(cardRepository.save(any(CardEntity.class))).thenAnswer(inv -> inv.getArgument(0));

        SaveCardResult result = service.saveCard(new CreateCardRequest(" serendipity ", "happy accident", null, "/ˌserənˈdɪpɪti/", "d1"));

        assertThat(result.added()).isTrue();
        assertThat(result.card().term()).isEqualTo("serendipity");
        assertThat(result.card().intervalDays()).isZero();
        assertThat(result.card().repetitions()).isZero();
        assertThat(result.card().step()).isZero();
        assertThat(result.card().easeFactor()).isEqualTo(2.5);
        assertThat(result.card().nextReviewAt()).isEqualTo(NOW);
        assertThat(result.card().phase()).isEqualTo(CardPhase.LEARNING);
        assertThat(result.card().cardId()).isNotBlank();

        ArgumentCaptor<LocalChangeEvent> captor = ArgumentCaptor.forClass(LocalChangeEvent.class);
        verify(events).publishEvent(captor.capture());
        assertThat(captor.getValue().kind()).isEqualTo(RemoteEntityKind.CARDS);
        assertThat(captor.getValue().id()).isEqualTo(result.card().cardId());
    }

    @Test
    void saveCard_duplicateTermInSameDeckIsReportedNotThrown() {
        when(deckRepository.existsById("d1")).thenReturn(true);
        when(cardRepository.existsByDeckIdAndTermIgnoreCase("d1", "Apple")).thenReturn(true);

        SaveCardResult result = service.saveCard(new CreateCardRequest("Apple", "a fruit", null, null, "d1"));

        assertThat(result.added()).isFalse();
        assertThat(result.reason()).contains("Apple");
        verify(cardRepository, never()).save(any());
        verify(events, never()).publishEvent(any(Object.class));
    }

    @Test
    void saveCard_uncategorizedCardsFormTheirOwnScope() {
        when(cardRepository.existsByDeckIdIsNullAndTermIgnoreCase("apple")).thenReturn(false);
        when(cardRepository.save(any(CardEntity.class))).thenAnswer(inv -> inv.getArgument(0));

        SaveCardResult result = service.saveCard(new CreateCardRequest("apple", "a fruit", null, null, "  "));

        assertThat(result.added()).isTrue();
        assertThat(result.card().deckId()).isNull();
        verify(cardRepository, never()).existsByDeckIdAndTermIgnoreCase(any(), any());
    }

    @Test
    void saveCard_unknownDeckIsNotFound() {
        when(deckRepository.existsById("nope")).thenReturn(false);

        assertThatThrownBy(() -> service.saveCard(new CreateCardRequest("apple", "a fruit", null, null, "nope")))
                .isInstanceOf(ResponseStatusException.class);
    }

    @Test
    void saveCard_blankTermIsRejected() {
        assertThatThrownBy(() -> service.saveCard(new CreateCardRequest("  ", "x", null, null, null)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void saveCard_fieldLongerThanItsColumnIsRejectedBeforeSaving() {
        CreateCardRequest req = new CreateCardRequest("pear", "a fruit", "x".repeat(4001), null, null);

        assertThatThrownBy(() -> service.saveCard(req))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Explanation");
        verify(cardRepository, never()).save(any(CardEntity.class));
    }
}
