package app.lexis.core.sync.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Card document as stored remotely. Timestamps are epoch milliseconds and
 * {@code interval} is in days, matching what the other clients write.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record RemoteCard(
        String id,
        String term,
        String meaning,
        String explanation,
        String phonetic,
        String deckId,
        Long createdAt,
        Long lastUpdated,
        Double easeFactor,
        Double interval,
        Integer repetitions,
        Integer step,
        Long nextReview
) {
}
