package app.lexis.core.deck.domain.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateCardRequest(
        @NotBlank @Size(max = 255) String term,
        @Size(max = 255) String meaning,
        @Size(max = 4000) String explanation,
        @Size(max = 255) String phonetic,
        String deckId // null = uncategorized
) {
}
