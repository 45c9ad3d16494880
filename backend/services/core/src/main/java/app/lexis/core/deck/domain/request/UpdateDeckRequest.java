package app.lexis.core.deck.domain.request;

import jakarta.validation.constraints.Size;

/**
 * Partial update: {@code null} fields are left as they are.
 */
public record UpdateDeckRequest(
        @Size(max = 255) String name,
        @Size(max = 2000) String description
) {
}
