package app.lexis.core.deck.domain.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateDeckRequest(
        @NotBlank @Size(max = 255) String name,
        @Size(max = 2000) String description
) {
}
