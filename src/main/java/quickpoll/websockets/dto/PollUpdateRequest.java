package quickpoll.websockets.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

/**
 * Partial update; null fields are left unchanged.
 */
public record PollUpdateRequest(
        @NotNull(message = "User ID is required")
        @Positive(message = "User ID must be positive")
        Long userId,

        @Size(min = 3, max = 200, message = "Title must be 3 to 200 characters")
        @Pattern(regexp = ".*\\S.*", message = "Title must not be blank")
        String title,

        @Size(max = 1000, message = "Description must be at most 1000 characters")
        String description,

        @JsonProperty("is_active")
        Boolean isActive
) {}
