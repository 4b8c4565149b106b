package quickpoll.websockets.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.util.List;

public record PollCreateRequest(
        @NotNull(message = "Creator ID is required")
        @Positive(message = "Creator ID must be positive")
        Long creatorId,

        @NotBlank(message = "Creator username is required")
        @Size(min = 3, max = 50, message = "Creator username must be 3 to 50 characters")
        String creatorUsername,

        @NotBlank(message = "Title is required")
        @Size(min = 3, max = 200, message = "Title must be 3 to 200 characters")
        String title,

        @Size(max = 1000, message = "Description must be at most 1000 characters")
        String description,

        @NotNull(message = "Options are required")
        @Size(min = 2, max = 10, message = "A poll needs 2 to 10 options")
        List<@Valid PollOptionRequest> options
) {}
