package quickpoll.websockets.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record PollOptionRequest(
        @NotBlank(message = "Option text is required")
        @Size(max = 200, message = "Option text must be at most 200 characters")
        String text
) {}
