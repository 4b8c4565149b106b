package quickpoll.websockets.dto;

import java.util.List;

public record PollListResponse(
        List<PollResponse> polls,
        long total,
        int page,
        int pageSize,
        int totalPages
) {
    public static PollListResponse of(List<PollResponse> polls, long total, int page, int pageSize) {
        int totalPages = (int) ((total + pageSize - 1) / pageSize);
        return new PollListResponse(polls, total, page, pageSize, totalPages);
    }
}
