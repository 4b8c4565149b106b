package quickpoll.websockets.controller;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import quickpoll.websockets.dto.LikeRequest;
import quickpoll.websockets.dto.LikeResponse;
import quickpoll.websockets.dto.PollCreateRequest;
import quickpoll.websockets.dto.PollListResponse;
import quickpoll.websockets.dto.PollResponse;
import quickpoll.websockets.dto.PollUpdateRequest;
import quickpoll.websockets.dto.VoteRequest;
import quickpoll.websockets.dto.VoteResponse;
import quickpoll.websockets.service.LikeService;
import quickpoll.websockets.service.PollService;
import quickpoll.websockets.service.VoteService;

@RestController
@RequestMapping("/api/polls")
@Validated
public class PollController {

    private static final Logger log = LoggerFactory.getLogger(PollController.class);

    private final PollService pollService;
    private final VoteService voteService;
    private final LikeService likeService;

    public PollController(PollService pollService, VoteService voteService, LikeService likeService) {
        this.pollService = pollService;
        this.voteService = voteService;
        this.likeService = likeService;
    }

    @PostMapping
    public ResponseEntity<PollResponse> createPoll(@Valid @RequestBody PollCreateRequest request) {
        log.info("Creating poll for user: {}", request.creatorId());
        return ResponseEntity.status(HttpStatus.CREATED).body(pollService.createPoll(request));
    }

    @GetMapping
    public PollListResponse listPolls(
            @RequestParam(defaultValue = "1") @Min(1) int page,
            @RequestParam(name = "page_size", defaultValue = "20") @Min(1) @Max(100) int pageSize,
            @RequestParam(name = "creator_id", required = false) Long creatorId,
            @RequestParam(name = "is_active", required = false) Boolean isActive,
            @RequestParam(name = "user_id", required = false) Long userId
    ) {
        return pollService.listPolls(page, pageSize, creatorId, isActive, userId);
    }

    @GetMapping("/{pollId}")
    public PollResponse getPoll(
            @PathVariable long pollId,
            @RequestParam(name = "user_id", required = false) Long userId
    ) {
        return pollService.getPoll(pollId, userId);
    }

    @PutMapping("/{pollId}")
    public PollResponse updatePoll(@PathVariable long pollId, @Valid @RequestBody PollUpdateRequest request) {
        return pollService.updatePoll(pollId, request);
    }

    @DeleteMapping("/{pollId}")
    public ResponseEntity<Void> deletePoll(
            @PathVariable long pollId,
            @RequestParam(name = "user_id") long userId
    ) {
        pollService.deletePoll(pollId, userId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{pollId}/vote")
    public VoteResponse vote(@PathVariable long pollId, @Valid @RequestBody VoteRequest request) {
        return voteService.castVote(pollId, request);
    }

    @PostMapping("/{pollId}/like")
    public LikeResponse toggleLike(@PathVariable long pollId, @Valid @RequestBody LikeRequest request) {
        return likeService.toggleLike(pollId, request);
    }
}
