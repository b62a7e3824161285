package com.gt.flashcards.review;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.gt.flashcards.model.ReviewSessionStatus;
import com.gt.flashcards.serialization.ReviewQualityDeserializer;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/rest/review")
public class ReviewSessionController {

    private final ReviewSessionService reviewSessionService;

    public ReviewSessionController(ReviewSessionService reviewSessionService) {
        this.reviewSessionService = reviewSessionService;
    }

    @PostMapping(value = "/start", produces = "application/json")
    public ReviewSessionStatus startSession(@AuthenticationPrincipal UserDetails userDetails) {
        return reviewSessionService.startSession(userDetails.getUsername());
    }

    @GetMapping(value = "/{sessionId}", produces = "application/json")
    public ReviewSessionStatus getSessionStatus(@PathVariable("sessionId") String sessionId,
                                                @AuthenticationPrincipal UserDetails userDetails) {
        return reviewSessionService.getSessionStatus(userDetails.getUsername(), sessionId);
    }

    @PostMapping(value = "/{sessionId}/reveal", produces = "application/json")
    public ReviewSessionStatus revealAnswer(@PathVariable("sessionId") String sessionId,
                                            @AuthenticationPrincipal UserDetails userDetails) {
        return reviewSessionService.revealAnswer(userDetails.getUsername(), sessionId);
    }

    @PostMapping(value = "/{sessionId}/rate", consumes = "application/json", produces = "application/json")
    public ReviewSessionStatus submitRating(@PathVariable("sessionId") String sessionId,
                                            @RequestBody SubmitRatingRequest request,
                                            @AuthenticationPrincipal UserDetails userDetails) {
        return reviewSessionService.submitRating(userDetails.getUsername(), sessionId, request.quality());
    }

    @PostMapping("/{sessionId}/abort")
    public void abortSession(@PathVariable("sessionId") String sessionId,
                             @AuthenticationPrincipal UserDetails userDetails) {
        reviewSessionService.abortSession(userDetails.getUsername(), sessionId);
    }

    private record SubmitRatingRequest(@JsonDeserialize(using = ReviewQualityDeserializer.class) Integer quality) { }
}
