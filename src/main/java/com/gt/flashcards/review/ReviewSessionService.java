package com.gt.flashcards.review;

import com.gt.flashcards.card.CardService;
import com.gt.flashcards.exception.InvalidQualityException;
import com.gt.flashcards.exception.ReviewSessionNotFoundException;
import com.gt.flashcards.model.Card;
import com.gt.flashcards.model.ReviewPhase;
import com.gt.flashcards.model.ReviewSessionStatus;
import com.gt.flashcards.scheduler.DueQueueBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class ReviewSessionService {

    private static final Logger log = LoggerFactory.getLogger(ReviewSessionService.class);

    private final CardService cardService;
    private final Clock scheduleClock;
    private final Map<String, ReviewSession> sessionsById = new ConcurrentHashMap<>();

    @Autowired
    public ReviewSessionService(CardService cardService, Clock scheduleClock) {
        this.cardService = cardService;
        this.scheduleClock = scheduleClock;
    }

    public ReviewSessionStatus startSession(String username) {
        Instant now = scheduleClock.instant();
        List<Card> dueQueue = DueQueueBuilder.buildDueQueue(cardService.loadAllCards(username), LocalDate.now(scheduleClock));

        ReviewSession session = new ReviewSession(UUID.randomUUID().toString(), username, now);
        session.start(dueQueue, now);
        sessionsById.put(session.getId(), session);

        log.info("Started review session {} for {} with {} due cards", session.getId(), username, dueQueue.size());
        return session.getStatus();
    }

    public ReviewSessionStatus getSessionStatus(String username, String sessionId) {
        return getOwnedSession(username, sessionId).getStatus();
    }

    public ReviewSessionStatus revealAnswer(String username, String sessionId) {
        ReviewSession session = getOwnedSession(username, sessionId);
        session.revealAnswer(scheduleClock.instant());

        return session.getStatus();
    }

    public ReviewSessionStatus submitRating(String username, String sessionId, Integer quality) {
        if (quality == null) {
            throw new InvalidQualityException("Quality rating is required");
        }
        ReviewSession session = getOwnedSession(username, sessionId);

        session.submitRating(quality,
                (card, cardReviewUpdate) -> cardService.updateCardReview(username, card.id(), cardReviewUpdate),
                LocalDate.now(scheduleClock),
                scheduleClock.instant());

        ReviewSessionStatus status = session.getStatus();
        if (status.phase() == ReviewPhase.Complete) {
            log.info("Review session {} for {} complete, {} cards reviewed", sessionId, username, status.reviewedCount());
        }

        return status;
    }

    public void abortSession(String username, String sessionId) {
        ReviewSession session = getOwnedSession(username, sessionId);

        session.abort();
        sessionsById.remove(sessionId);
        log.info("Aborted review session {} for {} after {} reviews", sessionId, username, session.getReviewedCount());
    }

    public int purgeInactiveSessions(Instant cutoff) {
        int purgeCnt = 0;

        for (ReviewSession session : sessionsById.values()) {
            if (session.abortIfInactiveSince(cutoff) && sessionsById.remove(session.getId(), session)) {
                purgeCnt++;
            }
        }

        return purgeCnt;
    }

    public int getActiveSessionCount() {
        return sessionsById.size();
    }

    private ReviewSession getOwnedSession(String username, String sessionId) {
        ReviewSession session = sessionsById.get(sessionId);

        if (session == null || !session.getOwner().equals(username)) {
            throw new ReviewSessionNotFoundException("Review session " + sessionId + " does not exist");
        }

        return session;
    }
}
