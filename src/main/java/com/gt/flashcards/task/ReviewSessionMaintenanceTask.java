package com.gt.flashcards.task;

import com.gt.flashcards.review.ReviewSessionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

@Component
public class ReviewSessionMaintenanceTask {

    private static final Logger log = LoggerFactory.getLogger(ReviewSessionMaintenanceTask.class);

    private static final long PURGE_SCHEDULE_MS = 15 * 60 * 1000;

    private final ReviewSessionService reviewSessionService;
    private final Clock scheduleClock;
    private final int sessionExpiryMinutes;

    public ReviewSessionMaintenanceTask(ReviewSessionService reviewSessionService,
                                        Clock scheduleClock,
                                        @Value("${flashcards.review.sessionExpiryMinutes:120}") int sessionExpiryMinutes) {
        this.reviewSessionService = reviewSessionService;
        this.scheduleClock = scheduleClock;

        this.sessionExpiryMinutes = sessionExpiryMinutes;
    }

    @Scheduled(fixedDelay = PURGE_SCHEDULE_MS, initialDelay = PURGE_SCHEDULE_MS)
    public void purgeInactiveReviewSessions() {
        Instant cutoff = scheduleClock.instant().minus(sessionExpiryMinutes, ChronoUnit.MINUTES);

        int purgeCnt = reviewSessionService.purgeInactiveSessions(cutoff);

        log.info("Purged inactive review sessions. {} sessions removed, {} still active.", purgeCnt, reviewSessionService.getActiveSessionCount());
    }
}
