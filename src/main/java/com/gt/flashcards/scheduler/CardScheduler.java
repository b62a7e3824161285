package com.gt.flashcards.scheduler;

import com.gt.flashcards.exception.InvalidQualityException;
import com.gt.flashcards.model.ScheduledState;
import com.gt.flashcards.model.SchedulingState;

import java.time.LocalDate;

/**
 * SM-2 variant used to reschedule a card after each review.
 * <p>
 * A rating of 3 or more is a correct recall. A correct recall grows the interval 0 -> 1 -> 6 -> interval * ease,
 * and ratings of 4 and 5 adjust the ease factor with the SM-2 formula (4 leaves it unchanged, 5 adds 0.1). A rating of
 * exactly 3 leaves the ease factor untouched. An incorrect recall resets the interval to 0 and lowers the ease factor
 * by 0.2. The ease factor never drops below {@link #MIN_EASE_FACTOR} and the interval is capped at
 * {@link #MAX_INTERVAL} days.
 * <p>
 * Stateless; safe to call from any thread.
 */
public final class CardScheduler {

    public static final int MIN_QUALITY = 0;
    public static final int MAX_QUALITY = 5;
    public static final int CORRECT_QUALITY_THRESHOLD = 3;

    public static final double INITIAL_EASE_FACTOR = 2.5;
    public static final double MIN_EASE_FACTOR = 1.3;
    public static final int INITIAL_INTERVAL = 0;
    public static final int MAX_INTERVAL = 36500;

    static final int FIRST_CORRECT_INTERVAL = 1;
    static final int SECOND_CORRECT_INTERVAL = 6;
    static final double INCORRECT_EASE_PENALTY = 0.2;

    private CardScheduler() { }

    public static SchedulingState initialState() {
        return new SchedulingState(INITIAL_INTERVAL, INITIAL_EASE_FACTOR);
    }

    public static ScheduledState computeNextState(SchedulingState state, int quality, LocalDate today) {
        validateQuality(quality);
        validateState(state);

        int newInterval;
        double newEaseFactor;

        if (quality >= CORRECT_QUALITY_THRESHOLD) {
            newEaseFactor = quality == CORRECT_QUALITY_THRESHOLD
                    ? state.easeFactor()
                    : Math.max(adjustEaseFactor(state.easeFactor(), quality), MIN_EASE_FACTOR);
            newInterval = nextCorrectInterval(state.interval(), newEaseFactor);
        } else {
            newInterval = 0;
            newEaseFactor = Math.max(state.easeFactor() - INCORRECT_EASE_PENALTY, MIN_EASE_FACTOR);
        }

        return new ScheduledState(newInterval, newEaseFactor, today.plusDays(newInterval));
    }

    public static boolean isValidQuality(int quality) {
        return quality >= MIN_QUALITY && quality <= MAX_QUALITY;
    }

    private static double adjustEaseFactor(double easeFactor, int quality) {
        int qualityDeficit = MAX_QUALITY - quality;

        return easeFactor + (0.1 - qualityDeficit * (0.08 + qualityDeficit * 0.02));
    }

    private static int nextCorrectInterval(int interval, double easeFactor) {
        if (interval == 0) {
            return FIRST_CORRECT_INTERVAL;
        } else if (interval == 1) {
            return SECOND_CORRECT_INTERVAL;
        }

        return (int) Math.min(Math.round(interval * easeFactor), MAX_INTERVAL);
    }

    private static void validateQuality(int quality) {
        if (!isValidQuality(quality)) {
            throw new InvalidQualityException("Quality rating " + quality + " is outside " + MIN_QUALITY + ".." + MAX_QUALITY);
        }
    }

    private static void validateState(SchedulingState state) {
        if (state.interval() < 0) {
            throw new IllegalArgumentException("Interval must not be negative, got " + state.interval());
        }
        if (state.easeFactor() < MIN_EASE_FACTOR) {
            throw new IllegalArgumentException("Ease factor must be at least " + MIN_EASE_FACTOR + ", got " + state.easeFactor());
        }
    }
}
