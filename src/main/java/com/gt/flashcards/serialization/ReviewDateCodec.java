package com.gt.flashcards.serialization;

import com.gt.flashcards.exception.MappingException;

import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;

/**
 * Converts review dates to and from their stored string form.
 * <p>
 * A due date is stored as the ISO-8601 instant of midnight in the scheduling zone, e.g. {@code 2026-10-19T00:00:00Z}
 * for UTC. Review timestamps are stored as full ISO-8601 instants. Bare {@code yyyy-MM-dd} dates and instants with an
 * offset are also accepted when reading.
 */
public class ReviewDateCodec {

    private static final int ISO_DATE_LENGTH = 10;      // yyyy-MM-dd

    private final ZoneId zone;

    public ReviewDateCodec(ZoneId zone) {
        this.zone = zone;
    }

    public ZoneId getZone() {
        return zone;
    }

    public String encodeReviewDate(LocalDate reviewDate) {
        return reviewDate.atStartOfDay(zone).toInstant().toString();
    }

    public LocalDate decodeReviewDate(String encodedDate) {
        if (encodedDate == null || encodedDate.isBlank()) {
            throw new MappingException("Review date is missing");
        }

        try {
            if (encodedDate.length() == ISO_DATE_LENGTH) {
                return LocalDate.parse(encodedDate);
            }
            return OffsetDateTime.parse(encodedDate).atZoneSameInstant(zone).toLocalDate();
        } catch (DateTimeParseException ex) {
            throw new MappingException("Unable to parse review date " + encodedDate, ex);
        }
    }

    public String encodeReviewInstant(Instant reviewInstant) {
        return reviewInstant == null ? null : reviewInstant.toString();
    }

    public Instant decodeReviewInstant(String encodedInstant) {
        if (encodedInstant == null || encodedInstant.isBlank()) {
            return null;
        }

        try {
            return OffsetDateTime.parse(encodedInstant).toInstant();
        } catch (DateTimeParseException ex) {
            throw new MappingException("Unable to parse review timestamp " + encodedInstant, ex);
        }
    }
}
