package com.questrail.homehub.validation;

import com.questrail.homehub.api.Reading;

import java.util.Objects;

/**
 * Outcome of {@link ReadingValidator#validate}: either an accepted
 * {@link Reading} or a named rejection.
 */
public sealed interface ValidationResult
        permits ValidationResult.Accepted, ValidationResult.Rejected
{
    boolean isAccepted();

    record Accepted(Reading reading) implements ValidationResult {
        public Accepted {
            Objects.requireNonNull(reading, "reading");
        }

        @Override
        public boolean isAccepted() {
            return true;
        }
    }

    /**
     * @param reason which constraint failed
     * @param detail short human-readable description for logs
     */
    record Rejected(RejectReason reason, String detail) implements ValidationResult {
        public Rejected {
            Objects.requireNonNull(reason, "reason");
            Objects.requireNonNull(detail, "detail");
        }

        @Override
        public boolean isAccepted() {
            return false;
        }
    }
}
