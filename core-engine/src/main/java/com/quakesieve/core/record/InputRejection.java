package com.quakesieve.core.record;

import java.io.Serializable;
import java.util.Objects;
import java.util.Optional;

/**
 * A record dropped by the lenient parser.
 *
 * @since 1.0.0
 */
public final class InputRejection implements Serializable {

    private static final long serialVersionUID = 1L;

    private final int rowNumber;
    private final String eventId;
    private final String reason;

    public InputRejection(int rowNumber, String eventId, String reason) {
        this.rowNumber = rowNumber;
        this.eventId = eventId;
        this.reason = Objects.requireNonNull(reason, "reason must not be null");
    }

    /**
     * @return 1-based data row number
     */
    public int getRowNumber() {
        return rowNumber;
    }

    /**
     * @return the record's id, or empty when the id itself was unusable
     */
    public Optional<String> getEventId() {
        return Optional.ofNullable(eventId);
    }

    public String getReason() {
        return reason;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof InputRejection that))
            return false;
        return rowNumber == that.rowNumber
                && Objects.equals(eventId, that.eventId)
                && reason.equals(that.reason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rowNumber, eventId, reason);
    }

    @Override
    public String toString() {
        return "InputRejection{" +
                "rowNumber=" + rowNumber +
                ", eventId='" + eventId + '\'' +
                ", reason='" + reason + '\'' +
                '}';
    }
}
