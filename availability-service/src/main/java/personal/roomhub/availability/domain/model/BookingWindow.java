package personal.roomhub.availability.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;

/**
 * 하루 예약 가능 구간 [start, end)
 * start/end 모두 운영 타임존 기준 같은 날짜에 고정된다
 */
public record BookingWindow(
        LocalDate date,
        Instant start,
        Instant end
) {
    public BookingWindow {
        if (date == null || start == null || end == null) {
            throw new IllegalArgumentException("Booking window fields cannot be null");
        }
        if (!start.isBefore(end)) {
            throw new IllegalArgumentException(
                    String.format("Booking window start must be before end: start=%s, end=%s", start, end));
        }
    }

    public Duration length() {
        return Duration.between(start, end);
    }

    public long lengthMinutes() {
        return length().toMinutes();
    }

    /**
     * now가 [start, end) 안에 있는지 여부
     */
    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && instant.isBefore(end);
    }
}
