package personal.roomhub.availability.domain.service;

import personal.roomhub.availability.domain.model.BookingWindow;
import personal.roomhub.common.exception.BusinessException;
import personal.roomhub.common.exception.ErrorCode;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;

/**
 * 운영 타임존과 운영 시간(open/close)으로 날짜별 예약 구간을 만든다
 * 날짜 문자열은 운영 타임존 기준 yyyy-MM-dd
 */
public class BookingWindowFactory {

    private final ZoneId zone;
    private final LocalTime open;
    private final LocalTime close;
    private final Clock clock;

    public BookingWindowFactory(ZoneId zone, LocalTime open, LocalTime close, Clock clock) {
        if (!open.isBefore(close)) {
            throw new IllegalArgumentException(
                    String.format("Window open must be before close: open=%s, close=%s", open, close));
        }
        this.zone = zone;
        this.open = open;
        this.close = close;
        this.clock = clock;
    }

    public BookingWindow windowFor(LocalDate date) {
        Instant start = date.atTime(open).atZone(zone).toInstant();
        Instant end = date.atTime(close).atZone(zone).toInstant();
        return new BookingWindow(date, start, end);
    }

    public LocalDate today() {
        return LocalDate.now(clock.withZone(zone));
    }

    public LocalDate dateOf(Instant instant) {
        return instant.atZone(zone).toLocalDate();
    }

    /**
     * 날짜 파라미터 해석. 비어 있으면 오늘
     */
    public LocalDate resolveDate(String date) {
        if (date == null || date.isBlank()) {
            return today();
        }
        try {
            return LocalDate.parse(date.trim());
        } catch (DateTimeParseException e) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Invalid date (expected yyyy-MM-dd): " + date);
        }
    }

    public Instant now() {
        return clock.instant();
    }

    public ZoneId zone() {
        return zone;
    }
}
