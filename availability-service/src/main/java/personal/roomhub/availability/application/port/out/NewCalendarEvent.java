package personal.roomhub.availability.application.port.out;

import java.time.Instant;

/**
 * 생성할 캘린더 이벤트
 */
public record NewCalendarEvent(
        String summary,
        Instant start,
        Instant end,
        String timeZone
) {
}
