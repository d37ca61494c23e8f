package personal.roomhub.availability.domain.exception;

import personal.roomhub.common.exception.BusinessException;
import personal.roomhub.common.exception.ErrorCode;

/**
 * Calendar Unavailable Exception
 * 캘린더 조회 실패 (5xx, Timeout, Circuit Breaker Open)
 * 가용성 조회에서는 해당 회의실 스냅샷만 저하시키는 데 사용된다
 */
public class CalendarUnavailableException extends BusinessException {
    public CalendarUnavailableException(String calendarId, Throwable cause) {
        super(ErrorCode.CALENDAR_UNAVAILABLE,
                String.format("Calendar read failed: calendarId=%s", calendarId), cause);
    }
}
