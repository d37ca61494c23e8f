package personal.roomhub.availability.domain.exception;

import personal.roomhub.common.exception.BusinessException;
import personal.roomhub.common.exception.ErrorCode;

/**
 * Calendar Mutation Failed Exception
 * 이벤트 생성/삭제 실패. 재시도하지 않으며 캐시도 무효화하지 않는다
 */
public class CalendarMutationFailedException extends BusinessException {

    private CalendarMutationFailedException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }

    public static CalendarMutationFailedException insertFailed(String calendarId, Throwable cause) {
        return new CalendarMutationFailedException(ErrorCode.BOOKING_CREATE_FAILED,
                String.format("Calendar insert failed: calendarId=%s", calendarId), cause);
    }

    public static CalendarMutationFailedException deleteFailed(String calendarId, String eventId, Throwable cause) {
        return new CalendarMutationFailedException(ErrorCode.BOOKING_REMOVE_FAILED,
                String.format("Calendar delete failed: calendarId=%s, eventId=%s", calendarId, eventId), cause);
    }
}
