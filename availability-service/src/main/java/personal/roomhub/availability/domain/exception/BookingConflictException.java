package personal.roomhub.availability.domain.exception;

import personal.roomhub.availability.domain.model.Room;
import personal.roomhub.common.exception.BusinessException;
import personal.roomhub.common.exception.ErrorCode;

import java.time.LocalTime;
import java.time.format.DateTimeFormatter;

/**
 * Booking Conflict Exception
 * 요청한 시간대가 기존 점유 블록과 겹칠 때 발생 (409 Conflict)
 * 메시지에는 가장 먼저 시작하는 충돌 블록의 시간이 들어간다
 */
public class BookingConflictException extends BusinessException {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("H:mm");

    public BookingConflictException(Room room, LocalTime blockStart, LocalTime blockEnd) {
        super(ErrorCode.BOOKING_CONFLICT,
                String.format("%s is booked from %s to %s", room.getDisplayName(),
                        TIME_FORMAT.format(blockStart), TIME_FORMAT.format(blockEnd)));
    }
}
