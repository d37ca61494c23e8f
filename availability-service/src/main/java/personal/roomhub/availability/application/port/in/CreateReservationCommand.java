package personal.roomhub.availability.application.port.in;

import personal.roomhub.availability.domain.model.Room;
import personal.roomhub.common.exception.BusinessException;
import personal.roomhub.common.exception.ErrorCode;

import java.time.Instant;

/**
 * Create Reservation Command
 * 네 필드 모두 필수. 외부 호출 전에 검증한다
 */
public record CreateReservationCommand(
        Room room,
        Instant start,
        Integer durationMinutes,
        String business
) {
    public CreateReservationCommand {
        if (room == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Room cannot be null");
        }
        if (start == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Start cannot be null");
        }
        if (durationMinutes == null || durationMinutes <= 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Duration must be a positive number of minutes");
        }
        if (business == null || business.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Business cannot be null or blank");
        }
    }
}
