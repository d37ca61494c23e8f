package personal.roomhub.availability.application.port.in;

import personal.roomhub.availability.domain.model.Room;
import personal.roomhub.common.exception.BusinessException;
import personal.roomhub.common.exception.ErrorCode;

import java.time.Instant;

/**
 * Delete Reservation Command
 *
 * @param start 원래 예약 시작 시각 (선택)
 */
public record DeleteReservationCommand(
        Room room,
        String eventId,
        Instant start
) {
    public DeleteReservationCommand {
        if (room == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Room cannot be null");
        }
        if (eventId == null || eventId.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Event ID cannot be null or blank");
        }
    }
}
