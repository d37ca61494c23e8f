package personal.roomhub.availability.application.port.in;

import personal.roomhub.availability.domain.model.Room;

import java.time.Instant;

/**
 * 생성된 예약 (종일 예약이면 start는 구간 시작으로 보정된 값)
 */
public record CreatedReservation(
        Room room,
        String eventId,
        Instant start,
        Instant end
) {
}
