package personal.roomhub.availability.adapter.in.web.dto;

import jakarta.validation.constraints.NotBlank;
import personal.roomhub.availability.application.port.in.DeleteReservationCommand;
import personal.roomhub.availability.domain.model.Room;

import java.time.Instant;

/**
 * 예약 삭제 요청 DTO
 * start는 선택: 없으면 서버가 전체 캐시를 비운다
 */
public record RemoveBookingRequest(
        @NotBlank(message = "Room is required")
        String room,

        @NotBlank(message = "Event ID is required")
        String eventId,

        Instant start
) {
    public DeleteReservationCommand toCommand() {
        return new DeleteReservationCommand(Room.fromKey(room), eventId, start);
    }
}
