package personal.roomhub.availability.adapter.in.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import personal.roomhub.availability.application.port.in.CreateReservationCommand;
import personal.roomhub.availability.domain.model.Room;

import java.time.Instant;

/**
 * 예약 생성 요청 DTO
 */
public record CreateBookingRequest(
        @NotBlank(message = "Room is required")
        String room,

        @NotNull(message = "Start is required")
        Instant start,

        @NotNull(message = "Duration is required")
        @Positive(message = "Duration must be positive")
        Integer durationMins,

        @NotBlank(message = "Business is required")
        String business
) {
    public CreateReservationCommand toCommand() {
        return new CreateReservationCommand(Room.fromKey(room), start, durationMins, business);
    }
}
