package personal.roomhub.availability.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import personal.roomhub.availability.application.port.in.CreatedReservation;

import java.time.Instant;

/**
 * 예약 생성/삭제 결과 응답 DTO
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BookingResultResponse(
        boolean success,
        String room,
        String eventId,
        Instant start,
        Instant end
) {
    public static BookingResultResponse created(CreatedReservation reservation) {
        return new BookingResultResponse(
                true,
                reservation.room().getKey(),
                reservation.eventId(),
                reservation.start(),
                reservation.end()
        );
    }

    public static BookingResultResponse removed() {
        return new BookingResultResponse(true, null, null, null, null);
    }
}
