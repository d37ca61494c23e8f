package personal.roomhub.availability.adapter.in.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import personal.roomhub.availability.adapter.in.web.dto.BookingResultResponse;
import personal.roomhub.availability.adapter.in.web.dto.CreateBookingRequest;
import personal.roomhub.availability.adapter.in.web.dto.RemoveBookingRequest;
import personal.roomhub.availability.application.port.in.CreateReservationUseCase;
import personal.roomhub.availability.application.port.in.CreatedReservation;
import personal.roomhub.availability.application.port.in.DeleteReservationUseCase;

/**
 * Booking API Controller
 * 회의실 예약 생성/삭제 REST API
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/bookings")
@RequiredArgsConstructor
public class BookingController {

    private final CreateReservationUseCase createReservationUseCase;
    private final DeleteReservationUseCase deleteReservationUseCase;

    /**
     * 예약 생성
     * POST /api/v1/bookings
     */
    @PostMapping
    public ResponseEntity<BookingResultResponse> createBooking(
            @Valid @RequestBody CreateBookingRequest request
    ) {
        log.info("Create booking: room={}, start={}, durationMins={}, business={}",
                request.room(), request.start(), request.durationMins(), request.business());

        CreatedReservation reservation = createReservationUseCase.createReservation(request.toCommand());

        return ResponseEntity.status(HttpStatus.CREATED).body(BookingResultResponse.created(reservation));
    }

    /**
     * 예약 삭제
     * POST /api/v1/bookings/remove
     */
    @PostMapping("/remove")
    public ResponseEntity<BookingResultResponse> removeBooking(
            @Valid @RequestBody RemoveBookingRequest request
    ) {
        log.info("Remove booking: room={}, eventId={}, start={}", request.room(), request.eventId(), request.start());

        deleteReservationUseCase.deleteReservation(request.toCommand());

        return ResponseEntity.ok(BookingResultResponse.removed());
    }
}
