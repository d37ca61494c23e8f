package personal.roomhub.availability.application.port.in;

/**
 * Create Reservation UseCase (Input Port)
 */
public interface CreateReservationUseCase {

    /**
     * 회의실 예약 생성
     * 충돌 검사 → 캘린더 이벤트 생성 → 성공 시 해당 날짜 캐시 무효화
     *
     * @throws personal.roomhub.availability.domain.exception.BookingConflictException 기존 예약과 겹칠 때 (409)
     * @throws personal.roomhub.availability.domain.exception.CalendarMutationFailedException 생성 실패 시
     */
    CreatedReservation createReservation(CreateReservationCommand command);
}
