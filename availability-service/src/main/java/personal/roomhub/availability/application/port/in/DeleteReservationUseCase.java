package personal.roomhub.availability.application.port.in;

/**
 * Delete Reservation UseCase (Input Port)
 */
public interface DeleteReservationUseCase {

    /**
     * 캘린더 이벤트 삭제 후 캐시 무효화
     * start가 있으면 그 날짜만, 없으면 전체 캐시를 비운다
     *
     * @throws personal.roomhub.availability.domain.exception.CalendarMutationFailedException 삭제 실패 시
     */
    void deleteReservation(DeleteReservationCommand command);
}
