package personal.roomhub.availability.application.port.out;

import personal.roomhub.availability.domain.model.ReservationRecord;

import java.time.Instant;
import java.util.List;

/**
 * Calendar Client (Output Port)
 * 회의실별 외부 캘린더와의 통신 인터페이스
 */
public interface CalendarClient {

    /**
     * [timeMin, timeMax) 범위의 단일 이벤트 목록 조회 (반복 일정은 이미 펼쳐진 상태)
     *
     * @throws personal.roomhub.availability.domain.exception.CalendarUnavailableException 조회 실패 시
     */
    List<ReservationRecord> listEvents(String calendarId, Instant timeMin, Instant timeMax);

    /**
     * 이벤트 생성
     *
     * @return 생성된 외부 이벤트 ID
     * @throws personal.roomhub.availability.domain.exception.CalendarMutationFailedException 생성 실패 시
     */
    String insertEvent(String calendarId, NewCalendarEvent event);

    /**
     * 이벤트 삭제
     *
     * @throws personal.roomhub.availability.domain.exception.CalendarMutationFailedException 삭제 실패 시
     */
    void deleteEvent(String calendarId, String eventId);
}
