package personal.roomhub.availability.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.roomhub.availability.application.port.in.CreateReservationCommand;
import personal.roomhub.availability.application.port.in.CreateReservationUseCase;
import personal.roomhub.availability.application.port.in.CreatedReservation;
import personal.roomhub.availability.application.port.in.DeleteReservationCommand;
import personal.roomhub.availability.application.port.in.DeleteReservationUseCase;
import personal.roomhub.availability.application.port.out.AvailabilityCacheRepository;
import personal.roomhub.availability.application.port.out.CalendarClient;
import personal.roomhub.availability.application.port.out.NewCalendarEvent;
import personal.roomhub.availability.domain.exception.BookingConflictException;
import personal.roomhub.availability.domain.model.BookingWindow;
import personal.roomhub.availability.domain.model.BusyBlock;
import personal.roomhub.availability.domain.model.ConflictCheckResult;
import personal.roomhub.availability.domain.model.Room;
import personal.roomhub.availability.domain.service.BookingWindowFactory;
import personal.roomhub.availability.domain.service.BusinessClassifier;
import personal.roomhub.availability.domain.service.ConflictChecker;

import java.time.Instant;
import java.time.LocalTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Reservation Command Service (SRP)
 * 단일 책임: 예약 생성/삭제와 캐시 무효화
 *
 * 순서: 원격 쓰기 → 성공 시에만 무효화. 실패하면 상태가 바뀌지 않았다고 보고 캐시를 건드리지 않는다.
 * 같은 회의실의 "충돌 검사 → 생성 → 무효화"는 회의실별 락 안에서 수행한다 (프로세스 내 이중 예약 방지).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReservationCommandService implements CreateReservationUseCase, DeleteReservationUseCase {

    private final CalendarClient calendarClient;
    private final AvailabilityCacheRepository availabilityCache;
    private final RoomAvailabilityCalculator calculator;
    private final RoomCalendarDirectory calendarDirectory;
    private final BookingWindowFactory windowFactory;
    private final ConflictChecker conflictChecker;
    private final BusinessClassifier businessClassifier;
    private final Map<Room, Object> roomLocks = createRoomLocks();

    @Override
    public CreatedReservation createReservation(CreateReservationCommand command) {
        calendarDirectory.verifyConfigured();
        Room room = command.room();
        String calendarId = calendarDirectory.calendarIdOf(room);
        BookingWindow window = windowFactory.windowFor(windowFactory.dateOf(command.start()));

        synchronized (roomLocks.get(room)) {
            List<BusyBlock> blocks = calculator.loadBusyBlocks(room, calendarId, window);
            ConflictCheckResult result = conflictChecker.check(
                    command.start(), command.durationMinutes(), blocks, window);

            if (result.hasConflict()) {
                BusyBlock conflict = result.conflict();
                log.warn("Booking conflict: room={}, requestedStart={}, conflictStart={}, conflictEnd={}",
                        room.getKey(), result.effectiveStart(), conflict.start(), conflict.end());
                throw new BookingConflictException(room, toLocalTime(conflict.start()), toLocalTime(conflict.end()));
            }

            NewCalendarEvent event = new NewCalendarEvent(
                    businessClassifier.summaryFor(command.business()),
                    result.effectiveStart(),
                    result.effectiveEnd(),
                    windowFactory.zone().getId());
            String eventId = calendarClient.insertEvent(calendarId, event);

            // 종일 예약 보정이 반영된 시작 시각 기준 날짜
            String affectedDate = windowFactory.dateOf(result.effectiveStart()).toString();
            availabilityCache.invalidate(affectedDate);

            log.info("Reservation created: room={}, eventId={}, start={}, end={}, invalidatedDate={}",
                    room.getKey(), eventId, result.effectiveStart(), result.effectiveEnd(), affectedDate);
            return new CreatedReservation(room, eventId, result.effectiveStart(), result.effectiveEnd());
        }
    }

    @Override
    public void deleteReservation(DeleteReservationCommand command) {
        calendarDirectory.verifyConfigured();
        Room room = command.room();
        String calendarId = calendarDirectory.calendarIdOf(room);

        synchronized (roomLocks.get(room)) {
            calendarClient.deleteEvent(calendarId, command.eventId());

            if (command.start() != null) {
                String affectedDate = windowFactory.dateOf(command.start()).toString();
                availabilityCache.invalidate(affectedDate);
                log.info("Reservation removed: room={}, eventId={}, invalidatedDate={}",
                        room.getKey(), command.eventId(), affectedDate);
            } else {
                // 날짜를 알 수 없으면 전체 캐시를 비운다
                availabilityCache.invalidateAll();
                log.info("Reservation removed: room={}, eventId={}, cache cleared", room.getKey(), command.eventId());
            }
        }
    }

    private LocalTime toLocalTime(Instant instant) {
        return instant.atZone(windowFactory.zone()).toLocalTime();
    }

    private static Map<Room, Object> createRoomLocks() {
        Map<Room, Object> locks = new EnumMap<>(Room.class);
        for (Room room : Room.values()) {
            locks.put(room, new Object());
        }
        return locks;
    }
}
