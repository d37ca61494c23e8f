package personal.roomhub.availability.acceptance.support;

import personal.roomhub.availability.application.port.out.CalendarClient;
import personal.roomhub.availability.application.port.out.NewCalendarEvent;
import personal.roomhub.availability.domain.exception.CalendarMutationFailedException;
import personal.roomhub.availability.domain.exception.CalendarUnavailableException;
import personal.roomhub.availability.domain.model.ReservationRecord;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 인수 테스트용 인메모리 캘린더
 * 캘린더 ID별 이벤트 목록을 보관하고 조회 횟수를 센다
 */
public class InMemoryCalendarClient implements CalendarClient {

    private final Map<String, List<ReservationRecord>> events = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> listCalls = new ConcurrentHashMap<>();
    private final Set<String> unavailable = ConcurrentHashMap.newKeySet();
    private final AtomicInteger sequence = new AtomicInteger();

    @Override
    public List<ReservationRecord> listEvents(String calendarId, Instant timeMin, Instant timeMax) {
        listCalls.computeIfAbsent(calendarId, key -> new AtomicInteger()).incrementAndGet();
        if (unavailable.contains(calendarId)) {
            throw new CalendarUnavailableException(calendarId, null);
        }
        return eventsOf(calendarId).stream()
                .filter(event -> event.start().isBefore(timeMax) && event.end().isAfter(timeMin))
                .toList();
    }

    @Override
    public String insertEvent(String calendarId, NewCalendarEvent event) {
        if (unavailable.contains(calendarId)) {
            throw CalendarMutationFailedException.insertFailed(calendarId, null);
        }
        String eventId = "evt-" + sequence.incrementAndGet();
        eventsOf(calendarId).add(new ReservationRecord(event.start(), event.end(), event.summary(), eventId));
        return eventId;
    }

    @Override
    public void deleteEvent(String calendarId, String eventId) {
        boolean removed = !unavailable.contains(calendarId)
                && eventsOf(calendarId).removeIf(event -> eventId.equals(event.eventId()));
        if (!removed) {
            throw CalendarMutationFailedException.deleteFailed(calendarId, eventId, null);
        }
    }

    public void addEvent(String calendarId, ReservationRecord record) {
        eventsOf(calendarId).add(record);
    }

    public void markUnavailable(String calendarId) {
        unavailable.add(calendarId);
    }

    public int listCallCount(String calendarId) {
        AtomicInteger count = listCalls.get(calendarId);
        return count == null ? 0 : count.get();
    }

    public List<ReservationRecord> snapshot(String calendarId) {
        return new ArrayList<>(eventsOf(calendarId));
    }

    public void reset() {
        events.clear();
        listCalls.clear();
        unavailable.clear();
    }

    private List<ReservationRecord> eventsOf(String calendarId) {
        return events.computeIfAbsent(calendarId, key -> new CopyOnWriteArrayList<>());
    }
}
