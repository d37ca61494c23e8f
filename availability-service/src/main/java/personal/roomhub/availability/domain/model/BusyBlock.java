package personal.roomhub.availability.domain.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 병합된 점유 구간 (불변)
 *
 * 같은 회의실/날짜 안에서 블록들은 서로 겹치지 않고 start 오름차순이며 예약 구간 안에 있다.
 * label은 시작 시각이 가장 빠른 원본 레코드의 제목이고, eventIds는 병합된 모든 원본 이벤트 ID이다.
 */
public record BusyBlock(
        Instant start,
        Instant end,
        String label,
        List<String> eventIds
) {
    public BusyBlock {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Busy block start and end cannot be null");
        }
        eventIds = eventIds == null ? List.of() : List.copyOf(eventIds);
    }

    public static BusyBlock from(ReservationRecord record) {
        List<String> ids = record.eventId() == null ? List.of() : List.of(record.eventId());
        return new BusyBlock(record.start(), record.end(), record.label(), ids);
    }

    /**
     * 구간을 end까지 늘리고 다른 레코드의 이벤트 ID를 합친다. label은 유지한다.
     */
    public BusyBlock absorb(ReservationRecord record) {
        Instant extendedEnd = record.end().isAfter(end) ? record.end() : end;
        List<String> ids = new ArrayList<>(eventIds);
        if (record.eventId() != null) {
            ids.add(record.eventId());
        }
        return new BusyBlock(start, extendedEnd, label, ids);
    }

    public int mergedCount() {
        return Math.max(1, eventIds.size());
    }

    public boolean contains(Instant instant) {
        return !start.isAfter(instant) && end.isAfter(instant);
    }

    public boolean overlaps(Instant otherStart, Instant otherEnd) {
        return start.isBefore(otherEnd) && end.isAfter(otherStart);
    }
}
