package personal.roomhub.availability.domain.model;

import java.time.Instant;

/**
 * 외부 캘린더에서 읽어온 예약 레코드 (읽기 전용)
 * start >= end 인 레코드는 BlockNormalizer에서 버려진다
 *
 * @param start   시작 시각
 * @param end     종료 시각
 * @param label   이벤트 제목 (없으면 "Booked")
 * @param eventId 외부 이벤트 ID
 */
public record ReservationRecord(
        Instant start,
        Instant end,
        String label,
        String eventId
) {
    public static final String DEFAULT_LABEL = "Booked";

    public ReservationRecord {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Reservation start and end cannot be null");
        }
        if (label == null || label.isBlank()) {
            label = DEFAULT_LABEL;
        }
    }

    public ReservationRecord withBounds(Instant clippedStart, Instant clippedEnd) {
        return new ReservationRecord(clippedStart, clippedEnd, label, eventId);
    }
}
