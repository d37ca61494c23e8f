package personal.roomhub.availability.domain.model;

import java.time.Instant;

/**
 * 예약 구간의 30분 단위 슬롯 [start, end)
 */
public record Slot(
        int index,
        Instant start,
        Instant end
) {
}
