package personal.roomhub.availability.domain.model;

import java.time.Instant;
import java.util.List;

/**
 * 회의실 하나의 가용성 스냅샷 (불변)
 *
 * @param room          회의실
 * @param busyBlocks    병합된 점유 구간
 * @param freeNow       지금 비어 있는지 (오늘, 운영 시간 중에만 의미 있음)
 * @param nextAvailable 현재 점유 중이면 비는 시각, 아니면 null
 * @param error         캘린더 조회 실패 시 메시지, 정상이면 null
 */
public record AvailabilitySnapshot(
        Room room,
        List<BusyBlock> busyBlocks,
        boolean freeNow,
        Instant nextAvailable,
        String error
) {
    public static final String CALENDAR_ERROR_MESSAGE = "Could not load calendar data";

    public AvailabilitySnapshot {
        if (room == null) {
            throw new IllegalArgumentException("Room cannot be null");
        }
        busyBlocks = busyBlocks == null ? List.of() : List.copyOf(busyBlocks);
    }

    public static AvailabilitySnapshot of(Room room, List<BusyBlock> busyBlocks, AvailabilityStatus status) {
        return new AvailabilitySnapshot(room, busyBlocks, status.freeNow(), status.nextAvailable(), null);
    }

    /**
     * 조회 실패 시 다른 회의실 결과에 영향을 주지 않는 저하된 스냅샷
     */
    public static AvailabilitySnapshot failed(Room room) {
        return new AvailabilitySnapshot(room, List.of(), false, null, CALENDAR_ERROR_MESSAGE);
    }

    public boolean hasError() {
        return error != null;
    }
}
