package personal.roomhub.availability.domain.model;

import java.time.LocalDate;

/**
 * 날짜별 두 회의실 스냅샷 묶음 (캐시 단위)
 */
public record DailyAvailability(
        LocalDate date,
        AvailabilitySnapshot talkingRoom,
        AvailabilitySnapshot boardRoom
) {
    public AvailabilitySnapshot snapshotOf(Room room) {
        return switch (room) {
            case TALKING -> talkingRoom;
            case BOARD -> boardRoom;
        };
    }

    /**
     * 한 회의실이라도 조회에 실패했으면 true
     */
    public boolean isDegraded() {
        return talkingRoom.hasError() || boardRoom.hasError();
    }
}
