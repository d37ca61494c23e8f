package personal.roomhub.availability.application.port.in;

import personal.roomhub.availability.domain.model.AvailabilitySnapshot;
import personal.roomhub.availability.domain.model.BookingWindow;
import personal.roomhub.availability.domain.model.BusyBlock;
import personal.roomhub.availability.domain.model.Slot;
import personal.roomhub.availability.domain.model.SlotLabel;

import java.util.List;

/**
 * 슬롯 보드
 *
 * @param window    예약 구간
 * @param snapshot  회의실 스냅샷
 * @param slots     슬롯 목록과 슬롯별 점유 블록 (비어 있으면 null)
 * @param labels    블록당 하나의 라벨 위치
 */
public record SlotBoard(
        BookingWindow window,
        AvailabilitySnapshot snapshot,
        List<SlotState> slots,
        List<SlotLabel> labels
) {
    public record SlotState(Slot slot, BusyBlock busyBlock) {
        public boolean busy() {
            return busyBlock != null;
        }
    }
}
