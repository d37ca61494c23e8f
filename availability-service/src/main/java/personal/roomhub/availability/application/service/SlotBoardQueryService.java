package personal.roomhub.availability.application.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import personal.roomhub.availability.application.port.in.GetAvailabilityUseCase;
import personal.roomhub.availability.application.port.in.GetSlotBoardUseCase;
import personal.roomhub.availability.application.port.in.SlotBoard;
import personal.roomhub.availability.domain.model.AvailabilitySnapshot;
import personal.roomhub.availability.domain.model.BookingWindow;
import personal.roomhub.availability.domain.model.DailyAvailability;
import personal.roomhub.availability.domain.model.Room;
import personal.roomhub.availability.domain.model.Slot;
import personal.roomhub.availability.domain.service.BookingWindowFactory;
import personal.roomhub.availability.domain.service.SlotGrid;

import java.util.List;

/**
 * Slot Board Query Service (SRP)
 * 단일 책임: 가용성 스냅샷을 30분 슬롯 보드로 변환
 * 스냅샷은 GetAvailabilityUseCase를 거치므로 캐시를 그대로 공유한다
 */
@Service
@RequiredArgsConstructor
public class SlotBoardQueryService implements GetSlotBoardUseCase {

    private final GetAvailabilityUseCase getAvailabilityUseCase;
    private final BookingWindowFactory windowFactory;
    private final SlotGrid slotGrid;

    @Override
    public SlotBoard getSlotBoard(String date, Room room) {
        DailyAvailability availability = getAvailabilityUseCase.getAvailability(date);
        AvailabilitySnapshot snapshot = availability.snapshotOf(room);
        BookingWindow window = windowFactory.windowFor(availability.date());

        List<SlotBoard.SlotState> slots = slotGrid.slots(window).stream()
                .map(slot -> toState(window, slot, snapshot))
                .toList();

        return new SlotBoard(window, snapshot, slots, slotGrid.labels(window, snapshot.busyBlocks()));
    }

    private SlotBoard.SlotState toState(BookingWindow window, Slot slot, AvailabilitySnapshot snapshot) {
        return new SlotBoard.SlotState(slot,
                slotGrid.blockAt(window, slot.index(), snapshot.busyBlocks()).orElse(null));
    }
}
