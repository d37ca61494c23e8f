package personal.roomhub.availability.domain.service;

import personal.roomhub.availability.domain.model.BookingWindow;
import personal.roomhub.availability.domain.model.BusyBlock;
import personal.roomhub.availability.domain.model.Slot;
import personal.roomhub.availability.domain.model.SlotLabel;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 예약 구간을 30분 슬롯으로 나누고 점유 블록을 슬롯 범위에 대응시킨다
 *
 * 슬롯 i = [window.start + i*30m, window.start + (i+1)*30m), i in [0, N)
 */
public class SlotGrid {

    public static final Duration SLOT_WIDTH = Duration.ofMinutes(30);

    public int slotCount(BookingWindow window) {
        return (int) (window.length().toMillis() / SLOT_WIDTH.toMillis());
    }

    public Instant slotStart(BookingWindow window, int index) {
        return window.start().plus(SLOT_WIDTH.multipliedBy(index));
    }

    public Instant slotEnd(BookingWindow window, int index) {
        return slotStart(window, index + 1);
    }

    public List<Slot> slots(BookingWindow window) {
        int count = slotCount(window);
        List<Slot> slots = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            slots.add(new Slot(i, slotStart(window, i), slotEnd(window, i)));
        }
        return slots;
    }

    /**
     * 슬롯과 겹치는 첫 번째 블록. block.start < slotEnd AND block.end > slotStart
     */
    public Optional<BusyBlock> blockAt(BookingWindow window, int index, List<BusyBlock> blocks) {
        Instant start = slotStart(window, index);
        Instant end = slotEnd(window, index);
        return blocks.stream()
                .filter(block -> block.overlaps(start, end))
                .findFirst();
    }

    /**
     * 블록마다 라벨을 정확히 하나 배치한다
     *
     * 라벨은 병합 배열의 위치(blockIndex)로 식별한다. 시작 시각 값으로 식별하면
     * 시작 시각이나 시작 슬롯이 같은 서로 다른 블록 중 하나가 누락된다.
     */
    public List<SlotLabel> labels(BookingWindow window, List<BusyBlock> blocks) {
        int count = slotCount(window);
        long slotMillis = SLOT_WIDTH.toMillis();
        List<SlotLabel> labels = new ArrayList<>();

        for (int blockIndex = 0; blockIndex < blocks.size(); blockIndex++) {
            BusyBlock block = blocks.get(blockIndex);
            Instant effectiveStart = block.start().isAfter(window.start()) ? block.start() : window.start();
            long offsetMillis = Duration.between(window.start(), effectiveStart).toMillis();
            int slotIndex = (int) (offsetMillis / slotMillis);
            if (slotIndex >= count || !block.end().isAfter(effectiveStart)) {
                continue;
            }

            long lengthMillis = Duration.between(effectiveStart, block.end()).toMillis();
            int span = (int) Math.max(1, (lengthMillis + slotMillis - 1) / slotMillis);
            span = Math.min(span, count - slotIndex);

            labels.add(new SlotLabel(blockIndex, slotIndex, span, block));
        }
        return labels;
    }
}
