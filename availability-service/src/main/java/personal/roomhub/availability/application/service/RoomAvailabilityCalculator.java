package personal.roomhub.availability.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.roomhub.availability.application.port.out.CalendarClient;
import personal.roomhub.availability.domain.model.AvailabilitySnapshot;
import personal.roomhub.availability.domain.model.AvailabilityStatus;
import personal.roomhub.availability.domain.model.BookingWindow;
import personal.roomhub.availability.domain.model.BusyBlock;
import personal.roomhub.availability.domain.model.ReservationRecord;
import personal.roomhub.availability.domain.model.Room;
import personal.roomhub.availability.domain.service.AvailabilityEvaluator;
import personal.roomhub.availability.domain.service.BlockNormalizer;
import personal.roomhub.availability.domain.service.IntervalMerger;

import java.time.Instant;
import java.util.List;

/**
 * 회의실 하나의 계산 파이프라인
 * 캘린더 조회 → BlockNormalizer → IntervalMerger → AvailabilityEvaluator
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RoomAvailabilityCalculator {

    private final CalendarClient calendarClient;
    private final BlockNormalizer blockNormalizer;
    private final IntervalMerger intervalMerger;
    private final AvailabilityEvaluator availabilityEvaluator;

    public List<BusyBlock> loadBusyBlocks(Room room, String calendarId, BookingWindow window) {
        List<ReservationRecord> records = calendarClient.listEvents(calendarId, window.start(), window.end());
        List<ReservationRecord> clipped = blockNormalizer.normalize(records, window);
        List<BusyBlock> merged = intervalMerger.merge(clipped);

        log.debug("Busy blocks computed: room={}, date={}, records={}, clipped={}, blocks={}",
                room.getKey(), window.date(), records.size(), clipped.size(), merged.size());
        return merged;
    }

    public AvailabilitySnapshot snapshot(Room room, String calendarId, BookingWindow window, Instant now) {
        List<BusyBlock> blocks = loadBusyBlocks(room, calendarId, window);
        AvailabilityStatus status = availabilityEvaluator.evaluate(blocks, window, now);
        return AvailabilitySnapshot.of(room, blocks, status);
    }
}
