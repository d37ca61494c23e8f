package personal.roomhub.availability.domain.service;

import personal.roomhub.availability.domain.model.AvailabilityStatus;
import personal.roomhub.availability.domain.model.BookingWindow;
import personal.roomhub.availability.domain.model.BusyBlock;

import java.time.Instant;
import java.util.List;

/**
 * 병합된 블록과 현재 시각으로 "지금 비어 있음 / 다음 빈 시각"을 계산한다
 *
 * now가 [window.start, window.end) 밖이면 (다른 날짜 또는 운영 시간 외) 의미가 없으므로
 * freeNow=false, nextAvailable=null 을 반환한다.
 */
public class AvailabilityEvaluator {

    public AvailabilityStatus evaluate(List<BusyBlock> blocks, BookingWindow window, Instant now) {
        if (!window.contains(now)) {
            return AvailabilityStatus.notApplicable();
        }

        BusyBlock current = findContaining(blocks, now);
        if (current == null) {
            return AvailabilityStatus.free();
        }
        return AvailabilityStatus.busyUntil(current.end());
    }

    /**
     * start 오름차순, 서로 겹치지 않는 블록에서 now를 포함하는 블록을 이진 탐색
     */
    BusyBlock findContaining(List<BusyBlock> blocks, Instant now) {
        int low = 0;
        int high = blocks.size() - 1;
        while (low <= high) {
            int mid = (low + high) >>> 1;
            BusyBlock block = blocks.get(mid);
            if (block.start().isAfter(now)) {
                high = mid - 1;
            } else if (!block.end().isAfter(now)) {
                low = mid + 1;
            } else {
                return block;
            }
        }
        return null;
    }
}
