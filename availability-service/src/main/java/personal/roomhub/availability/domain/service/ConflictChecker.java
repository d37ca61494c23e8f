package personal.roomhub.availability.domain.service;

import personal.roomhub.availability.domain.model.BookingWindow;
import personal.roomhub.availability.domain.model.BusyBlock;
import personal.roomhub.availability.domain.model.ConflictCheckResult;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * 새 예약 (start, duration)이 기존 점유 블록과 겹치는지 검사한다
 *
 * 종일 예약: duration이 예약 구간 전체 길이와 같으면 클릭한 시각과 무관하게
 * 시작 시각을 window.start로 고정한다.
 * 블록은 start 오름차순이므로 처음 걸리는 블록이 가장 먼저 시작하는 충돌 블록이다.
 */
public class ConflictChecker {

    public ConflictCheckResult check(Instant proposedStart, int durationMinutes,
                                     List<BusyBlock> blocks, BookingWindow window) {
        Instant effectiveStart = effectiveStart(proposedStart, durationMinutes, window);
        Instant proposedEnd = effectiveStart.plus(Duration.ofMinutes(durationMinutes));

        for (BusyBlock block : blocks) {
            if (block.overlaps(effectiveStart, proposedEnd)) {
                return new ConflictCheckResult(effectiveStart, proposedEnd, block);
            }
        }
        return new ConflictCheckResult(effectiveStart, proposedEnd, null);
    }

    public Instant effectiveStart(Instant proposedStart, int durationMinutes, BookingWindow window) {
        if (isEntireDay(durationMinutes, window)) {
            return window.start();
        }
        return proposedStart;
    }

    public boolean isEntireDay(int durationMinutes, BookingWindow window) {
        return durationMinutes == window.lengthMinutes();
    }
}
