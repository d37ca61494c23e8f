package personal.roomhub.availability.domain.model;

import java.time.Instant;
import java.util.Optional;

/**
 * 예약 충돌 검사 결과
 *
 * @param effectiveStart 실제 적용되는 시작 시각 (종일 예약이면 구간 시작)
 * @param effectiveEnd   effectiveStart + duration
 * @param conflict       가장 먼저 시작하는 충돌 블록, 없으면 null
 */
public record ConflictCheckResult(
        Instant effectiveStart,
        Instant effectiveEnd,
        BusyBlock conflict
) {
    public boolean hasConflict() {
        return conflict != null;
    }

    public Optional<BusyBlock> conflictingBlock() {
        return Optional.ofNullable(conflict);
    }
}
