package personal.roomhub.availability.domain.model;

import java.time.Instant;

/**
 * "지금 비어 있음 / 다음 빈 시각" 계산 결과
 */
public record AvailabilityStatus(
        boolean freeNow,
        Instant nextAvailable
) {
    public static AvailabilityStatus notApplicable() {
        return new AvailabilityStatus(false, null);
    }

    public static AvailabilityStatus free() {
        return new AvailabilityStatus(true, null);
    }

    public static AvailabilityStatus busyUntil(Instant nextAvailable) {
        return new AvailabilityStatus(false, nextAvailable);
    }
}
