package personal.roomhub.availability.adapter.out.cache;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import personal.roomhub.availability.domain.model.AvailabilitySnapshot;
import personal.roomhub.availability.domain.model.AvailabilityStatus;
import personal.roomhub.availability.domain.model.DailyAvailability;
import personal.roomhub.availability.domain.model.Room;
import personal.roomhub.availability.support.MutableClock;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * AvailabilityCache 단위 테스트
 * TTL 만료와 무효화, 버전 기반 저장을 검증
 */
@DisplayName("AvailabilityCache 단위 테스트")
class AvailabilityCacheTest {

    private static final String DATE = "2025-03-10";

    private MutableClock clock;
    private AvailabilityCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-03-10T00:00:00Z"));
        cache = new AvailabilityCache(clock, Duration.ofSeconds(60));
    }

    @Test
    @DisplayName("TTL 안에서는 저장한 값을 그대로 반환한다")
    void hitWithinTtl() {
        // Given
        DailyAvailability value = availability();
        cache.set(DATE, value);

        // When
        clock.advance(Duration.ofSeconds(59));

        // Then
        assertThat(cache.get(DATE)).containsSame(value);
    }

    @Test
    @DisplayName("TTL이 지나면 MISS이고 항목이 제거된다")
    void expiresAfterTtl() {
        // Given
        cache.set(DATE, availability());

        // When
        clock.advance(Duration.ofSeconds(60));

        // Then
        assertThat(cache.get(DATE)).isEmpty();
        assertThat(cache.size()).isZero();
    }

    @Test
    @DisplayName("invalidate는 해당 날짜만 제거한다")
    void invalidateSingleDate() {
        // Given
        cache.set(DATE, availability());
        cache.set("2025-03-11", availability());

        // When
        cache.invalidate(DATE);

        // Then
        assertThat(cache.get(DATE)).isEmpty();
        assertThat(cache.get("2025-03-11")).isPresent();
    }

    @Test
    @DisplayName("invalidateAll은 모든 날짜를 제거한다")
    void invalidateAll() {
        // Given
        cache.set(DATE, availability());
        cache.set("2025-03-11", availability());

        // When
        cache.invalidateAll();

        // Then
        assertThat(cache.size()).isZero();
    }

    @Test
    @DisplayName("조회 시작 후 무효화가 있었으면 오래된 결과는 저장되지 않는다")
    void staleSetDiscardedAfterInvalidate() {
        // Given: 조회 시작 시점의 버전
        long version = cache.currentVersion(DATE);

        // When: 조회 중 예약 생성으로 무효화
        cache.invalidate(DATE);
        boolean stored = cache.set(DATE, availability(), version);

        // Then
        assertThat(stored).isFalse();
        assertThat(cache.get(DATE)).isEmpty();
    }

    @Test
    @DisplayName("전체 무효화 이후에도 오래된 결과는 저장되지 않는다")
    void staleSetDiscardedAfterInvalidateAll() {
        // Given
        long version = cache.currentVersion(DATE);

        // When
        cache.invalidateAll();
        boolean stored = cache.set(DATE, availability(), version);

        // Then
        assertThat(stored).isFalse();
        assertThat(cache.get(DATE)).isEmpty();
    }

    @Test
    @DisplayName("무효화가 없었으면 버전 기반 저장이 성공한다")
    void versionedSetStores() {
        // Given
        long version = cache.currentVersion(DATE);

        // When
        boolean stored = cache.set(DATE, availability(), version);

        // Then
        assertThat(stored).isTrue();
        assertThat(cache.get(DATE)).isPresent();
    }

    @Test
    @DisplayName("다른 날짜의 무효화는 버전에 영향을 주지 않는다")
    void otherDateInvalidationDoesNotAffectVersion() {
        // Given
        long version = cache.currentVersion(DATE);

        // When
        cache.invalidate("2025-03-11");

        // Then
        assertThat(cache.set(DATE, availability(), version)).isTrue();
    }

    @Test
    @DisplayName("저장할 때 다시 조회되지 않은 만료 항목도 정리된다")
    void setSweepsExpiredEntries() {
        // Given: 한 번씩만 조회된 여러 날짜
        LocalDate first = LocalDate.parse(DATE);
        for (int i = 0; i < 500; i++) {
            String date = first.plusDays(i).toString();
            cache.set(date, availability(), cache.currentVersion(date));
        }

        // When
        clock.advance(Duration.ofMinutes(1));
        cache.set(DATE, availability());

        // Then
        assertThat(cache.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("버전 조회만으로는 날짜별 상태가 쌓이지 않는다")
    void readingVersionsTracksNothing() {
        // When
        LocalDate first = LocalDate.parse(DATE);
        for (int i = 0; i < 500; i++) {
            cache.currentVersion(first.plusDays(i).toString());
        }

        // Then
        assertThat(cache.trackedInvalidations()).isZero();
    }

    @Test
    @DisplayName("invalidateAll은 날짜별 무효화 기록도 비운다")
    void invalidateAllClearsInvalidations() {
        // Given
        long version = cache.currentVersion(DATE);
        cache.invalidate(DATE);
        cache.invalidate("2025-03-11");

        // When
        cache.invalidateAll();

        // Then: 기록은 사라져도 무효화 이전의 조회는 여전히 저장되지 않는다
        assertThat(cache.trackedInvalidations()).isZero();
        assertThat(cache.set(DATE, availability(), version)).isFalse();
    }

    @Test
    @DisplayName("TTL보다 오래된 무효화 기록은 정리되고 그 이전에 시작한 조회는 계속 거부된다")
    void oldInvalidationsPruned() {
        // Given
        long staleVersion = cache.currentVersion(DATE);
        cache.invalidate(DATE);

        // When
        clock.advance(Duration.ofSeconds(60));
        cache.set("2025-03-11", availability());

        // Then
        assertThat(cache.trackedInvalidations()).isZero();
        assertThat(cache.set(DATE, availability(), staleVersion)).isFalse();
        assertThat(cache.set(DATE, availability(), cache.currentVersion(DATE))).isTrue();
    }

    @Test
    @DisplayName("오류가 포함된 결과는 짧은 TTL이 지나면 만료된다")
    void degradedEntryUsesShorterTtl() {
        // Given
        DailyAvailability degraded = new DailyAvailability(
                LocalDate.parse(DATE),
                AvailabilitySnapshot.failed(Room.TALKING),
                AvailabilitySnapshot.of(Room.BOARD, List.of(), AvailabilityStatus.free()));
        cache.set(DATE, degraded);

        // When & Then
        clock.advance(Duration.ofSeconds(9));
        assertThat(cache.get(DATE)).containsSame(degraded);
        clock.advance(Duration.ofSeconds(1));
        assertThat(cache.get(DATE)).isEmpty();
    }

    private DailyAvailability availability() {
        return new DailyAvailability(
                LocalDate.parse(DATE),
                AvailabilitySnapshot.of(Room.TALKING, List.of(), AvailabilityStatus.free()),
                AvailabilitySnapshot.of(Room.BOARD, List.of(), AvailabilityStatus.free()));
    }
}
