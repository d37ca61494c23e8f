package personal.roomhub.availability.adapter.out.cache;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import personal.roomhub.availability.application.config.RoomHubProperties;
import personal.roomhub.availability.application.port.out.AvailabilityCacheRepository;
import personal.roomhub.availability.domain.model.DailyAvailability;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Availability Cache (In-Memory)
 *
 * 캐시 전략:
 * - 조회: 날짜별 스냅샷을 TTL(기본 60초) 동안 재사용
 * - 저하된 스냅샷(한 회의실 오류)은 짧은 TTL(기본 10초)만 유지
 * - 무효화: 예약 생성/삭제 성공 시 해당 날짜 즉시 삭제
 * - 프로세스 메모리에만 존재 (재시작 시 소멸)
 * - 저장할 때마다 만료된 항목과 오래된 무효화 기록을 정리
 *
 * 동시성:
 * - 항목은 통째로 교체되므로 부분적으로 갱신된 스냅샷은 보이지 않는다
 * - 같은 날짜의 동시 미스는 둘 다 재계산하고 나중 set이 이긴다 (재계산은 멱등)
 * - 버전은 전역 단조 증가 시퀀스. 무효화는 새 시퀀스를 날짜에 기록하고,
 *   조회 시작 시 읽은 시퀀스보다 새로운 무효화가 있으면 set하지 않는다
 * - 오래된 무효화 기록은 floor로 접어서 제거한다 (floor 이전에 시작한 조회는 모두 저장 거부)
 */
@Slf4j
@Component
public class AvailabilityCache implements AvailabilityCacheRepository {

    static final Duration DEFAULT_DEGRADED_TTL = Duration.ofSeconds(10);

    private final ConcurrentMap<String, CacheEntry> entries = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Invalidation> invalidations = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final AtomicLong floor = new AtomicLong();
    private final Clock clock;
    private final Duration ttl;
    private final Duration degradedTtl;

    @Autowired
    public AvailabilityCache(Clock clock, RoomHubProperties properties) {
        this(clock, properties.cache().ttl(), properties.cache().degradedTtl());
    }

    public AvailabilityCache(Clock clock, Duration ttl) {
        this(clock, ttl, DEFAULT_DEGRADED_TTL.compareTo(ttl) < 0 ? DEFAULT_DEGRADED_TTL : ttl);
    }

    public AvailabilityCache(Clock clock, Duration ttl, Duration degradedTtl) {
        this.clock = clock;
        this.ttl = ttl;
        this.degradedTtl = degradedTtl;
    }

    @Override
    public Optional<DailyAvailability> get(String date) {
        CacheEntry entry = entries.get(date);
        if (entry == null) {
            log.debug("Availability cache MISS: date={}", date);
            return Optional.empty();
        }

        Instant now = clock.instant();
        if (!entry.isValidAt(now)) {
            // 만료된 항목만 제거 (그 사이 교체된 항목은 유지)
            entries.remove(date, entry);
            log.debug("Availability cache EXPIRED: date={}, age={}ms",
                    date, Duration.between(entry.createdAt(), now).toMillis());
            return Optional.empty();
        }

        log.debug("Availability cache HIT: date={}", date);
        return Optional.of(entry.value());
    }

    @Override
    public void set(String date, DailyAvailability availability) {
        Instant now = clock.instant();
        sweep(now);
        entries.put(date, newEntry(availability, now));
        log.debug("Availability cached: date={}, degraded={}", date, availability.isDegraded());
    }

    @Override
    public boolean set(String date, DailyAvailability availability, long expectedVersion) {
        Instant now = clock.instant();
        sweep(now);
        if (invalidatedSince(date, expectedVersion)) {
            log.debug("Stale availability discarded: date={}, expectedVersion={}", date, expectedVersion);
            return false;
        }

        CacheEntry entry = newEntry(availability, now);
        entries.put(date, entry);

        // 확인과 저장 사이에 무효화가 끼어들었으면 방금 넣은 항목을 되돌린다
        if (invalidatedSince(date, expectedVersion)) {
            entries.remove(date, entry);
            log.debug("Stale availability discarded after store: date={}, expectedVersion={}", date, expectedVersion);
            return false;
        }
        log.debug("Availability cached: date={}, version={}, degraded={}",
                date, expectedVersion, availability.isDegraded());
        return true;
    }

    @Override
    public long currentVersion(String date) {
        return sequence.get();
    }

    @Override
    public void invalidate(String date) {
        // 기록이 먼저, 삭제가 나중 (set의 재확인이 이 순서에 의존)
        invalidations.merge(date, new Invalidation(sequence.incrementAndGet(), clock.instant()),
                (current, next) -> next.sequence() > current.sequence() ? next : current);
        entries.remove(date);
        log.debug("Availability cache invalidated: date={}", date);
    }

    @Override
    public void invalidateAll() {
        floor.accumulateAndGet(sequence.incrementAndGet(), Math::max);
        invalidations.clear();
        entries.clear();
        log.debug("Availability cache cleared");
    }

    int size() {
        return entries.size();
    }

    int trackedInvalidations() {
        return invalidations.size();
    }

    private boolean invalidatedSince(String date, long version) {
        Invalidation invalidation = invalidations.get(date);
        return floor.get() > version || (invalidation != null && invalidation.sequence() > version);
    }

    private CacheEntry newEntry(DailyAvailability availability, Instant now) {
        return new CacheEntry(availability, now, availability.isDegraded() ? degradedTtl : ttl);
    }

    /**
     * 만료된 항목 제거. TTL보다 오래된 무효화 기록은 floor를 올린 뒤 제거한다
     */
    private void sweep(Instant now) {
        entries.values().removeIf(entry -> !entry.isValidAt(now));

        for (Map.Entry<String, Invalidation> marker : invalidations.entrySet()) {
            Invalidation invalidation = marker.getValue();
            if (Duration.between(invalidation.invalidatedAt(), now).compareTo(ttl) >= 0) {
                floor.accumulateAndGet(invalidation.sequence(), Math::max);
                invalidations.remove(marker.getKey(), invalidation);
            }
        }
    }

    /**
     * 캐시 항목. createdAt 기준 자신의 TTL 미만이면 유효
     */
    record CacheEntry(DailyAvailability value, Instant createdAt, Duration ttl) {
        boolean isValidAt(Instant now) {
            return Duration.between(createdAt, now).compareTo(ttl) < 0;
        }
    }

    /**
     * 날짜별 마지막 무효화 (전역 시퀀스 값과 시각)
     */
    record Invalidation(long sequence, Instant invalidatedAt) {
    }
}
