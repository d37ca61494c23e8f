package personal.roomhub.availability.application.port.out;

import personal.roomhub.availability.domain.model.DailyAvailability;

import java.util.Optional;

/**
 * Availability Cache (Output Port)
 * 날짜(yyyy-MM-dd, 운영 타임존)별 가용성 스냅샷 캐시
 */
public interface AvailabilityCacheRepository {

    /**
     * TTL 안의 항목이면 반환, 없거나 만료되었으면 empty
     */
    Optional<DailyAvailability> get(String date);

    /**
     * 무조건 저장 (createdAt = now, 기존 항목 덮어씀)
     */
    void set(String date, DailyAvailability availability);

    /**
     * expectedVersion 이후 무효화가 없었을 때만 저장
     *
     * @return 저장되었으면 true
     */
    boolean set(String date, DailyAvailability availability, long expectedVersion);

    /**
     * 조회 시작 시점의 버전. 이후 해당 날짜나 전체가 무효화되면 이 버전으로는 저장되지 않는다
     */
    long currentVersion(String date);

    void invalidate(String date);

    void invalidateAll();
}
