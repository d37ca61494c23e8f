package personal.roomhub.availability.application.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.Map;

/**
 * RoomHub 설정 Properties
 * application.yml의 roomhub.* 설정을 바인딩
 */
@ConfigurationProperties(prefix = "roomhub")
public record RoomHubProperties(
        String timezone,
        Window window,
        Cache cache,
        Calendar calendar,
        Fetch fetch
) {
    public RoomHubProperties {
        if (timezone == null || timezone.isBlank()) {
            timezone = "Pacific/Auckland";
        }
        if (window == null) {
            window = new Window(null, null);
        }
        if (cache == null) {
            cache = new Cache(null, null);
        }
        if (calendar == null) {
            calendar = new Calendar(null, null, null, null, null);
        }
        if (fetch == null) {
            fetch = new Fetch(null, 0, 0);
        }
    }

    public ZoneId zoneId() {
        return ZoneId.of(timezone);
    }

    /**
     * 운영 시간 ("HH:mm")
     */
    public record Window(
            String start,
            String end
    ) {
        public Window {
            if (start == null || start.isBlank()) {
                start = "09:00";
            }
            if (end == null || end.isBlank()) {
                end = "18:00";
            }
        }

        public LocalTime openTime() {
            return LocalTime.parse(start);
        }

        public LocalTime closeTime() {
            return LocalTime.parse(end);
        }
    }

    /**
     * 가용성 캐시 설정
     *
     * @param ttl         정상 스냅샷 유지 시간
     * @param degradedTtl 한 회의실이라도 오류인 스냅샷의 유지 시간 (ttl을 넘지 않음)
     */
    public record Cache(
            Duration ttl,
            Duration degradedTtl
    ) {
        public Cache {
            if (ttl == null) {
                ttl = Duration.ofSeconds(60);
            }
            if (degradedTtl == null) {
                degradedTtl = Duration.ofSeconds(10);
            }
            if (degradedTtl.compareTo(ttl) > 0) {
                degradedTtl = ttl;
            }
        }
    }

    /**
     * 외부 캘린더 설정
     *
     * @param baseUrl        캘린더 API base URL
     * @param accessToken    Bearer 토큰 (없으면 모든 요청이 설정 오류로 실패)
     * @param connectTimeout TCP 연결 타임아웃
     * @param readTimeout    HTTP 응답 타임아웃
     * @param calendarIds    회의실 key → 외부 캘린더 ID
     */
    public record Calendar(
            String baseUrl,
            String accessToken,
            Duration connectTimeout,
            Duration readTimeout,
            Map<String, String> calendarIds
    ) {
        public Calendar {
            if (baseUrl == null || baseUrl.isBlank()) {
                baseUrl = "https://www.googleapis.com/calendar/v3";
            }
            if (connectTimeout == null) {
                connectTimeout = Duration.ofMillis(500);
            }
            if (readTimeout == null) {
                readTimeout = Duration.ofSeconds(3);
            }
            calendarIds = calendarIds == null ? Map.of() : Map.copyOf(calendarIds);
        }

        public boolean hasAccessToken() {
            return accessToken != null && !accessToken.isBlank();
        }
    }

    /**
     * 회의실별 병렬 조회 설정
     *
     * @param timeout  회의실 하나의 조회 제한 시간. 넘으면 해당 회의실만 오류 스냅샷
     * @param poolSize 조회 스레드 수
     * @param queueCapacity 대기 큐 크기
     */
    public record Fetch(
            Duration timeout,
            int poolSize,
            int queueCapacity
    ) {
        public Fetch {
            if (timeout == null) {
                timeout = Duration.ofSeconds(5);
            }
            if (poolSize <= 0) {
                poolSize = 8;
            }
            if (queueCapacity <= 0) {
                queueCapacity = 100;
            }
        }
    }
}
