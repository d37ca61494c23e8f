package personal.roomhub.availability.application.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import personal.roomhub.availability.application.config.RoomHubProperties;
import personal.roomhub.availability.application.port.in.GetAvailabilityUseCase;
import personal.roomhub.availability.application.port.out.AvailabilityCacheRepository;
import personal.roomhub.availability.domain.model.AvailabilitySnapshot;
import personal.roomhub.availability.domain.model.BookingWindow;
import personal.roomhub.availability.domain.model.DailyAvailability;
import personal.roomhub.availability.domain.model.Room;
import personal.roomhub.availability.domain.service.BookingWindowFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Availability Query Service (SRP)
 * 단일 책임: 날짜별 두 회의실 가용성 조회
 *
 * 캐시 HIT이면 파이프라인을 건너뛴다. MISS이면 두 회의실을 병렬로 조회하고,
 * 한 회의실의 실패/타임아웃은 그 회의실 스냅샷만 오류 상태로 만든다.
 * 저하된 결과도 캐시하되 짧은 TTL이 적용되어 장애 회의실은 곧 다시 조회된다.
 */
@Slf4j
@Service
public class AvailabilityQueryService implements GetAvailabilityUseCase {

    private final AvailabilityCacheRepository availabilityCache;
    private final RoomAvailabilityCalculator calculator;
    private final RoomCalendarDirectory calendarDirectory;
    private final BookingWindowFactory windowFactory;
    private final Executor calendarFetchExecutor;
    private final Duration fetchTimeout;

    public AvailabilityQueryService(AvailabilityCacheRepository availabilityCache,
                                    RoomAvailabilityCalculator calculator,
                                    RoomCalendarDirectory calendarDirectory,
                                    BookingWindowFactory windowFactory,
                                    @Qualifier("calendarFetchExecutor") Executor calendarFetchExecutor,
                                    RoomHubProperties properties) {
        this.availabilityCache = availabilityCache;
        this.calculator = calculator;
        this.calendarDirectory = calendarDirectory;
        this.windowFactory = windowFactory;
        this.calendarFetchExecutor = calendarFetchExecutor;
        this.fetchTimeout = properties.fetch().timeout();
    }

    @Override
    public DailyAvailability getAvailability(String date) {
        LocalDate day = windowFactory.resolveDate(date);
        String cacheKey = day.toString();

        Optional<DailyAvailability> cached = availabilityCache.get(cacheKey);
        if (cached.isPresent()) {
            return cached.get();
        }

        calendarDirectory.verifyConfigured();

        // 조회 시작 전 버전: 조회 중 무효화되면 결과를 캐시에 넣지 않는다
        long version = availabilityCache.currentVersion(cacheKey);
        BookingWindow window = windowFactory.windowFor(day);
        Instant now = windowFactory.now();

        log.info("Cache MISS - Loading availability from calendar: date={}", cacheKey);

        CompletableFuture<AvailabilitySnapshot> talkingRoom = fetchAsync(Room.TALKING, window, now);
        CompletableFuture<AvailabilitySnapshot> boardRoom = fetchAsync(Room.BOARD, window, now);

        DailyAvailability availability = new DailyAvailability(day, talkingRoom.join(), boardRoom.join());

        if (availability.isDegraded()) {
            // 저하된 결과는 캐시가 짧은 TTL로만 보관한다
            log.warn("Availability degraded: date={}, talkingError={}, boardError={}",
                    cacheKey, availability.talkingRoom().hasError(), availability.boardRoom().hasError());
        }

        availabilityCache.set(cacheKey, availability, version);
        return availability;
    }

    private CompletableFuture<AvailabilitySnapshot> fetchAsync(Room room, BookingWindow window, Instant now) {
        String calendarId = calendarDirectory.calendarIdOf(room);
        try {
            return CompletableFuture
                    .supplyAsync(() -> calculator.snapshot(room, calendarId, window, now), calendarFetchExecutor)
                    .orTimeout(fetchTimeout.toMillis(), TimeUnit.MILLISECONDS)
                    .exceptionally(e -> {
                        log.warn("Calendar fetch failed, room degraded: room={}, date={}, error={}",
                                room.getKey(), window.date(), e.toString());
                        return AvailabilitySnapshot.failed(room);
                    });
        } catch (RejectedExecutionException e) {
            log.warn("Calendar fetch rejected, room degraded: room={}, date={}", room.getKey(), window.date());
            return CompletableFuture.completedFuture(AvailabilitySnapshot.failed(room));
        }
    }
}
