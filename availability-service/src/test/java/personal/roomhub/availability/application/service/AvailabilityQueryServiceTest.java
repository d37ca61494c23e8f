package personal.roomhub.availability.application.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import personal.roomhub.availability.adapter.out.cache.AvailabilityCache;
import personal.roomhub.availability.application.config.RoomHubProperties;
import personal.roomhub.availability.application.port.out.CalendarClient;
import personal.roomhub.availability.domain.exception.CalendarUnavailableException;
import personal.roomhub.availability.domain.model.AvailabilitySnapshot;
import personal.roomhub.availability.domain.model.DailyAvailability;
import personal.roomhub.availability.domain.model.ReservationRecord;
import personal.roomhub.availability.domain.service.AvailabilityEvaluator;
import personal.roomhub.availability.domain.service.BlockNormalizer;
import personal.roomhub.availability.domain.service.BookingWindowFactory;
import personal.roomhub.availability.domain.service.IntervalMerger;
import personal.roomhub.availability.support.MutableClock;
import personal.roomhub.common.exception.BusinessException;
import personal.roomhub.common.exception.ErrorCode;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * AvailabilityQueryService 단위 테스트
 * 캘린더는 Mock, 캐시와 도메인 서비스는 실제 객체를 사용
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("AvailabilityQueryService 단위 테스트")
class AvailabilityQueryServiceTest {

    private static final String DATE = "2025-03-10";
    private static final String TALKING_CALENDAR = "talking@calendar";
    private static final String BOARD_CALENDAR = "board@calendar";

    @Mock
    private CalendarClient calendarClient;

    private MutableClock clock;
    private AvailabilityCache cache;
    private AvailabilityQueryService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-03-10T10:15:00Z"));
        cache = new AvailabilityCache(clock, Duration.ofSeconds(60));
        service = createService(properties("token"));
    }

    @Test
    @DisplayName("첫 조회는 두 회의실 캘린더를 읽고 결과를 계산한다")
    void computesBothRooms() {
        // Given
        given(calendarClient.listEvents(eq(TALKING_CALENDAR), any(), any())).willReturn(List.of(
                record("10:00", "10:30", "[Baker]", "t1"),
                record("10:30", "11:00", "[Hunch]", "t2")));
        given(calendarClient.listEvents(eq(BOARD_CALENDAR), any(), any())).willReturn(List.of());

        // When
        DailyAvailability result = service.getAvailability(DATE);

        // Then
        assertThat(result.date()).isEqualTo(LocalDate.parse(DATE));
        assertThat(result.talkingRoom().busyBlocks()).singleElement().satisfies(block -> {
            assertThat(block.label()).isEqualTo("[Baker]");
            assertThat(block.mergedCount()).isEqualTo(2);
        });
        assertThat(result.talkingRoom().freeNow()).isFalse();
        assertThat(result.talkingRoom().nextAvailable()).isEqualTo(Instant.parse("2025-03-10T11:00:00Z"));
        assertThat(result.boardRoom().freeNow()).isTrue();
        assertThat(result.boardRoom().nextAvailable()).isNull();
    }

    @Test
    @DisplayName("TTL 안의 두 번째 조회는 캘린더를 다시 읽지 않는다")
    void cachedWithinTtl() {
        // Given
        given(calendarClient.listEvents(any(), any(), any())).willReturn(List.of());

        // When
        service.getAvailability(DATE);
        clock.advance(Duration.ofSeconds(30));
        service.getAvailability(DATE);

        // Then
        verify(calendarClient, times(1)).listEvents(eq(TALKING_CALENDAR), any(), any());
        verify(calendarClient, times(1)).listEvents(eq(BOARD_CALENDAR), any(), any());
    }

    @Test
    @DisplayName("TTL이 지나면 다시 계산한다")
    void recomputesAfterTtl() {
        // Given
        given(calendarClient.listEvents(any(), any(), any())).willReturn(List.of());

        // When
        service.getAvailability(DATE);
        clock.advance(Duration.ofSeconds(61));
        service.getAvailability(DATE);

        // Then
        verify(calendarClient, times(2)).listEvents(eq(TALKING_CALENDAR), any(), any());
    }

    @Test
    @DisplayName("한 회의실 조회가 실패해도 다른 회의실 결과는 정상이다")
    void failureContainedToOneRoom() {
        // Given
        given(calendarClient.listEvents(eq(TALKING_CALENDAR), any(), any()))
                .willThrow(new CalendarUnavailableException(TALKING_CALENDAR, null));
        given(calendarClient.listEvents(eq(BOARD_CALENDAR), any(), any()))
                .willReturn(List.of(record("12:00", "13:00", "Navigate", "b1")));

        // When
        DailyAvailability result = service.getAvailability(DATE);

        // Then
        assertThat(result.talkingRoom().hasError()).isTrue();
        assertThat(result.talkingRoom().error()).isEqualTo(AvailabilitySnapshot.CALENDAR_ERROR_MESSAGE);
        assertThat(result.talkingRoom().busyBlocks()).isEmpty();
        assertThat(result.talkingRoom().freeNow()).isFalse();
        assertThat(result.boardRoom().hasError()).isFalse();
        assertThat(result.boardRoom().busyBlocks()).hasSize(1);
    }

    @Test
    @DisplayName("오류가 포함된 결과는 짧은 TTL 동안만 캐시되고 이후 다시 조회한다")
    void degradedResultCachedBriefly() {
        // Given
        given(calendarClient.listEvents(eq(TALKING_CALENDAR), any(), any()))
                .willThrow(new CalendarUnavailableException(TALKING_CALENDAR, null));
        given(calendarClient.listEvents(eq(BOARD_CALENDAR), any(), any())).willReturn(List.of());
        service.getAvailability(DATE);

        // When: 저하된 TTL(10초) 안의 재조회
        clock.advance(Duration.ofSeconds(5));
        DailyAvailability cached = service.getAvailability(DATE);

        // Then: 정상 회의실도 다시 읽지 않는다
        assertThat(cached.talkingRoom().hasError()).isTrue();
        verify(calendarClient, times(1)).listEvents(eq(BOARD_CALENDAR), any(), any());

        // When: 저하된 TTL 경과 후
        clock.advance(Duration.ofSeconds(5));
        service.getAvailability(DATE);

        // Then
        verify(calendarClient, times(2)).listEvents(eq(TALKING_CALENDAR), any(), any());
        verify(calendarClient, times(2)).listEvents(eq(BOARD_CALENDAR), any(), any());
    }

    @Test
    @DisplayName("자격 증명이 없으면 캘린더를 호출하지 않고 설정 오류로 실패한다")
    void missingCredentials() {
        // Given
        AvailabilityQueryService unconfigured = createService(properties(null));

        // When & Then
        assertThatThrownBy(() -> unconfigured.getAvailability(DATE))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.CONFIGURATION_ERROR);
        verify(calendarClient, never()).listEvents(any(), any(), any());
    }

    @Test
    @DisplayName("잘못된 날짜는 INVALID_INPUT")
    void invalidDate() {
        assertThatThrownBy(() -> service.getAvailability("2025-13-40"))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.INVALID_INPUT);
    }

    private AvailabilityQueryService createService(RoomHubProperties properties) {
        BookingWindowFactory windowFactory = new BookingWindowFactory(
                ZoneOffset.UTC, LocalTime.of(9, 0), LocalTime.of(18, 0), clock);
        RoomAvailabilityCalculator calculator = new RoomAvailabilityCalculator(
                calendarClient, new BlockNormalizer(), new IntervalMerger(), new AvailabilityEvaluator());
        // 동기 Executor: 회의실별 조회를 호출 스레드에서 실행
        return new AvailabilityQueryService(cache, calculator, new RoomCalendarDirectory(properties),
                windowFactory, Runnable::run, properties);
    }

    private RoomHubProperties properties(String accessToken) {
        return new RoomHubProperties("UTC", null, null,
                new RoomHubProperties.Calendar(null, accessToken, null, null,
                        Map.of("talking", TALKING_CALENDAR, "board", BOARD_CALENDAR)),
                null);
    }

    private ReservationRecord record(String start, String end, String label, String eventId) {
        return new ReservationRecord(
                Instant.parse(DATE + "T" + start + ":00Z"),
                Instant.parse(DATE + "T" + end + ":00Z"),
                label, eventId);
    }
}
