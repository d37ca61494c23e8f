package personal.roomhub.availability.adapter.out.external;

import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import personal.roomhub.availability.adapter.out.external.dto.CalendarEventDto;
import personal.roomhub.availability.adapter.out.external.dto.CalendarEventListResponse;
import personal.roomhub.availability.application.config.RoomHubProperties;
import personal.roomhub.availability.application.port.out.CalendarClient;
import personal.roomhub.availability.application.port.out.NewCalendarEvent;
import personal.roomhub.availability.domain.exception.CalendarMutationFailedException;
import personal.roomhub.availability.domain.exception.CalendarUnavailableException;
import personal.roomhub.availability.domain.model.ReservationRecord;
import personal.roomhub.common.exception.BusinessException;
import personal.roomhub.common.exception.ErrorCode;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Calendar REST Client Adapter
 * 외부 캘린더(Google Calendar v3 호환 REST API)와 HTTP 통신하는 구현체 (RestClient 사용)
 *
 * - 조회: Circuit Breaker + Retry (GET은 안전하게 재시도 가능)
 *   Retry가 Circuit Breaker 바깥에서 동작하므로 fallback은 Retry에 둔다.
 *   Circuit Breaker에 두면 연결 실패가 재시도 전에 도메인 예외로 바뀐다
 * - 생성/삭제: Circuit Breaker만 적용, 자동 재시도 없음 (중복 이벤트 방지)
 */
@Slf4j
@Component
public class CalendarRestClientAdapter implements CalendarClient {

    private static final String EVENTS_PATH = "/calendars/{calendarId}/events";
    private static final String EVENT_PATH = "/calendars/{calendarId}/events/{eventId}";

    private final RestClient calendarRestClient;
    private final RoomHubProperties properties;

    public CalendarRestClientAdapter(RestClient calendarRestClient, RoomHubProperties properties) {
        this.calendarRestClient = calendarRestClient;
        this.properties = properties;
    }

    @Override
    @CircuitBreaker(name = "calendar")
    @Retry(name = "calendar", fallbackMethod = "listEventsFallback")
    public List<ReservationRecord> listEvents(String calendarId, Instant timeMin, Instant timeMax) {
        String authorization = authorization();
        List<ReservationRecord> records = new ArrayList<>();
        String pageToken = null;

        do {
            String currentPageToken = pageToken;
            CalendarEventListResponse page = calendarRestClient.get()
                    .uri(uriBuilder -> {
                        uriBuilder.path(EVENTS_PATH)
                                .queryParam("timeMin", timeMin.toString())
                                .queryParam("timeMax", timeMax.toString())
                                .queryParam("singleEvents", true)
                                .queryParam("orderBy", "startTime");
                        if (currentPageToken != null) {
                            uriBuilder.queryParam("pageToken", currentPageToken);
                        }
                        return uriBuilder.build(calendarId);
                    })
                    .header(HttpHeaders.AUTHORIZATION, authorization)
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, (request, response) -> {
                        log.warn("Calendar list failed: calendarId={}, status={}", calendarId, response.getStatusCode());
                        throw new CalendarUnavailableException(calendarId, null);
                    })
                    .body(CalendarEventListResponse.class);

            if (page == null) {
                break;
            }
            if (page.items() != null) {
                page.items().stream()
                        .filter(CalendarEventDto::isTimed)
                        .map(this::toRecord)
                        .forEach(records::add);
            }
            pageToken = page.nextPageToken();
        } while (pageToken != null);

        log.debug("Calendar events loaded: calendarId={}, count={}", calendarId, records.size());
        return records;
    }

    @Override
    @CircuitBreaker(name = "calendar", fallbackMethod = "insertEventFallback")
    public String insertEvent(String calendarId, NewCalendarEvent event) {
        CalendarEventDto body = new CalendarEventDto(
                null,
                event.summary(),
                new CalendarEventDto.EventDateTime(event.start().toString(), null, event.timeZone()),
                new CalendarEventDto.EventDateTime(event.end().toString(), null, event.timeZone()));

        CalendarEventDto created = calendarRestClient.post()
                .uri(EVENTS_PATH, calendarId)
                .header(HttpHeaders.AUTHORIZATION, authorization())
                .contentType(MediaType.APPLICATION_JSON)
                .body(body)
                .retrieve()
                .onStatus(HttpStatusCode::isError, (request, response) -> {
                    log.error("Calendar insert failed: calendarId={}, status={}", calendarId, response.getStatusCode());
                    throw CalendarMutationFailedException.insertFailed(calendarId, null);
                })
                .body(CalendarEventDto.class);

        String eventId = created == null ? null : created.id();
        log.debug("Calendar event inserted: calendarId={}, eventId={}", calendarId, eventId);
        return eventId;
    }

    @Override
    @CircuitBreaker(name = "calendar", fallbackMethod = "deleteEventFallback")
    public void deleteEvent(String calendarId, String eventId) {
        calendarRestClient.delete()
                .uri(EVENT_PATH, calendarId, eventId)
                .header(HttpHeaders.AUTHORIZATION, authorization())
                .retrieve()
                .onStatus(HttpStatusCode::isError, (request, response) -> {
                    log.error("Calendar delete failed: calendarId={}, eventId={}, status={}",
                            calendarId, eventId, response.getStatusCode());
                    throw CalendarMutationFailedException.deleteFailed(calendarId, eventId, null);
                })
                .toBodilessEntity();

        log.debug("Calendar event deleted: calendarId={}, eventId={}", calendarId, eventId);
    }

    /**
     * Fallback 메서드
     * Circuit Breaker Open, Timeout, 재시도 소진 후 연결 실패 시 호출
     * 설정 오류(BusinessException)는 그대로 전파한다
     */
    private List<ReservationRecord> listEventsFallback(String calendarId, Instant timeMin, Instant timeMax, Throwable e) {
        if (e instanceof BusinessException businessException) {
            throw businessException;
        }
        log.error("Calendar unavailable: calendarId={}, error={}", calendarId, e.getClass().getSimpleName(), e);
        throw new CalendarUnavailableException(calendarId, e);
    }

    private String insertEventFallback(String calendarId, NewCalendarEvent event, Throwable e) {
        if (e instanceof BusinessException businessException) {
            throw businessException;
        }
        log.error("Calendar insert unavailable: calendarId={}, error={}", calendarId, e.getClass().getSimpleName(), e);
        throw CalendarMutationFailedException.insertFailed(calendarId, e);
    }

    private void deleteEventFallback(String calendarId, String eventId, Throwable e) {
        if (e instanceof BusinessException businessException) {
            throw businessException;
        }
        log.error("Calendar delete unavailable: calendarId={}, eventId={}, error={}",
                calendarId, eventId, e.getClass().getSimpleName(), e);
        throw CalendarMutationFailedException.deleteFailed(calendarId, eventId, e);
    }

    private ReservationRecord toRecord(CalendarEventDto event) {
        return new ReservationRecord(
                parseInstant(event.start().dateTime()),
                parseInstant(event.end().dateTime()),
                event.summary(),
                event.id());
    }

    private Instant parseInstant(String dateTime) {
        return OffsetDateTime.parse(dateTime).toInstant();
    }

    private String authorization() {
        RoomHubProperties.Calendar calendar = properties.calendar();
        if (!calendar.hasAccessToken()) {
            throw new BusinessException(ErrorCode.CONFIGURATION_ERROR, "Calendar access token not configured");
        }
        return "Bearer " + calendar.accessToken();
    }
}
