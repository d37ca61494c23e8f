package personal.roomhub.availability.adapter.out.external.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * 캘린더 이벤트 목록 응답 (events.list)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CalendarEventListResponse(
        List<CalendarEventDto> items,
        String nextPageToken
) {
}
