package personal.roomhub.availability.adapter.out.external.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 캘린더 이벤트
 * 종일 이벤트는 start/end에 dateTime 없이 date만 있다
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CalendarEventDto(
        String id,
        String summary,
        EventDateTime start,
        EventDateTime end
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record EventDateTime(
            String dateTime,
            String date,
            String timeZone
    ) {
        public boolean hasDateTime() {
            return dateTime != null && !dateTime.isBlank();
        }
    }

    public boolean isTimed() {
        return start != null && end != null && start.hasDateTime() && end.hasDateTime();
    }
}
