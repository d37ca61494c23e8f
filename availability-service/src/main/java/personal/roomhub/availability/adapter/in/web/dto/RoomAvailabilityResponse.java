package personal.roomhub.availability.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

/**
 * 회의실 가용성 응답 DTO
 */
public record RoomAvailabilityResponse(
        List<BusyBlockResponse> busyBlocks,
        boolean freeNow,
        Instant nextAvailable,
        @JsonInclude(JsonInclude.Include.NON_NULL)
        String error
) {
}
