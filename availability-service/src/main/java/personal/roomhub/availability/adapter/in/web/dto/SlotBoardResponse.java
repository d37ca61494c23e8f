package personal.roomhub.availability.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

/**
 * 슬롯 보드 응답 DTO
 */
public record SlotBoardResponse(
        String room,
        String date,
        Instant windowStart,
        Instant windowEnd,
        boolean freeNow,
        Instant nextAvailable,
        @JsonInclude(JsonInclude.Include.NON_NULL)
        String error,
        List<SlotResponse> slots,
        List<SlotLabelResponse> labels
) {
    public record SlotResponse(
            int index,
            Instant start,
            Instant end,
            boolean busy
    ) {
    }

    public record SlotLabelResponse(
            int slotIndex,
            int span,
            String title,
            String business,
            Instant start,
            Instant end
    ) {
    }
}
