package personal.roomhub.availability.adapter.in.web.dto;

import personal.roomhub.availability.domain.model.Business;
import personal.roomhub.availability.domain.model.BusyBlock;

import java.time.Instant;
import java.util.List;

/**
 * 점유 블록 응답 DTO
 */
public record BusyBlockResponse(
        Instant start,
        Instant end,
        String title,
        String business,
        int mergedCount,
        List<String> eventIds
) {
    public static BusyBlockResponse from(BusyBlock block, Business business) {
        return new BusyBlockResponse(
                block.start(),
                block.end(),
                block.label(),
                business.getDisplayName(),
                block.mergedCount(),
                block.eventIds()
        );
    }
}
