package personal.roomhub.availability.adapter.in.web.dto;

/**
 * 날짜별 가용성 응답 DTO
 */
public record AvailabilityResponse(
        RoomAvailabilityResponse talkingRoom,
        RoomAvailabilityResponse boardRoom,
        String date
) {
}
