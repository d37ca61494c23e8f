package personal.roomhub.availability.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.roomhub.availability.application.config.RoomHubProperties;
import personal.roomhub.availability.domain.model.Room;
import personal.roomhub.common.exception.BusinessException;
import personal.roomhub.common.exception.ErrorCode;

/**
 * 회의실 → 외부 캘린더 ID 매핑
 * 자격 증명이나 캘린더 ID가 없으면 요청 전체를 실패시킨다 (부분 처리 없음)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RoomCalendarDirectory {

    private final RoomHubProperties properties;

    public String calendarIdOf(Room room) {
        String calendarId = properties.calendar().calendarIds().get(room.getKey());
        if (calendarId == null || calendarId.isBlank()) {
            log.error("Calendar id not configured: room={}", room.getKey());
            throw new BusinessException(ErrorCode.CONFIGURATION_ERROR,
                    "Calendar id not configured for room: " + room.getKey());
        }
        return calendarId;
    }

    public void verifyConfigured() {
        if (!properties.calendar().hasAccessToken()) {
            log.error("Calendar access token not configured");
            throw new BusinessException(ErrorCode.CONFIGURATION_ERROR, "Calendar access token not configured");
        }
        for (Room room : Room.values()) {
            calendarIdOf(room);
        }
    }
}
