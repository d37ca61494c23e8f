package personal.roomhub.availability.domain.model;

import personal.roomhub.common.exception.BusinessException;
import personal.roomhub.common.exception.ErrorCode;

import java.util.Arrays;

/**
 * 예약 가능한 회의실
 * key는 API 요청/응답 및 설정(roomhub.calendar.calendar-ids)에서 사용하는 식별자
 */
public enum Room {
    TALKING("talking", "Talking Room"),
    BOARD("board", "Board Room");

    private final String key;
    private final String displayName;

    Room(String key, String displayName) {
        this.key = key;
        this.displayName = displayName;
    }

    public String getKey() {
        return key;
    }

    public String getDisplayName() {
        return displayName;
    }

    public static Room fromKey(String key) {
        if (key == null || key.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Room cannot be null or blank");
        }
        return Arrays.stream(values())
                .filter(room -> room.key.equalsIgnoreCase(key.trim()))
                .findFirst()
                .orElseThrow(() -> new BusinessException(ErrorCode.INVALID_INPUT, "Unknown room: " + key));
    }
}
