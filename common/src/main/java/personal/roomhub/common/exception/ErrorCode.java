package personal.roomhub.common.exception;

import org.springframework.http.HttpStatus;

/**
 * 에러 코드 정의
 * HTTP Status Code와 메시지를 함께 관리
 */
public enum ErrorCode {
    // Common (Cxxx)
    INVALID_INPUT(HttpStatus.BAD_REQUEST, "C001", "Missing required fields"),
    NOT_FOUND(HttpStatus.NOT_FOUND, "C004", "Requested resource not found"),
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "C006", "Internal server error"),
    CONFIGURATION_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "C007", "Server configuration error"),

    // Booking Domain (Bxxx)
    BOOKING_CONFLICT(HttpStatus.CONFLICT, "B001", "Room is already booked for that time"),
    BOOKING_CREATE_FAILED(HttpStatus.BAD_GATEWAY, "B002", "Failed to create booking"),
    BOOKING_REMOVE_FAILED(HttpStatus.BAD_GATEWAY, "B003", "Failed to remove booking"),

    // External Service (Exxx)
    CALENDAR_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "E001", "Could not load calendar data");

    private final HttpStatus httpStatus;
    private final String code;
    private final String message;

    ErrorCode(HttpStatus httpStatus, String code, String message) {
        this.httpStatus = httpStatus;
        this.code = code;
        this.message = message;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
