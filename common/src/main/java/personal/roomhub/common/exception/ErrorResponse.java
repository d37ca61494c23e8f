package personal.roomhub.common.exception;

import java.time.Instant;

/**
 * 에러 응답 포맷
 *
 * @param error     사용자에게 노출되는 메시지
 * @param code      ErrorCode 코드 (예: "B001")
 * @param timestamp 에러 발생 시각
 */
public record ErrorResponse(
        String error,
        String code,
        Instant timestamp
) {
    public static ErrorResponse of(ErrorCode errorCode, String message) {
        return new ErrorResponse(message, errorCode.getCode(), Instant.now());
    }
}
