package personal.studio.common.exception;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 에러 응답 포맷
 *
 * @param code      ErrorCode의 코드 값 (예: "P001")
 * @param message   사용자 노출 메시지
 * @param details   추가 정보 (충돌 목록 등, 없으면 빈 리스트)
 * @param timestamp 응답 생성 시각
 */
public record ErrorResponse(
        String code,
        String message,
        List<String> details,
        LocalDateTime timestamp
) {
    public static ErrorResponse of(ErrorCode errorCode, String message) {
        return new ErrorResponse(errorCode.getCode(), message, List.of(), LocalDateTime.now());
    }

    public static ErrorResponse of(ErrorCode errorCode, String message, List<String> details) {
        return new ErrorResponse(errorCode.getCode(), message, List.copyOf(details), LocalDateTime.now());
    }
}
