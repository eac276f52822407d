package personal.studio.common.exception;

import org.springframework.http.HttpStatus;

/**
 * 에러 코드 정의
 * HTTP Status Code와 메시지를 함께 관리
 */
public enum ErrorCode {
    // Common (Cxxx)
    INVALID_INPUT(HttpStatus.BAD_REQUEST, "C001", "잘못된 입력값입니다."),
    UNAUTHORIZED(HttpStatus.UNAUTHORIZED, "C002", "인증이 필요합니다."),
    FORBIDDEN(HttpStatus.FORBIDDEN, "C003", "권한이 없습니다."),
    NOT_FOUND(HttpStatus.NOT_FOUND, "C004", "요청한 리소스를 찾을 수 없습니다."),
    CONFLICT(HttpStatus.CONFLICT, "C005", "리소스 충돌이 발생했습니다."),
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "C006", "서버 내부 오류가 발생했습니다."),

    // Recurring Pattern (Pxxx)
    PATTERN_NOT_FOUND(HttpStatus.NOT_FOUND, "P001", "반복 수업 패턴을 찾을 수 없습니다."),
    INVALID_PATTERN(HttpStatus.BAD_REQUEST, "P002", "반복 수업 패턴 값이 올바르지 않습니다."),
    PATTERN_UPDATE_CONFLICT(HttpStatus.CONFLICT, "P003", "패턴 변경이 기존 수업과 충돌합니다."),

    // Lesson (Lxxx)
    LESSON_NOT_FOUND(HttpStatus.NOT_FOUND, "L001", "수업을 찾을 수 없습니다."),
    LESSON_CONFLICT(HttpStatus.CONFLICT, "L002", "강사, 강의실 또는 학생의 일정이 겹칩니다."),
    INVALID_LESSON_STATUS(HttpStatus.BAD_REQUEST, "L003", "허용되지 않는 수업 상태 변경입니다."),
    ATTENDANCE_NOT_FOUND(HttpStatus.NOT_FOUND, "L004", "해당 학생의 출석 정보를 찾을 수 없습니다."),
    INVALID_LESSON_EXCEPTION(HttpStatus.BAD_REQUEST, "L005", "예외 수업으로 처리할 수 없는 수업입니다."),

    // Generation (Gxxx)
    INVALID_DATE_RANGE(HttpStatus.BAD_REQUEST, "G001", "날짜 범위가 올바르지 않습니다."),
    HORIZON_TOO_LARGE(HttpStatus.BAD_REQUEST, "G002", "생성 가능한 기간을 초과했습니다."),

    // Concurrency (Sxxx)
    CONCURRENT_MODIFICATION(HttpStatus.CONFLICT, "S001", "다른 요청이 먼저 일정을 변경했습니다. 다시 시도해 주세요.");

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
