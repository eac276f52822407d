package personal.studio.common.exception;

import java.util.List;

/**
 * 비즈니스 예외 최상위 클래스
 * ErrorCode로 HTTP 응답을 결정하고, 메시지에는 로그용 상세 정보를 담는다
 */
public class BusinessException extends RuntimeException {

    private final ErrorCode errorCode;

    public BusinessException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, String detail) {
        super(detail);
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, String detail, Throwable cause) {
        super(detail, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * 응답 본문에 노출할 추가 정보
     * 충돌 목록처럼 클라이언트가 알아야 하는 항목이 있을 때만 하위 클래스에서 재정의
     */
    public List<String> getDetails() {
        return List.of();
    }
}
