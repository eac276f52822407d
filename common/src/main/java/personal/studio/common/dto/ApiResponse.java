package personal.studio.common.dto;

/**
 * 상태 조회 API 응답 포맷
 * 일정 리소스 API 는 DTO 를 그대로 반환하고, 이 포맷은 health 계열에서만 쓴다
 *
 * @param result  "success" 또는 "error"
 * @param message 응답 메시지
 * @param data    응답 데이터
 */
public record ApiResponse<T>(
        String result,
        String message,
        T data
) {
    private static final String SUCCESS = "success";
    private static final String ERROR = "error";

    public static <T> ApiResponse<T> success(String message, T data) {
        return new ApiResponse<>(SUCCESS, message, data);
    }

    public static <T> ApiResponse<T> error(String message, T data) {
        return new ApiResponse<>(ERROR, message, data);
    }

    public static <T> ApiResponse<T> from(boolean ok, String successMessage, String errorMessage, T data) {
        return ok ? success(successMessage, data) : error(errorMessage, data);
    }
}
