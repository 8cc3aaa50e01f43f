package hbnb.listing.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Unified API response envelope
 * @param <T> Response data type
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {
    /**
     * HTTP status code (200, 201, 400, 404, 409, ...)
     */
    private Integer code;

    /**
     * Failure kind for error responses (VALIDATION, NOT_FOUND, CONFLICT, UNAUTHORIZED, FORBIDDEN, INTERNAL)
     */
    private String kind;

    private String message;

    private T data;

    @Builder.Default
    private Long timestamp = System.currentTimeMillis();

    public static <T> ApiResponse<T> success(T data) {
        return success("Success", data);
    }

    public static <T> ApiResponse<T> success(String message, T data) {
        return ApiResponse.<T>builder()
                .code(200)
                .message(message)
                .data(data)
                .build();
    }

    public static <T> ApiResponse<T> created(String message, T data) {
        return ApiResponse.<T>builder()
                .code(201)
                .message(message)
                .data(data)
                .build();
    }

    /**
     * Error response with status code, failure kind and message
     */
    public static <T> ApiResponse<T> error(Integer code, String kind, String message) {
        return ApiResponse.<T>builder()
                .code(code)
                .kind(kind)
                .message(message)
                .build();
    }
}
