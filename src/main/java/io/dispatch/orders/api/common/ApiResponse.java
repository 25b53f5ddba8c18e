package io.dispatch.orders.api.common;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.dispatch.orders.domain.ErrorCode;

import java.util.List;

/**
 * Envelope of every response: {@code {ok, item}}, {@code {ok, items}} or {@code {ok:false, error, code}}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(
    boolean ok,
    T item,
    List<T> items,
    String error,
    String code
) {
    public static <T> ApiResponse<T> success() {
        return new ApiResponse<>(true, null, null, null, null);
    }

    public static <T> ApiResponse<T> item(T item) {
        return new ApiResponse<>(true, item, null, null, null);
    }

    public static <T> ApiResponse<T> items(List<T> items) {
        return new ApiResponse<>(true, null, items, null, null);
    }

    public static <T> ApiResponse<T> error(ErrorCode code, String message) {
        return new ApiResponse<>(false, null, null, message, code.name());
    }
}
