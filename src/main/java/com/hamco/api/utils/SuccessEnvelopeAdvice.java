package com.hamco.api.utils;

import com.hamco.api.model.ApiResponse;
import org.springframework.core.MethodParameter;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageConverter;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.http.server.ServletServerHttpRequest;
import org.springframework.http.server.ServletServerHttpResponse;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyAdvice;

/**
 * Wraps successful JSON responses from our controllers in ApiResponse:
 * {
 *   "success": true,
 *   "message": "OK",
 *   "data": {...},
 *   "requestId": "...",
 *   "timestamp": "...Z"
 * }
 * Skips wrapping:
 *  - ProblemDetail (errors)
 *  - Non-2xx responses
 *  - Empty bodies (e.g. 204)
 *  - Already-wrapped ApiResponse
 *  - Non-JSON media types
 */
@RestControllerAdvice(basePackages = "com.hamco.api.controller")
public class SuccessEnvelopeAdvice implements ResponseBodyAdvice<Object> {

    @Override
    public boolean supports(@NonNull MethodParameter returnType,
                            @NonNull Class<? extends HttpMessageConverter<?>> converterType) {
        // Decide in beforeBodyWrite (we need MediaType & body)
        return true;
    }

    @Override
    public Object beforeBodyWrite(@Nullable Object body,
                                  @NonNull MethodParameter returnType,
                                  @NonNull MediaType selectedContentType,
                                  @NonNull Class<? extends HttpMessageConverter<?>> selectedConverterType,
                                  @NonNull ServerHttpRequest request,
                                  @NonNull ServerHttpResponse response) {

        // Never wrap RFC 7807 errors
        if (body instanceof ProblemDetail) return body;
        if (!isJsonLike(selectedContentType)) return body;

        if (body instanceof ResponseEntity<?> entity) {
            if (!entity.getStatusCode().is2xxSuccessful()) return body;
            Object inner = entity.getBody();
            if (shouldSkip(inner)) return body;
            return ResponseEntity.status(entity.getStatusCode())
                    .headers(entity.getHeaders())
                    .body(ApiResponse.ok(resolveMessage(returnType), inner, requestId(request, response)));
        }

        if (shouldSkip(body)) return body;

        // Don’t wrap if the response status is not 2xx
        if (response instanceof ServletServerHttpResponse sResp) {
            HttpStatus resolved = HttpStatus.resolve(sResp.getServletResponse().getStatus());
            if (resolved != null && !resolved.is2xxSuccessful()) return body;
        }

        return ApiResponse.ok(resolveMessage(returnType), body, requestId(request, response));
    }

    private boolean shouldSkip(@Nullable Object body) {
        return body == null
                || body instanceof ApiResponse<?>
                || body instanceof byte[]
                || body instanceof org.springframework.core.io.Resource;
    }

    private boolean isJsonLike(@NonNull MediaType mt) {
        if (MediaType.APPLICATION_PROBLEM_JSON.includes(mt)) return false;
        return MediaType.APPLICATION_JSON.includes(mt) || mt.getSubtype().endsWith("+json");
    }

    /** Resolve message from @ResponseMessage on method or controller, default "OK". */
    private String resolveMessage(@NonNull MethodParameter returnType) {
        ResponseMessage ann = returnType.getMethodAnnotation(ResponseMessage.class);
        if (ann == null) {
            ann = returnType.getContainingClass().getAnnotation(ResponseMessage.class);
        }
        return (ann != null && StringUtils.hasText(ann.value())) ? ann.value() : "OK";
    }

    /** Pull requestId from header, then response header, then servlet attribute. */
    private String requestId(@NonNull ServerHttpRequest req, @NonNull ServerHttpResponse resp) {
        String id = req.getHeaders().getFirst(ErrorResponseWriter.REQUEST_ID_HEADER);
        if (!StringUtils.hasText(id)) {
            id = resp.getHeaders().getFirst(ErrorResponseWriter.REQUEST_ID_HEADER);
        }
        if (!StringUtils.hasText(id) && req instanceof ServletServerHttpRequest sreq) {
            Object attr = sreq.getServletRequest().getAttribute(ErrorResponseWriter.REQUEST_ID_ATTR);
            if (attr instanceof String s && StringUtils.hasText(s)) id = s;
        }
        return id;
    }
}
