package com.signaltrader.config;

import com.signaltrader.api.dto.response.ApiErrorResponse;
import com.signaltrader.api.dto.response.ApiResponse;
import org.springframework.core.MethodParameter;
import org.springframework.http.MediaType;
import org.springframework.http.converter.HttpMessageConverter;
import org.springframework.http.converter.StringHttpMessageConverter;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyAdvice;

/**
 * Wraps operator API bodies in {@link ApiResponse}. Actuator, error pages, plain
 * strings and bodies that are already wrapped pass through untouched.
 */
@RestControllerAdvice
public class ApiResponseAdvice implements ResponseBodyAdvice<Object> {

    @Override
    public boolean supports(MethodParameter returnType, Class<? extends HttpMessageConverter<?>> converterType) {
        return true;
    }

    @Override
    public Object beforeBodyWrite(
            Object body,
            MethodParameter returnType,
            MediaType selectedContentType,
            Class<? extends HttpMessageConverter<?>> selectedConverterType,
            ServerHttpRequest request,
            ServerHttpResponse response) {

        if (isPassThrough(request.getURI().getPath())
                || body instanceof ApiResponse<?>
                || body instanceof ApiErrorResponse
                || StringHttpMessageConverter.class.isAssignableFrom(selectedConverterType)) {
            return body;
        }
        return ApiResponse.of(body);
    }

    private boolean isPassThrough(String path) {
        return path.startsWith("/actuator") || path.equals("/error");
    }
}
