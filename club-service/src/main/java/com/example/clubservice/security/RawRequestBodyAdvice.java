package com.example.clubservice.security;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.core.MethodParameter;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpInputMessage;
import org.springframework.http.converter.HttpMessageConverter;
import org.springframework.lang.NonNull;
import org.springframework.util.StreamUtils;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;
import org.springframework.web.servlet.mvc.method.annotation.RequestBodyAdviceAdapter;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.lang.reflect.Type;

/**
 * Keeps the request body bytes exactly as the client sent them, before message
 * conversion drops properties the target type does not declare.
 *
 * SecurityPipelineAspect scans and audits these bytes instead of the bound argument.
 */
@ControllerAdvice
public class RawRequestBodyAdvice extends RequestBodyAdviceAdapter {

    public static final String ATTRIBUTE = RawRequestBodyAdvice.class.getName() + ".BODY";

    @Override
    public boolean supports(@NonNull MethodParameter methodParameter,
                            @NonNull Type targetType,
                            @NonNull Class<? extends HttpMessageConverter<?>> converterType) {
        return true;
    }

    @Override
    @NonNull
    public HttpInputMessage beforeBodyRead(@NonNull HttpInputMessage inputMessage,
                                           @NonNull MethodParameter parameter,
                                           @NonNull Type targetType,
                                           @NonNull Class<? extends HttpMessageConverter<?>> converterType)
            throws IOException {
        byte[] raw = StreamUtils.copyToByteArray(inputMessage.getBody());
        if (RequestContextHolder.getRequestAttributes() instanceof ServletRequestAttributes attributes) {
            HttpServletRequest request = attributes.getRequest();
            request.setAttribute(ATTRIBUTE, raw);
        }
        return new CachedInputMessage(inputMessage.getHeaders(), raw);
    }

    private record CachedInputMessage(HttpHeaders headers, byte[] body) implements HttpInputMessage {

        @Override
        @NonNull
        public InputStream getBody() {
            return new ByteArrayInputStream(body);
        }

        @Override
        @NonNull
        public HttpHeaders getHeaders() {
            return headers;
        }
    }
}
