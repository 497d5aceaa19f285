package com.len.admission.api.ratelimit;

import com.len.admission.application.ratelimit.OtpRateLimiter;
import lombok.RequiredArgsConstructor;
import org.springframework.core.MethodParameter;
import org.springframework.http.HttpInputMessage;
import org.springframework.http.converter.HttpMessageConverter;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;
import org.springframework.web.servlet.mvc.method.annotation.RequestBodyAdviceAdapter;

import java.lang.reflect.Type;

/**
 * JSON 본문의 phoneNumber 로 OTP 요청 제한.
 * 파라미터/헤더로 이미 센 요청({@link OtpRateLimitInterceptor#COUNTED_ATTRIBUTE})은 다시 세지 않는다.
 */
@RestControllerAdvice
@RequiredArgsConstructor
public class OtpRateLimitBodyAdvice extends RequestBodyAdviceAdapter {

    private final OtpRateLimiter rateLimiter;

    @Override
    public boolean supports(MethodParameter methodParameter, Type targetType,
                            Class<? extends HttpMessageConverter<?>> converterType) {
        return PhoneNumberBody.class.isAssignableFrom(methodParameter.getParameterType());
    }

    @Override
    public Object afterBodyRead(Object body, HttpInputMessage inputMessage, MethodParameter parameter,
                                Type targetType, Class<? extends HttpMessageConverter<?>> converterType) {
        String phoneNumber = ((PhoneNumberBody) body).phoneNumber();
        if (!StringUtils.hasText(phoneNumber)) {
            return body;
        }

        RequestAttributes attributes = RequestContextHolder.getRequestAttributes();
        if (!(attributes instanceof ServletRequestAttributes)) {
            OtpRateLimitInterceptor.apply(rateLimiter, phoneNumber.trim(), null);
            return body;
        }
        ServletRequestAttributes servlet = (ServletRequestAttributes) attributes;
        if (servlet.getRequest().getAttribute(OtpRateLimitInterceptor.COUNTED_ATTRIBUTE) != null) {
            return body;
        }

        servlet.getRequest().setAttribute(OtpRateLimitInterceptor.COUNTED_ATTRIBUTE, Boolean.TRUE);
        OtpRateLimitInterceptor.apply(rateLimiter, phoneNumber.trim(), servlet.getResponse());
        return body;
    }
}
