package com.len.admission.api.ratelimit;

import com.len.admission.application.ratelimit.OtpRateLimiter;
import com.len.admission.application.ratelimit.RateLimitDecision;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.util.StringUtils;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * OTP 발송 경로 앞단 요청 제한.
 * 전화번호는 요청 파라미터(phoneNumber) 또는 X-Phone-Number 헤더에서 읽는다.
 * JSON 본문으로만 번호가 오는 요청은 여기서 보이지 않으므로 {@link OtpRateLimitBodyAdvice} 가 본문을 읽은 뒤 센다.
 * 거부되면 RateLimitedException -> 429.
 */
@RequiredArgsConstructor
public class OtpRateLimitInterceptor implements HandlerInterceptor {

    public static final String PHONE_PARAM = "phoneNumber";
    public static final String PHONE_HEADER = "X-Phone-Number";

    public static final String HEADER_LIMIT = "X-RateLimit-Limit";
    public static final String HEADER_REMAINING = "X-RateLimit-Remaining";
    public static final String HEADER_RESET = "X-RateLimit-Reset";

    // 한 요청을 두 번 세지 않도록 (인터셉터에서 셌으면 본문 advice 는 건너뜀)
    public static final String COUNTED_ATTRIBUTE = OtpRateLimitInterceptor.class.getName() + ".COUNTED";

    private final OtpRateLimiter rateLimiter;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        String phoneNumber = resolvePhoneNumber(request);
        if (phoneNumber == null) {
            return true;
        }

        request.setAttribute(COUNTED_ATTRIBUTE, Boolean.TRUE);
        apply(rateLimiter, phoneNumber, response);
        return true;
    }

    static void apply(OtpRateLimiter rateLimiter, String phoneNumber, HttpServletResponse response) {
        RateLimitDecision decision = rateLimiter.isAllowed(phoneNumber);
        if (response != null) {
            response.setHeader(HEADER_LIMIT, String.valueOf(rateLimiter.getMaxRequests()));
            response.setHeader(HEADER_REMAINING, String.valueOf(decision.remaining()));
            response.setHeader(HEADER_RESET, decision.resetTime().toString());
        }

        if (!decision.allowed()) {
            rateLimiter.reject(decision);
        }
    }

    private String resolvePhoneNumber(HttpServletRequest request) {
        String param = request.getParameter(PHONE_PARAM);
        if (StringUtils.hasText(param)) {
            return param.trim();
        }
        String header = request.getHeader(PHONE_HEADER);
        return StringUtils.hasText(header) ? header.trim() : null;
    }
}
