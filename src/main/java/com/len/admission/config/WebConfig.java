package com.len.admission.config;

import com.len.admission.api.ratelimit.OtpRateLimitInterceptor;
import com.len.admission.application.ratelimit.OtpRateLimiter;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.List;

@Configuration
@RequiredArgsConstructor
public class WebConfig implements WebMvcConfigurer {

    private final OtpRateLimiter otpRateLimiter;

    @Value("${admission.rate-limit.otp-paths:/api/auth/otp/**}")
    private List<String> otpPaths;

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(new OtpRateLimitInterceptor(otpRateLimiter))
                .addPathPatterns(otpPaths);
    }
}
