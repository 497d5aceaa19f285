package com.len.admission.api.ratelimit;

/**
 * 본문에 전화번호를 싣는 OTP 요청 DTO 가 구현하면 {@link OtpRateLimitBodyAdvice} 가 요청 제한을 건다.
 */
public interface PhoneNumberBody {

    String phoneNumber();
}
