package com.len.admission.domain.notification;

/**
 * 학생 알림 요청. 실제 SMS 발송은 외부 워커 담당.
 * 구현체는 실패 시 예외를 던질 수 있고, 호출 측(AdmissionNotifier)이 삼키고 집계한다.
 */
public interface NotificationDispatcher {

    void notify(long studentId, NotificationKind kind, NotificationPayload payload);
}
