package com.sitescout.core.model;

import java.util.Objects;

/**
 * 단일 GET 결과. 성공(최종 상태 200)과 실패를 명시적으로 구분한다.
 * 빈 본문과 실패를 같은 값으로 취급하지 않는다.
 */
public interface FetchOutcome {

    /** 실패 분류: 진단 로그에서 전송 오류와 상태 코드 오류를 구분하기 위함 */
    enum FailureKind {
        /** 구문상 URL이 아님(스킴/호스트 없음). 요청을 보내지 않음 */
        INVALID_URL,
        /** 연결/DNS/IO 오류 */
        TRANSPORT,
        /** 연결 또는 응답 타임아웃 */
        TIMEOUT,
        /** 200 이외의 최종 응답 */
        HTTP_STATUS
    }

    String requestedUrl();

    boolean isSuccess();

    static Success success(String requestedUrl, String finalUrl, String body) {
        return new Success(requestedUrl, finalUrl, body);
    }

    static Failure invalidUrl(String url, String reason) {
        return new Failure(url, FailureKind.INVALID_URL, -1, reason);
    }

    static Failure transport(String url, String reason) {
        return new Failure(url, FailureKind.TRANSPORT, -1, reason);
    }

    static Failure timeout(String url, String reason) {
        return new Failure(url, FailureKind.TIMEOUT, -1, reason);
    }

    static Failure httpStatus(String url, int status) {
        return new Failure(url, FailureKind.HTTP_STATUS, status, "Status " + status);
    }

    record Success(String requestedUrl, String finalUrl, String body) implements FetchOutcome {
        public Success {
            Objects.requireNonNull(requestedUrl, "requestedUrl");
            finalUrl = (finalUrl == null ? requestedUrl : finalUrl);
            body = (body == null ? "" : body);
        }

        @Override public boolean isSuccess() { return true; }

        public boolean redirected() { return !requestedUrl.equals(finalUrl); }
    }

    /** @param status HTTP 상태 코드, 응답이 없으면 -1 */
    record Failure(String requestedUrl, FailureKind kind, int status, String reason) implements FetchOutcome {
        public Failure {
            Objects.requireNonNull(kind, "kind");
            reason = (reason == null ? kind.name() : reason);
        }

        @Override public boolean isSuccess() { return false; }
    }
}
