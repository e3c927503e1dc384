package com.sitescout.core.api;

import com.sitescout.core.model.BrokenLink;
import com.sitescout.core.model.FetchOutcome;

/**
 * 진단 기록 수신자. 기록은 제어 흐름에 영향을 주지 않는다.
 * 기본 구현은 {@link com.sitescout.core.util.StructuredDiagnosticsSink}.
 */
public interface DiagnosticsSink {

    /** @param referrer 검증 페치였다면 링크를 발견한 페이지, 아니면 null */
    void fetchFailed(FetchOutcome.Failure failure, String referrer);

    void brokenLink(BrokenLink link);

    void configFailed(String source, String reason);

    DiagnosticsSink NONE = new DiagnosticsSink() {
        @Override public void fetchFailed(FetchOutcome.Failure failure, String referrer) {}
        @Override public void brokenLink(BrokenLink link) {}
        @Override public void configFailed(String source, String reason) {}
    };
}
