package com.sitescout.core.util;

import com.sitescout.core.api.DiagnosticsSink;
import com.sitescout.core.model.BrokenLink;
import com.sitescout.core.model.FetchOutcome;

/**
 * 진단 기록을 "sitescout.diagnostics" 채널에 JSON 라인으로 남긴다.
 * LogSetup이 WARNING 이상을 errors.log로 보낸다.
 */
public final class StructuredDiagnosticsSink implements DiagnosticsSink {

    public static final String CHANNEL = "sitescout.diagnostics";

    private final StructuredLog slog;

    public StructuredDiagnosticsSink() {
        this(StructuredLog.named(CHANNEL));
    }

    StructuredDiagnosticsSink(StructuredLog slog) {
        this.slog = slog;
    }

    @Override
    public void fetchFailed(FetchOutcome.Failure failure, String referrer) {
        slog.warn("fetch-failed",
                "url", failure.requestedUrl(),
                "kind", failure.kind().name(),
                "status", failure.status(),
                "reason", failure.reason(),
                "referrer", referrer);
    }

    @Override
    public void brokenLink(BrokenLink link) {
        slog.warn("broken-link",
                "href", link.href(),
                "referrer", link.referrer());
    }

    @Override
    public void configFailed(String source, String reason) {
        slog.error("config-failed", null,
                "source", source,
                "reason", reason);
    }
}
