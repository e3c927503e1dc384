package com.sitescout.core.crawler;

import com.sitescout.core.api.IFetcher;
import com.sitescout.core.model.FetchOutcome;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** URL → 응답 스텁. 스텁 없는 URL은 404. 호출 기록은 스레드 세이프. */
final class FakeFetcher implements IFetcher {

    private final Map<String, FetchOutcome> byUrl = new ConcurrentHashMap<>();
    private final List<String> calls = new ArrayList<>();
    private volatile long delayMs = 0;

    FakeFetcher page(String url, String html) {
        byUrl.put(url, FetchOutcome.success(url, url, html));
        return this;
    }

    /** 링크만 있는 페이지 */
    FakeFetcher links(String url, String... hrefs) {
        StringBuilder sb = new StringBuilder("<html><body>");
        for (String h : hrefs) sb.append("<a href=\"").append(h).append("\">x</a>");
        return page(url, sb.append("</body></html>").toString());
    }

    FakeFetcher status(String url, int status) {
        byUrl.put(url, FetchOutcome.httpStatus(url, status));
        return this;
    }

    FakeFetcher transportError(String url) {
        byUrl.put(url, FetchOutcome.transport(url, "java.net.ConnectException: Connection refused"));
        return this;
    }

    FakeFetcher delay(long ms) {
        this.delayMs = ms;
        return this;
    }

    @Override
    public FetchOutcome fetch(String url) {
        synchronized (calls) {
            calls.add(url);
        }
        if (delayMs > 0) {
            try {
                Thread.sleep(delayMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return FetchOutcome.transport(url, "interrupted");
            }
        }
        FetchOutcome o = byUrl.get(url);
        return o != null ? o : FetchOutcome.httpStatus(url, 404);
    }

    List<String> calls() {
        synchronized (calls) {
            return new ArrayList<>(calls);
        }
    }

    long callsTo(String url) {
        return calls().stream().filter(url::equals).count();
    }
}
