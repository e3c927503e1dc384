package com.sitescout.core.api;

import com.sitescout.core.model.CrawlReport;
import com.sitescout.core.util.ProgressListener;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/** 크롤러 최소 계약: 시드 목록을 순서대로 크롤링하고 실행 결과를 돌려준다. */
public interface ICrawler {

    /**
     * @param seeds      절대 URL 시드 목록(순서 유지)
     * @param listener   방문 진행 콜백(null 허용)
     * @param cancelFlag true가 되면 새 페치를 멈춘다(null 허용)
     */
    CrawlReport crawl(List<String> seeds, ProgressListener listener, AtomicBoolean cancelFlag);

    default CrawlReport crawl(List<String> seeds) {
        return crawl(seeds, ProgressListener.NONE, null);
    }
}
