package com.sitescout.core.crawler;

import com.sitescout.core.util.UrlUtils;

import java.util.ArrayList;
import java.util.List;

/** 페이지 본문에서 절대 URL을 추출하는 전략 인터페이스. */
public interface LinkExtractor {

    /**
     * html에서 링크를 추출해 시드 기준 절대 URL로 반환(문서 순서, 중복 제거 없음).
     * 잘못된/빈 href는 건너뛰며 예외를 던지지 않는다.
     */
    List<String> extract(String html, String seed);

    /** extract 결과 중 시드와 같은 origin인 것만. 중복 제거는 VisitedSet 몫. */
    default List<String> candidates(String html, String seed) {
        String origin = UrlUtils.originOf(seed);
        List<String> out = new ArrayList<>();
        if (origin == null) return out;
        for (String link : extract(html, seed)) {
            if (UrlUtils.isInOrigin(link, origin)) out.add(link);
        }
        return out;
    }
}
