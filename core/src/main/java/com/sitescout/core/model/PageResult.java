package com.sitescout.core.model;

import java.util.List;
import java.util.Objects;

/** 키워드가 하나 이상 매칭된 페이지. keywords는 설정된 키워드 순서를 따른다. */
public record PageResult(String url, List<String> keywords) {
    public PageResult {
        Objects.requireNonNull(url, "url");
        keywords = List.copyOf(keywords);
        if (keywords.isEmpty()) {
            throw new IllegalArgumentException("PageResult requires at least one matched keyword");
        }
    }
}
