package com.sitescout.core.model;

import java.util.Objects;

/** 검증 페치에 실패한 링크와 그 링크를 발견한 페이지. */
public record BrokenLink(String href, String referrer) {
    public BrokenLink {
        Objects.requireNonNull(href, "href");
        Objects.requireNonNull(referrer, "referrer");
    }
}
