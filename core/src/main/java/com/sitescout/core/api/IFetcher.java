package com.sitescout.core.api;

import com.sitescout.core.model.FetchOutcome;

/** 페치 최소 계약: URL을 받아 성공/실패가 태깅된 결과를 돌려준다. 네트워크 오류로 예외를 던지지 않는다. */
@FunctionalInterface
public interface IFetcher {
    FetchOutcome fetch(String url);
}
