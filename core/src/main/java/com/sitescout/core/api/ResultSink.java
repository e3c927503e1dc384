package com.sitescout.core.api;

import com.sitescout.core.model.CrawlReport;

import java.io.IOException;
import java.nio.file.Path;

/** 크롤 결과를 파일로 내보내는 책임 (CSV/JSON). */
public interface ResultSink {
    /**
     * @param report 실행 결과(부분 결과 포함)
     * @return 생성된 파일 경로
     */
    Path write(CrawlReport report) throws IOException;
}
