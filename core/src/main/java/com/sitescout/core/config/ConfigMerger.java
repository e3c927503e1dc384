package com.sitescout.core.config;

import com.sitescout.core.model.CrawlConfig;

import java.util.ArrayList;
import java.util.List;

/**
 * 파일 설정 + 직접 인자 병합.
 * 직접 인자의 시드/키워드는 파일 값 뒤에 덧붙는다(교체 아님).
 */
public final class ConfigMerger {
    private ConfigMerger() {}

    /**
     * @param base     파일에서 읽은 설정(없으면 null → defaults)
     * @param seeds    직접 인자 시드
     * @param keywords 직접 인자 키워드
     * @throws InputException 병합 후 시드나 키워드가 비어 있음
     */
    public static CrawlConfig merge(CrawlConfig base, List<String> seeds, List<String> keywords) throws InputException {
        CrawlConfig cfg = (base != null ? base : CrawlConfig.defaults());
        cfg.addSeeds(seeds);
        cfg.addKeywords(keywords);

        if (cfg.getSeeds().isEmpty() || cfg.getKeywords().isEmpty()) {
            throw new InputException("No base URLs or keywords provided.");
        }
        return cfg;
    }

    /** "a, b,,c" → [a, b, c] */
    public static List<String> splitKeywords(String csv) {
        List<String> out = new ArrayList<>();
        if (csv == null || csv.isBlank()) return out;
        for (String p : csv.split(",")) {
            String t = p.trim();
            if (!t.isEmpty()) out.add(t);
        }
        return out;
    }
}
