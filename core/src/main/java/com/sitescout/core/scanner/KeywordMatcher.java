package com.sitescout.core.scanner;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * 원문 텍스트에서 키워드를 단어 단위 + 대소문자 무시로 찾는다.
 * 키워드는 리터럴(Pattern.quote)로 취급한다.
 * 경계: 키워드 앞뒤에 문자/숫자/'_'가 붙어 있으면 불일치 ("cat" ≠ "Cats").
 */
public final class KeywordMatcher {

    private static final String WORD_CHAR = "[\\p{L}\\p{N}_]";

    private final Map<String, Pattern> cache = new ConcurrentHashMap<>();

    /** @return 매칭된 키워드(입력 순서 유지, 중복 1회). 없으면 빈 리스트 */
    public List<String> match(String text, List<String> keywords) {
        List<String> found = new ArrayList<>();
        if (text == null || text.isEmpty() || keywords == null) return found;

        for (String kw : new LinkedHashSet<>(keywords)) {
            if (kw == null || kw.isBlank()) continue;
            if (cache.computeIfAbsent(kw, KeywordMatcher::compile).matcher(text).find()) {
                found.add(kw);
            }
        }
        return found;
    }

    static Pattern compile(String keyword) {
        return Pattern.compile(
                "(?<!" + WORD_CHAR + ")" + Pattern.quote(keyword) + "(?!" + WORD_CHAR + ")",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }
}
