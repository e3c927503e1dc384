package com.sitescout.core.crawler;

import com.sitescout.core.util.UrlUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;

/**
 * JSoup 기반 링크 추출기: a[href] 수집 후 시드 기준으로 절대화.
 * <ul>
 *   <li>"/x"       → origin + "/x" (scheme+host+port에 결합)</li>
 *   <li>"//host/x" → 시드 scheme + ":" + href</li>
 *   <li>"x.html"   → base + "/x.html" (base = 시드에서 뒤쪽 '/' 제거)</li>
 *   <li>"http(s)://..." → 그대로</li>
 * </ul>
 * fragment는 제거, "#..."/mailto:/javascript: 등은 무시.
 * URI에 쓸 수 없는 문자(공백 등)는 %XX로 인코딩.
 */
public class JsoupLinkExtractor implements LinkExtractor {

    @Override
    public List<String> extract(String html, String seed) {
        List<String> out = new ArrayList<>();
        if (html == null || html.isEmpty()) return out;

        String origin = UrlUtils.originOf(seed);
        if (origin == null) return out;
        String base = UrlUtils.baseOf(seed);

        Document doc = Jsoup.parse(html);
        for (Element a : doc.select("a[href]")) {
            String abs = resolve(a.attr("href"), origin, base);
            if (abs != null) out.add(abs);
        }
        return out;
    }

    /** 해석 불가/무시 대상이면 null */
    static String resolve(String rawHref, String origin, String base) {
        if (rawHref == null) return null;
        String href = rawHref.trim();
        if (href.isEmpty() || href.startsWith("#")) return null;
        if (UrlUtils.hasOtherScheme(href)) return null;

        String abs;
        if (href.startsWith("//")) {
            abs = origin.substring(0, origin.indexOf(':') + 1) + href;
        } else if (href.startsWith("/")) {
            abs = origin + href;
        } else if (!UrlUtils.hasHttpScheme(href)) {
            abs = base + "/" + href;
        } else {
            abs = href;
        }

        abs = UrlUtils.encodeIllegalChars(UrlUtils.stripFragment(abs));
        return UrlUtils.isHttpUrl(abs) ? abs : null;
    }
}
