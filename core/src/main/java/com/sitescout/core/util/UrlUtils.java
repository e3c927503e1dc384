package com.sitescout.core.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.regex.Pattern;

/** URL 검증 + origin 추출/포함 판정 유틸 */
public final class UrlUtils {
    private UrlUtils(){}

    // RFC 3986 scheme: ALPHA *( ALPHA / DIGIT / "+" / "-" / "." ) ":"
    private static final Pattern SCHEME = Pattern.compile("^[A-Za-z][A-Za-z0-9+.-]*:");

    /** 절대 http/https URL이면 URI, 아니면 null (예외 없음) */
    public static URI parseHttp(String url) {
        if (url == null || url.isBlank()) return null;
        try {
            URI u = new URI(url.trim());
            String scheme = u.getScheme();
            if (scheme == null) return null;
            scheme = scheme.toLowerCase(Locale.ROOT);
            if (!scheme.equals("http") && !scheme.equals("https")) return null;
            if (u.getHost() == null || u.getHost().isEmpty()) return null;
            return u;
        } catch (URISyntaxException e) {
            return null;
        }
    }

    public static boolean isHttpUrl(String url) {
        return parseHttp(url) != null;
    }

    /** "http://" 또는 "https://" 로 시작하는지(대소문자 무시) */
    public static boolean hasHttpScheme(String href) {
        if (href == null) return false;
        String h = href.toLowerCase(Locale.ROOT);
        return h.startsWith("http://") || h.startsWith("https://");
    }

    /** http 이외의 스킴(mailto:, javascript:, ftp: ...)을 가진 값인지 */
    public static boolean hasOtherScheme(String href) {
        return href != null && SCHEME.matcher(href).find() && !hasHttpScheme(href);
    }

    /**
     * origin = scheme + host + (명시 포트). 예: {@code http://localhost:8080}.
     * scheme/host는 소문자. 잘못된 URL이면 null.
     */
    public static String originOf(String url) {
        URI u = parseHttp(url);
        if (u == null) return null;
        String scheme = u.getScheme().toLowerCase(Locale.ROOT);
        String host = u.getHost().toLowerCase(Locale.ROOT);
        if (host.indexOf(':') >= 0 && !host.startsWith("[")) host = "[" + host + "]"; // IPv6
        return u.getPort() == -1 ? scheme + "://" + host : scheme + "://" + host + ":" + u.getPort();
    }

    /** 상대 경로 결합 기준: 시드 문자열에서 뒤쪽 '/' 제거 */
    public static String baseOf(String seed) {
        if (seed == null) return null;
        String s = seed.trim();
        int end = s.length();
        while (end > 0 && s.charAt(end - 1) == '/') end--;
        return s.substring(0, end);
    }

    /**
     * 시드 정규화: 경로가 비어 있으면 "/"를 붙인다 ("http://h" → "http://h/").
     * 사이트 내 "/" 링크와 시드가 같은 문자열이 되도록. 잘못된 URL이면 null.
     */
    public static String normalizeSeed(String seed) {
        URI u = parseHttp(seed);
        if (u == null) return null;
        String s = seed.trim();
        String path = u.getRawPath();
        if ((path == null || path.isEmpty()) && u.getRawQuery() == null && u.getRawFragment() == null) {
            return s + "/";
        }
        return s;
    }

    /**
     * 같은 origin 판정. origin 접두 + 구분자('/', '?', '#') 또는 완전 일치만 허용한다.
     * ("http://host" 가 "http://host.evil" 을 포함하지 않도록)
     */
    public static boolean isInOrigin(String url, String origin) {
        if (url == null || origin == null || origin.isEmpty()) return false;
        if (!url.regionMatches(true, 0, origin, 0, origin.length())) return false;
        if (url.length() == origin.length()) return true;
        char next = url.charAt(origin.length());
        return next == '/' || next == '?' || next == '#';
    }

    // URI에 그대로 쓸 수 있는 ASCII: unreserved + reserved + '%'
    private static final String URI_SAFE =
            "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789-._~:/?#[]@!$&'()*+,;=%";

    /**
     * URI에 올 수 없는 문자(공백, 따옴표, 비ASCII 등)를 UTF-8 %XX로 인코딩한다.
     * 이미 있는 %XX는 그대로 둔다. 예: {@code "/a b"} → {@code "/a%20b"}.
     */
    public static String encodeIllegalChars(String url) {
        if (url == null) return null;
        StringBuilder sb = null;
        for (int i = 0; i < url.length(); i++) {
            char c = url.charAt(i);
            if (c < 0x80 && URI_SAFE.indexOf(c) >= 0) {
                if (sb != null) sb.append(c);
                continue;
            }
            if (sb == null) sb = new StringBuilder(url.length() + 16).append(url, 0, i);
            int cp = url.codePointAt(i);
            if (Character.isSupplementaryCodePoint(cp)) i++;
            for (byte b : new String(Character.toChars(cp)).getBytes(StandardCharsets.UTF_8)) {
                sb.append('%').append(Character.toUpperCase(Character.forDigit((b >> 4) & 0xF, 16)))
                        .append(Character.toUpperCase(Character.forDigit(b & 0xF, 16)));
            }
        }
        return sb == null ? url : sb.toString();
    }

    /** fragment(#...) 제거 */
    public static String stripFragment(String url) {
        if (url == null) return null;
        int i = url.indexOf('#');
        return i < 0 ? url : url.substring(0, i);
    }
}
