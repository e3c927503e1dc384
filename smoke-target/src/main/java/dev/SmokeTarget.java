package dev;

import com.sun.net.httpserver.*;

import java.io.*;
import java.net.*;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.Executors;

/**
 * 수동 E2E 확인용 로컬 사이트.
 * <pre>
 *   mvn -pl smoke-target exec:java  (또는 IDE에서 main 실행)
 *   sitescout http://localhost:8080 -k hiring,careers
 * </pre>
 * 기대 결과: /about 매칭 1건, /broken 깨진 링크 1건
 */
public class SmokeTarget {

  static void add(HttpServer s, String path, HttpHandler h) { s.createContext(path, h); }

  public static void main(String[] args) throws Exception {
    int port = args.length > 0 ? Integer.parseInt(args[0]) : 8080;
    HttpServer http = HttpServer.create(new InetSocketAddress(port), 0);
    wireEndpoints(http);
    http.setExecutor(Executors.newFixedThreadPool(8));
    http.start();
    System.out.println("[SiteScout] smoke site on http://localhost:" + port);
  }

  // 공통 엔드포인트 배선
  static void wireEndpoints(HttpServer s) {
    // 인덱스 (컨텍스트 "/"는 모든 경로를 받으므로 정확히 "/"만 200)
    add(s, "/", ex -> {
      if (!"/".equals(ex.getRequestURI().getPath())) {
        resp(ex, 404, "text/html", "<html><body>Not Found</body></html>");
        return;
      }
      String html =
        "<html><body>" +
        "  <h3>SiteScout Smoke Index</h3>" +
        "  <ul>" +
        "    <li><a href=\"/about\">About</a></li>" +
        "    <li><a href=\"/broken\">Broken</a></li>" +
        "    <li><a href=\"team\">Team (relative)</a></li>" +
        "    <li><a href=\"/moved\">Moved (302)</a></li>" +
        "    <li><a href=\"/slow\">Slow</a></li>" +
        "    <li><a href=\"#top\">Top</a></li>" +
        "    <li><a href=\"mailto:info@example.com\">Mail</a></li>" +
        "    <li><a href=\"https://example.org/elsewhere\">Other origin</a></li>" +
        "  </ul>" +
        "</body></html>";
      resp(ex, 200, "text/html", html);
    });

    // 키워드 페이지
    add(s, "/about", ex -> resp(ex, 200, "text/html",
        "<html><body><p>We are Hiring engineers. See <a href=\"/\">home</a>.</p></body></html>"));

    add(s, "/team", ex -> resp(ex, 200, "text/html",
        "<html><body><p>Our team. No open roles listed here.</p></body></html>"));

    // 깨진 링크
    add(s, "/broken", ex -> resp(ex, 404, "text/html", "<html><body>gone</body></html>"));

    // 리다이렉트 → /about
    add(s, "/moved", ex -> {
      ex.getResponseHeaders().set("Location", "/about");
      ex.sendResponseHeaders(302, -1);
      ex.close();
    });

    // 타임아웃 확인용 (기본 3초 지연, ?ms=로 조정)
    add(s, "/slow", ex -> {
      long ms = 3000;
      String q = ex.getRequestURI().getRawQuery();
      if (q != null && q.matches("ms=\\d{1,6}")) ms = Long.parseLong(q.substring(3));
      try {
        Thread.sleep(ms);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      resp(ex, 200, "text/html", "<html><body>slow careers page</body></html>");
    });
  }

  static void resp(HttpExchange ex, int code, String ct, String body) throws IOException {
    byte[] b = body.getBytes(StandardCharsets.UTF_8);
    ex.getResponseHeaders().set("Content-Type", ct + "; charset=utf-8");
    ex.sendResponseHeaders(code, b.length);
    try (OutputStream os = ex.getResponseBody()) { os.write(b); }
  }
}
