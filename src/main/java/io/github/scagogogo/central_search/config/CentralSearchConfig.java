package io.github.scagogogo.central_search.config;

import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Endpoint and HTTP settings loaded from {@code application.properties}.
 */
@Getter
@Component
public class CentralSearchConfig {

  private final String baseUrl;
  private final String selectPath;
  private final int maxRetries;
  private final long retryDelayMs;
  private final int connectTimeoutMs;
  private final int socketTimeoutMs;
  private final String proxyHost;
  private final Integer proxyPort;

  public CentralSearchConfig(
      @Value("${central.search.base-url:https://search.maven.org}") String baseUrl,
      @Value("${central.search.select-path:/solrsearch/select}") String selectPath,
      @Value("${central.search.max-retries:3}") int maxRetries,
      @Value("${central.search.retry-delay-ms:1000}") long retryDelayMs,
      @Value("${central.search.connect-timeout-ms:10000}") int connectTimeoutMs,
      @Value("${central.search.socket-timeout-ms:30000}") int socketTimeoutMs,
      @Value("${http.proxy.host:}") String proxyHost,
      @Value("${http.proxy.port:#{null}}") Integer proxyPort) {
    this.baseUrl = baseUrl;
    this.selectPath = selectPath;
    this.maxRetries = maxRetries;
    this.retryDelayMs = retryDelayMs;
    this.connectTimeoutMs = connectTimeoutMs;
    this.socketTimeoutMs = socketTimeoutMs;
    this.proxyHost = proxyHost;
    this.proxyPort = proxyPort;
  }

  public boolean isProxyConfigured() {
    return proxyHost != null && !proxyHost.isEmpty() && proxyPort != null;
  }

  /**
   * Returns the select endpoint URL with a single slash between base URL and path.
   *
   * @return e.g. {@code https://search.maven.org/solrsearch/select}
   */
  public String getSelectUrl() {
    String base = baseUrl == null ? "" : baseUrl.trim();
    if (base.endsWith("/")) {
      base = base.substring(0, base.length() - 1);
    }
    String path = selectPath == null ? "" : selectPath.trim();
    if (!path.isEmpty() && !path.startsWith("/")) {
      path = "/" + path;
    }
    return base + path;
  }
}
