package io.github.scagogogo.central_search.client;

import io.github.scagogogo.central_search.config.CentralSearchConfig;
import io.github.scagogogo.central_search.exceptions.TransportException;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;
import org.apache.http.HttpHeaders;
import org.apache.http.HttpHost;
import org.apache.http.HttpStatus;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClientBuilder;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.util.EntityUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * {@link SearchTransport} backed by Apache HttpClient.
 *
 * <p>Issues GET requests to the configured select URL, optionally through a proxy. Network
 * failures and 5xx answers are retried with a linearly growing delay; other non-200 answers fail
 * immediately.
 */
@Slf4j
@Component
public class CentralSearchHttpClient implements SearchTransport {

  private final CentralSearchConfig config;
  private final CloseableHttpClient httpClient;

  @Autowired
  public CentralSearchHttpClient(CentralSearchConfig config) {
    this(config, createHttpClient(config));
  }

  CentralSearchHttpClient(CentralSearchConfig config, CloseableHttpClient httpClient) {
    this.config = Objects.requireNonNull(config, "config must not be null");
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
  }

  private static CloseableHttpClient createHttpClient(CentralSearchConfig config) {
    RequestConfig requestConfig =
        RequestConfig.custom()
            .setConnectTimeout(config.getConnectTimeoutMs())
            .setSocketTimeout(config.getSocketTimeoutMs())
            .build();
    HttpClientBuilder clientBuilder = HttpClients.custom().setDefaultRequestConfig(requestConfig);
    if (config.isProxyConfigured()) {
      clientBuilder.setProxy(new HttpHost(config.getProxyHost(), config.getProxyPort()));
    }
    return clientBuilder.build();
  }

  @Override
  public String fetch(String encodedParams) {
    String url = config.getSelectUrl() + "?" + (encodedParams == null ? "" : encodedParams);
    HttpGet httpGet;
    try {
      httpGet = new HttpGet(url);
    } catch (IllegalArgumentException e) {
      throw new TransportException("Invalid search URL: " + url, TransportException.NO_STATUS, e);
    }
    httpGet.setHeader(HttpHeaders.ACCEPT, "application/json");

    int maxAttempts = Math.max(1, config.getMaxRetries());
    int attempt = 0;
    int lastStatus = TransportException.NO_STATUS;
    Exception lastException = null;

    while (attempt < maxAttempts) {
      attempt++;
      try (CloseableHttpResponse response = httpClient.execute(httpGet)) {
        int statusCode = response.getStatusLine().getStatusCode();
        lastStatus = statusCode;

        if (statusCode == HttpStatus.SC_OK) {
          log.debug("Search call succeeded on attempt {}: {}", attempt, url);
          return response.getEntity() == null
              ? ""
              : EntityUtils.toString(response.getEntity(), StandardCharsets.UTF_8);
        }

        // Client errors are not retried
        if (statusCode >= 400 && statusCode < 500) {
          throw new TransportException(
              "Search endpoint rejected request: HTTP " + statusCode, statusCode);
        }

        lastException = null;
        log.warn("Unexpected status {} for URL: {}", statusCode, url);
      } catch (IOException e) {
        lastException = e;
        lastStatus = TransportException.NO_STATUS;
        log.warn("Attempt {}/{} failed for URL {} - {}", attempt, maxAttempts, url, e.getMessage());
      }

      if (attempt < maxAttempts) {
        sleepBeforeRetry(attempt);
      }
    }

    throw new TransportException(
        "Search call failed after " + maxAttempts + " attempts: " + url, lastStatus, lastException);
  }

  private void sleepBeforeRetry(int attempt) {
    long delay = config.getRetryDelayMs() * attempt;
    if (delay <= 0) {
      return;
    }
    try {
      Thread.sleep(delay);
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      throw new TransportException("Interrupted during retry", TransportException.NO_STATUS, ie);
    }
  }

  @PreDestroy
  public void cleanup() {
    try {
      httpClient.close();
      log.info("HTTP client closed successfully");
    } catch (IOException e) {
      log.error("Error closing HTTP client", e);
    }
  }
}
