package io.datahub.client.transport;

import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.apache.hc.client5.http.classic.methods.HttpUriRequestBase;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.entity.UrlEncodedFormEntity;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.http.NameValuePair;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.http.message.BasicNameValuePair;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link HttpTransport} on top of Apache HttpClient 5.
 */
public class ApacheHttpTransport implements HttpTransport, Closeable {

  private static final Logger log = LoggerFactory.getLogger(ApacheHttpTransport.class);

  private final CloseableHttpClient httpClient;

  public ApacheHttpTransport(CloseableHttpClient httpClient) {
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
  }

  /**
   * Builds a pooled client whose connect and socket timeouts bound every exchange, the token
   * endpoint call included.
   */
  public static ApacheHttpTransport create(Duration connectTimeout, Duration readTimeout) {
    requirePositive(connectTimeout, "connectTimeout");
    requirePositive(readTimeout, "readTimeout");
    ConnectionConfig connectionConfig = ConnectionConfig.custom()
        .setConnectTimeout(Timeout.of(connectTimeout))
        .setSocketTimeout(Timeout.of(readTimeout))
        .build();
    CloseableHttpClient client = HttpClients.custom()
        .setConnectionManager(PoolingHttpClientConnectionManagerBuilder.create()
            .setDefaultConnectionConfig(connectionConfig)
            .build())
        .setDefaultRequestConfig(RequestConfig.custom()
            .setResponseTimeout(Timeout.of(readTimeout))
            .build())
        .disableAutomaticRetries()
        .build();
    return new ApacheHttpTransport(client);
  }

  @Override
  public HttpCallResult get(String url, Map<String, String> headers, Duration timeout) {
    requirePositive(timeout, "timeout");
    HttpGet request;
    try {
      request = new HttpGet(url);
    } catch (IllegalArgumentException ex) {
      log.debug("GET {} rejected: {}", url, ex.getMessage());
      return HttpCallResult.failure(ex.toString());
    }
    addHeaders(request, headers);
    request.setConfig(RequestConfig.custom()
        .setResponseTimeout(Timeout.of(timeout))
        .build());
    return execute(request);
  }

  @Override
  public HttpCallResult post(String url, Map<String, String> headers, Map<String, String> form) {
    HttpPost request;
    try {
      request = new HttpPost(url);
    } catch (IllegalArgumentException ex) {
      log.debug("POST {} rejected: {}", url, ex.getMessage());
      return HttpCallResult.failure(ex.toString());
    }
    addHeaders(request, headers);
    List<NameValuePair> pairs = new ArrayList<>();
    if (form != null) {
      form.forEach((name, value) -> pairs.add(new BasicNameValuePair(name, value)));
    }
    request.setEntity(new UrlEncodedFormEntity(pairs, StandardCharsets.UTF_8));
    return execute(request);
  }

  @Override
  public void close() throws IOException {
    httpClient.close();
  }

  private HttpCallResult execute(HttpUriRequestBase request) {
    try {
      return httpClient.execute(request, response -> {
        String body = response.getEntity() == null
            ? ""
            : EntityUtils.toString(response.getEntity(), StandardCharsets.UTF_8);
        return HttpCallResult.of(response.getCode(), body);
      });
    } catch (IOException ex) {
      log.debug("{} {} failed: {}", request.getMethod(), request.getRequestUri(), ex.toString());
      return HttpCallResult.failure(ex.toString());
    }
  }

  private static void addHeaders(HttpUriRequestBase request, Map<String, String> headers) {
    if (headers != null) {
      headers.forEach(request::addHeader);
    }
  }

  private static void requirePositive(Duration value, String name) {
    Objects.requireNonNull(value, name);
    if (value.isZero() || value.isNegative()) {
      throw new IllegalArgumentException(name + " must be positive: " + value);
    }
  }
}
