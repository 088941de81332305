package io.datahub.client.transport;

import java.time.Duration;
import java.util.Map;

/**
 * Blocking HTTP exchange used by the client. Connection and timeout failures are returned as a
 * result with {@link HttpCallResult#error()} set instead of being thrown.
 */
public interface HttpTransport {

  HttpCallResult get(String url, Map<String, String> headers, Duration timeout);

  HttpCallResult post(String url, Map<String, String> headers, Map<String, String> form);

  record HttpCallResult(int statusCode, String body, String error) {

    public HttpCallResult {
      body = body == null ? "" : body;
    }

    public static HttpCallResult of(int statusCode, String body) {
      return new HttpCallResult(statusCode, body, null);
    }

    public static HttpCallResult failure(String error) {
      return new HttpCallResult(-1, "", error == null ? "unknown transport failure" : error);
    }

    public boolean isTransportFailure() {
      return error != null;
    }
  }
}
