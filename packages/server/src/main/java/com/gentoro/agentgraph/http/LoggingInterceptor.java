package com.gentoro.agentgraph.http;

import com.gentoro.agentgraph.utility.StringUtility;
import java.io.IOException;
import okhttp3.Headers;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;

/** Debug logging of outbound calls. Credentials in headers are never written in full. */
public class LoggingInterceptor implements Interceptor {
  private static final org.slf4j.Logger log =
      com.gentoro.agentgraph.logging.LoggingService.getLogger(LoggingInterceptor.class);

  @Override
  public Response intercept(Chain chain) throws IOException {
    Request request = chain.request();

    long startTime = System.nanoTime();
    log.debug(
        "Sending {} {}\nHeaders:\n{}", request.method(), request.url(), redact(request.headers()));

    Response response = chain.proceed(request);

    long endTime = System.nanoTime();
    log.debug(
        "Received response for {} in {} ms, status {}",
        response.request().url(),
        String.format("%.1f", (endTime - startTime) / 1e6d),
        response.code());
    return response;
  }

  static String redact(Headers headers) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < headers.size(); i++) {
      String name = headers.name(i);
      String value = headers.value(i);
      if ("Authorization".equalsIgnoreCase(name)) {
        value = StringUtility.redact(value);
      }
      sb.append(name).append(": ").append(value).append('\n');
    }
    return sb.toString();
  }
}
