package com.gentoro.agentgraph.client;

import com.gentoro.agentgraph.decode.DecodedResult;
import com.gentoro.agentgraph.decode.ResponseDecoder;
import com.gentoro.agentgraph.exception.NetworkException;
import com.gentoro.agentgraph.http.InvocationServlet;
import com.gentoro.agentgraph.utility.JacksonUtility;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Posts prompts to a runtime's {@code /invocations} endpoint and decodes the answer. Error bodies
 * are decoded like any other; only transport failures throw.
 */
public class RuntimeClient {
  private static final org.slf4j.Logger log =
      com.gentoro.agentgraph.logging.LoggingService.getLogger(RuntimeClient.class);
  private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

  private final OkHttpClient http;
  private final String invocationsUrl;
  private final String userId;
  private final ResponseDecoder decoder = new ResponseDecoder();

  public RuntimeClient(OkHttpClient http, String invocationsUrl, String userId) {
    this.http = Objects.requireNonNull(http, "http");
    this.invocationsUrl = Objects.requireNonNull(invocationsUrl, "invocationsUrl");
    this.userId = userId;
  }

  public DecodedResult invoke(String prompt, String sessionId) {
    Map<String, Object> input = new LinkedHashMap<>();
    input.put("prompt", prompt);
    input.put("session_id", sessionId);
    String payload = JacksonUtility.toJson(Map.of("input", input));

    Request.Builder request =
        new Request.Builder()
            .url(invocationsUrl)
            .header("Accept", "application/json")
            .post(RequestBody.create(payload, JSON));
    if (userId != null && !userId.isBlank()) {
      request.header(InvocationServlet.USER_ID_HEADER, userId);
    }

    try (Response response = http.newCall(request.build()).execute()) {
      ResponseBody body = response.body();
      byte[] bytes = body == null ? new byte[0] : body.bytes();
      log.debug("Runtime answered HTTP {} with {} bytes", response.code(), bytes.length);
      return decoder.decode(bytes);
    } catch (IOException e) {
      throw new NetworkException("Could not reach runtime at " + invocationsUrl, e);
    }
  }
}
