package com.gentoro.agentgraph.http;

import java.time.Duration;
import okhttp3.OkHttpClient;

public class OkHttpFactory {

  public static OkHttpClient create() {
    return create(Duration.ofSeconds(10), Duration.ofSeconds(20));
  }

  public static OkHttpClient create(Duration connectTimeout, Duration readTimeout) {
    return new OkHttpClient.Builder()
        .connectTimeout(connectTimeout)
        .readTimeout(readTimeout)
        .addInterceptor(new LoggingInterceptor())
        .build();
  }
}
