package com.eventledger.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class SyncConfig {
  static final int DEFAULT_POOL_SIZE = 3;
  static final int DEFAULT_CONNECT_TIMEOUT_MS = 5_000;
  static final int DEFAULT_READ_TIMEOUT_MS = 20_000;

  /** One worker per provider by default, since each provider rate-limits independently. */
  @Bean(destroyMethod = "shutdownNow")
  public ExecutorService syncExecutor(SyncProperties properties) {
    int size = properties.poolSize() > 0 ? properties.poolSize() : DEFAULT_POOL_SIZE;
    AtomicInteger counter = new AtomicInteger();
    ThreadFactory factory = runnable -> {
      Thread thread = new Thread(runnable, "account-sync-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
    return Executors.newFixedThreadPool(size, factory);
  }

  public static RestClient restClient(String baseUrl, SyncProperties properties) {
    SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(properties.connectTimeoutMs() > 0
        ? properties.connectTimeoutMs()
        : DEFAULT_CONNECT_TIMEOUT_MS);
    requestFactory.setReadTimeout(properties.readTimeoutMs() > 0
        ? properties.readTimeoutMs()
        : DEFAULT_READ_TIMEOUT_MS);
    return RestClient.builder()
        .baseUrl(baseUrl == null ? "" : baseUrl)
        .requestFactory(requestFactory)
        .build();
  }
}
