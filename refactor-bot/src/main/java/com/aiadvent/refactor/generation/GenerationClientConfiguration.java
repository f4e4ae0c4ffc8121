package com.aiadvent.refactor.generation;

import com.aiadvent.refactor.config.RefactorBotProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.http.HttpClient;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
class GenerationClientConfiguration {

  private static final Logger log = LoggerFactory.getLogger(GenerationClientConfiguration.class);

  @Bean
  OpenRouterClient openRouterClient(
      RefactorBotProperties properties,
      ObjectProvider<RestClient.Builder> restClientBuilderProvider,
      ObjectMapper objectMapper) {
    RefactorBotProperties.GenerationProperties generation = properties.getGeneration();
    Duration timeout = generation.getTimeout();
    HttpClient httpClient =
        HttpClient.newBuilder()
            .connectTimeout(timeout)
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();
    JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
    requestFactory.setReadTimeout(timeout);

    RestClient.Builder builder = restClientBuilderProvider.getIfAvailable(RestClient::builder);
    String baseUrl = stripTrailingSlash(generation.getBaseUrl().trim());
    log.info(
        "generation client configured: baseUrl={}, model={}, timeout={}s, maxRetries={}",
        baseUrl,
        generation.getModel(),
        timeout.toSeconds(),
        generation.getMaxRetries());
    RestClient restClient = builder.baseUrl(baseUrl).requestFactory(requestFactory).build();
    return new OpenRouterClient(restClient, generation, objectMapper);
  }

  private static String stripTrailingSlash(String value) {
    String result = value;
    while (result.endsWith("/")) {
      result = result.substring(0, result.length() - 1);
    }
    return result;
  }
}
