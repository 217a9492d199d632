package com.nevis.ingest.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Duration;

@Configuration
public class FileSearchConfig {

    static final String API_KEY_HEADER = "x-goog-api-key";

    @Value("${app.gemini.api-key}")
    private String apiKey;

    @Value("${app.gemini.base-url:https://generativelanguage.googleapis.com}")
    private String baseUrl;

    @Bean
    public RestClient fileSearchRestClient(RestClient.Builder builder) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(Duration.ofSeconds(30));
        requestFactory.setReadTimeout(Duration.ofMinutes(5));

        return builder
            .baseUrl(baseUrl)
            .defaultHeader(API_KEY_HEADER, apiKey)
            .requestFactory(requestFactory)
            .build();
    }
}
