package com.tracker.hierarchy.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * GitLab client configuration.
 * Builds the RestTemplate used by the hierarchy source.
 */
@Configuration
public class GitLabConfig {

    private static final String API_PATH = "/api/v4";
    private static final String TOKEN_HEADER = "PRIVATE-TOKEN";

    @Value("${gitlab.url}")
    private String url;

    @Value("${gitlab.token:}")
    private String token;

    @Value("${gitlab.connection-timeout:5000}")
    private int connectionTimeout;

    @Value("${gitlab.read-timeout:30000}")
    private int readTimeout;

    @Bean
    public RestTemplate gitLabRestTemplate(RestTemplateBuilder builder) {
        String rootUri = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;

        builder = builder
                .rootUri(rootUri + API_PATH)
                .setConnectTimeout(Duration.ofMillis(connectionTimeout))
                .setReadTimeout(Duration.ofMillis(readTimeout));

        // anonymous access only sees public groups
        if (token != null && !token.isEmpty()) {
            builder = builder.defaultHeader(TOKEN_HEADER, token);
        }

        return builder.build();
    }
}
