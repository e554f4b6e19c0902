package com.surveygateway.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * HTTP client used to reach the upstream completion API.
 * The read timeout is the hard bound on a single upstream call; there is no retry layer on top.
 */
@Configuration
public class UpstreamClientConfig {

    private static final Logger logger = LoggerFactory.getLogger(UpstreamClientConfig.class);

    @Bean
    public RestTemplate upstreamRestTemplate(
            @Value("${upstream.connect-timeout-seconds:5}") int connectTimeoutSeconds,
            @Value("${upstream.timeout-seconds:30}") int timeoutSeconds) {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(connectTimeoutSeconds))
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();

        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(Duration.ofSeconds(timeoutSeconds));

        logger.info("Upstream HTTP client configured: connectTimeout={}s, timeout={}s",
                connectTimeoutSeconds, timeoutSeconds);
        return new RestTemplate(requestFactory);
    }
}
