package com.backupcenter.server.configuration;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Duration;

@Configuration
public class RestClientConfig {

    @Bean(name = "agentRestClient")
    public RestClient agentRestClient(
            @Value("${backupcenter.server.agent.timeoutSec:30}") int timeoutSec) {
        return buildRestClient(timeoutSec);
    }

    @Bean(name = "webhookRestClient")
    public RestClient webhookRestClient(
            @Value("${backupcenter.server.notification.timeoutSec:10}") int timeoutSec) {
        return buildRestClient(timeoutSec);
    }

    private static RestClient buildRestClient(int timeoutSec) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(Duration.ofSeconds(timeoutSec));
        requestFactory.setReadTimeout(Duration.ofSeconds(timeoutSec));
        return RestClient.builder()
                .requestFactory(requestFactory)
                .defaultHeaders(headers -> headers.setContentType(MediaType.APPLICATION_JSON))
                .build();
    }
}
