package com.eden.gateway.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Outbound HTTP client configuration for the reverse proxy
 */
@Slf4j
@Configuration
public class GatewayConfig {

    @Bean(destroyMethod = "shutdown")
    public ExecutorService proxyExecutor() {
        return Executors.newCachedThreadPool();
    }

    /**
     * A single client shared by all proxied calls; it pools connections internally.
     * Redirects are relayed to the caller, never followed.
     */
    @Bean
    public HttpClient proxyHttpClient(GatewayProperties properties, ExecutorService proxyExecutor) {
        log.info("Proxy timeout {}, connect timeout {}", properties.getProxy().getTimeout(),
                properties.getProxy().getConnectTimeout());
        return HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(properties.getProxy().getConnectTimeout())
                .followRedirects(HttpClient.Redirect.NEVER)
                .executor(proxyExecutor)
                .build();
    }
}
