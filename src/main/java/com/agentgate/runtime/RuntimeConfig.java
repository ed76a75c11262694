package com.agentgate.runtime;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;

@Configuration
public class RuntimeConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Shared client for every instance's loopback API. Pinned to HTTP/1.1 so the
     * event stream is not subject to an h2c upgrade attempt.
     */
    @Bean
    public HttpClient runtimeHttpClient() {
        return HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Bean(destroyMethod = "shutdown")
    public ProcessRuntimeLauncher processRuntimeLauncher(RuntimeProperties properties,
                                                         HttpClient runtimeHttpClient,
                                                         ObjectMapper objectMapper) {
        return new ProcessRuntimeLauncher(properties, runtimeHttpClient, objectMapper);
    }
}
