package com.openforge.agentchat.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Core infrastructure beans:
 *  - agentToolExecutor     → bounded pool that runs tool fan-out
 *  - agentPipelineExecutor → runs WebSocket-initiated queries off the socket thread
 *  - Java HttpClient       → the only HTTP engine for the LLM providers
 *  - Jackson ObjectMapper  → snake_case on the wire, ISO-8601 time, tolerant deserialization
 *  - CORS for the browser front end
 *
 * Pipelines wait on tools, so tools never run on the pipeline pool.
 */
@Configuration
public class AppConfig implements WebMvcConfigurer {

    private final AgentProperties agentProperties;

    public AppConfig(AgentProperties agentProperties) {
        this.agentProperties = agentProperties;
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService agentToolExecutor() {
        return Executors.newFixedThreadPool(
                agentProperties.tools().poolSize(), namedDaemonThreads("agent-tool-"));
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService agentPipelineExecutor() {
        return Executors.newCachedThreadPool(namedDaemonThreads("agent-pipeline-"));
    }

    /**
     * Single, shared HttpClient instance.
     * 30 s connect timeout; per-request read timeouts are set at call site.
     */
    @Bean
    public HttpClient httpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(30))
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    /**
     * Shared ObjectMapper for the LLM wire format and for our own REST/WebSocket payloads:
     *  - snake_case property names (session_id, tools_used, finish_reason …)
     *  - ISO-8601 dates, NOT timestamps
     *  - Unknown properties silently ignored
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/**")
                .allowedOriginPatterns(agentProperties.app().corsOrigins().toArray(String[]::new))
                .allowedMethods("GET", "POST", "PUT", "DELETE", "OPTIONS")
                .allowedHeaders("*")
                .allowCredentials(true);
    }

    private static ThreadFactory namedDaemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
