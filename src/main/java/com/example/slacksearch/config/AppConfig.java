package com.example.slacksearch.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class AppConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public WebClient slackWebClient(WebClient.Builder builder,
                                    @Value("${app.slack.base-url:https://slack.com/api}") String baseUrl) {
        return builder.baseUrl(baseUrl).build();
    }

    /** Bounded pool for per-channel and per-hit lookups during a search. */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService searchExecutor(@Value("${app.search.max-threads:16}") int maxThreads) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threads = runnable -> {
            Thread thread = new Thread(runnable, "search-fanout-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(maxThreads, threads);
    }
}
