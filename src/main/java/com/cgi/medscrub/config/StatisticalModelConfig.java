package com.cgi.medscrub.config;

import com.cgi.medscrub.api.NamedEntityRecognizer;
import com.cgi.medscrub.service.NERServiceClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread pools of the engine and the entity-recognition client.
 */
@Configuration
public class StatisticalModelConfig {

    /**
     * Pool running one task per chunk during the statistical pass.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService nerExecutor(ScrubberProperties properties) {
        return Executors.newFixedThreadPool(Math.max(1, properties.getStatisticalConcurrency()),
                daemonThreadFactory("ner-chunk-"));
    }

    /**
     * Pool running asynchronous scrub requests.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService scrubExecutor(ScrubberProperties properties) {
        return Executors.newFixedThreadPool(Math.max(1, properties.getWorkerThreads()),
                daemonThreadFactory("scrub-worker-"));
    }

    @Bean
    @ConditionalOnProperty(prefix = "medscrub.ner", name = "service-url")
    public NamedEntityRecognizer nerServiceClient(ScrubberProperties properties) {
        return new NERServiceClient(properties.getNer());
    }

    private static ThreadFactory daemonThreadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
