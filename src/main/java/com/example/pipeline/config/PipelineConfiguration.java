package com.example.pipeline.config;

import com.example.pipeline.event.LoggingStatusChangeEventSink;
import com.example.pipeline.event.StatusChangeEventSink;
import com.example.pipeline.event.StatusChangePublisher;
import com.example.pipeline.service.StatusHistoryMigration;
import com.example.pipeline.store.CandidateStore;
import com.example.pipeline.store.InMemoryCandidateStore;
import com.example.pipeline.store.SampleCandidates;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wiring for the pipeline core: clock, candidate store and the asynchronous status change
 * dispatch. All collaborators are handed to services through their constructors.
 */
@Configuration(proxyBeanMethods = false)
@EnableConfigurationProperties(PipelineProperties.class)
public class PipelineConfiguration {

    private static final Logger log = LoggerFactory.getLogger(PipelineConfiguration.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CandidateStore candidateStore(PipelineProperties properties, Clock clock) {
        InMemoryCandidateStore store = new InMemoryCandidateStore(properties.historyLimit());
        if (properties.seedSampleData()) {
            int seeded = SampleCandidates.seed(store, clock);
            log.info("Seeded {} sample candidates", seeded);
        }
        return store;
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService statusEventExecutor(PipelineProperties properties) {
        AtomicInteger seq = new AtomicInteger();
        ThreadFactory threads = r -> {
            Thread t = new Thread(r, "status-event-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return Executors.newFixedThreadPool(properties.eventDispatchThreads(), threads);
    }

    @Bean
    public StatusChangeEventSink auditLogEventSink() {
        return new LoggingStatusChangeEventSink();
    }

    @Bean
    public StatusChangePublisher statusChangePublisher(ExecutorService statusEventExecutor,
                                                       List<StatusChangeEventSink> sinks) {
        return new StatusChangePublisher(statusEventExecutor, sinks);
    }

    @Bean
    @ConditionalOnProperty(prefix = "pipeline", name = "migrate-history-on-startup", havingValue = "true")
    public ApplicationRunner statusHistoryMigrationRunner(StatusHistoryMigration migration) {
        return args -> migration.run();
    }
}
