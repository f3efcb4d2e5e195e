package com.covidintel.etl.config;

import com.covidintel.etl.transform.CountryNameNormalizer;
import com.covidintel.etl.transform.HistoricalSeriesAssembler;
import com.covidintel.etl.transform.MetricCalculator;
import com.covidintel.etl.transform.TemporalAnalyzer;
import com.covidintel.etl.validation.CheckRegistry;
import com.covidintel.etl.validation.ConsistencyValidator;
import com.covidintel.etl.validation.QualityScorer;
import com.covidintel.etl.validation.StandardChecks;
import com.covidintel.etl.validation.TableQualityProfiler;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the framework-free transform and validation components.
 */
@Configuration
public class EngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder, CovidEtlProperties properties) {
        Duration timeout = Duration.ofSeconds(properties.getApi().getTimeoutSeconds());
        return builder
                .setConnectTimeout(timeout)
                .setReadTimeout(timeout)
                .build();
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService enrichmentExecutor(CovidEtlProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threads = r -> {
            Thread t = new Thread(r, "enrichment-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return Executors.newFixedThreadPool(Math.max(1, properties.getProcessing().getParallelism()), threads);
    }

    @Bean
    public MetricCalculator metricCalculator(Clock clock) {
        return new MetricCalculator(clock);
    }

    @Bean
    public TemporalAnalyzer temporalAnalyzer(CovidEtlProperties properties) {
        return new TemporalAnalyzer(properties.getTemporal());
    }

    @Bean
    public CountryNameNormalizer countryNameNormalizer() {
        return new CountryNameNormalizer();
    }

    @Bean
    public HistoricalSeriesAssembler historicalSeriesAssembler() {
        return new HistoricalSeriesAssembler();
    }

    @Bean
    public CheckRegistry checkRegistry(CovidEtlProperties properties) {
        return new StandardChecks(properties.getQuality()).build();
    }

    @Bean
    public ConsistencyValidator consistencyValidator(CheckRegistry checkRegistry) {
        return new ConsistencyValidator(checkRegistry);
    }

    @Bean
    public QualityScorer qualityScorer() {
        return new QualityScorer();
    }

    @Bean
    public TableQualityProfiler tableQualityProfiler(CovidEtlProperties properties) {
        return new TableQualityProfiler(properties.getQuality());
    }
}
