package com.neuralroots.orchestrator.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.neuralroots.analysis.stage.FreshnessScorer;
import com.neuralroots.analysis.stage.LogisticsSelector;
import com.neuralroots.analysis.stage.LogisticsSettings;
import com.neuralroots.analysis.stage.MarketPricer;
import com.neuralroots.analysis.stage.MarketSettings;
import com.neuralroots.analysis.stage.WeatherRiskAssessor;
import com.neuralroots.analysis.stage.WeatherSettings;
import com.neuralroots.analysis.synthesis.SynthesisEngine;
import com.neuralroots.common.datastore.DataStore;
import com.neuralroots.orchestrator.datastore.InMemoryDataStore;
import com.neuralroots.orchestrator.datastore.SeedData;
import com.neuralroots.orchestrator.history.HistoryStore;
import com.neuralroots.orchestrator.logger.WorkflowFlowLogger;
import com.neuralroots.orchestrator.service.WorkflowIdGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;

@Configuration
public class OrchestratorConfig {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorConfig.class);

    @Value("${assessment.deadline-ms:2000}")
    private long deadlineMs;

    @Value("${assessment.history.capacity:1000}")
    private int historyCapacity;

    @Value("${assessment.market.bulk-threshold-kg:500}")
    private double bulkThresholdKg;

    @Value("${assessment.market.comparable-window-days:7}")
    private int comparableWindowDays;

    @Value("${assessment.logistics.long-haul-km:500}")
    private double longHaulKm;

    @Value("${assessment.logistics.delivery-window-hours:24}")
    private double deliveryWindowHours;

    @Value("${assessment.logistics.max-ranked-carriers:5}")
    private int maxRankedCarriers;

    @Value("${assessment.weather.transit-speed-kmh:50}")
    private double transitSpeedKmh;

    @Value("${assessment.data-store.seed:classpath:seed-data.json}")
    private String seedLocation;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean
    public Duration stageDeadline() {
        return Duration.ofMillis(deadlineMs);
    }

    @Bean
    public DataStore dataStore(ResourceLoader resourceLoader, ObjectMapper objectMapper, Clock clock) {
        Resource resource = resourceLoader.getResource(seedLocation);
        if (!resource.exists()) {
            log.warn("[DataStore] seed {} not found; starting empty", seedLocation);
            return new InMemoryDataStore(SeedData.empty(), clock);
        }
        try (InputStream in = resource.getInputStream()) {
            return new InMemoryDataStore(objectMapper.readValue(in, SeedData.class), clock);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read data-store seed " + seedLocation, e);
        }
    }

    @Bean
    public FreshnessScorer freshnessScorer() {
        return new FreshnessScorer();
    }

    @Bean
    public MarketPricer marketPricer(DataStore dataStore, Clock clock) {
        return new MarketPricer(dataStore, clock,
            new MarketSettings(bulkThresholdKg, Duration.ofDays(comparableWindowDays)));
    }

    @Bean
    public LogisticsSelector logisticsSelector(DataStore dataStore) {
        return new LogisticsSelector(dataStore,
            new LogisticsSettings(longHaulKm, deliveryWindowHours, maxRankedCarriers));
    }

    @Bean
    public WeatherRiskAssessor weatherRiskAssessor(DataStore dataStore, Clock clock) {
        return new WeatherRiskAssessor(dataStore, clock, new WeatherSettings(transitSpeedKmh));
    }

    @Bean
    public SynthesisEngine synthesisEngine() {
        return new SynthesisEngine();
    }

    @Bean
    public HistoryStore historyStore() {
        return new HistoryStore(historyCapacity);
    }

    @Bean
    public WorkflowIdGenerator workflowIdGenerator(Clock clock) {
        return new WorkflowIdGenerator(clock);
    }

    @Bean
    public WorkflowFlowLogger workflowFlowLogger() {
        return new WorkflowFlowLogger();
    }
}
