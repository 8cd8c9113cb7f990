package io.ingest4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.ingest4j.Ingestion;
import io.ingest4j.IngestionContext;
import io.ingest4j.IngestionJob;
import io.ingest4j.core.ConfigurationException;
import io.ingest4j.core.JobRegistry;
import io.ingest4j.history.HistoryDetails;
import io.ingest4j.history.HistoryLedger;
import io.ingest4j.internal.DefaultIngestionContext;
import io.ingest4j.internal.mongo.MongoHistoryLedger;
import io.ingest4j.internal.mongo.MongoNextRunStore;
import io.ingest4j.internal.mongo.MongoVersionedTableStore;
import io.ingest4j.orchestrator.IngestionRunner;
import io.ingest4j.orchestrator.JobOrchestrator;
import io.ingest4j.schedule.CronEvaluator;
import io.ingest4j.schedule.InMemoryNextRunStore;
import io.ingest4j.schedule.NextRunStore;
import io.ingest4j.schedule.QuartzCronEvaluator;
import io.ingest4j.schedule.ScheduleLoader;
import io.ingest4j.schedule.ScheduleStore;
import io.ingest4j.temporal.TemporalUpsertEngine;
import io.ingest4j.temporal.VersionedTableStore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.util.List;

/**
 * Spring Boot auto-configuration entrypoint for ingestion components.
 */
@AutoConfiguration
@ConditionalOnClass({Ingestion.class, MongoTemplate.class})
@EnableConfigurationProperties(IngestionProperties.class)
@ConditionalOnProperty(prefix = "ingest", name = "enabled", havingValue = "true", matchIfMissing = true)
public class IngestionConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock ingestionClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public CronEvaluator cronEvaluator() {
        return new QuartzCronEvaluator();
    }

    @Bean
    @ConditionalOnMissingBean
    public NextRunStore nextRunStore(IngestionProperties props, MongoTemplate mongoTemplate) {
        if (props.isDryRun() || !props.isPersistNextRun()) {
            return new InMemoryNextRunStore();
        }
        return new MongoNextRunStore(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public HistoryLedger historyLedger(MongoTemplate mongoTemplate, Clock clock) {
        return new MongoHistoryLedger(mongoTemplate, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public VersionedTableStore versionedTableStore(MongoTemplate mongoTemplate) {
        return new MongoVersionedTableStore(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public TemporalUpsertEngine temporalUpsertEngine(VersionedTableStore store, Clock clock) {
        return new TemporalUpsertEngine(store, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public HistoryDetails historyDetails(ObjectMapper objectMapper) {
        return new HistoryDetails(objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public IngestionContext ingestionContext(TemporalUpsertEngine engine, HistoryLedger ledger, HistoryDetails details, Clock clock) {
        return new DefaultIngestionContext(engine, ledger, details, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobRegistry jobRegistry(ObjectProvider<List<IngestionJob>> jobsProvider) {
        List<IngestionJob> jobs = jobsProvider.getIfAvailable(List::of);
        return new JobRegistry(jobs);
    }

    @Bean
    @ConditionalOnMissingBean
    public ScheduleStore scheduleStore(IngestionProperties props,
                                       ResourceLoader resourceLoader,
                                       ObjectMapper objectMapper,
                                       ObjectProvider<CronEvaluator> cronEvaluator,
                                       NextRunStore nextRunStore,
                                       Clock clock) {
        Resource resource = resourceLoader.getResource(props.getScheduleFile());
        if (!resource.exists()) {
            throw new ConfigurationException("Schedule file not found: " + props.getScheduleFile());
        }
        ScheduleLoader loader = new ScheduleLoader(objectMapper, cronEvaluator.getIfAvailable(), nextRunStore);
        try (InputStream in = resource.getInputStream()) {
            return loader.load(in, clock.instant());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read schedule file: " + props.getScheduleFile(), e);
        }
    }

    @Bean
    @ConditionalOnMissingBean
    public JobOrchestrator jobOrchestrator(IngestionProperties props,
                                           ScheduleStore scheduleStore,
                                           JobRegistry registry,
                                           HistoryLedger ledger,
                                           HistoryDetails details,
                                           IngestionContext context,
                                           Clock clock) {
        return new JobOrchestrator(scheduleStore, registry, ledger, details, context, clock,
                props.getDispatchMode(), props.getMaxConcurrency());
    }

    @Bean
    @ConditionalOnMissingBean
    public Ingestion ingestion(JobOrchestrator orchestrator, IngestionProperties props, Clock clock) {
        return new IngestionRunner(orchestrator, props.getPollInterval(), props.getShutdownTimeout(), clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public IngestionLifecycle ingestionLifecycle(Ingestion ingestion, IngestionProperties props) {
        return new IngestionLifecycle(ingestion, props);
    }

    @Bean
    @ConditionalOnMissingBean
    public IngestionMongoIndexConfig ingestionMongoIndexConfig(MongoTemplate mongoTemplate) {
        return new IngestionMongoIndexConfig(mongoTemplate);
    }

    @Bean
    @ConditionalOnProperty(prefix = "ingest", name = "ensure-indexes-on-startup", havingValue = "true")
    public SmartInitializingSingleton ingestionIndexesInitializer(IngestionMongoIndexConfig indexConfig) {
        return indexConfig::ensureIndexes;
    }
}
