package com.enterprise.campaign.analytics.infrastructure;

import com.enterprise.campaign.analytics.application.AnalyticsSettings;
import com.enterprise.campaign.analytics.application.CampaignSummarizer;
import com.enterprise.campaign.analytics.application.FilterEngine;
import com.enterprise.campaign.analytics.application.InfluencerProfiler;
import com.enterprise.campaign.analytics.application.InsightAggregator;
import com.enterprise.campaign.analytics.application.MetricsCalculator;
import com.enterprise.campaign.analytics.application.PerformanceRanker;
import com.enterprise.campaign.analytics.application.RecommendationEngine;
import com.enterprise.campaign.analytics.application.TrendAnalyzer;
import com.enterprise.campaign.shared.filebridge.adapter.CsvReaderFactory;
import com.enterprise.campaign.shared.schema.SchemaValidator;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;

/**
 * Analytics engine, table reader and store wiring.
 */
@Configuration
@EnableConfigurationProperties(CampaignAnalyticsProperties.class)
public class CampaignAnalyticsConfig {

    @Bean
    AnalyticsSettings analyticsSettings(CampaignAnalyticsProperties properties) {
        return properties.toSettings();
    }

    @Bean
    ThreadPoolTaskExecutor insightExecutor(CampaignAnalyticsProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getAnalytics().getWorkerThreads());
        executor.setMaxPoolSize(properties.getAnalytics().getWorkerThreads());
        executor.setThreadNamePrefix("insight-");
        return executor;
    }

    @Bean
    FilterEngine filterEngine() {
        return new FilterEngine();
    }

    @Bean
    MetricsCalculator metricsCalculator(AnalyticsSettings settings) {
        return new MetricsCalculator(settings);
    }

    @Bean
    PerformanceRanker performanceRanker(AnalyticsSettings settings) {
        return new PerformanceRanker(settings);
    }

    @Bean
    TrendAnalyzer trendAnalyzer(AnalyticsSettings settings) {
        return new TrendAnalyzer(settings);
    }

    @Bean
    InsightAggregator insightAggregator(AnalyticsSettings settings,
            PerformanceRanker performanceRanker,
            TrendAnalyzer trendAnalyzer,
            ThreadPoolTaskExecutor insightExecutor) {
        return new InsightAggregator(settings, performanceRanker, trendAnalyzer, insightExecutor);
    }

    @Bean
    InfluencerProfiler influencerProfiler() {
        return new InfluencerProfiler();
    }

    @Bean
    CampaignSummarizer campaignSummarizer() {
        return new CampaignSummarizer();
    }

    @Bean
    RecommendationEngine recommendationEngine(AnalyticsSettings settings,
            MetricsCalculator metricsCalculator) {
        return new RecommendationEngine(settings, metricsCalculator);
    }

    @Bean
    CampaignTableReader campaignTableReader(CsvReaderFactory csvReaderFactory,
            SchemaValidator schemaValidator) {
        return new CampaignTableReader(csvReaderFactory, schemaValidator);
    }

    @Bean
    CampaignInputs campaignInputs(CampaignAnalyticsProperties properties,
            ResourceLoader resourceLoader) {
        CampaignAnalyticsProperties.Input input = properties.getInput();
        return new CampaignInputs(
            resourceLoader.getResource(input.getInfluencers()),
            resourceLoader.getResource(input.getPosts()),
            resourceLoader.getResource(input.getTracking()),
            resourceLoader.getResource(input.getPayouts()));
    }

    @Bean
    CampaignStore campaignStore(DataSource dataSource,
            PlatformTransactionManager transactionManager,
            SchemaValidator schemaValidator) {
        // A failed write must not mark the calling step's transaction rollback-only.
        TransactionTemplate transactions = new TransactionTemplate(transactionManager);
        transactions.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        return new CampaignStore(dataSource, transactions, schemaValidator);
    }
}
