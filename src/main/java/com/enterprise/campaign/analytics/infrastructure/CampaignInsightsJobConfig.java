package com.enterprise.campaign.analytics.infrastructure;

import com.enterprise.campaign.analytics.application.CampaignSummarizer;
import com.enterprise.campaign.analytics.application.FilterEngine;
import com.enterprise.campaign.analytics.application.InsightAggregator;
import com.enterprise.campaign.analytics.application.MetricsCalculator;
import com.enterprise.campaign.analytics.application.PerformanceRanker;
import com.enterprise.campaign.analytics.application.RecommendationEngine;
import com.enterprise.campaign.analytics.application.TrendAnalyzer;
import com.enterprise.campaign.analytics.domain.CampaignSnapshot;
import com.enterprise.campaign.analytics.domain.DataSummary;
import com.enterprise.campaign.analytics.domain.FilterCriteria;
import com.enterprise.campaign.analytics.domain.InsightReport;
import com.enterprise.campaign.analytics.domain.KpiSummary;
import com.enterprise.campaign.analytics.domain.PerformerRecord;
import com.enterprise.campaign.analytics.domain.PoorPerformerRecord;
import com.enterprise.campaign.analytics.domain.RoiRoasMetrics;
import com.enterprise.campaign.shared.filebridge.adapter.CsvWriterFactory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.core.Job;
import org.springframework.batch.core.Step;
import org.springframework.batch.core.configuration.annotation.JobScope;
import org.springframework.batch.core.configuration.annotation.StepScope;
import org.springframework.batch.core.job.builder.JobBuilder;
import org.springframework.batch.core.repository.JobRepository;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.step.builder.StepBuilder;
import org.springframework.batch.item.ExecutionContext;
import org.springframework.batch.item.file.FlatFileItemWriter;
import org.springframework.batch.item.support.ListItemReader;
import org.springframework.batch.repeat.RepeatStatus;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.FileSystemResource;
import org.springframework.transaction.PlatformTransactionManager;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@code campaignInsightsJob}: load CSV tables into the store, analyze the
 * filtered snapshot, export top and poor performer tables.
 *
 * <p>Optional job parameters: {@code platform}, {@code brand},
 * {@code category}, {@code startDate} and {@code endDate} (ISO dates; the
 * range applies only when both are given).
 */
@Configuration
public class CampaignInsightsJobConfig {

    private static final Logger log = LoggerFactory.getLogger(CampaignInsightsJobConfig.class);

    static final String TOP_PERFORMERS_FILE = "top_performers.csv";
    static final String POOR_PERFORMERS_FILE = "poor_performers.csv";

    // --- JobScope context ---

    @Bean
    @JobScope
    CampaignRunContext campaignRunContext() {
        return new CampaignRunContext();
    }

    // --- Step 1: CSV tables into the store ---

    @Bean
    Step loadTablesStep(JobRepository jobRepository,
            PlatformTransactionManager transactionManager,
            CampaignTableReader campaignTableReader,
            CampaignInputs campaignInputs,
            CampaignStore campaignStore,
            CampaignSummarizer campaignSummarizer) {
        return new StepBuilder("loadTablesStep", jobRepository)
            .tasklet((contribution, chunkContext) -> {
                List<String> schemaProblems = campaignStore.verifySchema();
                if (!schemaProblems.isEmpty()) {
                    log.warn("Store schema problems: {}", schemaProblems);
                }

                CampaignSnapshot snapshot = campaignTableReader.read(campaignInputs);
                StoreOutcome outcome = campaignStore.save(snapshot);

                DataSummary summary = campaignSummarizer.dataSummary(snapshot);
                ExecutionContext ctx = jobContext(chunkContext);
                ctx.putInt("influencerCount", summary.influencerCount());
                ctx.putInt("postCount", summary.postCount());
                ctx.putInt("trackingCount", summary.trackingCount());
                ctx.putInt("payoutCount", summary.payoutCount());
                ctx.putString("storeOutcome", outcome.persisted() ? "PERSISTED" : "IN_MEMORY");
                contribution.incrementWriteCount(snapshot.totalRows());
                return RepeatStatus.FINISHED;
            }, transactionManager)
            .build();
    }

    // --- Step 2: filter and analyze ---

    @Bean
    Step insightStep(JobRepository jobRepository,
            PlatformTransactionManager transactionManager,
            CampaignStore campaignStore,
            FilterEngine filterEngine,
            MetricsCalculator metricsCalculator,
            PerformanceRanker performanceRanker,
            InsightAggregator insightAggregator,
            TrendAnalyzer trendAnalyzer,
            RecommendationEngine recommendationEngine,
            CampaignRunContext campaignRunContext) {
        return new StepBuilder("insightStep", jobRepository)
            .tasklet((contribution, chunkContext) -> {
                FilterCriteria criteria = criteriaFrom(chunkContext.getStepContext().getJobParameters());
                CampaignSnapshot snapshot = filterEngine.apply(campaignStore.load(), criteria);

                RoiRoasMetrics metrics = metricsCalculator.calculateRoiRoas(snapshot);
                KpiSummary kpis = metricsCalculator.summarizeKpis(snapshot);
                BigDecimal incrementalRoas = trendAnalyzer.incrementalRoas(snapshot);
                InsightReport report = insightAggregator.generateInsights(snapshot);
                List<PerformerRecord> top = performanceRanker.topPerformers(snapshot);
                campaignRunContext.setPerformers(top, report.poorPerformers());

                log.info("Campaign insights for {}: revenue {}, ROI {}%, ROAS {}, incremental ROAS {}, {} top / {} poor performers",
                    criteria, metrics.totalRevenue(), metrics.avgRoi(), metrics.avgRoas(),
                    incrementalRoas, top.size(), report.poorPerformers().size());
                log.info("KPIs: {} orders, reach {}, engagement {}",
                    kpis.totalOrders(), kpis.totalReach(), kpis.totalEngagement());
                recommendationEngine.recommend(snapshot).forEach(r -> log.info("Recommendation: {}", r));

                ExecutionContext ctx = jobContext(chunkContext);
                ctx.putString("totalRevenue", metrics.totalRevenue().toPlainString());
                ctx.putString("avgRoi", metrics.avgRoi().toPlainString());
                ctx.putString("avgRoas", metrics.avgRoas().toPlainString());
                ctx.putString("costBasis", metrics.costBasis().name());
                ctx.putString("incrementalRoas", incrementalRoas.toPlainString());
                ctx.putLong("totalOrders", kpis.totalOrders());
                ctx.putLong("totalReach", kpis.totalReach());
                ctx.putLong("totalEngagement", kpis.totalEngagement());
                ctx.putInt("topPerformerCount", top.size());
                ctx.putInt("poorPerformerCount", report.poorPerformers().size());
                return RepeatStatus.FINISHED;
            }, transactionManager)
            .build();
    }

    // --- Step 3: top performers CSV ---

    @Bean
    @StepScope
    ListItemReader<PerformerRecord> topPerformerReader(CampaignRunContext campaignRunContext) {
        return new ListItemReader<>(campaignRunContext.topPerformers());
    }

    @Bean
    @StepScope
    FlatFileItemWriter<PerformerRecord> topPerformerWriter(CsvWriterFactory factory,
            CampaignAnalyticsProperties properties) {
        Map<String, String> columns = new LinkedHashMap<>();
        columns.put("influencerId", "influencer_id");
        columns.put("name", "name");
        columns.put("platform", "platform");
        columns.put("category", "category");
        columns.put("followerCount", "follower_count");
        columns.put("revenue", "revenue");
        columns.put("orders", "orders");
        columns.put("reach", "reach");
        columns.put("likes", "likes");
        columns.put("comments", "comments");
        columns.put("engagementRate", "engagement_rate");
        columns.put("revenuePerFollower", "revenue_per_follower");
        columns.put("ordersPerPost", "orders_per_post");
        return factory.csvWriter("topPerformerWriter",
            outputFile(properties, TOP_PERFORMERS_FILE), PerformerRecord.class, columns);
    }

    @Bean
    Step exportTopPerformersStep(JobRepository jobRepository,
            PlatformTransactionManager transactionManager,
            ListItemReader<PerformerRecord> topPerformerReader,
            FlatFileItemWriter<PerformerRecord> topPerformerWriter) {
        return new StepBuilder("exportTopPerformersStep", jobRepository)
            .<PerformerRecord, PerformerRecord>chunk(10, transactionManager)
            .reader(topPerformerReader)
            .writer(topPerformerWriter)
            .build();
    }

    // --- Step 4: poor performers CSV ---

    @Bean
    @StepScope
    ListItemReader<PoorPerformerRecord> poorPerformerReader(CampaignRunContext campaignRunContext) {
        return new ListItemReader<>(campaignRunContext.poorPerformers());
    }

    @Bean
    @StepScope
    FlatFileItemWriter<PoorPerformerRecord> poorPerformerWriter(CsvWriterFactory factory,
            CampaignAnalyticsProperties properties) {
        Map<String, String> columns = new LinkedHashMap<>();
        columns.put("influencerId", "influencer_id");
        columns.put("name", "name");
        columns.put("platform", "platform");
        columns.put("revenue", "revenue");
        columns.put("orders", "orders");
        columns.put("cost", "cost");
        columns.put("roi", "roi");
        columns.put("reason", "reason");
        return factory.csvWriter("poorPerformerWriter",
            outputFile(properties, POOR_PERFORMERS_FILE), PoorPerformerRecord.class, columns);
    }

    @Bean
    Step exportPoorPerformersStep(JobRepository jobRepository,
            PlatformTransactionManager transactionManager,
            ListItemReader<PoorPerformerRecord> poorPerformerReader,
            FlatFileItemWriter<PoorPerformerRecord> poorPerformerWriter) {
        return new StepBuilder("exportPoorPerformersStep", jobRepository)
            .<PoorPerformerRecord, PoorPerformerRecord>chunk(10, transactionManager)
            .reader(poorPerformerReader)
            .writer(poorPerformerWriter)
            .build();
    }

    @Bean
    Job campaignInsightsJob(JobRepository jobRepository,
            Step loadTablesStep,
            Step insightStep,
            Step exportTopPerformersStep,
            Step exportPoorPerformersStep) {
        return new JobBuilder("campaignInsightsJob", jobRepository)
            .start(loadTablesStep)
            .next(insightStep)
            .next(exportTopPerformersStep)
            .next(exportPoorPerformersStep)
            .build();
    }

    // --- helpers ---

    static FilterCriteria criteriaFrom(Map<String, Object> params) {
        String start = text(params.get("startDate"));
        String end = text(params.get("endDate"));
        List<LocalDate> range = start != null && end != null
            ? List.of(LocalDate.parse(start), LocalDate.parse(end))
            : List.of();
        return FilterCriteria.of(
            text(params.get("platform")),
            text(params.get("brand")),
            text(params.get("category")),
            range);
    }

    private static String text(Object value) {
        return value == null ? null : value.toString();
    }

    private static ExecutionContext jobContext(ChunkContext chunkContext) {
        return chunkContext.getStepContext()
            .getStepExecution()
            .getJobExecution()
            .getExecutionContext();
    }

    private static FileSystemResource outputFile(CampaignAnalyticsProperties properties, String fileName) {
        return new FileSystemResource(Path.of(properties.getOutput().getDir(), fileName));
    }
}
