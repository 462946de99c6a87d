package com.enterprise.campaign.analytics.infrastructure;

import com.enterprise.campaign.CampaignAnalyticsApplication;
import com.enterprise.campaign.analytics.domain.FilterCriteria;
import com.enterprise.campaign.analytics.domain.Platform;

import org.junit.jupiter.api.Test;
import org.springframework.batch.core.BatchStatus;
import org.springframework.batch.core.JobExecution;
import org.springframework.batch.core.JobParametersBuilder;
import org.springframework.batch.core.StepExecution;
import org.springframework.batch.item.ExecutionContext;
import org.springframework.batch.test.JobLauncherTestUtils;
import org.springframework.batch.test.StepScopeTestExecutionListener;
import org.springframework.batch.test.context.SpringBatchTest;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.TestExecutionListeners;
import org.springframework.test.context.TestPropertySource;

import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * End-to-end run of {@code campaignInsightsJob} over the sample CSV tables.
 *
 * <p>With a cost ratio of 0.5 every influencer returns 100% ROI, below the
 * 200% benchmark, so all three are poor performers. Payouts exist for the
 * tracked influencers, so the headline ROI is payout-based:
 * (8500 - 2000) / 2000 = 325%.
 *
 * <p>A ten-day baseline puts the 2025-01-20 sale in the recent window and the
 * earlier ones in the baseline.
 */
@SpringBatchTest
@TestExecutionListeners(listeners = StepScopeTestExecutionListener.class,
    mergeMode = TestExecutionListeners.MergeMode.MERGE_WITH_DEFAULTS)
@SpringBootTest(classes = CampaignAnalyticsApplication.class)
@TestPropertySource(properties = {
    "campaign.analytics.cost-ratio=0.5",
    "campaign.analytics.baseline-days=10",
    "campaign.output.dir=target/campaign-job-output"
})
class CampaignInsightsJobTest {

    private static final Path OUTPUT = Path.of("target/campaign-job-output");

    @Autowired private JobLauncherTestUtils jobLauncherTestUtils;

    private JobExecution run(JobParametersBuilder params) throws Exception {
        return jobLauncherTestUtils.launchJob(params.addLong("run.id", System.nanoTime()).toJobParameters());
    }

    @Test
    void unfilteredRunAnalyzesAndExports() throws Exception {
        JobExecution execution = run(new JobParametersBuilder());

        assertThat(execution.getStatus()).isEqualTo(BatchStatus.COMPLETED);
        assertThat(execution.getStepExecutions()).extracting(StepExecution::getStepName).containsExactly(
            "loadTablesStep", "insightStep", "exportTopPerformersStep", "exportPoorPerformersStep");

        ExecutionContext ctx = execution.getExecutionContext();
        assertThat(ctx.getInt("influencerCount")).isEqualTo(3);
        assertThat(ctx.getInt("postCount")).isEqualTo(4);
        assertThat(ctx.getInt("trackingCount")).isEqualTo(4);
        assertThat(ctx.getInt("payoutCount")).isEqualTo(2);
        assertThat(ctx.getString("storeOutcome")).isEqualTo("PERSISTED");
        assertThat(ctx.getString("costBasis")).isEqualTo("PAYOUT");
        assertThat(new BigDecimal(ctx.getString("totalRevenue"))).isEqualByComparingTo("8500");
        assertThat(new BigDecimal(ctx.getString("avgRoi"))).isEqualByComparingTo("325");
        assertThat(ctx.getInt("topPerformerCount")).isEqualTo(3);
        assertThat(ctx.getInt("poorPerformerCount")).isEqualTo(3);
        assertThat(ctx.getLong("totalOrders")).isEqualTo(75);
        assertThat(ctx.getLong("totalReach")).isEqualTo(45000);
        assertThat(ctx.getLong("totalEngagement")).isEqualTo(1750);
        // recent mean 2000 is below the baseline mean, so no lift
        assertThat(new BigDecimal(ctx.getString("incrementalRoas"))).isEqualByComparingTo("0");

        List<String> top = Files.readAllLines(OUTPUT.resolve(CampaignInsightsJobConfig.TOP_PERFORMERS_FILE));
        assertThat(top).hasSize(4);
        assertThat(top.get(0)).startsWith("influencer_id,name,platform,category,follower_count,revenue");
        assertThat(top.get(1)).startsWith("1,Asha,Instagram,Fashion,1000,");
        assertThat(top.get(3)).startsWith("3,Chen,Instagram,Fashion,1500,");

        List<String> poor = Files.readAllLines(OUTPUT.resolve(CampaignInsightsJobConfig.POOR_PERFORMERS_FILE));
        assertThat(poor).hasSize(4);
        assertThat(poor.get(0)).isEqualTo("influencer_id,name,platform,revenue,orders,cost,roi,reason");
        assertThat(poor.get(1)).startsWith("1,Asha,Instagram,").endsWith(",Below benchmark ROI");
        assertThat(poor.get(3)).startsWith("3,Chen,Instagram,").endsWith(",Low revenue generation");
    }

    @Test
    void jobParametersNarrowTheAnalysis() throws Exception {
        JobExecution execution = run(new JobParametersBuilder()
            .addString("platform", "Instagram")
            .addString("startDate", "2025-01-06")
            .addString("endDate", "2025-01-31"));

        assertThat(execution.getStatus()).isEqualTo(BatchStatus.COMPLETED);
        ExecutionContext ctx = execution.getExecutionContext();
        // Asha's 2025-01-20 sale (2000) and Chen's (500)
        assertThat(new BigDecimal(ctx.getString("totalRevenue"))).isEqualByComparingTo("2500");
        assertThat(ctx.getInt("topPerformerCount")).isEqualTo(2);
        assertThat(ctx.getLong("totalOrders")).isEqualTo(25);
        // (2000 - 500) / (2000 * 0.5)
        assertThat(new BigDecimal(ctx.getString("incrementalRoas"))).isEqualByComparingTo("1.5");
    }

    @Test
    void loadStepAloneFillsTheStore() {
        JobExecution execution = jobLauncherTestUtils.launchStep("loadTablesStep");

        assertThat(execution.getStatus()).isEqualTo(BatchStatus.COMPLETED);
        StepExecution step = execution.getStepExecutions().iterator().next();
        assertThat(step.getWriteCount()).isEqualTo(13);
        assertThat(execution.getExecutionContext().getString("storeOutcome")).isEqualTo("PERSISTED");
    }

    @Test
    void criteriaFromJobParameters() {
        FilterCriteria criteria = CampaignInsightsJobConfig.criteriaFrom(Map.of(
            "platform", "YouTube",
            "brand", "All",
            "startDate", "2025-01-01"));

        assertThat(criteria.platform()).isEqualTo(Platform.YOUTUBE);
        assertThat(criteria.brand()).isNull();
        assertThat(criteria.dateRange()).isNull();

        FilterCriteria ranged = CampaignInsightsJobConfig.criteriaFrom(Map.of(
            "startDate", LocalDate.of(2025, 1, 1),
            "endDate", LocalDate.of(2025, 1, 31)));
        assertThat(ranged.dateRange().end()).isEqualTo(LocalDate.of(2025, 1, 31));
    }
}
