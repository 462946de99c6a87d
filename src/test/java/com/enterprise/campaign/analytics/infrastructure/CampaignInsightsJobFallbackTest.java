package com.enterprise.campaign.analytics.infrastructure;

import com.enterprise.campaign.CampaignAnalyticsApplication;

import org.junit.jupiter.api.Test;
import org.springframework.batch.core.BatchStatus;
import org.springframework.batch.core.JobExecution;
import org.springframework.batch.core.JobParametersBuilder;
import org.springframework.batch.item.ExecutionContext;
import org.springframework.batch.test.JobLauncherTestUtils;
import org.springframework.batch.test.context.SpringBatchTest;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.TestPropertySource;

import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * {@code campaignInsightsJob} against a database without the campaign tables:
 * the load step keeps the tables in memory and the run still completes.
 */
@SpringBatchTest
@SpringBootTest(classes = CampaignAnalyticsApplication.class)
@TestPropertySource(properties = {
    "spring.datasource.url=jdbc:h2:mem:campaign-no-schema;DB_CLOSE_DELAY=-1",
    "spring.sql.init.mode=never",
    "campaign.output.dir=target/campaign-fallback-output"
})
class CampaignInsightsJobFallbackTest {

    private static final Path OUTPUT = Path.of("target/campaign-fallback-output");

    @Autowired private JobLauncherTestUtils jobLauncherTestUtils;
    @Autowired private CampaignStore campaignStore;

    @Test
    void loadStepCompletesWithTablesHeldInMemory() {
        JobExecution execution = jobLauncherTestUtils.launchStep("loadTablesStep");

        assertThat(execution.getStatus()).isEqualTo(BatchStatus.COMPLETED);
        assertThat(execution.getAllFailureExceptions()).isEmpty();
        assertThat(execution.getExecutionContext().getString("storeOutcome")).isEqualTo("IN_MEMORY");
        assertThat(campaignStore.usingFallback()).isTrue();
        assertThat(campaignStore.verifySchema()).hasSize(4);
    }

    @Test
    void fullRunAnalyzesTheInMemoryTables() throws Exception {
        JobExecution execution = jobLauncherTestUtils.launchJob(new JobParametersBuilder()
            .addLong("run.id", System.nanoTime())
            .toJobParameters());

        assertThat(execution.getStatus()).isEqualTo(BatchStatus.COMPLETED);
        ExecutionContext ctx = execution.getExecutionContext();
        assertThat(ctx.getString("storeOutcome")).isEqualTo("IN_MEMORY");
        assertThat(ctx.getInt("trackingCount")).isEqualTo(4);
        assertThat(new BigDecimal(ctx.getString("totalRevenue"))).isEqualByComparingTo("8500");
        assertThat(ctx.getInt("topPerformerCount")).isEqualTo(3);

        assertThat(Files.readAllLines(OUTPUT.resolve(CampaignInsightsJobConfig.TOP_PERFORMERS_FILE)))
            .hasSize(4);
    }
}
