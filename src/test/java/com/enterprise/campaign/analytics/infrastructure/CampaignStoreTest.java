package com.enterprise.campaign.analytics.infrastructure;

import com.enterprise.campaign.CampaignAnalyticsApplication;
import com.enterprise.campaign.analytics.domain.CampaignSnapshot;
import com.enterprise.campaign.analytics.domain.Influencer;
import com.enterprise.campaign.analytics.domain.PayoutRecord;
import com.enterprise.campaign.analytics.domain.TrackingRecord;
import com.enterprise.campaign.shared.schema.SchemaValidator;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;

import static com.enterprise.campaign.analytics.CampaignFixtures.*;
import static org.assertj.core.api.Assertions.*;

@SpringBootTest(classes = CampaignAnalyticsApplication.class)
class CampaignStoreTest {

    @Autowired private CampaignStore store;

    @AfterEach
    void cleanUp() {
        store.clear();
    }

    @Test
    void schemaMatchesTableDefinitions() {
        assertThat(store.verifySchema()).isEmpty();
    }

    @Test
    void saveThenLoadRoundTripsRows() {
        StoreOutcome outcome = store.save(threeInfluencers());

        assertThat(outcome).isEqualTo(new StoreOutcome.Persisted(13));
        assertThat(outcome.persisted()).isTrue();

        CampaignSnapshot loaded = store.load();
        assertThat(loaded.influencers()).extracting(Influencer::name)
                .containsExactlyInAnyOrder("Asha", "Bilal", "Chen");
        assertThat(loaded.posts()).hasSize(4);
        assertThat(loaded.tracking()).extracting(TrackingRecord::revenue)
                .usingElementComparator(BigDecimal::compareTo)
                .containsExactlyInAnyOrder(new BigDecimal("3000"), new BigDecimal("2000"),
                        new BigDecimal("3000"), new BigDecimal("500"));
        assertThat(loaded.payouts()).extracting(PayoutRecord::influencerId).containsExactlyInAnyOrder(1L, 2L);
    }

    @Test
    void saveReplacesPreviousContents() {
        store.save(threeInfluencers());
        store.save(twoInfluencers());

        CampaignSnapshot loaded = store.load();
        assertThat(loaded.influencers()).hasSize(2);
        assertThat(loaded.tracking()).hasSize(2);
        assertThat(loaded.posts()).isEmpty();
        assertThat(loaded.payouts()).isEmpty();
    }

    @Test
    void clearEmptiesTheStore() {
        store.save(threeInfluencers());

        store.clear();

        assertThat(store.load().isEmpty()).isTrue();
    }

    @Test
    void failedWriteFallsBackToMemory() {
        DriverManagerDataSource noTables = new DriverManagerDataSource(
                "jdbc:h2:mem:campaign-no-tables;DB_CLOSE_DELAY=-1", "sa", "");
        CampaignStore broken = new CampaignStore(noTables,
                new TransactionTemplate(new DataSourceTransactionManager(noTables)), new SchemaValidator());
        CampaignSnapshot snapshot = threeInfluencers();

        StoreOutcome outcome = broken.save(snapshot);

        assertThat(outcome).isInstanceOf(StoreOutcome.InMemoryFallback.class);
        assertThat(outcome.persisted()).isFalse();
        assertThat(((StoreOutcome.InMemoryFallback) outcome).reason()).isNotBlank();
        assertThat(broken.usingFallback()).isTrue();
        assertThat(broken.load()).isEqualTo(snapshot);
        assertThat(broken.verifySchema()).hasSize(4)
                .allSatisfy(error -> assertThat(error).contains("not found in database"));
    }
}
