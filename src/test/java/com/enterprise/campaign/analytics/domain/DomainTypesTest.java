package com.enterprise.campaign.analytics.domain;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class DomainTypesTest {

    // ===================== PoorPerformanceReason =====================

    @Test
    void lowRevenueWinsOverEveryOtherReason() {
        assertThat(PoorPerformanceReason.classify(new BigDecimal("500"), 5, new BigDecimal("10")))
                .isEqualTo(PoorPerformanceReason.LOW_REVENUE);
    }

    @Test
    void reasonsApplyInPriorityOrder() {
        assertThat(PoorPerformanceReason.classify(new BigDecimal("5000"), 5, new BigDecimal("10")))
                .isEqualTo(PoorPerformanceReason.LOW_CONVERSION);
        assertThat(PoorPerformanceReason.classify(new BigDecimal("5000"), 50, new BigDecimal("10")))
                .isEqualTo(PoorPerformanceReason.VERY_LOW_ROI);
        assertThat(PoorPerformanceReason.classify(new BigDecimal("5000"), 50, new BigDecimal("150")))
                .isEqualTo(PoorPerformanceReason.BELOW_BENCHMARK);
    }

    @Test
    void reasonPrintsItsLabel() {
        assertThat(PoorPerformanceReason.LOW_CONVERSION).hasToString("Low order conversion");
    }

    // ===================== Platform / PayoutBasis =====================

    @Test
    void platformParsesLabelsAndNamesIgnoringCase() {
        assertThat(Platform.fromLabel("YouTube")).isEqualTo(Platform.YOUTUBE);
        assertThat(Platform.fromLabel(" tiktok ")).isEqualTo(Platform.TIKTOK);
        assertThat(Platform.fromLabel("LINKEDIN")).isEqualTo(Platform.LINKEDIN);
        assertThat(Platform.INSTAGRAM).hasToString("Instagram");
    }

    @Test
    void unknownPlatformListsValidLabels() {
        assertThatThrownBy(() -> Platform.fromLabel("MySpace"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("MySpace")
                .hasMessageContaining("Instagram");
    }

    @Test
    void payoutBasisAcceptsOnlyPostOrOrder() {
        assertThat(PayoutBasis.fromCode("Order")).isEqualTo(PayoutBasis.ORDER);
        assertThatThrownBy(() -> PayoutBasis.fromCode("click"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid basis value");
    }

    // ===================== FilterCriteria =====================

    @Test
    void allSelectorsDisableFiltering() {
        assertThat(FilterCriteria.of("All", "all", " ", List.of())).isEqualTo(FilterCriteria.all());
        assertThat(FilterCriteria.of(null, null, null, null)).isEqualTo(FilterCriteria.all());
    }

    @Test
    void dateRangeNeedsExactlyTwoDates() {
        LocalDate day = LocalDate.of(2025, 1, 5);

        assertThat(FilterCriteria.of("All", "All", "All", List.of(day)).dateRange()).isNull();
        assertThat(FilterCriteria.of("All", "All", "All", List.of(day, day, day)).dateRange()).isNull();
        assertThat(FilterCriteria.of("All", "All", "All", List.of(day, day.plusDays(2))).dateRange())
                .isEqualTo(new DateRange(day, day.plusDays(2)));
    }

    @Test
    void selectorsParseIntoCriteria() {
        FilterCriteria criteria = FilterCriteria.of("Instagram", "Glow", "Fashion", List.of());

        assertThat(criteria.platform()).isEqualTo(Platform.INSTAGRAM);
        assertThat(criteria.brand()).isEqualTo("Glow");
        assertThat(criteria.category()).isEqualTo("Fashion");
    }

    // ===================== IsoWeek =====================

    @Test
    void isoWeekCarriesWeekBasedYear() {
        assertThat(IsoWeek.of(LocalDate.of(2019, 12, 30))).isEqualTo(new IsoWeek(2020, 1));
        assertThat(IsoWeek.of(LocalDate.of(2021, 1, 1))).isEqualTo(new IsoWeek(2020, 53));
        assertThat(new IsoWeek(2021, 3)).hasToString("2021-W03");
        assertThat(new IsoWeek(2020, 53)).isLessThan(new IsoWeek(2021, 1));
    }

    @Test
    void snapshotCopiesAndDefaultsItsTables() {
        CampaignSnapshot snapshot = new CampaignSnapshot(null, null, null, null);

        assertThat(snapshot.isEmpty()).isTrue();
        assertThat(snapshot.totalRows()).isZero();
    }
}
