package com.enterprise.campaign.analytics.application;

import com.enterprise.campaign.analytics.domain.CampaignSnapshot;
import com.enterprise.campaign.analytics.domain.CategoryInsight;
import com.enterprise.campaign.analytics.domain.Influencer;
import com.enterprise.campaign.analytics.domain.InfluencerRoi;
import com.enterprise.campaign.analytics.domain.InsightReport;
import com.enterprise.campaign.analytics.domain.Platform;
import com.enterprise.campaign.analytics.domain.PlatformInsight;
import com.enterprise.campaign.analytics.domain.PoorPerformerRecord;
import com.enterprise.campaign.analytics.domain.Post;
import com.enterprise.campaign.analytics.domain.TopInfluencers;
import com.enterprise.campaign.analytics.domain.TrendReport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Composes every insight over one snapshot: top influencers, platform and
 * category rollups, poor performers and trends.
 *
 * <p>The sub-analyses only read the immutable snapshot, so they are submitted
 * to the configured {@link Executor} independently and joined before the
 * report is returned. The default executor runs them on the calling thread.
 * Each sub-analysis degrades to an empty result when its input is empty.
 *
 * <p>Platform and category rollups use fixed-ratio cost and skip tracking rows
 * whose influencer is unknown.
 */
public class InsightAggregator {

    private static final Logger log = LoggerFactory.getLogger(InsightAggregator.class);

    private final AnalyticsSettings settings;
    private final PerformanceRanker ranker;
    private final TrendAnalyzer trendAnalyzer;
    private final Executor executor;

    public InsightAggregator(AnalyticsSettings settings) {
        this(settings, new PerformanceRanker(settings), new TrendAnalyzer(settings), Runnable::run);
    }

    public InsightAggregator(AnalyticsSettings settings, PerformanceRanker ranker,
                             TrendAnalyzer trendAnalyzer, Executor executor) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.ranker = Objects.requireNonNull(ranker, "ranker");
        this.trendAnalyzer = Objects.requireNonNull(trendAnalyzer, "trendAnalyzer");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    public InsightReport generateInsights(CampaignSnapshot snapshot) {
        CompletableFuture<TopInfluencers> top =
                CompletableFuture.supplyAsync(() -> topInfluencers(snapshot), executor);
        CompletableFuture<List<PlatformInsight>> platforms =
                CompletableFuture.supplyAsync(() -> platformAnalysis(snapshot), executor);
        CompletableFuture<List<CategoryInsight>> categories =
                CompletableFuture.supplyAsync(() -> categoryAnalysis(snapshot), executor);
        CompletableFuture<List<PoorPerformerRecord>> poor =
                CompletableFuture.supplyAsync(() -> ranker.poorPerformers(snapshot), executor);
        CompletableFuture<TrendReport> trends =
                CompletableFuture.supplyAsync(() -> trendAnalyzer.trends(snapshot), executor);

        InsightReport report = new InsightReport(
                await(top), await(platforms), await(categories), await(poor), await(trends));
        log.debug("Insights: {} platforms, {} categories, {} poor performers",
                report.platformAnalysis().size(), report.categoryAnalysis().size(),
                report.poorPerformers().size());
        return report;
    }

    /**
     * Top influencers by revenue and by fixed-ratio ROI, each cut independently.
     * Empty when there is no influencer table to name the rows.
     */
    public TopInfluencers topInfluencers(CampaignSnapshot snapshot) {
        if (snapshot.influencers().isEmpty()) {
            return TopInfluencers.empty();
        }
        List<InfluencerRoi> rows = ranker.influencerReturns(snapshot);
        if (rows.isEmpty()) {
            return TopInfluencers.empty();
        }
        Comparator<InfluencerRoi> byId = Comparator.comparing(InfluencerRoi::influencerId, PerformanceRanker.BY_ID);
        List<InfluencerRoi> byRevenue = rows.stream()
                .sorted(Comparator.comparing(InfluencerRoi::revenue).reversed().thenComparing(byId))
                .limit(settings.topLimit())
                .toList();
        List<InfluencerRoi> byRoi = rows.stream()
                .sorted(Comparator.comparing(InfluencerRoi::roi).reversed().thenComparing(byId))
                .limit(settings.topLimit())
                .toList();
        return new TopInfluencers(byRevenue, byRoi);
    }

    /** One row per platform with attributed revenue, ordered by platform label. */
    public List<PlatformInsight> platformAnalysis(CampaignSnapshot snapshot) {
        if (snapshot.tracking().isEmpty() || snapshot.influencers().isEmpty()) {
            return List.of();
        }
        InfluencerIndex index = new InfluencerIndex(snapshot.influencers());
        Map<Platform, RevenueTotals> revenue = RevenueTotals.groupBy(snapshot.tracking(), row -> {
            Influencer influencer = index.get(row.influencerId());
            return influencer == null ? null : influencer.platform();
        });
        Map<Platform, EngagementTotals> engagement = EngagementTotals.groupBy(snapshot.posts(), Post::platform);
        FixedRatioCost costModel = settings.fixedRatioCost();

        List<PlatformInsight> rows = new ArrayList<>(revenue.size());
        revenue.forEach((platform, totals) -> {
            EngagementTotals posts = engagement.get(platform);
            BigDecimal cost = costModel.costOf(totals.revenue());
            rows.add(new PlatformInsight(
                platform,
                totals.revenue(),
                totals.orders(),
                totals.influencerCount(),
                Ratios.ratioOrZero(totals.revenue(), totals.influencerCount()).setScale(2, RoundingMode.HALF_UP),
                posts == null ? BigDecimal.ZERO : Ratios.engagementRate(posts.engagement(), posts.reach()),
                cost,
                Ratios.roi(totals.revenue(), cost)));
        });
        rows.sort(Comparator.comparing((PlatformInsight row) -> row.platform().label()));
        return rows;
    }

    /**
     * One row per influencer category, ordered by category name. Revenue
     * columns are zero when no tracking row reaches the category.
     *
     * <p>{@code totalPosts} is the category's Post row count.
     * {@code avgRevenuePerPost} is revenue over the category's influencer
     * count, so it stays defined for categories without posts.
     */
    public List<CategoryInsight> categoryAnalysis(CampaignSnapshot snapshot) {
        if (snapshot.influencers().isEmpty()) {
            return List.of();
        }
        InfluencerIndex index = new InfluencerIndex(snapshot.influencers());

        Map<String, List<Influencer>> byCategory = new TreeMap<>();
        for (Influencer influencer : snapshot.influencers()) {
            if (influencer.category() != null) {
                byCategory.computeIfAbsent(influencer.category(), k -> new ArrayList<>()).add(influencer);
            }
        }
        Map<String, RevenueTotals> revenue = RevenueTotals.groupBy(snapshot.tracking(),
                row -> categoryOf(index, row.influencerId()));
        Map<String, EngagementTotals> posts = EngagementTotals.groupBy(snapshot.posts(),
                row -> categoryOf(index, row.influencerId()));
        FixedRatioCost costModel = settings.fixedRatioCost();

        List<CategoryInsight> rows = new ArrayList<>(byCategory.size());
        byCategory.forEach((category, members) -> {
            long followers = members.stream().mapToLong(Influencer::followerCount).sum();
            RevenueTotals totals = revenue.getOrDefault(category, new RevenueTotals());
            EngagementTotals postTotals = posts.get(category);
            long totalPosts = postTotals == null ? 0L : postTotals.posts();
            BigDecimal cost = costModel.costOf(totals.revenue());
            rows.add(new CategoryInsight(
                category,
                members.size(),
                Ratios.ratioOrZero(BigDecimal.valueOf(followers), members.size()).setScale(2, RoundingMode.HALF_UP),
                followers,
                totalPosts,
                totals.revenue(),
                totals.orders(),
                Ratios.ratioOrZero(totals.revenue(), members.size()),
                cost,
                Ratios.roi(totals.revenue(), cost)));
        });
        return rows;
    }

    private static String categoryOf(InfluencerIndex index, Long influencerId) {
        Influencer influencer = index.get(influencerId);
        return influencer == null ? null : influencer.category();
    }

    private static <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }
}
