package com.enterprise.campaign.analytics.infrastructure;

import com.enterprise.campaign.analytics.application.AnalyticsSettings;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;

/**
 * Binds {@code campaign.analytics.*}, {@code campaign.input.*} and
 * {@code campaign.output.*}.
 */
@ConfigurationProperties(prefix = "campaign")
public class CampaignAnalyticsProperties {

    private final Analytics analytics = new Analytics();
    private final Input input = new Input();
    private final Output output = new Output();

    public Analytics getAnalytics() {
        return analytics;
    }

    public Input getInput() {
        return input;
    }

    public Output getOutput() {
        return output;
    }

    public AnalyticsSettings toSettings() {
        return new AnalyticsSettings(
            analytics.benchmarkRoi,
            analytics.benchmarkRoas,
            analytics.costRatio,
            analytics.topLimit,
            analytics.baselineDays);
    }

    public static class Analytics {

        private BigDecimal benchmarkRoi = AnalyticsSettings.DEFAULT_BENCHMARK_ROI;
        private BigDecimal benchmarkRoas = AnalyticsSettings.DEFAULT_BENCHMARK_ROAS;
        private BigDecimal costRatio = AnalyticsSettings.DEFAULT_COST_RATIO;
        private int topLimit = AnalyticsSettings.DEFAULT_TOP_LIMIT;
        private int baselineDays = AnalyticsSettings.DEFAULT_BASELINE_DAYS;
        private int workerThreads = 4;

        public BigDecimal getBenchmarkRoi() {
            return benchmarkRoi;
        }

        public void setBenchmarkRoi(BigDecimal benchmarkRoi) {
            this.benchmarkRoi = benchmarkRoi;
        }

        public BigDecimal getBenchmarkRoas() {
            return benchmarkRoas;
        }

        public void setBenchmarkRoas(BigDecimal benchmarkRoas) {
            this.benchmarkRoas = benchmarkRoas;
        }

        public BigDecimal getCostRatio() {
            return costRatio;
        }

        public void setCostRatio(BigDecimal costRatio) {
            this.costRatio = costRatio;
        }

        public int getTopLimit() {
            return topLimit;
        }

        public void setTopLimit(int topLimit) {
            this.topLimit = topLimit;
        }

        public int getBaselineDays() {
            return baselineDays;
        }

        public void setBaselineDays(int baselineDays) {
            this.baselineDays = baselineDays;
        }

        /** Threads for computing report sections in parallel. */
        public int getWorkerThreads() {
            return workerThreads;
        }

        public void setWorkerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
        }
    }

    public static class Input {

        private String influencers = "file:input/influencers.csv";
        private String posts = "file:input/posts.csv";
        private String tracking = "file:input/tracking_data.csv";
        private String payouts = "file:input/payouts.csv";

        public String getInfluencers() {
            return influencers;
        }

        public void setInfluencers(String influencers) {
            this.influencers = influencers;
        }

        public String getPosts() {
            return posts;
        }

        public void setPosts(String posts) {
            this.posts = posts;
        }

        public String getTracking() {
            return tracking;
        }

        public void setTracking(String tracking) {
            this.tracking = tracking;
        }

        public String getPayouts() {
            return payouts;
        }

        public void setPayouts(String payouts) {
            this.payouts = payouts;
        }
    }

    public static class Output {

        private String dir = "output";

        public String getDir() {
            return dir;
        }

        public void setDir(String dir) {
            this.dir = dir;
        }
    }
}
