package com.enterprise.campaign.analytics.infrastructure;

import com.enterprise.campaign.analytics.domain.Influencer;
import com.enterprise.campaign.analytics.domain.PayoutBasis;
import com.enterprise.campaign.analytics.domain.PayoutRecord;
import com.enterprise.campaign.analytics.domain.Platform;
import com.enterprise.campaign.analytics.domain.Post;
import com.enterprise.campaign.analytics.domain.TrackingRecord;

import org.springframework.batch.item.file.mapping.FieldSetMapper;
import org.springframework.jdbc.core.RowMapper;

import java.math.BigDecimal;
import java.sql.Date;
import java.time.LocalDate;

import static com.enterprise.campaign.analytics.domain.InfluencerTable.INFLUENCERS;
import static com.enterprise.campaign.analytics.domain.PayoutTable.PAYOUTS;
import static com.enterprise.campaign.analytics.domain.PostTable.POSTS;
import static com.enterprise.campaign.analytics.domain.TrackingTable.TRACKING;

/**
 * CSV and JDBC mappers for the four campaign tables. CSV values are
 * lenient: blank counts read as zero, dates keep their first ten characters
 * so timestamps are accepted.
 */
final class CampaignRowMappers {

    private CampaignRowMappers() {
    }

    // --- CSV ---

    static FieldSetMapper<Influencer> influencerFields() {
        return fs -> new Influencer(
            id(fs.readString(INFLUENCERS.ID.name())),
            fs.readString(INFLUENCERS.NAME.name()),
            fs.readString(INFLUENCERS.CATEGORY.name()),
            fs.readString(INFLUENCERS.GENDER.name()),
            count(fs.readString(INFLUENCERS.FOLLOWER_COUNT.name())),
            Platform.fromLabel(fs.readString(INFLUENCERS.PLATFORM.name())));
    }

    static FieldSetMapper<Post> postFields() {
        return fs -> new Post(
            id(fs.readString(POSTS.INFLUENCER_ID.name())),
            Platform.fromLabel(fs.readString(POSTS.PLATFORM.name())),
            date(fs.readString(POSTS.DATE.name())),
            fs.readString(POSTS.URL.name()),
            fs.readString(POSTS.CAPTION.name()),
            count(fs.readString(POSTS.REACH.name())),
            count(fs.readString(POSTS.LIKES.name())),
            count(fs.readString(POSTS.COMMENTS.name())));
    }

    static FieldSetMapper<TrackingRecord> trackingFields() {
        return fs -> new TrackingRecord(
            fs.readString(TRACKING.SOURCE.name()),
            fs.readString(TRACKING.CAMPAIGN.name()),
            id(fs.readString(TRACKING.INFLUENCER_ID.name())),
            fs.readString(TRACKING.USER_ID.name()),
            fs.readString(TRACKING.PRODUCT.name()),
            date(fs.readString(TRACKING.DATE.name())),
            count(fs.readString(TRACKING.ORDERS.name())),
            amount(fs.readString(TRACKING.REVENUE.name())));
    }

    static FieldSetMapper<PayoutRecord> payoutFields() {
        return fs -> new PayoutRecord(
            id(fs.readString(PAYOUTS.INFLUENCER_ID.name())),
            PayoutBasis.fromCode(fs.readString(PAYOUTS.BASIS.name())),
            amount(fs.readString(PAYOUTS.RATE.name())),
            count(fs.readString(PAYOUTS.ORDERS.name())),
            amount(fs.readString(PAYOUTS.TOTAL_PAYOUT.name())));
    }

    // --- JDBC ---

    static RowMapper<Influencer> influencerRows() {
        return (rs, rowNum) -> new Influencer(
            rs.getObject(INFLUENCERS.ID.name(), Long.class),
            rs.getString(INFLUENCERS.NAME.name()),
            rs.getString(INFLUENCERS.CATEGORY.name()),
            rs.getString(INFLUENCERS.GENDER.name()),
            rs.getLong(INFLUENCERS.FOLLOWER_COUNT.name()),
            Platform.fromLabel(rs.getString(INFLUENCERS.PLATFORM.name())));
    }

    static RowMapper<Post> postRows() {
        return (rs, rowNum) -> new Post(
            rs.getObject(POSTS.INFLUENCER_ID.name(), Long.class),
            Platform.fromLabel(rs.getString(POSTS.PLATFORM.name())),
            localDate(rs.getDate(POSTS.DATE.name())),
            rs.getString(POSTS.URL.name()),
            rs.getString(POSTS.CAPTION.name()),
            rs.getLong(POSTS.REACH.name()),
            rs.getLong(POSTS.LIKES.name()),
            rs.getLong(POSTS.COMMENTS.name()));
    }

    static RowMapper<TrackingRecord> trackingRows() {
        return (rs, rowNum) -> new TrackingRecord(
            rs.getString(TRACKING.SOURCE.name()),
            rs.getString(TRACKING.CAMPAIGN.name()),
            rs.getObject(TRACKING.INFLUENCER_ID.name(), Long.class),
            rs.getString(TRACKING.USER_ID.name()),
            rs.getString(TRACKING.PRODUCT.name()),
            localDate(rs.getDate(TRACKING.DATE.name())),
            rs.getLong(TRACKING.ORDERS.name()),
            zeroIfNull(rs.getBigDecimal(TRACKING.REVENUE.name())));
    }

    static RowMapper<PayoutRecord> payoutRows() {
        return (rs, rowNum) -> new PayoutRecord(
            rs.getObject(PAYOUTS.INFLUENCER_ID.name(), Long.class),
            PayoutBasis.fromCode(rs.getString(PAYOUTS.BASIS.name())),
            zeroIfNull(rs.getBigDecimal(PAYOUTS.RATE.name())),
            rs.getLong(PAYOUTS.ORDERS.name()),
            zeroIfNull(rs.getBigDecimal(PAYOUTS.TOTAL_PAYOUT.name())));
    }

    // --- value parsing ---

    static Long id(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        return new BigDecimal(raw.trim()).longValueExact();
    }

    static long count(String raw) {
        if (raw == null || raw.isBlank()) {
            return 0L;
        }
        return new BigDecimal(raw.trim()).longValue();
    }

    static BigDecimal amount(String raw) {
        if (raw == null || raw.isBlank()) {
            return BigDecimal.ZERO;
        }
        return new BigDecimal(raw.trim());
    }

    static LocalDate date(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String trimmed = raw.trim();
        return LocalDate.parse(trimmed.length() > 10 ? trimmed.substring(0, 10) : trimmed);
    }

    private static LocalDate localDate(Date date) {
        return date == null ? null : date.toLocalDate();
    }

    private static BigDecimal zeroIfNull(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }
}
