package com.enterprise.campaign.analytics.infrastructure;

import com.enterprise.campaign.analytics.domain.CampaignSnapshot;
import com.enterprise.campaign.analytics.domain.Influencer;
import com.enterprise.campaign.analytics.domain.PayoutRecord;
import com.enterprise.campaign.analytics.domain.Post;
import com.enterprise.campaign.analytics.domain.TrackingRecord;
import com.enterprise.campaign.shared.schema.SchemaValidator;
import com.enterprise.campaign.shared.schema.Table;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.function.Function;

import javax.sql.DataSource;

import static com.enterprise.campaign.analytics.domain.InfluencerTable.INFLUENCERS;
import static com.enterprise.campaign.analytics.domain.PayoutTable.PAYOUTS;
import static com.enterprise.campaign.analytics.domain.PostTable.POSTS;
import static com.enterprise.campaign.analytics.domain.TrackingTable.TRACKING;

/**
 * Keeps the campaign tables in a relational database.
 *
 * <p>{@link #save} replaces every table in one transaction, which the
 * template should run apart from any caller transaction. When the
 * database refuses the write the snapshot is kept in memory and
 * {@link #load} serves it until the next successful save.
 */
public class CampaignStore {

    private static final Logger log = LoggerFactory.getLogger(CampaignStore.class);

    private final DataSource dataSource;
    private final NamedParameterJdbcTemplate jdbc;
    private final TransactionTemplate transactions;
    private final SchemaValidator schemaValidator;

    private volatile CampaignSnapshot fallback;

    public CampaignStore(DataSource dataSource, TransactionTemplate transactions,
            SchemaValidator schemaValidator) {
        this.dataSource = dataSource;
        this.jdbc = new NamedParameterJdbcTemplate(dataSource);
        this.transactions = transactions;
        this.schemaValidator = schemaValidator;
    }

    public StoreOutcome save(CampaignSnapshot snapshot) {
        try {
            Integer rows = transactions.execute(status -> {
                deleteAll();
                return insert(INFLUENCERS, snapshot.influencers(), this::influencerParams)
                    + insert(POSTS, snapshot.posts(), this::postParams)
                    + insert(TRACKING, snapshot.tracking(), this::trackingParams)
                    + insert(PAYOUTS, snapshot.payouts(), this::payoutParams);
            });
            fallback = null;
            log.info("Stored {} campaign rows", rows);
            return new StoreOutcome.Persisted(rows == null ? 0 : rows);
        } catch (DataAccessException e) {
            fallback = snapshot;
            log.warn("Database write failed, keeping {} rows in memory: {}",
                snapshot.totalRows(), e.getMessage());
            return new StoreOutcome.InMemoryFallback(e.getMostSpecificCause().getMessage());
        }
    }

    /**
     * The snapshot held in memory after a failed save, otherwise the
     * database contents.
     */
    public CampaignSnapshot load() {
        CampaignSnapshot held = fallback;
        if (held != null) {
            return held;
        }
        return new CampaignSnapshot(
            jdbc.query(INFLUENCERS.selectAll(), CampaignRowMappers.influencerRows()),
            jdbc.query(POSTS.selectAll(), CampaignRowMappers.postRows()),
            jdbc.query(TRACKING.selectAll(), CampaignRowMappers.trackingRows()),
            jdbc.query(PAYOUTS.selectAll(), CampaignRowMappers.payoutRows()));
    }

    public void clear() {
        fallback = null;
        transactions.executeWithoutResult(status -> deleteAll());
    }

    public boolean usingFallback() {
        return fallback != null;
    }

    /** Problems found comparing the table definitions with the database. */
    public List<String> verifySchema() {
        return schemaValidator.validate(dataSource, INFLUENCERS, POSTS, TRACKING, PAYOUTS);
    }

    private void deleteAll() {
        for (Table table : List.of(PAYOUTS, TRACKING, POSTS, INFLUENCERS)) {
            jdbc.getJdbcTemplate().update("DELETE FROM " + table.tableName());
        }
    }

    private <T> int insert(Table table, List<T> rows, Function<T, SqlParameterSource> params) {
        if (rows.isEmpty()) {
            return 0;
        }
        SqlParameterSource[] batch = rows.stream().map(params).toArray(SqlParameterSource[]::new);
        jdbc.batchUpdate(table.insertTemplate(), batch);
        return rows.size();
    }

    private SqlParameterSource influencerParams(Influencer row) {
        return new MapSqlParameterSource()
            .addValue(INFLUENCERS.ID.name(), row.id())
            .addValue(INFLUENCERS.NAME.name(), row.name())
            .addValue(INFLUENCERS.CATEGORY.name(), row.category())
            .addValue(INFLUENCERS.GENDER.name(), row.gender())
            .addValue(INFLUENCERS.FOLLOWER_COUNT.name(), row.followerCount())
            .addValue(INFLUENCERS.PLATFORM.name(), row.platform().label());
    }

    private SqlParameterSource postParams(Post row) {
        return new MapSqlParameterSource()
            .addValue(POSTS.INFLUENCER_ID.name(), row.influencerId())
            .addValue(POSTS.PLATFORM.name(), row.platform().label())
            .addValue(POSTS.DATE.name(), row.date())
            .addValue(POSTS.URL.name(), row.url())
            .addValue(POSTS.CAPTION.name(), row.caption())
            .addValue(POSTS.REACH.name(), row.reach())
            .addValue(POSTS.LIKES.name(), row.likes())
            .addValue(POSTS.COMMENTS.name(), row.comments());
    }

    private SqlParameterSource trackingParams(TrackingRecord row) {
        return new MapSqlParameterSource()
            .addValue(TRACKING.SOURCE.name(), row.source())
            .addValue(TRACKING.CAMPAIGN.name(), row.campaign())
            .addValue(TRACKING.INFLUENCER_ID.name(), row.influencerId())
            .addValue(TRACKING.USER_ID.name(), row.userId())
            .addValue(TRACKING.PRODUCT.name(), row.product())
            .addValue(TRACKING.DATE.name(), row.date())
            .addValue(TRACKING.ORDERS.name(), row.orders())
            .addValue(TRACKING.REVENUE.name(), row.revenue());
    }

    private SqlParameterSource payoutParams(PayoutRecord row) {
        return new MapSqlParameterSource()
            .addValue(PAYOUTS.INFLUENCER_ID.name(), row.influencerId())
            .addValue(PAYOUTS.BASIS.name(), row.basis().code())
            .addValue(PAYOUTS.RATE.name(), row.rate())
            .addValue(PAYOUTS.ORDERS.name(), row.orders())
            .addValue(PAYOUTS.TOTAL_PAYOUT.name(), row.totalPayout());
    }
}
