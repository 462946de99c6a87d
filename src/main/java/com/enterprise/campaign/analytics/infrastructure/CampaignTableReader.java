package com.enterprise.campaign.analytics.infrastructure;

import com.enterprise.campaign.analytics.domain.CampaignSnapshot;
import com.enterprise.campaign.shared.filebridge.adapter.CsvReaderFactory;
import com.enterprise.campaign.shared.schema.SchemaException;
import com.enterprise.campaign.shared.schema.SchemaValidator;
import com.enterprise.campaign.shared.schema.Table;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.item.file.mapping.FieldSetMapper;
import org.springframework.core.io.Resource;

import java.util.Arrays;
import java.util.List;

import static com.enterprise.campaign.analytics.domain.InfluencerTable.INFLUENCERS;
import static com.enterprise.campaign.analytics.domain.PayoutTable.PAYOUTS;
import static com.enterprise.campaign.analytics.domain.PostTable.POSTS;
import static com.enterprise.campaign.analytics.domain.TrackingTable.TRACKING;

/**
 * Reads the four campaign tables from CSV into a {@link CampaignSnapshot}.
 *
 * <p>Each header is checked against its {@link Table} before any row is read;
 * columns may appear in any order and extra columns are ignored. A missing
 * file reads as an empty table.
 */
public class CampaignTableReader {

    private static final Logger log = LoggerFactory.getLogger(CampaignTableReader.class);

    private final CsvReaderFactory readerFactory;
    private final SchemaValidator schemaValidator;

    public CampaignTableReader(CsvReaderFactory readerFactory, SchemaValidator schemaValidator) {
        this.readerFactory = readerFactory;
        this.schemaValidator = schemaValidator;
    }

    /**
     * @throws SchemaException when a file lacks a required column
     */
    public CampaignSnapshot read(CampaignInputs inputs) {
        CampaignSnapshot snapshot = new CampaignSnapshot(
            read(INFLUENCERS, inputs.influencers(), CampaignRowMappers.influencerFields()),
            read(POSTS, inputs.posts(), CampaignRowMappers.postFields()),
            read(TRACKING, inputs.tracking(), CampaignRowMappers.trackingFields()),
            read(PAYOUTS, inputs.payouts(), CampaignRowMappers.payoutFields()));
        log.info("Read campaign tables: {} influencers, {} posts, {} tracking rows, {} payouts",
            snapshot.influencers().size(), snapshot.posts().size(),
            snapshot.tracking().size(), snapshot.payouts().size());
        return snapshot;
    }

    <T> List<T> read(Table table, Resource resource, FieldSetMapper<T> mapper) {
        if (resource == null || !resource.exists()) {
            log.warn("No input for table '{}' at {}", table.tableName(),
                resource == null ? "<unset>" : resource.getDescription());
            return List.of();
        }
        String[] header = Arrays.stream(readerFactory.readHeader(resource))
            .map(String::trim)
            .toArray(String[]::new);
        schemaValidator.requireColumns(table, Arrays.asList(header));

        List<T> rows = readerFactory.readAll(
            readerFactory.csvReader(table.tableName() + "Reader", resource, header, mapper));
        log.debug("Table '{}': {} rows from {}", table.tableName(), rows.size(), resource.getDescription());
        return rows;
    }
}
