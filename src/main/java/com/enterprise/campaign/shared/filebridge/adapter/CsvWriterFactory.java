package com.enterprise.campaign.shared.filebridge.adapter;

import org.springframework.batch.item.file.FlatFileHeaderCallback;
import org.springframework.batch.item.file.FlatFileItemWriter;
import org.springframework.batch.item.file.transform.DelimitedLineAggregator;
import org.springframework.batch.item.file.transform.FieldExtractor;
import org.springframework.batch.item.file.transform.RecordFieldExtractor;
import org.springframework.core.io.WritableResource;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Factory that creates CSV {@link FlatFileItemWriter} instances for Java
 * records, extracting values with {@link RecordFieldExtractor}.
 *
 * <p>Map keys are record component names (drive extraction), values are CSV
 * header names:
 * <pre>{@code
 * Map<String, String> columns = new LinkedHashMap<>();
 * columns.put("influencerId", "influencer_id");
 * columns.put("revenue",      "revenue");
 * return factory.csvWriter("topPerformersCsv",
 *         new FileSystemResource("output/top_performers.csv"),
 *         PerformerRecord.class, columns);
 * }</pre>
 *
 * <p>{@code null} components are written as empty fields and decimals in
 * plain notation.
 */
public class CsvWriterFactory {

    private String delimiter = ",";
    private String encoding = "UTF-8";
    private boolean shouldDeleteIfExists = true;

    /**
     * Creates a CSV writer with header derived from a column map.
     *
     * <p>Insertion order determines column order; use
     * {@link java.util.LinkedHashMap} for deterministic ordering.
     *
     * @param <T>        record type
     * @param name       writer name (for restart data and logging)
     * @param resource   output file resource
     * @param recordType record class whose components are extracted
     * @param columns    component name to CSV header name (insertion-ordered)
     * @return configured writer
     */
    public <T> FlatFileItemWriter<T> csvWriter(
            String name,
            WritableResource resource,
            Class<T> recordType,
            Map<String, String> columns) {

        if (columns == null || columns.isEmpty()) {
            throw new IllegalArgumentException("columns must not be empty");
        }
        String[] fieldNames = columns.keySet().toArray(String[]::new);
        String[] headerNames = columns.values().toArray(String[]::new);
        FlatFileHeaderCallback header = w -> w.write(String.join(delimiter, headerNames));

        RecordFieldExtractor<T> extractor = new RecordFieldExtractor<>(recordType);
        extractor.setNames(fieldNames);

        return buildWriter(name, resource, plainValues(extractor), header);
    }

    // ===================== Internal builder =====================

    private <T> FlatFileItemWriter<T> buildWriter(
            String name,
            WritableResource resource,
            FieldExtractor<T> extractor,
            FlatFileHeaderCallback headerCallback) {

        DelimitedLineAggregator<T> aggregator = new DelimitedLineAggregator<>();
        aggregator.setDelimiter(delimiter);
        aggregator.setFieldExtractor(extractor);

        FlatFileItemWriter<T> writer = new FlatFileItemWriter<>();
        writer.setName(name);
        writer.setResource(resource);
        writer.setEncoding(encoding);
        writer.setShouldDeleteIfExists(shouldDeleteIfExists);
        writer.setLineAggregator(aggregator);
        if (headerCallback != null) {
            writer.setHeaderCallback(headerCallback);
        }
        return writer;
    }

    private static <T> FieldExtractor<T> plainValues(FieldExtractor<T> delegate) {
        return item -> {
            Object[] values = delegate.extract(item);
            for (int i = 0; i < values.length; i++) {
                if (values[i] == null) {
                    values[i] = "";
                } else if (values[i] instanceof BigDecimal decimal) {
                    values[i] = decimal.toPlainString();
                }
            }
            return values;
        };
    }

    /** Field delimiter. Default {@code ","}. */
    public void setDelimiter(String delimiter) {
        this.delimiter = delimiter;
    }

    /** File encoding. Default {@code "UTF-8"}. */
    public void setEncoding(String encoding) {
        this.encoding = encoding;
    }

    /** Whether to delete existing file before writing. Default {@code true}. */
    public void setShouldDeleteIfExists(boolean shouldDeleteIfExists) {
        this.shouldDeleteIfExists = shouldDeleteIfExists;
    }
}
