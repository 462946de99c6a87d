package com.enterprise.campaign.shared.filebridge.adapter;

import com.enterprise.campaign.shared.schema.SchemaValidator;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Auto-configuration for file-based readers and writers.
 *
 * <p>Provides {@link CsvReaderFactory}, {@link CsvWriterFactory} and the
 * {@link SchemaValidator} used to check CSV headers. Override individual beans
 * to customize (e.g. different delimiter):
 * <pre>{@code
 * @Bean
 * public CsvReaderFactory csvReaderFactory() {
 *     CsvReaderFactory factory = new CsvReaderFactory();
 *     factory.setDelimiter(";");
 *     return factory;
 * }
 * }</pre>
 */
@Configuration
public class FileBridgeConfig {

    @Bean
    public CsvReaderFactory csvReaderFactory() {
        return new CsvReaderFactory();
    }

    @Bean
    public CsvWriterFactory csvWriterFactory() {
        return new CsvWriterFactory();
    }

    @Bean
    public SchemaValidator schemaValidator() {
        return new SchemaValidator();
    }
}
