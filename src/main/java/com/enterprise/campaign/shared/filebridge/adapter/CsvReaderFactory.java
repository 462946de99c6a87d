package com.enterprise.campaign.shared.filebridge.adapter;

import org.springframework.batch.item.ExecutionContext;
import org.springframework.batch.item.ItemStreamException;
import org.springframework.batch.item.file.FlatFileItemReader;
import org.springframework.batch.item.file.mapping.DefaultLineMapper;
import org.springframework.batch.item.file.mapping.FieldSetMapper;
import org.springframework.batch.item.file.transform.DelimitedLineTokenizer;
import org.springframework.core.io.Resource;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.List;

/**
 * Factory that creates CSV {@link FlatFileItemReader} instances mapping each
 * line through a {@link FieldSetMapper}.
 *
 * <p>Field names drive tokenization; the first line is skipped by default
 * (header row). When a file's own header decides the column order, read it
 * with {@link #readHeader(Resource)} and pass it back as the field names:
 * <pre>{@code
 * String[] header = factory.readHeader(resource);
 * FlatFileItemReader<Influencer> reader = factory.csvReader("influencers",
 *         resource, header,
 *         fs -> new Influencer(fs.readLong("ID"), fs.readString("name"), ...));
 * List<Influencer> rows = factory.readAll(reader);
 * }</pre>
 */
public class CsvReaderFactory {

    private String delimiter = ",";
    private String encoding = "UTF-8";
    private int linesToSkip = 1;

    /**
     * Creates a CSV reader with a custom {@link FieldSetMapper}.
     *
     * <p>Use this for Java records or types without default constructors.
     *
     * @param <T>        item type
     * @param name       reader name (for restart data and logging)
     * @param resource   input file resource
     * @param fieldNames column names, available via {@code fieldSet.readXxx(name)}
     * @param mapper     maps each tokenized line to a domain object
     * @return configured reader
     */
    public <T> FlatFileItemReader<T> csvReader(
            String name,
            Resource resource,
            String[] fieldNames,
            FieldSetMapper<T> mapper) {

        if (fieldNames == null || fieldNames.length == 0) {
            throw new IllegalArgumentException("fieldNames must not be empty");
        }

        DelimitedLineTokenizer tokenizer = new DelimitedLineTokenizer();
        tokenizer.setDelimiter(delimiter);
        tokenizer.setNames(fieldNames);

        DefaultLineMapper<T> lineMapper = new DefaultLineMapper<>();
        lineMapper.setLineTokenizer(tokenizer);
        lineMapper.setFieldSetMapper(mapper);

        FlatFileItemReader<T> reader = new FlatFileItemReader<>();
        reader.setName(name);
        reader.setResource(resource);
        reader.setEncoding(encoding);
        reader.setLinesToSkip(linesToSkip);
        reader.setLineMapper(lineMapper);
        return reader;
    }

    /**
     * Tokenizes the first line of {@code resource}. An empty file has an
     * empty header.
     *
     * @throws ItemStreamException when the resource cannot be read
     */
    public String[] readHeader(Resource resource) {
        try (BufferedReader in = new BufferedReader(
                new InputStreamReader(resource.getInputStream(), Charset.forName(encoding)))) {
            String line = in.readLine();
            if (line == null || line.isBlank()) {
                return new String[0];
            }
            if (line.startsWith("﻿")) {
                line = line.substring(1);
            }
            DelimitedLineTokenizer tokenizer = new DelimitedLineTokenizer();
            tokenizer.setDelimiter(delimiter);
            return tokenizer.tokenize(line).getValues();
        } catch (IOException e) {
            throw new ItemStreamException("Failed to read header of " + resource.getDescription(), e);
        }
    }

    /**
     * Opens {@code reader}, drains it into a list and closes it.
     */
    public <T> List<T> readAll(FlatFileItemReader<T> reader) {
        List<T> items = new ArrayList<>();
        reader.open(new ExecutionContext());
        try {
            T item;
            while ((item = reader.read()) != null) {
                items.add(item);
            }
        } catch (Exception e) {
            throw new ItemStreamException("Failed to read items", e);
        } finally {
            reader.close();
        }
        return items;
    }

    /** Field delimiter. Default {@code ","}. */
    public void setDelimiter(String delimiter) {
        this.delimiter = delimiter;
    }

    /** File encoding. Default {@code "UTF-8"}. */
    public void setEncoding(String encoding) {
        this.encoding = encoding;
    }

    /** Number of header lines to skip. Default {@code 1}. */
    public void setLinesToSkip(int linesToSkip) {
        this.linesToSkip = linesToSkip;
    }
}
