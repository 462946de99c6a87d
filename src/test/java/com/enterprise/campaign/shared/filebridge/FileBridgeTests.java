package com.enterprise.campaign.shared.filebridge;

import com.enterprise.campaign.shared.filebridge.adapter.CsvReaderFactory;
import com.enterprise.campaign.shared.filebridge.adapter.CsvWriterFactory;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.batch.item.Chunk;
import org.springframework.batch.item.ExecutionContext;
import org.springframework.batch.item.ItemStreamException;
import org.springframework.batch.item.file.FlatFileItemReader;
import org.springframework.batch.item.file.FlatFileItemWriter;
import org.springframework.core.io.FileSystemResource;

import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link CsvWriterFactory} and {@link CsvReaderFactory}.
 */
class FileBridgeTests {

    public record ItemRecord(String name, Long quantity, BigDecimal price) {}

    private static Map<String, String> columns() {
        Map<String, String> columns = new LinkedHashMap<>();
        columns.put("name", "product_name");
        columns.put("quantity", "qty");
        columns.put("price", "unit_price");
        return columns;
    }

    // ===================== CsvWriterFactory =====================

    @Test
    void writerHeaderFromColumnMap(@TempDir Path tmp) throws Exception {
        Path file = tmp.resolve("out.csv");
        FlatFileItemWriter<ItemRecord> writer = new CsvWriterFactory().csvWriter("test",
                new FileSystemResource(file), ItemRecord.class, columns());

        writer.open(new ExecutionContext());
        writer.write(chunk(new ItemRecord("Widget", 5L, new BigDecimal("9.99"))));
        writer.close();

        assertThat(Files.readAllLines(file)).containsExactly("product_name,qty,unit_price", "Widget,5,9.99");
    }

    @Test
    void writerBlanksNullsAndAvoidsExponents(@TempDir Path tmp) throws Exception {
        Path file = tmp.resolve("out.csv");
        FlatFileItemWriter<ItemRecord> writer = new CsvWriterFactory().csvWriter("test",
                new FileSystemResource(file), ItemRecord.class, columns());

        writer.open(new ExecutionContext());
        writer.write(chunk(new ItemRecord("Gadget", null, new BigDecimal("1E+3"))));
        writer.close();

        assertThat(Files.readAllLines(file).get(1)).isEqualTo("Gadget,,1000");
    }

    @Test
    void writerCustomDelimiter(@TempDir Path tmp) throws Exception {
        Path file = tmp.resolve("out.csv");
        CsvWriterFactory factory = new CsvWriterFactory();
        factory.setDelimiter(";");
        FlatFileItemWriter<ItemRecord> writer = factory.csvWriter("test",
                new FileSystemResource(file), ItemRecord.class, columns());

        writer.open(new ExecutionContext());
        writer.write(chunk(new ItemRecord("A", 10L, BigDecimal.ONE)));
        writer.close();

        assertThat(Files.readAllLines(file)).containsExactly("product_name;qty;unit_price", "A;10;1");
    }

    @Test
    void writerRejectsEmptyColumns() {
        assertThatThrownBy(() -> new CsvWriterFactory().csvWriter("test",
                new FileSystemResource("dummy"), ItemRecord.class, Map.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("columns");
    }

    // ===================== CsvReaderFactory =====================

    @Test
    void headerDrivesFieldNames(@TempDir Path tmp) throws Exception {
        Path file = tmp.resolve("in.csv");
        Files.writeString(file, "price,name,quantity\n2.50,Bolt,4\n1.25,Nut,8\n");
        CsvReaderFactory factory = new CsvReaderFactory();
        FileSystemResource resource = new FileSystemResource(file);

        String[] header = factory.readHeader(resource);
        FlatFileItemReader<ItemRecord> reader = factory.csvReader("test", resource, header,
                fs -> new ItemRecord(fs.readString("name"), fs.readLong("quantity"), fs.readBigDecimal("price")));
        List<ItemRecord> items = factory.readAll(reader);

        assertThat(header).containsExactly("price", "name", "quantity");
        assertThat(items).containsExactly(
                new ItemRecord("Bolt", 4L, new BigDecimal("2.50")),
                new ItemRecord("Nut", 8L, new BigDecimal("1.25")));
    }

    @Test
    void headerOfEmptyFileIsEmpty(@TempDir Path tmp) throws Exception {
        Path file = tmp.resolve("empty.csv");
        Files.writeString(file, "");

        assertThat(new CsvReaderFactory().readHeader(new FileSystemResource(file))).isEmpty();
    }

    @Test
    void quotedValuesKeepTheirCommas(@TempDir Path tmp) throws Exception {
        Path file = tmp.resolve("in.csv");
        Files.writeString(file, "name,quantity,price\n\"Bolt, large\",1,3\n");
        CsvReaderFactory factory = new CsvReaderFactory();
        FileSystemResource resource = new FileSystemResource(file);

        List<ItemRecord> items = factory.readAll(factory.csvReader("test", resource, factory.readHeader(resource),
                fs -> new ItemRecord(fs.readString("name"), fs.readLong("quantity"), fs.readBigDecimal("price"))));

        assertThat(items).extracting(ItemRecord::name).containsExactly("Bolt, large");
    }

    @Test
    void malformedLineFailsTheRead(@TempDir Path tmp) throws Exception {
        Path file = tmp.resolve("in.csv");
        Files.writeString(file, "name,quantity,price\nBolt,not-a-number,3\n");
        CsvReaderFactory factory = new CsvReaderFactory();
        FileSystemResource resource = new FileSystemResource(file);
        FlatFileItemReader<ItemRecord> reader = factory.csvReader("test", resource, factory.readHeader(resource),
                fs -> new ItemRecord(fs.readString("name"), fs.readLong("quantity"), fs.readBigDecimal("price")));

        assertThatThrownBy(() -> factory.readAll(reader)).isInstanceOf(ItemStreamException.class);
    }

    @Test
    void readerRejectsEmptyFieldNames() {
        assertThatThrownBy(() -> new CsvReaderFactory().csvReader("test",
                new FileSystemResource("dummy"), new String[]{}, fs -> fs.readString(0)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("fieldNames");
    }

    @SafeVarargs
    private static <T> Chunk<T> chunk(T... items) {
        return new Chunk<>(List.of(items));
    }
}
