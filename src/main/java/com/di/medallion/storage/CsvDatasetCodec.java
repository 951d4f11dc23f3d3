package com.di.medallion.storage;

import com.di.medallion.dataset.Dataset;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.csv.QuoteMode;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * CSV encoding of a {@link Dataset}.
 *
 * <p>The header row is the schema in column order. Non-null values are always
 * quoted and nulls are written as an empty unquoted field, so a null and an
 * empty string survive a round trip as different values. Dates are ISO-8601,
 * decimals plain, booleans {@code true}/{@code false}.
 *
 * <p>Reading returns every non-null value as a {@code String}; consumers re-type
 * with their own schema descriptor.
 */
@Component
public class CsvDatasetCodec {

    private static final CSVFormat WRITE_FORMAT = CSVFormat.DEFAULT.builder()
            .setQuoteMode(QuoteMode.ALL_NON_NULL)
            .setRecordSeparator("\n")
            .build();

    private static final CSVFormat READ_FORMAT = CSVFormat.DEFAULT.builder()
            .setQuoteMode(QuoteMode.ALL_NON_NULL)
            .setNullString("")
            .setHeader()
            .setSkipHeaderRecord(true)
            .build();

    public void write(Dataset dataset, Writer out) throws IOException {
        CSVFormat format = WRITE_FORMAT.builder()
                .setHeader(dataset.getColumns().toArray(new String[0]))
                .build();
        try (CSVPrinter printer = new CSVPrinter(out, format)) {
            for (List<Object> row : dataset.getRows()) {
                List<String> encoded = new ArrayList<>(row.size());
                for (Object value : row) {
                    encoded.add(encode(value));
                }
                printer.printRecord(encoded);
            }
        }
    }

    public Dataset read(Reader in) throws IOException {
        try (CSVParser parser = READ_FORMAT.parse(in)) {
            List<String> columns = new ArrayList<>(parser.getHeaderNames());
            Dataset.Builder builder = Dataset.builder(columns);
            for (CSVRecord record : parser) {
                List<Object> values = new ArrayList<>(columns.size());
                for (int i = 0; i < columns.size(); i++) {
                    values.add(i < record.size() ? record.get(i) : null);
                }
                builder.addRow(values);
            }
            return builder.build();
        }
    }

    static String encode(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof LocalDate) {
            return ((LocalDate) value).format(DateTimeFormatter.ISO_LOCAL_DATE);
        }
        if (value instanceof LocalDateTime) {
            return ((LocalDateTime) value).format(DateTimeFormatter.ISO_LOCAL_DATE_TIME);
        }
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).toPlainString();
        }
        return value.toString();
    }
}
