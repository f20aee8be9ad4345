package gridcast.marketdata.ingest.util;

import gridcast.marketdata.ingest.table.DataTable;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads delimited text (a raw feed dump) into a raw feed table of string cells.
 *
 * Features:
 * - First non-blank line is the header; header names are kept as-is
 *   (case folding is the normalizer's job)
 * - RFC 4180 quoting: quoted fields may contain the delimiter, "" is an escaped quote
 * - Blank cells become null
 * - Short rows are padded with nulls, rows longer than the header are rejected
 *
 * This class is stateless and can be safely used concurrently.
 */
@Slf4j
public class CsvFeedReader {

    private final char delimiter;

    public CsvFeedReader() {
        this(',');
    }

    public CsvFeedReader(char delimiter) {
        this.delimiter = delimiter;
    }

    public DataTable read(InputStream inputStream) throws IOException {
        return read(new InputStreamReader(inputStream, StandardCharsets.UTF_8));
    }

    public DataTable read(String content) throws IOException {
        return read(new StringReader(content));
    }

    /**
     * @param source the delimited text
     * @return table with one column per header field; empty table for empty input
     * @throws IOException if the source cannot be read
     * @throws IllegalArgumentException if a row has more fields than the header
     */
    public DataTable read(Reader source) throws IOException {
        try (BufferedReader reader = new BufferedReader(source)) {
            String headerLine = reader.readLine();
            while (headerLine != null && headerLine.trim().isEmpty()) {
                headerLine = reader.readLine();
            }
            if (headerLine == null) {
                log.warn("Raw feed is empty, returning empty table");
                return DataTable.empty();
            }

            List<String> headers = parseRow(stripBom(headerLine));
            DataTable.Builder builder = DataTable.builder(headers);

            String line;
            long lineNumber = 1;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.trim().isEmpty()) {
                    continue;
                }
                List<String> values = parseRow(line);
                if (values.size() > headers.size()) {
                    throw new IllegalArgumentException(String.format(
                            "Line %d has %d fields but header has %d", lineNumber, values.size(), headers.size()));
                }
                Map<String, Object> row = new LinkedHashMap<>();
                for (int i = 0; i < values.size(); i++) {
                    String value = values.get(i);
                    row.put(headers.get(i), value.isEmpty() ? null : value);
                }
                builder.addRow(row);
            }

            DataTable table = builder.build();
            log.debug("Read raw feed with {} columns and {} rows", headers.size(), table.rowCount());
            return table;
        }
    }

    /**
     * Parse one delimited row handling quoted fields.
     *
     * Examples (comma delimiter):
     *   "2023-01-01,ERCOT,35000" → ["2023-01-01", "ERCOT", "35000"]
     *   "\"HB_NORTH, HUB\",42.1" → ["HB_NORTH, HUB", "42.1"]
     *   "\"say \"\"hi\"\"\"" → ["say \"hi\""]
     */
    public List<String> parseRow(String line) {
        List<String> values = new ArrayList<>();
        boolean inQuotes = false;
        StringBuilder currentValue = new StringBuilder();

        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);

            if (c == '"') {
                if (inQuotes && i + 1 < line.length() && line.charAt(i + 1) == '"') {
                    currentValue.append('"');
                    i++;
                } else {
                    inQuotes = !inQuotes;
                }
            } else if (c == delimiter && !inQuotes) {
                values.add(currentValue.toString().trim());
                currentValue = new StringBuilder();
            } else {
                currentValue.append(c);
            }
        }

        values.add(currentValue.toString().trim());
        return values;
    }

    private static String stripBom(String line) {
        return !line.isEmpty() && line.charAt(0) == '\uFEFF' ? line.substring(1) : line;
    }
}
