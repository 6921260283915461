package com.labscheduler.persistence;

import com.labscheduler.exception.InputParseException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * A CSV file read into memory: one header row, then data rows.
 *
 * Fields may be quoted with {@code "}; quoted fields may contain commas, line breaks
 * and doubled quotes. Blank lines are skipped. Row numbers are 1-based file lines of
 * the row start, so the first data row is usually row 2.
 */
public final class CsvTable {

    private final String source;
    private final List<String> header;
    private final List<Row> rows;

    private CsvTable(String source, List<String> header, List<Row> rows) {
        this.source = source;
        this.header = header;
        this.rows = rows;
    }

    public static CsvTable read(Path file) throws IOException {
        try (BufferedReader br = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return parse(br, file.getFileName().toString());
        }
    }

    public static CsvTable parse(String content, String source) {
        try {
            return parse(new StringReader(content), source);
        } catch (IOException e) {
            throw new IllegalStateException("StringReader failed", e);
        }
    }

    public static CsvTable parse(Reader input, String source) throws IOException {
        BufferedReader reader = input instanceof BufferedReader br ? br : new BufferedReader(input);
        List<Row> records = new ArrayList<>();
        List<String> fields = new ArrayList<>();
        StringBuilder field = new StringBuilder();
        boolean inQuotes = false;
        boolean quotedField = false;
        int line = 1;
        int recordStart = 1;
        boolean first = true;

        int c;
        while ((c = reader.read()) != -1) {
            char ch = (char) c;
            if (first) {
                first = false;
                if (ch == '\uFEFF') continue; // BOM
            }
            if (inQuotes) {
                if (ch == '"') {
                    reader.mark(1);
                    int next = reader.read();
                    if (next == '"') {
                        field.append('"');
                    } else {
                        inQuotes = false;
                        if (next != -1) reader.reset();
                    }
                } else {
                    if (ch == '\n') line++;
                    field.append(ch);
                }
                continue;
            }
            switch (ch) {
                case '"':
                    if (field.length() == 0 && !quotedField) {
                        inQuotes = true;
                        quotedField = true;
                    } else {
                        field.append(ch);
                    }
                    break;
                case ',':
                    fields.add(field.toString());
                    field.setLength(0);
                    quotedField = false;
                    break;
                case '\r':
                    break;
                case '\n':
                    fields.add(field.toString());
                    field.setLength(0);
                    quotedField = false;
                    addRecord(records, fields, recordStart);
                    fields = new ArrayList<>();
                    line++;
                    recordStart = line;
                    break;
                default:
                    field.append(ch);
            }
        }
        if (inQuotes) {
            throw new InputParseException("Unterminated quoted field", source, recordStart, null, null);
        }
        if (field.length() > 0 || !fields.isEmpty() || quotedField) {
            fields.add(field.toString());
            addRecord(records, fields, recordStart);
        }

        if (records.isEmpty()) {
            throw new InputParseException("File has no header row", source, null, null, null);
        }
        List<String> header = records.get(0).values.stream().map(String::trim).toList();
        return new CsvTable(source, header, Collections.unmodifiableList(records.subList(1, records.size())));
    }

    private static void addRecord(List<Row> records, List<String> fields, int lineNumber) {
        boolean blank = fields.stream().allMatch(String::isBlank);
        if (!blank) {
            records.add(new Row(lineNumber, List.copyOf(fields)));
        }
    }

    /**
     * Index of the first column whose header equals one of the names, ignoring case.
     *
     * @return the index, or -1 when absent
     */
    public int columnIndex(String... names) {
        for (String name : names) {
            for (int i = 0; i < header.size(); i++) {
                if (header.get(i).toLowerCase(Locale.ROOT).equals(name.toLowerCase(Locale.ROOT))) {
                    return i;
                }
            }
        }
        return -1;
    }

    /**
     * @throws InputParseException naming the expected headers when none is present
     */
    public int requireColumn(String... names) {
        int index = columnIndex(names);
        if (index < 0) {
            throw new InputParseException("Missing column " + String.join(" / ", names), source, 1, null, null);
        }
        return index;
    }

    public String getSource() { return source; }

    public List<String> getHeader() { return header; }

    public List<Row> getRows() { return rows; }

    /** One data row. Missing trailing cells read as empty strings. */
    public static final class Row {
        private final int lineNumber;
        private final List<String> values;

        Row(int lineNumber, List<String> values) {
            this.lineNumber = lineNumber;
            this.values = values;
        }

        public String get(int column) {
            if (column < 0 || column >= values.size()) {
                return "";
            }
            return values.get(column).trim();
        }

        public int getLineNumber() { return lineNumber; }

        public int size() { return values.size(); }
    }
}
