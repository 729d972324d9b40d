package com.example.smartcart.storage;

import com.example.smartcart.model.EvaluationReport;
import com.example.smartcart.model.EvaluationRow;
import com.example.smartcart.model.Item;
import com.example.smartcart.model.Recommendation;
import com.example.smartcart.model.TestRow;
import com.example.smartcart.services.OrderParser;
import com.example.smartcart.services.Recommender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.util.*;
import java.util.regex.Pattern;

/** Reads order and test tables, writes the evaluation table. Quoted fields may span lines. */
public class CsvTables {
    private static final Logger log = LoggerFactory.getLogger(CsvTables.class);

    public static class Table {
        public final List<String> header;
        public final List<List<String>> rows;

        public Table(List<String> header, List<List<String>> rows) { this.header = header; this.rows = rows; }

        /** Index of a column by case-insensitive name, or -1. */
        public int indexOf(String column) {
            for (int i = 0; i < header.size(); i++) if (header.get(i).trim().equalsIgnoreCase(column)) return i;
            return -1;
        }

        public int require(String column, String what) throws IOException {
            int idx = indexOf(column);
            if (idx < 0) throw new IOException("Missing required column '" + column + "' in " + what + ". Found: " + header);
            return idx;
        }

        public String cell(List<String> row, int idx) { return idx >= 0 && idx < row.size() ? row.get(idx) : ""; }
    }

    private final OrderParser parser = new OrderParser();

    public Table read(Path file) throws IOException {
        try (Reader r = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return read(r);
        }
    }

    public Table read(Reader in) throws IOException {
        List<List<String>> records = parse(in);
        if (records.isEmpty()) throw new IOException("CSV is empty: expected a header row.");
        List<String> header = records.get(0);
        if (!header.isEmpty()) header.set(0, stripBom(header.get(0)));
        return new Table(header, records.subList(1, records.size()));
    }

    /** Raw order cells from the configured column, one per data row. */
    public List<String> readOrders(Path file, String column) throws IOException {
        Table t = read(file);
        int idx = t.require(column, "orders " + file.getFileName());
        List<String> out = new ArrayList<>(t.rows.size());
        for (List<String> row : t.rows) out.add(t.cell(row, idx));
        log.info("Read {} orders from {}", out.size(), file);
        return out;
    }

    public List<TestRow> readTestRows(Path file, EngineSettings settings) throws IOException {
        try (Reader r = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return readTestRows(r, settings, file.getFileName().toString());
        }
    }

    public List<TestRow> readTestRows(Reader in, EngineSettings settings, String source) throws IOException {
        Table t = read(in);
        int[] cartCols = columns(t, settings.testCartColumns, "test " + source);
        int[] truthCols = columns(t, settings.testTruthColumns, "test " + source);
        int idCol = t.indexOf(settings.testIdColumn);
        Pattern split = Pattern.compile(Pattern.quote(settings.listDelimiter));

        List<TestRow> out = new ArrayList<>(t.rows.size());
        int n = 0;
        for (List<String> row : t.rows) {
            n++;
            if (row.size() == 1 && row.get(0).isBlank()) continue;
            String id = idCol >= 0 ? t.cell(row, idCol).trim() : "";
            if (id.isEmpty()) id = String.valueOf(n);
            out.add(new TestRow(id, cells(t, row, cartCols, split), cells(t, row, truthCols, split)));
        }
        log.info("Read {} test rows from {}", out.size(), source);
        return out;
    }

    private static int[] columns(Table t, List<String> names, String what) throws IOException {
        if (names == null || names.isEmpty()) throw new IOException("No columns configured for " + what + ".");
        int[] idx = new int[names.size()];
        for (int i = 0; i < idx.length; i++) idx[i] = t.require(names.get(i), what);
        return idx;
    }

    private List<String> cells(Table t, List<String> row, int[] cols, Pattern split) {
        List<String> out = new ArrayList<>();
        for (int c : cols) out.addAll(parser.cleanAll(Arrays.asList(split.split(t.cell(row, c)))));
        return out;
    }

    public void writeEvaluation(EvaluationReport report, Path file) throws IOException {
        Path dir = file.toAbsolutePath().getParent();
        if (dir != null && !Files.exists(dir)) Files.createDirectories(dir);
        try (Writer w = new OutputStreamWriter(Files.newOutputStream(file), StandardCharsets.UTF_8)) {
            writeEvaluation(report, w);
        }
        log.info("Wrote {} rows to {}", report.rows.size(), file);
    }

    public void writeEvaluation(EvaluationReport report, Writer w) throws IOException {
        List<String> header = new ArrayList<>(List.of("ROW_ID", "CART"));
        for (int i = 1; i <= Recommender.LIMIT; i++) { header.add("RECOMMENDATION_" + i); header.add("SCORE_" + i); }
        header.addAll(List.of("GROUND_TRUTH", "HITS", "HIT_AT_3"));
        writeRow(w, header);

        for (EvaluationRow r : report.rows) {
            List<String> cells = new ArrayList<>();
            cells.add(r.id);
            List<String> cart = new ArrayList<>();
            for (Item it : r.cart) cart.add(it.name);
            cells.add(String.join("|", cart));
            for (int i = 0; i < Recommender.LIMIT; i++) {
                Recommendation rec = i < r.recommendations.size() ? r.recommendations.get(i) : null;
                cells.add(rec == null ? "" : rec.item.name);
                cells.add(rec == null ? "" : String.format(Locale.ROOT, "%.4f", rec.score));
            }
            cells.add(String.join("|", r.groundTruth));
            List<String> hits = new ArrayList<>();
            for (Boolean h : r.hits) hits.add(h ? "1" : "0");
            cells.add(String.join("|", hits));
            cells.add(r.anyHit() ? "1" : "0");
            writeRow(w, cells);
        }
    }

    private static void writeRow(Writer w, List<String> cells) throws IOException {
        for (int i = 0; i < cells.size(); i++) {
            if (i > 0) w.write(",");
            w.write(escapeCsv(cells.get(i)));
        }
        w.write("\n");
    }

    static String escapeCsv(String s) {
        if (s == null) return "";
        if (s.contains(",") || s.contains("\"") || s.contains("\n") || s.contains("\r")) {
            s = s.replace("\"", "\"\"");
            return "\"" + s + "\"";
        }
        return s;
    }

    /** RFC 4180 records: doubled quotes inside quoted fields, line breaks allowed inside quotes. */
    static List<List<String>> parse(Reader in) throws IOException {
        List<List<String>> records = new ArrayList<>();
        List<String> cur = new ArrayList<>();
        StringBuilder field = new StringBuilder();
        boolean inQuotes = false;
        boolean any = false;
        int c;
        Reader r = in instanceof BufferedReader ? in : new BufferedReader(in);
        while ((c = r.read()) != -1) {
            char ch = (char) c;
            any = true;
            if (inQuotes) {
                if (ch == '"') {
                    r.mark(1);
                    int next = r.read();
                    if (next == '"') field.append('"');
                    else { inQuotes = false; if (next != -1) r.reset(); }
                } else {
                    field.append(ch);
                }
            } else if (ch == '"') {
                inQuotes = true;
            } else if (ch == ',') {
                cur.add(field.toString()); field.setLength(0);
            } else if (ch == '\n' || ch == '\r') {
                if (ch == '\r') {
                    r.mark(1);
                    int next = r.read();
                    if (next != '\n' && next != -1) r.reset();
                }
                cur.add(field.toString()); field.setLength(0);
                records.add(cur);
                cur = new ArrayList<>();
                any = false;
            } else {
                field.append(ch);
            }
        }
        if (inQuotes) log.warn("CSV ended inside a quoted field; keeping the partial value");
        if (any) {
            cur.add(field.toString());
            records.add(cur);
        }
        return records;
    }

    private static String stripBom(String s) {
        return s != null && !s.isEmpty() && s.charAt(0) == '\uFEFF' ? s.substring(1) : s;
    }
}
