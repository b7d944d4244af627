package com.elssolution.tanksim.loader;

import com.elssolution.tanksim.domain.Reading;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.*;
import java.util.regex.Pattern;

/**
 * Loads tank history CSVs.
 *
 * Column detection:
 *   - headers are lower-cased, bracketed unit suffixes dropped ("Volume (m³)" → "volume"),
 *     separators removed, then matched against known timestamp / value names;
 *   - otherwise the first header loosely matching date|time resp. value|volume|level|... wins.
 * Rows with an unparsable timestamp or value are skipped, the rest sorted by timestamp.
 */
@Slf4j
@Component
public class CsvSourceLoader implements SourceLoader {

    private static final CsvMapper CSV = CsvMapper.builder()
            .enable(CsvParser.Feature.WRAP_AS_ARRAY)
            .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
            .build();

    private static final List<String> TIME_NAMES  = List.of("timestamp", "datetime", "date", "time", "ts");
    private static final List<String> VALUE_NAMES = List.of("value", "volume", "level", "consumption", "flow", "reading");
    private static final Pattern TIME_LOOSE  = Pattern.compile("date|time|timestamp", Pattern.CASE_INSENSITIVE);
    private static final Pattern VALUE_LOOSE = Pattern.compile("value|volume|level|consum|flow|reading", Pattern.CASE_INSENSITIVE);

    private static final Pattern UNIT_SUFFIX = Pattern.compile("\\(.*?\\)|\\[.*?]");
    private static final Pattern SEPARATORS  = Pattern.compile("[\\s_()\\-\\[\\]/:\\\\]");
    private static final Pattern NOT_NUMERIC = Pattern.compile("[^\\d.\\-eE]");

    private static final List<DateTimeFormatter> DATE_TIMES = formatters(
            "yyyy-M-d H:mm:ss", "yyyy-M-d H:mm",
            "yyyy/M/d H:mm:ss", "yyyy/M/d H:mm",
            "d-M-yyyy H:mm:ss", "d-M-yyyy H:mm",
            "M/d/yyyy H:mm:ss", "M/d/yyyy H:mm");
    private static final List<DateTimeFormatter> DATES = formatters("yyyy-M-d", "d-M-yyyy", "M/d/yyyy");
    private static final List<DateTimeFormatter> TIMES = formatters("H:mm:ss", "H:mm");
    private static final LocalDate TIME_ONLY_DATE = LocalDate.of(1900, 1, 1);

    private final Path baseDir;

    public CsvSourceLoader(@Value("${replay.data.baseDir:data}") String baseDir) {
        this.baseDir = Path.of(baseDir);
    }

    public Path resolve(String ref) {
        Path p = Path.of(ref);
        return p.isAbsolute() ? p : baseDir.resolve(p);
    }

    @Override
    public String sourceId(String ref) {
        String name = Path.of(ref).getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    @Override
    public List<Reading> load(String ref) throws SourceLoadException {
        String id = sourceId(ref);
        Path path = resolve(ref);
        if (!Files.isRegularFile(path)) {
            throw new SourceLoadException(id, "File not found: " + path);
        }

        List<String[]> rows;
        try (Reader in = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             MappingIterator<String[]> it = CSV.readerFor(String[].class).readValues(in)) {
            rows = it.readAll();
        } catch (IOException | RuntimeException e) {
            throw new SourceLoadException(id, "CSV read error: " + e.getMessage(), e);
        }

        if (rows.isEmpty() || rows.get(0).length == 0) {
            throw new SourceLoadException(id, "CSV has no header row");
        }
        String[] headers = rows.get(0);
        if (!headers[0].isEmpty() && headers[0].charAt(0) == '\uFEFF') headers[0] = headers[0].substring(1); // BOM

        int timeCol = findColumn(headers, TIME_NAMES, TIME_LOOSE);
        int valueCol = findColumn(headers, VALUE_NAMES, VALUE_LOOSE);
        if (timeCol < 0 || valueCol < 0 || timeCol == valueCol) {
            throw new SourceLoadException(id, "Missing timestamp/value columns. Headers: " + Arrays.toString(headers));
        }

        List<Reading> out = new ArrayList<>(rows.size());
        int skipped = 0;
        for (int i = 1; i < rows.size(); i++) {
            String[] row = rows.get(i);
            if (row.length <= Math.max(timeCol, valueCol)) { skipped++; continue; }
            Optional<LocalDateTime> ts = parseTimestamp(row[timeCol]);
            OptionalDouble v = parseValue(row[valueCol]);
            if (ts.isEmpty() || v.isEmpty()) { skipped++; continue; }
            out.add(new Reading(ts.get(), v.getAsDouble()));
        }
        if (out.isEmpty()) {
            throw new SourceLoadException(id, "No numeric rows found");
        }
        out.sort(Comparator.naturalOrder());

        log.info("source_loaded id={} rows={} skipped={} timeCol='{}' valueCol='{}'",
                id, out.size(), skipped, headers[timeCol], headers[valueCol]);
        return out;
    }

    // ---- Column detection ----

    static String normalizeHeader(String h) {
        String s = UNIT_SUFFIX.matcher(h.toLowerCase(Locale.ROOT)).replaceAll("");
        return SEPARATORS.matcher(s).replaceAll("");
    }

    private static int findColumn(String[] headers, List<String> names, Pattern loose) {
        Map<String, Integer> normalized = new LinkedHashMap<>();
        for (int i = 0; i < headers.length; i++) {
            if (headers[i] != null && !headers[i].isBlank()) {
                normalized.putIfAbsent(normalizeHeader(headers[i]), i);
            }
        }
        for (String n : names) {
            Integer idx = normalized.get(n);
            if (idx != null) return idx;
        }
        for (int i = 0; i < headers.length; i++) {
            if (headers[i] != null && loose.matcher(headers[i]).find()) return i;
        }
        return -1;
    }

    // ---- Cell parsing ----

    static Optional<LocalDateTime> parseTimestamp(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        String s = raw.trim();
        for (DateTimeFormatter f : DATE_TIMES) {
            try { return Optional.of(LocalDateTime.parse(s, f)); } catch (DateTimeParseException ignore) { /* next pattern */ }
        }
        for (DateTimeFormatter f : DATES) {
            try { return Optional.of(LocalDate.parse(s, f).atStartOfDay()); } catch (DateTimeParseException ignore) { /* next pattern */ }
        }
        for (DateTimeFormatter f : TIMES) {
            try { return Optional.of(LocalTime.parse(s, f).atDate(TIME_ONLY_DATE)); } catch (DateTimeParseException ignore) { /* next pattern */ }
        }
        try {
            return Optional.of(LocalDateTime.parse(s));
        } catch (DateTimeParseException ignore) {
            // may still carry an offset
        }
        try {
            return Optional.of(OffsetDateTime.parse(s).toLocalDateTime());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    static OptionalDouble parseValue(String raw) {
        if (raw == null) return OptionalDouble.empty();
        String s = raw.trim();
        if (s.indexOf(',') >= 0 && s.indexOf('.') < 0) s = s.replace(',', '.'); // decimal comma
        String cleaned = NOT_NUMERIC.matcher(s).replaceAll("");
        if (cleaned.isEmpty()) return OptionalDouble.empty();
        try {
            double v = Double.parseDouble(cleaned);
            return Double.isFinite(v) ? OptionalDouble.of(v) : OptionalDouble.empty();
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
    }

    private static List<DateTimeFormatter> formatters(String... patterns) {
        return Arrays.stream(patterns).map(DateTimeFormatter::ofPattern).toList();
    }
}
