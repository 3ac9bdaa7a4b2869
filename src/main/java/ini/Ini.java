package ini;

import lombok.Getter;
import lombok.NonNull;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory INI document: sections of key/value pairs plus the lines rejected while parsing.
 * <p>
 * Sections and keys keep insertion order. Keys found before the first header, and keys of an explicit
 * {@code []} section, belong to the section named {@code ""}. Parsing never throws on bad input;
 * malformed headers, lines without a key and redefined keys are collected in {@link #getErrors()}.
 * <p>
 * Instances are not thread-safe.
 */
public class Ini {

    private static final Logger log = LoggerFactory.getLogger(Ini.class);

    public static final char SECTION_START = '[';
    public static final char SECTION_END = ']';
    public static final char ASSIGN = '=';
    public static final char LINE_END = '\n';

    /**
     * Upper bound on global substitution passes run by {@link #interpolate()}.
     */
    public static final int MAX_INTERPOLATION_DEPTH = 10;

    @Getter
    private final Map<String, Map<String, String>> sections = new LinkedHashMap<>();
    @Getter
    private final List<String> errors = new ArrayList<>();

    private final CommentClassifier commentClassifier;

    public Ini() {
        this(CommentClassifier.DEFAULT);
    }

    public Ini(@NonNull CommentClassifier commentClassifier) {
        this.commentClassifier = commentClassifier;
    }

    /**
     * Parses {@code data} line by line. Lines end at {@code '\n'} only; a {@code '\r'} before it is
     * removed as whitespace, elsewhere it stays part of the line.
     */
    public void parse(String data) {
        ParseContext ctx = new ParseContext();
        if (data != null) {
            for (String line : StringUtils.splitPreserveAllTokens(data, LINE_END)) {
                ctx.processRawLine(line);
            }
        }
        ctx.finish();
    }

    /**
     * Parses all lines from {@code reader}, split as in {@link #parse(String)}. The reader is not closed.
     */
    public void parse(@NonNull Reader reader) throws IOException {
        ParseContext ctx = new ParseContext();
        BufferedReader in = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
        StringBuilder line = new StringBuilder();
        int ch;
        while ((ch = in.read()) != -1) {
            if (ch == LINE_END) {
                ctx.processRawLine(line.toString());
                line.setLength(0);
            } else {
                line.append((char) ch);
            }
        }
        if (line.length() > 0) {
            ctx.processRawLine(line.toString());
        }
        ctx.finish();
    }

    /**
     * Replaces {@code ${key}} and {@code ${section:key}} references in all values.
     * See {@link Interpolator} for the exact substitution rules.
     */
    public void interpolate() {
        new Interpolator(sections).interpolate();
    }

    /**
     * Adds each default to every existing section that does not define the key yet.
     */
    public void defaultSection(@NonNull Map<String, String> defaults) {
        for (Map<String, String> section : sections.values()) {
            for (Map.Entry<String, String> entry : defaults.entrySet()) {
                section.putIfAbsent(entry.getKey(), entry.getValue());
            }
        }
    }

    public void clear() {
        sections.clear();
        errors.clear();
    }

    public String generate() {
        StringWriter out = new StringWriter();
        try {
            generate(out);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toString();
    }

    /**
     * Writes every section as a header, its {@code key=value} lines and a blank line.
     * Values are written as is. The writer is not closed.
     */
    public void generate(@NonNull Writer out) throws IOException {
        String ls = System.lineSeparator();
        for (Map.Entry<String, Map<String, String>> sec : sections.entrySet()) {
            out.append(SECTION_START).append(sec.getKey()).append(SECTION_END).append(ls);
            for (Map.Entry<String, String> val : sec.getValue().entrySet()) {
                out.append(val.getKey()).append(ASSIGN).append(val.getValue()).append(ls);
            }
            out.append(ls);
        }
        out.flush();
    }

    public Optional<String> get(String section, String key) {
        Map<String, String> sec = sections.get(section);
        return sec == null ? Optional.empty() : Optional.ofNullable(sec.get(key));
    }

    public <T> Optional<T> get(String section, String key, @NonNull Class<T> type) {
        return get(section, key).flatMap(v -> IniValues.extract(v, type));
    }

    /**
     * Tells whether a trimmed line starting with {@code first} is a comment.
     * Subclasses may override it to recognize other markers.
     */
    protected boolean isComment(char first) {
        return commentClassifier.isComment(first);
    }

    private final class ParseContext {
        String currentSection = "";
        int accepted;
        int rejected;

        void processRawLine(String rawLine) {
            String line = IniText.trim(rawLine);
            if (line.isEmpty()) {
                return;
            }

            char front = line.charAt(0);
            if (isComment(front)) {
                return;
            }
            if (front == SECTION_START) {
                onSectionHeader(line);
                return;
            }
            onDataLine(line);
        }

        void onSectionHeader(String line) {
            if (line.length() > 1 && line.charAt(line.length() - 1) == SECTION_END) {
                currentSection = line.substring(1, line.length() - 1);
                section(currentSection);
            } else {
                reject(line, "unterminated section header");
            }
        }

        void onDataLine(String line) {
            int pos = line.indexOf(ASSIGN);
            if (pos <= 0) {
                reject(line, pos == 0 ? "empty key" : "missing '='");
                return;
            }

            String key = IniText.rtrim(line.substring(0, pos));
            String value = IniText.ltrim(line.substring(pos + 1));
            Map<String, String> sec = section(currentSection);
            if (sec.containsKey(key)) {
                reject(line, "duplicate key");
                return;
            }
            sec.put(key, value);
            accepted++;
        }

        void reject(String line, String reason) {
            errors.add(line);
            rejected++;
            log.debug("Rejected line ({}): {}", reason, line);
        }

        void finish() {
            log.debug("Parsed {} values, rejected {} lines", accepted, rejected);
        }

        private Map<String, String> section(String name) {
            return sections.computeIfAbsent(name, n -> new LinkedHashMap<>());
        }
    }
}
