package com.spatialnote.backend.service.notebook.extract;

import com.spatialnote.backend.domain.WindowState;
import com.spatialnote.backend.domain.payload.DataFrameData;
import com.spatialnote.backend.service.notebook.generate.PyLiterals;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class DataFrameExtractor extends RegexPayloadExtractor<DataFrameData> {

    private static final Pattern COLUMN_LINE = Pattern.compile(
            "(?m)^\\s*(?:'((?:[^'\\\\]|\\\\.)*)'|\"((?:[^\"\\\\]|\\\\.)*)\")\\s*:\\s*\\[(.*)\\],?\\s*$");
    private static final Pattern INLINE_COLUMN = Pattern.compile(
            "(?:'((?:[^'\\\\]|\\\\.)*)'|\"((?:[^\"\\\\]|\\\\.)*)\")\\s*:\\s*\\[([^\\]]*)\\]");
    private static final Pattern CONVERSION = Pattern.compile(
            "(?m)^df\\['((?:[^'\\\\]|\\\\.)*)'\\] = (pd\\.to_numeric\\(.*\\)\\.astype\\('Int64'\\)|pd\\.to_numeric|pd\\.to_datetime|df\\[.*\\]\\.astype\\('boolean'\\))");
    private static final Pattern DTYPE_COMMENT = Pattern.compile("(?m)^# (.+): (\\S+)$");

    public DataFrameExtractor() {
        super(List.of(
                Rule.of("(?s)data\\s*=\\s*\\{(.*?)\\n\\}", (m, src) -> fromDict(m.group(1), src, COLUMN_LINE)),
                Rule.of("data\\s*=\\s*\\{([^}]+)\\}", (m, src) -> fromDict(m.group(1), src, INLINE_COLUMN)),
                Rule.of("pd\\.DataFrame\\(([^)]+)\\)", (m, src) -> placeholder())
        ));
    }

    @Override
    protected void attach(DataFrameData payload, WindowState target) {
        target.setDataFrameData(payload);
    }

    private static DataFrameData fromDict(String body, String source, Pattern columnPattern) {
        List<String> columns = new ArrayList<>();
        List<List<String>> values = new ArrayList<>();
        Matcher m = columnPattern.matcher(body);
        while (m.find()) {
            String raw = m.group(1) != null ? m.group(1) : m.group(2);
            columns.add(PyLiterals.unescape(raw));
            values.add(cells(m.group(3)));
        }
        if (columns.isEmpty()) return null;

        int rowCount = values.stream().mapToInt(List::size).max().orElse(0);
        List<List<String>> rows = new ArrayList<>(rowCount);
        for (int r = 0; r < rowCount; r++) {
            List<String> row = new ArrayList<>(columns.size());
            for (List<String> col : values) {
                row.add(r < col.size() ? col.get(r) : "");
            }
            rows.add(row);
        }
        return new DataFrameData(columns, rows, dtypes(source));
    }

    // quoted values when there are any, bare tokens otherwise
    private static List<String> cells(String list) {
        List<String> quoted = SourceText.quotedStrings(list);
        if (!quoted.isEmpty()) return quoted;
        List<String> out = new ArrayList<>();
        for (String token : list.split(",")) {
            String t = token.trim();
            if (!t.isEmpty()) out.add(t);
        }
        return out;
    }

    private static Map<String, String> dtypes(String source) {
        Map<String, String> out = new LinkedHashMap<>();
        int section = source.indexOf("# Convert data types");
        if (section < 0) return out;
        String tail = source.substring(section);

        Matcher m = CONVERSION.matcher(tail);
        while (m.find()) {
            String call = m.group(2);
            String type;
            if (call.endsWith("astype('Int64')")) type = "int";
            else if (call.startsWith("pd.to_numeric")) type = "float";
            else if (call.startsWith("pd.to_datetime")) type = "datetime";
            else type = "bool";
            out.put(PyLiterals.unescape(m.group(1)), type);
        }
        Matcher c = DTYPE_COMMENT.matcher(tail);
        while (c.find()) {
            out.putIfAbsent(c.group(1), c.group(2));
        }
        return out;
    }

    private static DataFrameData placeholder() {
        return new DataFrameData(
                List.of("imported_column"),
                List.of(List.of("Data imported from notebook")),
                Map.of("imported_column", "string"));
    }
}
