package com.sandkev.tradewise.ledger;

import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads transaction exports. The first line is a header naming at least
 * {@code date,symbol,type,quantity,price}; {@code fees} is optional and {@code side} may stand
 * in for {@code type}. Column order is free. Short lines are kept as rows with missing
 * fields so the ledger counts them as malformed.
 */
@Component
public class TradeCsvReader {

    private static final List<String> REQUIRED = List.of("date", "symbol", "type", "quantity", "price");

    public List<TradeRow> read(InputStream in) {
        try (BufferedReader br = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String header = br.readLine();
            if (header == null) return List.of();
            Map<String, Integer> cols = columns(header);

            List<TradeRow> out = new ArrayList<>();
            String line;
            while ((line = br.readLine()) != null) {
                if (line.isBlank()) continue;
                List<String> f = splitCsv(line);
                out.add(new TradeRow(
                        field(f, cols.get("date")),
                        field(f, cols.get("symbol")),
                        field(f, cols.get("type")),
                        field(f, cols.get("quantity")),
                        field(f, cols.get("price")),
                        field(f, cols.get("fees"))
                ));
            }
            return out;
        } catch (IOException e) {
            throw new UncheckedIOException("CSV read failed", e);
        }
    }

    // ---- CSV helpers ----

    private static Map<String, Integer> columns(String header) {
        if (header.startsWith("\uFEFF")) header = header.substring(1);
        Map<String, Integer> cols = new HashMap<>();
        List<String> names = splitCsv(header);
        for (int i = 0; i < names.size(); i++) {
            String name = names.get(i).trim().toLowerCase(Locale.ROOT);
            switch (name) {
                case "side" -> cols.putIfAbsent("type", i);
                case "fee" -> cols.putIfAbsent("fees", i);
                default -> cols.putIfAbsent(name, i);
            }
        }
        for (String r : REQUIRED) {
            if (!cols.containsKey(r)) {
                throw new IllegalArgumentException("CSV header is missing column '" + r + "': " + header);
            }
        }
        return cols;
    }

    private static String field(List<String> fields, Integer idx) {
        if (idx == null || idx >= fields.size()) return null;
        String v = fields.get(idx).trim();
        return v.isEmpty() ? null : v;
    }

    static List<String> splitCsv(String line) {
        List<String> out = new ArrayList<>();
        StringBuilder cur = new StringBuilder();
        boolean inQuotes = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '"') {
                if (inQuotes && i + 1 < line.length() && line.charAt(i + 1) == '"') {
                    cur.append('"'); i++; // escaped quote
                } else {
                    inQuotes = !inQuotes;
                }
            } else if (c == ',' && !inQuotes) {
                out.add(cur.toString());
                cur.setLength(0);
            } else {
                cur.append(c);
            }
        }
        out.add(cur.toString());
        return out;
    }
}
