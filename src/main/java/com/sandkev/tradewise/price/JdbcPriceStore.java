package com.sandkev.tradewise.price;

import com.sandkev.tradewise.instrument.InstrumentNotFoundException;
import com.sandkev.tradewise.instrument.InstrumentWriteLocks;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.*;

@Slf4j
@Repository
@RequiredArgsConstructor
public class JdbcPriceStore implements PriceStore {

    private static final String SELECT_POINT = """
        select i.symbol, p.trade_date,
               p.raw_open, p.raw_high, p.raw_low, p.raw_close,
               p.qfq_open, p.qfq_high, p.qfq_low, p.qfq_close,
               p.hfq_open, p.hfq_high, p.hfq_low, p.hfq_close,
               p.volume
          from price_point p
          join instrument i on i.id = p.instrument_id
    """;

    private final JdbcTemplate jdbc;
    private final InstrumentWriteLocks locks;

    @Override
    public boolean upsert(PricePoint pt) {
        return locks.withLock(pt.symbol(), () -> {
            Long instrumentId = instrumentId(pt.symbol());
            Ohlc q = pt.qfq();
            Ohlc h = pt.hfq();
            Integer existing = jdbc.queryForObject(
                    "select count(*) from price_point where instrument_id = ? and trade_date = ?",
                    Integer.class, instrumentId, Date.valueOf(pt.date()));
            if (existing != null && existing > 0) return false; // never overwrite history

            try {
                jdbc.update("""
                    insert into price_point (instrument_id, trade_date,
                        raw_open, raw_high, raw_low, raw_close,
                        qfq_open, qfq_high, qfq_low, qfq_close,
                        hfq_open, hfq_high, hfq_low, hfq_close,
                        volume)
                    values (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """,
                        instrumentId, Date.valueOf(pt.date()),
                        pt.raw().open(), pt.raw().high(), pt.raw().low(), pt.raw().close(),
                        q == null ? null : q.open(), q == null ? null : q.high(),
                        q == null ? null : q.low(), q == null ? null : q.close(),
                        h == null ? null : h.open(), h == null ? null : h.high(),
                        h == null ? null : h.low(), h == null ? null : h.close(),
                        pt.volume());
                return true;
            } catch (DuplicateKeyException e) {
                log.debug("Price point {}@{} already stored", pt.symbol(), pt.date());
                return false;
            }
        });
    }

    @Override
    public Optional<PricePoint> latestBefore(String symbol, LocalDate date) {
        var rows = jdbc.query(SELECT_POINT + """
             where i.symbol = ? and p.trade_date <= ?
             order by p.trade_date desc
             limit 1
        """, POINT, symbol, Date.valueOf(date));
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    @Override
    public List<LocalDate> datesUnion(LocalDate floor) {
        return jdbc.query("""
            select distinct trade_date from price_point
             where trade_date >= ?
             order by trade_date
        """, (rs, i) -> rs.getDate(1).toLocalDate(), Date.valueOf(floor));
    }

    @Override
    public List<PricePoint> series(String symbol) {
        return jdbc.query(SELECT_POINT + """
             where i.symbol = ?
             order by p.trade_date
        """, POINT, symbol);
    }

    @Override
    public Map<String, List<PricePoint>> seriesFor(Collection<String> symbols) {
        if (symbols == null || symbols.isEmpty()) return Map.of();
        var distinct = new ArrayList<>(new LinkedHashSet<>(symbols));
        String placeholders = String.join(",", Collections.nCopies(distinct.size(), "?"));

        var rows = jdbc.query(SELECT_POINT + " where i.symbol in (" + placeholders + ") order by i.symbol, p.trade_date",
                POINT, distinct.toArray());

        var out = new LinkedHashMap<String, List<PricePoint>>();
        for (String s : distinct) out.put(s, new ArrayList<>());
        for (PricePoint p : rows) out.get(p.symbol()).add(p);
        return out;
    }

    @Override
    public Optional<LocalDate> latestDate(String symbol) {
        var rows = jdbc.query("""
            select max(p.trade_date) from price_point p
              join instrument i on i.id = p.instrument_id
             where i.symbol = ?
        """, (rs, i) -> rs.getDate(1), symbol);
        if (rows.isEmpty() || rows.get(0) == null) return Optional.empty();
        return Optional.of(rows.get(0).toLocalDate());
    }

    // ---- helpers ----

    private Long instrumentId(String symbol) {
        var ids = jdbc.query("select id from instrument where symbol = ?", (rs, i) -> rs.getLong(1), symbol);
        if (ids.isEmpty()) throw new InstrumentNotFoundException(symbol);
        return ids.get(0);
    }

    private static final RowMapper<PricePoint> POINT = (rs, i) -> new PricePoint(
            rs.getString(1),
            rs.getDate(2).toLocalDate(),
            ohlc(rs, 3),
            ohlc(rs, 7),
            ohlc(rs, 11),
            rs.getBigDecimal(15)
    );

    private static Ohlc ohlc(ResultSet rs, int from) throws SQLException {
        BigDecimal close = rs.getBigDecimal(from + 3);
        if (close == null) return null;
        return new Ohlc(rs.getBigDecimal(from), rs.getBigDecimal(from + 1), rs.getBigDecimal(from + 2), close);
    }
}
