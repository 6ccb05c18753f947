package com.sandkev.tradewise.ledger;

import com.sandkev.tradewise.instrument.InstrumentNotFoundException;
import com.sandkev.tradewise.instrument.InstrumentWriteLocks;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.sql.Date;
import java.time.LocalDate;
import java.util.List;

@Slf4j
@Repository
@RequiredArgsConstructor
public class JdbcTradeDao implements TradeDao {

    /** Column scale; values are normalised to it before the duplicate check. */
    static final int SCALE = 8;

    private static final String SELECT_TRADE = """
        select t.id, t.instrument_id, i.symbol, t.trade_date, t.side, t.quantity, t.price, t.fees
          from trade t
          join instrument i on i.id = t.instrument_id
    """;

    private final JdbcTemplate jdbc;
    private final InstrumentWriteLocks locks;

    @Override
    public boolean insertIfAbsent(String symbol, LocalDate tradeDate, Side side,
                                  BigDecimal quantity, BigDecimal price, BigDecimal fees) {
        BigDecimal qty = scaled(quantity);
        BigDecimal px = scaled(price);
        BigDecimal fee = fees == null ? BigDecimal.ZERO : scaled(fees);

        return locks.withLock(symbol, () -> {
            Long instrumentId = instrumentId(symbol);
            Integer existing = jdbc.queryForObject("""
                select count(*) from trade
                 where instrument_id = ? and trade_date = ? and side = ? and quantity = ? and price = ?
            """, Integer.class, instrumentId, Date.valueOf(tradeDate), side.name(), qty, px);
            if (existing != null && existing > 0) return false;

            try {
                jdbc.update("""
                    insert into trade (instrument_id, trade_date, side, quantity, price, fees)
                    values (?, ?, ?, ?, ?, ?)
                """, instrumentId, Date.valueOf(tradeDate), side.name(), qty, px, fee);
                return true;
            } catch (DuplicateKeyException e) {
                log.debug("Trade {} {} {}x{} on {} already stored", symbol, side, qty, px, tradeDate);
                return false;
            }
        });
    }

    @Override
    public List<Trade> findAllOrdered() {
        return jdbc.query(SELECT_TRADE + " order by t.trade_date, t.id", TRADE);
    }

    @Override
    public List<Trade> findBySymbol(String symbol) {
        return jdbc.query(SELECT_TRADE + " where i.symbol = ? order by t.trade_date, t.id", TRADE, symbol);
    }

    // ---- helpers ----

    static BigDecimal scaled(BigDecimal x) {
        return x.setScale(SCALE, RoundingMode.HALF_UP);
    }

    private Long instrumentId(String symbol) {
        var ids = jdbc.query("select id from instrument where symbol = ?", (rs, i) -> rs.getLong(1), symbol);
        if (ids.isEmpty()) throw new InstrumentNotFoundException(symbol);
        return ids.get(0);
    }

    private static final RowMapper<Trade> TRADE = (rs, i) -> new Trade(
            rs.getLong("id"),
            rs.getLong("instrument_id"),
            rs.getString("symbol"),
            rs.getDate("trade_date").toLocalDate(),
            Side.valueOf(rs.getString("side")),
            rs.getBigDecimal("quantity"),
            rs.getBigDecimal("price"),
            rs.getBigDecimal("fees")
    );
}
