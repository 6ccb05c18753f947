package com.sandkev.tradewise.instrument;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;
import java.util.Optional;

public interface InstrumentRepository extends JpaRepository<Instrument, Long> {

    Optional<Instrument> findBySymbol(String symbol);

    List<Instrument> findAllByOrderBySymbolAsc();

    // trade rows are written through JdbcTemplate, so this goes native
    @Query(value = """
        select i.* from instrument i
         where exists (select 1 from trade t where t.instrument_id = i.id)
         order by i.symbol
    """, nativeQuery = true)
    List<Instrument> findWithTrades();
}
