package com.sandkev.tradewise.instrument;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

@Entity
@Table(name = "instrument")
@Getter
@ToString
@NoArgsConstructor(access = AccessLevel.PROTECTED) // for JPA
public class Instrument {

    public static final int MAX_SYMBOL_LENGTH = 32;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = MAX_SYMBOL_LENGTH)
    private String symbol;

    // filled by price sync; import-created instruments start without one
    @Setter
    @Column(length = 128)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private InstrumentCategory category;

    public Instrument(String symbol, String name, InstrumentCategory category) {
        this.symbol = symbol;
        this.name = name;
        this.category = category;
    }

    public boolean hasName() {
        return name != null && !name.isBlank();
    }
}
