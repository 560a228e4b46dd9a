package com.goldprice.common.diff;

import com.goldprice.common.model.CanonicalPriceRecord;
import com.goldprice.common.model.PriceSource;
import com.goldprice.common.model.PriceWithDelta;
import com.goldprice.common.model.StoredSnapshot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class DeltaCalculatorTest {

    private static final Instant NOW = Instant.parse("2026-01-28T07:00:00Z");

    private static CanonicalPriceRecord current(long sell, long buy, boolean buyPublished) {
        return new CanonicalPriceRecord(PriceSource.INDOGOLD, "antam", BigDecimal.ONE,
            sell, buy, buyPublished, "28 Januari 2026", NOW);
    }

    private static StoredSnapshot prior(long sell, long buy) {
        return new StoredSnapshot(PriceSource.INDOGOLD, "antam", BigDecimal.ONE,
            sell, buy, true, "27 Januari 2026", NOW.minusSeconds(86_400));
    }

    @Test
    @DisplayName("price rise and fall are signed differences")
    void signedDifferences() {
        PriceWithDelta delta = DeltaCalculator.apply(current(1_005_000, 940_000, true), prior(1_000_000, 950_000));
        assertEquals(5_000L, delta.sellChange());
        assertEquals(-10_000L, delta.buyChange());
    }

    @Test
    @DisplayName("no prior → zero deltas")
    void noPrior() {
        PriceWithDelta delta = DeltaCalculator.apply(current(1_005_000, 940_000, true), null);
        assertEquals(0L, delta.sellChange());
        assertEquals(0L, delta.buyChange());
    }

    @Test
    @DisplayName("buy not published → buyChange 0")
    void buyNotPublished() {
        PriceWithDelta delta = DeltaCalculator.apply(current(1_005_000, 0, false), prior(1_000_000, 950_000));
        assertEquals(5_000L, delta.sellChange());
        assertEquals(0L, delta.buyChange());
    }
}
