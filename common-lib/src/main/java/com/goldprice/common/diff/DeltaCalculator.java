package com.goldprice.common.diff;

import com.goldprice.common.model.CanonicalPriceRecord;
import com.goldprice.common.model.PriceWithDelta;
import com.goldprice.common.model.StoredSnapshot;

/**
 * Per-series arithmetic of the snapshot diff.
 *
 * <p>Changes are {@code current - previous}. With no prior snapshot both are 0.
 * The buy change is also 0 when the current record carries no published buy
 * price: an unpublished price has no movement to report.
 */
public final class DeltaCalculator {

    private DeltaCalculator() {}

    public static PriceWithDelta apply(CanonicalPriceRecord current, StoredSnapshot prior) {
        if (prior == null) {
            return PriceWithDelta.unchanged(current);
        }
        long sellChange = current.sellPrice() - prior.sellPrice();
        long buyChange  = current.buyPublished() ? current.buyPrice() - prior.buyPrice() : 0L;
        return new PriceWithDelta(current, sellChange, buyChange);
    }
}
