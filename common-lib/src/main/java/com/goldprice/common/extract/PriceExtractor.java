package com.goldprice.common.extract;

import com.goldprice.common.model.ExtractionResult;
import com.goldprice.common.model.PriceSource;

/**
 * Strategy interface: one implementation per {@link PriceSource}, each knowing
 * the document shape of its site.
 *
 * <p>Implementations never throw on malformed documents. Rows or entries that
 * cannot be read are skipped and the rest of the document is still extracted.
 */
public interface PriceExtractor {

    PriceSource source();

    ExtractionResult extract(String rawDocument);
}
