package com.goldprice.common.store;

import com.goldprice.common.model.CanonicalPriceRecord;

import java.util.List;

/**
 * Hands a run's normalized records to durable storage.
 *
 * <p>Fire-and-forget by contract: implementations MUST return without waiting
 * for the write and MUST NOT throw for storage failures. A failed write is
 * visible only in the logs, so a storage outage degrades to "no history"
 * rather than "no prices". Resubmitting identical records is harmless; the
 * store keeps at most one row per (source, category, weight, publishedAt).
 */
public interface PriceSnapshotRecorder {

    /**
     * @param records the unfiltered normalized set of one run
     */
    void record(List<CanonicalPriceRecord> records);
}
