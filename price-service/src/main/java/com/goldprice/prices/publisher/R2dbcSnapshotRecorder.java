package com.goldprice.prices.publisher;

import com.goldprice.common.model.CanonicalPriceRecord;
import com.goldprice.common.store.PriceSnapshotRecorder;
import com.goldprice.prices.service.PriceHistoryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * R2DBC-backed {@link PriceSnapshotRecorder}. The write is subscribed detached
 * (fire-and-forget); the caller's response never waits for it and a failure is
 * only logged.
 */
@Component
public class R2dbcSnapshotRecorder implements PriceSnapshotRecorder {

    private static final Logger log = LoggerFactory.getLogger(R2dbcSnapshotRecorder.class);

    private final PriceHistoryService historyService;

    public R2dbcSnapshotRecorder(PriceHistoryService historyService) {
        this.historyService = historyService;
    }

    @Override
    public void record(List<CanonicalPriceRecord> records) {
        if (records == null || records.isEmpty()) return;
        String source = records.get(0).source().slug();
        String publishedAt = records.get(0).publishedAt();

        historyService.upsert(records)
            .subscribe(
                inserted -> log.info("Snapshot persisted. source={} publishedAt={} submitted={} inserted={}",
                                     source, publishedAt, records.size(), inserted),
                err      -> log.warn("Snapshot persistence failed (non-critical). source={} publishedAt={}",
                                     source, publishedAt, err)
            );
    }
}
