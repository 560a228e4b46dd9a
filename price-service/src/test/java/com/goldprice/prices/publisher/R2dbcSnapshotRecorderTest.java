package com.goldprice.prices.publisher;

import com.goldprice.common.model.CanonicalPriceRecord;
import com.goldprice.common.model.PriceSource;
import com.goldprice.prices.service.PriceHistoryService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class R2dbcSnapshotRecorderTest {

    @Mock
    private PriceHistoryService historyService;

    @InjectMocks
    private R2dbcSnapshotRecorder recorder;

    private final List<CanonicalPriceRecord> records = List.of(
        new CanonicalPriceRecord(PriceSource.INDOGOLD, "antam", BigDecimal.ONE,
            1_950_000, 1_800_000, true, "5 Mei 2025", Instant.parse("2025-05-05T03:00:00Z")));

    @Test
    @DisplayName("subscribes the upsert without blocking the caller")
    void subscribesUpsert() {
        AtomicBoolean subscribed = new AtomicBoolean();
        when(historyService.upsert(records))
            .thenReturn(Mono.fromCallable(() -> { subscribed.set(true); return 1L; }));

        recorder.record(records);

        assertTrue(subscribed.get());
        verify(historyService).upsert(records);
    }

    @Test
    @DisplayName("store failure is logged, not thrown")
    void failureSwallowed() {
        when(historyService.upsert(records)).thenReturn(Mono.error(new IllegalStateException("db down")));

        assertDoesNotThrow(() -> recorder.record(records));
    }

    @Test
    @DisplayName("empty batch → no write")
    void emptyBatch() {
        recorder.record(List.of());
        verifyNoInteractions(historyService);
    }
}
