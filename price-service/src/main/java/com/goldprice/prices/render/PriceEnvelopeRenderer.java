package com.goldprice.prices.render;

import com.goldprice.common.model.CanonicalPriceRecord;
import com.goldprice.common.model.PriceWithDelta;
import com.goldprice.common.model.ScrapeResult;
import com.goldprice.prices.dto.PriceEnvelopeDTO;
import com.goldprice.prices.dto.PriceItemDTO;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class PriceEnvelopeRenderer {

    public PriceEnvelopeDTO render(ScrapeResult result) {
        List<PriceItemDTO> items = result.hasDeltas()
            ? result.deltas().stream().map(PriceEnvelopeRenderer::withChanges).toList()
            : result.records().stream().map(PriceEnvelopeRenderer::plain).toList();
        return new PriceEnvelopeDTO(items, result.meta());
    }

    private static PriceItemDTO plain(CanonicalPriceRecord r) {
        return new PriceItemDTO(r.weight(), PriceItemDTO.UNIT_GRAM, r.sellPrice(), r.buyPrice(),
            r.category(), null, null);
    }

    private static PriceItemDTO withChanges(PriceWithDelta d) {
        CanonicalPriceRecord r = d.record();
        return new PriceItemDTO(r.weight(), PriceItemDTO.UNIT_GRAM, r.sellPrice(), r.buyPrice(),
            r.category(), d.sellChange(), d.buyChange());
    }
}
