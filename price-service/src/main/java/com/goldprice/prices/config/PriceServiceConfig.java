package com.goldprice.prices.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.goldprice.common.extract.AnekalogamExtractor;
import com.goldprice.common.extract.ExtractorRegistry;
import com.goldprice.common.extract.Galeri24Extractor;
import com.goldprice.common.extract.IndogoldExtractor;
import com.goldprice.common.extract.PegadaianExtractor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

@Configuration
public class PriceServiceConfig {

    @Bean
    public ExtractorRegistry extractorRegistry(ObjectMapper objectMapper) {
        return new ExtractorRegistry(List.of(
            new AnekalogamExtractor(),
            new IndogoldExtractor(),
            new PegadaianExtractor(),
            new Galeri24Extractor(objectMapper)
        ));
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
