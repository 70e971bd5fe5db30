package com.flagship.payments_engine.config;

import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Jackson configuration for the CSV input and output.
 *
 * Key features:
 * - unquoted values are trimmed, so {@code deposit, 1, 1, 1.0} is accepted
 * - rows with more columns than the header are rejected
 */
@Configuration
public class CsvConfig {

    @Bean
    public CsvMapper csvMapper() {
        return CsvMapper.builder()
            .enable(CsvParser.Feature.TRIM_SPACES)
            .disable(CsvParser.Feature.IGNORE_TRAILING_UNMAPPABLE)
            .build();
    }
}
