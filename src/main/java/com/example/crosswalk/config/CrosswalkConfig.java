package com.example.crosswalk.config;

import com.example.crosswalk.model.ClassifierPhrases;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Shared serialization beans and classifier configuration.
 */
@Configuration
public class CrosswalkConfig {

    /**
     * ObjectMapper shared for catalog JSON: ISO timestamps, indented output.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CsvMapper csvMapper() {
        return new CsvMapper();
    }

    /**
     * Phrase sets for the relationship classifier, bound from {@code crosswalk.classifier}.
     */
    @Bean
    public ClassifierPhrases classifierPhrases(CrosswalkProperties properties) {
        if (properties.classifier() == null) {
            return ClassifierPhrases.forRevisions("rev4", "rev5");
        }
        return properties.classifier().toPhrases();
    }
}
