package com.example.csvimport.ingestion.support;

import com.univocity.parsers.csv.CsvParser;
import com.univocity.parsers.csv.CsvParserSettings;
import lombok.extern.slf4j.Slf4j;
import org.apache.camel.dataformat.univocity.UniVocityCsvDataFormat;
import org.springframework.stereotype.Component;

/**
 * Builds single-use univocity parsers for {@code name,email,age} uploads.
 *
 * <p>Header handling is left to the caller: the first row is returned like any other so it can be
 * recognised as a header or treated as data.</p>
 */
@Slf4j
@Component
public class CamelCsvParserFactory extends UniVocityCsvDataFormat {

    // fields grow without a per-column cap; request size is bounded by the multipart limit
    static final int UNBOUNDED_COLUMN_LENGTH = -1;

    public CamelCsvParserFactory() {
        setHeaderExtractionEnabled(false);
        setSkipEmptyLines(true);
        setIgnoreLeadingWhitespaces(true);
        setIgnoreTrailingWhitespaces(true);
        setLineSeparator("\n");
        setLazyLoad(true);
        setAsMap(false);
    }

    public CsvParser newParser() {
        CsvParserSettings settings = createParserSettings();
        configureParserSettings(settings);
        settings.setColumnReorderingEnabled(false);
        settings.setMaxCharsPerColumn(UNBOUNDED_COLUMN_LENGTH);
        settings.setIgnoreLeadingWhitespaces(true);
        settings.setIgnoreTrailingWhitespaces(true);
        settings.setLineSeparatorDetectionEnabled(true);
        settings.setReadInputOnSeparateThread(false);
        settings.getFormat().setDelimiter(',');
        log.debug("Created CsvParser with maxCharsPerColumn={} lazyLoad={}",
            settings.getMaxCharsPerColumn(), isLazyLoad());
        return createParser(settings);
    }
}
