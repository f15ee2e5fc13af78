package com.example.csvimport.ingestion.service;

import com.example.csvimport.ingestion.support.EncodingException;
import com.example.csvimport.ingestion.support.UnreadableContentException;
import com.univocity.parsers.csv.CsvParser;
import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;

/**
 * Single-pass reader over a UTF-8 CSV stream. Recognises an optional {@code name,email,age} header
 * (in any column order) and yields numbered rows starting at 1 for the first data row.
 */
class CsvRowReader implements Closeable {

    private static final List<String> COLUMNS = List.of("name", "email", "age");
    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private final CsvParser parser;
    private final Reader reader;
    private final int[] columnOrder = { 0, 1, 2 };
    private boolean started;
    private long rowNumber;

    CsvRowReader(CsvParser parser, InputStream input) {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        this.parser = parser;
        this.reader = new BufferedReader(new InputStreamReader(input, decoder));
        parseGuarded(() -> {
            parser.beginParsing(reader);
            return null;
        });
    }

    /**
     * @return the next data row, or {@code null} once the stream is exhausted
     * @throws EncodingException if the bytes are not valid UTF-8
     * @throws UnreadableContentException if the CSV structure cannot be parsed at all
     */
    RawRow next() {
        String[] fields = parseGuarded(parser::parseNext);
        if (!started) {
            started = true;
            stripByteOrderMark(fields);
            if (fields != null && applyHeader(fields)) {
                fields = parseGuarded(parser::parseNext);
            }
        }
        if (fields == null) {
            return null;
        }

        rowNumber++;
        if (fields.length != RawRow.EXPECTED_FIELDS) {
            return RawRow.malformed(rowNumber, fields.length);
        }
        return new RawRow(rowNumber,
                fields[columnOrder[0]],
                fields[columnOrder[1]],
                fields[columnOrder[2]],
                fields.length);
    }

    @Override
    public void close() throws IOException {
        try {
            parser.stopParsing();
        } finally {
            reader.close();
        }
    }

    private boolean applyHeader(String[] fields) {
        if (fields.length != COLUMNS.size()) {
            return false;
        }
        int[] order = new int[COLUMNS.size()];
        boolean[] seen = new boolean[COLUMNS.size()];
        for (int position = 0; position < fields.length; position++) {
            int column = COLUMNS.indexOf(normalizeHeader(fields[position]));
            if (column < 0 || seen[column]) {
                return false;
            }
            seen[column] = true;
            order[column] = position;
        }
        System.arraycopy(order, 0, columnOrder, 0, order.length);
        return true;
    }

    private static String normalizeHeader(String value) {
        return value == null ? "" : value.strip().toLowerCase(Locale.ROOT);
    }

    private static void stripByteOrderMark(String[] fields) {
        if (fields == null || fields.length == 0 || fields[0] == null) {
            return;
        }
        if (!fields[0].isEmpty() && fields[0].charAt(0) == BYTE_ORDER_MARK) {
            fields[0] = fields[0].substring(1).strip();
        }
    }

    private <T> T parseGuarded(ParserCall<T> call) {
        try {
            return call.invoke();
        } catch (RuntimeException ex) {
            if (hasCodingError(ex)) {
                throw new EncodingException("File is not valid UTF-8 text (failed after row %d)".formatted(rowNumber),
                        ex);
            }
            throw new UnreadableContentException("Unreadable CSV content after row %d".formatted(rowNumber), ex);
        }
    }

    private static boolean hasCodingError(Throwable ex) {
        for (Throwable current = ex; current != null; current = current.getCause()) {
            if (current instanceof CharacterCodingException) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
        }
        return false;
    }

    @FunctionalInterface
    private interface ParserCall<T> {
        T invoke();
    }
}
