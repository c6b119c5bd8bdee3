package com.payments.engine.ingest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.RuntimeJsonMappingException;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.payments.engine.command.CommandType;
import com.payments.engine.dto.TransactionRecord;
import com.payments.engine.exception.InputSourceException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.math.BigDecimal;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Streams the transactions CSV row by row.
 *
 * Rows that do not parse (unknown type, non-numeric ids, malformed amount) are dropped
 * and only logged at debug level. Range checks are left to {@link CommandFactory}.
 * Invalid UTF-8 is decoded to replacement characters, so it only spoils the field it sits in.
 * A broken quote ends reading at that row; the rows before it are kept.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TransactionCsvReader {

    private static final String TYPE = "type";
    private static final String CLIENT = "client";
    private static final String TX = "tx";
    private static final String AMOUNT = "amount";

    private final CsvMapper csvMapper;

    /**
     * @return number of dropped rows
     */
    public int read(Path inputPath, Consumer<TransactionRecord> sink) {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE);
        try (Reader reader = new BufferedReader(new InputStreamReader(Files.newInputStream(inputPath), decoder))) {
            log.info("Reading transactions from {}", inputPath);
            return read(reader, sink);
        } catch (IOException e) {
            throw new InputSourceException("Unable to read input " + inputPath, e);
        }
    }

    /**
     * @return number of dropped rows
     */
    public int read(Reader reader, Consumer<TransactionRecord> sink) throws IOException {
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        int dropped = 0;
        long row = 0;

        try (MappingIterator<Map<String, String>> rows =
                     csvMapper.readerForMapOf(String.class).with(schema).readValues(reader)) {
            while (true) {
                try {
                    if (!rows.hasNext()) {
                        break;
                    }
                } catch (RuntimeException e) {
                    rethrowUnlessParseFailure(e, row + 1);
                    log.warn("Stopping at unreadable row {}: {}", row + 1, e.getMessage());
                    dropped++;
                    break;
                }

                row++;
                Map<String, String> values;
                try {
                    values = rows.next();
                } catch (RuntimeJsonMappingException e) {
                    log.debug("Dropping unreadable row {}: {}", row, e.getMessage());
                    dropped++;
                    continue;
                } catch (RuntimeException e) {
                    rethrowUnlessParseFailure(e, row);
                    log.warn("Stopping at unreadable row {}: {}", row, e.getMessage());
                    dropped++;
                    break;
                }

                Optional<TransactionRecord> record = parse(values);
                if (record.isPresent()) {
                    sink.accept(record.get());
                } else {
                    log.debug("Dropping malformed row {}: {}", row, values);
                    dropped++;
                }
            }
        }
        return dropped;
    }

    // MappingIterator wraps every IOException in a RuntimeException
    private static void rethrowUnlessParseFailure(RuntimeException e, long row) {
        if (e instanceof RuntimeJsonMappingException || e.getCause() instanceof JsonProcessingException) {
            return;
        }
        if (e.getCause() instanceof IOException) {
            throw new InputSourceException("Unable to read input at row " + row, e.getCause());
        }
        throw e;
    }

    static Optional<TransactionRecord> parse(Map<String, String> raw) {
        Map<String, String> values = normalize(raw);
        try {
            Optional<CommandType> type = CommandType.fromLabel(values.get(TYPE));
            if (type.isEmpty()) {
                return Optional.empty();
            }
            Long client = parseLong(values.get(CLIENT));
            Long tx = parseLong(values.get(TX));
            BigDecimal amount = parseAmount(values.get(AMOUNT));
            return Optional.of(new TransactionRecord(type.get(), client, tx, amount));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static Map<String, String> normalize(Map<String, String> raw) {
        Map<String, String> values = new HashMap<>();
        raw.forEach((key, value) -> {
            if (key != null) {
                values.put(key.trim().toLowerCase(Locale.ROOT), value == null ? null : value.trim());
            }
        });
        return values;
    }

    private static Long parseLong(String value) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        return Long.parseLong(value);
    }

    private static BigDecimal parseAmount(String value) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        return new BigDecimal(value);
    }
}
