package com.payments.engine.report;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.payments.engine.dto.AccountSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.util.List;

/**
 * Writes {@code client,available,held,total,locked}, one row per account.
 * The target writer is flushed but left open, it is usually stdout.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AccountCsvWriter {

    private final CsvMapper csvMapper;

    public void write(List<AccountSnapshot> accounts, Writer output) throws IOException {
        if (accounts.isEmpty()) {
            // no rows, no header
            log.debug("No accounts to report");
            return;
        }
        CsvSchema schema = csvMapper.schemaFor(AccountSnapshot.class).withHeader();
        try (SequenceWriter rows = csvMapper.writer(schema)
                .without(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
                .writeValues(output)) {
            rows.writeAll(accounts);
        }
        output.flush();
        log.debug("Wrote {} account rows", accounts.size());
    }
}
