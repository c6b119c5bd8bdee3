package com.payments.engine.service;

import com.payments.engine.command.Command;
import com.payments.engine.dto.AccountSnapshot;
import com.payments.engine.dto.TransactionRecord;
import com.payments.engine.exception.InputSourceException;
import com.payments.engine.exception.InvalidRecordException;
import com.payments.engine.ingest.CommandFactory;
import com.payments.engine.ingest.TransactionCsvReader;
import com.payments.engine.report.AccountCsvWriter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Consumer;

/**
 * Replays an input CSV through a fresh {@link LedgerEngine} and writes the account report.
 *
 * Records are applied strictly in input order. Invalid records and rejected commands are
 * logged and skipped; only an unreadable input aborts the replay.
 */
@Service
public class LedgerReplayService {

    private static final Logger logger = LoggerFactory.getLogger(LedgerReplayService.class);

    private final TransactionCsvReader csvReader;
    private final CommandFactory commandFactory;
    private final AccountCsvWriter csvWriter;
    private final MeterRegistry meterRegistry;
    private final int displayScale;
    private final Counter appliedCounter;
    private final Counter invalidRecordCounter;
    private final Counter droppedRowCounter;

    public LedgerReplayService(TransactionCsvReader csvReader, CommandFactory commandFactory,
                               AccountCsvWriter csvWriter, MeterRegistry meterRegistry,
                               @Value("${ledger.report.display-scale:4}") int displayScale) {
        this.csvReader = csvReader;
        this.commandFactory = commandFactory;
        this.csvWriter = csvWriter;
        this.meterRegistry = meterRegistry;
        this.displayScale = displayScale;

        this.appliedCounter = Counter.builder("ledger.commands.applied")
                .description("Commands applied to the ledger")
                .register(meterRegistry);

        this.invalidRecordCounter = Counter.builder("ledger.records.invalid")
                .description("Records rejected before reaching the ledger")
                .register(meterRegistry);

        this.droppedRowCounter = Counter.builder("ledger.records.dropped")
                .description("Input rows that could not be parsed")
                .register(meterRegistry);
    }

    public ReplaySummary replay(Path inputPath, Writer output) {
        return replay(sink -> csvReader.read(inputPath, sink), output);
    }

    public ReplaySummary replay(Reader input, Writer output) {
        return replay(sink -> csvReader.read(input, sink), output);
    }

    private ReplaySummary replay(RecordSource source, Writer output) {
        LedgerEngine engine = new LedgerEngine();
        Tally tally = new Tally();

        int dropped;
        try {
            dropped = source.read(record -> process(engine, record, tally));
        } catch (IOException e) {
            throw new InputSourceException("Unable to read input", e);
        }
        droppedRowCounter.increment(dropped);

        List<AccountSnapshot> accounts = engine.snapshot(displayScale);
        try {
            csvWriter.write(accounts, output);
        } catch (IOException e) {
            logger.warn("unable to write csv: {}", e.getMessage(), e);
        }

        logger.info("Replay finished: {} applied, {} rejected, {} invalid records, {} dropped rows, {} accounts",
                tally.applied, tally.rejected, tally.invalid, dropped, accounts.size());
        return new ReplaySummary(tally.applied, tally.rejected, tally.invalid, dropped, accounts);
    }

    private void process(LedgerEngine engine, TransactionRecord record, Tally tally) {
        Command command;
        try {
            command = commandFactory.toCommand(record);
        } catch (InvalidRecordException e) {
            logger.warn("unable to parse transaction: {} ({})", e.getMessage(), e.getReason());
            invalidRecordCounter.increment();
            tally.invalid++;
            return;
        }

        ApplyResult result = engine.apply(command);
        if (result.isApplied()) {
            appliedCounter.increment();
            tally.applied++;
            return;
        }

        logger.warn("unable to process transaction: {} {} for client {}: {}",
                command.getType(), command.getTransactionId(), command.getClientId(), result);
        rejectedCounter(result).increment();
        tally.rejected++;
    }

    private Counter rejectedCounter(ApplyResult result) {
        return Counter.builder("ledger.commands.rejected")
                .description("Commands rejected by the ledger")
                .tag("reason", result.getReason().map(Enum::name).orElse("UNKNOWN"))
                .register(meterRegistry);
    }

    @FunctionalInterface
    private interface RecordSource {
        int read(Consumer<TransactionRecord> sink) throws IOException;
    }

    private static final class Tally {
        private int applied;
        private int rejected;
        private int invalid;
    }
}
