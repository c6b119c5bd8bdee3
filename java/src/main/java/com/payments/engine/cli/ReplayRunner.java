package com.payments.engine.cli;

import com.payments.engine.exception.InputSourceException;
import com.payments.engine.service.LedgerReplayService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.BufferedWriter;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Takes the input path as the single positional argument and writes the report to stdout.
 * Spring options such as {@code --logging.level.root=DEBUG} may be passed alongside it.
 */
@Component
@ConditionalOnProperty(prefix = "ledger.runner", name = "enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class ReplayRunner implements ApplicationRunner {

    static final String USAGE = "Usage: payments-engine <transactions.csv>";

    private final LedgerReplayService replayService;
    private final OutputStream out;

    @Autowired
    public ReplayRunner(LedgerReplayService replayService) {
        this(replayService, System.out);
    }

    ReplayRunner(LedgerReplayService replayService, OutputStream out) {
        this.replayService = replayService;
        this.out = out;
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        Path inputPath = inputPath(args.getNonOptionArgs());

        Writer output = new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8));
        replayService.replay(inputPath, output);
        output.flush();
    }

    static Path inputPath(List<String> positional) {
        if (positional.size() != 1) {
            throw new InputSourceException(USAGE);
        }
        Path path = Paths.get(positional.get(0));
        if (!Files.isReadable(path)) {
            throw new InputSourceException("Input file is not readable: " + path);
        }
        log.debug("Input file: {}", path.toAbsolutePath());
        return path;
    }
}
