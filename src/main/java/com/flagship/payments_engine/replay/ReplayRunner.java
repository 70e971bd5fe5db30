package com.flagship.payments_engine.replay;

import com.flagship.payments_engine.csv.AccountCsvWriter;
import com.flagship.payments_engine.csv.TransactionCsvReader;
import com.flagship.payments_engine.exception.LedgerException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Command-line entry point: replays the CSV file named by the single program argument and
 * prints the resulting accounts as CSV on standard output.
 *
 * Exit codes:
 * - 0: every record was read and applied or skipped
 * - 1: a fatal record aborted the replay; the abort-time snapshot is still printed
 * - 2: wrong arguments or unreadable input; nothing is printed
 */
@Component
@ConditionalOnProperty(name = "ledger.runner.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class ReplayRunner implements ApplicationRunner, ExitCodeGenerator {

    static final int EXIT_OK = 0;
    static final int EXIT_ABORTED = 1;
    static final int EXIT_USAGE = 2;

    private final TransactionCsvReader csvReader;
    private final LedgerReplayService replayService;
    private final AccountCsvWriter csvWriter;

    private int exitCode = EXIT_OK;

    @Override
    public void run(ApplicationArguments args) throws IOException {
        Writer stdout = new BufferedWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
        exitCode = replay(args.getNonOptionArgs(), stdout);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    int replay(List<String> arguments, Writer output) throws IOException {
        if (arguments.size() != 1) {
            log.error("Expected exactly one argument, the path of the transactions CSV, but got {}", arguments);
            return EXIT_USAGE;
        }
        Path input = Path.of(arguments.get(0));

        ReplayReport report;
        try (Reader reader = Files.newBufferedReader(input, StandardCharsets.UTF_8)) {
            report = replayService.replay(csvReader.read(reader));
        } catch (LedgerException e) {
            // header could not be read; nothing was applied
            report = replayService.abortUnread(e);
        } catch (IOException | UncheckedIOException e) {
            log.error("Failed to read {}: {}", input, e.getMessage());
            return EXIT_USAGE;
        }

        csvWriter.write(report.getAccounts(), output);
        return report.isAborted() ? EXIT_ABORTED : EXIT_OK;
    }
}
