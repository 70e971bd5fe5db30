package com.flagship.payments_engine.csv;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.flagship.payments_engine.ledger.Account;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;

/**
 * Writes account snapshots as CSV: {@code client,available,held,total,locked}.
 *
 * The header is always written, even when there are no accounts.
 * The target writer is flushed but never closed.
 */
@Component
@RequiredArgsConstructor
public class AccountCsvWriter {

    public static final String HEADER = "client,available,held,total,locked";

    private final CsvMapper csvMapper;

    public void write(Iterable<Account> accounts, Writer output) throws IOException {
        CsvSchema schema = csvMapper.schemaFor(AccountCsvRow.class).withoutHeader();

        output.write(HEADER);
        output.write(schema.getLineSeparator());

        try (SequenceWriter rows = csvMapper.writer(schema)
                .without(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
                .writeValues(output)) {
            for (Account account : accounts) {
                rows.write(AccountCsvRow.from(account));
            }
        }
        output.flush();
    }
}
