package com.flagship.payments_engine.csv;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.flagship.payments_engine.exception.AmountOverflowException;
import com.flagship.payments_engine.exception.MalformedRecordException;
import com.flagship.payments_engine.money.Amount;
import com.flagship.payments_engine.record.RecordType;
import com.flagship.payments_engine.record.TransactionRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Reads transaction records from CSV with a {@code type,client,tx,amount} header.
 *
 * Records are parsed lazily, one per {@link Iterator#next()} call, so the input is never
 * held in memory. Any row that cannot be turned into a valid {@link TransactionRecord}
 * raises {@link MalformedRecordException} naming the 1-based record number; an amount
 * outside the fixed-point range raises {@link AmountOverflowException} with the same prefix.
 */
@Component
@RequiredArgsConstructor
public class TransactionCsvReader {

    private static final CsvSchema SCHEMA = CsvSchema.emptySchema().withHeader();

    private final CsvMapper csvMapper;

    /**
     * Opens a lazy record iterator over the input. The caller owns and closes the reader.
     *
     * @throws MalformedRecordException if the header cannot be read
     */
    public Iterator<TransactionRecord> read(Reader input) {
        try {
            MappingIterator<TransactionCsvRow> rows = csvMapper
                .readerFor(TransactionCsvRow.class)
                .with(SCHEMA)
                .readValues(input);
            return new RecordIterator(rows);
        } catch (JsonProcessingException e) {
            throw new MalformedRecordException("Unreadable CSV header: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to open transaction input", e);
        }
    }

    static TransactionRecord toRecord(TransactionCsvRow row) {
        RecordType type = RecordType.fromCode(row.getType());
        long clientId = parseId("client", row.getClient());
        long txId = parseId("tx", row.getTx());
        Amount amount = parseAmount(row.getAmount());
        return TransactionRecord.of(type, clientId, txId, amount);
    }

    private static long parseId(String column, String value) {
        if (value == null || value.isBlank()) {
            throw new MalformedRecordException("Missing " + column + " id");
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new MalformedRecordException("Invalid " + column + " id: " + value, e);
        }
    }

    private static Amount parseAmount(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Amount.parse(value);
        } catch (IllegalArgumentException e) {
            // NumberFormatException included
            throw new MalformedRecordException("Invalid amount: " + value, e);
        }
    }

    private static final class RecordIterator implements Iterator<TransactionRecord> {

        private final MappingIterator<TransactionCsvRow> rows;
        private long recordNumber;

        private RecordIterator(MappingIterator<TransactionCsvRow> rows) {
            this.rows = rows;
        }

        @Override
        public boolean hasNext() {
            try {
                return rows.hasNextValue();
            } catch (JsonProcessingException e) {
                throw malformed(recordNumber + 1, e.getOriginalMessage(), e);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read transaction input", e);
            }
        }

        @Override
        public TransactionRecord next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            long current = ++recordNumber;
            TransactionCsvRow row;
            try {
                row = rows.nextValue();
            } catch (JsonProcessingException e) {
                throw malformed(current, e.getOriginalMessage(), e);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read transaction input", e);
            }
            try {
                return toRecord(row);
            } catch (MalformedRecordException e) {
                throw malformed(current, e.getMessage(), e);
            } catch (AmountOverflowException e) {
                throw new AmountOverflowException("Record " + current + ": " + e.getMessage(), e);
            }
        }

        private static MalformedRecordException malformed(long recordNumber, String detail, Exception cause) {
            return new MalformedRecordException("Record " + recordNumber + ": " + detail, cause);
        }
    }
}
