package ai.tabprof.source;

import ai.tabprof.config.ProfilerConfig;
import com.opencsv.CSVParserBuilder;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.ICSVParser;
import com.opencsv.enums.CSVReaderNullFieldIndicator;
import com.opencsv.exceptions.CsvValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;

/**
 * CSV file read in chunks. The first record is the header and fixes the columns.
 * <p>
 * Blank lines are skipped. Unquoted empty fields are read as null, so a quoted empty value on its own line is still
 * a row. Records shorter than the header are padded with nulls, longer records fail the read.
 * Empty header names become {@code Unnamed: <index>}, repeated names get a {@code .1}, {@code .2} ... suffix.
 */
public class CsvRowSource implements RowSource {

    private static final Logger LOG = LoggerFactory.getLogger(CsvRowSource.class);

    private static final char BOM = '\uFEFF';

    private final Path path;
    private final int chunkSize;
    private final char separator;
    private CSVReader csvReader;
    private boolean iterated;

    public CsvRowSource(Path path, ProfilerConfig config) {
        this(path, config.chunkSize(), config.delimiter().orElse(defaultSeparator(path)));
    }

    public CsvRowSource(Path path, int chunkSize, char separator) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("Chunk size should be positive");
        }
        this.path = path;
        this.chunkSize = chunkSize;
        this.separator = separator;
    }

    static char defaultSeparator(Path path) {
        return path.toString().toLowerCase().endsWith(".tsv") ? '\t' : ',';
    }

    @Override
    public Iterator<Chunk> chunks() {
        if (iterated) {
            throw new IllegalStateException("CSV source can be iterated only once");
        }
        iterated = true;
        return new ChunkIterator();
    }

    @Override
    public String describe() {
        return path.toString();
    }

    @Override
    public void close() {
        if (csvReader != null) {
            try {
                csvReader.close();
            } catch (IOException e) {
                throw new RowSourceException(String.format("Unable to close %s", path), e);
            } finally {
                csvReader = null;
            }
        }
    }

    private CSVReader open() {
        try {
            ICSVParser parser = new CSVParserBuilder()
                .withSeparator(separator)
                .withEscapeChar(ICSVParser.NULL_CHARACTER)
                .withIgnoreLeadingWhiteSpace(false)
                .withFieldAsNull(CSVReaderNullFieldIndicator.EMPTY_SEPARATORS)
                .build();
            return new CSVReaderBuilder(Files.newBufferedReader(path, StandardCharsets.UTF_8))
                .withCSVParser(parser)
                .build();
        } catch (IOException e) {
            throw new RowSourceException(String.format("Unable to open %s", path), e);
        }
    }

    /**
     * Next non-blank record, or null at the end of the file.
     */
    private String[] readRecord() {
        try {
            String[] record;
            do {
                record = csvReader.readNext();
            } while (record != null && isBlank(record));
            return record;
        } catch (IOException | CsvValidationException e) {
            throw new RowSourceException(
                String.format("Error reading %s near line %s", path, csvReader.getLinesRead()), e);
        }
    }

    // a blank line parses as a single null field, a line holding just "" as a single empty string
    private static boolean isBlank(String[] record) {
        return record.length == 1 && record[0] == null;
    }

    static List<String> headerNames(String[] header) {
        List<String> names = new ArrayList<>(header.length);
        Set<String> used = new HashSet<>();
        for (int i = 0; i < header.length; i++) {
            String name = header[i];
            if (name == null) {
                name = "";
            }
            if (i == 0 && !name.isEmpty() && name.charAt(0) == BOM) {
                name = name.substring(1);
            }
            if (name.isEmpty()) {
                name = "Unnamed: " + i;
            }
            String unique = name;
            int suffix = 1;
            while (used.contains(unique)) {
                unique = name + "." + suffix++;
            }
            used.add(unique);
            names.add(unique);
        }
        return names;
    }

    private class ChunkIterator implements Iterator<Chunk> {

        private boolean initialized;
        private boolean exhausted;
        private List<String> columns;
        private Chunk pending;

        @Override
        public boolean hasNext() {
            if (!initialized) {
                initialize();
            }
            if (pending == null && !exhausted) {
                pending = readChunk();
            }
            return pending != null;
        }

        @Override
        public Chunk next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            Chunk chunk = pending;
            pending = null;
            return chunk;
        }

        private void initialize() {
            initialized = true;
            csvReader = open();
            String[] header = readRecord();
            if (header == null) {
                LOG.info("File {} has no header, nothing to read", path);
                exhausted = true;
                return;
            }
            columns = headerNames(header);
        }

        private Chunk readChunk() {
            List<String[]> rows = new ArrayList<>(Math.min(chunkSize, 1024));
            while (rows.size() < chunkSize) {
                String[] record = readRecord();
                if (record == null) {
                    exhausted = true;
                    break;
                }
                if (record.length > columns.size()) {
                    throw new RowSourceException(String.format(
                        "Error reading %s: expected %s fields in line %s, saw %s",
                        path, columns.size(), csvReader.getLinesRead(), record.length));
                }
                rows.add(record);
            }
            return rows.isEmpty() ? null : new Chunk(columns, rows);
        }
    }
}
