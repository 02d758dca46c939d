package com.luanvv.listings.store;

import com.luanvv.listings.model.Dataset;
import com.luanvv.listings.model.ReconciledRecord;
import com.opencsv.CSVReader;
import com.opencsv.CSVWriter;
import com.opencsv.exceptions.CsvValidationException;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Keeps the dataset as one CSV file laid out per {@link DatasetColumns}. A missing file is
 * the first run; a file with other headers, or a row that cannot be read, is refused rather
 * than guessed at.
 */
@Slf4j
public class CsvDatasetStore implements DatasetStore {
    @Getter private final Path path;
    private final Path archiveDir;

    public CsvDatasetStore(Path path) {
        this(path, null);
    }

    public CsvDatasetStore(Path path, Path archiveDir) {
        this.path = path;
        this.archiveDir = archiveDir;
    }

    @Override
    public Dataset read() {
        if (!Files.exists(path)) {
            log.info("No dataset at {}, starting from an empty one", path);
            return Dataset.empty();
        }
        try (Reader r = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             CSVReader csv = new CSVReader(r)) {
            String[] header = csv.readNext();
            if (header == null) {
                log.info("Dataset {} is empty", path);
                return Dataset.empty();
            }
            verifyHeader(header);
            List<ReconciledRecord> records = new ArrayList<>();
            Set<String> codes = new HashSet<>();
            String[] row;
            while ((row = csv.readNext()) != null) {
                if (row.length == 1 && row[0].isBlank()) continue;
                if (row.length > 1 && row[1].isBlank()) {
                    log.warn("Skipping row without code at line {} of {}", csv.getLinesRead(), path);
                    continue;
                }
                ReconciledRecord record;
                try {
                    record = DatasetColumns.fromRow(row);
                } catch (IllegalArgumentException e) {
                    // writing back without the row would delete the listing for good
                    throw new DatasetStoreException("Unreadable row at line " + csv.getLinesRead() + " of " + path
                        + ": " + e.getMessage(), e);
                }
                if (!codes.add(record.getCode())) {
                    log.warn("Skipping duplicate code {} at line {} of {}", record.getCode(), csv.getLinesRead(), path);
                    continue;
                }
                records.add(record);
            }
            log.info("Read {} records from {}", records.size(), path);
            return Dataset.of(records);
        } catch (IOException | CsvValidationException e) {
            throw new DatasetStoreException("Cannot read dataset " + path, e);
        }
    }

    @Override
    public void write(Dataset dataset) {
        if (archiveDir != null && Files.exists(path)) {
            backup(archiveDir, LocalDate.now());
        }
        try {
            Path parent = path.toAbsolutePath().getParent();
            Files.createDirectories(parent);
            Path tmp = Files.createTempFile(parent, path.getFileName().toString(), ".tmp");
            try (Writer w = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8);
                 CSVWriter csv = new CSVWriter(w)) {
                csv.writeNext(DatasetColumns.HEADERS.toArray(String[]::new));
                for (ReconciledRecord record : dataset.records()) {
                    csv.writeNext(DatasetColumns.toRow(record));
                }
            }
            try {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            }
            log.info("Wrote {} records to {}", dataset.size(), path);
        } catch (IOException e) {
            throw new DatasetStoreException("Cannot write dataset " + path, e);
        }
    }

    /** Copies the current dataset file to {@code Backup <date>.csv} in {@code dir}. */
    public Path backup(Path dir, LocalDate date) {
        if (!Files.exists(path)) {
            throw new DatasetStoreException("Nothing to back up, " + path + " does not exist");
        }
        try {
            Files.createDirectories(dir);
            Path target = dir.resolve("Backup " + date + ".csv");
            Files.copy(path, target, StandardCopyOption.REPLACE_EXISTING);
            log.info("Backed up {} to {}", path, target);
            return target;
        } catch (IOException e) {
            throw new DatasetStoreException("Cannot back up dataset " + path + " to " + dir, e);
        }
    }

    private void verifyHeader(String[] header) {
        List<String> actual = Arrays.stream(header).map(h -> h.replace("\uFEFF", "").trim()).toList();
        if (!actual.equals(DatasetColumns.HEADERS)) {
            throw new DatasetStoreException("Dataset " + path + " does not match column layout v"
                + DatasetColumns.VERSION + ": " + actual);
        }
    }
}
