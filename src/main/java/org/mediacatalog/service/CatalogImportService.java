package org.mediacatalog.service;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.io.input.BOMInputStream;
import org.mediacatalog.config.CatalogProperties;
import org.mediacatalog.dto.ImportResult;
import org.mediacatalog.entity.CatalogRecord;
import org.mediacatalog.exception.ImportException;
import org.mediacatalog.repository.CatalogRecordRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Разовая загрузка каталога из CSV-файла.
 * <p>
 * Записи с уже существующим {@code show_id} пропускаются, существующие строки не обновляются.
 * Вставка идет батчами, каждый батч в своей транзакции: при ошибке откатывается только
 * текущий батч, ранее закоммиченные остаются в базе.
 */
@Slf4j
@Service
public class CatalogImportService {
    static final List<String> COLUMNS = List.of(
            "show_id", "type", "title", "director", "cast", "country",
            "date_added", "release_year", "rating", "duration", "listed_in", "description");
    private static final Pattern NUMBER = Pattern.compile("[+-]?\\d+(\\.\\d*)?");

    private final CatalogRecordRepository catalogRecordRepository;
    private final CatalogStatisticsService statisticsService;
    private final TransactionTemplate transactionTemplate;
    private final int batchSize;

    public CatalogImportService(CatalogRecordRepository catalogRecordRepository,
                                CatalogStatisticsService statisticsService,
                                PlatformTransactionManager transactionManager,
                                CatalogProperties properties) {
        this.catalogRecordRepository = catalogRecordRepository;
        this.statisticsService = statisticsService;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.batchSize = properties.getImporter().getBatchSize();
    }

    public ImportResult importCsv(String csvPath) {
        log.info("Чтение файла: {}", csvPath);
        List<CatalogRecord> rows = readRows(Path.of(csvPath));
        log.info("Загружено строк из CSV: {}", rows.size());

        int inserted = 0;
        int skipped = 0;
        for (int start = 0; start < rows.size(); start += batchSize) {
            int end = Math.min(start + batchSize, rows.size());
            List<CatalogRecord> batch = rows.subList(start, end);
            try {
                int batchInserted = insertBatch(batch);
                inserted += batchInserted;
                skipped += batch.size() - batchInserted;
            } catch (RuntimeException e) {
                log.error("Ошибка при загрузке батча {}-{}, батч откатен: {}", start + 1, end, e.getMessage(), e);
                throw new ImportException("Ошибка записи строк " + (start + 1) + "-" + end, e);
            }
            log.info("Обработано записей: {}/{}", end, rows.size());
        }

        return new ImportResult("success", rows.size(), inserted, 0, skipped, statisticsService.getOverview());
    }

    private int insertBatch(List<CatalogRecord> batch) {
        Integer inserted = transactionTemplate.execute(status -> {
            int count = 0;
            for (CatalogRecord record : batch) {
                if (record.getShowId() == null) {
                    log.warn("Строка без show_id пропущена: {}", record.getTitle());
                    continue;
                }
                if (catalogRecordRepository.existsByShowId(record.getShowId())) {
                    log.debug("Запись {} уже существует, пропуск", record.getShowId());
                    continue;
                }
                catalogRecordRepository.save(record);
                count++;
            }
            catalogRecordRepository.flush();
            return count;
        });
        return inserted == null ? 0 : inserted;
    }

    List<CatalogRecord> readRows(Path path) {
        if (!Files.isReadable(path)) {
            throw new ImportException("Файл недоступен для чтения: " + path);
        }

        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setHeader()
                .setSkipHeaderRecord(true)
                .setIgnoreEmptyLines(true)
                .build();

        // BOM в начале файла иначе попадает в имя первой колонки
        try (Reader reader = new InputStreamReader(
                BOMInputStream.builder().setPath(path).get(), StandardCharsets.UTF_8);
             CSVParser parser = format.parse(reader)) {
            List<String> missing = COLUMNS.stream()
                    .filter(column -> !parser.getHeaderMap().containsKey(column))
                    .toList();
            if (!missing.isEmpty()) {
                throw new ImportException("Схема файла не совпадает, нет колонок " + missing);
            }

            List<CatalogRecord> rows = new ArrayList<>();
            for (CSVRecord csvRecord : parser) {
                rows.add(toRecord(csvRecord));
            }
            return rows;
        } catch (IOException | UncheckedIOException | IllegalStateException | IllegalArgumentException e) {
            throw new ImportException("Не удалось разобрать файл " + path, e);
        }
    }

    static CatalogRecord toRecord(CSVRecord row) {
        CatalogRecord record = new CatalogRecord();
        String showId = cell(row, "show_id");
        record.setShowId(showId == null ? null : showId.trim());
        record.setType(cell(row, "type"));
        record.setTitle(cell(row, "title"));
        record.setDirector(cell(row, "director"));
        record.setCast(cell(row, "cast"));
        record.setCountry(cell(row, "country"));
        record.setDateAdded(cell(row, "date_added"));
        record.setReleaseYear(parseYear(cell(row, "release_year")));
        record.setRating(cell(row, "rating"));
        record.setDuration(cell(row, "duration"));
        record.setListedIn(cell(row, "listed_in"));
        record.setDescription(cell(row, "description"));
        return record;
    }

    // Пустая ячейка или отсутствующая в короткой строке = null
    private static String cell(CSVRecord row, String column) {
        if (!row.isSet(column)) {
            return null;
        }
        String value = row.get(column);
        return value == null || value.isBlank() ? null : value;
    }

    /**
     * Год выпуска: десятичное число (в т.ч. "2019.0"), иначе null. Ноль и отрицательные тоже null.
     */
    static Integer parseYear(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        if (!NUMBER.matcher(trimmed).matches()) {
            log.warn("Некорректный год выпуска '{}', сохраняется как пустой", value);
            return null;
        }
        int year = (int) Double.parseDouble(trimmed);
        return year > 0 ? year : null;
    }
}
