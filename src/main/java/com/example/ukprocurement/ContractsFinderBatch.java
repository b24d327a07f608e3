package com.example.ukprocurement;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Обработка одного дневного списка Contracts Finder: колонка URI пакетов релизов.
 * Повторный URI в пределах списка не запрашивается, а помечается отдельным статусом.
 */
@Slf4j
public class ContractsFinderBatch {
    public static final String STATUS_DUPLICATE = "duplicate_uri_skipped_fetch";

    private final OcdsReleaseAdapter adapter;
    private final ReleasePackageSource source;

    public ContractsFinderBatch(ReleasePackageSource source) {
        this(new OcdsReleaseAdapter(), source);
    }

    public ContractsFinderBatch(OcdsReleaseAdapter adapter, ReleasePackageSource source) {
        this.adapter = adapter;
        this.source = source;
    }

    /**
     * @param csvFile имя дневного списка, попадает в колонку csv_file
     * @param uris    значения первой колонки списка, индекс элемента - номер строки
     * @return по записи на каждый непустой URI
     */
    public List<NoticeRecord> process(String csvFile, List<String> uris) {
        List<NoticeRecord> records = new ArrayList<>();
        Set<String> seenUris = new HashSet<>();
        log.info("Processing {} URIs from {}", uris.size(), csvFile);

        for (int idx = 0; idx < uris.size(); idx++) {
            String uri = uris.get(idx) != null ? uris.get(idx).trim() : "";
            if (uri.isEmpty()) {
                continue;
            }
            SourceRow row = new SourceRow(csvFile, idx, uri);

            if (!seenUris.add(uri)) {
                log.debug("Duplicate URI {} skipped at row {}", uri, idx);
                records.add(OcdsReleaseAdapter.bookkeeping(row, STATUS_DUPLICATE)
                        .set(ContractsFinderField.URI, uri)
                        .build());
                continue;
            }

            JsonNode releasePackage;
            try {
                releasePackage = source.fetch(uri);
            } catch (RuntimeException e) {
                log.warn("Fetch failed for {}: {}", uri, e.getMessage());
                releasePackage = null;
            }
            records.add(releasePackage != null ? adapter.normalize(row, releasePackage) : adapter.failed(row));
        }

        log.info("Extracted {} records from {}", records.size(), csvFile);
        return records;
    }
}
