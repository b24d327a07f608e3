package com.example.ukprocurement;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * Дневной архив Find a Tender: по записи на каждый XML-файл архива.
 * Файлы с другим расширением пропускаются, битый XML дает запись с parse_error.
 */
@Slf4j
public class FindATenderArchiveReader {
    private final NoticeSchemaDispatcher dispatcher;
    private final NoticePayloadDecoder decoder;
    private final String entrySuffix;

    public FindATenderArchiveReader() {
        this(new NoticeSchemaDispatcher(), new NoticePayloadDecoder(), Config.getArchiveEntrySuffix());
    }

    public FindATenderArchiveReader(NoticeSchemaDispatcher dispatcher, NoticePayloadDecoder decoder, String entrySuffix) {
        this.dispatcher = dispatcher;
        this.decoder = decoder;
        this.entrySuffix = entrySuffix.toLowerCase(Locale.ROOT);
    }

    /**
     * @param zip     поток архива, закрывает вызывающая сторона
     * @param zipName имя архива для колонки source_zip
     * @throws IOException если архив не читается
     */
    public List<NoticeRecord> read(InputStream zip, String zipName) throws IOException {
        List<NoticeRecord> records = new ArrayList<>();
        ZipInputStream zis = new ZipInputStream(zip);
        ZipEntry entry;
        while ((entry = zis.getNextEntry()) != null) {
            String name = entry.getName();
            if (entry.isDirectory() || !name.toLowerCase(Locale.ROOT).endsWith(entrySuffix)) {
                continue;
            }
            String xml = decoder.decode(zis.readAllBytes());
            NoticeRecord record = dispatcher.normalize(xml).toBuilder()
                    .set(FindATenderField.SOURCE_XML_FILE, name)
                    .set(FindATenderField.SOURCE_ZIP, zipName)
                    .build();
            records.add(record);
        }
        if (records.isEmpty()) {
            log.warn("No XML files found in {}", zipName);
        } else {
            log.info("Extracted {} notices from {}", records.size(), zipName);
        }
        return records;
    }
}
