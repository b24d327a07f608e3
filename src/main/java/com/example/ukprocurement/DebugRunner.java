package com.example.ukprocurement;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Ручная проверка нормализации на локальных файлах: .json (пакет релизов),
 * .xml (уведомление Find a Tender) или .zip (дневной архив).
 */
public class DebugRunner {
    public static void main(String[] args) {
        System.out.println("=== Starting Debug Runner ===");
        ObjectMapper mapper = new ObjectMapper();

        for (String arg : args) {
            Path path = Paths.get(arg);
            String fileName = path.getFileName().toString();
            System.out.println("\n--- " + fileName + " ---");
            try {
                List<NoticeRecord> records;
                if (fileName.endsWith(".json")) {
                    SourceRow row = new SourceRow(fileName, 0, path.toUri().toString());
                    records = List.of(new OcdsReleaseAdapter().normalize(row, Files.readString(path)));
                } else if (fileName.endsWith(".zip")) {
                    try (InputStream in = Files.newInputStream(path)) {
                        records = new FindATenderArchiveReader().read(in, fileName);
                    }
                } else {
                    String xml = new NoticePayloadDecoder().decode(Files.readAllBytes(path));
                    records = List.of(new NoticeSchemaDispatcher().normalize(xml));
                }
                for (NoticeRecord record : records) {
                    System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(record.asMap()));
                }
                System.out.println(fileName + ": " + records.size() + " record(s)");
            } catch (Exception e) {
                System.err.println(fileName + " Error: " + e.getMessage());
                e.printStackTrace();
            }
        }

        System.out.println("\n=== Debug Runner Finished ===");
    }
}
