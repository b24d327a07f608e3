package com.example.ukprocurement;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Получение пакета релизов по URI. Реализуется вызывающей стороной (HTTP, кеш, файлы).
 */
public interface ReleasePackageSource {

    /**
     * @return разобранный пакет или null, если получить или разобрать его не удалось
     */
    JsonNode fetch(String uri);
}
