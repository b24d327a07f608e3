package com.example.ukprocurement;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.TreeSet;

/**
 * Склейка многозначных полей в одну колонку.
 * <p>
 * XML-выгрузки исторически склеиваются через ";" с сортировкой,
 * JSON-выгрузки через "|" в порядке появления. Разделители менять нельзя,
 * на них завязаны уже собранные таблицы.
 */
public final class NoticeText {
    public static final String XML_DELIMITER = ";";
    public static final String JSON_DELIMITER = "|";

    private NoticeText() {
    }

    /**
     * Пустые значения отбрасываются, остальные обрезаются, дедуплицируются и сортируются.
     *
     * @return склеенная строка или null, если ничего не осталось
     */
    public static String joinSorted(Collection<String> values, String delimiter) {
        Set<String> unique = new TreeSet<>();
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                unique.add(value.trim());
            }
        }
        return unique.isEmpty() ? null : String.join(delimiter, unique);
    }

    /**
     * Пустые значения отбрасываются, повторы убираются, порядок первого появления сохраняется.
     *
     * @return склеенная строка или null, если ничего не осталось
     */
    public static String joinOrdered(Collection<String> values, String delimiter) {
        Set<String> unique = new LinkedHashSet<>();
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                unique.add(value);
            }
        }
        return unique.isEmpty() ? null : String.join(delimiter, unique);
    }

    public static String joinSorted(Collection<String> values) {
        return joinSorted(values, XML_DELIMITER);
    }

    public static String joinOrdered(Collection<String> values) {
        return joinOrdered(values, JSON_DELIMITER);
    }

    public static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
