package com.example.ukprocurement;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Плоская запись одного уведомления: упорядоченное отображение
 * "имя колонки -> скалярное значение или null".
 * <p>
 * Запись всегда содержит все колонки своей раскладки, отсутствующие данные
 * хранятся как null. После {@link Builder#build()} запись не изменяется.
 */
public final class NoticeRecord {
    private final Map<String, Object> values;

    private NoticeRecord(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static <F extends Enum<F> & RecordField> Builder builder(Class<F> layout) {
        Map<String, Object> columns = new LinkedHashMap<>();
        for (F field : layout.getEnumConstants()) {
            columns.put(field.column(), null);
        }
        return new Builder(columns);
    }

    /**
     * Новый билдер с теми же колонками и значениями, сама запись не меняется
     */
    public Builder toBuilder() {
        return new Builder(new LinkedHashMap<>(values));
    }

    public Object get(RecordField field) {
        return values.get(field.column());
    }

    public Object get(String column) {
        return values.get(column);
    }

    /**
     * Значение колонки как строка (числа и флаги в их текстовом виде)
     */
    public String getString(RecordField field) {
        Object value = get(field);
        return value != null ? value.toString() : null;
    }

    public boolean hasColumn(String column) {
        return values.containsKey(column);
    }

    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NoticeRecord)) return false;
        return values.equals(((NoticeRecord) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "NoticeRecord" + values;
    }

    public static final class Builder {
        private final Map<String, Object> columns;

        private Builder(Map<String, Object> columns) {
            this.columns = columns;
        }

        /**
         * Записывает значение. Колонка обязана принадлежать раскладке билдера.
         */
        public Builder set(RecordField field, Object value) {
            if (!columns.containsKey(field.column())) {
                throw new IllegalArgumentException("Column " + field.column() + " is not part of this layout");
            }
            columns.put(field.column(), value);
            return this;
        }

        public Object peek(RecordField field) {
            return columns.get(field.column());
        }

        public NoticeRecord build() {
            return new NoticeRecord(new LinkedHashMap<>(columns));
        }
    }
}
