package com.example.ukprocurement;

/**
 * Колонка плоской записи уведомления. Реализуется перечислениями-раскладками,
 * порядок констант перечисления задает порядок колонок.
 */
public interface RecordField {

    String column();
}
