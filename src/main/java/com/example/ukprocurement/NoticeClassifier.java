package com.example.ukprocurement;

import java.util.Collection;
import java.util.Locale;

/**
 * Сводит сырые коды типа документа к небольшому закрытому набору групп.
 * Функции тотальные: неизвестный или пустой код дает {@link NoticeTypeGroup#OTHER}.
 */
public final class NoticeClassifier {

    private NoticeClassifier() {
    }

    /**
     * Код TD_DOCUMENT_TYPE из TED-формы.
     */
    public static NoticeTypeGroup classifyDocumentType(String tdCode) {
        if (tdCode == null) {
            return NoticeTypeGroup.OTHER;
        }
        switch (tdCode.trim().toUpperCase(Locale.ROOT)) {
            case "0":
                return NoticeTypeGroup.PIN;
            case "3":
            case "O":
            case "V":
                return NoticeTypeGroup.CONTRACT_NOTICE;
            case "7":
                return NoticeTypeGroup.CONTRACT_AWARD;
            case "K":
                return NoticeTypeGroup.MODIFICATION;
            default:
                return NoticeTypeGroup.OTHER;
        }
    }

    /**
     * Форма UKn и теги OCDS-релиза.
     */
    public static NoticeTypeGroup classifyUkForm(UkFormTag form, Collection<String> tags) {
        if (form != null && form.isAwardForm() && tags.contains("award")) {
            return NoticeTypeGroup.CONTRACT_AWARD;
        }
        if (tags.contains("planning")) {
            return NoticeTypeGroup.PLANNING;
        }
        return NoticeTypeGroup.OTHER;
    }
}
