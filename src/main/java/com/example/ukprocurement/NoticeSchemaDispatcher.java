package com.example.ukprocurement;

import lombok.extern.slf4j.Slf4j;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.Optional;

/**
 * Точка входа для XML-уведомлений Find a Tender: разбирает текст, определяет схему
 * и отдает документ нужному адаптеру.
 * <p>
 * Формы UKn опрашиваются в порядке {@link UkFormTag}, побеждает первая найденная.
 * Если ни одной нет, документ считается TED-формой. Метод {@link #normalize(String)}
 * никогда не бросает исключений: ошибка разбора попадает в колонку parse_error.
 */
@Slf4j
public class NoticeSchemaDispatcher {
    private final TedNoticeAdapter tedAdapter;
    private final UkFormNoticeAdapter ukFormAdapter;

    public NoticeSchemaDispatcher() {
        this(new TedNoticeAdapter(), new UkFormNoticeAdapter());
    }

    public NoticeSchemaDispatcher(TedNoticeAdapter tedAdapter, UkFormNoticeAdapter ukFormAdapter) {
        this.tedAdapter = tedAdapter;
        this.ukFormAdapter = ukFormAdapter;
    }

    public NoticeRecord normalize(String xml) {
        Document document;
        try {
            document = XmlNoticeParser.parse(xml);
        } catch (NoticeParseException e) {
            log.warn("Notice is not well-formed XML: {}", e.getMessage());
            return errorRecord(e);
        }

        try {
            Optional<UkFormTag> form = select(document);
            return form.isPresent()
                    ? ukFormAdapter.normalize(document, form.get())
                    : tedAdapter.normalize(document);
        } catch (RuntimeException e) {
            log.error("Error extracting notice fields: {}", e.getMessage(), e);
            return errorRecord(e);
        }
    }

    /**
     * Первая форма UKn из фиксированного списка, элемент которой есть в документе
     */
    public Optional<UkFormTag> select(Document document) {
        Element root = document.getDocumentElement();
        for (UkFormTag form : UkFormTag.values()) {
            if (XmlTree.find(root, XmlTree.plain(form.elementName())) != null) {
                return Optional.of(form);
            }
        }
        return Optional.empty();
    }

    private NoticeRecord errorRecord(Exception e) {
        String description = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        return NoticeRecord.builder(FindATenderField.class)
                .set(FindATenderField.PARSE_ERROR, description)
                .build();
    }
}
