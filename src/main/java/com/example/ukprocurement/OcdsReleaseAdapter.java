package com.example.ukprocurement;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

import static com.example.ukprocurement.ContractsFinderField.*;
import static com.example.ukprocurement.OcdsNodes.array;
import static com.example.ukprocurement.OcdsNodes.first;
import static com.example.ukprocurement.OcdsNodes.node;
import static com.example.ukprocurement.OcdsNodes.scalar;
import static com.example.ukprocurement.OcdsNodes.scalarTexts;
import static com.example.ukprocurement.OcdsNodes.text;
import static com.example.ukprocurement.OcdsNodes.texts;

/**
 * Пакет релизов OCDS из Contracts Finder в плоскую запись.
 * <p>
 * Берется только первый релиз пакета и только первая награда релиза: это снимок на момент
 * публикации, цепочки поправок не сводятся. Любое отсутствующее поле дает null.
 */
@Slf4j
public class OcdsReleaseAdapter {
    public static final String STATUS_OK = "ok";
    public static final String STATUS_FETCH_FAILED = "fetch_failed_or_invalid_json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * Разбирает текст пакета и нормализует его. Невалидный JSON дает запись об ошибке.
     */
    public NoticeRecord normalize(SourceRow row, String json) {
        if (json == null) {
            return failed(row);
        }
        try {
            return normalize(row, MAPPER.readTree(json));
        } catch (JsonProcessingException e) {
            log.warn("Invalid JSON for {}: {}", row.getUri(), e.getOriginalMessage());
            return failed(row);
        }
    }

    public NoticeRecord normalize(SourceRow row, JsonNode releasePackage) {
        if (releasePackage == null || !releasePackage.isObject()) {
            return failed(row);
        }
        NoticeRecord.Builder record = bookkeeping(row, STATUS_OK);

        String packageUri = text(releasePackage, "uri");
        record.set(URI, packageUri != null ? packageUri : row.getUri());
        record.set(PUBLISHED_DATE, scalar(releasePackage, "publishedDate"));
        extractPublisher(releasePackage, record);

        JsonNode release = first(releasePackage, "releases");
        extractRelease(release, record);
        extractPlanning(node(release, "planning"), record);

        JsonNode tender = node(release, "tender");
        extractTender(tender, record);
        extractDelivery(tender, record);

        extractBuyer(release, record);
        extractSuppliers(release, record);
        extractAward(first(release, "awards"), record);

        if (Config.getParserVerbose()) {
            log.debug("Normalized release {} from {}", record.peek(OCID), row.getUri());
        }
        return record.build();
    }

    /**
     * Запись для строки, пакет которой не удалось получить или разобрать
     */
    public NoticeRecord failed(SourceRow row) {
        return bookkeeping(row, STATUS_FETCH_FAILED).set(URI, row.getUri()).build();
    }

    static NoticeRecord.Builder bookkeeping(SourceRow row, String status) {
        return NoticeRecord.builder(ContractsFinderField.class)
                .set(CSV_FILE, row.getCsvFile())
                .set(ROW_INDEX, row.getRowIndex())
                .set(STATUS, status);
    }

    private void extractPublisher(JsonNode releasePackage, NoticeRecord.Builder record) {
        record.set(PUBLISHER_NAME, scalar(releasePackage, "publisher", "name"));
        record.set(PUBLISHER_SCHEME, scalar(releasePackage, "publisher", "scheme"));
        record.set(PUBLISHER_UID, scalar(releasePackage, "publisher", "uid"));
        record.set(PUBLISHER_URI, scalar(releasePackage, "publisher", "uri"));
        record.set(VERSION, scalar(releasePackage, "version"));
        record.set(EXTENSIONS, join(scalarTexts(array(releasePackage, "extensions"))));
        record.set(LICENSE, scalar(releasePackage, "license"));
        record.set(PUBLICATION_POLICY, scalar(releasePackage, "publicationPolicy"));
    }

    private void extractRelease(JsonNode release, NoticeRecord.Builder record) {
        record.set(OCID, scalar(release, "ocid"));
        record.set(RELEASE_ID, scalar(release, "id"));
        record.set(RELEASE_TITLE, scalar(release, "title"));
        record.set(RELEASE_DATE, scalar(release, "date"));
        record.set(RELEASE_LANGUAGE, scalar(release, "language"));

        List<String> tags = scalarTexts(array(release, "tag"));
        record.set(RELEASE_TAG, tags.isEmpty() ? null : tags.get(0));
        record.set(RELEASE_TAGS_ALL, join(tags));
        record.set(INITIATION_TYPE, scalar(release, "initiationType"));
    }

    private void extractPlanning(JsonNode planning, NoticeRecord.Builder record) {
        List<JsonNode> milestones = array(planning, "milestones");
        record.set(PLANNING_MILESTONE_IDS, join(texts(milestones, "id")));
        record.set(PLANNING_MILESTONE_TITLES, join(texts(milestones, "title")));
        record.set(PLANNING_MILESTONE_TYPES, join(texts(milestones, "type")));
        record.set(PLANNING_MILESTONE_DUE_DATES, join(texts(milestones, "dueDate")));

        List<JsonNode> documents = array(planning, "documents");
        record.set(PLANNING_DOCUMENT_IDS, join(texts(documents, "id")));
        record.set(PLANNING_DOCUMENT_TYPES, join(texts(documents, "documentType")));
        record.set(PLANNING_DOCUMENT_DESCRIPTIONS, join(texts(documents, "description")));
        record.set(PLANNING_DOCUMENT_URLS, join(texts(documents, "url")));
        record.set(PLANNING_DOCUMENT_DATE_PUBLISHED, join(texts(documents, "datePublished")));
        record.set(PLANNING_DOCUMENT_FORMATS, join(texts(documents, "format")));
        record.set(PLANNING_DOCUMENT_LANGUAGES, join(texts(documents, "language")));
    }

    private void extractTender(JsonNode tender, NoticeRecord.Builder record) {
        record.set(TENDER_ID, scalar(tender, "id"));
        record.set(TENDER_TITLE, scalar(tender, "title"));
        record.set(TENDER_DESCRIPTION, scalar(tender, "description"));
        record.set(TENDER_STATUS, scalar(tender, "status"));
        record.set(MAIN_PROCUREMENT_CATEGORY, scalar(tender, "mainProcurementCategory"));

        record.set(VALUE_AMOUNT, scalar(tender, "value", "amount"));
        record.set(VALUE_CURRENCY, scalar(tender, "value", "currency"));
        record.set(MIN_VALUE_AMOUNT, scalar(tender, "minValue", "amount"));
        record.set(MIN_VALUE_CURRENCY, scalar(tender, "minValue", "currency"));

        record.set(CPV_SCHEME, scalar(tender, "classification", "scheme"));
        record.set(CPV_ID, scalar(tender, "classification", "id"));
        record.set(CPV_DESCRIPTION, scalar(tender, "classification", "description"));
        List<JsonNode> additional = array(tender, "additionalClassifications");
        record.set(ADDITIONAL_CPV_IDS, join(texts(additional, "id")));
        record.set(ADDITIONAL_CPV_DESCRIPTIONS, join(texts(additional, "description")));

        List<JsonNode> documents = array(tender, "documents");
        record.set(TENDER_DOCUMENT_IDS, join(texts(documents, "id")));
        record.set(TENDER_DOCUMENT_TYPES, join(texts(documents, "documentType")));
        record.set(TENDER_DOCUMENT_DESCRIPTIONS, join(texts(documents, "description")));
        record.set(TENDER_DOCUMENT_URLS, join(texts(documents, "url")));
        record.set(TENDER_DOCUMENT_DATE_PUBLISHED, join(texts(documents, "datePublished")));
        record.set(TENDER_DOCUMENT_DATE_MODIFIED, join(texts(documents, "dateModified")));
        record.set(TENDER_DOCUMENT_FORMATS, join(texts(documents, "format")));
        record.set(TENDER_DOCUMENT_LANGUAGES, join(texts(documents, "language")));

        JsonNode notice = findDocument(documents, "tenderNotice");
        record.set(TENDER_NOTICE_URL, scalar(notice, "url"));
        record.set(TENDER_NOTICE_DESCRIPTION, scalar(notice, "description"));

        record.set(TENDER_DATE_PUBLISHED, scalar(tender, "datePublished"));
        record.set(TENDER_END_DATE, scalar(tender, "tenderPeriod", "endDate"));
        record.set(CONTRACT_START_DATE, scalar(tender, "contractPeriod", "startDate"));
        record.set(CONTRACT_END_DATE, scalar(tender, "contractPeriod", "endDate"));

        record.set(PROCUREMENT_METHOD, scalar(tender, "procurementMethod"));
        record.set(PROCUREMENT_METHOD_DETAILS, scalar(tender, "procurementMethodDetails"));
        record.set(SUITABILITY_SME, scalar(tender, "suitability", "sme"));
        record.set(SUITABILITY_VCSE, scalar(tender, "suitability", "vcse"));
    }

    /**
     * Колонки *_all собирают все адреса всех позиций; одиночные delivery_* берутся
     * из адресов первой позиции, первое непустое значение каждого поля.
     */
    private void extractDelivery(JsonNode tender, NoticeRecord.Builder record) {
        List<JsonNode> items = array(tender, "items");
        record.set(TENDER_ITEM_IDS, join(texts(items, "id")));

        List<JsonNode> allAddresses = new ArrayList<>();
        for (JsonNode item : items) {
            allAddresses.addAll(objects(array(item, "deliveryAddresses")));
        }
        record.set(TENDER_DELIVERY_POSTAL_CODES_ALL, join(texts(allAddresses, "postalCode")));
        record.set(TENDER_DELIVERY_REGIONS_ALL, join(texts(allAddresses, "region")));
        record.set(TENDER_DELIVERY_COUNTRY_NAMES_ALL, join(texts(allAddresses, "countryName")));

        List<JsonNode> firstItemAddresses = items.isEmpty()
                ? List.of()
                : objects(array(items.get(0), "deliveryAddresses"));
        record.set(DELIVERY_POSTAL_CODE, firstNonEmpty(firstItemAddresses, "postalCode"));
        record.set(DELIVERY_REGION, firstNonEmpty(firstItemAddresses, "region"));
        record.set(DELIVERY_COUNTRY, firstNonEmpty(firstItemAddresses, "countryName"));
    }

    /**
     * Заказчик - сторона, чей id совпадает с release.buyer.id. Если такой стороны нет,
     * все поля заказчика остаются пустыми.
     */
    private void extractBuyer(JsonNode release, NoticeRecord.Builder record) {
        JsonNode party = findBuyerParty(release);
        if (party == null) {
            if (Config.getParserVerbose()) {
                log.debug("No party matches buyer id {}", text(release, "buyer", "id"));
            }
            return;
        }
        Object pointerName = scalar(release, "buyer", "name");
        record.set(BUYER_ID, scalar(release, "buyer", "id"));
        record.set(BUYER_NAME, pointerName != null ? pointerName : scalar(party, "name"));
        record.set(BUYER_LEGAL_NAME, scalar(party, "identifier", "legalName"));
        record.set(BUYER_IDENTIFIER_SCHEME, scalar(party, "identifier", "scheme"));
        record.set(BUYER_IDENTIFIER_ID, scalar(party, "identifier", "id"));
        record.set(BUYER_STREET_ADDRESS, scalar(party, "address", "streetAddress"));
        record.set(BUYER_LOCALITY, scalar(party, "address", "locality"));
        record.set(BUYER_POSTAL_CODE, scalar(party, "address", "postalCode"));
        record.set(BUYER_COUNTRY_NAME, scalar(party, "address", "countryName"));
        record.set(BUYER_CONTACT_NAME, scalar(party, "contactPoint", "name"));
        record.set(BUYER_CONTACT_EMAIL, scalar(party, "contactPoint", "email"));
        record.set(BUYER_CONTACT_TELEPHONE, scalar(party, "contactPoint", "telephone"));
        record.set(BUYER_DETAILS_URL, scalar(party, "details", "url"));
        record.set(BUYER_ROLES, join(scalarTexts(array(party, "roles"))));
    }

    private JsonNode findBuyerParty(JsonNode release) {
        String buyerId = text(release, "buyer", "id");
        if (NoticeText.isBlank(buyerId)) {
            return null;
        }
        for (JsonNode party : array(release, "parties")) {
            if (buyerId.equals(text(party, "id"))) {
                return party;
            }
        }
        return null;
    }

    /**
     * Поставщики - все стороны документа с ролью supplier, в порядке документа
     */
    private void extractSuppliers(JsonNode release, NoticeRecord.Builder record) {
        List<JsonNode> suppliers = new ArrayList<>();
        for (JsonNode party : array(release, "parties")) {
            if (scalarTexts(array(party, "roles")).contains("supplier")) {
                suppliers.add(party);
            }
        }

        record.set(SUPPLIER_PARTY_IDS, join(texts(suppliers, "id")));
        record.set(SUPPLIER_PARTY_NAMES, join(texts(suppliers, "name")));
        record.set(SUPPLIER_LEGAL_NAMES, join(texts(suppliers, "identifier", "legalName")));
        record.set(SUPPLIER_IDENTIFIER_SCHEMES, join(texts(suppliers, "identifier", "scheme")));
        record.set(SUPPLIER_IDENTIFIER_IDS, join(texts(suppliers, "identifier", "id")));
        record.set(SUPPLIER_STREET_ADDRESSES, join(texts(suppliers, "address", "streetAddress")));
        record.set(SUPPLIER_LOCALITIES, join(texts(suppliers, "address", "locality")));
        record.set(SUPPLIER_POSTAL_CODES, join(texts(suppliers, "address", "postalCode")));
        record.set(SUPPLIER_COUNTRY_NAMES, join(texts(suppliers, "address", "countryName")));
        record.set(SUPPLIER_SCALES, join(texts(suppliers, "details", "scale")));
        record.set(SUPPLIER_VCSE_FLAGS, join(texts(suppliers, "details", "vcse")));
        record.set(SUPPLIER_DETAILS_URLS, join(texts(suppliers, "details", "url")));

        List<String> roles = new ArrayList<>();
        for (JsonNode supplier : suppliers) {
            roles.addAll(scalarTexts(array(supplier, "roles")));
        }
        record.set(SUPPLIER_ROLES, join(roles));
    }

    private void extractAward(JsonNode award, NoticeRecord.Builder record) {
        record.set(AWARD_ID, scalar(award, "id"));
        record.set(AWARD_STATUS, scalar(award, "status"));
        record.set(AWARD_DATE, scalar(award, "date"));
        record.set(AWARD_DATE_PUBLISHED, scalar(award, "datePublished"));
        record.set(AWARD_VALUE_AMOUNT, scalar(award, "value", "amount"));
        record.set(AWARD_VALUE_CURRENCY, scalar(award, "value", "currency"));
        record.set(AWARD_CONTRACT_START_DATE, scalar(award, "contractPeriod", "startDate"));
        record.set(AWARD_CONTRACT_END_DATE, scalar(award, "contractPeriod", "endDate"));

        List<JsonNode> suppliers = array(award, "suppliers");
        record.set(AWARD_SUPPLIERS_IDS, join(texts(suppliers, "id")));
        record.set(AWARD_SUPPLIERS_NAMES, join(texts(suppliers, "name")));

        List<JsonNode> documents = array(award, "documents");
        JsonNode notice = findDocument(documents, "awardNotice");
        record.set(AWARD_NOTICE_URL, scalar(notice, "url"));
        record.set(AWARD_NOTICE_DESCRIPTION, scalar(notice, "description"));
        record.set(AWARD_NOTICE_DATE_PUBLISHED, scalar(notice, "datePublished"));
        record.set(AWARD_NOTICE_FORMAT, scalar(notice, "format"));
        record.set(AWARD_NOTICE_LANGUAGE, scalar(notice, "language"));

        record.set(AWARD_DOCUMENT_IDS, join(texts(documents, "id")));
        record.set(AWARD_DOCUMENT_TYPES, join(texts(documents, "documentType")));
        record.set(AWARD_DOCUMENT_DESCRIPTIONS, join(texts(documents, "description")));
        record.set(AWARD_DOCUMENT_URLS, join(texts(documents, "url")));
        record.set(AWARD_DOCUMENT_DATE_PUBLISHED, join(texts(documents, "datePublished")));
        record.set(AWARD_DOCUMENT_DATE_MODIFIED, join(texts(documents, "dateModified")));
        record.set(AWARD_DOCUMENT_FORMATS, join(texts(documents, "format")));
        record.set(AWARD_DOCUMENT_LANGUAGES, join(texts(documents, "language")));
    }

    private JsonNode findDocument(List<JsonNode> documents, String documentType) {
        for (JsonNode document : documents) {
            if (documentType.equals(text(document, "documentType"))) {
                return document;
            }
        }
        return null;
    }

    private static List<JsonNode> objects(List<JsonNode> nodes) {
        List<JsonNode> result = new ArrayList<>();
        for (JsonNode node : nodes) {
            if (node.isObject()) {
                result.add(node);
            }
        }
        return result;
    }

    private static String firstNonEmpty(List<JsonNode> nodes, String key) {
        for (JsonNode node : nodes) {
            String value = text(node, key);
            if (!NoticeText.isBlank(value)) {
                return value;
            }
        }
        return null;
    }

    private static String join(List<String> values) {
        return NoticeText.joinOrdered(values);
    }
}
