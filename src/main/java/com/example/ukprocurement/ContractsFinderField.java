package com.example.ukprocurement;

/**
 * Раскладка записи Contracts Finder (OCDS JSON). Одна строка на URI из дневного списка.
 */
public enum ContractsFinderField implements RecordField {
    // служебные
    CSV_FILE("csv_file"),
    ROW_INDEX("row_index"),
    STATUS("status"),

    // идентификация релиза
    URI("uri"),
    PUBLISHED_DATE("publishedDate"),
    OCID("ocid"),
    RELEASE_ID("release_id"),
    RELEASE_TITLE("release_title"),
    RELEASE_DATE("release_date"),
    RELEASE_LANGUAGE("release_language"),
    RELEASE_TAG("release_tag"),
    RELEASE_TAGS_ALL("release_tags_all"),
    INITIATION_TYPE("initiationType"),

    // планирование
    PLANNING_MILESTONE_IDS("planning_milestone_ids"),
    PLANNING_MILESTONE_TITLES("planning_milestone_titles"),
    PLANNING_MILESTONE_TYPES("planning_milestone_types"),
    PLANNING_MILESTONE_DUE_DATES("planning_milestone_dueDates"),
    PLANNING_DOCUMENT_IDS("planning_document_ids"),
    PLANNING_DOCUMENT_TYPES("planning_document_types"),
    PLANNING_DOCUMENT_DESCRIPTIONS("planning_document_descriptions"),
    PLANNING_DOCUMENT_URLS("planning_document_urls"),
    PLANNING_DOCUMENT_DATE_PUBLISHED("planning_document_datePublished"),
    PLANNING_DOCUMENT_FORMATS("planning_document_formats"),
    PLANNING_DOCUMENT_LANGUAGES("planning_document_languages"),

    // издатель и метаданные пакета
    PUBLISHER_NAME("publisher_name"),
    PUBLISHER_SCHEME("publisher_scheme"),
    PUBLISHER_UID("publisher_uid"),
    PUBLISHER_URI("publisher_uri"),
    VERSION("version"),
    EXTENSIONS("extensions"),
    LICENSE("license"),
    PUBLICATION_POLICY("publicationPolicy"),

    // тендер
    TENDER_ID("tender_id"),
    TENDER_TITLE("tender_title"),
    TENDER_DESCRIPTION("tender_description"),
    TENDER_STATUS("tender_status"),
    MAIN_PROCUREMENT_CATEGORY("mainProcurementCategory"),

    // стоимость
    VALUE_AMOUNT("value_amount"),
    VALUE_CURRENCY("value_currency"),
    MIN_VALUE_AMOUNT("minValue_amount"),
    MIN_VALUE_CURRENCY("minValue_currency"),

    // CPV и документы тендера
    CPV_SCHEME("cpv_scheme"),
    CPV_ID("cpv_id"),
    CPV_DESCRIPTION("cpv_description"),
    ADDITIONAL_CPV_IDS("additional_cpv_ids"),
    ADDITIONAL_CPV_DESCRIPTIONS("additional_cpv_descriptions"),
    TENDER_DOCUMENT_IDS("tender_document_ids"),
    TENDER_DOCUMENT_TYPES("tender_document_types"),
    TENDER_DOCUMENT_DESCRIPTIONS("tender_document_descriptions"),
    TENDER_DOCUMENT_URLS("tender_document_urls"),
    TENDER_DOCUMENT_DATE_PUBLISHED("tender_document_datePublished"),
    TENDER_DOCUMENT_DATE_MODIFIED("tender_document_dateModified"),
    TENDER_DOCUMENT_FORMATS("tender_document_formats"),
    TENDER_DOCUMENT_LANGUAGES("tender_document_languages"),

    // география поставки
    TENDER_ITEM_IDS("tender_item_ids"),
    TENDER_DELIVERY_POSTAL_CODES_ALL("tender_delivery_postalCodes_all"),
    TENDER_DELIVERY_REGIONS_ALL("tender_delivery_regions_all"),
    TENDER_DELIVERY_COUNTRY_NAMES_ALL("tender_delivery_countryNames_all"),
    DELIVERY_POSTAL_CODE("delivery_postalCode"),
    DELIVERY_REGION("delivery_region"),
    DELIVERY_COUNTRY("delivery_country"),

    // сроки
    TENDER_DATE_PUBLISHED("tender_datePublished"),
    TENDER_END_DATE("tender_endDate"),
    CONTRACT_START_DATE("contract_startDate"),
    CONTRACT_END_DATE("contract_endDate"),

    // способ закупки, признаки МСП
    PROCUREMENT_METHOD("procurementMethod"),
    PROCUREMENT_METHOD_DETAILS("procurementMethodDetails"),
    SUITABILITY_SME("suitability_sme"),
    SUITABILITY_VCSE("suitability_vcse"),

    // заказчик
    BUYER_ID("buyer_id"),
    BUYER_NAME("buyer_name"),
    BUYER_LEGAL_NAME("buyer_legalName"),
    BUYER_IDENTIFIER_SCHEME("buyer_identifier_scheme"),
    BUYER_IDENTIFIER_ID("buyer_identifier_id"),
    BUYER_STREET_ADDRESS("buyer_streetAddress"),
    BUYER_LOCALITY("buyer_locality"),
    BUYER_POSTAL_CODE("buyer_postalCode"),
    BUYER_COUNTRY_NAME("buyer_countryName"),
    BUYER_CONTACT_NAME("buyer_contact_name"),
    BUYER_CONTACT_EMAIL("buyer_contact_email"),
    BUYER_CONTACT_TELEPHONE("buyer_contact_telephone"),
    BUYER_DETAILS_URL("buyer_details_url"),
    BUYER_ROLES("buyer_roles"),

    // поставщики (роль supplier)
    SUPPLIER_PARTY_IDS("supplier_party_ids"),
    SUPPLIER_PARTY_NAMES("supplier_party_names"),
    SUPPLIER_LEGAL_NAMES("supplier_legalNames"),
    SUPPLIER_IDENTIFIER_SCHEMES("supplier_identifier_schemes"),
    SUPPLIER_IDENTIFIER_IDS("supplier_identifier_ids"),
    SUPPLIER_STREET_ADDRESSES("supplier_streetAddresses"),
    SUPPLIER_LOCALITIES("supplier_localities"),
    SUPPLIER_POSTAL_CODES("supplier_postalCodes"),
    SUPPLIER_COUNTRY_NAMES("supplier_countryNames"),
    SUPPLIER_SCALES("supplier_scales"),
    SUPPLIER_VCSE_FLAGS("supplier_vcse_flags"),
    SUPPLIER_DETAILS_URLS("supplier_details_urls"),
    SUPPLIER_ROLES("supplier_roles"),

    // ссылки
    TENDER_NOTICE_URL("tender_notice_url"),
    TENDER_NOTICE_DESCRIPTION("tender_notice_description"),

    // первая награда (award)
    AWARD_ID("award_id"),
    AWARD_STATUS("award_status"),
    AWARD_DATE("award_date"),
    AWARD_DATE_PUBLISHED("award_datePublished"),
    AWARD_VALUE_AMOUNT("award_value_amount"),
    AWARD_VALUE_CURRENCY("award_value_currency"),
    AWARD_CONTRACT_START_DATE("award_contract_startDate"),
    AWARD_CONTRACT_END_DATE("award_contract_endDate"),
    AWARD_SUPPLIERS_IDS("award_suppliers_ids"),
    AWARD_SUPPLIERS_NAMES("award_suppliers_names"),
    AWARD_NOTICE_URL("award_notice_url"),
    AWARD_NOTICE_DESCRIPTION("award_notice_description"),
    AWARD_NOTICE_DATE_PUBLISHED("award_notice_datePublished"),
    AWARD_NOTICE_FORMAT("award_notice_format"),
    AWARD_NOTICE_LANGUAGE("award_notice_language"),
    AWARD_DOCUMENT_IDS("award_document_ids"),
    AWARD_DOCUMENT_TYPES("award_document_types"),
    AWARD_DOCUMENT_DESCRIPTIONS("award_document_descriptions"),
    AWARD_DOCUMENT_URLS("award_document_urls"),
    AWARD_DOCUMENT_DATE_PUBLISHED("award_document_datePublished"),
    AWARD_DOCUMENT_DATE_MODIFIED("award_document_dateModified"),
    AWARD_DOCUMENT_FORMATS("award_document_formats"),
    AWARD_DOCUMENT_LANGUAGES("award_document_languages");

    private final String column;

    ContractsFinderField(String column) {
        this.column = column;
    }

    @Override
    public String column() {
        return column;
    }
}
