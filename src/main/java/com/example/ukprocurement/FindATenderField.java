package com.example.ukprocurement;

/**
 * Раскладка записи Find a Tender (XML). Общая для TED-форм и форм UKn_2023,
 * поля, которых нет в конкретной форме, остаются null.
 */
public enum FindATenderField implements RecordField {
    SCHEMA_TYPE("schema_type"),
    FORM_TYPE("form_type"),
    TD_DOCUMENT_TYPE_CODE("td_document_type_code"),
    NOTICE_TYPE_GROUP("notice_type_group"),

    DOC_ID("doc_id"),
    EDITION("edition"),
    NO_DOC_OJS("no_doc_ojs"),
    NOTICE_URL("notice_url"),

    DATE_PUB("date_pub"),
    DS_DATE_DISPATCH("ds_date_dispatch"),
    AWARD_DATE("award_date"),

    // география
    ISO_COUNTRY("iso_country"),
    TI_COUNTRY("ti_country"),
    TI_TOWN("ti_town"),
    CA_COUNTRY_CODE("ca_country_code"),
    CA_TOWN("ca_town"),
    CA_POSTCODE("ca_postcode"),
    CA_NUTS_CODE("ca_nuts_code"),
    PERF_NUTS_CODE("perf_nuts_code"),
    CA_CE_NUTS_CODE("ca_ce_nuts_code"),

    // заказчик
    CA_NAME("ca_name"),
    CA_EMAIL("ca_email"),
    CA_URL("ca_url"),

    ORIGINAL_CPV_CODE("original_cpv_code"),
    CPV_MAIN_CODE("cpv_main_code"),
    ADDITIONAL_CPV_CODES("additional_cpv_codes"),

    TI_TEXT("ti_text"),
    OBJ_TITLE("obj_title"),
    SHORT_DESCR("short_descr"),
    TYPE_CONTRACT_CTYPE("type_contract_ctype"),

    // стоимость: сумма + валюта
    VAL_TOTAL("val_total"),
    VAL_TOTAL_CURRENCY("val_total_currency"),
    EST_TOTAL_VAL("est_total_val"),
    EST_TOTAL_VAL_CURRENCY("est_total_val_currency"),
    PROC_TOTAL_VAL("proc_total_val"),
    PROC_TOTAL_VAL_CURRENCY("proc_total_val_currency"),
    AW_VAL_TOTAL("aw_val_total"),
    AW_VAL_CURRENCY("aw_val_currency"),
    NB_TENDERS("nb_tenders"),

    // кодифицированные атрибуты CODIF_DATA
    NC_CONTRACT_NATURE_CODE("nc_contract_nature_code"),
    PR_PROC_CODE("pr_proc_code"),
    AC_AWARD_CRIT_CODE("ac_award_crit_code"),
    MA_MAIN_ACTIVITIES_CODE("ma_main_activities_code"),
    RP_REGULATION_CODE("rp_regulation_code"),

    CONTRACTOR_NAMES("contractor_names"),

    // служебные
    PARSE_ERROR("parse_error"),
    SOURCE_XML_FILE("source_xml_file"),
    SOURCE_ZIP("source_zip");

    private final String column;

    FindATenderField(String column) {
        this.column = column;
    }

    @Override
    public String column() {
        return column;
    }
}
