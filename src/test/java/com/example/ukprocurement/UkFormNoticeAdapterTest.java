package com.example.ukprocurement;

import org.junit.jupiter.api.Test;

import static com.example.ukprocurement.FindATenderField.*;
import static org.assertj.core.api.Assertions.assertThat;

class UkFormNoticeAdapterTest {
    private final UkFormNoticeAdapter adapter = new UkFormNoticeAdapter();

    @Test
    void normalize_awardForm() throws Exception {
        NoticeRecord record = adapter.normalize(Fixtures.document("uk7_award.xml"), UkFormTag.UK7_2023);

        assertThat(record.get(SCHEMA_TYPE)).isEqualTo("UK7_2023");
        assertThat(record.get(FORM_TYPE)).isEqualTo("UK7");
        assertThat(record.get(TD_DOCUMENT_TYPE_CODE)).isEqualTo("UK7");
        assertThat(record.get(NOTICE_TYPE_GROUP)).isEqualTo("CONTRACT_AWARD");
        assertThat(record.get(DOC_ID)).isEqualTo("012345-2024");
        assertThat(record.get(DATE_PUB)).isEqualTo("2024-03-01T10:00:00Z");
        assertThat(record.get(NO_DOC_OJS)).isEqualTo("2024/S 000-012345");
        assertThat(record.get(NOTICE_URL)).isEqualTo("https://www.find-tender.service.gov.uk/Notice/012345-2024");
    }

    @Test
    void normalize_takesFirstBuyerAndSortedSuppliers() throws Exception {
        NoticeRecord record = adapter.normalize(Fixtures.document("uk7_award.xml"), UkFormTag.UK7_2023);

        assertThat(record.get(CA_NAME)).isEqualTo("NHS Supply Chain");
        assertThat(record.get(ISO_COUNTRY)).isEqualTo("GB");
        assertThat(record.get(CA_COUNTRY_CODE)).isEqualTo("GB");
        assertThat(record.get(CA_TOWN)).isEqualTo("Alfreton");
        assertThat(record.get(TI_TOWN)).isEqualTo("Alfreton");
        assertThat(record.get(CA_POSTCODE)).isEqualTo("DE55 4QJ");
        assertThat(record.get(CA_NUTS_CODE)).isEqualTo("UKF11");
        assertThat(record.get(CA_URL)).isEqualTo("https://www.supplychain.nhs.uk");
        assertThat(record.get(CONTRACTOR_NAMES)).isEqualTo("Bunzl Healthcare;Medline Ltd");
    }

    @Test
    void normalize_collectsCpvAndDeliveryRegionsFromAwardItems() throws Exception {
        NoticeRecord record = adapter.normalize(Fixtures.document("uk7_award.xml"), UkFormTag.UK7_2023);

        assertThat(record.get(CPV_MAIN_CODE)).isEqualTo("18424300");
        assertThat(record.get(ORIGINAL_CPV_CODE)).isEqualTo("18424300");
        assertThat(record.get(ADDITIONAL_CPV_CODES)).isEqualTo("18100000;33140000");
        assertThat(record.get(PERF_NUTS_CODE)).isEqualTo("UKE;UKF");
    }

    @Test
    void normalize_mapsTenderAndCategory() throws Exception {
        NoticeRecord record = adapter.normalize(Fixtures.document("uk7_award.xml"), UkFormTag.UK7_2023);

        assertThat(record.get(OBJ_TITLE)).isEqualTo("Examination gloves framework");
        assertThat(record.get(TI_TEXT)).isEqualTo("Examination gloves framework");
        assertThat(record.get(SHORT_DESCR)).isEqualTo("Supply of nitrile examination gloves.");
        assertThat(record.get(TYPE_CONTRACT_CTYPE)).isEqualTo("SUPPLIES");
    }

    @Test
    void normalize_planningFormWithoutNoticeData() throws Exception {
        NoticeRecord record = adapter.normalize(Fixtures.document("uk1_planning.xml"), UkFormTag.UK1_2023);

        assertThat(record.get(NOTICE_TYPE_GROUP)).isEqualTo("PLANNING");
        assertThat(record.get(DOC_ID)).isEqualTo("ocds-h6vhtk-0399aa");
        assertThat(record.get(DATE_PUB)).isEqualTo("2024-01-15T12:00:00Z");
        assertThat(record.get(CA_NAME)).isEqualTo("Ministry of Defence");
        assertThat(record.get(TYPE_CONTRACT_CTYPE)).isEqualTo("WORKS");
        assertThat(record.get(CONTRACTOR_NAMES)).isNull();
        assertThat(record.get(CPV_MAIN_CODE)).isNull();
        assertThat(record.get(ADDITIONAL_CPV_CODES)).isNull();
    }

    @Test
    void normalize_singleCpvLeavesAdditionalEmpty() throws Exception {
        String xml = "<UK_NOTICE><UK6_2023><tag>award</tag><awards><items>"
                + "<additionalClassifications><scheme>CPV</scheme><id>72000000</id></additionalClassifications>"
                + "</items></awards></UK6_2023></UK_NOTICE>";

        NoticeRecord record = adapter.normalize(XmlNoticeParser.parse(xml), UkFormTag.UK6_2023);

        assertThat(record.get(CPV_MAIN_CODE)).isEqualTo("72000000");
        assertThat(record.get(ADDITIONAL_CPV_CODES)).isNull();
        assertThat(record.get(NOTICE_TYPE_GROUP)).isEqualTo("CONTRACT_AWARD");
    }

    @Test
    void normalize_missingFormElementKeepsIdentificationOnly() throws Exception {
        NoticeRecord record = adapter.normalize(Fixtures.document("uk7_award.xml"), UkFormTag.UK3_2023);

        assertThat(record.get(SCHEMA_TYPE)).isEqualTo("UK3_2023");
        assertThat(record.get(DOC_ID)).isEqualTo("012345-2024");
        assertThat(record.get(NOTICE_TYPE_GROUP)).isEqualTo("OTHER");
        assertThat(record.get(CA_NAME)).isNull();
    }
}
