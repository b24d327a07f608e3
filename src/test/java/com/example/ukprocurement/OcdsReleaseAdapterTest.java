package com.example.ukprocurement;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static com.example.ukprocurement.ContractsFinderField.*;
import static org.assertj.core.api.Assertions.assertThat;

class OcdsReleaseAdapterTest {
    private static final SourceRow ROW = new SourceRow("notices_2023-06-01.csv", 7,
            "https://www.contractsfinder.service.gov.uk/Published/Notice/releases/a1b2c3d4.json");

    private final OcdsReleaseAdapter adapter = new OcdsReleaseAdapter();

    @Test
    void normalize_minimalBuyerAndSupplier() {
        String json = "{\"releases\":[{"
                + "\"buyer\":{\"id\":\"B1\"},"
                + "\"parties\":[{\"id\":\"B1\",\"roles\":[\"buyer\"]},{\"id\":\"S1\",\"roles\":[\"supplier\"]}],"
                + "\"awards\":[{\"suppliers\":[{\"id\":\"S1\"}]}]}]}";

        NoticeRecord record = adapter.normalize(ROW, json);

        assertThat(record.get(STATUS)).isEqualTo("ok");
        assertThat(record.get(BUYER_ID)).isEqualTo("B1");
        assertThat(record.get(BUYER_ROLES)).isEqualTo("buyer");
        assertThat(record.get(SUPPLIER_PARTY_IDS)).isEqualTo("S1");
        assertThat(record.get(AWARD_SUPPLIERS_IDS)).isEqualTo("S1");
        assertThat(record.get(URI)).isEqualTo(ROW.getUri());
        assertThat(record.get(OCID)).isNull();
        assertThat(record.get(TENDER_TITLE)).isNull();
    }

    @Test
    void normalize_bookkeepingFromSourceRow() throws Exception {
        NoticeRecord record = adapter.normalize(ROW, Fixtures.text("contracts_finder_release.json"));

        assertThat(record.get(CSV_FILE)).isEqualTo("notices_2023-06-01.csv");
        assertThat(record.get(ROW_INDEX)).isEqualTo(7L);
        assertThat(record.get(STATUS)).isEqualTo(OcdsReleaseAdapter.STATUS_OK);
        assertThat(record.get(URI)).isEqualTo(
                "https://www.contractsfinder.service.gov.uk/Published/Notice/releases/a1b2c3d4.json");
        assertThat(record.get(PUBLISHED_DATE)).isEqualTo("2023-06-01T10:15:00Z");
    }

    @Test
    void normalize_packageAndReleaseFields() {
        NoticeRecord record = adapter.normalize(ROW, Fixtures.text("contracts_finder_release.json"));

        assertThat(record.get(PUBLISHER_NAME)).isEqualTo("Crown Commercial Service");
        assertThat(record.get(PUBLISHER_UID)).isEqualTo("09999999");
        assertThat(record.get(VERSION)).isEqualTo("1.1");
        assertThat(record.get(EXTENSIONS)).isEqualTo("https://standard.open-contracting.org/extensions/suitability.json");

        assertThat(record.get(OCID)).isEqualTo("ocds-b5fd17-a1b2c3d4");
        assertThat(record.get(RELEASE_ID)).isEqualTo("ocds-b5fd17-a1b2c3d4-1");
        assertThat(record.get(RELEASE_TITLE)).isEqualTo("Grounds maintenance");
        assertThat(record.get(RELEASE_TAG)).isEqualTo("award");
        assertThat(record.get(RELEASE_TAGS_ALL)).isEqualTo("award|contract");
        assertThat(record.get(INITIATION_TYPE)).isEqualTo("tender");

        assertThat(record.get(PLANNING_MILESTONE_IDS)).isEqualTo("M1");
        assertThat(record.get(PLANNING_MILESTONE_DUE_DATES)).isEqualTo("2023-01-10");
        assertThat(record.get(PLANNING_DOCUMENT_TYPES)).isEqualTo("plannedProcurementNotice");
        assertThat(record.get(PLANNING_DOCUMENT_DESCRIPTIONS)).isNull();
    }

    @Test
    void normalize_tenderFieldsKeepJsonScalarTypes() {
        NoticeRecord record = adapter.normalize(ROW, Fixtures.text("contracts_finder_release.json"));

        assertThat(record.get(TENDER_ID)).isEqualTo("T-77");
        assertThat(record.get(MAIN_PROCUREMENT_CATEGORY)).isEqualTo("services");
        assertThat(record.get(VALUE_AMOUNT)).isEqualTo(250000);
        assertThat(record.get(VALUE_CURRENCY)).isEqualTo("GBP");
        assertThat(record.get(MIN_VALUE_AMOUNT)).isEqualTo(200000.5);
        assertThat(record.get(SUITABILITY_SME)).isEqualTo(Boolean.TRUE);
        assertThat(record.get(SUITABILITY_VCSE)).isEqualTo(Boolean.FALSE);
        assertThat(record.get(CPV_ID)).isEqualTo("77310000");
        assertThat(record.get(ADDITIONAL_CPV_IDS)).isEqualTo("77311000|77312000");
        assertThat(record.get(TENDER_DOCUMENT_IDS)).isEqualTo("D1|D2");
        assertThat(record.get(TENDER_NOTICE_URL)).isEqualTo("https://cf.example/notice");
        assertThat(record.get(TENDER_END_DATE)).isEqualTo("2023-03-01T12:00:00Z");
        assertThat(record.get(CONTRACT_END_DATE)).isEqualTo("2026-04-30");
    }

    @Test
    void normalize_deliveryAddresses() {
        NoticeRecord record = adapter.normalize(ROW, Fixtures.text("contracts_finder_release.json"));

        assertThat(record.get(TENDER_ITEM_IDS)).isEqualTo("1|2");
        assertThat(record.get(TENDER_DELIVERY_REGIONS_ALL)).isEqualTo("North West|North East|Yorkshire");
        assertThat(record.get(TENDER_DELIVERY_POSTAL_CODES_ALL)).isEqualTo("M1 1AA|LS1 4DY");
        assertThat(record.get(TENDER_DELIVERY_COUNTRY_NAMES_ALL)).isEqualTo("United Kingdom");
        assertThat(record.get(DELIVERY_POSTAL_CODE)).isEqualTo("M1 1AA");
        assertThat(record.get(DELIVERY_REGION)).isEqualTo("North West");
        assertThat(record.get(DELIVERY_COUNTRY)).isEqualTo("United Kingdom");
    }

    @Test
    void normalize_buyerUsesPointerNameAndPartyDetails() {
        NoticeRecord record = adapter.normalize(ROW, Fixtures.text("contracts_finder_release.json"));

        assertThat(record.get(BUYER_ID)).isEqualTo("GB-CF-BUYER-1");
        assertThat(record.get(BUYER_NAME)).isEqualTo("Manchester City Council");
        assertThat(record.get(BUYER_LEGAL_NAME)).isEqualTo("Manchester City Council");
        assertThat(record.get(BUYER_IDENTIFIER_ID)).isEqualTo("PB123");
        assertThat(record.get(BUYER_LOCALITY)).isEqualTo("Manchester");
        assertThat(record.get(BUYER_CONTACT_EMAIL)).isEqualTo("buy@manchester.gov.uk");
        assertThat(record.get(BUYER_DETAILS_URL)).isEqualTo("https://www.manchester.gov.uk");
    }

    @Test
    void normalize_buyerFieldsStayEmptyWithoutMatchingParty() {
        String json = "{\"releases\":[{\"buyer\":{\"id\":\"B9\",\"name\":\"Orphan buyer\"},"
                + "\"parties\":[{\"id\":\"B1\",\"name\":\"Other\",\"roles\":[\"buyer\"]}]}]}";

        NoticeRecord record = adapter.normalize(ROW, json);

        assertThat(record.get(STATUS)).isEqualTo("ok");
        assertThat(record.get(BUYER_ID)).isNull();
        assertThat(record.get(BUYER_NAME)).isNull();
        assertThat(record.get(BUYER_ROLES)).isNull();
    }

    @Test
    void normalize_buyerNameFallsBackToParty() {
        String json = "{\"releases\":[{\"buyer\":{\"id\":\"B1\"},"
                + "\"parties\":[{\"id\":\"B1\",\"name\":\"Leeds City Council\",\"roles\":[\"buyer\"]}]}]}";

        assertThat(adapter.normalize(ROW, json).get(BUYER_NAME)).isEqualTo("Leeds City Council");
    }

    @Test
    void normalize_suppliersAndFirstAwardOnly() {
        NoticeRecord record = adapter.normalize(ROW, Fixtures.text("contracts_finder_release.json"));

        assertThat(record.get(SUPPLIER_PARTY_IDS)).isEqualTo("GB-COH-111|GB-COH-222");
        assertThat(record.get(SUPPLIER_PARTY_NAMES)).isEqualTo("Green Spaces Ltd|Hedges & Co");
        assertThat(record.get(SUPPLIER_LOCALITIES)).isEqualTo("Leeds");
        assertThat(record.get(SUPPLIER_SCALES)).isEqualTo("sme|large");
        assertThat(record.get(SUPPLIER_VCSE_FLAGS)).isEqualTo("false");
        assertThat(record.get(SUPPLIER_ROLES)).isEqualTo("supplier|tenderer");

        assertThat(record.get(AWARD_ID)).isEqualTo("AW-1");
        assertThat(record.get(AWARD_VALUE_AMOUNT)).isEqualTo(240000);
        assertThat(record.get(AWARD_SUPPLIERS_IDS)).isEqualTo("GB-COH-111|GB-COH-222");
        assertThat(record.getString(AWARD_SUPPLIERS_IDS)).doesNotContain("GB-COH-333");
        assertThat(record.get(AWARD_NOTICE_URL)).isEqualTo("https://cf.example/award");
        assertThat(record.get(AWARD_NOTICE_LANGUAGE)).isEqualTo("en");
        assertThat(record.get(AWARD_DOCUMENT_TYPES)).isEqualTo("awardNotice|contractSigned");
        assertThat(record.get(AWARD_DOCUMENT_DATE_MODIFIED)).isEqualTo("2023-06-02");
    }

    @Test
    void normalize_invalidJsonGivesFailureRecord() {
        NoticeRecord record = adapter.normalize(ROW, "{not json");

        assertThat(record.get(STATUS)).isEqualTo(OcdsReleaseAdapter.STATUS_FETCH_FAILED);
        assertThat(record.get(URI)).isEqualTo(ROW.getUri());
        assertThat(record.get(ROW_INDEX)).isEqualTo(7L);
        assertThat(record.get(OCID)).isNull();
    }

    @Test
    void normalize_nonObjectPackageGivesFailureRecord() throws Exception {
        assertThat(adapter.normalize(ROW, new ObjectMapper().readTree("[1, 2]")).get(STATUS))
                .isEqualTo("fetch_failed_or_invalid_json");
        assertThat(adapter.normalize(ROW, (String) null).get(STATUS))
                .isEqualTo("fetch_failed_or_invalid_json");
    }

    @Test
    void normalize_emptyPackageKeepsAllColumnsEmpty() {
        NoticeRecord record = adapter.normalize(ROW, "{\"releases\":[]}");

        assertThat(record.asMap()).hasSize(ContractsFinderField.values().length);
        assertThat(record.get(STATUS)).isEqualTo("ok");
        assertThat(record.get(OCID)).isNull();
        assertThat(record.get(AWARD_ID)).isNull();
        assertThat(record.get(SUPPLIER_PARTY_IDS)).isNull();
    }
}
