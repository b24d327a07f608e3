package com.example.ukprocurement;

import lombok.extern.slf4j.Slf4j;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;

import static com.example.ukprocurement.FindATenderField.*;
import static com.example.ukprocurement.XmlTree.plain;

/**
 * Британские формы UKn_2023 (и UK1_2022): данные в форме OCDS, но сериализованные в XML
 * без пространств имен.
 * <p>
 * Поставщики здесь собираются из сторон внутри формы по роли supplier и склеиваются по имени,
 * а CPV и регионы поставки берутся из позиций наград (awards/items).
 */
@Slf4j
public class UkFormNoticeAdapter {

    public NoticeRecord normalize(Document document, UkFormTag form) {
        Element root = document.getDocumentElement();
        NoticeRecord.Builder record = NoticeRecord.builder(FindATenderField.class);

        record.set(SCHEMA_TYPE, form.elementName());
        record.set(FORM_TYPE, form.formCode());
        record.set(TD_DOCUMENT_TYPE_CODE, form.formCode());

        Element noticeData = XmlTree.child(root, plain("NOTICE_DATA"));
        String docId = XmlTree.text(XmlTree.child(noticeData, plain("DOC_ID")));
        String datePub = XmlTree.text(XmlTree.child(noticeData, plain("PUBLISHED")));
        record.set(NO_DOC_OJS, XmlTree.text(XmlTree.child(noticeData, plain("NO_DOC_EXT"))));
        record.set(NOTICE_URL, XmlTree.text(XmlTree.child(noticeData, plain("URI_DOC"))));
        record.set(DOC_ID, docId);
        record.set(DATE_PUB, datePub);

        Element formElement = XmlTree.find(root, plain(form.elementName()));
        if (formElement == null) {
            log.warn("Form element {} not found, only identification fields extracted", form.elementName());
            record.set(NOTICE_TYPE_GROUP, NoticeTypeGroup.OTHER.name());
            return record.build();
        }

        if (docId == null) {
            record.set(DOC_ID, XmlTree.text(XmlTree.child(formElement, plain("id"))));
        }
        if (datePub == null) {
            record.set(DATE_PUB, XmlTree.text(XmlTree.child(formElement, plain("date"))));
        }

        extractParties(formElement, record);
        extractAwardItems(formElement, record);

        Element tender = XmlTree.child(formElement, plain("tender"));
        String title = XmlTree.text(XmlTree.child(tender, plain("title")));
        record.set(OBJ_TITLE, title);
        record.set(TI_TEXT, title);
        record.set(SHORT_DESCR, XmlTree.text(XmlTree.child(tender, plain("description"))));

        record.set(TYPE_CONTRACT_CTYPE, ContractTypeRules.infer(mainProcurementCategory(formElement)));

        List<String> tags = new ArrayList<>();
        for (Element tag : XmlTree.children(formElement, plain("tag"))) {
            String value = XmlTree.text(tag);
            if (value != null) {
                tags.add(value);
            }
        }
        record.set(NOTICE_TYPE_GROUP, NoticeClassifier.classifyUkForm(form, tags).name());

        if (Config.getParserVerbose()) {
            log.debug("UK notice {} ({}, tags {})", record.peek(DOC_ID), form, tags);
        }
        return record.build();
    }

    private void extractParties(Element formElement, NoticeRecord.Builder record) {
        boolean buyerFound = false;
        List<String> supplierNames = new ArrayList<>();

        for (Element party : XmlTree.children(formElement, plain("parties"))) {
            List<String> roles = new ArrayList<>();
            for (Element role : XmlTree.children(party, plain("roles"))) {
                String value = XmlTree.text(role);
                if (value != null) {
                    roles.add(value);
                }
            }
            String name = XmlTree.text(XmlTree.child(party, plain("name")));

            if (roles.contains("buyer") && !buyerFound) {
                buyerFound = true;
                Element address = XmlTree.child(party, plain("address"));
                String country = XmlTree.text(XmlTree.child(address, plain("country")));
                String locality = XmlTree.text(XmlTree.child(address, plain("locality")));
                record.set(CA_NAME, name);
                record.set(ISO_COUNTRY, country);
                record.set(CA_COUNTRY_CODE, country);
                record.set(TI_TOWN, locality);
                record.set(CA_TOWN, locality);
                record.set(CA_POSTCODE, XmlTree.text(XmlTree.child(address, plain("postalCode"))));
                record.set(CA_NUTS_CODE, XmlTree.text(XmlTree.child(address, plain("region"))));
                Element details = XmlTree.child(party, plain("details"));
                record.set(CA_URL, XmlTree.text(XmlTree.child(details, plain("url"))));
            }
            if (roles.contains("supplier")) {
                supplierNames.add(name);
            }
        }

        // запасной вариант: отдельный элемент buyer только с именем
        if (record.peek(CA_NAME) == null) {
            Element buyer = XmlTree.child(formElement, plain("buyer"));
            record.set(CA_NAME, XmlTree.text(XmlTree.child(buyer, plain("name"))));
        }
        record.set(CONTRACTOR_NAMES, NoticeText.joinSorted(supplierNames));
    }

    private void extractAwardItems(Element formElement, NoticeRecord.Builder record) {
        List<String> cpvCodes = new ArrayList<>();
        List<String> regions = new ArrayList<>();
        for (Element award : XmlTree.children(formElement, plain("awards"))) {
            for (Element item : XmlTree.children(award, plain("items"))) {
                for (Element classification : XmlTree.children(item, plain("additionalClassifications"))) {
                    String scheme = XmlTree.text(XmlTree.child(classification, plain("scheme")));
                    String id = XmlTree.text(XmlTree.child(classification, plain("id")));
                    if ("CPV".equals(scheme) && id != null) {
                        cpvCodes.add(id);
                    }
                }
                for (Element address : XmlTree.children(item, plain("deliveryAddresses"))) {
                    regions.add(XmlTree.text(XmlTree.child(address, plain("region"))));
                }
            }
        }

        String main = cpvCodes.isEmpty() ? null : cpvCodes.get(0);
        record.set(CPV_MAIN_CODE, main);
        record.set(ORIGINAL_CPV_CODE, main);
        if (cpvCodes.size() > 1) {
            record.set(ADDITIONAL_CPV_CODES, NoticeText.joinSorted(cpvCodes.subList(1, cpvCodes.size())));
        }
        record.set(PERF_NUTS_CODE, NoticeText.joinSorted(regions));
    }

    private String mainProcurementCategory(Element formElement) {
        for (Element award : XmlTree.children(formElement, plain("awards"))) {
            String category = XmlTree.text(XmlTree.child(award, plain("mainProcurementCategory")));
            if (category != null) {
                return category;
            }
        }
        return null;
    }
}
