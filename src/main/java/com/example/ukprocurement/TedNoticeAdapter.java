package com.example.ukprocurement;

import lombok.extern.slf4j.Slf4j;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import javax.xml.namespace.QName;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import static com.example.ukprocurement.FindATenderField.*;

/**
 * Классические TED-формы (F01-F21, схема R2.0.9) из выгрузки Find a Tender.
 * <p>
 * Все выборки идут в пространстве имен корневого элемента. Коды NUTS лежат в отдельных
 * пространствах 2016 и 2021 года, опрашиваются оба.
 */
@Slf4j
public class TedNoticeAdapter {
    public static final String SCHEMA_TYPE_TED = "TED_R2.0.9";
    private static final String ENGLISH = "EN";

    public NoticeRecord normalize(Document document) {
        NoticeNamespaces ns = NoticeNamespaces.resolve(document);
        Element root = document.getDocumentElement();
        NoticeRecord.Builder record = NoticeRecord.builder(FindATenderField.class);

        record.set(SCHEMA_TYPE, SCHEMA_TYPE_TED);
        record.set(DOC_ID, XmlTree.attribute(root, "DOC_ID"));
        record.set(EDITION, XmlTree.attribute(root, "EDITION"));

        record.set(DATE_PUB, text(root, ns, "REF_OJS", "DATE_PUB"));
        record.set(DS_DATE_DISPATCH, text(root, ns, "CODIF_DATA", "DS_DATE_DISPATCH"));
        record.set(ISO_COUNTRY, code(root, ns, "VALUE", "NOTICE_DATA", "ISO_COUNTRY"));
        record.set(NOTICE_URL, XmlTree.text(XmlTree.findWithAttribute(root, "LG", ENGLISH,
                path(ns, "NOTICE_DATA", "URI_LIST", "URI_DOC"))));
        record.set(NO_DOC_OJS, text(root, ns, "NOTICE_DATA", "NO_DOC_OJS"));

        extractCpv(root, ns, record);
        extractNuts(root, ns, record);
        extractTranslation(root, ns, record);
        extractContractingBody(root, ns, record);
        extractObject(root, ns, record);
        extractValues(root, ns, record);
        extractAward(root, ns, record);

        String tdCode = code(root, ns, "CODE", "CODIF_DATA", "TD_DOCUMENT_TYPE");
        record.set(TD_DOCUMENT_TYPE_CODE, tdCode);
        record.set(NC_CONTRACT_NATURE_CODE, code(root, ns, "CODE", "CODIF_DATA", "NC_CONTRACT_NATURE"));
        record.set(PR_PROC_CODE, code(root, ns, "CODE", "CODIF_DATA", "PR_PROC"));
        record.set(AC_AWARD_CRIT_CODE, code(root, ns, "CODE", "CODIF_DATA", "AC_AWARD_CRIT"));
        record.set(MA_MAIN_ACTIVITIES_CODE, code(root, ns, "CODE", "CODIF_DATA", "MA_MAIN_ACTIVITIES"));
        record.set(RP_REGULATION_CODE, code(root, ns, "CODE", "CODIF_DATA", "RP_REGULATION"));

        record.set(FORM_TYPE, formType(root, ns));
        record.set(NOTICE_TYPE_GROUP, NoticeClassifier.classifyDocumentType(tdCode).name());

        if (Config.getParserVerbose()) {
            log.debug("TED notice {} (form {}, TD {})", record.peek(DOC_ID), record.peek(FORM_TYPE), tdCode);
        }
        return record.build();
    }

    private void extractCpv(Element root, NoticeNamespaces ns, NoticeRecord.Builder record) {
        record.set(ORIGINAL_CPV_CODE, code(root, ns, "CODE", "NOTICE_DATA", "ORIGINAL_CPV"));
        record.set(CPV_MAIN_CODE, code(root, ns, "CODE", "OBJECT_CONTRACT", "CPV_MAIN", "CPV_CODE"));

        List<String> additional = new ArrayList<>();
        for (Element cpv : XmlTree.findAll(root, path(ns, "OBJECT_DESCR", "CPV_ADDITIONAL", "CPV_CODE"))) {
            additional.add(XmlTree.attribute(cpv, "CODE"));
        }
        record.set(ADDITIONAL_CPV_CODES, NoticeText.joinSorted(additional));
    }

    private void extractNuts(Element root, NoticeNamespaces ns, NoticeRecord.Builder record) {
        List<String> performance = new ArrayList<>();
        for (QName nuts : ns.nuts("PERFORMANCE_NUTS")) {
            for (Element el : XmlTree.findAll(root, ns.ted("NOTICE_DATA"), nuts)) {
                performance.add(XmlTree.attribute(el, "CODE"));
            }
        }
        record.set(PERF_NUTS_CODE, NoticeText.joinSorted(performance));

        record.set(CA_CE_NUTS_CODE, firstNutsCode(ns, "CA_CE_NUTS",
                nuts -> XmlTree.findAll(root, ns.ted("NOTICE_DATA"), nuts)));
    }

    /**
     * Первый непустой код NUTS: сначала пространство 2021, затем 2016.
     */
    private String firstNutsCode(NoticeNamespaces ns, String localName, Function<QName, List<Element>> lookup) {
        for (QName nuts : ns.nuts(localName)) {
            for (Element el : lookup.apply(nuts)) {
                String value = XmlTree.attribute(el, "CODE");
                if (!NoticeText.isBlank(value)) {
                    return value;
                }
            }
        }
        return null;
    }

    private void extractTranslation(Element root, NoticeNamespaces ns, NoticeRecord.Builder record) {
        // только английский перевод, на другие языки не откатываемся
        Element titles = XmlTree.findWithAttribute(root, "LG", ENGLISH,
                path(ns, "TRANSLATION_SECTION", "ML_TITLES", "ML_TI_DOC"));
        record.set(TI_COUNTRY, XmlTree.text(XmlTree.child(titles, ns.ted("TI_CY"))));
        record.set(TI_TOWN, XmlTree.text(XmlTree.child(titles, ns.ted("TI_TOWN"))));
        record.set(TI_TEXT, XmlTree.text(XmlTree.child(XmlTree.child(titles, ns.ted("TI_TEXT")), ns.ted("P"))));
    }

    private void extractContractingBody(Element root, NoticeNamespaces ns, NoticeRecord.Builder record) {
        Element address = XmlTree.find(root, path(ns, "CONTRACTING_BODY", "ADDRESS_CONTRACTING_BODY"));
        record.set(CA_NAME, XmlTree.text(XmlTree.child(address, ns.ted("OFFICIALNAME"))));
        record.set(CA_TOWN, XmlTree.text(XmlTree.child(address, ns.ted("TOWN"))));
        record.set(CA_POSTCODE, XmlTree.text(XmlTree.child(address, ns.ted("POSTAL_CODE"))));
        record.set(CA_EMAIL, XmlTree.text(XmlTree.child(address, ns.ted("E_MAIL"))));
        record.set(CA_URL, XmlTree.text(XmlTree.child(address, ns.ted("URL_GENERAL"))));
        record.set(CA_COUNTRY_CODE, XmlTree.attribute(XmlTree.child(address, ns.ted("COUNTRY")), "VALUE"));
        record.set(CA_NUTS_CODE, firstNutsCode(ns, "NUTS", nuts -> XmlTree.children(address, nuts)));
    }

    private void extractObject(Element root, NoticeNamespaces ns, NoticeRecord.Builder record) {
        record.set(OBJ_TITLE, text(root, ns, "OBJECT_CONTRACT", "TITLE", "P"));

        String shortDescr = text(root, ns, "OBJECT_CONTRACT", "SHORT_DESCR", "P");
        if (shortDescr == null) {
            shortDescr = text(root, ns, "OBJECT_DESCR", "SHORT_DESCR", "P");
        }
        record.set(SHORT_DESCR, shortDescr);
        record.set(TYPE_CONTRACT_CTYPE, code(root, ns, "CTYPE", "OBJECT_CONTRACT", "TYPE_CONTRACT"));
    }

    private void extractValues(Element root, NoticeNamespaces ns, NoticeRecord.Builder record) {
        Element total = XmlTree.find(root, path(ns, "OBJECT_CONTRACT", "VAL_TOTAL"));
        record.set(VAL_TOTAL, XmlTree.text(total));
        record.set(VAL_TOTAL_CURRENCY, XmlTree.attribute(total, "CURRENCY"));

        Element estimated = XmlTree.findWithAttribute(root, "TYPE", "ESTIMATED_TOTAL",
                path(ns, "NOTICE_DATA", "VALUES", "VALUE"));
        record.set(EST_TOTAL_VAL, XmlTree.text(estimated));
        record.set(EST_TOTAL_VAL_CURRENCY, XmlTree.attribute(estimated, "CURRENCY"));

        Element procurement = XmlTree.findWithAttribute(root, "TYPE", "PROCUREMENT_TOTAL",
                path(ns, "NOTICE_DATA", "VALUES", "VALUE"));
        record.set(PROC_TOTAL_VAL, XmlTree.text(procurement));
        record.set(PROC_TOTAL_VAL_CURRENCY, XmlTree.attribute(procurement, "CURRENCY"));
    }

    private void extractAward(Element root, NoticeNamespaces ns, NoticeRecord.Builder record) {
        record.set(AWARD_DATE, text(root, ns, "AWARD_CONTRACT", "AWARDED_CONTRACT", "DATE_CONCLUSION_CONTRACT"));

        Element awardTotal = XmlTree.find(root, path(ns, "AWARD_CONTRACT", "AWARDED_CONTRACT", "VALUES", "VAL_TOTAL"));
        record.set(AW_VAL_TOTAL, XmlTree.text(awardTotal));
        record.set(AW_VAL_CURRENCY, XmlTree.attribute(awardTotal, "CURRENCY"));

        record.set(NB_TENDERS, text(root, ns, "AWARD_CONTRACT", "AWARDED_CONTRACT", "TENDERS", "NB_TENDERS_RECEIVED"));

        List<String> contractors = new ArrayList<>();
        for (Element contractor : XmlTree.findAll(root,
                path(ns, "AWARD_CONTRACT", "AWARDED_CONTRACT", "CONTRACTORS", "CONTRACTOR"))) {
            Element address = XmlTree.child(contractor, ns.ted("ADDRESS_CONTRACTOR"));
            contractors.add(XmlTree.text(XmlTree.child(address, ns.ted("OFFICIALNAME"))));
        }
        record.set(CONTRACTOR_NAMES, NoticeText.joinSorted(contractors));
    }

    /**
     * Значение атрибута FORM у первого прямого потомка FORM_SECTION, который его несет
     */
    private String formType(Element root, NoticeNamespaces ns) {
        Element formSection = XmlTree.find(root, ns.ted("FORM_SECTION"));
        for (Element child : XmlTree.childElements(formSection)) {
            String form = XmlTree.attribute(child, "FORM");
            if (form != null) {
                return form;
            }
        }
        return null;
    }

    private static QName[] path(NoticeNamespaces ns, String... localNames) {
        QName[] path = new QName[localNames.length];
        for (int i = 0; i < localNames.length; i++) {
            path[i] = ns.ted(localNames[i]);
        }
        return path;
    }

    private static String text(Element root, NoticeNamespaces ns, String... localNames) {
        return XmlTree.text(XmlTree.find(root, path(ns, localNames)));
    }

    private static String code(Element root, NoticeNamespaces ns, String attribute, String... localNames) {
        return XmlTree.attribute(XmlTree.find(root, path(ns, localNames)), attribute);
    }
}
