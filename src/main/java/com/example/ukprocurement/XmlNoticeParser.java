package com.example.ukprocurement;

import lombok.extern.slf4j.Slf4j;
import org.w3c.dom.Document;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import java.io.IOException;
import java.io.StringReader;

/**
 * Разбор текста уведомления в DOM. Парсер с учетом пространств имен,
 * без DTD и внешних сущностей, свой экземпляр на поток.
 */
@Slf4j
public final class XmlNoticeParser {
    private static final String MAX_ELEMENT_DEPTH = "http://www.oracle.com/xml/jaxp/properties/maxElementDepth";
    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private static final ThreadLocal<DocumentBuilder> DOCUMENT_BUILDER = ThreadLocal.withInitial(() -> {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
            factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_SCHEMA, "");
            factory.setExpandEntityReferences(false);
            factory.setAttribute(MAX_ELEMENT_DEPTH, String.valueOf(Config.getMaxElementDepth()));
            DocumentBuilder builder = factory.newDocumentBuilder();
            // по умолчанию Xerces печатает ошибки в stderr
            builder.setErrorHandler(new DefaultHandler());
            return builder;
        } catch (Exception e) {
            throw new IllegalStateException("Failed to initialize secure XML parser", e);
        }
    });

    private XmlNoticeParser() {
    }

    public static Document parse(String xml) throws NoticeParseException {
        if (xml == null) {
            throw new NoticeParseException("XML payload is null", null);
        }
        DocumentBuilder builder;
        try {
            builder = DOCUMENT_BUILDER.get();
        } catch (IllegalStateException e) {
            throw new NoticeParseException(e.getMessage(), e);
        }
        try {
            builder.setErrorHandler(new DefaultHandler());
            return builder.parse(new InputSource(new StringReader(stripByteOrderMark(xml))));
        } catch (SAXException | IOException e) {
            if (Config.getParserVerbose()) {
                log.debug("XML parse failed: {}", e.getMessage());
            }
            throw new NoticeParseException(e.getMessage(), e);
        }
    }

    /**
     * Текст, декодированный из UTF-8 с BOM, начинается с U+FEFF, а парсер из Reader его не пропускает
     */
    static String stripByteOrderMark(String xml) {
        return !xml.isEmpty() && xml.charAt(0) == BYTE_ORDER_MARK ? xml.substring(1) : xml;
    }
}
