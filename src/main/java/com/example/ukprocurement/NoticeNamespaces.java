package com.example.ukprocurement;

import lombok.Value;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import javax.xml.XMLConstants;
import javax.xml.namespace.QName;
import java.util.List;

/**
 * Пространства имен TED-уведомления. Определяются один раз на документ
 * и дальше передаются во все выборки.
 * <p>
 * Основное пространство берется из корневого элемента (у разных выпусков схемы оно разное),
 * два пространства NUTS фиксированы: схема географии менялась в 2016 и в 2021 году.
 */
@Value
public class NoticeNamespaces {
    public static final String NUTS_2016 = "http://enotice.service.gov.uk/resource/schema/ted/2016/nuts";
    public static final String NUTS_2021 = "http://enotice.service.gov.uk/resource/schema/ted/2021/nuts";

    /**
     * Пространство корневого элемента, пустая строка если его нет
     */
    String main;

    public static NoticeNamespaces resolve(Document document) {
        Element root = document.getDocumentElement();
        String namespace = root != null ? root.getNamespaceURI() : null;
        return new NoticeNamespaces(namespace != null ? namespace : XMLConstants.NULL_NS_URI);
    }

    public QName ted(String localName) {
        return new QName(main, localName);
    }

    /**
     * Имя в обоих пространствах NUTS, в порядке опроса: сначала 2021, потом 2016.
     */
    public List<QName> nuts(String localName) {
        return List.of(new QName(NUTS_2021, localName), new QName(NUTS_2016, localName));
    }
}
