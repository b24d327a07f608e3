package com.example.ukprocurement;

import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import javax.xml.XMLConstants;
import javax.xml.namespace.QName;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Безопасные примитивы обхода DOM-дерева уведомления.
 * Ни один метод не падает на отсутствующем узле, вместо этого возвращается null
 * или пустой список.
 */
public final class XmlTree {

    private XmlTree() {
    }

    /**
     * Собственный текст элемента (без вложенных элементов), обрезанный.
     *
     * @return текст или null, если элемента нет или текст пустой
     */
    public static String text(Element element) {
        if (element == null) {
            return null;
        }
        StringBuilder sb = new StringBuilder();
        NodeList nodes = element.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node.getNodeType() == Node.TEXT_NODE || node.getNodeType() == Node.CDATA_SECTION_NODE) {
                sb.append(node.getNodeValue());
            }
        }
        String text = sb.toString().trim();
        return text.isEmpty() ? null : text;
    }

    public static String attribute(Element element, String name) {
        if (element == null || !element.hasAttribute(name)) {
            return null;
        }
        return element.getAttribute(name);
    }

    /**
     * Имя без пространства имен, для форм UKn_2023.
     */
    public static QName plain(String localName) {
        return new QName(XMLConstants.NULL_NS_URI, localName);
    }

    public static boolean matches(Element element, QName name) {
        String namespace = element.getNamespaceURI() != null ? element.getNamespaceURI() : XMLConstants.NULL_NS_URI;
        String localName = element.getLocalName() != null ? element.getLocalName() : element.getTagName();
        return name.getNamespaceURI().equals(namespace) && name.getLocalPart().equals(localName);
    }

    public static List<Element> children(Element parent, QName name) {
        if (parent == null) {
            return Collections.emptyList();
        }
        List<Element> result = new ArrayList<>();
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node instanceof Element && matches((Element) node, name)) {
                result.add((Element) node);
            }
        }
        return result;
    }

    public static List<Element> childElements(Element parent) {
        if (parent == null) {
            return Collections.emptyList();
        }
        List<Element> result = new ArrayList<>();
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            if (nodes.item(i) instanceof Element) {
                result.add((Element) nodes.item(i));
            }
        }
        return result;
    }

    public static Element child(Element parent, QName name) {
        List<Element> found = children(parent, name);
        return found.isEmpty() ? null : found.get(0);
    }

    /**
     * Все потомки контекста (сам контекст не входит) с заданным именем, в порядке документа.
     * Обход без рекурсии: глубина дерева ограничена только памятью.
     */
    public static List<Element> descendants(Element context, QName name) {
        List<Element> result = new ArrayList<>();
        if (context == null) {
            return result;
        }
        Deque<Element> pending = new ArrayDeque<>();
        pushChildren(context, pending);
        while (!pending.isEmpty()) {
            Element element = pending.pop();
            if (matches(element, name)) {
                result.add(element);
            }
            pushChildren(element, pending);
        }
        return result;
    }

    // в обратном порядке, чтобы первым со стека снимался первый ребенок
    private static void pushChildren(Element parent, Deque<Element> pending) {
        List<Element> children = childElements(parent);
        for (int i = children.size() - 1; i >= 0; i--) {
            pending.push(children.get(i));
        }
    }

    /**
     * Аналог пути ".//A/B/C": первый шаг ищется среди потомков, остальные среди детей.
     */
    public static List<Element> findAll(Element context, QName... path) {
        if (context == null || path.length == 0) {
            return Collections.emptyList();
        }
        List<Element> current = descendants(context, path[0]);
        for (int step = 1; step < path.length && !current.isEmpty(); step++) {
            List<Element> next = new ArrayList<>();
            for (Element element : current) {
                next.addAll(children(element, path[step]));
            }
            current = next;
        }
        return current;
    }

    public static Element find(Element context, QName... path) {
        List<Element> found = findAll(context, path);
        return found.isEmpty() ? null : found.get(0);
    }

    /**
     * Первый элемент по пути, у которого атрибут равен заданному значению (аналог [@LG='EN']).
     */
    public static Element findWithAttribute(Element context, String attribute, String value, QName... path) {
        for (Element element : findAll(context, path)) {
            if (value.equals(attribute(element, attribute))) {
                return element;
            }
        }
        return null;
    }

    /**
     * Текст всех найденных по пути элементов, без пустых.
     */
    public static List<String> texts(Element context, QName... path) {
        List<String> result = new ArrayList<>();
        for (Element element : findAll(context, path)) {
            String text = text(element);
            if (text != null) {
                result.add(text);
            }
        }
        return result;
    }
}
