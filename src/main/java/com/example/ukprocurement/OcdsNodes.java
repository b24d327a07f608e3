package com.example.ukprocurement;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

/**
 * Цепочки доступа к полям OCDS-документа. Отсутствующее звено цепочки
 * дает MissingNode, а не null, поэтому спуск дальше всегда безопасен.
 */
public final class OcdsNodes {

    private OcdsNodes() {
    }

    /**
     * Узел по пути ключей. Если звено отсутствует или не является объектом, возвращается MissingNode.
     */
    public static JsonNode node(JsonNode root, String... keys) {
        JsonNode current = root != null ? root : MissingNode.getInstance();
        for (String key : keys) {
            current = current.isObject() ? current.path(key) : MissingNode.getInstance();
        }
        return current;
    }

    /**
     * Скалярное значение по пути: строка, число или флаг.
     *
     * @return null, если звено отсутствует, равно null или не является скаляром
     */
    public static Object scalar(JsonNode root, String... keys) {
        JsonNode node = node(root, keys);
        if (node.isTextual()) {
            return node.textValue();
        }
        if (node.isNumber()) {
            return node.numberValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        return null;
    }

    /**
     * Значение по пути в текстовом виде (числа и флаги как в JSON).
     */
    public static String text(JsonNode root, String... keys) {
        JsonNode node = node(root, keys);
        return node.isValueNode() && !node.isNull() ? node.asText() : null;
    }

    /**
     * Элементы массива по пути; пустой список, если массива нет.
     */
    public static List<JsonNode> array(JsonNode root, String... keys) {
        JsonNode node = node(root, keys);
        if (!node.isArray()) {
            return Collections.emptyList();
        }
        List<JsonNode> items = new ArrayList<>(node.size());
        node.forEach(items::add);
        return items;
    }

    /**
     * Первый элемент массива по пути или MissingNode
     */
    public static JsonNode first(JsonNode root, String... keys) {
        List<JsonNode> items = array(root, keys);
        return items.isEmpty() ? MissingNode.getInstance() : items.get(0);
    }

    /**
     * Текстовые значения одного поля у каждого элемента списка
     */
    public static List<String> texts(List<JsonNode> items, String... keys) {
        List<String> values = new ArrayList<>(items.size());
        for (JsonNode item : items) {
            values.add(text(item, keys));
        }
        return values;
    }

    /**
     * То же, что {@link #texts}, но для массива скаляров (например tag или roles)
     */
    public static List<String> scalarTexts(List<JsonNode> items) {
        return map(items, item -> item.isValueNode() && !item.isNull() ? item.asText() : null);
    }

    private static List<String> map(List<JsonNode> items, Function<JsonNode, String> mapper) {
        List<String> values = new ArrayList<>(items.size());
        for (JsonNode item : items) {
            values.add(mapper.apply(item));
        }
        return values;
    }
}
