package com.example.ukprocurement;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Эвристика типа контракта по свободному тексту mainProcurementCategory.
 * <p>
 * Это не проверенная классификация: словаря значений у источника нет, поэтому ищем
 * подстроки без учета регистра. Порядок правил важен, "work" проверяется первым.
 */
public final class ContractTypeRules {
    private static final Map<String, List<String>> RULES = new LinkedHashMap<>();

    static {
        RULES.put("WORKS", List.of("work"));
        RULES.put("SERVICES", List.of("service"));
        RULES.put("SUPPLIES", List.of("supply", "good"));
    }

    private ContractTypeRules() {
    }

    /**
     * @return WORKS, SERVICES, SUPPLIES или null, если ни одно правило не сработало
     */
    public static String infer(String mainProcurementCategory) {
        if (NoticeText.isBlank(mainProcurementCategory)) {
            return null;
        }
        String lower = mainProcurementCategory.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, List<String>> rule : RULES.entrySet()) {
            for (String fragment : rule.getValue()) {
                if (lower.contains(fragment)) {
                    return rule.getKey();
                }
            }
        }
        return null;
    }
}
