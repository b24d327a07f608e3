package com.example.ukprocurement;

import java.util.List;

/**
 * Элементы, по которым распознаются формы UKn. Порядок констант - это порядок опроса
 * диспетчером, от новых форм к старым. Новые формы добавляются в этот список.
 */
public enum UkFormTag {
    UK16_2023,
    UK15_2023,
    UK14_2023,
    UK13_2023,
    UK12_2023,
    UK11_2023,
    UK10_2023,
    UK9_2023,
    UK8_2023,
    UK7_2023,
    UK6_2023,
    UK5_2023,
    UK4_2023,
    UK3_2023,
    UK2_2023,
    UK1_2023,
    UK1_2022;

    private static final List<UkFormTag> AWARD_FORMS = List.of(UK6_2023, UK7_2023);

    public String elementName() {
        return name();
    }

    /**
     * Код формы без суффикса года выпуска 2023, например "UK7"
     */
    public String formCode() {
        return name().replace("_2023", "");
    }

    public boolean isAwardForm() {
        return AWARD_FORMS.contains(this);
    }
}
