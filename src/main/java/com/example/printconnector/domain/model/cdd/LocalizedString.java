package com.example.printconnector.domain.model.cdd;

import java.util.List;

/**
 * Display string tagged with its locale.
 *
 * @param locale locale tag, always {@code EN} for PPD derived strings
 * @param value  display text
 */
public record LocalizedString(String locale, String value) {

    /**
     * Wraps a display text into the single-element English list used across the schema.
     *
     * @param value display text
     * @return immutable list holding one English string
     */
    public static List<LocalizedString> english(String value) {
        return List.of(new LocalizedString("EN", value));
    }
}
