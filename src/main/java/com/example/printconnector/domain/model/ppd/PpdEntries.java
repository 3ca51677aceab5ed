package com.example.printconnector.domain.model.ppd;

import java.util.Map;
import java.util.Optional;

/**
 * Entries of one document indexed by keyword and by translation. A later entry replaces an earlier one with the same key.
 */
public record PpdEntries(Map<String, PpdEntry> byMainKeyword, Map<String, PpdEntry> byTranslation) {

    public PpdEntries {
        byMainKeyword = Map.copyOf(byMainKeyword);
        byTranslation = Map.copyOf(byTranslation);
    }

    public Optional<PpdEntry> byKeyword(String mainKeyword) {
        return Optional.ofNullable(byMainKeyword.get(mainKeyword));
    }

    public Optional<PpdEntry> byTranslation(String translation) {
        return Optional.ofNullable(byTranslation.get(translation));
    }
}
