package com.example.printconnector.domain.model.ppd;

import java.util.List;

/**
 * A user-selectable PPD control built from one {@code OpenUI ... CloseUI} block.
 *
 * @param mainKeyword  control keyword, e.g. {@code PageSize}
 * @param translation  display name, falls back to the keyword
 * @param kind         pick-one or boolean
 * @param defaultValue option keyword of the default choice; always one of the options
 * @param options      ordered choices, never empty
 */
public record PpdEntry(
        String mainKeyword,
        String translation,
        PpdEntryKind kind,
        String defaultValue,
        List<PpdStatement> options
) {

    public PpdEntry {
        options = List.copyOf(options);
        if (options.isEmpty()) {
            throw new IllegalArgumentException("Entry " + mainKeyword + " has no options");
        }
        String declaredDefault = defaultValue;
        if (options.stream().noneMatch(option -> option.optionKeyword().equals(declaredDefault))) {
            throw new IllegalArgumentException("Entry " + mainKeyword + " default " + defaultValue + " is not an option");
        }
    }

    /**
     * Checks whether a choice with the given option keyword exists.
     *
     * @param optionKeyword keyword to look up
     * @return {@code true} when present
     */
    public boolean hasOption(String optionKeyword) {
        return options.stream().anyMatch(option -> option.optionKeyword().equals(optionKeyword));
    }
}
