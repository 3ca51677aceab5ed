package com.example.printconnector.domain.model.ppd;

/**
 * One parsed PPD directive of the form {@code *MainKeyword OptionKeyword/Translation: Value}.
 *
 * @param mainKeyword   directive name without the leading marker, never empty
 * @param optionKeyword option keyword, or an empty string
 * @param translation   human readable translation, or an empty string
 * @param value         quoted or unquoted value, or an empty string
 */
public record PpdStatement(
        String mainKeyword,
        String optionKeyword,
        String translation,
        String value
) {

    public PpdStatement {
        if (mainKeyword == null || mainKeyword.isEmpty()) {
            throw new IllegalArgumentException("mainKeyword must not be empty");
        }
        optionKeyword = optionKeyword == null ? "" : optionKeyword;
        translation = translation == null ? "" : translation;
        value = value == null ? "" : value;
    }
}
