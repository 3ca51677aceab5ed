package com.example.printconnector.infrastructure.cups.ipp;

import java.util.List;

/**
 * One IPP attribute. Integer, enum and boolean values are kept in their decimal or {@code true}/{@code false} form.
 *
 * @param valueTag value tag shared by all values
 * @param name     attribute name
 * @param values   one or more values
 */
public record IppAttribute(int valueTag, String name, List<String> values) {

    public IppAttribute {
        values = List.copyOf(values);
    }

    public static IppAttribute keyword(String name, String... values) {
        return new IppAttribute(IppTag.KEYWORD, name, List.of(values));
    }

    public static IppAttribute uri(String name, String value) {
        return new IppAttribute(IppTag.URI, name, List.of(value));
    }

    public static IppAttribute charset(String value) {
        return new IppAttribute(IppTag.CHARSET, "attributes-charset", List.of(value));
    }

    public static IppAttribute naturalLanguage(String value) {
        return new IppAttribute(IppTag.NATURAL_LANGUAGE, "attributes-natural-language", List.of(value));
    }

    public String firstValue() {
        return values.isEmpty() ? "" : values.get(0);
    }
}
