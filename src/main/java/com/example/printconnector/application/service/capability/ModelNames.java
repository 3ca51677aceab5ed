package com.example.printconnector.application.service.capability;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Normalizes the manufacturer and model strings found in PPD headers.
 */
public final class ModelNames {

    /**
     * Driver, language and firmware noise that vendors append to {@code *NickName} and {@code *ModelName}.
     */
    private static final Pattern MODEL_NOISE = Pattern.compile("\\s+("
            + "(w/)?PS2?3?(\\(P\\))?(,\\s+[0-9.]+)?|"
            + "pcl3?(,\\s+\\d+(\\.\\d+))*|"
            + "-|PXL|PDF|cups-team|CUPS\\+Gutenprint\\s+v\\S+|\\(?recommended\\)?|"
            + "(A4|Letter)(\\+Duplex)?|"
            + "Post[Ss]cript|BR-Script2?3?J?|"
            + "v[0-9.]+|"
            + "\\(?KPDL(-2)?\\)?|"
            + "Foomatic/\\S+|Epson Inkjet Printer Driver \\(ESC/P-R\\) for \\S+|"
            + "(hpcups|hpijs|HPLIP),?\\s+\\d+(\\.\\d+)*|requires proprietary plugin"
            + ")\\s*$");

    private static final Map<String, String> MANUFACTURERS = Map.ofEntries(
            Map.entry("BROTHER", "Brother"),
            Map.entry("CANON", "Canon"),
            Map.entry("DELL", "Dell"),
            Map.entry("EPSON", "Epson"),
            Map.entry("FUJI XEROX", "Fuji Xerox"),
            Map.entry("FUJIFILM", "Fujifilm"),
            Map.entry("GESTETNER", "Gestetner"),
            Map.entry("HEWLETT-PACKARD", "HP"),
            Map.entry("INFOTEC", "Infotec"),
            Map.entry("KONICA MINOLTA", "Konica Minolta"),
            Map.entry("KYOCERA", "Kyocera"),
            Map.entry("LANIER", "Lanier"),
            Map.entry("LEXMARK", "Lexmark"),
            Map.entry("OKI DATA", "OKI Data"),
            Map.entry("PANASONIC", "Panasonic"),
            Map.entry("RICOH", "Ricoh"),
            Map.entry("SAMSUNG", "Samsung"),
            Map.entry("SAVIN", "Savin"),
            Map.entry("SHARP", "Sharp"),
            Map.entry("TOSHIBA", "Toshiba"),
            Map.entry("XEROX", "Xerox"),
            Map.entry("ZEBRA", "Zebra")
    );

    private ModelNames() {
    }

    /**
     * Strips trailing driver noise until nothing more can be removed.
     *
     * @param model raw model string
     * @return cleaned model string
     */
    public static String cleanupModel(String model) {
        String current = model;
        while (true) {
            String cleaned = MODEL_NOISE.matcher(current).replaceAll("");
            cleaned = removeSuffix(cleaned, ",");
            cleaned = removeSuffix(cleaned, "(PS)");
            if (cleaned.equals(current)) {
                return current;
            }
            current = cleaned;
        }
    }

    /**
     * Removes a leading manufacturer name from a model string.
     *
     * @param model        cleaned model string
     * @param manufacturer manufacturer as declared in the PPD
     * @return model without the manufacturer prefix and leading spaces
     */
    public static String stripManufacturer(String model, String manufacturer) {
        String stripped = !manufacturer.isEmpty() && model.startsWith(manufacturer)
                ? model.substring(manufacturer.length())
                : model;
        int start = 0;
        while (start < stripped.length() && stripped.charAt(start) == ' ') {
            start++;
        }
        return stripped.substring(start);
    }

    /**
     * Title-cases manufacturer names that vendors declare in capitals.
     *
     * @param manufacturer manufacturer as declared in the PPD
     * @return display form of the manufacturer; unknown names are returned as given
     */
    public static String normalizeManufacturer(String manufacturer) {
        return MANUFACTURERS.getOrDefault(manufacturer.toUpperCase(Locale.ROOT), manufacturer);
    }

    private static String removeSuffix(String text, String suffix) {
        return text.endsWith(suffix) ? text.substring(0, text.length() - suffix.length()) : text;
    }
}
