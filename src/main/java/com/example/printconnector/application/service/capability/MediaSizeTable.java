package com.example.printconnector.application.service.capability;

import com.example.printconnector.domain.model.cdd.LocalizedString;
import com.example.printconnector.domain.model.cdd.MediaSizeName;
import com.example.printconnector.domain.model.cdd.MediaSizeOption;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static com.example.printconnector.domain.model.cdd.MediaSizeName.*;

/**
 * Well-known PPD {@code PageSize} option keywords and the media sizes they stand for.
 */
final class MediaSizeTable {

    private static final Map<String, MediaSizeOption> SIZES;

    static {
        Builder table = new Builder();
        table.inches("3x5", NA_INDEX_3X5, 3f, 5f, "3x5");
        table.inches("4x6", NA_INDEX_4X6, 4f, 6f, "4x6");
        table.inches("5x7", NA_5X7, 5f, 7f, "5x7");
        table.inches("5x8", NA_INDEX_5X8, 5f, 8f, "5x8");
        table.inches("6x9", NA_6X9, 6f, 9f, "6x9");
        table.inches("6.5x9.5", NA_C5, 6.5f, 9.5f, "6.5x9.5");
        table.inches("7x9", NA_7X9, 7f, 9f, "7x9");
        table.inches("8x10", NA_GOVT_LETTER, 8f, 10f, "8x10");
        table.inches("8x13", NA_GOVT_LEGAL, 8f, 13f, "8x13");
        table.inches("9x11", NA_9X11, 9f, 11f, "9x11");
        table.inches("10x11", NA_10X11, 10f, 11f, "10x11");
        table.inches("10x13", NA_10X13, 10f, 13f, "10x13");
        table.inches("10x14", NA_10X14, 10f, 14f, "10x14");
        table.inches("10x15", NA_10X15, 10f, 15f, "10x15");
        table.inches("11x12", NA_11X12, 11f, 12f, "11x12");
        table.inches("11x14", NA_EDP, 11f, 14f, "11x14");
        table.inches("11x15", NA_11X15, 11f, 15f, "11x15");
        table.inches("11x17", NA_LEDGER, 11f, 17f, "11x17");
        table.inches("12x18", NA_ARCH_B, 12f, 18f, "12x18");
        table.inches("12x19", NA_12X19, 12f, 19f, "12x19");
        table.inches("13x19", NA_SUPER_B, 13f, 19f, "13x19");
        table.inches("EnvPersonal", NA_PERSONAL, 3.625f, 6.5f, "EnvPersonal");
        table.inches("Monarch", NA_MONARCH, 3.875f, 7.5f, "Monarch");
        table.inches("EnvMonarch", NA_MONARCH, 3.875f, 7.5f, "Monarch");
        table.inches("Comm10", NA_NUMBER_10, 4.125f, 9.5f, "Comm10");
        table.inches("EnvA2", NA_A2, 4.375f, 5.75f, "EnvA2");
        table.inches("Env9", NA_NUMBER_9, 3.875f, 8.875f, "Env9");
        table.inches("Env10", NA_NUMBER_10, 4.125f, 9.5f, "Env10");
        table.inches("Env11", NA_NUMBER_11, 4.5f, 10.375f, "Env11");
        table.inches("Env12", NA_NUMBER_12, 4.75f, 11f, "Env12");
        table.inches("Env14", NA_NUMBER_14, 5f, 11.5f, "Env14");
        table.inches("Statement", NA_INVOICE, 5.5f, 8.5f, "Statement");
        table.inches("Executive", NA_EXECUTIVE, 7.25f, 10.5f, "Executive");
        table.inches("Quarto", NA_QUARTO, 8.5f, 10.83f, "Quarto");
        table.inches("EngQuatro", CUSTOM, 8f, 10f, "English Quatro 8x10");
        table.inches("Letter", NA_LETTER, 8.5f, 11f, "Letter");
        table.inches("LetterExtra", NA_LETTER_EXTRA, 9.5f, 12f, "Letter Extra");
        table.inches("LetterPlus", NA_LETTER_PLUS, 8.5f, 12.69f, "Letter Plus");
        table.inches("Legal", NA_LEGAL, 8.5f, 14f, "Legal");
        table.inches("LegalExtra", NA_LEGAL_EXTRA, 9.5f, 15f, "Legal Extra");
        table.inches("FanFoldGerman", NA_FANFOLD_EUR, 8.5f, 12f, "FanFoldGerman");
        table.inches("Foolscap", NA_FOOLSCAP, 8.5f, 13f, "Foolscap");
        table.inches("FanFoldGermanLegal", NA_FOOLSCAP, 8.5f, 13f, "Fan Fold German Legal");
        table.inches("GovernmentLG", NA_FOOLSCAP, 8.5f, 13f, "GovernmentLG");
        table.inches("SuperA", NA_SUPER_A, 8.94f, 14f, "Super A");
        table.inches("SuperB", NA_B_PLUS, 12f, 19.17f, "Super B");
        table.inches("Tabloid", NA_LEDGER, 11f, 17f, "Tabloid");
        table.inches("Ledger", NA_LEDGER, 11f, 17f, "Ledger");
        table.inches("ARCHA", NA_ARCH_A, 9f, 12f, "Arch A");
        table.inches("ARCHB", NA_ARCH_B, 12f, 18f, "Arch B");
        table.inches("ARCHC", NA_ARCH_C, 18f, 24f, "Arch C");
        table.inches("ARCHD", NA_ARCH_D, 24f, 36f, "Arch D");
        table.inches("ARCHE", NA_ARCH_E, 36f, 48f, "Arch E");
        table.inches("AnsiC", NA_C, 17f, 22f, "ANSI C");
        table.inches("AnsiD", NA_D, 22f, 34f, "ANSI D");
        table.inches("AnsiE", NA_E, 34f, 44f, "ANSI E");
        table.inches("AnsiF", NA_F, 44f, 68f, "ANSI F");
        table.inches("F", NA_F, 44f, 68f, "ANSI F");
        table.inches("roc16k", ROC_16K, 7.75f, 10.75f, "16K (ROC)");
        table.inches("roc8k", ROC_8K, 10.75f, 15.5f, "8K (ROC)");
        table.millimeters("PRC32K", PRC_32K, 97f, 151f, "32K (PRC)");
        table.millimeters("EnvPRC1", PRC_1, 102f, 165f, "EnvPRC1");
        table.millimeters("EnvPRC2", PRC_2, 102f, 176f, "EnvPRC2");
        table.millimeters("EnvPRC4", PRC_4, 110f, 208f, "EnvPRC4");
        table.millimeters("EnvPRC5", PRC_5, 110f, 220f, "EnvPRC5");
        table.millimeters("EnvPRC8", PRC_8, 120f, 309f, "EnvPRC8");
        table.millimeters("EnvPRC6", PRC_6, 120f, 230f, "EnvPRC6");
        table.millimeters("EnvPRC3", PRC_3, 125f, 176f, "EnvPRC3");
        table.millimeters("PRC16K", PRC_16K, 146f, 215f, "PRC16K");
        table.millimeters("EnvPRC7", PRC_7, 160f, 230f, "EnvPRC7");
        table.millimeters("A0", ISO_A0, 841f, 1189f, "A0");
        table.millimeters("A1", ISO_A1, 594f, 841f, "A1");
        table.millimeters("A2", ISO_A2, 420f, 594f, "A2");
        table.millimeters("A3", ISO_A3, 297f, 420f, "A3");
        table.millimeters("A3Extra", ISO_A3_EXTRA, 322f, 445f, "A3 Extra");
        table.millimeters("A4", ISO_A4, 210f, 297f, "A4");
        table.millimeters("A4Extra", ISO_A4_EXTRA, 235.5f, 322.3f, "A4 Extra");
        table.millimeters("A4Tab", ISO_A4_TAB, 225f, 297f, "A4 Tab");
        table.millimeters("A5", ISO_A5, 148f, 210f, "A5");
        table.millimeters("A5Extra", ISO_A5_EXTRA, 174f, 235f, "A5 Extra");
        table.millimeters("A6", ISO_A6, 105f, 148f, "A6");
        table.millimeters("A7", ISO_A7, 74f, 105f, "A7");
        table.millimeters("A8", ISO_A8, 52f, 74f, "A8");
        table.millimeters("A9", ISO_A9, 37f, 52f, "A9");
        table.millimeters("A10", ISO_A10, 26f, 37f, "A10");
        table.millimeters("ISOB0", ISO_B0, 1000f, 1414f, "B0 (ISO)");
        table.millimeters("ISOB1", ISO_B1, 707f, 1000f, "B1 (ISO)");
        table.millimeters("ISOB2", ISO_B2, 500f, 707f, "B2 (ISO)");
        table.millimeters("ISOB3", ISO_B3, 353f, 500f, "B3 (ISO)");
        table.millimeters("ISOB4", ISO_B4, 250f, 353f, "B4 (ISO)");
        table.millimeters("ISOB5", ISO_B5, 176f, 250f, "B5 (ISO)");
        table.millimeters("EnvISOB5", ISO_B5, 176f, 250f, "B5 Envelope (ISO)");
        table.millimeters("ISOB5Extra", ISO_B5_EXTRA, 201f, 276f, "B5 Extra (ISO)");
        table.millimeters("ISOB6", ISO_B6, 125f, 176f, "B6 (ISO)");
        table.millimeters("ISOB7", ISO_B7, 88f, 125f, "B7 (ISO)");
        table.millimeters("ISOB8", ISO_B8, 62f, 88f, "B8 (ISO)");
        table.millimeters("ISOB9", ISO_B9, 44f, 62f, "B9 (ISO)");
        table.millimeters("ISOB10", ISO_B10, 31f, 44f, "B10 (ISO)");
        table.millimeters("EnvC0", ISO_C0, 917f, 1297f, "C0 (ISO)");
        table.millimeters("EnvC1", ISO_C1, 648f, 917f, "C1 (ISO)");
        table.millimeters("EnvC2", ISO_C2, 458f, 648f, "C2 (ISO)");
        table.millimeters("EnvC3", ISO_C3, 324f, 458f, "C3 (ISO)");
        table.millimeters("EnvC4", ISO_C4, 229f, 324f, "C4 (ISO)");
        table.millimeters("EnvC5", ISO_C5, 162f, 229f, "C5 (ISO)");
        table.millimeters("EnvC6", ISO_C6, 114f, 162f, "C6 (ISO)");
        table.millimeters("EnvC65", ISO_C6C5, 114f, 229f, "C6c5 (ISO)");
        table.millimeters("EnvC7", ISO_C7, 81f, 114f, "C7 (ISO)");
        table.millimeters("EnvDL", ISO_DL, 110f, 220f, "DL Envelope");
        table.millimeters("DLEnv", ISO_DL, 110f, 220f, "DL Envelope");
        table.millimeters("RA0", ISO_RA0, 860f, 1220f, "RA0");
        table.millimeters("RA1", ISO_RA1, 610f, 860f, "RA1");
        table.millimeters("RA2", ISO_RA2, 430f, 610f, "RA2");
        table.millimeters("RA3", CUSTOM, 305f, 430f, "RA3");
        table.millimeters("RA4", CUSTOM, 215f, 305f, "RA4");
        table.millimeters("SRA0", ISO_SRA0, 900f, 1280f, "SRA0");
        table.millimeters("SRA1", ISO_SRA1, 640f, 900f, "SRA1");
        table.millimeters("SRA2", ISO_SRA2, 450f, 640f, "SRA2");
        table.millimeters("SRA3", CUSTOM, 320f, 450f, "SRA3");
        table.millimeters("SRA4", CUSTOM, 225f, 320f, "SRA4");
        table.millimeters("JISB0", JIS_B0, 1030f, 1456f, "B0 (JIS)");
        table.millimeters("B0JIS", JIS_B0, 1030f, 1456f, "B0 (JIS)");
        table.millimeters("B0", JIS_B0, 1030f, 1456f, "B0 (JIS)");
        table.millimeters("JISB1", JIS_B1, 728f, 1030f, "B1 (JIS)");
        table.millimeters("B1JIS", JIS_B1, 728f, 1030f, "B1 (JIS)");
        table.millimeters("B1", JIS_B1, 728f, 1030f, "B1 (JIS)");
        table.millimeters("JISB2", JIS_B2, 515f, 728f, "B2 (JIS)");
        table.millimeters("B2JIS", JIS_B2, 515f, 728f, "B2 (JIS)");
        table.millimeters("B2", JIS_B2, 515f, 728f, "B2 (JIS)");
        table.millimeters("JISB3", JIS_B3, 364f, 515f, "B3 (JIS)");
        table.millimeters("B3JIS", JIS_B3, 364f, 515f, "B3 (JIS)");
        table.millimeters("B3", JIS_B3, 364f, 515f, "B3 (JIS)");
        table.millimeters("JISB4", JIS_B4, 257f, 364f, "B4 (JIS)");
        table.millimeters("B4JIS", JIS_B4, 257f, 364f, "B4 (JIS)");
        table.millimeters("B4", JIS_B4, 257f, 364f, "B4 (JIS)");
        table.millimeters("JISB5", JIS_B5, 182f, 257f, "B5 (JIS)");
        table.millimeters("B5JIS", JIS_B5, 182f, 257f, "B5 (JIS)");
        table.millimeters("B5", JIS_B5, 182f, 257f, "B5 (JIS)");
        table.millimeters("JISB6", JIS_B6, 128f, 182f, "B6 (JIS)");
        table.millimeters("B6JIS", JIS_B6, 128f, 182f, "B6 (JIS)");
        table.millimeters("B6", JIS_B6, 128f, 182f, "B6 (JIS)");
        table.millimeters("JISB7", JIS_B7, 91f, 128f, "B7 (JIS)");
        table.millimeters("B7JIS", JIS_B7, 91f, 128f, "B7 (JIS)");
        table.millimeters("B7", JIS_B7, 91f, 128f, "B7 (JIS)");
        table.millimeters("JISB8", JIS_B8, 64f, 91f, "B8 (JIS)");
        table.millimeters("B8JIS", JIS_B8, 64f, 91f, "B8 (JIS)");
        table.millimeters("B8", JIS_B8, 64f, 91f, "B8 (JIS)");
        table.millimeters("JISB9", JIS_B9, 45f, 64f, "B9 (JIS)");
        table.millimeters("B9JIS", JIS_B9, 45f, 64f, "B9 (JIS)");
        table.millimeters("B9", JIS_B9, 45f, 64f, "B9 (JIS)");
        table.millimeters("JISB10", JIS_B10, 32f, 45f, "B10 (JIS)");
        table.millimeters("B10JIS", JIS_B10, 32f, 45f, "B10 (JIS)");
        table.millimeters("B10", JIS_B10, 32f, 45f, "B10 (JIS)");
        table.millimeters("EnvChou4", JPN_CHOU4, 90f, 205f, "EnvChou4");
        table.millimeters("Hagaki", JPN_HAGAKI, 100f, 148f, "Hagaki");
        table.millimeters("JapanesePostCard", JPN_HAGAKI, 100f, 148f, "Japanese Postcard");
        table.millimeters("Postcard", JPN_HAGAKI, 100f, 148f, "Postcard");
        table.millimeters("EnvYou4", JPN_YOU4, 105f, 235f, "EnvYou4");
        table.millimeters("EnvChou3", JPN_CHOU3, 120f, 235f, "EnvChou3");
        table.millimeters("Oufuku", JPN_OUFUKU, 148f, 200f, "Oufuku");
        table.millimeters("DoublePostcardRotated", JPN_OUFUKU, 148f, 200f, "Double Postcard Rotated");
        table.millimeters("EnvKaku2", JPN_KAKU2, 240f, 332f, "EnvKaku2");
        table.millimeters("om_small-photo", OM_SMALL_PHOTO, 100f, 150f, "Small Photo");
        table.millimeters("EnvItalian", OM_ITALIAN, 110f, 230f, "EnvItalian");
        table.millimeters("om_large-photo", OM_LARGE_PHOTO, 200f, 300f, "Large Photo");
        table.millimeters("Folio", OM_FOLIO, 210f, 330f, "Folio");
        table.millimeters("FolioSP", OM_FOLIO_SP, 215f, 315f, "FolioSP");
        table.millimeters("EnvInvite", OM_INVITE, 220f, 220f, "EnvInvite");
        table.inches("8Kai", CUSTOM, 10.5f, 15.375f, "8 Kai");
        table.inches("8K", CUSTOM, 10.5f, 15.375f, "8 Kai");
        table.inches("16Kai", CUSTOM, 7.6875f, 10.5f, "16 Kai");
        table.inches("16K", CUSTOM, 7.6875f, 10.5f, "16 Kai");
        SIZES = Map.copyOf(table.sizes);
    }

    private MediaSizeTable() {
    }

    /**
     * Looks up a PPD page size keyword.
     *
     * @param optionKeyword keyword such as {@code A4} or {@code Letter}
     * @return the size, not flagged as default, or empty when the keyword is unknown
     */
    static Optional<MediaSizeOption> lookup(String optionKeyword) {
        return Optional.ofNullable(SIZES.get(optionKeyword));
    }

    private static final class Builder {

        private final Map<String, MediaSizeOption> sizes = new HashMap<>();

        void inches(String keyword, MediaSizeName name, float width, float height, String displayName) {
            add(keyword, name, Units.inchesToMicrons(width), Units.inchesToMicrons(height), displayName);
        }

        void millimeters(String keyword, MediaSizeName name, float width, float height, String displayName) {
            add(keyword, name, Units.millimetersToMicrons(width), Units.millimetersToMicrons(height), displayName);
        }

        private void add(String keyword, MediaSizeName name, int width, int height, String displayName) {
            sizes.put(keyword, new MediaSizeOption(name, width, height, false, false, keyword,
                    LocalizedString.english(displayName)));
        }
    }
}
