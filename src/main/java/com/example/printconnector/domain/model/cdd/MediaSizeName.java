package com.example.printconnector.domain.model.cdd;

/**
 * Named media sizes understood by the capability schema; {@link #CUSTOM} covers everything else.
 */
public enum MediaSizeName {
    CUSTOM,

    NA_INDEX_3X5, NA_INDEX_4X6, NA_5X7, NA_INDEX_5X8, NA_6X9, NA_C5, NA_7X9,
    NA_GOVT_LETTER, NA_GOVT_LEGAL, NA_9X11, NA_10X11, NA_10X13, NA_10X14, NA_10X15,
    NA_11X12, NA_EDP, NA_11X15, NA_LEDGER, NA_12X19, NA_SUPER_A, NA_SUPER_B, NA_B_PLUS,
    NA_PERSONAL, NA_MONARCH, NA_NUMBER_9, NA_NUMBER_10, NA_NUMBER_11, NA_NUMBER_12, NA_NUMBER_14,
    NA_A2, NA_INVOICE, NA_EXECUTIVE, NA_QUARTO, NA_LETTER, NA_LETTER_EXTRA, NA_LETTER_PLUS,
    NA_LEGAL, NA_LEGAL_EXTRA, NA_FANFOLD_EUR, NA_FOOLSCAP,
    NA_ARCH_A, NA_ARCH_B, NA_ARCH_C, NA_ARCH_D, NA_ARCH_E, NA_C, NA_D, NA_E, NA_F,

    ROC_16K, ROC_8K,
    PRC_32K, PRC_16K, PRC_1, PRC_2, PRC_3, PRC_4, PRC_5, PRC_6, PRC_7, PRC_8,

    ISO_A0, ISO_A1, ISO_A2, ISO_A3, ISO_A3_EXTRA, ISO_A4, ISO_A4_EXTRA, ISO_A4_TAB, ISO_A5, ISO_A5_EXTRA,
    ISO_A6, ISO_A7, ISO_A8, ISO_A9, ISO_A10,
    ISO_B0, ISO_B1, ISO_B2, ISO_B3, ISO_B4, ISO_B5, ISO_B5_EXTRA, ISO_B6, ISO_B7, ISO_B8, ISO_B9, ISO_B10,
    ISO_C0, ISO_C1, ISO_C2, ISO_C3, ISO_C4, ISO_C5, ISO_C6, ISO_C6C5, ISO_C7, ISO_DL,
    ISO_RA0, ISO_RA1, ISO_RA2, ISO_SRA0, ISO_SRA1, ISO_SRA2,

    JIS_B0, JIS_B1, JIS_B2, JIS_B3, JIS_B4, JIS_B5, JIS_B6, JIS_B7, JIS_B8, JIS_B9, JIS_B10,
    JPN_CHOU3, JPN_CHOU4, JPN_HAGAKI, JPN_YOU4, JPN_OUFUKU, JPN_KAKU2,

    OM_SMALL_PHOTO, OM_ITALIAN, OM_LARGE_PHOTO, OM_FOLIO, OM_FOLIO_SP, OM_INVITE
}
