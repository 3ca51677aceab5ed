package com.example.printconnector.infrastructure.cups.ipp;

/**
 * Delimiter and value tags of the IPP/1.1 binary encoding (RFC 8010).
 */
public final class IppTag {

    public static final int OPERATION_ATTRIBUTES = 0x01;
    public static final int JOB_ATTRIBUTES = 0x02;
    public static final int END_OF_ATTRIBUTES = 0x03;
    public static final int PRINTER_ATTRIBUTES = 0x04;
    public static final int UNSUPPORTED_ATTRIBUTES = 0x05;

    public static final int INTEGER = 0x21;
    public static final int BOOLEAN = 0x22;
    public static final int ENUM = 0x23;
    public static final int TEXT = 0x41;
    public static final int NAME = 0x42;
    public static final int KEYWORD = 0x44;
    public static final int URI = 0x45;
    public static final int CHARSET = 0x47;
    public static final int NATURAL_LANGUAGE = 0x48;

    private IppTag() {
    }

    static boolean isDelimiter(int tag) {
        return tag < 0x10;
    }

    static boolean isInteger(int tag) {
        return tag == INTEGER || tag == ENUM;
    }
}
