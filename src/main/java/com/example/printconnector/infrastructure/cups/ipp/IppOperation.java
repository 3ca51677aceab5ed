package com.example.printconnector.infrastructure.cups.ipp;

/**
 * Operation ids and status codes used by the connector.
 */
public final class IppOperation {

    public static final int GET_PRINTER_ATTRIBUTES = 0x000B;
    public static final int CUPS_GET_PRINTERS = 0x4002;

    public static final int STATUS_OK = 0x0000;
    public static final int STATUS_OK_IGNORED_OR_SUBSTITUTED = 0x0001;
    public static final int STATUS_OK_CONFLICTING = 0x0002;
    public static final int STATUS_NOT_FOUND = 0x0406;

    private IppOperation() {
    }
}
