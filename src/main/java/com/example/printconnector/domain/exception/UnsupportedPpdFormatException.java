package com.example.printconnector.domain.exception;

/**
 * Raised when a printer's description document holds no PPD statements at all.
 * This keeps empty or foreign documents from being published as a printer without capabilities.
 */
public class UnsupportedPpdFormatException extends DomainException {

	/**
	 * Creates the exception and mentions the printer so the caller can react.
	 *
	 * @param printerName printer whose document was rejected
	 */
    public UnsupportedPpdFormatException(String printerName) {
        super("The description of printer " + printerName + " is not a PPD document.");
    }
}
