package com.example.printconnector.domain.exception;

/**
 * Signals that an operation was invoked without a printer name.
 */
public class PrinterNameRequiredException extends DomainException {

	/**
	 * Creates the exception with the fixed validation message.
	 */
    public PrinterNameRequiredException() {
        super("A printer name is required.");
    }
}
