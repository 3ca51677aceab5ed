package com.example.printconnector.infrastructure.exception;

/**
 * Signals that the print server could not be reached or the session broke (refused, timed out, reset).
 */
public class PrintServerTransportException extends InfrastructureException {

	/**
	 * @param message description shared with the application layer
	 * @param cause   low-level I/O or HTTP client exception
	 */
    public PrintServerTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
