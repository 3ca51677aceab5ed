package com.example.printconnector.infrastructure.exception;

/**
 * The print server answered but reported a failure. Carries the HTTP or IPP status code it returned.
 */
public class PrintServerException extends InfrastructureException {

    private final int statusCode;

	/**
	 * @param message    description of the failed operation
	 * @param statusCode HTTP status or IPP status code reported by the server
	 */
    public PrintServerException(String message, int statusCode) {
        super(message + " (status " + statusCode + ")");
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
