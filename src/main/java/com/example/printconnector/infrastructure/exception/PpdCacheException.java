package com.example.printconnector.infrastructure.exception;

/**
 * Infrastructure-layer exception for file system failures of the PPD cache.
 */
public class PpdCacheException extends InfrastructureException {

	/**
	 * @param message description shared with the application layer
	 */
    public PpdCacheException(String message) {
        super(message);
    }

	/**
	 * @param message description shared with the application layer
	 * @param cause   underlying I/O exception
	 */
    public PpdCacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
