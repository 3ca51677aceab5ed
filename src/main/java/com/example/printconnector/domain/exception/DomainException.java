package com.example.printconnector.domain.exception;

/**
 * Base type for all domain-level exceptions in the core model.
 * Subclasses capture invariant violations of the PPD and capability model without leaking infrastructure dependencies.
 */
public abstract class DomainException extends RuntimeException {

	/**
	 * Creates a domain exception with a descriptive failure message.
	 *
	 * @param message explanation of which invariant broke
	 */
    protected DomainException(String message) {
        super(message);
    }
}
