package com.example.printconnector.domain.exception;

/**
 * Raised when a capability section is built with other than exactly one default choice.
 */
public class InvalidCapabilityException extends DomainException {

	/**
	 * @param section      capability section name, e.g. {@code media_size}
	 * @param defaultCount number of options flagged as default
	 */
    public InvalidCapabilityException(String section, long defaultCount) {
        super("Capability " + section + " must have exactly one default option but has " + defaultCount);
    }

	/**
	 * @param section capability section name
	 */
    public InvalidCapabilityException(String section) {
        super("Capability " + section + " must have at least one option");
    }
}
