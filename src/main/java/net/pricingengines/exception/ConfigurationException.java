/*
 * (c) Copyright Christian P. Fries, Germany. All rights reserved. Contact: email@christian-fries.de.
 *
 * Created on 14.03.2024
 */
package net.pricingengines.exception;

/**
 * Fatal configuration error: invalid arguments record, missing market data or an
 * engine wired to a delegate of the wrong type. Never retried.
 */
public class ConfigurationException extends IllegalArgumentException {

	private static final long serialVersionUID = -2871840913458823451L;

	public ConfigurationException(String message) {
		super(message);
	}

	public ConfigurationException(String message, Throwable cause) {
		super(message, cause);
	}
}
