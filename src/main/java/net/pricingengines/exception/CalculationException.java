/*
 * (c) Copyright Christian P. Fries, Germany. All rights reserved. Contact: email@christian-fries.de.
 *
 * Created on 14.03.2024
 */
package net.pricingengines.exception;

/**
 * Exception thrown when a pricing calculation fails, e.g., when a delegate
 * engine cannot produce a value for the given arguments or a Monte Carlo
 * pricer does not reach the requested accuracy.
 */
public class CalculationException extends Exception {

	private static final long serialVersionUID = 6734102936508132453L;

	public CalculationException(String message) {
		super(message);
	}

	public CalculationException(Throwable cause) {
		super(cause);
	}

	public CalculationException(String message, Throwable cause) {
		super(message, cause);
	}
}
