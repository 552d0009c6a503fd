/*
 * (c) Copyright Christian P. Fries, Germany. All rights reserved. Contact: email@christian-fries.de.
 *
 * Created on 19.03.2024
 */
package net.pricingengines.pricingengines;

/**
 * Results computed by a pricing engine.
 */
public interface ResultsInterface {

	/**
	 * Discards all previously calculated results.
	 */
	void reset();
}
