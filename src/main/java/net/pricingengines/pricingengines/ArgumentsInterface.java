/*
 * (c) Copyright Christian P. Fries, Germany. All rights reserved. Contact: email@christian-fries.de.
 *
 * Created on 19.03.2024
 */
package net.pricingengines.pricingengines;

/**
 * Description of a problem to be solved by a pricing engine.
 */
public interface ArgumentsInterface {

	/**
	 * Checks the arguments for consistency.
	 *
	 * @throws net.pricingengines.exception.ConfigurationException Thrown on the first violated requirement.
	 */
	void validate();
}
