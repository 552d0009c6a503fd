/*
 * (c) Copyright Christian P. Fries, Germany. All rights reserved. Contact: email@christian-fries.de.
 *
 * Created on 19.03.2024
 */
package net.pricingengines.pricingengines;

public enum OptionType {
	CALL,
	PUT,
	STRADDLE
}
