/*
 * (c) Copyright Christian P. Fries, Germany. All rights reserved. Contact: email@christian-fries.de.
 *
 * Created on 19.03.2024
 */
package net.pricingengines.pricingengines;

/**
 * Results of a vanilla option engine: the option results plus the sensitivity
 * with respect to the strike.
 */
public class VanillaOptionResults extends OptionResults {

	private double strikeSensitivity;

	@Override
	public void reset() {
		super.reset();
		strikeSensitivity = Double.NaN;
	}

	public double getStrikeSensitivity() {
		return strikeSensitivity;
	}

	public void setStrikeSensitivity(double strikeSensitivity) {
		this.strikeSensitivity = strikeSensitivity;
	}
}
