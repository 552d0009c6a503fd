/*
 * (c) Copyright Christian P. Fries, Germany. All rights reserved. Contact: email@christian-fries.de.
 *
 * Created on 21.03.2024
 */
package net.pricingengines.pricingengines.forward;

import java.time.LocalDate;

import net.pricingengines.exception.ConfigurationException;
import net.pricingengines.pricingengines.VanillaOptionArguments;

/**
 * Arguments of a forward starting (strike resetting) option.
 *
 * In addition to the vanilla option arguments the option has a <code>moneyness</code>
 * and a <code>resetDate</code>: at the reset date the strike is fixed at
 * moneyness times the underlying value observed on that date.
 *
 * The strike of the vanilla arguments is not used by the forward engines, it is still
 * subject to the vanilla validation.
 */
public class ForwardOptionArguments extends VanillaOptionArguments {

	private double		moneyness = Double.NaN;
	private LocalDate	resetDate;

	/**
	 * Validates the vanilla arguments, then checks (in this order) that the moneyness is
	 * given, positive and finite, that the reset date is given and that the reset time
	 * lies in [0, maturity].
	 */
	@Override
	public void validate() {
		super.validate();

		if(Double.isNaN(moneyness))								throw new ConfigurationException("ForwardOptionArguments: null moneyness given.");
		if(!(moneyness > 0.0) || Double.isInfinite(moneyness))	throw new ConfigurationException("ForwardOptionArguments: negative, zero or infinite moneyness given: " + moneyness);
		if(resetDate == null)									throw new ConfigurationException("ForwardOptionArguments: null reset date given.");

		double resetTime = getResetTime();
		if(resetTime < 0.0)			throw new ConfigurationException("ForwardOptionArguments: negative reset time given (reset date " + resetDate + " before " + getRiskFreeCurve().getReferenceDate() + ").");
		if(resetTime > getMaturity())	throw new ConfigurationException("ForwardOptionArguments: reset time " + resetTime + " greater than maturity " + getMaturity() + ".");
	}

	/**
	 * @return The year fraction from the reference date of the risk free curve to the reset date.
	 */
	public double getResetTime() {
		return getRiskFreeCurve().getTimeFromReferenceDate(resetDate);
	}

	public double getMoneyness() {
		return moneyness;
	}

	public void setMoneyness(double moneyness) {
		this.moneyness = moneyness;
	}

	public LocalDate getResetDate() {
		return resetDate;
	}

	public void setResetDate(LocalDate resetDate) {
		this.resetDate = resetDate;
	}
}
