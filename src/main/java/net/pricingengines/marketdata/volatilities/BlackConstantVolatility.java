/*
 * (c) Copyright Christian P. Fries, Germany. All rights reserved. Contact: email@christian-fries.de.
 *
 * Created on 16.03.2024
 */
package net.pricingengines.marketdata.volatilities;

import java.time.LocalDate;

import net.pricingengines.time.DayCountConventionInterface;

/**
 * Constant Black volatility, independent of time and strike.
 */
public class BlackConstantVolatility extends AbstractBlackVolTermStructure {

	private final double volatility;

	public BlackConstantVolatility(LocalDate referenceDate, double volatility, DayCountConventionInterface dayCountConvention) {
		super(referenceDate, dayCountConvention);
		if(volatility < 0) throw new IllegalArgumentException("Negative volatility given: " + volatility);
		this.volatility = volatility;
	}

	@Override
	public double getBlackVolatility(double time, double strike) {
		return volatility;
	}

	@Override
	public double getBlackVariance(double time, double strike) {
		return volatility * volatility * time;
	}
}
