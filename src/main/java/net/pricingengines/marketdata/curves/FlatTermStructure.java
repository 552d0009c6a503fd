/*
 * (c) Copyright Christian P. Fries, Germany. All rights reserved. Contact: email@christian-fries.de.
 *
 * Created on 15.03.2024
 */
package net.pricingengines.marketdata.curves;

import java.time.LocalDate;

import net.pricingengines.time.DayCountConventionInterface;
import org.apache.commons.math3.util.FastMath;

/**
 * A term structure with a constant continuously compounded zero rate,
 * i.e., <i>df(t) = exp(-r t)</i>.
 */
public class FlatTermStructure extends AbstractTermStructure {

	private final double rate;

	public FlatTermStructure(LocalDate referenceDate, double rate, DayCountConventionInterface dayCountConvention) {
		super(referenceDate, dayCountConvention);
		this.rate = rate;
	}

	@Override
	public double getDiscountFactor(double time) {
		return FastMath.exp(-rate * time);
	}

	@Override
	public double getZeroRate(double time) {
		return rate;
	}

	public double getRate() {
		return rate;
	}

	@Override
	public String toString() {
		return "FlatTermStructure [referenceDate=" + getReferenceDate() + ", rate=" + rate + ", dayCountConvention=" + getDayCountConvention() + "]";
	}
}
