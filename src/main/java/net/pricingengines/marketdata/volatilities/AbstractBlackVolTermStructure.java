/*
 * (c) Copyright Christian P. Fries, Germany. All rights reserved. Contact: email@christian-fries.de.
 *
 * Created on 16.03.2024
 */
package net.pricingengines.marketdata.volatilities;

import java.time.LocalDate;

import net.pricingengines.time.DayCountConventionInterface;
import org.apache.commons.math3.util.FastMath;

/**
 * Abstract base class for Black volatility term structures. Derive from this class and
 * implement <code>getBlackVariance</code>; the volatility is derived from the variance.
 */
public abstract class AbstractBlackVolTermStructure implements BlackVolTermStructureInterface {

	// Time used for the volatility at time 0
	private static final double SHORT_TIME_STEP = 1.0 / 365.0;

	private final LocalDate						referenceDate;
	private final DayCountConventionInterface	dayCountConvention;

	public AbstractBlackVolTermStructure(LocalDate referenceDate, DayCountConventionInterface dayCountConvention) {
		super();
		if(referenceDate == null)		throw new IllegalArgumentException("Reference date must not be null.");
		if(dayCountConvention == null)	throw new IllegalArgumentException("Day count convention must not be null.");
		this.referenceDate		= referenceDate;
		this.dayCountConvention	= dayCountConvention;
	}

	@Override
	public LocalDate getReferenceDate() {
		return referenceDate;
	}

	@Override
	public DayCountConventionInterface getDayCountConvention() {
		return dayCountConvention;
	}

	@Override
	public double getTimeFromReferenceDate(LocalDate date) {
		return dayCountConvention.getDaycountFraction(referenceDate, date);
	}

	@Override
	public double getBlackVolatility(double time, double strike) {
		double effectiveTime = time == 0.0 ? SHORT_TIME_STEP : time;
		return FastMath.sqrt(getBlackVariance(effectiveTime, strike) / effectiveTime);
	}
}
