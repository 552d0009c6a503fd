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
 * Abstract base class for term structures. Implements the date based methods
 * of {@link TermStructureInterface} and the zero rate via the discount factor.
 * Derive from this class and implement <code>getDiscountFactor(double)</code>.
 */
public abstract class AbstractTermStructure implements TermStructureInterface {

	// Time step used for the zero rate at time 0 (one calendar day)
	private static final double SHORT_RATE_TIME_STEP = 1.0 / 365.0;

	private final LocalDate						referenceDate;
	private final DayCountConventionInterface	dayCountConvention;

	public AbstractTermStructure(LocalDate referenceDate, DayCountConventionInterface dayCountConvention) {
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
	public double getDiscountFactor(LocalDate date) {
		return getDiscountFactor(getTimeFromReferenceDate(date));
	}

	@Override
	public double getZeroRate(double time) {
		if(time == 0.0) {
			return -FastMath.log(getDiscountFactor(SHORT_RATE_TIME_STEP)) / SHORT_RATE_TIME_STEP;
		}
		return -FastMath.log(getDiscountFactor(time)) / time;
	}

	@Override
	public double getZeroRate(LocalDate date) {
		return getZeroRate(getTimeFromReferenceDate(date));
	}
}
