/*
 * (c) Copyright Christian P. Fries, Germany. All rights reserved. Contact: email@christian-fries.de.
 *
 * Created on 15.03.2024
 */
package net.pricingengines.marketdata.curves;

import java.time.LocalDate;

import net.pricingengines.time.DayCountConventionInterface;

/**
 * Interface of a yield term structure (discount curve) anchored at a reference date.
 *
 * Times are year fractions measured from the reference date using the curve's
 * day count convention. Zero rates are continuously compounded.
 */
public interface TermStructureInterface {

	LocalDate getReferenceDate();

	DayCountConventionInterface getDayCountConvention();

	/**
	 * Returns the year fraction from the reference date of this curve to the given date.
	 *
	 * @param date The date.
	 * @return The year fraction, negative if the date lies before the reference date.
	 */
	double getTimeFromReferenceDate(LocalDate date);

	/**
	 * Returns the discount factor for the given time (year fraction from the reference date).
	 *
	 * @param time The maturity.
	 * @return The discount factor.
	 */
	double getDiscountFactor(double time);

	double getDiscountFactor(LocalDate date);

	/**
	 * Returns the continuously compounded zero rate for the given time.
	 * For time zero the instantaneous short rate is returned.
	 *
	 * @param time The maturity.
	 * @return The zero rate.
	 */
	double getZeroRate(double time);

	double getZeroRate(LocalDate date);
}
