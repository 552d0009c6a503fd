/*
 * (c) Copyright Christian P. Fries, Germany. All rights reserved. Contact: email@christian-fries.de.
 *
 * Created on 14.03.2024
 */
package net.pricingengines.time;

import java.time.LocalDate;

/**
 * Interface for various day count conventions.
 */
public interface DayCountConventionInterface {

	/**
	 * Returns the day count fraction for the period from startDate to endDate.
	 * The fraction is negative if endDate lies before startDate.
	 *
	 * @param startDate Start date of the period.
	 * @param endDate End date of the period.
	 * @return The day count fraction (year fraction).
	 */
	double getDaycountFraction(LocalDate startDate, LocalDate endDate);
}
