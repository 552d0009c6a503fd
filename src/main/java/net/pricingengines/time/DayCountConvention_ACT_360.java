/*
 * (c) Copyright Christian P. Fries, Germany. All rights reserved. Contact: email@christian-fries.de.
 *
 * Created on 14.03.2024
 */
package net.pricingengines.time;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Implementation of ACT/360: actual number of days divided by 360.
 */
public class DayCountConvention_ACT_360 implements DayCountConventionInterface {

	@Override
	public double getDaycountFraction(LocalDate startDate, LocalDate endDate) {
		return ChronoUnit.DAYS.between(startDate, endDate) / 360.0;
	}

	@Override
	public String toString() {
		return "ACT/360";
	}
}
