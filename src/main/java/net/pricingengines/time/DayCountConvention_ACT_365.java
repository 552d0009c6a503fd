/*
 * (c) Copyright Christian P. Fries, Germany. All rights reserved. Contact: email@christian-fries.de.
 *
 * Created on 14.03.2024
 */
package net.pricingengines.time;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Implementation of ACT/365: actual number of days divided by 365.
 */
public class DayCountConvention_ACT_365 implements DayCountConventionInterface {

	@Override
	public double getDaycountFraction(LocalDate startDate, LocalDate endDate) {
		return ChronoUnit.DAYS.between(startDate, endDate) / 365.0;
	}

	@Override
	public String toString() {
		return "ACT/365";
	}
}
