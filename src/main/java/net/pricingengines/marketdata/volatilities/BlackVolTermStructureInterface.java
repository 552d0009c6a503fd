/*
 * (c) Copyright Christian P. Fries, Germany. All rights reserved. Contact: email@christian-fries.de.
 *
 * Created on 16.03.2024
 */
package net.pricingengines.marketdata.volatilities;

import java.time.LocalDate;

import net.pricingengines.time.DayCountConventionInterface;

/**
 * Interface of a Black volatility term structure. Times are year fractions from the
 * reference date; the strike argument allows for a strike (asset level) dependence.
 */
public interface BlackVolTermStructureInterface {

	LocalDate getReferenceDate();

	DayCountConventionInterface getDayCountConvention();

	double getTimeFromReferenceDate(LocalDate date);

	/**
	 * Returns the Black volatility for the given option maturity and strike.
	 *
	 * @param time The option maturity.
	 * @param strike The option strike.
	 * @return The Black (lognormal) volatility.
	 */
	double getBlackVolatility(double time, double strike);

	/**
	 * Returns the total Black variance, i.e., <i>&sigma;<sup>2</sup> t</i>.
	 *
	 * @param time The option maturity.
	 * @param strike The option strike.
	 * @return The total variance.
	 */
	double getBlackVariance(double time, double strike);
}
