/*
 * (c) Copyright Christian P. Fries, Germany. All rights reserved. Contact: email@christian-fries.de.
 *
 * Created on 16.03.2024
 */
package net.pricingengines.marketdata.volatilities;

import java.time.LocalDate;

/**
 * The Black volatility term structure implied by a given one as seen from a later date,
 * i.e., the forward variance
 * <i>v(t, K) = V(t<sub>0</sub> + t, K) - V(t<sub>0</sub>, K)</i>,
 * where <i>V</i> is the total variance of the original structure and <i>t<sub>0</sub></i>
 * is the time of the new reference date on the original structure.
 *
 * This is exact if the volatility is at most time dependent. If the original volatility
 * depends on the asset level (smile), the strike is passed through unchanged and the
 * result is only an approximation; a consistent treatment would require a local or
 * stochastic volatility model.
 */
public class ImpliedVolTermStructure extends AbstractBlackVolTermStructure {

	private final BlackVolTermStructureInterface	originalVolatility;
	private final double							originalTimeOfReferenceDate;

	public ImpliedVolTermStructure(BlackVolTermStructureInterface originalVolatility, LocalDate referenceDate) {
		super(referenceDate, originalVolatility.getDayCountConvention());
		this.originalVolatility = originalVolatility;
		this.originalTimeOfReferenceDate = originalVolatility.getTimeFromReferenceDate(referenceDate);

		if(originalTimeOfReferenceDate < 0) throw new IllegalArgumentException("Reference date " + referenceDate + " before reference date of original volatility " + originalVolatility.getReferenceDate() + ".");
	}

	@Override
	public double getBlackVariance(double time, double strike) {
		return originalVolatility.getBlackVariance(originalTimeOfReferenceDate + time, strike)
				- originalVolatility.getBlackVariance(originalTimeOfReferenceDate, strike);
	}

	public BlackVolTermStructureInterface getOriginalVolatility() {
		return originalVolatility;
	}
}
