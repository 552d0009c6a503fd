/*
 * (c) Copyright Christian P. Fries, Germany. All rights reserved. Contact: email@christian-fries.de.
 *
 * Created on 18.03.2024
 */
package net.pricingengines.marketdata.volatilities;

import java.time.LocalDate;
import java.util.Arrays;

import net.pricingengines.time.DayCountConventionInterface;

/**
 * Time dependent, strike independent Black volatility given by volatilities on a set of
 * maturities. The total variance <i>&sigma;<sup>2</sup> t</i> is interpolated linearly in time
 * (starting from zero variance at time 0); beyond the last maturity the last volatility is
 * extrapolated constant.
 */
public class BlackVarianceCurve extends AbstractBlackVolTermStructure {

	private final double[] times;
	private final double[] variances;

	public BlackVarianceCurve(LocalDate referenceDate, double[] times, double[] volatilities, DayCountConventionInterface dayCountConvention) {
		super(referenceDate, dayCountConvention);
		if(times == null || volatilities == null || times.length == 0)	throw new IllegalArgumentException("Variance curve requires at least one time and volatility.");
		if(times.length != volatilities.length)							throw new IllegalArgumentException("Number of times (" + times.length + ") and volatilities (" + volatilities.length + ") differ.");

		this.times		= new double[times.length+1];
		this.variances	= new double[times.length+1];
		for(int i=0; i<times.length; i++) {
			if(times[i] <= this.times[i]) throw new IllegalArgumentException("Times have to be positive and strictly increasing.");
			this.times[i+1]		= times[i];
			this.variances[i+1]	= volatilities[i] * volatilities[i] * times[i];
			if(variances[i+1] < variances[i]) throw new IllegalArgumentException("Variance must be non-decreasing (at time " + times[i] + ").");
		}
	}

	@Override
	public double getBlackVariance(double time, double strike) {
		int last = times.length-1;
		if(time >= times[last]) return variances[last] * time / times[last];

		int index = Arrays.binarySearch(times, time);
		if(index >= 0) return variances[index];

		int upper = -index-1;
		int lower = upper-1;
		double weight = (time - times[lower]) / (times[upper] - times[lower]);
		return variances[lower] + weight * (variances[upper] - variances[lower]);
	}
}
