/*
 * (c) Copyright Christian P. Fries, Germany. All rights reserved. Contact: email@christian-fries.de.
 *
 * Created on 18.03.2024
 */
package net.pricingengines.marketdata.curves;

import java.time.LocalDate;
import java.util.Arrays;

import net.pricingengines.time.DayCountConventionInterface;
import org.apache.commons.math3.util.FastMath;

/**
 * A term structure given by continuously compounded zero rates on a set of times.
 * Zero rates are interpolated linearly between the given times and extrapolated
 * constant outside.
 */
public class ZeroCurveInterpolated extends AbstractTermStructure {

	private final double[] times;
	private final double[] zeroRates;

	/**
	 * Create a zero curve.
	 *
	 * @param referenceDate The reference date of the curve.
	 * @param times Strictly increasing, non-negative times of the given zero rates.
	 * @param zeroRates The zero rates at the given times.
	 * @param dayCountConvention The day count convention mapping dates to times.
	 */
	public ZeroCurveInterpolated(LocalDate referenceDate, double[] times, double[] zeroRates, DayCountConventionInterface dayCountConvention) {
		super(referenceDate, dayCountConvention);
		if(times == null || zeroRates == null || times.length == 0)	throw new IllegalArgumentException("Zero curve requires at least one time and rate.");
		if(times.length != zeroRates.length)						throw new IllegalArgumentException("Number of times (" + times.length + ") and zero rates (" + zeroRates.length + ") differ.");
		if(times[0] < 0)											throw new IllegalArgumentException("Negative time given: " + times[0]);
		for(int i=1; i<times.length; i++) {
			if(times[i] <= times[i-1]) throw new IllegalArgumentException("Times have to be strictly increasing.");
		}

		this.times		= times.clone();
		this.zeroRates	= zeroRates.clone();
	}

	@Override
	public double getDiscountFactor(double time) {
		return FastMath.exp(-getZeroRate(time) * time);
	}

	@Override
	public double getZeroRate(double time) {
		if(time <= times[0])				return zeroRates[0];
		if(time >= times[times.length-1])	return zeroRates[zeroRates.length-1];

		int index = Arrays.binarySearch(times, time);
		if(index >= 0) return zeroRates[index];

		int upper = -index-1;
		int lower = upper-1;
		double weight = (time - times[lower]) / (times[upper] - times[lower]);
		return zeroRates[lower] + weight * (zeroRates[upper] - zeroRates[lower]);
	}
}
