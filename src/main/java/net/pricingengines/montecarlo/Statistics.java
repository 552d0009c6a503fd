/*
 * (c) Copyright Christian P. Fries, Germany. All rights reserved. Contact: email@christian-fries.de.
 *
 * Created on 26.03.2024
 */
package net.pricingengines.montecarlo;

import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.apache.commons.math3.util.FastMath;

/**
 * Accumulator of Monte Carlo samples, providing the estimate (mean) and its error estimate.
 */
public class Statistics {

	private final SummaryStatistics summaryStatistics = new SummaryStatistics();

	public void add(double value) {
		summaryStatistics.addValue(value);
	}

	public long getSamples() {
		return summaryStatistics.getN();
	}

	/**
	 * @return The sample mean, <code>NaN</code> if no sample has been added.
	 */
	public double getMean() {
		return summaryStatistics.getMean();
	}

	public double getVariance() {
		return summaryStatistics.getVariance();
	}

	public double getStandardDeviation() {
		return summaryStatistics.getStandardDeviation();
	}

	/**
	 * Returns the error estimate of the mean, i.e., the standard deviation divided by
	 * the square root of the number of samples.
	 *
	 * @return The error estimate, <code>NaN</code> if less than two samples have been added.
	 */
	public double getErrorEstimate() {
		long samples = summaryStatistics.getN();
		if(samples < 2) return Double.NaN;
		return summaryStatistics.getStandardDeviation() / FastMath.sqrt(samples);
	}

	public double getMin() {
		return summaryStatistics.getMin();
	}

	public double getMax() {
		return summaryStatistics.getMax();
	}

	public void reset() {
		summaryStatistics.clear();
	}
}
