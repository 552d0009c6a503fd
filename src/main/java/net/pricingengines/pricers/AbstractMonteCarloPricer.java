/*
 * (c) Copyright Christian P. Fries, Germany. All rights reserved. Contact: email@christian-fries.de.
 *
 * Created on 27.03.2024
 */
package net.pricingengines.pricers;

import java.util.Map;

import net.pricingengines.exception.CalculationException;
import net.pricingengines.exception.ConfigurationException;
import net.pricingengines.montecarlo.MonteCarloModel;
import org.apache.commons.math3.util.FastMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for Monte Carlo pricers. Samples are accumulated across calls, i.e., each call
 * continues the simulation of the previous one.
 *
 * Supported properties:
 * <ul>
 * <li><code>minimumSamples</code>: the minimum batch size of {@link #getValue(double, long)}, default 100.</li>
 * </ul>
 */
public abstract class AbstractMonteCarloPricer {

	private static final Logger log = LoggerFactory.getLogger(AbstractMonteCarloPricer.class);

	private final MonteCarloModel	monteCarloModel;
	private final long				minimumSamples;

	public AbstractMonteCarloPricer(MonteCarloModel monteCarloModel, Map<String, ?> properties) {
		super();
		this.monteCarloModel = monteCarloModel;

		long minimumSamples = 100;
		if(properties != null && properties.containsKey("minimumSamples"))	minimumSamples = Long.parseLong(properties.get("minimumSamples").toString());
		if(minimumSamples < 2) throw new ConfigurationException("Minimum number of samples must be at least 2, given: " + minimumSamples);
		this.minimumSamples = minimumSamples;
	}

	/**
	 * Adds samples until the error estimate is below the given tolerance and returns the estimate.
	 *
	 * @param tolerance The (absolute) tolerance of the error estimate.
	 * @param maxSamples The maximum number of samples.
	 * @return The Monte Carlo estimate of the value.
	 * @throws CalculationException Thrown if the tolerance is not reached with <code>maxSamples</code> samples.
	 */
	public double getValue(double tolerance, long maxSamples) throws CalculationException {
		if(!(tolerance > 0)) throw new ConfigurationException("Tolerance must be positive, given: " + tolerance);

		long sampleNumber = monteCarloModel.getSampleAccumulator().getSamples();
		long firstBatchSize = Math.min(minimumSamples, maxSamples);
		if(sampleNumber < firstBatchSize) {
			monteCarloModel.addSamples(firstBatchSize - sampleNumber);
			sampleNumber = firstBatchSize;
		}

		double error = getErrorEstimate();
		// error is NaN with less than two samples
		while(!(error <= tolerance)) {
			// the error decreases like 1/sqrt(n)
			double order = (error * error) / (tolerance * tolerance);
			long nextBatch = Math.max((long)FastMath.ceil(sampleNumber * order * 0.8 - sampleNumber), minimumSamples);
			nextBatch = Math.min(nextBatch, maxSamples - sampleNumber);
			if(nextBatch <= 0) {
				throw new CalculationException("Maximum number of samples " + maxSamples + " exceeded, error estimate " + error + " above tolerance " + tolerance + ".");
			}

			monteCarloModel.addSamples(nextBatch);
			sampleNumber += nextBatch;
			error = getErrorEstimate();
			log.debug("Monte Carlo samples={}, error estimate={}", sampleNumber, error);
		}

		return monteCarloModel.getSampleAccumulator().getMean();
	}

	/**
	 * Adds samples until the total number of samples equals <code>samples</code> and returns the estimate.
	 *
	 * @param samples The total number of samples.
	 * @return The Monte Carlo estimate of the value.
	 */
	public double getValueWithSamples(long samples) {
		long sampleNumber = monteCarloModel.getSampleAccumulator().getSamples();
		if(samples < sampleNumber) {
			throw new ConfigurationException("Number of samples " + samples + " lower than the number of samples already used (" + sampleNumber + ").");
		}

		monteCarloModel.addSamples(samples - sampleNumber);
		return monteCarloModel.getSampleAccumulator().getMean();
	}

	public double getErrorEstimate() {
		return monteCarloModel.getSampleAccumulator().getErrorEstimate();
	}

	public MonteCarloModel getMonteCarloModel() {
		return monteCarloModel;
	}
}
