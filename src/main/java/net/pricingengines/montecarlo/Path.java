/*
 * (c) Copyright Christian P. Fries, Germany. All rights reserved. Contact: email@christian-fries.de.
 *
 * Created on 25.03.2024
 */
package net.pricingengines.montecarlo;

/**
 * A single sample path of the logarithm of a one dimensional process, given by its
 * drift and diffusion increments on a time discretization.
 * The log-increment over step <i>i</i> is <code>drift[i] + diffusion[i]</code>.
 */
public class Path {

	private final double[] times;
	private final double[] drift;
	private final double[] diffusion;

	/**
	 * @param times The end times of the time steps.
	 * @param drift The drift increments, one per time step.
	 * @param diffusion The diffusion increments, one per time step.
	 */
	public Path(double[] times, double[] drift, double[] diffusion) {
		super();
		if(times.length != drift.length || times.length != diffusion.length) {
			throw new IllegalArgumentException("Times, drift and diffusion must have the same length.");
		}
		this.times		= times;
		this.drift		= drift;
		this.diffusion	= diffusion;
	}

	public int getNumberOfTimeSteps() {
		return times.length;
	}

	public double getTime(int timeIndex) {
		return times[timeIndex];
	}

	public double getDrift(int timeIndex) {
		return drift[timeIndex];
	}

	public double getDiffusion(int timeIndex) {
		return diffusion[timeIndex];
	}

	public double getDriftSum() {
		double sum = 0.0;
		for(double increment : drift) sum += increment;
		return sum;
	}

	public double getDiffusionSum() {
		double sum = 0.0;
		for(double increment : diffusion) sum += increment;
		return sum;
	}
}
