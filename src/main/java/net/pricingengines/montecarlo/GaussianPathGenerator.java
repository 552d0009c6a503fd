/*
 * (c) Copyright Christian P. Fries, Germany. All rights reserved. Contact: email@christian-fries.de.
 *
 * Created on 25.03.2024
 */
package net.pricingengines.montecarlo;

import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.util.FastMath;

/**
 * Generates paths of a Brownian motion with constant drift and variance on an equidistant
 * time discretization, i.e., increments <i>&mu; &Delta;t</i> (drift) and
 * <i>&radic;(&sigma;<sup>2</sup> &Delta;t) Z</i> (diffusion) with standard normal <i>Z</i>.
 *
 * Random numbers are drawn from a Mersenne Twister, so generators with the same seed
 * produce the same sequence of paths.
 */
public class GaussianPathGenerator implements PathGeneratorInterface {

	private final double			drift;
	private final double			variance;
	private final double[]			times;
	private final double			timeStep;
	private final RandomGenerator	randomGenerator;

	/**
	 * @param drift The drift per unit of time.
	 * @param variance The variance per unit of time.
	 * @param time The horizon of the paths.
	 * @param timeSteps The number of time steps.
	 * @param seed The seed of the random number generator.
	 */
	public GaussianPathGenerator(double drift, double variance, double time, int timeSteps, long seed) {
		super();
		if(variance < 0)	throw new IllegalArgumentException("Negative variance given: " + variance);
		if(!(time > 0))		throw new IllegalArgumentException("Non-positive time given: " + time);
		if(timeSteps < 1)	throw new IllegalArgumentException("At least one time step required, given: " + timeSteps);

		this.drift		= drift;
		this.variance	= variance;
		this.timeStep	= time / timeSteps;
		this.times		= new double[timeSteps];
		for(int i=0; i<timeSteps; i++) times[i] = (i+1) * timeStep;
		this.randomGenerator = new MersenneTwister(seed);
	}

	@Override
	public Path next() {
		double[] driftIncrements		= new double[times.length];
		double[] diffusionIncrements	= new double[times.length];
		double standardDeviation = FastMath.sqrt(variance * timeStep);
		for(int i=0; i<times.length; i++) {
			driftIncrements[i]		= drift * timeStep;
			diffusionIncrements[i]	= standardDeviation * randomGenerator.nextGaussian();
		}
		return new Path(times, driftIncrements, diffusionIncrements);
	}

	public double getDrift() {
		return drift;
	}

	public double getVariance() {
		return variance;
	}
}
