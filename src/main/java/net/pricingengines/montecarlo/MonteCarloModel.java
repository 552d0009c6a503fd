/*
 * (c) Copyright Christian P. Fries, Germany. All rights reserved. Contact: email@christian-fries.de.
 *
 * Created on 26.03.2024
 */
package net.pricingengines.montecarlo;

/**
 * A one factor Monte Carlo model composed of a path generator, a path pricer and a
 * statistics accumulator. Each sample draws a new path from the generator and adds the
 * value of the path pricer on it to the accumulator.
 */
public class MonteCarloModel {

	private final PathGeneratorInterface	pathGenerator;
	private final PathPricerInterface		pathPricer;
	private final Statistics				sampleAccumulator;

	public MonteCarloModel(PathGeneratorInterface pathGenerator, PathPricerInterface pathPricer, Statistics sampleAccumulator) {
		super();
		if(pathGenerator == null || pathPricer == null || sampleAccumulator == null) {
			throw new IllegalArgumentException("Path generator, path pricer and sample accumulator are required.");
		}
		this.pathGenerator		= pathGenerator;
		this.pathPricer			= pathPricer;
		this.sampleAccumulator	= sampleAccumulator;
	}

	public void addSamples(long samples) {
		for(long i=0; i<samples; i++) {
			Path path = pathGenerator.next();
			sampleAccumulator.add(pathPricer.getValue(path));
		}
	}

	public Statistics getSampleAccumulator() {
		return sampleAccumulator;
	}

	public PathGeneratorInterface getPathGenerator() {
		return pathGenerator;
	}

	public PathPricerInterface getPathPricer() {
		return pathPricer;
	}
}
