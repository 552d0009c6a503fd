/*
 * (c) Copyright Christian P. Fries, Germany. All rights reserved. Contact: email@christian-fries.de.
 *
 * Created on 27.03.2024
 */
package net.pricingengines.pricers;

import java.util.Map;

import net.pricingengines.exception.ConfigurationException;
import net.pricingengines.montecarlo.EuropeanPathPricer;
import net.pricingengines.montecarlo.GaussianPathGenerator;
import net.pricingengines.montecarlo.MonteCarloModel;
import net.pricingengines.montecarlo.PathGeneratorInterface;
import net.pricingengines.montecarlo.PathPricerInterface;
import net.pricingengines.montecarlo.Statistics;
import net.pricingengines.pricingengines.OptionType;
import org.apache.commons.math3.util.FastMath;

/**
 * Monte Carlo pricer of a European option in the Black-Scholes model with constant
 * dividend yield, risk free rate and volatility.
 *
 * The log of the underlying is simulated in a single time step with drift
 * <i>r - q - &sigma;<sup>2</sup>/2</i> and variance <i>&sigma;<sup>2</sup></i>,
 * the payoff is discounted with <i>exp(-r T)</i>.
 */
public class MonteCarloEuropeanOption extends AbstractMonteCarloPricer {

	public MonteCarloEuropeanOption(OptionType type, double underlying, double strike, double dividendYield,
			double riskFreeRate, double residualTime, double volatility, boolean isAntitheticVariance, long seed) {
		this(type, underlying, strike, dividendYield, riskFreeRate, residualTime, volatility, isAntitheticVariance, seed, null);
	}

	public MonteCarloEuropeanOption(OptionType type, double underlying, double strike, double dividendYield,
			double riskFreeRate, double residualTime, double volatility, boolean isAntitheticVariance, long seed,
			Map<String, ?> properties) {
		super(createModel(type, underlying, strike, dividendYield, riskFreeRate, residualTime, volatility, isAntitheticVariance, seed), properties);
	}

	private static MonteCarloModel createModel(OptionType type, double underlying, double strike, double dividendYield,
			double riskFreeRate, double residualTime, double volatility, boolean isAntitheticVariance, long seed) {
		double drift = riskFreeRate - dividendYield - 0.5 * volatility * volatility;

		try {
			PathGeneratorInterface pathGenerator = new GaussianPathGenerator(drift, volatility * volatility, residualTime, 1, seed);

			PathPricerInterface pathPricer = new EuropeanPathPricer(type, underlying, strike, FastMath.exp(-riskFreeRate * residualTime), isAntitheticVariance);

			return new MonteCarloModel(pathGenerator, pathPricer, new Statistics());
		}
		catch(IllegalArgumentException e) {
			throw new ConfigurationException("MonteCarloEuropeanOption: " + e.getMessage(), e);
		}
	}
}
