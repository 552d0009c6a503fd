/*
 * (c) Copyright Christian P. Fries, Germany. All rights reserved. Contact: email@christian-fries.de.
 *
 * Created on 25.03.2024
 */
package net.pricingengines.montecarlo;

import net.pricingengines.pricingengines.OptionType;
import org.apache.commons.math3.util.FastMath;

/**
 * Path pricer of a European option: the discounted payoff at the end of the path of
 * <i>S(T) = S(0) exp(&Sigma; drift + &Sigma; diffusion)</i>.
 *
 * With antithetic variance the value is the average of the payoffs on the path and on
 * the mirrored path <i>S(0) exp(&Sigma; drift - &Sigma; diffusion)</i>.
 */
public class EuropeanPathPricer implements PathPricerInterface {

	private final OptionType	type;
	private final double		underlying;
	private final double		strike;
	private final double		discount;
	private final boolean		isAntitheticVariance;

	public EuropeanPathPricer(OptionType type, double underlying, double strike, double discount, boolean isAntitheticVariance) {
		super();
		if(type == null)			throw new IllegalArgumentException("No option type given.");
		if(!(underlying > 0))		throw new IllegalArgumentException("Non-positive underlying given: " + underlying);
		if(strike < 0)				throw new IllegalArgumentException("Negative strike given: " + strike);
		if(!(discount > 0))			throw new IllegalArgumentException("Non-positive discount given: " + discount);
		this.type					= type;
		this.underlying				= underlying;
		this.strike					= strike;
		this.discount				= discount;
		this.isAntitheticVariance	= isAntitheticVariance;
	}

	@Override
	public double getValue(Path path) {
		double driftSum		= path.getDriftSum();
		double diffusionSum	= path.getDiffusionSum();

		double value = getPayoff(underlying * FastMath.exp(driftSum + diffusionSum));
		if(isAntitheticVariance) {
			value = 0.5 * (value + getPayoff(underlying * FastMath.exp(driftSum - diffusionSum)));
		}
		return discount * value;
	}

	private double getPayoff(double underlyingAtMaturity) {
		switch(type) {
		case CALL:
			return Math.max(underlyingAtMaturity - strike, 0.0);
		case PUT:
			return Math.max(strike - underlyingAtMaturity, 0.0);
		case STRADDLE:
			return Math.abs(underlyingAtMaturity - strike);
		default:
			throw new IllegalArgumentException("Option type " + type + " not supported.");
		}
	}

	public boolean isAntitheticVariance() {
		return isAntitheticVariance;
	}
}
