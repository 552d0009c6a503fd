/*
 * (c) Copyright Christian P. Fries, Germany. All rights reserved. Contact: email@christian-fries.de.
 *
 * Created on 20.03.2024
 */
package net.pricingengines.pricingengines;

import net.pricingengines.exception.CalculationException;
import net.pricingengines.exception.ConfigurationException;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.util.FastMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pricing engine for European options using the Black-Scholes formula on the
 * given term structures.
 *
 * With <i>P<sub>r</sub>(T)</i>, <i>P<sub>q</sub>(T)</i> the risk free and dividend discount factors,
 * the forward is <i>F = S P<sub>q</sub>(T) / P<sub>r</sub>(T)</i> and the total variance is taken
 * from the volatility term structure at the option strike. Theta is obtained from the
 * Black-Scholes PDE using the zero rates to maturity.
 */
public class AnalyticEuropeanEngine extends AbstractPricingEngine<VanillaOptionArguments, VanillaOptionResults> {

	private static final Logger log = LoggerFactory.getLogger(AnalyticEuropeanEngine.class);

	private static final NormalDistribution normalDistribution = new NormalDistribution();

	public AnalyticEuropeanEngine() {
		super(new VanillaOptionArguments(), new VanillaOptionResults());
	}

	@Override
	public void calculate() throws CalculationException {
		arguments.validate();
		if(arguments.getExerciseType() != ExerciseType.EUROPEAN) {
			throw new ConfigurationException("Analytic European engine does not support " + arguments.getExerciseType() + " exercise.");
		}

		double underlying	= arguments.getUnderlying();
		double strike		= arguments.getStrike();
		double maturity		= arguments.getMaturity();

		double discountFactorRiskFree	= arguments.getRiskFreeCurve().getDiscountFactor(maturity);
		double discountFactorDividend	= arguments.getDividendCurve().getDiscountFactor(maturity);
		double variance					= arguments.getVolatility().getBlackVariance(maturity, strike);
		if(!(variance > 0.0)) {
			throw new CalculationException("Non-positive Black variance " + variance + " for maturity " + maturity + " and strike " + strike + ".");
		}

		double forward				= underlying * discountFactorDividend / discountFactorRiskFree;
		double standardDeviation	= FastMath.sqrt(variance);
		double d1 = FastMath.log(forward / strike) / standardDeviation + 0.5 * standardDeviation;
		double d2 = d1 - standardDeviation;
		double densityD1 = normalDistribution.density(d1);

		double value				= 0.0;
		double delta				= 0.0;
		double rho					= 0.0;
		double dividendRho			= 0.0;
		double strikeSensitivity	= 0.0;
		int numberOfLegs			= 0;
		for(double omega : getPayoffSigns(arguments.getType())) {
			double probabilityD1 = normalDistribution.cumulativeProbability(omega * d1);
			double probabilityD2 = normalDistribution.cumulativeProbability(omega * d2);

			value				+= discountFactorRiskFree * omega * (forward * probabilityD1 - strike * probabilityD2);
			delta				+= omega * discountFactorDividend * probabilityD1;
			rho					+= omega * strike * maturity * discountFactorRiskFree * probabilityD2;
			dividendRho			+= -omega * underlying * maturity * discountFactorDividend * probabilityD1;
			strikeSensitivity	+= -omega * discountFactorRiskFree * probabilityD2;
			numberOfLegs++;
		}
		double gamma	= numberOfLegs * discountFactorDividend * densityD1 / (underlying * standardDeviation);
		double vega		= numberOfLegs * underlying * discountFactorDividend * densityD1 * FastMath.sqrt(maturity);

		double riskFreeRate		= arguments.getRiskFreeCurve().getZeroRate(maturity);
		double dividendYield	= arguments.getDividendCurve().getZeroRate(maturity);
		double volatility		= FastMath.sqrt(variance / maturity);
		double theta = riskFreeRate * value
				- (riskFreeRate - dividendYield) * underlying * delta
				- 0.5 * volatility * volatility * underlying * underlying * gamma;

		results.setValue(value);
		results.setDelta(delta);
		results.setGamma(gamma);
		results.setTheta(theta);
		results.setVega(vega);
		results.setRho(rho);
		results.setDividendRho(dividendRho);
		results.setStrikeSensitivity(strikeSensitivity);

		log.debug("Calculated {} option: underlying={}, strike={}, maturity={}, value={}", arguments.getType(), underlying, strike, maturity, value);
	}

	private static double[] getPayoffSigns(OptionType type) {
		switch(type) {
		case CALL:
			return new double[] { 1.0 };
		case PUT:
			return new double[] { -1.0 };
		case STRADDLE:
			return new double[] { 1.0, -1.0 };
		default:
			throw new IllegalArgumentException("Option type " + type + " not supported.");
		}
	}
}
