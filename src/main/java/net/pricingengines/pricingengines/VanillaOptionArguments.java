/*
 * (c) Copyright Christian P. Fries, Germany. All rights reserved. Contact: email@christian-fries.de.
 *
 * Created on 19.03.2024
 */
package net.pricingengines.pricingengines;

import net.pricingengines.exception.ConfigurationException;
import net.pricingengines.marketdata.curves.TermStructureInterface;
import net.pricingengines.marketdata.volatilities.BlackVolTermStructureInterface;

/**
 * Arguments of a plain vanilla option on a single underlying.
 *
 * The maturity is a year fraction measured from the reference date of the curves.
 * Unset numbers are <code>NaN</code>, unset references are <code>null</code>.
 */
public class VanillaOptionArguments implements ArgumentsInterface {

	private OptionType						type;
	private double							underlying		= Double.NaN;
	private double							strike			= Double.NaN;
	private TermStructureInterface			dividendCurve;
	private TermStructureInterface			riskFreeCurve;
	private BlackVolTermStructureInterface	volatility;
	private ExerciseType					exerciseType	= ExerciseType.EUROPEAN;
	private double[]						stoppingTimes	= new double[0];
	private double							maturity		= Double.NaN;

	@Override
	public void validate() {
		if(type == null)					throw new ConfigurationException("No option type given.");
		if(Double.isNaN(underlying))		throw new ConfigurationException("No underlying value given.");
		if(!(underlying > 0.0))				throw new ConfigurationException("Negative or zero underlying given: " + underlying);
		if(Double.isNaN(strike))			throw new ConfigurationException("No strike given.");
		if(!(strike > 0.0))					throw new ConfigurationException("Negative or zero strike given: " + strike);
		if(dividendCurve == null)			throw new ConfigurationException("No dividend term structure given.");
		if(riskFreeCurve == null)			throw new ConfigurationException("No risk free term structure given.");
		if(volatility == null)				throw new ConfigurationException("No volatility term structure given.");
		if(exerciseType == null)			throw new ConfigurationException("No exercise type given.");
		if(Double.isNaN(maturity))			throw new ConfigurationException("No maturity given.");
		if(!(maturity > 0.0))				throw new ConfigurationException("Negative or zero maturity given: " + maturity);
		if(stoppingTimes == null)			throw new ConfigurationException("Null stopping times given.");
		if(exerciseType == ExerciseType.BERMUDAN && stoppingTimes.length == 0) throw new ConfigurationException("Bermudan exercise requires stopping times.");
		for(double stoppingTime : stoppingTimes) {
			if(stoppingTime < 0.0 || stoppingTime > maturity) throw new ConfigurationException("Stopping time " + stoppingTime + " outside [0, " + maturity + "].");
		}
	}

	public OptionType getType() {
		return type;
	}

	public void setType(OptionType type) {
		this.type = type;
	}

	public double getUnderlying() {
		return underlying;
	}

	public void setUnderlying(double underlying) {
		this.underlying = underlying;
	}

	public double getStrike() {
		return strike;
	}

	public void setStrike(double strike) {
		this.strike = strike;
	}

	public TermStructureInterface getDividendCurve() {
		return dividendCurve;
	}

	public void setDividendCurve(TermStructureInterface dividendCurve) {
		this.dividendCurve = dividendCurve;
	}

	public TermStructureInterface getRiskFreeCurve() {
		return riskFreeCurve;
	}

	public void setRiskFreeCurve(TermStructureInterface riskFreeCurve) {
		this.riskFreeCurve = riskFreeCurve;
	}

	public BlackVolTermStructureInterface getVolatility() {
		return volatility;
	}

	public void setVolatility(BlackVolTermStructureInterface volatility) {
		this.volatility = volatility;
	}

	public ExerciseType getExerciseType() {
		return exerciseType;
	}

	public void setExerciseType(ExerciseType exerciseType) {
		this.exerciseType = exerciseType;
	}

	/**
	 * @return The stopping (exercise) times. The array is shared, not copied.
	 */
	public double[] getStoppingTimes() {
		return stoppingTimes;
	}

	public void setStoppingTimes(double[] stoppingTimes) {
		this.stoppingTimes = stoppingTimes;
	}

	public double getMaturity() {
		return maturity;
	}

	public void setMaturity(double maturity) {
		this.maturity = maturity;
	}
}
