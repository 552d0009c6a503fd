/*
 * (c) Copyright Christian P. Fries, Germany. All rights reserved. Contact: email@christian-fries.de.
 *
 * Created on 19.03.2024
 */
package net.pricingengines.pricingengines;

/**
 * Value and sensitivities (Greeks) of an option. Values not (yet) calculated are <code>NaN</code>.
 */
public class OptionResults implements ResultsInterface {

	private double value;
	private double delta;
	private double gamma;
	private double theta;
	private double vega;
	private double rho;
	private double dividendRho;

	public OptionResults() {
		reset();
	}

	@Override
	public void reset() {
		value		= Double.NaN;
		delta		= Double.NaN;
		gamma		= Double.NaN;
		theta		= Double.NaN;
		vega		= Double.NaN;
		rho			= Double.NaN;
		dividendRho	= Double.NaN;
	}

	public double getValue() {
		return value;
	}

	public void setValue(double value) {
		this.value = value;
	}

	public double getDelta() {
		return delta;
	}

	public void setDelta(double delta) {
		this.delta = delta;
	}

	public double getGamma() {
		return gamma;
	}

	public void setGamma(double gamma) {
		this.gamma = gamma;
	}

	public double getTheta() {
		return theta;
	}

	public void setTheta(double theta) {
		this.theta = theta;
	}

	public double getVega() {
		return vega;
	}

	public void setVega(double vega) {
		this.vega = vega;
	}

	public double getRho() {
		return rho;
	}

	public void setRho(double rho) {
		this.rho = rho;
	}

	public double getDividendRho() {
		return dividendRho;
	}

	public void setDividendRho(double dividendRho) {
		this.dividendRho = dividendRho;
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + " [value=" + value + ", delta=" + delta + ", gamma=" + gamma + ", theta=" + theta
				+ ", vega=" + vega + ", rho=" + rho + ", dividendRho=" + dividendRho + "]";
	}
}
