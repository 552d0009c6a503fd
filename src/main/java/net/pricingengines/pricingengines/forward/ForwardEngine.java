/*
 * (c) Copyright Christian P. Fries, Germany. All rights reserved. Contact: email@christian-fries.de.
 *
 * Created on 21.03.2024
 */
package net.pricingengines.pricingengines.forward;

import java.time.LocalDate;
import java.util.Map;

import net.pricingengines.exception.CalculationException;
import net.pricingengines.exception.ConfigurationException;
import net.pricingengines.marketdata.curves.ImpliedTermStructure;
import net.pricingengines.marketdata.curves.TermStructureInterface;
import net.pricingengines.marketdata.volatilities.ImpliedVolTermStructure;
import net.pricingengines.pricingengines.AbstractPricingEngine;
import net.pricingengines.pricingengines.OptionResults;
import net.pricingengines.pricingengines.PricingEngineInterface;
import net.pricingengines.pricingengines.VanillaOptionArguments;
import net.pricingengines.pricingengines.VanillaOptionResults;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pricing engine for forward starting options, re-using an engine for the corresponding
 * vanilla option (the original engine).
 *
 * On each call to {@link #calculate()} the forward option arguments are projected onto
 * vanilla arguments as seen from the reset date (strike <code>moneyness * underlying</code>,
 * curves and volatility implied at the reset date), the original engine calculates the
 * vanilla results and these are transformed back to results of the forward option.
 * The back transformation is selected by the {@link Payoff}:
 * <ul>
 * <li>{@link Payoff#FORWARD}: the absolute payoff of a forward starting option,</li>
 * <li>{@link Payoff#PERFORMANCE}: the payoff relative to the underlying at the reset date.</li>
 * </ul>
 *
 * The engine binds the arguments and results storage of the original engine at construction
 * and mutates them on every calculation. The original engine must therefore not be shared
 * with another forward engine or used elsewhere while this engine calculates. The engine is
 * not thread safe.
 *
 * @param <A> The arguments type of the original engine.
 * @param <R> The results type of the original engine.
 */
public class ForwardEngine<A extends VanillaOptionArguments, R extends VanillaOptionResults> extends AbstractPricingEngine<ForwardOptionArguments, OptionResults> {

	private static final Logger log = LoggerFactory.getLogger(ForwardEngine.class);

	public enum Payoff { FORWARD, PERFORMANCE }

	private final PricingEngineInterface<?, ?>	originalEngine;
	private final A								originalArguments;
	private final R								originalResults;
	private final Payoff						payoff;

	/**
	 * Create a forward engine for a forward starting option with absolute payoff.
	 *
	 * @param originalEngine The vanilla option engine.
	 * @param argumentsType The expected arguments type of the vanilla engine.
	 * @param resultsType The expected results type of the vanilla engine.
	 */
	public ForwardEngine(PricingEngineInterface<?, ?> originalEngine, Class<A> argumentsType, Class<R> resultsType) {
		this(originalEngine, argumentsType, resultsType, Payoff.FORWARD);
	}

	/**
	 * Create a forward engine. The payoff is given by the property <code>payoff</code>
	 * (<code>forward</code> or <code>performance</code>), default is <code>forward</code>.
	 *
	 * @param originalEngine The vanilla option engine.
	 * @param argumentsType The expected arguments type of the vanilla engine.
	 * @param resultsType The expected results type of the vanilla engine.
	 * @param properties Key value map of engine properties, may be null.
	 */
	public ForwardEngine(PricingEngineInterface<?, ?> originalEngine, Class<A> argumentsType, Class<R> resultsType, Map<String, ?> properties) {
		this(originalEngine, argumentsType, resultsType, getPayoff(properties));
	}

	public ForwardEngine(PricingEngineInterface<?, ?> originalEngine, Class<A> argumentsType, Class<R> resultsType, Payoff payoff) {
		super(new ForwardOptionArguments(), new OptionResults());

		if(originalEngine == null)							throw new ConfigurationException("ForwardEngine: null engine or wrong engine type.");
		if(argumentsType == null || resultsType == null)	throw new ConfigurationException("ForwardEngine: arguments and results types of the original engine are required.");
		if(payoff == null)									throw new ConfigurationException("ForwardEngine: null payoff given.");

		Object engineArguments	= originalEngine.getArguments();
		Object engineResults	= originalEngine.getResults();
		if(!argumentsType.isInstance(engineArguments)) {
			throw new ConfigurationException("ForwardEngine: wrong engine type, arguments " + (engineArguments == null ? "null" : engineArguments.getClass().getName()) + " are not of type " + argumentsType.getName() + ".");
		}
		if(!resultsType.isInstance(engineResults)) {
			throw new ConfigurationException("ForwardEngine: wrong engine type, results " + (engineResults == null ? "null" : engineResults.getClass().getName()) + " are not of type " + resultsType.getName() + ".");
		}

		this.originalEngine		= originalEngine;
		this.originalArguments	= argumentsType.cast(engineArguments);
		this.originalResults	= resultsType.cast(engineResults);
		this.payoff				= payoff;
	}

	/**
	 * Create a forward engine for a forward starting performance option.
	 *
	 * @param originalEngine The vanilla option engine.
	 * @param argumentsType The expected arguments type of the vanilla engine.
	 * @param resultsType The expected results type of the vanilla engine.
	 * @param <A> The arguments type of the original engine.
	 * @param <R> The results type of the original engine.
	 * @return The forward performance engine.
	 */
	public static <A extends VanillaOptionArguments, R extends VanillaOptionResults> ForwardEngine<A, R> forwardPerformance(PricingEngineInterface<?, ?> originalEngine, Class<A> argumentsType, Class<R> resultsType) {
		return new ForwardEngine<A, R>(originalEngine, argumentsType, resultsType, Payoff.PERFORMANCE);
	}

	private static Payoff getPayoff(Map<String, ?> properties) {
		if(properties == null || !properties.containsKey("payoff")) return Payoff.FORWARD;
		Object payoff = properties.get("payoff");
		if(payoff == null) throw new ConfigurationException("ForwardEngine: null payoff given.");
		try {
			return Payoff.valueOf(payoff.toString().toUpperCase());
		}
		catch(IllegalArgumentException e) {
			throw new ConfigurationException("ForwardEngine: unknown payoff " + properties.get("payoff") + ".", e);
		}
	}

	/**
	 * Discards previous results, validates the forward option arguments and calculates the results.
	 * If the calculation fails the results remain <code>NaN</code>.
	 * For the forward payoff the original engine is reset first. The performance payoff does not
	 * reset the original engine, since all arguments the original engine reads are overwritten.
	 *
	 * @throws CalculationException Thrown if the original engine fails.
	 */
	@Override
	public void calculate() throws CalculationException {
		results.reset();
		arguments.validate();

		if(payoff == Payoff.FORWARD) originalEngine.reset();
		setOriginalArguments();
		originalEngine.calculate();
		getOriginalResults();

		log.debug("Calculated {} option with reset date {} and moneyness {}: value={}", payoff, arguments.getResetDate(), arguments.getMoneyness(), results.getValue());
	}

	/**
	 * Sets the arguments of the original engine to the vanilla option equivalent to the forward
	 * option as seen from the reset date and validates them.
	 *
	 * The volatility is replaced by the volatility implied at the reset date. This is fine if the
	 * volatility is at most time dependent; it is wrong if it depends on the asset level, in which
	 * case a stochastic or local volatility model would be required.
	 */
	public void setOriginalArguments() {
		LocalDate resetDate = arguments.getResetDate();

		originalArguments.setType(arguments.getType());
		// The underlying is kept at spot (not the forward), the implied curves carry the forward start
		originalArguments.setUnderlying(arguments.getUnderlying());
		originalArguments.setStrike(arguments.getMoneyness() * arguments.getUnderlying());
		try {
			originalArguments.setDividendCurve(new ImpliedTermStructure(arguments.getDividendCurve(), resetDate, resetDate));
			originalArguments.setRiskFreeCurve(new ImpliedTermStructure(arguments.getRiskFreeCurve(), resetDate, resetDate));
			originalArguments.setVolatility(new ImpliedVolTermStructure(arguments.getVolatility(), resetDate));
		}
		catch(IllegalArgumentException e) {
			throw new ConfigurationException("ForwardEngine: market data not consistent with reset date " + resetDate + ".", e);
		}
		originalArguments.setExerciseType(arguments.getExerciseType());
		originalArguments.setStoppingTimes(arguments.getStoppingTimes());
		originalArguments.setMaturity(arguments.getMaturity());

		originalArguments.validate();
	}

	/**
	 * Transforms the results of the original engine to the results of the forward option.
	 *
	 * Gamma is set to zero (and for the performance payoff also delta): the second order
	 * contribution through the strike reset is not calculated.
	 */
	public void getOriginalResults() {
		LocalDate resetDate = arguments.getResetDate();
		double resetTime = arguments.getResetTime();

		switch(payoff) {
		case FORWARD:
		{
			TermStructureInterface dividendCurve = arguments.getDividendCurve();
			double discountDividend = dividendCurve.getDiscountFactor(resetDate);

			results.setValue(discountDividend * originalResults.getValue());
			// chain rule: the strike depends on the underlying
			results.setDelta(discountDividend * (originalResults.getDelta() + arguments.getMoneyness() * originalResults.getStrikeSensitivity()));
			results.setGamma(0.0);
			results.setTheta(dividendCurve.getZeroRate(resetDate) * results.getValue());
			results.setVega(discountDividend * originalResults.getVega());
			results.setRho(discountDividend * originalResults.getRho());
			results.setDividendRho(-resetTime * results.getValue() + discountDividend * originalResults.getDividendRho());
			break;
		}
		case PERFORMANCE:
		{
			TermStructureInterface riskFreeCurve = arguments.getRiskFreeCurve();
			// performance option: value per unit of underlying
			double discountRiskFree = riskFreeCurve.getDiscountFactor(resetDate) / arguments.getUnderlying();

			results.setValue(discountRiskFree * originalResults.getValue());
			results.setDelta(0.0);
			results.setGamma(0.0);
			results.setTheta(riskFreeCurve.getZeroRate(resetDate) * results.getValue());
			results.setVega(discountRiskFree * originalResults.getVega());
			results.setRho(-resetTime * results.getValue() + discountRiskFree * originalResults.getRho());
			results.setDividendRho(discountRiskFree * originalResults.getDividendRho());
			break;
		}
		default:
			throw new IllegalArgumentException("Payoff " + payoff + " not supported.");
		}
	}

	public Payoff getPayoff() {
		return payoff;
	}

	public PricingEngineInterface<?, ?> getOriginalEngine() {
		return originalEngine;
	}
}
