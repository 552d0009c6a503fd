/*
 * (c) Copyright Christian P. Fries, Germany. All rights reserved. Contact: email@christian-fries.de.
 *
 * Created on 19.03.2024
 */
package net.pricingengines.pricingengines;

import net.pricingengines.exception.CalculationException;

/**
 * A pricing engine: given a filled in arguments record, <code>calculate</code>
 * computes the results record.
 *
 * The arguments and results are mutable storage owned by the engine. Clients fill
 * the arguments returned by {@link #getArguments()} and read the results returned by
 * {@link #getResults()} after a successful call to {@link #calculate()}.
 * Engines are not thread safe.
 *
 * @param <A> The type of the arguments.
 * @param <R> The type of the results.
 */
public interface PricingEngineInterface<A extends ArgumentsInterface, R extends ResultsInterface> {

	A getArguments();

	R getResults();

	/**
	 * Discards the results of a previous calculation.
	 */
	void reset();

	/**
	 * Validates the arguments and calculates the results.
	 *
	 * @throws CalculationException Thrown if the calculation fails.
	 */
	void calculate() throws CalculationException;
}
