/*
 * (c) Copyright Christian P. Fries, Germany. All rights reserved. Contact: email@christian-fries.de.
 *
 * Created on 19.03.2024
 */
package net.pricingengines.pricingengines;

/**
 * Base class for pricing engines holding the arguments and results storage.
 *
 * @param <A> The type of the arguments.
 * @param <R> The type of the results.
 */
public abstract class AbstractPricingEngine<A extends ArgumentsInterface, R extends ResultsInterface> implements PricingEngineInterface<A, R> {

	protected final A arguments;
	protected final R results;

	public AbstractPricingEngine(A arguments, R results) {
		super();
		this.arguments	= arguments;
		this.results	= results;
	}

	@Override
	public A getArguments() {
		return arguments;
	}

	@Override
	public R getResults() {
		return results;
	}

	@Override
	public void reset() {
		results.reset();
	}
}
