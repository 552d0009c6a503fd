/*
 * (c) Copyright Christian P. Fries, Germany. All rights reserved. Contact: email@christian-fries.de.
 *
 * Created on 25.03.2024
 */
package net.pricingengines.montecarlo;

/**
 * Evaluates the (discounted) payoff of a product on a single sample path.
 */
public interface PathPricerInterface {

	double getValue(Path path);
}
