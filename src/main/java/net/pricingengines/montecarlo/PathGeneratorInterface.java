/*
 * (c) Copyright Christian P. Fries, Germany. All rights reserved. Contact: email@christian-fries.de.
 *
 * Created on 25.03.2024
 */
package net.pricingengines.montecarlo;

/**
 * Generator of sample paths. Each call to <code>next</code> returns a new, independent path.
 */
public interface PathGeneratorInterface {

	Path next();
}
