/*
 * (c) Copyright Christian P. Fries, Germany. All rights reserved. Contact: email@christian-fries.de.
 *
 * Created on 15.03.2024
 */
package net.pricingengines.marketdata.curves;

import java.time.LocalDate;

/**
 * The term structure implied by a given term structure as seen from a later date.
 *
 * The implied curve has reference date <code>referenceDate</code> and discount factors
 * <i>df(t) = P(t<sub>0</sub> + t) / P(t<sub>0</sub>)</i>, where <i>P</i> is the original curve
 * and <i>t<sub>0</sub></i> is the time of <code>referenceDate</code> on the original curve.
 * The day count convention is the one of the original curve.
 */
public class ImpliedTermStructure extends AbstractTermStructure {

	private final TermStructureInterface	originalCurve;
	private final LocalDate					todaysDate;
	private final double					originalTimeOfReferenceDate;

	/**
	 * @param originalCurve The curve from which the implied curve is derived.
	 * @param todaysDate The evaluation date, not after the reference date.
	 * @param referenceDate The new reference date, not before the reference date of the original curve.
	 */
	public ImpliedTermStructure(TermStructureInterface originalCurve, LocalDate todaysDate, LocalDate referenceDate) {
		super(referenceDate, originalCurve.getDayCountConvention());
		if(todaysDate == null)				throw new IllegalArgumentException("Todays date must not be null.");
		if(todaysDate.isAfter(referenceDate))	throw new IllegalArgumentException("Todays date " + todaysDate + " after reference date " + referenceDate + ".");

		this.originalCurve	= originalCurve;
		this.todaysDate		= todaysDate;
		this.originalTimeOfReferenceDate = originalCurve.getTimeFromReferenceDate(referenceDate);

		if(originalTimeOfReferenceDate < 0) throw new IllegalArgumentException("Reference date " + referenceDate + " before reference date of original curve " + originalCurve.getReferenceDate() + ".");
	}

	@Override
	public double getDiscountFactor(double time) {
		return originalCurve.getDiscountFactor(originalTimeOfReferenceDate + time) / originalCurve.getDiscountFactor(originalTimeOfReferenceDate);
	}

	public TermStructureInterface getOriginalCurve() {
		return originalCurve;
	}

	public LocalDate getTodaysDate() {
		return todaysDate;
	}
}
