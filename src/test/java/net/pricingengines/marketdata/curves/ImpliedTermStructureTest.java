package net.pricingengines.marketdata.curves;

import net.pricingengines.time.DayCountConventionInterface;
import net.pricingengines.time.DayCountConvention_ACT_360;
import org.junit.Test;

import java.time.LocalDate;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;

public class ImpliedTermStructureTest {

    private final LocalDate referenceDate = LocalDate.of(2024, 1, 2);
    private final DayCountConventionInterface dayCountConvention = new DayCountConvention_ACT_360();

    @Test
    public void testThatImpliedCurveOfFlatCurveIsFlat() {
        TermStructureInterface curve = new FlatTermStructure(referenceDate, 0.03, dayCountConvention);
        LocalDate resetDate = referenceDate.plusDays(180);

        ImpliedTermStructure impliedCurve = new ImpliedTermStructure(curve, resetDate, resetDate);

        assertEquals(resetDate, impliedCurve.getReferenceDate());
        assertSame(dayCountConvention, impliedCurve.getDayCountConvention());
        assertEquals(1.0, impliedCurve.getDiscountFactor(0.0), 1e-15);
        for(double time : new double[] { 0.25, 1.0, 5.0 }) {
            assertEquals(Math.exp(-0.03 * time), impliedCurve.getDiscountFactor(time), 1e-12);
            assertEquals(0.03, impliedCurve.getZeroRate(time), 1e-12);
        }
        assertEquals(0.03, impliedCurve.getZeroRate(resetDate), 1e-9);
    }

    @Test
    public void testThatImpliedDiscountFactorIsForwardDiscountFactor() {
        TermStructureInterface curve = new ZeroCurveInterpolated(referenceDate,
                new double[] { 0.5, 1.0, 2.0 }, new double[] { 0.01, 0.02, 0.025 }, dayCountConvention);
        LocalDate resetDate = referenceDate.plusDays(180);

        TermStructureInterface impliedCurve = new ImpliedTermStructure(curve, resetDate, resetDate);

        assertEquals(curve.getDiscountFactor(1.0) / curve.getDiscountFactor(0.5), impliedCurve.getDiscountFactor(0.5), 1e-14);
        assertEquals(curve.getDiscountFactor(2.0) / curve.getDiscountFactor(0.5), impliedCurve.getDiscountFactor(resetDate.plusDays(540)), 1e-14);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testThatReferenceDateBeforeOriginalReferenceDateIsRejected() {
        TermStructureInterface curve = new FlatTermStructure(referenceDate, 0.03, dayCountConvention);

        new ImpliedTermStructure(curve, referenceDate.minusDays(10), referenceDate.minusDays(1));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testThatTodaysDateAfterReferenceDateIsRejected() {
        TermStructureInterface curve = new FlatTermStructure(referenceDate, 0.03, dayCountConvention);

        new ImpliedTermStructure(curve, referenceDate.plusDays(20), referenceDate.plusDays(10));
    }
}
