package net.pricingengines.marketdata.volatilities;

import net.pricingengines.time.DayCountConventionInterface;
import net.pricingengines.time.DayCountConvention_ACT_360;
import org.junit.Test;

import java.time.LocalDate;

import static org.junit.Assert.assertEquals;

public class ImpliedVolTermStructureTest {

    private final LocalDate referenceDate = LocalDate.of(2024, 1, 2);
    private final DayCountConventionInterface dayCountConvention = new DayCountConvention_ACT_360();

    @Test
    public void testThatConstantVolatilityIsUnchanged() {
        BlackVolTermStructureInterface volatility = new BlackConstantVolatility(referenceDate, 0.2, dayCountConvention);

        BlackVolTermStructureInterface impliedVolatility = new ImpliedVolTermStructure(volatility, referenceDate.plusDays(180));

        assertEquals(referenceDate.plusDays(180), impliedVolatility.getReferenceDate());
        assertEquals(0.2, impliedVolatility.getBlackVolatility(1.0, 100.0), 1e-12);
        assertEquals(0.04 * 0.75, impliedVolatility.getBlackVariance(0.75, 80.0), 1e-14);
    }

    @Test
    public void testThatImpliedVarianceIsForwardVariance() {
        BlackVolTermStructureInterface volatility = new BlackVarianceCurve(referenceDate,
                new double[] { 0.5, 1.0 }, new double[] { 0.2, 0.25 }, dayCountConvention);

        BlackVolTermStructureInterface impliedVolatility = new ImpliedVolTermStructure(volatility, referenceDate.plusDays(180));

        double forwardVariance = 0.25 * 0.25 * 1.0 - 0.2 * 0.2 * 0.5;
        assertEquals(forwardVariance, impliedVolatility.getBlackVariance(0.5, 100.0), 1e-14);
        assertEquals(Math.sqrt(forwardVariance / 0.5), impliedVolatility.getBlackVolatility(0.5, 100.0), 1e-12);
    }

    @Test
    public void testVarianceCurveInterpolationAndExtrapolation() {
        BlackVolTermStructureInterface volatility = new BlackVarianceCurve(referenceDate,
                new double[] { 0.5, 1.0 }, new double[] { 0.2, 0.25 }, dayCountConvention);

        assertEquals(0.02 * 0.5, volatility.getBlackVariance(0.25, 100.0), 1e-15);
        assertEquals(0.5 * (0.02 + 0.0625), volatility.getBlackVariance(0.75, 100.0), 1e-15);
        assertEquals(0.25, volatility.getBlackVolatility(3.0, 100.0), 1e-12);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testThatDecreasingVarianceIsRejected() {
        new BlackVarianceCurve(referenceDate, new double[] { 0.5, 1.0 }, new double[] { 0.4, 0.2 }, dayCountConvention);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testThatReferenceDateBeforeOriginalIsRejected() {
        new ImpliedVolTermStructure(new BlackConstantVolatility(referenceDate, 0.2, dayCountConvention), referenceDate.minusDays(1));
    }
}
