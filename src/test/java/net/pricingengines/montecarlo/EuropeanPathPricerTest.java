package net.pricingengines.montecarlo;

import net.pricingengines.pricingengines.OptionType;
import org.junit.Test;

import static org.junit.Assert.assertEquals;

public class EuropeanPathPricerTest {

    private final Path path = new Path(new double[] { 0.5, 1.0 }, new double[] { 0.005, 0.005 }, new double[] { 0.04, 0.06 });

    @Test
    public void testPayoffOnPath() {
        double underlyingAtMaturity = 100.0 * Math.exp(0.11);

        assertEquals(0.9 * (underlyingAtMaturity - 100.0), new EuropeanPathPricer(OptionType.CALL, 100.0, 100.0, 0.9, false).getValue(path), 1e-12);
        assertEquals(0.0, new EuropeanPathPricer(OptionType.PUT, 100.0, 100.0, 0.9, false).getValue(path), 0.0);
        assertEquals(0.9 * (120.0 - underlyingAtMaturity), new EuropeanPathPricer(OptionType.PUT, 100.0, 120.0, 0.9, false).getValue(path), 1e-12);
        assertEquals(0.9 * (120.0 - underlyingAtMaturity), new EuropeanPathPricer(OptionType.STRADDLE, 100.0, 120.0, 0.9, false).getValue(path), 1e-12);
    }

    @Test
    public void testAntitheticPayoffIsAverageWithMirroredPath() {
        double underlyingAtMaturity = 100.0 * Math.exp(0.11);
        double underlyingAtMaturityMirrored = 100.0 * Math.exp(-0.09);

        assertEquals(0.5 * 0.9 * (underlyingAtMaturity - 100.0), new EuropeanPathPricer(OptionType.CALL, 100.0, 100.0, 0.9, true).getValue(path), 1e-12);
        assertEquals(0.5 * 0.9 * ((underlyingAtMaturity - 100.0) + (100.0 - underlyingAtMaturityMirrored)),
                new EuropeanPathPricer(OptionType.STRADDLE, 100.0, 100.0, 0.9, true).getValue(path), 1e-12);
    }
}
