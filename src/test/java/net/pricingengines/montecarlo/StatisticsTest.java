package net.pricingengines.montecarlo;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class StatisticsTest {

    @Test
    public void testMeanAndErrorEstimate() {
        Statistics statistics = new Statistics();
        for(double value : new double[] { 1.0, 2.0, 3.0, 4.0 }) {
            statistics.add(value);
        }

        assertEquals(4, statistics.getSamples());
        assertEquals(2.5, statistics.getMean(), 1e-15);
        assertEquals(5.0 / 3.0, statistics.getVariance(), 1e-15);
        assertEquals(Math.sqrt(5.0 / 3.0) / 2.0, statistics.getErrorEstimate(), 1e-15);
        assertEquals(1.0, statistics.getMin(), 0.0);
        assertEquals(4.0, statistics.getMax(), 0.0);
    }

    @Test
    public void testThatErrorEstimateRequiresTwoSamples() {
        Statistics statistics = new Statistics();
        statistics.add(1.0);

        assertTrue(Double.isNaN(statistics.getErrorEstimate()));

        statistics.reset();
        assertEquals(0, statistics.getSamples());
        assertTrue(Double.isNaN(statistics.getMean()));
    }
}
