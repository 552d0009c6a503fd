package net.pricingengines.pricers;

import net.pricingengines.exception.CalculationException;
import net.pricingengines.exception.ConfigurationException;
import net.pricingengines.pricingengines.OptionType;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.junit.Test;

import java.util.Collections;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class MonteCarloEuropeanOptionTest {

    private final double underlying = 100.0;
    private final double strike = 100.0;
    private final double dividendYield = 0.02;
    private final double riskFreeRate = 0.05;
    private final double residualTime = 1.0;
    private final double volatility = 0.2;

    @Test
    public void testThatPricersWithSameSeedAreDeterministic() {
        MonteCarloEuropeanOption pricer1 = createPricer(OptionType.CALL, false, 4711);
        MonteCarloEuropeanOption pricer2 = createPricer(OptionType.CALL, false, 4711);

        assertEquals(pricer1.getValueWithSamples(1), pricer2.getValueWithSamples(1), 0.0);
        assertEquals(pricer1.getValueWithSamples(1000), pricer2.getValueWithSamples(1000), 0.0);
    }

    @Test
    public void testThatPricersWithDifferentSeedsDiffer() {
        assertNotEquals(createPricer(OptionType.CALL, false, 1).getValueWithSamples(1000),
                createPricer(OptionType.CALL, false, 2).getValueWithSamples(1000), 0.0);
    }

    @Test
    public void testConvergenceToBlackScholes() {
        for(OptionType type : new OptionType[] { OptionType.CALL, OptionType.PUT }) {
            MonteCarloEuropeanOption pricer = createPricer(type, false, 1234);

            double value = pricer.getValueWithSamples(100000);
            double error = pricer.getErrorEstimate();

            assertEquals(type.toString(), getBlackScholesValue(type), value, 4.0 * error);
        }
    }

    @Test
    public void testThatAntitheticVarianceReducesError() {
        MonteCarloEuropeanOption pricer = createPricer(OptionType.CALL, false, 99);
        MonteCarloEuropeanOption pricerAntithetic = createPricer(OptionType.CALL, true, 99);

        pricer.getValueWithSamples(50000);
        double valueAntithetic = pricerAntithetic.getValueWithSamples(50000);

        assertTrue(pricerAntithetic.getErrorEstimate() < pricer.getErrorEstimate());
        assertEquals(getBlackScholesValue(OptionType.CALL), valueAntithetic, 4.0 * pricerAntithetic.getErrorEstimate());
    }

    @Test
    public void testValueWithTolerance() throws CalculationException {
        MonteCarloEuropeanOption pricer = createPricer(OptionType.CALL, true, 2024);

        double value = pricer.getValue(0.05, 1000000);

        assertTrue(pricer.getErrorEstimate() <= 0.05);
        assertEquals(getBlackScholesValue(OptionType.CALL), value, 0.2);
    }

    @Test(expected = CalculationException.class)
    public void testThatToleranceBeyondMaximumSamplesFails() throws CalculationException {
        createPricer(OptionType.CALL, false, 2024).getValue(1e-6, 1000);
    }

    @Test(expected = ConfigurationException.class)
    public void testThatSamplesCannotBeReduced() {
        MonteCarloEuropeanOption pricer = createPricer(OptionType.CALL, false, 2024);
        pricer.getValueWithSamples(100);

        pricer.getValueWithSamples(50);
    }

    @Test
    public void testMinimumSamplesProperty() throws CalculationException {
        MonteCarloEuropeanOption pricer = new MonteCarloEuropeanOption(OptionType.CALL, underlying, strike, dividendYield,
                riskFreeRate, residualTime, volatility, false, 7, Collections.singletonMap("minimumSamples", 500));

        pricer.getValue(100.0, 10000);

        assertEquals(500, pricer.getMonteCarloModel().getSampleAccumulator().getSamples());
    }

    @Test
    public void testThatMaximumSamplesBoundsFirstBatch() {
        MonteCarloEuropeanOption pricer = createPricer(OptionType.CALL, false, 2024);

        try {
            pricer.getValue(1e-6, 10);
            fail("Expected failure with 10 samples.");
        }
        catch(CalculationException e) {
            assertTrue(pricer.getMonteCarloModel().getSampleAccumulator().getSamples() <= 10);
        }
    }

    @Test
    public void testThatToleranceCanBeReachedBelowMinimumSamples() throws CalculationException {
        MonteCarloEuropeanOption pricer = createPricer(OptionType.CALL, false, 2024);

        pricer.getValue(100.0, 50);

        assertEquals(50, pricer.getMonteCarloModel().getSampleAccumulator().getSamples());
    }

    @Test(expected = CalculationException.class)
    public void testThatSingleSampleCannotReachTolerance() throws CalculationException {
        createPricer(OptionType.CALL, false, 2024).getValue(100.0, 1);
    }

    @Test(expected = ConfigurationException.class)
    public void testThatZeroResidualTimeIsRejected() {
        new MonteCarloEuropeanOption(OptionType.CALL, underlying, strike, dividendYield, riskFreeRate, 0.0, volatility, false, 7);
    }

    @Test(expected = ConfigurationException.class)
    public void testThatNegativeStrikeIsRejected() {
        new MonteCarloEuropeanOption(OptionType.CALL, underlying, -1.0, dividendYield, riskFreeRate, residualTime, volatility, false, 7);
    }

    @Test(expected = ConfigurationException.class)
    public void testThatMissingOptionTypeIsRejected() {
        new MonteCarloEuropeanOption(null, underlying, strike, dividendYield, riskFreeRate, residualTime, volatility, false, 7);
    }

    private MonteCarloEuropeanOption createPricer(OptionType type, boolean isAntitheticVariance, long seed) {
        return new MonteCarloEuropeanOption(type, underlying, strike, dividendYield, riskFreeRate, residualTime, volatility, isAntitheticVariance, seed);
    }

    private double getBlackScholesValue(OptionType type) {
        NormalDistribution normal = new NormalDistribution();
        double standardDeviation = volatility * Math.sqrt(residualTime);
        double d1 = (Math.log(underlying / strike) + (riskFreeRate - dividendYield) * residualTime) / standardDeviation + 0.5 * standardDeviation;
        double d2 = d1 - standardDeviation;
        double call = underlying * Math.exp(-dividendYield * residualTime) * normal.cumulativeProbability(d1)
                - strike * Math.exp(-riskFreeRate * residualTime) * normal.cumulativeProbability(d2);
        if(type == OptionType.CALL) return call;
        return call - underlying * Math.exp(-dividendYield * residualTime) + strike * Math.exp(-riskFreeRate * residualTime);
    }
}
