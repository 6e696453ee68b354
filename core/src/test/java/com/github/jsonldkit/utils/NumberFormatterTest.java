package com.github.jsonldkit.utils;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import org.junit.Test;

public class NumberFormatterTest {

    @Test
    public void formatsIntegralValuesWithoutFraction() {
        assertEquals("1", NumberFormatter.format(1.0));
        assertEquals("-42", NumberFormatter.format(-42.0));
        assertEquals("0", NumberFormatter.format(0.0));
        assertEquals("0", NumberFormatter.format(-0.0));
        assertEquals("123456789012345680000", NumberFormatter.format(123456789012345680000.0));
    }

    @Test
    public void formatsFractions() {
        assertEquals("0.1", NumberFormatter.format(0.1));
        assertEquals("1.5", NumberFormatter.format(1.5));
        assertEquals("0.000001", NumberFormatter.format(0.000001));
        assertEquals("0.30000000000000004", NumberFormatter.format(0.1 + 0.2));
    }

    @Test
    public void switchesToExponentAtBoundaries() {
        assertEquals("1e+21", NumberFormatter.format(1e21));
        assertEquals("1e-7", NumberFormatter.format(1e-7));
        assertEquals("1.5e-7", NumberFormatter.format(1.5e-7));
        assertEquals("5e-324", NumberFormatter.format(Double.MIN_VALUE));
        assertEquals("1.7976931348623157e+308", NumberFormatter.format(Double.MAX_VALUE));
    }

    @Test
    public void rejectsNonFiniteValues() {
        for (final double value : new double[] { Double.NaN, Double.POSITIVE_INFINITY,
                Double.NEGATIVE_INFINITY }) {
            try {
                NumberFormatter.format(value);
                fail("expected " + value + " to be rejected");
            } catch (final IllegalArgumentException e) {
                // expected
            }
        }
    }

    @Test
    public void outputParsesBackToSameDouble() {
        final Random random = new Random(42);
        for (int i = 0; i < 10000; i++) {
            final double value = Double.longBitsToDouble(random.nextLong());
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                continue;
            }
            final String formatted = NumberFormatter.format(value);
            assertEquals(formatted, value, Double.parseDouble(formatted), 0.0);
        }
    }

    @Test
    public void distinctDoublesFormatDistinctly() {
        final Random random = new Random(7);
        final Map<String, Long> seen = new HashMap<String, Long>();
        final List<Double> values = new ArrayList<Double>();
        for (int i = 0; i < 10000; i++) {
            values.add(Double.longBitsToDouble(random.nextLong()));
            // neighbours differ only in the last bit
            values.add(Math.nextUp(1.0 + i));
            values.add(1.0 + i);
        }
        for (final double value : values) {
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                continue;
            }
            // -0.0 and 0.0 both print "0"
            final long bits = Double.doubleToLongBits(value == 0.0 ? 0.0 : value);
            final String formatted = NumberFormatter.format(value);
            final Long previous = seen.put(formatted, bits);
            if (previous != null && previous.longValue() != bits) {
                fail(formatted + " is the output for " + Double.longBitsToDouble(previous)
                        + " and " + value);
            }
        }
    }
}
