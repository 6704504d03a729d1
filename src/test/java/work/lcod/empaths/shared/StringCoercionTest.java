package work.lcod.empaths.shared;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import org.junit.jupiter.api.Test;

class StringCoercionTest {
    @Test
    void absentIsEmpty() {
        assertEquals("", StringCoercion.toString(null));
    }

    @Test
    void scalarsUseTheirCanonicalForm() {
        assertEquals("hello", StringCoercion.toString("hello"));
        assertEquals("true", StringCoercion.toString(true));
        assertEquals("42", StringCoercion.toString(42));
        assertEquals("-123", StringCoercion.toString(-123L));
        assertEquals("12345678901234567890", StringCoercion.toString(new BigInteger("12345678901234567890")));
    }

    @Test
    void wholeRealsDropTheFraction() {
        assertEquals("30", StringCoercion.toString(30.0));
        assertEquals("100", StringCoercion.toString(100.0));
        assertEquals("30", StringCoercion.toString(new BigDecimal("30.00")));
    }

    @Test
    void realsUseShortestDigitsWithoutExponent() {
        assertEquals("3.14", StringCoercion.toString(3.14));
        assertEquals("0.1", StringCoercion.toString(0.1f));
        assertEquals("1000000000000000000000", StringCoercion.toString(1e21));
        assertEquals("0.0000001", StringCoercion.toString(1e-7));
        assertEquals("30.5", StringCoercion.toString(new BigDecimal("30.50")));
    }

    @Test
    void largeRealsUseShortestRoundTripDigits() {
        assertEquals("100000000000000000000000", StringCoercion.toString(1e23));
        assertEquals("200000000000000000000000", StringCoercion.toString(2e23));
        assertEquals("-231845256772633250", StringCoercion.toString(-2.3184525677263325E17));
        assertEquals("10000000000", StringCoercion.toString(1e10f));
    }

    @Test
    void specialRealsHaveFixedSpellings() {
        assertEquals("NaN", StringCoercion.toString(Double.NaN));
        assertEquals("+Inf", StringCoercion.toString(Double.POSITIVE_INFINITY));
        assertEquals("-Inf", StringCoercion.toString(Float.NEGATIVE_INFINITY));
        assertEquals("-0", StringCoercion.formatDouble(-0.0));
        assertEquals("0", StringCoercion.formatFloat(0f));
    }

    @Test
    void otherObjectsUseToString() {
        assertEquals("[a, b]", StringCoercion.toString(List.of("a", "b")));
        assertEquals("c", StringCoercion.toString('c'));
    }
}
