package work.lcod.empaths.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalLong;
import org.junit.jupiter.api.Test;
import work.lcod.empaths.support.Fixtures;

class ValuesTest {
    @Test
    void classifiesScalars() {
        assertTrue(Values.of(null).isAbsent());
        assertInstanceOf(Value.Bool.class, Values.of(true));
        assertInstanceOf(Value.Text.class, Values.of("x"));
        assertInstanceOf(Value.Int.class, Values.of((byte) 1));
        assertInstanceOf(Value.Int.class, Values.of(1L));
        assertInstanceOf(Value.Int.class, Values.of(BigInteger.TEN));
        assertInstanceOf(Value.Real.class, Values.of(1.5f));
        assertInstanceOf(Value.Real.class, Values.of(BigDecimal.ONE));
    }

    @Test
    void classifiesContainers() {
        assertInstanceOf(Value.Indexed.class, Values.of(List.of()));
        assertInstanceOf(Value.Indexed.class, Values.of(new long[0]));
        assertInstanceOf(Value.Keyed.class, Values.of(Map.of()));
        assertInstanceOf(Value.Indirect.class, Values.of(Optional.empty()));
        assertInstanceOf(Value.Indirect.class, Values.of(OptionalLong.of(1)));
        assertInstanceOf(Value.Struct.class, Values.of(Fixtures.alice()));
        assertInstanceOf(Value.Struct.class, Values.of('c'));
    }

    @Test
    void extractionHandsBackTheOriginalObject() {
        var alice = Fixtures.alice();
        assertSame(alice, ValueExtractor.extract(Values.of(alice)));
        assertSame(alice.tags(), ValueExtractor.extract(Values.of(alice.tags())));
        assertEquals(12L, ValueExtractor.extract(Values.of(12L)));
    }

    @Test
    void extractionUnwrapsIndirections() {
        assertEquals("x", ValueExtractor.extract(Values.of(Optional.of(Optional.of("x")))));
        assertEquals(2.5, ValueExtractor.extract(Values.of(OptionalDouble.of(2.5))));
        assertNull(ValueExtractor.extract(Values.of(OptionalDouble.empty())));
        assertNull(ValueExtractor.extract(Value.ABSENT));
        assertNull(ValueExtractor.extract(null));
    }
}
