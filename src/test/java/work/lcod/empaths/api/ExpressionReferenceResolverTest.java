package work.lcod.empaths.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.empaths.support.Fixtures;

class ExpressionReferenceResolverTest {
    @Test
    void definitionsAreEvaluatedAgainstCurrentData() {
        var resolver = new ExpressionReferenceResolver(Map.of("who", ".name"));
        assertEquals("Alice", resolver.resolve("who", Fixtures.alice()));
        assertEquals("Bob", resolver.resolve("who", Fixtures.bob()));
    }

    @Test
    void definitionsMayReferToEachOther() {
        var resolver = new ExpressionReferenceResolver(Map.of(
            "salutation", "'Dear ' .name",
            "letter", ":salutation ', you are ' .age"
        ));
        assertEquals("Dear Alice, you are 30", Empaths.resolve(":letter", Fixtures.alice(), resolver));
    }

    @Test
    void siblingReferencesAreNotCycles() {
        var resolver = new ExpressionReferenceResolver(Map.of("n", ".name", "both", ":n '/' :n"));
        assertEquals("Alice/Alice", resolver.resolve("both", Fixtures.alice()));
    }

    @Test
    void selfReferenceIsACycle() {
        var resolver = new ExpressionReferenceResolver(Map.of("loop", ":loop"));
        var ex = assertThrows(ReferenceCycleException.class, () -> resolver.resolve("loop", Fixtures.alice()));
        assertEquals(List.of("loop", "loop"), ex.chain());
        assertEquals("Reference cycle: loop -> loop", ex.getMessage());
    }

    @Test
    void mutualReferenceIsACycle() {
        var resolver = new ExpressionReferenceResolver(Map.of("a", "'x' :b", "b", "'y' :a"));
        var ex = assertThrows(ReferenceCycleException.class, () -> Empaths.resolve(":a", null, resolver));
        assertEquals(List.of("a", "b", "a"), ex.chain());
    }

    @Test
    void unknownNamesGoToFallback() {
        var resolver = new ExpressionReferenceResolver(Map.of("who", ".name"), new MapReferenceResolver(Map.of("limit", 18)));
        assertEquals(18, resolver.resolve("limit", Fixtures.alice()));
        assertNull(resolver.resolve("other", Fixtures.alice()));
        assertEquals(true, Empaths.resolve("?:limit=='18'", Fixtures.alice(), resolver));
    }

    @Test
    void unknownNamesWithoutFallbackAreAbsent() {
        assertNull(new ExpressionReferenceResolver(Map.of()).resolve("x", null));
    }
}
