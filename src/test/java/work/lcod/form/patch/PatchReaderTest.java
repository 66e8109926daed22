package work.lcod.form.patch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.Test;
import work.lcod.form.support.FormFixtures;

class PatchReaderTest {
    @Test
    void readsBatch() {
        List<Patch> patches = PatchReader.read("""
            [
              {"fieldId": "company", "operation": "set_value", "value": "Acme"},
              {"fieldId": "sources", "operation": "skip", "reason": "none public"},
              {"fieldId": "markets", "operation": "clear"}
            ]
            """);

        assertEquals(3, patches.size());
        assertEquals(PatchOperation.SET_VALUE, patches.get(0).operation());
        assertEquals("Acme", patches.get(0).value().orElseThrow().textValue());
        assertEquals(Optional.of("none public"), patches.get(1).reason());
        assertTrue(patches.get(2).value().isEmpty());
    }

    @ParameterizedTest
    @CsvSource({
        "set_value, SET_VALUE",
        "set-value, SET_VALUE",
        "SET, SET_VALUE",
        "skip_field, SKIP",
        "abort-field, ABORT",
        "clear_field, CLEAR"
    })
    void acceptsOperationSpellings(String spelling, PatchOperation expected) {
        assertEquals(expected, PatchOperation.from(spelling));
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "not json",
        "{\"fieldId\": \"a\", \"operation\": \"clear\"}",
        "[1]",
        "[{\"operation\": \"clear\"}]",
        "[{\"fieldId\": \"a\"}]",
        "[{\"fieldId\": \"a\", \"operation\": \"rename\"}]",
        "[{\"fieldId\": \"a\", \"operation\": \"skip\", \"reason\": 3}]"
    })
    void rejectsMalformedInput(String json) {
        assertThrows(PatchFormatException.class, () -> PatchReader.read(json));
    }

    @Test
    void valueOnSkipIsIgnoredWithWarning() {
        var patches = PatchReader.read("[{\"fieldId\": \"sources\", \"operation\": \"skip\", \"value\": [\"x\"]}]");
        var result = PatchApplier.apply(FormFixtures.load("simple.form.md"), patches);

        assertEquals(ApplyStatus.APPLIED, result.status());
        assertEquals("value ignored by skip", result.warnings().get(0).message());
    }

    @Test
    void serializableMapKeepsWireNames() {
        var map = PatchReader.read("[{\"fieldId\": \"company\", \"operation\": \"set-value\", \"value\": \"Acme\"}]").get(0).toSerializableMap();

        assertEquals(List.of("fieldId", "operation", "value"), List.copyOf(map.keySet()));
        assertEquals("set_value", map.get("operation"));
    }
}
