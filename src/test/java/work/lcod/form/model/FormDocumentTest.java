package work.lcod.form.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import work.lcod.form.support.FormFixtures;

class FormDocumentTest {
    private final FormDocument simple = FormFixtures.load("simple.form.md");

    @Test
    void everyFieldHasAResponseInDeclarationOrder() {
        var bare = FormDocument.of(simple.schema(), Map.of());

        assertEquals(List.of("company", "employees", "markets", "sources", "review"), List.copyOf(bare.responses().keySet()));
        assertEquals(FieldResponse.unanswered(), bare.response("sources"));
    }

    @Test
    void rejectsResponsesThatDoNotFitTheSchema() {
        var schema = simple.schema();

        assertThrows(IllegalArgumentException.class, () -> FormDocument.of(schema, Map.of("ghost", FieldResponse.skipped(null))));
        assertThrows(
            IllegalArgumentException.class,
            () -> FormDocument.of(schema, Map.of("employees", FieldResponse.answered(new FieldValue.StringValue("ten"))))
        );
    }

    @Test
    void responseStateAndPayloadAgree() {
        assertThrows(
            IllegalArgumentException.class,
            () -> new FieldResponse(AnswerState.UNANSWERED, Optional.of(new FieldValue.StringValue("x")), Optional.empty())
        );
        assertThrows(
            IllegalArgumentException.class,
            () -> new FieldResponse(AnswerState.UNANSWERED, Optional.empty(), Optional.of("why"))
        );
        assertEquals(Optional.empty(), FieldResponse.skipped("  ").reason());
    }

    @Test
    void withResponsesKeepsSourceAndWithoutSourceDropsIt() {
        var updated = simple.withResponses(Map.of("company", FieldResponse.answered(new FieldValue.StringValue("Acme"))));

        assertTrue(updated.source().isPresent());
        assertEquals(simple.response("employees"), updated.response("employees"));
        assertTrue(updated.withoutSource().source().isEmpty());
    }
}
