package work.lcod.form.inspect;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import work.lcod.form.model.CheckboxMode;
import work.lcod.form.model.CheckboxState;
import work.lcod.form.model.ColumnType;
import work.lcod.form.model.Field;
import work.lcod.form.model.FieldConstraints;
import work.lcod.form.model.FieldKind;
import work.lcod.form.model.FieldOption;
import work.lcod.form.model.FieldValue;
import work.lcod.form.model.TableCell;
import work.lcod.form.model.TableColumn;
import work.lcod.form.model.TableRow;

class FieldValidatorTest {
    private static Field field(FieldKind kind, FieldConstraints constraints) {
        return Field.builder(kind, "f").constraints(constraints).build();
    }

    private static Field withOptions(FieldKind kind, CheckboxMode mode, FieldConstraints constraints) {
        var builder = Field.builder(kind, "f")
            .options(List.of(new FieldOption("a", "A"), new FieldOption("b", "B")))
            .constraints(constraints);
        if (mode != null) {
            builder.checkboxMode(mode);
        }
        return builder.build();
    }

    @Test
    void stringLengthAndPattern() {
        var field = field(FieldKind.STRING, FieldConstraints.builder().minLength(3).maxLength(5).pattern("^[a-z]+$").build());

        assertTrue(FieldValidator.violations(field, new FieldValue.StringValue("abcd")).isEmpty());
        assertEquals(1, FieldValidator.violations(field, new FieldValue.StringValue("ab")).size());
        assertEquals(2, FieldValidator.violations(field, new FieldValue.StringValue("ABCDEFG")).size());
    }

    @Test
    void numberBoundsAndIntegrality() {
        var field = field(FieldKind.NUMBER, FieldConstraints.builder().min(1.0).max(10.0).integer(true).build());

        assertTrue(FieldValidator.violations(field, new FieldValue.NumberValue(10)).isEmpty());
        assertEquals(List.of("must be an integer, got 2.5"), FieldValidator.violations(field, new FieldValue.NumberValue(2.5)));
        assertEquals(List.of("must be at most 10, got 11"), FieldValidator.violations(field, new FieldValue.NumberValue(11)));
    }

    @Test
    void listCountsAndUniqueness() {
        var field = field(FieldKind.STRING_LIST, FieldConstraints.builder().minItems(2).maxItems(3).uniqueItems(true).build());

        assertEquals(1, FieldValidator.violations(field, new FieldValue.StringListValue(List.of("x", "x"))).size());
        assertEquals(1, FieldValidator.violations(field, new FieldValue.StringListValue(List.of("a", "b", "c", "d"))).size());
        var shortfall = FieldValidator.shortfall(field, new FieldValue.StringListValue(List.of("a")));
        assertEquals(IssueReason.MIN_ITEMS_NOT_MET, shortfall.orElseThrow().reason());
        assertEquals(Optional.empty(), FieldValidator.shortfall(field, new FieldValue.StringListValue(List.of("a", "b"))));
    }

    @Test
    void urlsMustBeHttpWithHost() {
        assertTrue(FieldValidator.isUrl("https://example.com/path?q=1"));
        assertTrue(FieldValidator.isUrl("http://localhost:8080"));
        assertFalse(FieldValidator.isUrl("ftp://example.com"));
        assertFalse(FieldValidator.isUrl("https://"));
        assertFalse(FieldValidator.isUrl("not a url"));

        var list = field(FieldKind.URL_LIST, FieldConstraints.NONE);
        assertEquals(
            List.of("'mailto:x@example.com' is not an http(s) URL"),
            FieldValidator.violations(list, new FieldValue.UrlListValue(List.of("https://ok.example", "mailto:x@example.com")))
        );
    }

    @Test
    void dateAndYearBounds() {
        var date = field(FieldKind.DATE, FieldConstraints.builder().minDate(LocalDate.of(2020, 1, 1)).build());
        assertEquals(1, FieldValidator.violations(date, new FieldValue.DateValue(LocalDate.of(2019, 12, 31))).size());
        assertTrue(FieldValidator.violations(date, new FieldValue.DateValue(LocalDate.of(2020, 1, 1))).isEmpty());

        var year = field(FieldKind.YEAR, FieldConstraints.builder().min(1900.0).max(2100.0).build());
        assertEquals(List.of("must be 2100 or earlier, got 2200"), FieldValidator.violations(year, new FieldValue.YearValue(2200)));
    }

    @Test
    void selectionsMustBeDeclaredOptions() {
        var single = withOptions(FieldKind.SINGLE_SELECT, null, FieldConstraints.NONE);
        assertEquals(List.of("'z' is not an option"), FieldValidator.violations(single, FieldValue.SingleSelectValue.of("z")));

        var multi = withOptions(FieldKind.MULTI_SELECT, null, FieldConstraints.builder().minSelections(2).maxSelections(2).build());
        assertTrue(FieldValidator.violations(multi, new FieldValue.MultiSelectValue(List.of("a", "b"))).isEmpty());
        assertEquals(
            IssueReason.MIN_ITEMS_NOT_MET,
            FieldValidator.shortfall(multi, new FieldValue.MultiSelectValue(List.of("a"))).orElseThrow().reason()
        );
    }

    @Test
    void checkboxCompletionDependsOnMode() {
        var multi = withOptions(FieldKind.CHECKBOXES, CheckboxMode.MULTI, FieldConstraints.NONE);
        var settled = new FieldValue.CheckboxesValue(Map.of("a", CheckboxState.DONE, "b", CheckboxState.NA));
        assertTrue(FieldValidator.isCheckboxComplete(multi, settled));
        var active = new FieldValue.CheckboxesValue(Map.of("a", CheckboxState.DONE, "b", CheckboxState.ACTIVE));
        assertEquals(IssueReason.CHECKBOX_INCOMPLETE, FieldValidator.shortfall(multi, active).orElseThrow().reason());

        var explicit = withOptions(FieldKind.CHECKBOXES, CheckboxMode.EXPLICIT, FieldConstraints.NONE);
        assertTrue(FieldValidator.isCheckboxComplete(
            explicit,
            new FieldValue.CheckboxesValue(Map.of("a", CheckboxState.YES, "b", CheckboxState.NO))
        ));
        assertEquals(1, FieldValidator.violations(
            explicit,
            new FieldValue.CheckboxesValue(Map.of("a", CheckboxState.DONE, "b", CheckboxState.NO))
        ).size());

        var minDone = withOptions(FieldKind.CHECKBOXES, CheckboxMode.SIMPLE, FieldConstraints.builder().minDone(1).build());
        assertTrue(FieldValidator.isCheckboxComplete(
            minDone,
            new FieldValue.CheckboxesValue(Map.of("a", CheckboxState.DONE, "b", CheckboxState.TODO))
        ));
    }

    @Test
    void tableRowsAndRequiredColumns() {
        var field = Field.builder(FieldKind.TABLE, "t")
            .columns(List.of(
                new TableColumn("name", "Name", ColumnType.STRING, true),
                new TableColumn("site", "Site", ColumnType.URL, false)
            ))
            .constraints(FieldConstraints.builder().minRows(1).maxRows(1).build())
            .build();
        var good = new TableRow(Map.of(
            "name", TableCell.answered(new FieldValue.StringValue("Ann")),
            "site", TableCell.answered(new FieldValue.UrlValue("https://ann.example"))
        ));
        var missingName = new TableRow(Map.of(
            "name", TableCell.empty(),
            "site", TableCell.answered(new FieldValue.UrlValue("nope"))
        ));

        assertTrue(FieldValidator.violations(field, new FieldValue.TableValue(List.of(good))).isEmpty());
        var problems = FieldValidator.violations(field, new FieldValue.TableValue(List.of(good, missingName)));
        assertEquals(
            List.of(
                "at most 1 rows allowed, got 2",
                "row 2 is missing required column 'name'",
                "row 2 column 'site' is not an http(s) URL"
            ),
            problems
        );
        assertEquals(
            IssueReason.MIN_ITEMS_NOT_MET,
            FieldValidator.shortfall(field, new FieldValue.TableValue(List.of())).orElseThrow().reason()
        );
    }
}
