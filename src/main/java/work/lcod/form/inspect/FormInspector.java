package work.lcod.form.inspect;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.form.model.AnswerState;
import work.lcod.form.model.Field;
import work.lcod.form.model.FieldKind;
import work.lcod.form.model.FieldPriority;
import work.lcod.form.model.FieldResponse;
import work.lcod.form.model.FormDocument;
import work.lcod.form.model.FormSchema;

/**
 * Validates responses and derives summaries, form state and the prioritized issue list. Reads only
 * the typed model, so repeated calls on one document give equal results.
 */
public final class FormInspector {
    private static final Logger log = LoggerFactory.getLogger(FormInspector.class);

    private FormInspector() {}

    /** Sort order of issues: priority, severity, declaration order, then ref. */
    public static Comparator<Issue> issueOrder(FormSchema schema) {
        return Comparator.comparingInt(Issue::priority)
            .thenComparing(Issue::severity)
            .thenComparingInt(issue -> schema.declarationIndex(issue.ref()))
            .thenComparing(Issue::ref);
    }

    public static InspectResult inspect(FormDocument document) {
        return inspect(document, InspectOptions.DEFAULTS);
    }

    public static InspectResult inspect(FormDocument document, InspectOptions options) {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(options, "options");
        FormSchema schema = document.schema();
        var progress = new LinkedHashMap<String, FieldProgress>();
        var issues = new ArrayList<Issue>();
        String openGate = null;
        for (Field field : schema.fields()) {
            FieldResponse response = document.response(field.id());
            Evaluation evaluation = evaluate(field, response);
            progress.put(field.id(), evaluation.progress());
            Optional<String> blockedBy = blocker(document, field, openGate);
            evaluation.issue(field, blockedBy).ifPresent(issues::add);
            if (openGate == null && field.kind() == FieldKind.CHECKBOXES && field.constraints().blockingApproval()
                && !evaluation.progress().resolved()) {
                openGate = field.id();
            }
        }
        List<Issue> visible = options.filtersRoles()
            ? IssueFilters.byRole(schema, options.targetRoles()).apply(issues)
            : issues;
        List<Issue> sorted = new ArrayList<>(visible);
        sorted.sort(issueOrder(schema));

        ProgressCounts counts = count(progress.values());
        FormState state = formState(progress.values());
        log.debug("Inspected '{}': state={}, {} issue(s)", schema.id(), state.wireName(), sorted.size());
        return new InspectResult(structure(document), new ProgressSummary(counts, progress), state, sorted);
    }

    /** Whether a response needs no more work on the dependency side: skipped, aborted or filled. */
    static boolean isSettled(FieldResponse response) {
        return response.state() == AnswerState.SKIPPED || response.state() == AnswerState.ABORTED || response.hasContent();
    }

    private static Optional<String> blocker(FormDocument document, Field field, String openGate) {
        if (field.dependsOn().isPresent()) {
            String dependency = field.dependsOn().get();
            if (!isSettled(document.response(dependency))) {
                return Optional.of(dependency);
            }
        }
        return Optional.ofNullable(openGate);
    }

    private static Evaluation evaluate(Field field, FieldResponse response) {
        boolean filled = response.hasContent();
        List<String> violations = filled ? FieldValidator.violations(field, response.value().get()) : List.of();
        Optional<FieldValidator.Shortfall> shortfall = filled && violations.isEmpty()
            ? FieldValidator.shortfall(field, response.value().get())
            : Optional.empty();
        boolean closed = response.state() == AnswerState.SKIPPED || response.state() == AnswerState.ABORTED;
        boolean resolved = closed || (filled && violations.isEmpty() && shortfall.isEmpty());
        var progress = new FieldProgress(field.id(), field.required(), response.state(), filled, violations.isEmpty(), resolved);
        return new Evaluation(progress, closed, violations, shortfall);
    }

    private record Evaluation(
        FieldProgress progress,
        boolean closed,
        List<String> violations,
        Optional<FieldValidator.Shortfall> shortfall
    ) {
        Optional<Issue> issue(Field field, Optional<String> blockedBy) {
            if (closed) {
                return Optional.empty();
            }
            boolean required = field.required();
            Severity severity = required ? Severity.REQUIRED : Severity.RECOMMENDED;
            if (!progress.filled()) {
                if (required) {
                    return Optional.of(new Issue(
                        field.id(),
                        IssueScope.FIELD,
                        IssueReason.MISSING_REQUIRED_VALUE,
                        "Required field '" + field.label() + "' has no value",
                        severity,
                        2,
                        blockedBy
                    ));
                }
                return Optional.of(new Issue(
                    field.id(),
                    IssueScope.FIELD,
                    IssueReason.OPTIONAL_UNANSWERED,
                    "Optional field '" + field.label() + "' is unanswered",
                    severity,
                    field.priority() == FieldPriority.HIGH ? 4 : 5,
                    blockedBy
                ));
            }
            if (!violations.isEmpty()) {
                return Optional.of(new Issue(
                    field.id(),
                    IssueScope.FIELD,
                    IssueReason.INVALID_VALUE_FOR_KIND,
                    "'" + field.label() + "': " + String.join("; ", violations),
                    severity,
                    required ? 1 : 3,
                    blockedBy
                ));
            }
            return shortfall.map(gap -> new Issue(
                field.id(),
                IssueScope.FIELD,
                gap.reason(),
                gap.message(),
                severity,
                required ? 2 : 4,
                blockedBy
            ));
        }
    }

    private static FormState formState(Iterable<FieldProgress> fields) {
        boolean anyField = false;
        boolean requiredOpen = false;
        for (FieldProgress field : fields) {
            if (!field.valid()) {
                return FormState.INVALID;
            }
            anyField = true;
            requiredOpen |= field.required() && !field.resolved();
        }
        if (!anyField) {
            return FormState.EMPTY;
        }
        return requiredOpen ? FormState.INCOMPLETE : FormState.COMPLETE;
    }

    private static ProgressCounts count(Iterable<FieldProgress> fields) {
        int total = 0;
        int required = 0;
        int answered = 0;
        int skipped = 0;
        int aborted = 0;
        int unanswered = 0;
        int filled = 0;
        int valid = 0;
        int resolved = 0;
        for (FieldProgress field : fields) {
            total++;
            required += field.required() ? 1 : 0;
            switch (field.state()) {
                case ANSWERED:
                    answered++;
                    break;
                case SKIPPED:
                    skipped++;
                    break;
                case ABORTED:
                    aborted++;
                    break;
                default:
                    unanswered++;
            }
            filled += field.filled() ? 1 : 0;
            valid += field.filled() && field.valid() ? 1 : 0;
            resolved += field.resolved() ? 1 : 0;
        }
        return new ProgressCounts(total, required, answered, skipped, aborted, unanswered, filled, total - filled, valid, filled - valid, resolved);
    }

    private static StructureSummary structure(FormDocument document) {
        FormSchema schema = document.schema();
        var byKind = new LinkedHashMap<String, Integer>();
        var roles = new LinkedHashSet<String>(document.metadata().roles());
        int required = 0;
        int options = 0;
        int columns = 0;
        for (Field field : schema.fields()) {
            byKind.merge(field.kind().wireName(), 1, Integer::sum);
            roles.add(field.role());
            required += field.required() ? 1 : 0;
            options += field.options().size();
            columns += field.columns().size();
        }
        int groups = (int) schema.groups().stream().filter(group -> !group.implicit() || !group.fields().isEmpty()).count();
        return new StructureSummary(groups, schema.fields().size(), required, options, columns, byKind, List.copyOf(roles));
    }
}
