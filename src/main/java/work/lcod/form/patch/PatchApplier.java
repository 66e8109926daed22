package work.lcod.form.patch;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.form.inspect.FormInspector;
import work.lcod.form.inspect.InspectResult;
import work.lcod.form.model.Field;
import work.lcod.form.model.FieldResponse;
import work.lcod.form.model.FieldValue;
import work.lcod.form.model.FormDocument;

/**
 * Applies patch batches atomically. Every patch is checked before any is applied; a single
 * structural problem rejects the whole batch and returns the input document.
 */
public final class PatchApplier {
    private static final Logger log = LoggerFactory.getLogger(PatchApplier.class);

    private PatchApplier() {}

    public static ApplyResult apply(FormDocument document, List<Patch> patches) {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(patches, "patches");
        var rejections = new ArrayList<PatchRejection>();
        var warnings = new ArrayList<PatchWarning>();
        var updates = new LinkedHashMap<String, FieldResponse>();
        for (int index = 0; index < patches.size(); index++) {
            Patch patch = patches.get(index);
            Optional<Field> field = document.schema().field(patch.fieldId());
            if (field.isEmpty()) {
                rejections.add(new PatchRejection(index, patch.fieldId(), "Unknown field '" + patch.fieldId() + "'"));
                continue;
            }
            FieldResponse current = updates.getOrDefault(patch.fieldId(), document.response(patch.fieldId()));
            var notes = new ArrayList<String>();
            try {
                updates.put(patch.fieldId(), respond(field.get(), patch, current, notes));
            } catch (IllegalArgumentException ex) {
                rejections.add(new PatchRejection(index, patch.fieldId(), ex.getMessage()));
                continue;
            }
            for (String note : notes) {
                warnings.add(new PatchWarning(index, patch.fieldId(), note));
            }
        }

        if (!rejections.isEmpty()) {
            log.debug("Rejected batch of {} patch(es) on '{}': {} problem(s)", patches.size(), document.schema().id(), rejections.size());
            return new ApplyResult(ApplyStatus.REJECTED, document, FormInspector.inspect(document), rejections, List.of());
        }

        FormDocument updated = updates.isEmpty() ? document : document.withResponses(updates);
        InspectResult inspection = FormInspector.inspect(updated);
        boolean invalidTouched = updates.keySet().stream()
            .map(fieldId -> inspection.progressSummary().field(fieldId))
            .anyMatch(progress -> !progress.valid());
        ApplyStatus status = invalidTouched ? ApplyStatus.PARTIAL : ApplyStatus.APPLIED;
        log.debug("Applied {} patch(es) on '{}': {}", patches.size(), document.schema().id(), status.wireName());
        return new ApplyResult(status, updated, inspection, List.of(), warnings);
    }

    private static FieldResponse respond(Field field, Patch patch, FieldResponse current, List<String> notes) {
        switch (patch.operation()) {
            case SET_VALUE: {
                FieldValue value = ValueCoercer.coerce(field, patch.value().orElse(null), current, notes);
                return FieldResponse.answered(field, value);
            }
            case SKIP:
                ignoredValue(patch, notes);
                return FieldResponse.skipped(patch.reason().orElse(null));
            case ABORT:
                ignoredValue(patch, notes);
                return FieldResponse.aborted(patch.reason().orElse(null));
            case CLEAR:
                ignoredValue(patch, notes);
                return FieldResponse.unanswered();
            default:
                throw new IllegalArgumentException("Unhandled operation " + patch.operation());
        }
    }

    private static void ignoredValue(Patch patch, List<String> notes) {
        if (patch.value().filter(node -> !node.isNull()).isPresent()) {
            notes.add("value ignored by " + patch.operation().wireName());
        }
    }
}
