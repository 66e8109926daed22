package work.lcod.form.api;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import work.lcod.form.harness.FillHarness;
import work.lcod.form.harness.FillResult;
import work.lcod.form.harness.FormAgent;
import work.lcod.form.harness.HarnessConfig;
import work.lcod.form.inspect.FormInspector;
import work.lcod.form.inspect.InspectOptions;
import work.lcod.form.inspect.InspectResult;
import work.lcod.form.model.FormDocument;
import work.lcod.form.parse.FormParser;
import work.lcod.form.patch.ApplyResult;
import work.lcod.form.patch.Patch;
import work.lcod.form.patch.PatchApplier;
import work.lcod.form.patch.PatchReader;
import work.lcod.form.plan.ExecutionPlan;
import work.lcod.form.plan.ExecutionPlanner;
import work.lcod.form.serialize.FormSerializer;
import work.lcod.form.serialize.JsonSchemaExporter;
import work.lcod.form.serialize.MarkdownExporter;
import work.lcod.form.serialize.SerializeOptions;
import work.lcod.form.serialize.ValuesExporter;

/**
 * Public entry point for embedding the form engine. Every operation is a pure function of its
 * inputs; documents are never mutated.
 */
public final class FormEngine {
    private FormEngine() {}

    public static FormDocument parse(String text) {
        return FormParser.parse(text);
    }

    public static FormDocument load(Path path) throws IOException {
        return parse(Files.readString(path, StandardCharsets.UTF_8));
    }

    public static String serialize(FormDocument document) {
        return FormSerializer.serialize(document);
    }

    public static String serialize(FormDocument document, SerializeOptions options) {
        return FormSerializer.serialize(document, options);
    }

    public static InspectResult inspect(FormDocument document) {
        return FormInspector.inspect(document);
    }

    public static InspectResult inspect(FormDocument document, InspectOptions options) {
        return FormInspector.inspect(document, options);
    }

    public static ApplyResult applyPatches(FormDocument document, List<Patch> patches) {
        return PatchApplier.apply(document, patches);
    }

    /** Reads a JSON array of patches and applies it as one batch. */
    public static ApplyResult applyPatches(FormDocument document, String patchesJson) {
        return PatchApplier.apply(document, PatchReader.read(patchesJson));
    }

    public static ExecutionPlan computeExecutionPlan(FormDocument document) {
        return ExecutionPlanner.computeExecutionPlan(document);
    }

    public static String exportMarkdown(FormDocument document) {
        return MarkdownExporter.export(document);
    }

    public static String exportJsonSchema(FormDocument document) {
        return JsonSchemaExporter.export(document);
    }

    public static String exportValues(FormDocument document) {
        return ValuesExporter.toJson(document);
    }

    /** Runs the fill loop; limits declared in the form's frontmatter override {@code config}. */
    public static FillResult fill(FormDocument document, FormAgent agent, HarnessConfig config) {
        return FillHarness.run(document, agent, config.withFormLimits(document.metadata().harnessLimits()));
    }
}
