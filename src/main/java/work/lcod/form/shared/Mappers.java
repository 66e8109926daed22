package work.lcod.form.shared;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;

/**
 * Shared Jackson mappers. Mappers are thread-safe once configured.
 */
public final class Mappers {
    public static final ObjectMapper JSON = new ObjectMapper();
    public static final ObjectWriter JSON_PRETTY = JSON.writerWithDefaultPrettyPrinter();
    public static final ObjectMapper YAML = new ObjectMapper(
        new YAMLFactory()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
    );

    private Mappers() {}
}
