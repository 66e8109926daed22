package work.lcod.form.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

public record FormMetadata(
    String specVersion,
    Optional<RunMode> runMode,
    List<String> roles,
    Map<String, String> roleInstructions,
    HarnessLimits harnessLimits
) {
    public static final String DEFAULT_SPEC_VERSION = "MF/0.1";
    public static final FormMetadata DEFAULTS = new FormMetadata(
        DEFAULT_SPEC_VERSION, Optional.empty(), Roles.DEFAULTS, Map.of(), HarnessLimits.NONE
    );

    public FormMetadata {
        specVersion = specVersion == null || specVersion.isBlank() ? DEFAULT_SPEC_VERSION : specVersion;
        Objects.requireNonNull(runMode, "runMode");
        roles = roles == null || roles.isEmpty() ? Roles.DEFAULTS : List.copyOf(roles);
        roleInstructions = roleInstructions == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(roleInstructions));
        harnessLimits = harnessLimits == null ? HarnessLimits.NONE : harnessLimits;
    }
}
