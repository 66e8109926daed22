package work.lcod.form.inspect;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Something about a field that still needs attention. Derived from a document, never stored.
 */
public record Issue(
    String ref,
    IssueScope scope,
    IssueReason reason,
    String message,
    Severity severity,
    int priority,
    Optional<String> blockedBy
) {
    public Issue {
        Objects.requireNonNull(ref, "ref");
        Objects.requireNonNull(scope, "scope");
        Objects.requireNonNull(reason, "reason");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(blockedBy, "blockedBy");
        if (priority < 1) {
            throw new IllegalArgumentException("Issue priority starts at 1, got " + priority);
        }
    }

    public boolean isBlocked() {
        return blockedBy.isPresent();
    }

    public Map<String, Object> toSerializableMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("ref", ref);
        map.put("scope", scope.wireName());
        map.put("reason", reason.code());
        map.put("message", message);
        map.put("severity", severity.wireName());
        map.put("priority", priority);
        blockedBy.ifPresent(id -> map.put("blockedBy", id));
        return map;
    }
}
