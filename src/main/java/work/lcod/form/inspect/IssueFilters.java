package work.lcod.form.inspect;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import work.lcod.form.model.Field;
import work.lcod.form.model.FieldGroup;
import work.lcod.form.model.FormSchema;
import work.lcod.form.model.Roles;

/**
 * Stable filter stages over issue lists. None of them reorders what it keeps.
 */
public final class IssueFilters {
    private IssueFilters() {}

    /** Keeps issues whose field role is targeted. No roles, or {@code *}, keeps everything. */
    public static IssueFilter byRole(FormSchema schema, Set<String> targetRoles) {
        if (targetRoles == null || targetRoles.isEmpty() || targetRoles.contains(Roles.WILDCARD)) {
            return issues -> List.copyOf(issues);
        }
        return issues -> issues.stream()
            .filter(issue -> schema.field(issue.ref()).map(field -> targetRoles.contains(field.role())).orElse(true))
            .collect(Collectors.toList());
    }

    /** Drops issues still waiting on another field. */
    public static IssueFilter byReadiness() {
        return issues -> issues.stream().filter(issue -> !issue.isBlocked()).collect(Collectors.toList());
    }

    /** Keeps the issues at the lowest order level present in the list. */
    public static IssueFilter byOrderLevel(FormSchema schema) {
        return issues -> {
            Optional<Integer> lowest = issues.stream().map(issue -> level(schema, issue)).min(Integer::compare);
            if (lowest.isEmpty()) {
                return List.of();
            }
            int level = lowest.get();
            return issues.stream().filter(issue -> level(schema, issue) == level).collect(Collectors.toList());
        };
    }

    /** Issues that can be worked on now: ready ones at the lowest open order level. */
    public static IssueFilter filterIssuesByOrder(FormSchema schema) {
        return byReadiness().then(byOrderLevel(schema));
    }

    /**
     * Keeps issues while the distinct fields and groups they touch stay within the caps. A
     * {@code null} cap is unlimited.
     */
    public static IssueFilter byScope(FormSchema schema, Integer maxFields, Integer maxGroups) {
        return issues -> {
            Set<String> fields = new HashSet<>();
            Set<String> groups = new HashSet<>();
            return issues.stream().filter(issue -> {
                String groupId = schema.groupOf(issue.ref()).map(FieldGroup::id).orElse(issue.ref());
                boolean newField = !fields.contains(issue.ref());
                boolean newGroup = !groups.contains(groupId);
                if (newField && maxFields != null && fields.size() >= maxFields) {
                    return false;
                }
                if (newGroup && maxGroups != null && groups.size() >= maxGroups) {
                    return false;
                }
                fields.add(issue.ref());
                groups.add(groupId);
                return true;
            }).collect(Collectors.toList());
        };
    }

    public static IssueFilter byCount(int max) {
        if (max < 0) {
            throw new IllegalArgumentException("Issue count cap must not be negative: " + max);
        }
        return issues -> issues.stream().limit(max).collect(Collectors.toList());
    }

    private static int level(FormSchema schema, Issue issue) {
        Optional<Field> field = schema.field(issue.ref());
        if (field.isPresent()) {
            return schema.orderOf(field.get());
        }
        return schema.group(issue.ref()).flatMap(FieldGroup::order).orElse(0);
    }
}
