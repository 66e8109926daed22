package work.lcod.form.plan;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.form.inspect.FieldValidator;
import work.lcod.form.model.AnswerState;
import work.lcod.form.model.Field;
import work.lcod.form.model.FieldGroup;
import work.lcod.form.model.FieldResponse;
import work.lcod.form.model.FormDocument;
import work.lcod.form.model.FormSchema;

/**
 * Splits the remaining work of a document into serial items and parallel batches per order level.
 * Expects a document that already parsed; it does not validate.
 */
public final class ExecutionPlanner {
    private static final Logger log = LoggerFactory.getLogger(ExecutionPlanner.class);

    private ExecutionPlanner() {}

    private record Candidate(
        PlanItem item,
        int declaration,
        Optional<String> parallel,
        boolean serial,
        Set<String> ownFields,
        Set<String> pendingDependencies
    ) {}

    public static ExecutionPlan computeExecutionPlan(FormDocument document) {
        Objects.requireNonNull(document, "document");
        var levels = new TreeMap<Integer, List<Candidate>>();
        for (Candidate candidate : candidates(document)) {
            levels.computeIfAbsent(candidate.item().order(), level -> new ArrayList<>()).add(candidate);
        }
        var looseSerial = new ArrayList<PlanItem>();
        var batches = new ArrayList<ParallelBatch>();
        for (Map.Entry<Integer, List<Candidate>> level : levels.entrySet()) {
            planLevel(level.getKey(), level.getValue(), looseSerial, batches);
        }
        var plan = new ExecutionPlan(new ArrayList<>(levels.keySet()), looseSerial, batches);
        log.debug(
            "Planned '{}': {} level(s), {} serial item(s), {} batch(es)",
            document.schema().id(),
            plan.orderLevels().size(),
            looseSerial.size(),
            batches.size()
        );
        return plan;
    }

    private static List<Candidate> candidates(FormDocument document) {
        FormSchema schema = document.schema();
        var candidates = new ArrayList<Candidate>();
        for (FieldGroup group : schema.groups()) {
            if (group.implicit()) {
                for (Field field : group.fields()) {
                    if (isRemaining(document, field)) {
                        candidates.add(candidate(
                            document,
                            field.id(),
                            PlanItem.ItemType.FIELD,
                            schema.orderOf(field),
                            field.parallel(),
                            field.serial(),
                            List.of(field)
                        ));
                    }
                }
                continue;
            }
            var remaining = new ArrayList<Field>();
            for (Field field : group.fields()) {
                if (isRemaining(document, field)) {
                    remaining.add(field);
                }
            }
            if (!remaining.isEmpty()) {
                candidates.add(candidate(
                    document,
                    group.id(),
                    PlanItem.ItemType.GROUP,
                    group.order().orElse(0),
                    group.parallel(),
                    group.serial() || remaining.stream().anyMatch(Field::serial),
                    remaining
                ));
            }
        }
        return candidates;
    }

    private static Candidate candidate(
        FormDocument document,
        String itemId,
        PlanItem.ItemType type,
        int order,
        Optional<String> parallel,
        boolean serial,
        List<Field> remaining
    ) {
        var ids = new ArrayList<String>();
        var roles = new LinkedHashSet<String>();
        for (Field field : remaining) {
            ids.add(field.id());
            roles.add(field.role());
        }
        var own = new HashSet<>(ids);
        var pending = new LinkedHashSet<String>();
        for (Field field : remaining) {
            field.dependsOn()
                .filter(dependency -> !own.contains(dependency))
                .filter(dependency -> document.response(dependency).state() == AnswerState.UNANSWERED)
                .ifPresent(pending::add);
        }
        Optional<String> role = roles.size() == 1 ? Optional.of(roles.iterator().next()) : Optional.empty();
        int declaration = document.schema().declarationIndex(ids.get(0));
        return new Candidate(new PlanItem(itemId, type, order, role, ids), declaration, parallel, serial, own, pending);
    }

    /** Unanswered fields, plus answered ones whose value still fails validation. */
    private static boolean isRemaining(FormDocument document, Field field) {
        FieldResponse response = document.response(field.id());
        if (response.state() == AnswerState.UNANSWERED) {
            return true;
        }
        return response.state() == AnswerState.ANSWERED
            && response.hasContent()
            && !FieldValidator.violations(field, response.value().get()).isEmpty();
    }

    private static void planLevel(int level, List<Candidate> candidates, List<PlanItem> looseSerial, List<ParallelBatch> batches) {
        Set<Candidate> chained = dependencyChains(candidates);
        var loose = new ArrayList<Candidate>();
        var tagged = new LinkedHashMap<String, List<Candidate>>();
        var byRole = new LinkedHashMap<String, List<Candidate>>();
        for (Candidate candidate : candidates) {
            if (candidate.parallel().isPresent()) {
                tagged.computeIfAbsent(candidate.parallel().get(), tag -> new ArrayList<>()).add(candidate);
            } else if (candidate.serial() || candidate.item().role().isEmpty() || chained.contains(candidate)) {
                loose.add(candidate);
            } else {
                byRole.computeIfAbsent(candidate.item().role().get(), role -> new ArrayList<>()).add(candidate);
            }
        }
        var levelBatches = new ArrayList<Map.Entry<Integer, ParallelBatch>>();
        for (Map.Entry<String, List<Candidate>> entry : tagged.entrySet()) {
            levelBatches.add(Map.entry(entry.getValue().get(0).declaration(), batch(entry.getKey(), level, entry.getValue())));
        }
        if (byRole.size() > 1) {
            for (Map.Entry<String, List<Candidate>> entry : byRole.entrySet()) {
                String batchId = "order-" + level + "-" + entry.getKey();
                levelBatches.add(Map.entry(entry.getValue().get(0).declaration(), batch(batchId, level, entry.getValue())));
            }
        } else {
            byRole.values().forEach(loose::addAll);
        }
        loose.sort(Comparator.comparingInt(Candidate::declaration));
        loose.forEach(candidate -> looseSerial.add(candidate.item()));
        levelBatches.sort(Map.Entry.comparingByKey());
        levelBatches.forEach(entry -> batches.add(entry.getValue()));
    }

    /** Items at this level that depend on, or are depended on by, another pending item here. */
    private static Set<Candidate> dependencyChains(List<Candidate> candidates) {
        var chained = new HashSet<Candidate>();
        for (Candidate dependent : candidates) {
            for (Candidate target : candidates) {
                if (dependent != target && dependent.pendingDependencies().stream().anyMatch(target.ownFields()::contains)) {
                    chained.add(dependent);
                    chained.add(target);
                }
            }
        }
        return chained;
    }

    private static ParallelBatch batch(String batchId, int level, List<Candidate> members) {
        var roles = new LinkedHashSet<String>();
        members.forEach(member -> member.item().role().ifPresent(roles::add));
        Optional<String> role = roles.size() == 1 ? Optional.of(roles.iterator().next()) : Optional.empty();
        return new ParallelBatch(batchId, level, role, members.stream().map(Candidate::item).toList());
    }
}
