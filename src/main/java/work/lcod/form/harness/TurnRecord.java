package work.lcod.form.harness;

import java.util.LinkedHashMap;
import java.util.Map;
import work.lcod.form.patch.ApplyStatus;

public record TurnRecord(int turn, int issuesShown, int patchesSubmitted, ApplyStatus applyStatus, int remainingIssues) {
    public Map<String, Object> toSerializableMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("turn", turn);
        map.put("issuesShown", issuesShown);
        map.put("patchesSubmitted", patchesSubmitted);
        map.put("applyStatus", applyStatus.wireName());
        map.put("remainingIssues", remainingIssues);
        return map;
    }
}
