package votetally.api.domain;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record TallyResult(
        List<TallyEntry> entries
) {
    public TallyResult {
        entries = List.copyOf(entries);
    }

    public long countFor(String choice) {
        return entries.stream()
                .filter(entry -> entry.choice().equals(choice))
                .mapToLong(TallyEntry::count)
                .sum();
    }

    public long total() {
        return entries.stream().mapToLong(TallyEntry::count).sum();
    }

    public Map<String, Long> asMap() {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (TallyEntry entry : entries) {
            counts.merge(entry.choice(), entry.count(), Long::sum);
        }
        return counts;
    }
}
