package app.ttable.core.card.service;

import app.ttable.core.reference.api.ReferenceDataProvider;
import app.ttable.core.reference.api.ReferenceDataProvider.GroupRef;
import org.springframework.stereotype.Component;

import java.util.*;

// Названия групп -> активные группы корпуса
@Component
public class GroupResolver {

    public record Resolution(List<GroupRef> resolved, List<String> missing) {
    }

    private final ReferenceDataProvider referenceDataProvider;

    public GroupResolver(ReferenceDataProvider referenceDataProvider) {
        this.referenceDataProvider = referenceDataProvider;
    }

    public Resolution resolve(long buildingId, Collection<String> groupNames) {
        if (groupNames == null || groupNames.isEmpty()) {
            return new Resolution(List.of(), List.of());
        }

        Map<String, GroupRef> byName = new HashMap<>();
        for (GroupRef group : referenceDataProvider.activeGroups(buildingId)) {
            byName.putIfAbsent(normalize(group.name()), group);
        }

        List<GroupRef> resolved = new ArrayList<>();
        List<String> missing = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        for (String raw : groupNames) {
            if (raw == null || raw.isBlank()) {
                continue;
            }
            String name = raw.trim();
            String key = normalize(name);
            if (!seen.add(key)) {
                continue;
            }
            GroupRef group = byName.get(key);
            if (group == null) {
                missing.add(name);
            } else {
                resolved.add(group);
            }
        }
        return new Resolution(resolved, missing);
    }

    // "ис-21 " и "ИС-21" одна и та же группа
    static String normalize(String name) {
        return name.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }
}
