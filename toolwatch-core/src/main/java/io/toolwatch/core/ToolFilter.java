package io.toolwatch.core;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Predicate over tool metadata used by alert rules. Unset criteria match everything.
 *
 * <p>Name patterns are case-insensitive regular expressions; a tool passes when any pattern is found in its name.
 */
public record ToolFilter(
        Set<Integer> priorityLevels,
        Set<String> categories,
        Boolean openSource,
        List<Pattern> namePatterns
) {
    private static final ToolFilter ANY = new ToolFilter(Set.of(), Set.of(), null, List.of());

    public ToolFilter {
        priorityLevels = priorityLevels == null ? Set.of() : Set.copyOf(priorityLevels);
        categories = categories == null ? Set.of() : Set.copyOf(categories);
        namePatterns = namePatterns == null ? List.of() : List.copyOf(namePatterns);
    }

    public static ToolFilter any() {
        return ANY;
    }

    public static ToolFilter priorityLevels(Integer... levels) {
        return new ToolFilter(Set.of(levels), Set.of(), null, List.of());
    }

    public static ToolFilter of(Set<Integer> priorityLevels, Set<String> categories, Boolean openSource,
                                List<String> namePatterns) {
        List<Pattern> compiled = namePatterns == null ? List.of() : namePatterns.stream()
                .map(p -> Pattern.compile(p, Pattern.CASE_INSENSITIVE))
                .toList();
        return new ToolFilter(priorityLevels, categories, openSource, compiled);
    }

    public boolean matches(ToolInfo tool) {
        if (!categories.isEmpty() && (tool.category() == null || !categories.contains(tool.category()))) {
            return false;
        }
        if (!priorityLevels.isEmpty() && !priorityLevels.contains(tool.priorityLevel())) {
            return false;
        }
        if (openSource != null && openSource != tool.openSource()) {
            return false;
        }
        if (!namePatterns.isEmpty()) {
            return namePatterns.stream().anyMatch(p -> p.matcher(tool.name()).find());
        }
        return true;
    }
}
