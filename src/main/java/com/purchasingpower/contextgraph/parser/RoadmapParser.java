package com.purchasingpower.contextgraph.parser;

import com.purchasingpower.contextgraph.core.Horizon;
import com.purchasingpower.contextgraph.model.artifact.RoadmapItem;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses roadmap markdown into {@link RoadmapItem}s.
 *
 * <p>Recognized structure:
 * <pre>
 * ## Now                      horizon header (Now / Next / Later / Future)
 * ### Item name               item header (### or ####)
 * Body text...                description, until the next header
 * Dependencies: A, B          optional, comma-separated item names
 * </pre>
 *
 * Any other level-1/level-2 header closes the current item and resets the horizon to
 * {@link Horizon#UNKNOWN}.
 */
@Slf4j
@Component
public class RoadmapParser {

    private static final Pattern HORIZON_HEADER =
        Pattern.compile("^##\\s+(Now|Next|Later|Future)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern SECTION_HEADER = Pattern.compile("^#{1,2}\\s+.*");
    private static final Pattern DEPENDENCIES_LINE =
        Pattern.compile("^\\s*(?:[-*•]\\s*)?\\**Dependencies\\**\\s*:\\s*\\**\\s*(.*)$", Pattern.CASE_INSENSITIVE);

    private static final int MAX_ID_SLUG_LENGTH = 50;

    public List<RoadmapItem> parse(String roadmapContent) {
        List<RoadmapItem> items = new ArrayList<>();
        if (roadmapContent == null || roadmapContent.isBlank()) {
            return items;
        }

        Horizon currentHorizon = Horizon.UNKNOWN;
        ItemBuilder current = null;

        for (String line : roadmapContent.split("\\R")) {
            Matcher horizon = HORIZON_HEADER.matcher(line);
            if (horizon.find()) {
                current = flush(current, items);
                currentHorizon = Horizon.fromValue(horizon.group(1));
                continue;
            }

            if (line.startsWith("### ") || line.startsWith("#### ")) {
                flush(current, items);
                String title = line.replaceFirst("^#+", "").strip();
                current = new ItemBuilder(title, currentHorizon);
                continue;
            }

            if (SECTION_HEADER.matcher(line).matches()) {
                current = flush(current, items);
                currentHorizon = Horizon.UNKNOWN;
                continue;
            }

            if (current == null || line.isBlank()) {
                continue;
            }

            Matcher deps = DEPENDENCIES_LINE.matcher(line);
            if (deps.matches()) {
                current.dependencies.addAll(splitNames(deps.group(1)));
            } else {
                current.description.append(line.strip()).append(' ');
            }
        }
        flush(current, items);

        log.debug("Parsed {} roadmap items", items.size());
        return items;
    }

    /**
     * Stable id for a roadmap item name: {@code ri_} + lower-cased name with spaces replaced by
     * underscores, truncated to 50 characters.
     */
    public static String itemId(String name) {
        String slug = name.toLowerCase(Locale.ROOT).replace(' ', '_');
        if (slug.length() > MAX_ID_SLUG_LENGTH) {
            slug = slug.substring(0, MAX_ID_SLUG_LENGTH);
        }
        return "ri_" + slug;
    }

    private ItemBuilder flush(ItemBuilder current, List<RoadmapItem> items) {
        if (current != null && !current.name.isBlank()) {
            items.add(current.build());
        }
        return null;
    }

    private List<String> splitNames(String raw) {
        return Arrays.stream(raw.replace("*", "").split(","))
            .map(String::strip)
            .filter(s -> !s.isEmpty())
            .toList();
    }

    private static final class ItemBuilder {
        private final String name;
        private final Horizon horizon;
        private final StringBuilder description = new StringBuilder();
        private final List<String> dependencies = new ArrayList<>();

        private ItemBuilder(String name, Horizon horizon) {
            this.name = name;
            this.horizon = horizon;
        }

        private RoadmapItem build() {
            return new RoadmapItem(itemId(name), name, description.toString().strip(), horizon, dependencies);
        }
    }
}
