package com.purchasingpower.contextgraph.parser;

import com.purchasingpower.contextgraph.core.Horizon;
import com.purchasingpower.contextgraph.model.artifact.RoadmapItem;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RoadmapParser")
class RoadmapParserTest {

    private final RoadmapParser parser = new RoadmapParser();

    @Test
    @DisplayName("Items take the horizon of the header above them")
    void parse_horizons() {
        String roadmap = """
                # Master Roadmap

                ## Now
                ### Checkout v2
                One-page checkout.
                Supports wallets.

                ## Next
                #### Loyalty Points
                Points on every order.
                **Dependencies:** Checkout v2, Customer Profiles

                ## Later
                ### Marketplace
                Third-party sellers.
                """;

        List<RoadmapItem> items = parser.parse(roadmap);

        assertThat(items).extracting(RoadmapItem::name)
                .containsExactly("Checkout v2", "Loyalty Points", "Marketplace");
        assertThat(items).extracting(RoadmapItem::horizon)
                .containsExactly(Horizon.NOW, Horizon.NEXT, Horizon.LATER);
        assertThat(items.get(0).description()).isEqualTo("One-page checkout. Supports wallets.");
        assertThat(items.get(1).dependencies()).containsExactly("Checkout v2", "Customer Profiles");
        assertThat(items.get(1).description()).isEqualTo("Points on every order.");
    }

    @Test
    @DisplayName("A non-horizon section header resets the horizon")
    void parse_otherSectionResetsHorizon() {
        String roadmap = """
                ## Now
                ### Checkout v2
                Fast.
                ## Risks
                ### Vendor lock-in
                Single cloud.
                """;

        List<RoadmapItem> items = parser.parse(roadmap);

        assertThat(items).extracting(RoadmapItem::horizon).containsExactly(Horizon.NOW, Horizon.UNKNOWN);
    }

    @Test
    @DisplayName("Blank or missing content yields no items")
    void parse_blank() {
        assertThat(parser.parse("")).isEmpty();
        assertThat(parser.parse(null)).isEmpty();
        assertThat(parser.parse("Just prose, no headers.")).isEmpty();
    }

    @Test
    @DisplayName("Item ids are ri_ + lower-cased, underscored name cut at 50 characters")
    void itemId_format() {
        assertThat(RoadmapParser.itemId("Search Revamp")).isEqualTo("ri_search_revamp");
        String longName = "A Very Long Roadmap Item Name That Goes On And On Forever";
        assertThat(RoadmapParser.itemId(longName)).isEqualTo("ri_" + longName.toLowerCase().replace(' ', '_').substring(0, 50));
    }
}
