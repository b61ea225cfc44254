package org.gamevibe.compiler.frontend;

import org.gamevibe.compiler.frontend.semantics.NameSuggestions;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for {@link NameSuggestions}.
 */
public class NameSuggestionsTest {

    /**
     * Verifies that candidates are ordered by distance and that far or identical names are excluded.
     */
    @Test
    @Tag("unit")
    void testClosestCandidates() {
        // Act
        List<String> suggestions = NameSuggestions.closest("Playr",
                List.of("Enemy", "Players", "Player", "Playr", "Layer"));

        // Assert
        assertThat(suggestions).containsExactly("Player", "Players", "Layer");
    }

    /**
     * Verifies that comparison ignores case.
     */
    @Test
    @Tag("unit")
    void testCaseInsensitive() {
        // Act & Assert
        assertThat(NameSuggestions.closest("player", List.of("PLAYER", "Boss"))).containsExactly("PLAYER");
        assertThat(NameSuggestions.closest("x", List.of())).isEmpty();
    }
}
