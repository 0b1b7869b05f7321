package com.earthfile.frontend.loader.semantic;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.earthfile.frontend.builder.BuildContext;
import com.earthfile.frontend.builder.RecordingGraphBuilder;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ArgExpanderTest {
    private RecordingGraphBuilder builder;
    private ArgExpander expander;

    @BeforeEach
    void setUp() throws Exception {
        builder = new RecordingGraphBuilder();
        builder.env(BuildContext.background(), "NAME", "world");
        expander = new ArgExpander(builder);
    }

    @Test
    void expandsVariablesInBothModes() {
        assertEquals("hello-world", expander.literal("hello-$NAME"));
        assertEquals("./world+build", expander.reference("./$NAME+build"));
        assertEquals(List.of("a", "world"), expander.literal(List.of("a", "$NAME")));
    }

    @Test
    void referenceModeKeepsEscapedMarker() {
        assertEquals("./dir\\+x+build", expander.reference("./dir\\+x+build"));
        assertEquals("+build", expander.reference("+build"));
    }

    @Test
    void literalModeRemovesMarkerEscape() {
        assertEquals("./dir+x+build", expander.literal("./dir\\+x+build"));
        assertEquals("a+b", expander.literal("a+b"));
    }

    @Test
    void emptyWordsStayEmpty() {
        assertEquals("", expander.literal(""));
        assertEquals("", expander.reference(""));
    }

    @Test
    void escapeHelpersOnlyTouchEscapedMarkers() {
        assertEquals("a\\\\+b+c", ArgExpander.escapeMarker("a\\+b+c"));
        assertEquals("a+b+c", ArgExpander.unescapeMarker("a\\+b+c"));
        assertEquals("a\\b", ArgExpander.unescapeMarker("a\\b"));
    }

    @Test
    void alreadyDoubledEscapeCollapsesToEscapedMarker() {
        // An input \\+ cannot be told apart from an escaped marker once expanded.
        assertEquals("a\\+b", expander.reference("a\\\\+b"));
        assertEquals("a+b", expander.literal("a\\\\+b"));
    }
}
