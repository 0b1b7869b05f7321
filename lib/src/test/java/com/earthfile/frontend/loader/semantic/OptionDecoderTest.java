package com.earthfile.frontend.loader.semantic;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;

class OptionDecoderTest {
    private static final OptionSpec SPEC =
            OptionSpec.builder("TEST")
                    .flag("push")
                    .string("platform")
                    .list("build-arg")
                    .duration("interval", Duration.ofSeconds(30))
                    .integer("retries", 3)
                    .build();

    @Test
    void defaultsApplyWhenNothingIsGiven() throws Exception {
        DecodedOptions decoded = OptionDecoder.decode(SPEC, List.of("a", "b"));
        assertFalse(decoded.flag("push"));
        assertEquals("", decoded.string("platform"));
        assertEquals(List.of(), decoded.list("build-arg"));
        assertEquals(Duration.ofSeconds(30), decoded.duration("interval"));
        assertEquals(3, decoded.integer("retries"));
        assertEquals(List.of("a", "b"), decoded.positionals());
    }

    @Test
    void singleAndDoubleDashesAreEquivalent() throws Exception {
        DecodedOptions decoded =
                OptionDecoder.decode(SPEC, List.of("-push", "--platform=linux/amd64", "-retries", "5", "img"));
        assertTrue(decoded.flag("push"));
        assertEquals("linux/amd64", decoded.string("platform"));
        assertEquals(5, decoded.integer("retries"));
        assertEquals(1, decoded.positionalCount());
        assertEquals("img", decoded.positional(0));
    }

    @Test
    void listsAccumulateAndOtherOptionsKeepLastValue() throws Exception {
        DecodedOptions decoded =
                OptionDecoder.decode(
                        SPEC,
                        List.of("--build-arg", "A=1", "--platform", "x", "--build-arg=B=2", "--platform", "y"));
        assertEquals(List.of("A=1", "B=2"), decoded.list("build-arg"));
        assertEquals("y", decoded.string("platform"));
        assertEquals(0, decoded.positionalCount());
    }

    @Test
    void decodingStopsAtFirstPositionalOrTerminator() throws Exception {
        DecodedOptions stopped = OptionDecoder.decode(SPEC, List.of("echo", "--push"));
        assertFalse(stopped.flag("push"));
        assertEquals(List.of("echo", "--push"), stopped.positionals());

        DecodedOptions terminated = OptionDecoder.decode(SPEC, List.of("--push", "--", "--platform"));
        assertTrue(terminated.flag("push"));
        assertEquals(List.of("--platform"), terminated.positionals());

        DecodedOptions dash = OptionDecoder.decode(SPEC, List.of("-", "x"));
        assertEquals(List.of("-", "x"), dash.positionals());
    }

    @Test
    void flagsAcceptExplicitBooleans() throws Exception {
        assertFalse(OptionDecoder.decode(SPEC, List.of("--push=false")).flag("push"));
        assertTrue(OptionDecoder.decode(SPEC, List.of("--push=T")).flag("push"));
        OptionDecodeException e =
                assertThrows(OptionDecodeException.class, () -> OptionDecoder.decode(SPEC, List.of("--push=yes")));
        assertEquals(
                "invalid TEST arguments [--push=yes]: invalid boolean value \"yes\" for -push: parse error",
                e.getMessage());
    }

    @Test
    void unknownOptionIsReportedWithAllWords() {
        OptionDecodeException e =
                assertThrows(
                        OptionDecodeException.class, () -> OptionDecoder.decode(SPEC, List.of("--nope", "img")));
        assertEquals("invalid TEST arguments [--nope img]: flag provided but not defined: -nope", e.getMessage());
    }

    @Test
    void helpAndMalformedFlagsAreRejected() {
        OptionDecodeException help =
                assertThrows(OptionDecodeException.class, () -> OptionDecoder.decode(SPEC, List.of("-h")));
        assertEquals("invalid TEST arguments [-h]: flag: help requested", help.getMessage());

        OptionDecodeException syntax =
                assertThrows(OptionDecodeException.class, () -> OptionDecoder.decode(SPEC, List.of("---push")));
        assertEquals("invalid TEST arguments [---push]: bad flag syntax: ---push", syntax.getMessage());
    }

    @Test
    void valueOptionAtEndNeedsAnArgument() {
        OptionDecodeException e =
                assertThrows(OptionDecodeException.class, () -> OptionDecoder.decode(SPEC, List.of("--platform")));
        assertEquals("invalid TEST arguments [--platform]: flag needs an argument: -platform", e.getMessage());
    }

    @Test
    void typedValuesAreValidated() throws Exception {
        assertEquals(
                Duration.ofSeconds(90),
                OptionDecoder.decode(SPEC, List.of("--interval=1m30s")).duration("interval"));
        OptionDecodeException duration =
                assertThrows(
                        OptionDecodeException.class, () -> OptionDecoder.decode(SPEC, List.of("--interval=soon")));
        assertEquals(
                "invalid TEST arguments [--interval=soon]: invalid value \"soon\" for flag -interval: parse error",
                duration.getMessage());
        assertThrows(OptionDecodeException.class, () -> OptionDecoder.decode(SPEC, List.of("--retries", "many")));
    }

    @Test
    void readingUndeclaredOptionIsAProgrammingError() throws Exception {
        DecodedOptions decoded = OptionDecoder.decode(SPEC, List.of());
        assertThrows(IllegalArgumentException.class, () -> decoded.flag("platform"));
        assertThrows(IllegalArgumentException.class, () -> decoded.string("missing"));
        assertThrows(IllegalArgumentException.class, () -> decoded.list("platform"));
        assertThrows(IllegalArgumentException.class, () -> decoded.string("build-arg"));
    }

    @Test
    void listValuesAreIsolatedFromLaterDecoding() throws Exception {
        DecodedOptions decoded = OptionDecoder.decode(SPEC, List.of("--build-arg", "A=1"));
        List<String> snapshot = decoded.list("build-arg");
        decoded.append("build-arg", "B=2");
        assertEquals(List.of("A=1"), snapshot);
        assertEquals(List.of("A=1", "B=2"), decoded.list("build-arg"));
        assertThrows(UnsupportedOperationException.class, () -> snapshot.add("C=3"));
    }
}
