package com.earthfile.frontend.loader;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.earthfile.frontend.builder.BuildContext;
import com.earthfile.frontend.builder.BuilderCall;
import com.earthfile.frontend.builder.RecordingGraphBuilder;
import com.earthfile.frontend.loader.semantic.InterpreterException;
import com.earthfile.frontend.loader.semantic.TargetNotFoundException;
import com.earthfile.frontend.testing.TestResources;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class EarthfileLoaderTest {
    private final EarthfileLoader loader = new EarthfileLoader();

    @Test
    void loadsTargetFromFile() throws Exception {
        Path earthfile = TestResources.earthfile("multi-target.earth");
        RecordingGraphBuilder builder = new RecordingGraphBuilder();
        LoaderResult result = loader.load(earthfile, "build", builder, BuildContext.background());

        assertEquals("build", result.getTargetName());
        assertEquals(earthfile.toString(), result.getSourceName());
        assertTrue(result.getMessages().isEmpty());
        assertEquals(
                List.of("fromImage", "fromImage", "copyClassical", "run", "saveArtifact"),
                builder.getOperations());
        List<BuilderCall> calls = builder.getCalls();
        assertEquals("+deps", calls.get(1).get("image"));
        assertEquals(
                List.of("go", "build", "-ldflags", "\"-X main.version=$VERSION\"", "-o", "out/app", "main.go"),
                calls.get(3).get("args"));
        assertEquals("/app", calls.get(4).get("destination"));
        assertEquals("build/app", calls.get(4).get("localDestination"));
    }

    @Test
    void loadsImageTarget() throws Exception {
        RecordingGraphBuilder builder = new RecordingGraphBuilder();
        loader.load(TestResources.earthfile("multi-target.earth"), "docker", builder, BuildContext.background());

        assertEquals(
                List.of("fromImage", "copyArtifact", "entrypoint", "label", "saveImage"),
                builder.getOperations());
        List<BuilderCall> calls = builder.getCalls();
        assertEquals("+build/app", calls.get(1).get("source"));
        assertEquals(List.of("/usr/bin/app"), calls.get(2).get("args"));
        Map<String, String> labels = new LinkedHashMap<>();
        labels.put("org.opencontainers.image.version", "");
        labels.put("maintainer", "dev team");
        assertEquals(labels, calls.get(3).get("labels"));
        assertEquals(true, calls.get(4).get("push"));
    }

    @Test
    void loadsBaseRecipe() throws Exception {
        RecordingGraphBuilder builder = new RecordingGraphBuilder();
        loader.load(TestResources.earthfile("multi-target.earth"), "base", builder, BuildContext.background());

        assertEquals(List.of("fromImage", "workdir", "arg"), builder.getOperations());
        assertEquals("golang:1.21-alpine", builder.getCalls().get(0).get("image"));
        assertEquals(true, builder.getCalls().get(2).get("global"));
    }

    @Test
    void missingFileIsALoaderError() {
        Path missing = Path.of("does-not-exist", "Earthfile");
        LoaderException e = assertThrows(LoaderException.class,
                () -> loader.load(missing, "build", new RecordingGraphBuilder(), BuildContext.background()));
        assertEquals("Failed to read Earthfile: " + missing, e.getMessage());
    }

    @Test
    void syntaxErrorNamesFileAndLine() {
        Path earthfile = TestResources.earthfile("syntax-error.earth");
        RecordingGraphBuilder builder = new RecordingGraphBuilder();
        LoaderException e = assertThrows(LoaderException.class,
                () -> loader.load(earthfile, "build", builder, BuildContext.background()));
        assertTrue(e.getMessage().startsWith("Failed to parse Earthfile: " + earthfile + ":3:"), e.getMessage());
        assertInstanceOf(EarthfileParseException.class, e.getCause());
        assertTrue(builder.getCalls().isEmpty());
    }

    @Test
    void unknownTargetIsReported() {
        TargetNotFoundException e = assertThrows(TargetNotFoundException.class,
                () -> loader.load(
                        TestResources.earthfile("multi-target.earth"), "release", new RecordingGraphBuilder(),
                        BuildContext.background()));
        assertEquals("target release not defined", e.getMessage());
    }

    @Test
    void interpreterFailuresAreLoaderExceptions() {
        LoaderException e = assertThrows(LoaderException.class,
                () -> loader.load(
                        TestResources.earthfile("unterminated-with-docker.earth"), "integration",
                        new RecordingGraphBuilder(), BuildContext.background()));
        InterpreterException failure = assertInstanceOf(InterpreterException.class, e);
        assertEquals("no matching END found for WITH DOCKER", failure.getMessage());
    }

    @Test
    void tokenDebuggingAddsInfoMessages() throws Exception {
        String previous = System.getProperty(DebugFlags.TOKENS_PROPERTY);
        System.setProperty(DebugFlags.TOKENS_PROPERTY, "true");
        try {
            LoaderResult result = loader.load(
                    "Earthfile", "build:\n    RUN true\n", "build", new RecordingGraphBuilder(),
                    BuildContext.background());
            List<LoaderMessage> messages = result.getMessages();
            assertEquals(6, messages.size());
            assertTrue(messages.stream().allMatch(m -> m.getLevel() == LoaderMessage.Level.INFO));
            assertTrue(messages.get(0).getMessage().startsWith("[tokens] Target"), messages.get(0).getMessage());
            assertTrue(result.getWarnings().isEmpty());
        } finally {
            if (previous == null) {
                System.clearProperty(DebugFlags.TOKENS_PROPERTY);
            } else {
                System.setProperty(DebugFlags.TOKENS_PROPERTY, previous);
            }
        }
    }

    @Test
    void parseFailureWithTokenDebuggingListsRecentTokens() {
        String previous = System.getProperty(DebugFlags.TOKENS_PROPERTY);
        System.setProperty(DebugFlags.TOKENS_PROPERTY, "true");
        try {
            LoaderException e = assertThrows(LoaderException.class,
                    () -> loader.load(
                            "Earthfile", "build:\n    ENV\n", "build", new RecordingGraphBuilder(),
                            BuildContext.background()));
            assertTrue(e.getMessage().startsWith("Failed to parse Earthfile: Earthfile:2:"), e.getMessage());
            assertTrue(e.getMessage().contains("\nRecent tokens:\n"), e.getMessage());
            assertTrue(e.getMessage().contains("ENV"), e.getMessage());
        } finally {
            if (previous == null) {
                System.clearProperty(DebugFlags.TOKENS_PROPERTY);
            } else {
                System.setProperty(DebugFlags.TOKENS_PROPERTY, previous);
            }
        }
    }
}
