package com.earthfile.frontend.loader.semantic;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.earthfile.frontend.builder.BuildContext;
import com.earthfile.frontend.builder.RecordingGraphBuilder;
import com.earthfile.frontend.loader.EarthfileLoader;
import com.earthfile.frontend.loader.LoaderException;
import java.util.List;
import org.junit.jupiter.api.Test;

class PushOnlyModeTest {

    private static RecordingGraphBuilder interpret(String earthfile) throws LoaderException {
        RecordingGraphBuilder builder = new RecordingGraphBuilder();
        new EarthfileLoader().load("Earthfile", earthfile, "build", builder, BuildContext.background());
        return builder;
    }

    @Test
    void nonPushStatementAfterPushedRunFails() {
        StateInvariantException e = assertThrows(StateInvariantException.class, () -> interpret("""
                build:
                    FROM alpine:3.18
                    RUN --push echo hi
                    WORKDIR /x
                """));
        assertEquals("no non-push commands allowed after a --push: WORKDIR /x", e.getMessage());
        assertEquals(4, e.getLine());
    }

    @Test
    void pushedStatementsMayFollowEachOther() throws Exception {
        RecordingGraphBuilder builder = interpret("""
                build:
                    RUN --push ./deploy.sh
                    RUN --push ./notify.sh
                    SAVE IMAGE --push registry.example.com/app:1
                """);
        assertEquals(List.of("fromImage", "run", "run", "saveImage"), builder.getOperations());
        assertEquals(true, builder.getCalls().get(1).get("push"));
    }

    @Test
    void plainRunAfterPushFails() {
        StateInvariantException e = assertThrows(StateInvariantException.class, () -> interpret("""
                build:
                    RUN --push ./deploy.sh
                    RUN echo done
                """));
        assertTrue(e.getMessage().endsWith(": RUN echo done"), e.getMessage());
    }

    @Test
    void pushedSaveImageEntersPushOnlyMode() {
        assertThrows(StateInvariantException.class, () -> interpret("""
                build:
                    SAVE IMAGE --push registry.example.com/app:1
                    ENV A=b
                """));
    }

    @Test
    void unpushedSaveImageAfterPushFails() {
        assertThrows(StateInvariantException.class, () -> interpret("""
                build:
                    RUN --push ./deploy.sh
                    SAVE IMAGE app:1
                """));
        assertThrows(StateInvariantException.class, () -> interpret("""
                build:
                    RUN --push ./deploy.sh
                    SAVE IMAGE
                """));
    }

    @Test
    void pushOnlyCheckPrecedesStatementValidation() {
        StateInvariantException e = assertThrows(StateInvariantException.class, () -> interpret("""
                build:
                    RUN --push ./deploy.sh
                    ENV 1BAD=x
                """));
        assertEquals("no non-push commands allowed after a --push: ENV 1BAD=x", e.getMessage());
    }

    @Test
    void pushesInOtherTargetsDoNotApply() throws Exception {
        RecordingGraphBuilder builder = interpret("""
                deploy:
                    RUN --push ./deploy.sh

                build:
                    WORKDIR /app
                """);
        assertEquals(List.of("fromImage", "workdir"), builder.getOperations());
    }
}
