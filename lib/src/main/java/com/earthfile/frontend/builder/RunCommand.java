package com.earthfile.frontend.builder;

import java.util.List;

/**
 * A {@code RUN} step. {@code withShell} is false when the command was written in JSON array form;
 * shell-form arguments are passed through unexpanded.
 */
public record RunCommand(
        List<String> args,
        List<String> mounts,
        List<String> secrets,
        boolean privileged,
        boolean withEntrypoint,
        boolean withDocker,
        boolean withShell,
        boolean push,
        boolean withSsh) {

    public RunCommand {
        args = List.copyOf(args);
        mounts = List.copyOf(mounts);
        secrets = List.copyOf(secrets);
    }
}
