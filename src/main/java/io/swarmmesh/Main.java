package io.swarmmesh;

import io.swarmmesh.cli.SwarmMeshCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new SwarmMeshCommand()).execute(args);
        System.exit(code);
    }
}
