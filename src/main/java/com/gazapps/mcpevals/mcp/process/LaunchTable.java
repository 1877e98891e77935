package com.gazapps.mcpevals.mcp.process;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.gazapps.mcpevals.model.ServerType;

/**
 * Launch command prefix per server type. The artifact path and the configured
 * arguments are appended to the prefix.
 */
public final class LaunchTable {

    private static final Map<ServerType, List<String>> PREFIXES = Map.of(
        ServerType.TYPESCRIPT_SCRIPT, List.of("npx", "tsx"),
        ServerType.NODE_SCRIPT, List.of("node"),
        ServerType.NATIVE_EXECUTABLE, List.of(),
        ServerType.PYTHON_SCRIPT, List.of("python"),
        ServerType.UNKNOWN, List.of()
    );

    private LaunchTable() {
    }

    public static List<String> command(ServerType type, Path artifact, List<String> args) {
        List<String> command = new ArrayList<>(PREFIXES.getOrDefault(type, List.of()));
        if (isWindows() && !command.isEmpty() && "npx".equals(command.get(0))) {
            command.add(0, "cmd.exe");
            command.add(1, "/c");
        }
        command.add(artifact.toString());
        if (args != null) {
            command.addAll(args);
        }
        return command;
    }

    private static boolean isWindows() {
        return System.getProperty("os.name", "").toLowerCase(Locale.ROOT).contains("win");
    }
}
