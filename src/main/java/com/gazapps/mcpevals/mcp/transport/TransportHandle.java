package com.gazapps.mcpevals.mcp.transport;

import java.net.URI;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Everything needed to open a protocol client. A stdio handle carries the launch
 * command; the SDK spawns that process itself when the client initializes. An
 * HTTP handle carries the endpoint and, when the harness launched the server,
 * the owned process.
 */
public final class TransportHandle {

    public enum Kind { STDIO, HTTP }

    private final Kind kind;
    private final String command;
    private final List<String> args;
    private final Path workingDirectory;
    private final Map<String, String> environment;
    private final URI endpoint;
    private final Process ownedProcess;

    private TransportHandle(Kind kind, String command, List<String> args, Path workingDirectory,
            Map<String, String> environment, URI endpoint, Process ownedProcess) {
        this.kind = kind;
        this.command = command;
        this.args = args != null ? List.copyOf(args) : List.of();
        this.workingDirectory = workingDirectory;
        this.environment = environment != null ? Map.copyOf(environment) : Map.of();
        this.endpoint = endpoint;
        this.ownedProcess = ownedProcess;
    }

    public static TransportHandle stdio(List<String> commandLine, Path workingDirectory, Map<String, String> environment) {
        if (commandLine == null || commandLine.isEmpty()) {
            throw new IllegalArgumentException("Command line cannot be empty");
        }
        return new TransportHandle(Kind.STDIO, commandLine.get(0), commandLine.subList(1, commandLine.size()),
                workingDirectory, environment, null, null);
    }

    public static TransportHandle http(URI endpoint, Process ownedProcess) {
        return new TransportHandle(Kind.HTTP, null, null, null, null, endpoint, ownedProcess);
    }

    public Kind getKind() { return kind; }
    public String getCommand() { return command; }
    public List<String> getArgs() { return args; }
    public Path getWorkingDirectory() { return workingDirectory; }
    public Map<String, String> getEnvironment() { return environment; }
    public URI getEndpoint() { return endpoint; }
    public Process getOwnedProcess() { return ownedProcess; }

    @Override
    public String toString() {
        return kind == Kind.STDIO
                ? String.format("TransportHandle{stdio: %s %s}", command, String.join(" ", args))
                : String.format("TransportHandle{http: %s, owned=%b}", endpoint, ownedProcess != null);
    }
}
