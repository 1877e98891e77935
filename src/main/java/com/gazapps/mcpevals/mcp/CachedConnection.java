package com.gazapps.mcpevals.mcp;

import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

import com.gazapps.mcpevals.mcp.process.ServerProcessManager;

/**
 * A cache entry: a live client plus the process the cache launched for it, if any.
 * Protocol calls through one entry are serialized, so parallel evaluations can share it.
 */
public final class CachedConnection implements McpConnection {

    private final McpConnection connection;
    private final Process ownedProcess;
    private final ReentrantLock lock = new ReentrantLock();

    public CachedConnection(McpConnection connection, Process ownedProcess) {
        this.connection = connection;
        this.ownedProcess = ownedProcess;
    }

    /**
     * True when the cache launched a process for this entry and it has since exited.
     */
    public boolean isStale() {
        return ownedProcess != null && !ownedProcess.isAlive();
    }

    public Process getOwnedProcess() {
        return ownedProcess;
    }

    @Override
    public List<ToolDescriptor> listTools() {
        lock.lock();
        try {
            return connection.listTools();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public ToolCallResult callTool(String toolName, Map<String, Object> arguments) {
        lock.lock();
        try {
            return connection.callTool(toolName, arguments);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Closes the client, then stops the owned process.
     */
    @Override
    public void close() {
        try {
            connection.close();
        } finally {
            ServerProcessManager.stop(ownedProcess);
        }
    }

    @Override
    public String toString() {
        return "CachedConnection{" + connection + ", owned=" + (ownedProcess != null) + "}";
    }
}
