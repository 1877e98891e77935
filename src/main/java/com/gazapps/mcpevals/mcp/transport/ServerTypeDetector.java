package com.gazapps.mcpevals.mcp.transport;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.gazapps.mcpevals.model.ServerConfiguration;
import com.gazapps.mcpevals.model.ServerType;

/**
 * Classifies a server artifact by extension, then by keywords found in its path.
 * Pure: no file system access.
 */
public class ServerTypeDetector {

    private static final Logger logger = LoggerFactory.getLogger(ServerTypeDetector.class);

    private static final Map<String, ServerType> EXTENSIONS = Map.of(
        ".exe", ServerType.NATIVE_EXECUTABLE,
        ".ts", ServerType.TYPESCRIPT_SCRIPT,
        ".js", ServerType.NODE_SCRIPT,
        ".py", ServerType.PYTHON_SCRIPT
    );

    // Checked in insertion order, first hit wins
    private static final Map<String, ServerType> KEYWORDS = new LinkedHashMap<>();
    static {
        KEYWORDS.put("typescript", ServerType.TYPESCRIPT_SCRIPT);
        KEYWORDS.put("node", ServerType.TYPESCRIPT_SCRIPT);
        KEYWORDS.put("csharp", ServerType.NATIVE_EXECUTABLE);
        KEYWORDS.put("dotnet", ServerType.NATIVE_EXECUTABLE);
        KEYWORDS.put("python", ServerType.PYTHON_SCRIPT);
        KEYWORDS.put("py", ServerType.PYTHON_SCRIPT);
    }

    public ServerType detectServerType(String serverPath, ServerConfiguration config) {
        if (serverPath == null || serverPath.isBlank()) {
            return ServerType.UNKNOWN;
        }

        String lowerPath = serverPath.toLowerCase(Locale.ROOT);
        ServerType byExtension = EXTENSIONS.get(extensionOf(lowerPath));
        if (byExtension != null) {
            return byExtension;
        }

        for (Map.Entry<String, ServerType> keyword : KEYWORDS.entrySet()) {
            if (lowerPath.contains(keyword.getKey())) {
                logger.debug("Server type {} inferred from keyword '{}' in {}", keyword.getValue(), keyword.getKey(), serverPath);
                return keyword.getValue();
            }
        }

        logger.debug("Could not determine server type for {}", serverPath);
        return ServerType.UNKNOWN;
    }

    private static String extensionOf(String path) {
        int slash = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
        int dot = path.lastIndexOf('.');
        return dot > slash ? path.substring(dot) : "";
    }
}
