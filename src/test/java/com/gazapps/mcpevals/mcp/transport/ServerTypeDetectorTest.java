package com.gazapps.mcpevals.mcp.transport;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;

import com.gazapps.mcpevals.model.ServerConfiguration;
import com.gazapps.mcpevals.model.ServerType;

class ServerTypeDetectorTest {

    private final ServerTypeDetector detector = new ServerTypeDetector();
    private final ServerConfiguration config = new ServerConfiguration();

    @ParameterizedTest
    @CsvSource({
        "servers/index.ts, TYPESCRIPT_SCRIPT",
        "servers/INDEX.TS, TYPESCRIPT_SCRIPT",
        "/opt/mcp/server.js, NODE_SCRIPT",
        "/opt/mcp/Server.JS, NODE_SCRIPT",
        "C:\\tools\\Calculator.exe, NATIVE_EXECUTABLE",
        "C:\\tools\\CALCULATOR.EXE, NATIVE_EXECUTABLE",
        "main.py, PYTHON_SCRIPT",
        "Main.PY, PYTHON_SCRIPT"
    })
    void extension_mapsToType_ignoringCase(String path, ServerType expected) {
        assertThat(detector.detectServerType(path, config)).isEqualTo(expected);
    }

    @Test
    void extension_isCheckedBeforeKeywords() {
        assertThat(detector.detectServerType("/work/python-tools/server.js", config)).isEqualTo(ServerType.NODE_SCRIPT);
    }

    @ParameterizedTest
    @CsvSource({
        "/work/typescript-server/run, TYPESCRIPT_SCRIPT",
        "/work/node-server/bin/start, TYPESCRIPT_SCRIPT",
        "/work/csharp/bin/Release/server, NATIVE_EXECUTABLE",
        "/work/DotNet/server, NATIVE_EXECUTABLE",
        "/work/python/server, PYTHON_SCRIPT"
    })
    void keyword_inPath_selectsType(String path, ServerType expected) {
        assertThat(detector.detectServerType(path, config)).isEqualTo(expected);
    }

    @Test
    void unrecognizedPath_isUnknown() {
        assertThat(detector.detectServerType("/usr/local/bin/calculator", config)).isEqualTo(ServerType.UNKNOWN);
    }

    @ParameterizedTest
    @NullAndEmptySource
    void missingPath_isUnknown(String path) {
        assertThat(detector.detectServerType(path, config)).isEqualTo(ServerType.UNKNOWN);
    }

    @Test
    void dotInDirectoryName_isNotAnExtension() {
        assertThat(detector.detectServerType("/srv/app.v2/launcher", config)).isEqualTo(ServerType.UNKNOWN);
    }
}
