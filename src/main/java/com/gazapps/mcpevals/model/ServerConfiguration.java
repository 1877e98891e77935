package com.gazapps.mcpevals.model;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * How to reach the server under test. {@code stdio} needs {@code path};
 * {@code http} needs {@code url}, and launches {@code path} first when both are set.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ServerConfiguration {

    public static final int DEFAULT_TIMEOUT_SECONDS = 30;

    public String transport;
    public String path;
    public String url;
    public List<String> args = new ArrayList<>();
    public Map<String, String> env = new HashMap<>();
    public int timeout = DEFAULT_TIMEOUT_SECONDS;

    public ServerConfiguration() {
    }

    public ServerConfiguration(String transport, String path, String url) {
        this.transport = transport;
        this.path = path;
        this.url = url;
    }

    public static ServerConfiguration stdio(String path, String... args) {
        ServerConfiguration config = new ServerConfiguration("stdio", path, null);
        config.args = new ArrayList<>(List.of(args));
        return config;
    }

    public static ServerConfiguration http(String url) {
        return new ServerConfiguration("http", null, url);
    }

    public List<String> argsOrEmpty() {
        return args != null ? args : List.of();
    }

    public boolean hasPath() {
        return path != null && !path.isBlank();
    }

    public boolean hasUrl() {
        return url != null && !url.isBlank();
    }

    @Override
    public String toString() {
        return String.format("ServerConfiguration{transport=%s, path=%s, url=%s, args=%s, timeout=%ds}",
                transport, path, url, argsOrEmpty(), timeout);
    }
}
