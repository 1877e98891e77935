package com.gazapps.mcpevals.mcp.transport;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.api.Test;

import com.gazapps.mcpevals.model.ServerConfiguration;

class TransportResolverTest {

    private final TransportResolver resolver = new TransportResolver();

    @ParameterizedTest
    @CsvSource({
        "STDIO, , http://localhost:3000, stdio",
        "Http, server.js, , http",
        "stdio, , http://localhost:3000/mcp, stdio",
        "sse, server.js, http://localhost:3000, sse"
    })
    void explicitTransport_alwaysWins_lowerCased(String transport, String path, String url, String expected) {
        assertThat(resolver.resolveTransport(new ServerConfiguration(transport, path, url))).isEqualTo(expected);
    }

    @Test
    void noTransport_withUrl_resolvesHttp() {
        assertThat(resolver.resolveTransport(new ServerConfiguration(null, "server.js", "http://localhost:3000")))
            .isEqualTo(TransportResolver.HTTP);
    }

    @Test
    void noTransport_withOnlyPath_resolvesStdio() {
        assertThat(resolver.resolveTransport(new ServerConfiguration("", "server.py", null)))
            .isEqualTo(TransportResolver.STDIO);
    }

    @Test
    void emptyConfiguration_resolvesStdio() {
        assertThat(resolver.resolveTransport(new ServerConfiguration())).isEqualTo(TransportResolver.STDIO);
    }
}
