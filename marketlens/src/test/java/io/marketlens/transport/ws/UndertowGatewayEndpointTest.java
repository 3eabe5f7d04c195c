package io.marketlens.transport.ws;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class UndertowGatewayEndpointTest {

    @Test
    void testExtractToken() {
        assertEquals("abc", UndertowGatewayEndpoint.extractToken("token=abc"));
        assertEquals("a b+c", UndertowGatewayEndpoint.extractToken("x=1&token=a%20b%2Bc"));
        assertNull(UndertowGatewayEndpoint.extractToken("x=1"));
        assertNull(UndertowGatewayEndpoint.extractToken(null));
    }

    @Test
    void testBearer() {
        assertEquals("abc", UndertowGatewayEndpoint.bearer("Bearer abc"));
        assertEquals("abc", UndertowGatewayEndpoint.bearer("bearer  abc "));
        assertNull(UndertowGatewayEndpoint.bearer("Basic abc"));
        assertNull(UndertowGatewayEndpoint.bearer(null));
    }
}
