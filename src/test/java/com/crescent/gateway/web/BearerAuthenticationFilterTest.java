package com.crescent.gateway.web;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class BearerAuthenticationFilterTest {

    @Test
    void shouldExtractBearerCredentialCaseInsensitively() {
        assertEquals("sk-abc", BearerAuthenticationFilter.extractCredential("Bearer sk-abc"));
        assertEquals("sk-abc", BearerAuthenticationFilter.extractCredential("bearer   sk-abc "));
        assertNull(BearerAuthenticationFilter.extractCredential(null));
        assertNull(BearerAuthenticationFilter.extractCredential("Basic dXNlcjpwYXNz"));
        assertNull(BearerAuthenticationFilter.extractCredential("Bearer "));
    }
}
