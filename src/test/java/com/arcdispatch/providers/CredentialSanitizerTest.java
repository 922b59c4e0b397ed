package com.arcdispatch.providers;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CredentialSanitizerTest {

    @Test
    void redactsLiteralKey() {
        String out = CredentialSanitizer.sanitize("bad key custom-key-value-42 supplied", "custom-key-value-42");
        assertFalse(out.contains("custom-key-value-42"));
    }

    @Test
    void redactsBearerTokens() {
        String out = CredentialSanitizer.sanitize("Authorization: Bearer abc.def-123");
        assertFalse(out.contains("abc.def-123"));
        assertTrue(out.contains("Bearer [redacted]"));
    }

    @Test
    void redactsQueryParameters() {
        String out = CredentialSanitizer.sanitize("GET https://host/v1?key=AIzaSecret&alt=sse");
        assertFalse(out.contains("AIzaSecret"));
        assertTrue(out.contains("alt=sse"));
    }

    @Test
    void redactsKeyShapedStrings() {
        String out = CredentialSanitizer.sanitize("used sk-proj-abcdefghijklmnop and xai-ABCDEFGH12345678");
        assertFalse(out.contains("sk-proj-abcdefghijklmnop"));
        assertFalse(out.contains("xai-ABCDEFGH12345678"));
    }

    @Test
    void leavesOrdinaryTextAlone() {
        assertEquals("Provider request failed (500)", CredentialSanitizer.sanitize("Provider request failed (500)"));
        assertNull(CredentialSanitizer.sanitize(null));
    }
}
