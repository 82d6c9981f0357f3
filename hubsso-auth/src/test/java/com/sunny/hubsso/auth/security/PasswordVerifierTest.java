package com.sunny.hubsso.auth.security;

import org.junit.jupiter.api.Test;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PasswordVerifierTest {

    private final BCryptPasswordEncoder encoder = new BCryptPasswordEncoder(4);
    private final PasswordVerifier verifier = new PasswordVerifier(encoder);

    @Test
    void verify_shouldAcceptMatchingPassword() {
        String hash = encoder.encode("s3cret!");

        assertTrue(verifier.verify("s3cret!", hash));
    }

    @Test
    void verify_shouldRejectWrongPassword() {
        String hash = encoder.encode("s3cret!");

        assertFalse(verifier.verify("S3cret!", hash));
    }

    @Test
    void verify_shouldAcceptBcrypt2bPrefix() {
        String hash = encoder.encode("s3cret!").replaceFirst("^\\$2a\\$", "\\$2b\\$");

        assertTrue(verifier.verify("s3cret!", hash));
    }

    @Test
    void verify_shouldReturnFalseForMalformedOrMissingHash() {
        assertFalse(verifier.verify("s3cret!", "not-a-bcrypt-hash"));
        assertFalse(verifier.verify("s3cret!", ""));
        assertFalse(verifier.verify("s3cret!", null));
        assertFalse(verifier.verify(null, encoder.encode("s3cret!")));
    }
}
