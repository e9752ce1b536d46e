package com.flagship.ebank_ledger.auth;

import com.flagship.ebank_ledger.config.LedgerProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Checks admin logins against the configured ebank.admin credentials.
 */
@Component
@RequiredArgsConstructor
public class AdminCredentials {

    private final LedgerProperties properties;

    public boolean matches(String adminId, String password) {
        LedgerProperties.Admin admin = properties.getAdmin();
        // Evaluate both comparisons so timing does not reveal which one failed
        boolean idMatches = constantTimeEquals(admin.getId(), adminId);
        boolean passwordMatches = constantTimeEquals(admin.getPassword(), password);
        return idMatches & passwordMatches;
    }

    private static boolean constantTimeEquals(String expected, String actual) {
        if (expected == null || actual == null) {
            return false;
        }
        return MessageDigest.isEqual(
            expected.getBytes(StandardCharsets.UTF_8),
            actual.getBytes(StandardCharsets.UTF_8));
    }
}
