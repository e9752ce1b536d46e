package com.flagship.ebank_ledger.account;

import com.flagship.ebank_ledger.exception.LedgerErrorCode;
import com.flagship.ebank_ledger.exception.LedgerException;
import lombok.RequiredArgsConstructor;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Format check, hashing and verification of 4-digit PINs.
 */
@Component
@RequiredArgsConstructor
public class PinPolicy {

    private static final Pattern PIN_FORMAT = Pattern.compile("\\d{4}");

    private final PasswordEncoder pinEncoder;

    /**
     * Hashes a new PIN after checking it is exactly four digits.
     */
    public String hash(String pin) {
        if (pin == null || !PIN_FORMAT.matcher(pin).matches()) {
            throw new LedgerException(LedgerErrorCode.INVALID_PIN, "PIN must be 4 digits");
        }
        return pinEncoder.encode(pin);
    }

    public boolean matches(AccountEntity account, String pin) {
        return pin != null && pinEncoder.matches(pin, account.getPinHash());
    }

    /**
     * Fails with INVALID_PIN unless the PIN is present and matches.
     */
    public void verify(AccountEntity account, String pin) {
        if (!matches(account, pin)) {
            throw LedgerException.invalidPin();
        }
    }
}
