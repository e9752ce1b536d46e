package com.flagship.ebank_ledger.account;

import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.Random;
import java.util.regex.Pattern;

/**
 * Draws candidate account numbers: 8-digit numerals in [10000000, 99999999].
 *
 * Uniqueness is not checked here; {@link AccountService} re-checks every candidate.
 */
@Component
public class AccountNumberGenerator {

    static final int MIN = 10_000_000;
    static final int MAX = 99_999_999;

    private static final Pattern FORMAT = Pattern.compile("\\d{8}");

    private final Random random;

    public AccountNumberGenerator() {
        this(new SecureRandom());
    }

    AccountNumberGenerator(Random random) {
        this.random = random;
    }

    public String nextCandidate() {
        return String.valueOf(MIN + random.nextInt(MAX - MIN + 1));
    }

    public static boolean isWellFormed(String accountNumber) {
        return accountNumber != null && FORMAT.matcher(accountNumber).matches();
    }
}
