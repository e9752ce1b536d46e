package com.flagship.ebank_ledger.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

/**
 * PINs are stored as salted BCrypt hashes and verified through the encoder,
 * never compared as plain strings.
 */
@Configuration
public class PinEncoderConfig {

    @Bean
    public PasswordEncoder pinEncoder(LedgerProperties properties) {
        return new BCryptPasswordEncoder(properties.getAccounts().getPinHashStrength());
    }
}
