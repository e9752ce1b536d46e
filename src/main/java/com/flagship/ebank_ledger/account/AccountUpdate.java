package com.flagship.ebank_ledger.account;

import lombok.Value;

/**
 * Partial profile change. A null field is left untouched.
 */
@Value
public class AccountUpdate {
    String address;
    String pin;
}
