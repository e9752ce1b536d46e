package com.flagship.ebank_ledger.ledger;

import com.flagship.ebank_ledger.account.AccountEntity;
import com.flagship.ebank_ledger.exception.LedgerErrorCode;
import com.flagship.ebank_ledger.exception.LedgerException;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Amount validation for ledger operations: strictly positive, at most two
 * fractional digits, no larger than a balance column can hold, normalized
 * to scale 2.
 */
final class Money {

    static final int SCALE = 2;

    private Money() {
    }

    static BigDecimal requireValidAmount(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new LedgerException(LedgerErrorCode.INVALID_AMOUNT, "Amount must be greater than 0");
        }
        if (amount.stripTrailingZeros().scale() > SCALE) {
            throw new LedgerException(LedgerErrorCode.INVALID_AMOUNT,
                "Amount must have at most " + SCALE + " fractional digits: " + amount.toPlainString());
        }
        if (amount.compareTo(AccountEntity.MAX_BALANCE) > 0) {
            throw new LedgerException(LedgerErrorCode.INVALID_AMOUNT,
                "Amount must not exceed " + AccountEntity.MAX_BALANCE.toPlainString());
        }
        return amount.setScale(SCALE, RoundingMode.UNNECESSARY);
    }
}
