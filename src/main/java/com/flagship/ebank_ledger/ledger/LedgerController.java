package com.flagship.ebank_ledger.ledger;

import com.flagship.ebank_ledger.exception.LedgerErrorCode;
import com.flagship.ebank_ledger.exception.LedgerException;
import com.flagship.ebank_ledger.idempotency.IdempotencyRecord;
import com.flagship.ebank_ledger.idempotency.IdempotencyService;
import com.flagship.ebank_ledger.ledger.dto.AdminDepositRequest;
import com.flagship.ebank_ledger.ledger.dto.DepositRequest;
import com.flagship.ebank_ledger.ledger.dto.LedgerOperationResponse;
import com.flagship.ebank_ledger.ledger.dto.TransactionResponse;
import com.flagship.ebank_ledger.ledger.dto.TransferRequest;
import com.flagship.ebank_ledger.ledger.dto.WalletPayRequest;
import com.flagship.ebank_ledger.ledger.dto.WithdrawWalletRequest;
import com.flagship.ebank_ledger.observability.LedgerMetrics;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * REST endpoints for ledger mutations and transaction history.
 *
 * Mutations accept an optional Idempotency-Key header. A repeated key answers
 * with the transaction recorded the first time instead of moving money again,
 * provided the request is the same kind of operation for the same amount.
 * Otherwise the key is rejected with IDEMPOTENCY_KEY_REUSED.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class LedgerController {

    static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final LedgerService ledgerService;
    private final TransactionLogService transactionLogService;
    private final IdempotencyService idempotencyService;
    private final LedgerMetrics metrics;

    @PostMapping("/transactions/deposit")
    public ResponseEntity<LedgerOperationResponse> deposit(
            @Valid @RequestBody DepositRequest request,
            @RequestHeader(name = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey) {
        return idempotent(idempotencyKey, TransactionType.DEPOSIT, request.getAmount(),
            key -> ledgerService.deposit(request.getAccountNumber(), request.getPin(), request.getAmount(), key));
    }

    @PostMapping("/transactions/withdraw-wallet")
    public ResponseEntity<LedgerOperationResponse> withdrawToWallet(
            @Valid @RequestBody WithdrawWalletRequest request,
            @RequestHeader(name = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey) {
        return idempotent(idempotencyKey, TransactionType.WITHDRAWAL_TO_WALLET, request.getAmount(),
            key -> ledgerService.withdrawToWallet(
                request.getAccountNumber(), request.getPin(), request.getAmount(), key));
    }

    @PostMapping("/transactions/transfer")
    public ResponseEntity<LedgerOperationResponse> transfer(
            @Valid @RequestBody TransferRequest request,
            @RequestHeader(name = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey) {
        return idempotent(idempotencyKey, TransactionType.TRANSFER, request.getAmount(),
            key -> ledgerService.transfer(request.getFromAccountNumber(), request.getToAccountNumber(),
                request.getPin(), request.getAmount(), key));
    }

    @PostMapping("/wallet/pay")
    public ResponseEntity<LedgerOperationResponse> walletPay(
            @Valid @RequestBody WalletPayRequest request,
            @RequestHeader(name = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey) {
        return idempotent(idempotencyKey, TransactionType.WALLET_PAYMENT, request.getAmount(),
            key -> ledgerService.walletPay(request.getAccountNumber(), request.getAmount(),
                request.getMerchant(), key));
    }

    @PostMapping("/admin/deposit")
    public ResponseEntity<LedgerOperationResponse> adminDeposit(
            @Valid @RequestBody AdminDepositRequest request,
            @RequestHeader(name = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey) {
        return idempotent(idempotencyKey, TransactionType.ADMIN_DEPOSIT, request.getAmount(),
            key -> ledgerService.adminDeposit(request.getAccountNumber(), request.getAmount(), key));
    }

    /**
     * Transaction history, newest first. Dates are ISO calendar days
     * (yyyy-MM-dd), both bounds inclusive.
     */
    @GetMapping("/transactions")
    public List<TransactionResponse> listTransactions(
            @RequestParam(name = "account_number", required = false) String accountNumber,
            @RequestParam(name = "start_date", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(name = "end_date", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {

        TransactionQuery query = TransactionQuery.builder()
            .accountNumber(accountNumber != null && !accountNumber.isBlank() ? accountNumber : null)
            .startDate(startDate)
            .endDate(endDate)
            .build();

        return transactionLogService.query(query).stream()
            .map(TransactionResponse::from)
            .collect(Collectors.toList());
    }

    private ResponseEntity<LedgerOperationResponse> idempotent(String idempotencyKey,
                                                              TransactionType type,
                                                              BigDecimal amount,
                                                              Function<String, LedgerTransaction> operation) {
        if (idempotencyKey != null) {
            Optional<IdempotencyRecord> existing = idempotencyService.findRecord(idempotencyKey);
            if (existing.isPresent()) {
                IdempotencyRecord record = existing.get();
                if (!record.matches(type, amount)) {
                    log.warn("Idempotency key {} was used for a {} of {}, rejecting a {} of {}",
                        idempotencyKey, record.getType().getWireValue(), record.getAmount(),
                        type.getWireValue(), amount);
                    throw new LedgerException(LedgerErrorCode.IDEMPOTENCY_KEY_REUSED,
                        "Idempotency key already used for a different request");
                }
                metrics.recordIdempotencyHit();
                log.info("Idempotency key {} already used, returning transaction {}",
                    idempotencyKey, record.getTransactionId());
                return ResponseEntity.ok(LedgerOperationResponse.replayed(record.getTransactionId()));
            }
            metrics.recordIdempotencyMiss();
        }

        // The engine call has committed when it returns
        LedgerTransaction transaction = operation.apply(idempotencyKey);
        if (idempotencyKey != null) {
            idempotencyService.remember(idempotencyKey, transaction);
        }
        return ResponseEntity.ok(LedgerOperationResponse.applied(transaction.getId()));
    }
}
