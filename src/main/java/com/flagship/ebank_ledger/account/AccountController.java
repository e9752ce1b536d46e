package com.flagship.ebank_ledger.account;

import com.flagship.ebank_ledger.account.dto.AccountResponse;
import com.flagship.ebank_ledger.account.dto.AdminStatsResponse;
import com.flagship.ebank_ledger.account.dto.CreateAccountRequest;
import com.flagship.ebank_ledger.account.dto.UpdateAccountRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

/**
 * REST endpoints for account management.
 *
 * The /admin routes are expected to sit behind the gateway's admin
 * authentication; nothing here checks admin credentials.
 */
@RestController
@RequiredArgsConstructor
public class AccountController {

    private final AccountService accountService;

    /**
     * Answers 200 with the new account, as existing clients expect.
     */
    @PostMapping("/admin/accounts")
    public AccountResponse createAccount(@Valid @RequestBody CreateAccountRequest request) {
        return AccountResponse.from(accountService.createAccount(request.toProfile(), request.getPin()));
    }

    @GetMapping("/accounts/{accountNumber}")
    public AccountResponse getAccount(@PathVariable("accountNumber") String accountNumber) {
        return AccountResponse.from(accountService.getByAccountNumber(accountNumber));
    }

    @PutMapping("/accounts/{accountNumber}")
    public AccountResponse updateAccount(@PathVariable("accountNumber") String accountNumber,
                                         @Valid @RequestBody UpdateAccountRequest request) {
        return AccountResponse.from(accountService.updateProfile(accountNumber, request.toUpdate()));
    }

    @GetMapping("/admin/users")
    public List<AccountResponse> listAccounts() {
        return accountService.listAll().stream()
            .map(AccountResponse::from)
            .collect(Collectors.toList());
    }

    @GetMapping("/admin/stats")
    public AdminStatsResponse adminStats() {
        return AdminStatsResponse.from(accountService.aggregateStats());
    }
}
