package com.flagship.ebank_ledger.auth;

import com.flagship.ebank_ledger.account.AccountService;
import com.flagship.ebank_ledger.account.dto.AccountResponse;
import com.flagship.ebank_ledger.auth.dto.AdminLoginRequest;
import com.flagship.ebank_ledger.auth.dto.UserLoginRequest;
import com.flagship.ebank_ledger.exception.ApiError;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Map;

/**
 * Login checks for customers (mobile + PIN) and the administrator.
 *
 * No session or token is issued; the front end keeps the result.
 */
@RestController
@RequestMapping("/auth")
@RequiredArgsConstructor
@Slf4j
public class AuthController {

    private final AccountService accountService;
    private final AdminCredentials adminCredentials;

    @PostMapping("/login-user")
    public AccountResponse loginUser(@Valid @RequestBody UserLoginRequest request) {
        return AccountResponse.from(accountService.authenticate(request.getMobile(), request.getPin()));
    }

    @PostMapping("/login-admin")
    public ResponseEntity<?> loginAdmin(@Valid @RequestBody AdminLoginRequest request) {
        if (adminCredentials.matches(request.getAdminId(), request.getPassword())) {
            return ResponseEntity.ok(Map.of("ok", true));
        }
        log.warn("Rejected admin login for id {}", request.getAdminId());

        ApiError error = ApiError.builder()
            .error(HttpStatus.UNAUTHORIZED.getReasonPhrase())
            .message("Invalid admin credentials")
            .timestamp(Instant.now())
            .build();
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(error);
    }
}
