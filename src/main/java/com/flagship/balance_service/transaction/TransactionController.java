package com.flagship.balance_service.transaction;

import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StreamUtils;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * REST controller for the two ledger operations.
 *
 * Every business outcome, including malformed input and insufficient funds,
 * is answered with 200 and a plain-text body. Callers distinguish outcomes by
 * the body text.
 */
@RestController
@RequiredArgsConstructor
public class TransactionController {

    private static final MediaType TEXT_PLAIN_UTF8 = new MediaType(MediaType.TEXT_PLAIN, StandardCharsets.UTF_8);

    private final TransactionService transactionService;

    @PostMapping("/pay")
    public ResponseEntity<String> pay(HttpServletRequest request) {
        TransactionOutcome outcome;
        try {
            outcome = transactionService.pay(readBody(request));
        } catch (IOException e) {
            outcome = transactionService.readFailure(TransactionType.PAY, e);
        }
        return respond(outcome);
    }

    @PostMapping("/save")
    public ResponseEntity<String> save(HttpServletRequest request) {
        TransactionOutcome outcome;
        try {
            outcome = transactionService.save(readBody(request));
        } catch (IOException e) {
            outcome = transactionService.readFailure(TransactionType.SAVE, e);
        }
        return respond(outcome);
    }

    private static String readBody(HttpServletRequest request) throws IOException {
        return StreamUtils.copyToString(request.getInputStream(), StandardCharsets.UTF_8);
    }

    private static ResponseEntity<String> respond(TransactionOutcome outcome) {
        return ResponseEntity.ok()
                .contentType(TEXT_PLAIN_UTF8)
                .body(outcome.render());
    }
}
