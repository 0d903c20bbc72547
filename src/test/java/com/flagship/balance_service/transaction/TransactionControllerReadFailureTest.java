package com.flagship.balance_service.transaction;

import com.flagship.balance_service.ledger.Ledger;
import com.flagship.balance_service.ledger.LedgerSnapshot;
import com.flagship.balance_service.observability.LedgerMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.servlet.ServletInputStream;
import jakarta.servlet.http.HttpServletRequestWrapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

class TransactionControllerReadFailureTest {

    @Test
    @DisplayName("Truncated body should be answered with the read error and leave the ledger untouched")
    void testBodyReadFailure() {
        Ledger ledger = new Ledger(1000, 0);
        TransactionController controller = new TransactionController(
                new TransactionService(ledger, new LedgerMetrics(new SimpleMeterRegistry(), ledger)));

        HttpServletRequestWrapper truncated = new HttpServletRequestWrapper(new MockHttpServletRequest("POST", "/pay")) {
            @Override
            public ServletInputStream getInputStream() throws IOException {
                throw new IOException("connection reset");
            }
        };

        ResponseEntity<String> pay = controller.pay(truncated);
        ResponseEntity<String> save = controller.save(truncated);

        assertEquals(200, pay.getStatusCode().value());
        assertEquals("error read HTTP body: connection reset", pay.getBody());
        assertEquals("error read HTTP body: connection reset", save.getBody());
        assertEquals(new LedgerSnapshot(1000, 0), ledger.snapshot());
    }
}
