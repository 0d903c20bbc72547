package com.flagship.balance_service;

import com.flagship.balance_service.observability.RequestIdContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.test.annotation.DirtiesContext;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests over a real port, covering the filter chain as Tomcat runs it.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@DirtiesContext(classMode = DirtiesContext.ClassMode.BEFORE_EACH_TEST_METHOD)
class BalanceServiceApplicationTest {

    @Autowired
    private TestRestTemplate restTemplate;

    private ResponseEntity<String> post(String path, String body, String requestId) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.TEXT_PLAIN);
        if (requestId != null) {
            headers.set(RequestIdContext.REQUEST_ID_HEADER, requestId);
        }
        return restTemplate.postForEntity(path, new HttpEntity<>(body, headers), String.class);
    }

    @Test
    @DisplayName("Full chain payment should return the new balance and a request id")
    void testFullMiddlewareChain() {
        ResponseEntity<String> response = post("/pay", "300", null);

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals("current balance: 700, current bank: 0", response.getBody());

        String requestId = response.getHeaders().getFirst(RequestIdContext.REQUEST_ID_HEADER);
        assertNotNull(requestId, "Request ID header missing in response");
        assertFalse(requestId.isBlank());
    }

    @Test
    @DisplayName("Pay then save should share one ledger and echo the caller's request id")
    void testPayThenSave() {
        post("/pay", "150", "trace-1");
        ResponseEntity<String> response = post("/save", "200", "trace-2");

        assertEquals("current balance: 650, current bank: 200", response.getBody());
        assertEquals("trace-2", response.getHeaders().getFirst(RequestIdContext.REQUEST_ID_HEADER));
    }

    @Test
    @DisplayName("Ledger health should be reported by actuator")
    void testLedgerHealth() {
        ResponseEntity<String> response = restTemplate.getForEntity("/actuator/health", String.class);

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertNotNull(response.getBody());
        assertTrue(response.getBody().contains("ledgerHealth"), response.getBody());
        assertTrue(response.getBody().contains("\"balance\":1000"), response.getBody());
    }
}
