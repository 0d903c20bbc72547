package com.flagship.balance_service.observability;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletResponse;

import static org.junit.jupiter.api.Assertions.*;

class StatusRecordingResponseWrapperTest {

    @Test
    @DisplayName("Explicit status should be recorded and forwarded")
    void testSetStatus() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();
        StatusRecordingResponseWrapper wrapper = new StatusRecordingResponseWrapper(response);

        wrapper.setStatus(404);

        assertEquals(404, wrapper.getRecordedStatus());
        assertEquals(404, response.getStatus());
        assertEquals("", response.getContentAsString());
    }

    @Test
    @DisplayName("Writing a body without a status should record 200")
    void testWriteWithoutStatus() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();
        StatusRecordingResponseWrapper wrapper = new StatusRecordingResponseWrapper(response);

        wrapper.getWriter().write("test body");
        wrapper.flushBuffer();

        assertEquals(200, wrapper.getRecordedStatus());
        assertEquals("test body", response.getContentAsString());
    }

    @Test
    @DisplayName("Status then body should record the status and pass the body through")
    void testStatusThenWrite() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();
        StatusRecordingResponseWrapper wrapper = new StatusRecordingResponseWrapper(response);

        wrapper.setStatus(500);
        wrapper.getWriter().write("error");
        wrapper.flushBuffer();

        assertEquals(500, wrapper.getRecordedStatus());
        assertEquals(500, response.getStatus());
        assertEquals("error", response.getContentAsString());
    }

    @Test
    @DisplayName("sendError should be recorded")
    void testSendError() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();
        StatusRecordingResponseWrapper wrapper = new StatusRecordingResponseWrapper(response);

        wrapper.sendError(503, "unavailable");

        assertEquals(503, wrapper.getRecordedStatus());
        assertEquals(503, response.getStatus());
    }
}
