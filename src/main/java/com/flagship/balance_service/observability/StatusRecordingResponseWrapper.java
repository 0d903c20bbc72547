package com.flagship.balance_service.observability;

import jakarta.servlet.http.HttpServletResponse;
import jakarta.servlet.http.HttpServletResponseWrapper;

import java.io.IOException;

/**
 * Response decorator that remembers the last status code set on it.
 *
 * Everything is forwarded to the wrapped response unchanged. A handler that
 * writes a body without setting a status leaves the recorded value at 200.
 */
public class StatusRecordingResponseWrapper extends HttpServletResponseWrapper {

    private int recordedStatus = HttpServletResponse.SC_OK;

    public StatusRecordingResponseWrapper(HttpServletResponse response) {
        super(response);
    }

    @Override
    public void setStatus(int sc) {
        recordedStatus = sc;
        super.setStatus(sc);
    }

    @Override
    public void sendError(int sc) throws IOException {
        recordedStatus = sc;
        super.sendError(sc);
    }

    @Override
    public void sendError(int sc, String msg) throws IOException {
        recordedStatus = sc;
        super.sendError(sc, msg);
    }

    public int getRecordedStatus() {
        return recordedStatus;
    }
}
