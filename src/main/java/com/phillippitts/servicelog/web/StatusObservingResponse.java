package com.phillippitts.servicelog.web;

import jakarta.servlet.http.HttpServletResponse;
import jakarta.servlet.http.HttpServletResponseWrapper;

import java.io.IOException;

/**
 * Response wrapper that remembers the status code written through it.
 * Defaults to 200 when nothing sets a status.
 */
class StatusObservingResponse extends HttpServletResponseWrapper {

    private int status = HttpServletResponse.SC_OK;

    StatusObservingResponse(HttpServletResponse response) {
        super(response);
    }

    @Override
    public void setStatus(int sc) {
        this.status = sc;
        super.setStatus(sc);
    }

    @Override
    public void sendError(int sc) throws IOException {
        this.status = sc;
        super.sendError(sc);
    }

    @Override
    public void sendError(int sc, String msg) throws IOException {
        this.status = sc;
        super.sendError(sc, msg);
    }

    @Override
    public void sendRedirect(String location) throws IOException {
        this.status = HttpServletResponse.SC_FOUND;
        super.sendRedirect(location);
    }

    @Override
    public int getStatus() {
        return status;
    }
}
