package com.phillippitts.servicelog.exception;

/**
 * Thrown when a peer address cannot be split into host and port.
 */
public class AddressParseException extends ServiceLogException {

    private final String address;
    private final String reason;

    public AddressParseException(String address, String reason) {
        super("address " + address + ": " + reason);
        this.address = address;
        this.reason = reason;
    }

    public String getAddress() {
        return address;
    }

    public String getReason() {
        return reason;
    }
}
