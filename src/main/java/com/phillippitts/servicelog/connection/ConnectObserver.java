package com.phillippitts.servicelog.connection;

/**
 * Callback invoked by a connection layer after each connection attempt.
 */
@FunctionalInterface
public interface ConnectObserver {

    void observeConnect(ConnectionEvent event);
}
