package com.gridarena.session;

/**
 * The connection handle the game core sends through.
 *
 * Implementations must be safe to call from any session thread: a broadcast
 * triggered by one player writes to every other player's transport.
 */
public interface Transport {

    /**
     * Sends text to the remote end as-is (callers add line terminators).
     *
     * @return false if the text could not be delivered; the caller treats
     *         this as the connection being gone
     */
    boolean send(String text);

    /**
     * Closes the connection. Safe to call more than once.
     */
    void close();

    boolean isOpen();

    /**
     * Short description for log lines, e.g. the remote address.
     */
    String describe();
}
