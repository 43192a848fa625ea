package com.gridarena;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.net.Socket;
import java.nio.charset.StandardCharsets;

/**
 * Minimal blocking TCP client for talking to a running server in tests.
 */
class LineClient implements AutoCloseable {

    private static final int READ_TIMEOUT_MS = 5000;

    private final Socket socket;
    private final BufferedReader in;
    private final PrintWriter out;

    LineClient(int port) throws IOException {
        this.socket = new Socket("localhost", port);
        socket.setSoTimeout(READ_TIMEOUT_MS);
        this.in = new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.US_ASCII));
        this.out = new PrintWriter(socket.getOutputStream(), true, StandardCharsets.US_ASCII);
    }

    void send(String line) {
        out.print(line + "\n");
        out.flush();
    }

    /**
     * Reads one line, or null once the server has closed the connection.
     */
    String readLine() throws IOException {
        return in.readLine();
    }

    /**
     * Reads until a line starting with the prefix arrives and returns it.
     *
     * @throws IOException if the connection closes first
     */
    String readUntil(String prefix) throws IOException {
        String line;
        while ((line = in.readLine()) != null) {
            if (line.startsWith(prefix)) {
                return line;
            }
        }
        throw new IOException("Connection closed before a line starting with '" + prefix + "'");
    }

    /**
     * Skips to the next snapshot and returns it whole. The number of player
     * lines is taken from the player symbols shown on the grid.
     */
    String readSnapshot() throws IOException {
        StringBuilder sb = new StringBuilder();
        sb.append(readUntil("Grid:")).append('\n');

        int players = 0;
        for (int r = 0; r < 5; r++) {
            String row = in.readLine();
            for (char c : row.toCharArray()) {
                if (c >= 'A' && c <= 'D') {
                    players++;
                }
            }
            sb.append(row).append('\n');
        }
        sb.append(in.readLine()).append('\n');
        for (int i = 0; i < players; i++) {
            sb.append(in.readLine()).append('\n');
        }
        return sb.toString();
    }

    /**
     * Reads snapshots until one does not mention the symbol.
     */
    String readSnapshotWithout(char symbol) throws IOException {
        while (true) {
            String snapshot = readSnapshot();
            if (!snapshot.contains(symbol + ":")) {
                return snapshot;
            }
        }
    }

    /**
     * Waits for the server to close the connection.
     *
     * @return true if the stream ended before the read timeout
     */
    boolean awaitClosed() {
        try {
            while (in.readLine() != null) {
                // drain
            }
            return true;
        } catch (IOException e) {
            return false;
        }
    }

    @Override
    public void close() throws IOException {
        socket.close();
    }
}
