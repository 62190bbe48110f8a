package com.shipyard.preview;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.time.Duration;

/**
 * Treats a dev server as ready once it accepts a TCP connection on the loopback interface.
 */
public class TcpReadinessProbe implements ReadinessProbe {

    private final Duration connectTimeout;

    public TcpReadinessProbe(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    @Override
    public boolean isReady(int port) {
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress("127.0.0.1", port), (int) connectTimeout.toMillis());
            return true;
        } catch (IOException e) {
            return false;
        }
    }
}
