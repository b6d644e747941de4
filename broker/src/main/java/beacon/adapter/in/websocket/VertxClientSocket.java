package beacon.adapter.in.websocket;

import io.vertx.core.http.ServerWebSocket;

import beacon.core.port.out.ClientSocket;

/**
 * {@link ClientSocket} over a Vert.x server WebSocket.
 *
 * <p>Writes are queued by Vert.x and never block. A frame is refused when the socket is closed
 * or its write queue is full, so a slow client cannot grow the queue without bound.
 */
public final class VertxClientSocket implements ClientSocket {

    private final ServerWebSocket socket;

    public VertxClientSocket(ServerWebSocket socket) {
        this.socket = socket;
    }

    @Override
    public boolean send(String frame) {
        if (socket.isClosed() || socket.writeQueueFull()) {
            return false;
        }
        socket.writeTextMessage(frame);
        return true;
    }

    @Override
    public void close(short code, String reason) {
        if (!socket.isClosed()) {
            socket.close(code, reason);
        }
    }

    @Override
    public boolean isOpen() {
        return !socket.isClosed();
    }
}
