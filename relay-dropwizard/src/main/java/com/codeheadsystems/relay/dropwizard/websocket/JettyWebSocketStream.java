package com.codeheadsystems.relay.dropwizard.websocket;

import com.codeheadsystems.relay.server.connection.QueuedWebSocketStream;
import com.codeheadsystems.relay.server.connection.StreamClosedException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.eclipse.jetty.websocket.api.Session;
import org.eclipse.jetty.websocket.api.StatusCode;
import org.eclipse.jetty.websocket.api.WebSocketListener;
import org.eclipse.jetty.websocket.api.WebSocketPingPongListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Adapts a Jetty WebSocket session to the blocking stream the connection loops expect.
 * <p>
 * Jetty delivers frames through the listener callbacks, which feed the inbound queue of
 * {@link QueuedWebSocketStream}; a full inbound buffer blocks Jetty's thread, which stops it
 * reading further frames until the read loop catches up. Writes block on the session's remote endpoint and wait for
 * the handshake to finish if the write loop gets ahead of it.
 */
public class JettyWebSocketStream extends QueuedWebSocketStream
    implements WebSocketListener, WebSocketPingPongListener {

  private static final Logger log = LoggerFactory.getLogger(JettyWebSocketStream.class);

  private static final long CONNECT_TIMEOUT_SECONDS = 10;

  private final CountDownLatch connected = new CountDownLatch(1);
  private volatile Session session;
  private volatile boolean closeRequested;

  /**
   * Instantiates a new Jetty web socket stream.
   *
   * @param clock           time source for the read deadline
   * @param inboundCapacity messages buffered before Jetty's thread waits for the read loop
   */
  public JettyWebSocketStream(final Clock clock, final int inboundCapacity) {
    super(clock, inboundCapacity);
  }

  @Override
  public void onWebSocketConnect(final Session session) {
    this.session = session;
    connected.countDown();
    log.debug("onWebSocketConnect({})", session.getRemoteAddress());
    if (closeRequested) {
      session.close();
    }
  }

  @Override
  public void onWebSocketText(final String message) {
    receiveText(message);
  }

  @Override
  public void onWebSocketBinary(final byte[] payload, final int offset, final int len) {
    receiveText(new String(payload, offset, len, StandardCharsets.UTF_8));
  }

  @Override
  public void onWebSocketPing(final ByteBuffer payload) {
    // Jetty leaves the pong to listeners that handle pings themselves
    log.trace("onWebSocketPing()");
    try {
      session.getRemote().sendPong(payload);
    } catch (IOException e) {
      log.debug("unable to answer ping: {}", e.getMessage());
    }
  }

  @Override
  public void onWebSocketPong(final ByteBuffer payload) {
    receivePong();
  }

  @Override
  public void onWebSocketClose(final int statusCode, final String reason) {
    log.debug("onWebSocketClose({}, {})", statusCode, reason);
    receiveClose(statusCode, reason);
  }

  @Override
  public void onWebSocketError(final Throwable cause) {
    log.debug("onWebSocketError({})", cause.toString());
    receiveError(cause);
  }

  @Override
  public void writeText(final String text) throws IOException {
    session().getRemote().sendString(text);
  }

  @Override
  public void writePing() throws IOException {
    session().getRemote().sendPing(ByteBuffer.allocate(0));
  }

  @Override
  public void writeClose() throws IOException {
    Session s = session();
    if (s.isOpen()) {
      s.close(StatusCode.NORMAL, null);
    }
  }

  @Override
  public void close() {
    closeRequested = true;
    discardInbound();
    Session s = session;
    if (s != null) {
      s.close();
    } else {
      // a later onWebSocketConnect sees closeRequested; make sure a pending read ends now
      receiveClose(StreamClosedException.ABNORMAL, "closed before connect");
    }
  }

  private Session session() throws IOException {
    Session s = session;
    if (s != null) {
      return s;
    }
    if (closeRequested) {
      throw new IOException("stream closed before the handshake completed");
    }
    try {
      if (!connected.await(CONNECT_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
        throw new IOException("WebSocket handshake did not complete");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IOException("interrupted waiting for WebSocket handshake", e);
    }
    return session;
  }
}
