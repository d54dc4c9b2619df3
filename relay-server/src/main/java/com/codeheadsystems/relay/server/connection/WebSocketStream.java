package com.codeheadsystems.relay.server.connection;

import java.io.IOException;
import java.time.Instant;

/**
 * One physical full-duplex message stream, as seen by a {@link Connection}.
 * <p>
 * Reads are performed only by the connection's read loop and writes only by its write loop,
 * so implementations need not serialize concurrent reads or concurrent writes. The pong
 * handler may be invoked from a transport thread.
 */
public interface WebSocketStream {

  /**
   * Blocks until the next data message arrives.
   *
   * @return the message text
   * @throws StreamClosedException         if the peer closed the stream
   * @throws ReadDeadlineExceededException if the read deadline passed first
   * @throws MessageTooLargeException      if the message exceeds the read limit
   * @throws IOException                   on any other transport failure
   */
  String readMessage() throws IOException;

  /**
   * Sets the instant after which a pending or future read fails.
   *
   * @param deadline the deadline
   */
  void setReadDeadline(Instant deadline);

  /**
   * Installs the callback run whenever a pong control frame arrives.
   *
   * @param handler the handler
   */
  void setPongHandler(Runnable handler);

  /**
   * Sets the largest inbound message accepted.
   *
   * @param maxBytes limit in bytes
   */
  void setReadLimit(long maxBytes);

  /**
   * Writes one text data frame.
   *
   * @param text the frame content
   * @throws IOException if the write fails
   */
  void writeText(String text) throws IOException;

  /**
   * Writes a ping control frame with an empty body.
   *
   * @throws IOException if the write fails
   */
  void writePing() throws IOException;

  /**
   * Writes a close control frame, starting the closing handshake.
   *
   * @throws IOException if the write fails
   */
  void writeClose() throws IOException;

  /**
   * Closes the underlying stream. Must tolerate being called more than once.
   */
  void close();
}
