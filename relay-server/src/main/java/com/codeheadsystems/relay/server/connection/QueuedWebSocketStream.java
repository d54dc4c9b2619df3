package com.codeheadsystems.relay.server.connection;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base {@link WebSocketStream} for callback-driven transports.
 * <p>
 * The transport pushes what it receives through {@link #receiveText}, {@link #receivePong},
 * {@link #receiveClose} and {@link #receiveError}; {@link #readMessage()} hands those events to
 * the read loop one at a time while enforcing the read deadline and read limit. A pong moves
 * the deadline forward even while a read is blocked. Once a read has failed, every later read
 * fails with the same exception.
 * <p>
 * At most {@code inboundCapacity} data messages wait for the read loop. When that many are
 * buffered, {@link #receiveText} blocks the transport's thread until the read loop takes one,
 * so a flooding peer is held back instead of buffered. Once the stream has ended, data
 * messages are discarded.
 * <p>
 * Subclasses implement the write side.
 */
public abstract class QueuedWebSocketStream implements WebSocketStream {

  private static final Logger log = LoggerFactory.getLogger(QueuedWebSocketStream.class);

  private static final long RECEIVE_POLL_MILLIS = 100;

  private final BlockingQueue<Inbound> inbound = new LinkedBlockingQueue<>();
  private final Semaphore textSlots;
  private final Clock clock;

  private volatile Instant readDeadline;
  private volatile Runnable pongHandler = () -> {
  };
  private volatile long readLimit = Long.MAX_VALUE;
  private volatile IOException readFailure;
  private volatile boolean ended;

  /**
   * Instantiates a new Queued web socket stream.
   *
   * @param clock           time source for the read deadline
   * @param inboundCapacity data messages buffered ahead of the reader before the transport waits
   */
  protected QueuedWebSocketStream(final Clock clock, final int inboundCapacity) {
    if (inboundCapacity < 1) {
      throw new IllegalArgumentException("inboundCapacity must be positive: " + inboundCapacity);
    }
    this.clock = clock;
    this.textSlots = new Semaphore(inboundCapacity);
  }

  @Override
  public String readMessage() throws IOException {
    IOException failure = readFailure;
    if (failure != null) {
      throw failure;
    }
    while (true) {
      Instant deadline = readDeadline;
      long waitMillis = Long.MAX_VALUE;
      if (deadline != null) {
        waitMillis = Duration.between(clock.instant(), deadline).toMillis();
        if (waitMillis <= 0) {
          throw fail(new ReadDeadlineExceededException(deadline));
        }
      }
      Inbound next;
      try {
        next = inbound.poll(waitMillis, TimeUnit.MILLISECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw fail(new InterruptedIOException("interrupted while reading"));
      }
      if (next == null) {
        // timed out; the deadline may have moved while we waited
        continue;
      }
      switch (next.kind()) {
        case TEXT:
          textSlots.release();
          long size = next.text().getBytes(StandardCharsets.UTF_8).length;
          if (size > readLimit) {
            throw fail(new MessageTooLargeException(size, readLimit));
          }
          return next.text();
        case CLOSE:
          throw fail(new StreamClosedException(next.closeStatus(), next.text()));
        default:
          throw fail(next.error() instanceof IOException io ? io : new IOException(next.error()));
      }
    }
  }

  @Override
  public void setReadDeadline(final Instant deadline) {
    this.readDeadline = deadline;
  }

  @Override
  public void setPongHandler(final Runnable handler) {
    this.pongHandler = handler;
  }

  @Override
  public void setReadLimit(final long maxBytes) {
    this.readLimit = maxBytes;
  }

  /**
   * Gets the current read limit.
   *
   * @return limit in bytes
   */
  protected long readLimit() {
    return readLimit;
  }

  /**
   * Number of data messages waiting for the read loop.
   *
   * @return the backlog
   */
  int backlog() {
    return (int) inbound.stream().filter(i -> i.kind() == Kind.TEXT).count();
  }

  /**
   * Delivers an inbound data message, waiting while the inbound buffer is full. Returns without
   * queueing if the stream ends first.
   *
   * @param text the message
   */
  protected void receiveText(final String text) {
    boolean acquired = false;
    try {
      while (!ended && !acquired) {
        acquired = textSlots.tryAcquire(RECEIVE_POLL_MILLIS, TimeUnit.MILLISECONDS);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.debug("interrupted waiting for inbound capacity, discarding message");
      return;
    }
    if (ended) {
      log.trace("stream ended, discarding inbound message");
      if (acquired) {
        textSlots.release();
      }
      return;
    }
    inbound.offer(Inbound.text(text));
  }

  /**
   * Stops accepting data messages. Messages already buffered stay readable; a transport thread
   * waiting in {@link #receiveText} gives up.
   */
  protected void discardInbound() {
    ended = true;
  }

  /**
   * Delivers an inbound pong.
   */
  protected void receivePong() {
    pongHandler.run();
  }

  /**
   * Delivers the end of the stream.
   *
   * @param statusCode close status code
   * @param reason     close reason, may be null
   */
  protected void receiveClose(final int statusCode, final String reason) {
    ended = true;
    inbound.offer(Inbound.close(statusCode, reason));
  }

  /**
   * Delivers a transport failure.
   *
   * @param error the failure
   */
  protected void receiveError(final Throwable error) {
    ended = true;
    inbound.offer(Inbound.error(error));
  }

  private IOException fail(final IOException e) {
    readFailure = e;
    ended = true;
    inbound.clear();
    return e;
  }

  private enum Kind { TEXT, CLOSE, ERROR }

  private record Inbound(Kind kind, String text, int closeStatus, Throwable error) {

    static Inbound text(String text) {
      return new Inbound(Kind.TEXT, text, 0, null);
    }

    static Inbound close(int status, String reason) {
      return new Inbound(Kind.CLOSE, reason, status, null);
    }

    static Inbound error(Throwable error) {
      return new Inbound(Kind.ERROR, null, 0, error);
    }
  }
}
