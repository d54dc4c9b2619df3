package com.codeheadsystems.relay.server.connection;

import com.codeheadsystems.relay.model.Envelope;
import com.codeheadsystems.relay.server.exception.DecodeException;
import com.codeheadsystems.relay.server.exception.EventHandlerException;
import com.codeheadsystems.relay.server.exception.UnsupportedEventException;
import com.codeheadsystems.relay.server.registry.ConnectionRegistry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One admitted WebSocket peer.
 * <p>
 * Each connection runs exactly two threads for its lifetime:
 * <ul>
 *   <li>the <em>read loop</em> decodes inbound envelopes and dispatches them through the
 *       registry, keeping the read deadline alive on every pong;</li>
 *   <li>the <em>write loop</em> drains the outbound mailbox in order and sends a ping every
 *       {@link ConnectionSettings#pingInterval()}.</li>
 * </ul>
 * Whichever loop exits first asks the registry to remove the connection; the second request is
 * a no-op. Removal closes the stream, which ends a blocked read, and closes the mailbox, which
 * makes the write loop send a close frame and end.
 */
public class Connection {

  private static final Logger log = LoggerFactory.getLogger(Connection.class);

  // Mailbox sentinel, compared by identity.
  private static final Envelope CLOSE_SIGNAL = new Envelope(null, null);

  private final ConnectionId id;
  private final WebSocketStream stream;
  private final ConnectionRegistry registry;
  private final ConnectionSettings settings;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  private final BlockingQueue<Envelope> mailbox = new LinkedBlockingQueue<>();
  private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.ADMITTED);
  private final AtomicBoolean streamClosed = new AtomicBoolean();
  private final CountDownLatch loopsExited = new CountDownLatch(2);
  private boolean mailboxClosed;

  /**
   * Instantiates a new Connection. The loops are not started until {@link #start}.
   *
   * @param id           the connection identity
   * @param stream       the upgraded stream
   * @param registry     the owning registry
   * @param settings     liveness and size limits
   * @param objectMapper codec for envelopes
   * @param clock        time source for deadlines and pings
   */
  public Connection(final ConnectionId id,
                    final WebSocketStream stream,
                    final ConnectionRegistry registry,
                    final ConnectionSettings settings,
                    final ObjectMapper objectMapper,
                    final Clock clock) {
    this.id = id;
    this.stream = stream;
    this.registry = registry;
    this.settings = settings;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  /**
   * Gets the identity.
   *
   * @return the id
   */
  public ConnectionId id() {
    return id;
  }

  /**
   * Gets the owning registry, for handlers that fan out to other connections.
   *
   * @return the registry
   */
  public ConnectionRegistry registry() {
    return registry;
  }

  /**
   * Gets the lifecycle state.
   *
   * @return the state
   */
  public ConnectionState state() {
    return state.get();
  }

  /**
   * Starts the read and write loops on two new threads.
   *
   * @param threadFactory source of the loop threads
   */
  public void start(final ThreadFactory threadFactory) {
    if (!state.compareAndSet(ConnectionState.ADMITTED, ConnectionState.ACTIVE)) {
      throw new IllegalStateException(id + " already started (state " + state.get() + ")");
    }
    Thread reader = threadFactory.newThread(this::readLoop);
    reader.setName("relay-read-" + id.value());
    Thread writer = threadFactory.newThread(this::writeLoop);
    writer.setName("relay-write-" + id.value());
    reader.start();
    writer.start();
    log.debug("Started loops for {}", id);
  }

  /**
   * Queues an envelope for delivery to the peer. Envelopes are written in the order they are
   * queued.
   *
   * @param envelope the envelope
   * @return false if the connection is shutting down or its mailbox is full
   */
  public boolean send(final Envelope envelope) {
    synchronized (mailbox) {
      if (mailboxClosed) {
        return false;
      }
      if (mailbox.size() >= settings.mailboxCapacity()) {
        log.warn("Mailbox full for {}, dropping {} envelope", id, envelope.type());
        return false;
      }
      return mailbox.offer(envelope);
    }
  }

  /**
   * Queues an envelope built from a type tag and a payload object.
   *
   * @param type    the event type
   * @param payload the payload, converted to a JSON tree
   * @return false if the envelope was not queued
   */
  public boolean send(final String type, final Object payload) {
    return send(new Envelope(type, objectMapper.valueToTree(payload)));
  }

  /**
   * Stops accepting envelopes and tells the write loop to send a close frame once the envelopes
   * already queued have been written. Idempotent.
   */
  public void closeMailbox() {
    synchronized (mailbox) {
      if (mailboxClosed) {
        return;
      }
      mailboxClosed = true;
      mailbox.offer(CLOSE_SIGNAL);
    }
  }

  /**
   * Closes the underlying stream exactly once, however many times it is called.
   */
  public void closeStream() {
    if (streamClosed.compareAndSet(false, true)) {
      stream.close();
      log.debug("Closed stream of {}", id);
    }
  }

  /**
   * Marks the connection as removed from its registry.
   */
  public void markRemoved() {
    state.set(ConnectionState.REMOVED);
  }

  /**
   * Waits until both loops have exited.
   *
   * @param timeout how long to wait
   * @return true if both loops exited in time
   * @throws InterruptedException if interrupted while waiting
   */
  public boolean awaitTermination(final Duration timeout) throws InterruptedException {
    return loopsExited.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  void readLoop() {
    try {
      stream.setReadLimit(settings.maxMessageBytes());
      stream.setReadDeadline(clock.instant().plus(settings.pongWait()));
      stream.setPongHandler(this::onPong);
      while (true) {
        String text;
        try {
          text = stream.readMessage();
        } catch (StreamClosedException e) {
          if (e.isExpected()) {
            log.debug("{} closed by peer: {}", id, e.getMessage());
          } else {
            log.warn("error reading a message on {}: {}", id, e.getMessage());
          }
          break;
        } catch (ReadDeadlineExceededException e) {
          log.info("{} missed its pong deadline, dropping", id);
          break;
        } catch (IOException e) {
          log.warn("error reading a message on {}: {}", id, e.getMessage());
          break;
        }

        Envelope envelope;
        try {
          envelope = decode(text);
        } catch (DecodeException e) {
          log.warn("error decoding message on {}, closing: {}", id, e.getMessage());
          break;
        }

        try {
          registry.dispatch(envelope, this);
        } catch (UnsupportedEventException | EventHandlerException e) {
          log.warn("error handling {} on {}: {}", envelope.type(), id, e.getMessage());
        }
      }
    } finally {
      loopExited("read");
    }
  }

  void writeLoop() {
    Instant nextPing = clock.instant().plus(settings.pingInterval());
    try {
      while (true) {
        if (!clock.instant().isBefore(nextPing)) {
          try {
            stream.writePing();
            log.trace("ping {}", id);
          } catch (IOException e) {
            log.debug("ping failed on {}: {}", id, e.getMessage());
            break;
          }
          nextPing = clock.instant().plus(settings.pingInterval());
        }

        long waitMillis = Math.max(0, Duration.between(clock.instant(), nextPing).toMillis());
        Envelope next;
        try {
          next = mailbox.poll(waitMillis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          break;
        }
        if (next == null) {
          continue;
        }
        if (next == CLOSE_SIGNAL) {
          try {
            stream.writeClose();
          } catch (IOException e) {
            log.debug("connection closed: {}", e.getMessage());
          }
          break;
        }

        if (streamClosed.get()) {
          log.debug("stream of {} closed, discarding {} envelope", id, next.type());
          continue;
        }
        String data;
        try {
          data = objectMapper.writeValueAsString(next);
        } catch (JsonProcessingException e) {
          log.warn("unable to encode {} envelope for {}, closing: {}", next.type(), id, e.getMessage());
          break;
        }
        try {
          stream.writeText(data);
        } catch (IOException e) {
          log.warn("error writing to {}: {}", id, e.getMessage());
        }
      }
    } finally {
      loopExited("write");
    }
  }

  private void onPong() {
    log.trace("pong {}", id);
    stream.setReadDeadline(clock.instant().plus(settings.pongWait()));
  }

  private Envelope decode(final String text) throws DecodeException {
    Envelope envelope;
    try {
      envelope = objectMapper.readValue(text, Envelope.class);
    } catch (JsonProcessingException e) {
      throw new DecodeException("malformed envelope", e);
    }
    if (envelope == null) {
      throw new DecodeException("empty envelope", null);
    }
    return envelope;
  }

  private void loopExited(final String loop) {
    state.compareAndSet(ConnectionState.ACTIVE, ConnectionState.CLOSING);
    try {
      registry.remove(this);
    } finally {
      loopsExited.countDown();
      log.debug("{} loop of {} exited", loop, id);
    }
  }

  @Override
  public String toString() {
    return id.toString();
  }
}
