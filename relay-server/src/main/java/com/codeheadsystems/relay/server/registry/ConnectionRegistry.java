package com.codeheadsystems.relay.server.registry;

import com.codeheadsystems.relay.model.Envelope;
import com.codeheadsystems.relay.server.connection.Connection;
import com.codeheadsystems.relay.server.connection.ConnectionId;
import com.codeheadsystems.relay.server.connection.ConnectionSettings;
import com.codeheadsystems.relay.server.connection.WebSocketStream;
import com.codeheadsystems.relay.server.event.EventRouter;
import com.codeheadsystems.relay.server.exception.EventHandlerException;
import com.codeheadsystems.relay.server.exception.OriginRejectedException;
import com.codeheadsystems.relay.server.exception.UnauthorizedException;
import com.codeheadsystems.relay.server.exception.UnsupportedEventException;
import com.codeheadsystems.relay.server.exception.UpgradeFailedException;
import com.codeheadsystems.relay.server.store.TokenStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tracks every live {@link Connection} and mediates admission.
 * <p>
 * The connection set is guarded by a single read/write lock: {@link #admit} and
 * {@link #remove} take the write lock, {@link #size}, {@link #connections} and
 * {@link #broadcast} take the read lock. No lock is held while a handler runs or while a
 * connection's loops block on I/O, so a slow peer or a slow handler never stalls admission or
 * removal of unrelated connections.
 * <p>
 * A connection is registered exactly while it is active: it is added once its stream is
 * upgraded and removed by whichever of its loops exits first.
 */
public class ConnectionRegistry {

  private static final Logger log = LoggerFactory.getLogger(ConnectionRegistry.class);

  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
  private final Map<ConnectionId, Connection> connections = new HashMap<>();

  private final TokenStore tokenStore;
  private final EventRouter eventRouter;
  private final OriginPolicy originPolicy;
  private final ConnectionSettings settings;
  private final ObjectMapper objectMapper;
  private final ThreadFactory threadFactory;
  private final Clock clock;

  private boolean shutdown;

  /**
   * Creates a registry using daemon loop threads and the system clock.
   *
   * @param tokenStore   redeems admission tokens
   * @param eventRouter  handler table for inbound envelopes
   * @param originPolicy which origins may connect
   * @param settings     per-connection limits
   * @param objectMapper envelope codec
   */
  public ConnectionRegistry(final TokenStore tokenStore,
                            final EventRouter eventRouter,
                            final OriginPolicy originPolicy,
                            final ConnectionSettings settings,
                            final ObjectMapper objectMapper) {
    this(tokenStore, eventRouter, originPolicy, settings, objectMapper, r -> {
      Thread t = new Thread(r);
      t.setDaemon(true);
      return t;
    }, Clock.systemUTC());
  }

  /**
   * Creates a registry.
   *
   * @param tokenStore    redeems admission tokens
   * @param eventRouter   handler table for inbound envelopes
   * @param originPolicy  which origins may connect
   * @param settings      per-connection limits
   * @param objectMapper  envelope codec
   * @param threadFactory source of the two loop threads per connection
   * @param clock         time source for deadlines and pings
   */
  public ConnectionRegistry(final TokenStore tokenStore,
                            final EventRouter eventRouter,
                            final OriginPolicy originPolicy,
                            final ConnectionSettings settings,
                            final ObjectMapper objectMapper,
                            final ThreadFactory threadFactory,
                            final Clock clock) {
    this.tokenStore = tokenStore;
    this.eventRouter = eventRouter;
    this.originPolicy = originPolicy;
    this.settings = settings;
    this.objectMapper = objectMapper;
    this.threadFactory = threadFactory;
    this.clock = clock;
  }

  /**
   * Admits a connection: redeems the token, checks the origin, upgrades, registers the new
   * connection and starts its loops.
   * <p>
   * The token is consumed even if a later step fails.
   *
   * @param request  the inbound request
   * @param upgrader performs the protocol switch
   * @return the registered, running connection
   * @throws UnauthorizedException  if the token is missing or not redeemable
   * @throws UpgradeFailedException if the origin is rejected, the registry is shut down, the
   *                                transport could not upgrade or the loops could not start
   */
  public Connection admit(final AdmissionRequest request, final Upgrader upgrader)
      throws UnauthorizedException, UpgradeFailedException {
    String token = request.token()
        .orElseThrow(() -> new UnauthorizedException("Missing admission token"));
    if (!tokenStore.verify(token)) {
      throw new UnauthorizedException("Invalid or expired admission token");
    }
    Optional<String> origin = request.origin();
    if (origin.isPresent() && !originPolicy.allows(origin.get())) {
      throw new OriginRejectedException(origin.get());
    }

    WebSocketStream stream;
    try {
      stream = upgrader.upgrade();
    } catch (IOException e) {
      throw new UpgradeFailedException("Upgrade failed: " + e.getMessage(), e);
    }

    Connection connection = new Connection(ConnectionId.next(), stream, this, settings, objectMapper, clock);
    lock.writeLock().lock();
    try {
      if (shutdown) {
        stream.close();
        throw new UpgradeFailedException("Registry is shut down");
      }
      connections.put(connection.id(), connection);
    } finally {
      lock.writeLock().unlock();
    }
    try {
      connection.start(threadFactory);
    } catch (RuntimeException e) {
      remove(connection);
      throw new UpgradeFailedException("Unable to start connection loops: " + e.getMessage(), e);
    } catch (Error e) {
      log.error("Unable to start loops for {}: {}", connection.id(), e.toString());
      remove(connection);
      throw e;
    }
    log.info("Admitted {}", connection.id());
    return connection;
  }

  /**
   * Removes a connection, closing its stream and mailbox. Safe to call any number of times
   * from any thread; only the first call for a registered connection has an effect.
   *
   * @param connection the connection
   */
  public void remove(final Connection connection) {
    lock.writeLock().lock();
    try {
      if (connections.remove(connection.id()) == null) {
        return;
      }
      connection.closeStream();
      connection.closeMailbox();
      connection.markRemoved();
    } finally {
      lock.writeLock().unlock();
    }
    log.info("Removed {}", connection.id());
  }

  /**
   * Number of live connections.
   *
   * @return the count
   */
  public int size() {
    lock.readLock().lock();
    try {
      return connections.size();
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Whether the connection is currently registered.
   *
   * @param connection the connection
   * @return true if registered
   */
  public boolean contains(final Connection connection) {
    lock.readLock().lock();
    try {
      return connections.containsKey(connection.id());
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Snapshot of the live connections.
   *
   * @return an immutable copy
   */
  public List<Connection> connections() {
    lock.readLock().lock();
    try {
      return List.copyOf(connections.values());
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Routes an inbound envelope to its handler. Runs on the caller's thread with no registry
   * lock held.
   *
   * @param envelope   the envelope
   * @param connection the connection it arrived on
   * @throws UnsupportedEventException if no handler is registered for the type
   * @throws EventHandlerException     if the handler failed
   */
  public void dispatch(final Envelope envelope, final Connection connection)
      throws UnsupportedEventException, EventHandlerException {
    eventRouter.route(envelope, connection);
  }

  /**
   * Queues an envelope on every live connection's mailbox. Never blocks on a slow peer.
   *
   * @param envelope the envelope
   * @return the number of connections that accepted it
   */
  public int broadcast(final Envelope envelope) {
    int delivered = 0;
    for (Connection connection : connections()) {
      if (connection.send(envelope)) {
        delivered++;
      }
    }
    log.debug("Broadcast {} to {} connection(s)", envelope.type(), delivered);
    return delivered;
  }

  /**
   * Refuses further admissions and asks every live connection to close. Each write loop sends
   * a close frame after its queued envelopes, then the connection removes itself.
   */
  public void shutdown() {
    List<Connection> live;
    lock.writeLock().lock();
    try {
      shutdown = true;
      live = List.copyOf(connections.values());
    } finally {
      lock.writeLock().unlock();
    }
    live.forEach(Connection::closeMailbox);
    log.info("Registry shut down, closing {} connection(s)", live.size());
  }
}
