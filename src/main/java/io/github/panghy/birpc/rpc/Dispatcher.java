package io.github.panghy.birpc.rpc;

import io.github.panghy.birpc.core.CancellationToken;
import io.github.panghy.birpc.core.PendingRequestTable;
import io.github.panghy.birpc.rpc.cancel.PendingTableAware;
import io.github.panghy.birpc.rpc.error.RpcAddressException;
import io.github.panghy.birpc.rpc.error.RpcException;
import io.github.panghy.birpc.rpc.message.CodecResponseSink;
import io.github.panghy.birpc.rpc.message.Request;
import io.github.panghy.birpc.rpc.message.ResponseSink;
import io.github.panghy.birpc.rpc.message.ServerCodec;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Phaser;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

import static io.github.panghy.birpc.util.LoggingUtil.debug;
import static io.github.panghy.birpc.util.LoggingUtil.error;
import static io.github.panghy.birpc.util.LoggingUtil.warn;

/**
 * Invokes service methods for one connection.
 *
 * <p>The dispatcher has two ways of running a call:</p>
 * <ul>
 *   <li>{@link #call} runs it synchronously on the caller's thread. The caller owns the
 *   token and every argument and gets the method's exception back unchanged.</li>
 *   <li>{@link #dispatch} runs a call that arrived from the wire on the dispatcher's
 *   executor. It registers the request's sequence number with the pending request
 *   table for the duration of the call, so the peer can cancel it through the
 *   cancel service, and hands the outcome to the {@link ResponseSink}.</li>
 * </ul>
 *
 * <p>Whatever happens inside a dispatched call, including an {@link Error} thrown by
 * the method, the token is released, the completion tracker is notified and exactly
 * one response is written. Responses of concurrent calls are written under one lock
 * per dispatcher, so they never interleave; their order is not defined.</p>
 */
public class Dispatcher implements AutoCloseable {

  private static final Logger LOGGER = Logger.getLogger(Dispatcher.class.getName());

  private final PendingRequestTable pending;
  private final ServerCodec codec;
  private final ResponseSink sink;
  private final Executor executor;
  // Only set when the dispatcher created its executor and has to shut it down
  private final ExecutorService ownedExecutor;
  private final RpcConfiguration config;
  private final Lock sendLock = new ReentrantLock();

  /**
   * Creates a dispatcher writing through the codec with its own thread pool.
   *
   * @param pending The pending request table of the connection
   * @param codec   The codec of the connection
   */
  public Dispatcher(PendingRequestTable pending, ServerCodec codec) {
    this(pending, codec, RpcConfiguration.defaultConfig());
  }

  /**
   * Creates a dispatcher writing through the codec with its own thread pool.
   *
   * @param pending The pending request table of the connection
   * @param codec   The codec of the connection
   * @param config  The configuration
   */
  public Dispatcher(PendingRequestTable pending, ServerCodec codec, RpcConfiguration config) {
    this(pending, codec, new CodecResponseSink(), newDispatchExecutor(config), true, config);
  }

  /**
   * Creates a dispatcher running calls on the given executor. The executor is not
   * shut down by {@link #close()}.
   *
   * @param pending  The pending request table of the connection
   * @param codec    The codec of the connection
   * @param sink     Where responses are delivered
   * @param executor The executor running dispatched calls
   * @param config   The configuration
   */
  public Dispatcher(PendingRequestTable pending, ServerCodec codec, ResponseSink sink,
                    Executor executor, RpcConfiguration config) {
    this(pending, codec, sink, executor, false, config);
  }

  private Dispatcher(PendingRequestTable pending, ServerCodec codec, ResponseSink sink,
                     Executor executor, boolean ownsExecutor, RpcConfiguration config) {
    this.pending = pending;
    this.codec = codec;
    this.sink = sink;
    this.executor = executor;
    this.ownedExecutor = ownsExecutor ? (ExecutorService) executor : null;
    this.config = config;
  }

  private static ExecutorService newDispatchExecutor(RpcConfiguration config) {
    String prefix = config.getDispatchThreadNamePrefix();
    AtomicInteger counter = new AtomicInteger();
    return Executors.newCachedThreadPool(runnable -> {
      Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    });
  }

  /**
   * Calls a method synchronously. No pending request table is involved.
   *
   * @see Service#call(CancellationToken, ClientConnector, String, Object, Object)
   */
  public void call(Service service, CancellationToken token, ClientConnector client, String address,
                   Object argument, Object reply) throws Exception {
    service.call(token, client, address, argument, reply);
  }

  /**
   * Serves a request that arrived from the wire: resolves its address, allocates the
   * argument and reply, lets the codec decode the body and dispatches the call.
   *
   * <p>If the address does not resolve or the body cannot be decoded, the body is
   * discarded and an error response is written right away on the calling thread;
   * this method never throws for a bad request.</p>
   *
   * @param registry The services of this peer
   * @param request  The request header
   * @param client   The connector back to the calling peer
   * @param tracker  Registered party to arrive at when the call is finished, may be null
   * @return A future completing once the response has been handed to the sink
   */
  public CompletableFuture<Void> serve(ServiceRegistry registry, Request request, ClientConnector client,
                                       Phaser tracker) {
    ServiceRegistry.Target target;
    try {
      target = registry.resolve(request.serviceMethod());
    } catch (RpcAddressException e) {
      debug(LOGGER, () -> "Rejecting seq=" + request.seq() + ": " + e.getMessage());
      String errorMessage = e.getMessage();
      try {
        codec.readRequestBody(null);
      } catch (IOException discardFailure) {
        warn(LOGGER, "rpc: discarding body of seq=" + request.seq() + " failed", discardFailure);
        errorMessage = errorMessage + "; " + discardFailure.getMessage();
      }
      return reject(request, errorMessage, tracker);
    }

    ArgumentHolder argument = ValueFactory.makeArgument(target.method());
    Ref<Object> reply = ValueFactory.makeReply(target.method());
    try {
      codec.readRequestBody(argument.ref());
    } catch (IOException | RuntimeException e) {
      warn(LOGGER, "rpc: reading body of seq=" + request.seq() + " failed", e);
      return reject(request, "rpc: reading body: " + e.getMessage(), tracker);
    }
    return dispatch(target.service(), target.method(), request, argument.invocationValue(), reply,
        client, tracker);
  }

  /**
   * Runs a call detached from the caller.
   *
   * <p>The sequence number is registered with the pending request table before the
   * method starts and cancelled once it has returned. If the target is the cancel
   * service, the pending request table is injected into the argument first. The
   * outcome, success or not, is then written through the response sink.</p>
   *
   * @param service  The target service
   * @param method   The target method of that service
   * @param request  The request header
   * @param argument The decoded argument as the method expects it
   * @param reply    The reply holder
   * @param client   The connector back to the calling peer
   * @param tracker  Registered party to arrive at when the call is finished, may be null
   * @return A future completing once the response has been handed to the sink
   */
  public CompletableFuture<Void> dispatch(Service service, MethodDescriptor method, Request request,
                                          Object argument, Object reply, ClientConnector client,
                                          Phaser tracker) {
    CompletableFuture<Void> done = new CompletableFuture<>();
    Runnable task = () -> {
      Throwable failure = null;
      try {
        runCall(service, method, request, argument, reply, client);
      } catch (RuntimeException | Error e) {
        error(LOGGER, "rpc: delivering the response of seq=" + request.seq() + " failed", e);
        failure = e;
      } finally {
        arrive(tracker);
      }
      if (failure == null) {
        done.complete(null);
      } else {
        done.completeExceptionally(failure);
      }
    };
    try {
      executor.execute(task);
    } catch (RejectedExecutionException e) {
      warn(LOGGER, "rpc: dispatcher rejected seq=" + request.seq(), e);
      return reject(request, "rpc: dispatcher is shut down", tracker);
    }
    return done;
  }

  private void runCall(Service service, MethodDescriptor method, Request request,
                       Object argument, Object reply, ClientConnector client) {
    String errorMessage;
    try {
      errorMessage = startAndInvoke(service, method, request, argument, reply, client);
    } catch (RuntimeException | Error e) {
      // Method failures are answered by invoke, so this is the pending table failing
      errorMessage = internalError(request, e);
    }
    try {
      sink.sendResponse(sendLock, request, reply, codec, errorMessage);
    } finally {
      sink.releaseRequest(request);
    }
  }

  private String startAndInvoke(Service service, MethodDescriptor method, Request request,
                                Object argument, Object reply, ClientConnector client) {
    try {
      CancellationToken token = pending.start(request.seq());
      if (service.isCancelService()) {
        injectPendingTable(argument);
      }
      return invoke(service, method, request, token, client, argument, reply);
    } finally {
      pending.cancel(request.seq());
    }
  }

  private String invoke(Service service, MethodDescriptor method, Request request, CancellationToken token,
                        ClientConnector client, Object argument, Object reply) {
    debug(LOGGER, () -> "Invoking " + request.serviceMethod() + " seq=" + request.seq());
    try {
      method.invoke(service.getReceiver(), token, client, argument, reply);
      return "";
    } catch (Error e) {
      return internalError(request, e);
    } catch (Throwable t) {
      if (t instanceof InterruptedException) {
        // The call ends with an error but the worker thread keeps the interrupt
        Thread.currentThread().interrupt();
      }
      debug(LOGGER, () -> request.serviceMethod() + " seq=" + request.seq() + " failed: " + t);
      return errorMessage(t);
    }
  }

  /**
   * Logs a call that was aborted by something other than an exception of the method
   * and builds the error string of its response.
   */
  private static String internalError(Request request, Throwable cause) {
    RpcException aborted = new RpcException(RpcException.ErrorCode.INTERNAL_ERROR,
        "rpc: internal error in " + request.serviceMethod() + ": " + cause, cause);
    error(LOGGER, "rpc: " + request.serviceMethod() + " seq=" + request.seq() + " aborted", aborted);
    return aborted.getMessage();
  }

  private void injectPendingTable(Object argument) {
    Object value = argument instanceof Ref<?> ref ? ref.get() : argument;
    if (value instanceof PendingTableAware aware) {
      aware.setPendingTable(pending);
    }
  }

  /**
   * Answers a request without calling anything.
   */
  private CompletableFuture<Void> reject(Request request, String errorMessage, Phaser tracker) {
    try {
      sink.sendResponse(sendLock, request, CodecResponseSink.INVALID_REQUEST, codec, errorMessage);
    } finally {
      try {
        sink.releaseRequest(request);
      } finally {
        arrive(tracker);
      }
    }
    return CompletableFuture.completedFuture(null);
  }

  private static void arrive(Phaser tracker) {
    if (tracker != null) {
      tracker.arriveAndDeregister();
    }
  }

  /**
   * Turns a method failure into the error string of a response. A failure without a
   * message must still read as an error, so it falls back to the exception's name.
   */
  static String errorMessage(Throwable t) {
    String message = t.getMessage();
    return message == null || message.isEmpty() ? t.toString() : message;
  }

  /**
   * @return The lock serializing response writes of this dispatcher
   */
  public Lock getSendLock() {
    return sendLock;
  }

  public PendingRequestTable getPendingRequestTable() {
    return pending;
  }

  public RpcConfiguration getConfiguration() {
    return config;
  }

  /**
   * Shuts down the executor if this dispatcher created it, waiting up to the
   * configured shutdown timeout for in-flight calls. A supplied executor is left alone.
   */
  @Override
  public void close() {
    if (ownedExecutor == null) {
      return;
    }
    ownedExecutor.shutdown();
    try {
      if (!ownedExecutor.awaitTermination(config.getShutdownTimeoutMs(), TimeUnit.MILLISECONDS)) {
        warn(LOGGER, "Dispatch threads still busy after " + config.getShutdownTimeoutMs()
            + "ms, interrupting them");
        ownedExecutor.shutdownNow();
      }
    } catch (InterruptedException e) {
      ownedExecutor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }
}
