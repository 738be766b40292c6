package io.github.panghy.birpc.rpc.message;

import java.util.Objects;

/**
 * Header of an inbound call as decoded by the transport.
 *
 * <p>The transport owns and allocates requests. The dispatcher reads the address to
 * find the method and uses the sequence number as the key under which the call can
 * be cancelled; it has to be unique among the calls outstanding on a connection.</p>
 *
 * @param serviceMethod The {@code service.method} address
 * @param seq           The sequence number chosen by the caller
 */
public record Request(String serviceMethod, long seq) {
  public Request {
    Objects.requireNonNull(serviceMethod, "Service method cannot be null");
  }
}
