package io.github.panghy.birpc.rpc.message;

import java.util.Objects;

/**
 * Header of the response to one {@link Request}.
 *
 * @param serviceMethod The address of the request being answered
 * @param seq           The sequence number of the request being answered
 * @param error         The error message, empty if the call succeeded
 */
public record Response(String serviceMethod, long seq, String error) {
  public Response {
    Objects.requireNonNull(serviceMethod, "Service method cannot be null");
    Objects.requireNonNull(error, "Error cannot be null, use an empty string for success");
  }

  /**
   * @return true if the response reports a failed call
   */
  public boolean isError() {
    return !error.isEmpty();
  }
}
