package io.github.panghy.birpc.rpc.message;

import java.io.IOException;

/**
 * The server side of a wire codec.
 *
 * <p>The dispatcher never encodes anything itself. It asks the codec to decode a
 * request body into the holder the method expects and hands the codec to the
 * {@link ResponseSink}, which writes the response with it.</p>
 */
public interface ServerCodec {

  /**
   * Decodes the body of the current request.
   *
   * @param holder The holder to decode into, or {@code null} to read and discard the body
   * @throws IOException if the body cannot be read or decoded
   */
  void readRequestBody(Object holder) throws IOException;

  /**
   * Encodes and writes a response.
   *
   * @param response The response header
   * @param body     The reply value
   * @throws IOException if the response cannot be written
   */
  void writeResponse(Response response, Object body) throws IOException;
}
