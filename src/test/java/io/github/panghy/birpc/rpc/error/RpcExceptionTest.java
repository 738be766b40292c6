package io.github.panghy.birpc.rpc.error;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for RpcException and its subclasses.
 */
public class RpcExceptionTest {

  @Test
  public void testErrorCodes() {
    assertEquals(1000, RpcException.ErrorCode.UNKNOWN.getCode());
    assertEquals(1001, RpcException.ErrorCode.REGISTRATION_ERROR.getCode());
    assertEquals(1002, RpcException.ErrorCode.ADDRESS_ERROR.getCode());
    assertEquals(1003, RpcException.ErrorCode.INVOCATION_ERROR.getCode());
    assertEquals(1004, RpcException.ErrorCode.CANCELLED.getCode());
    assertEquals(1005, RpcException.ErrorCode.INTERNAL_ERROR.getCode());
  }

  @Test
  public void testFromCode() {
    for (RpcException.ErrorCode code : RpcException.ErrorCode.values()) {
      assertEquals(code, RpcException.ErrorCode.fromCode(code.getCode()));
    }
    assertEquals(RpcException.ErrorCode.UNKNOWN, RpcException.ErrorCode.fromCode(42));
  }

  @Test
  public void testConstructors() {
    RpcException bare = new RpcException(RpcException.ErrorCode.CANCELLED);
    assertEquals("RPC error: CANCELLED", bare.getMessage());
    assertEquals(1004, bare.getErrorCodeValue());

    IOException cause = new IOException("io");
    RpcException wrapped = new RpcException(RpcException.ErrorCode.INVOCATION_ERROR, "failed", cause);
    assertEquals("failed", wrapped.getMessage());
    assertSame(cause, wrapped.getCause());
    assertEquals(RpcException.ErrorCode.INVOCATION_ERROR, wrapped.getErrorCode());
  }

  @Test
  public void testToString() {
    RpcException e = new RpcException(RpcException.ErrorCode.INTERNAL_ERROR, "bad");
    assertEquals("RpcException{errorCode=INTERNAL_ERROR, message='bad'}", e.toString());
  }

  @Test
  public void testRegistrationException() {
    RpcRegistrationException e = new RpcRegistrationException(
        RpcRegistrationException.Reason.NO_SUITABLE_METHODS, "Arith", "no methods");
    assertEquals(RpcException.ErrorCode.REGISTRATION_ERROR, e.getErrorCode());
    assertEquals(RpcRegistrationException.Reason.NO_SUITABLE_METHODS, e.getReason());
    assertEquals("Arith", e.getServiceName());
    assertFalse(e.hasHint());

    RpcRegistrationException hinted = new RpcRegistrationException(
        RpcRegistrationException.Reason.NO_SUITABLE_METHODS, "Class", "no methods (hint)", true);
    assertTrue(hinted.hasHint());
  }

  @Test
  public void testAddressExceptionFactories() {
    RpcAddressException illFormed = RpcAddressException.illFormed("nodot");
    assertEquals(RpcAddressException.Reason.ILL_FORMED, illFormed.getReason());
    assertEquals("nodot", illFormed.getAddress());
    assertEquals("rpc: service/method request ill-formed: nodot", illFormed.getMessage());
    assertEquals(RpcException.ErrorCode.ADDRESS_ERROR, illFormed.getErrorCode());

    RpcAddressException unknownService = RpcAddressException.unknownService("Nope.add");
    assertEquals(RpcAddressException.Reason.UNKNOWN_SERVICE, unknownService.getReason());
    assertEquals("rpc: can't find service Nope.add", unknownService.getMessage());

    RpcAddressException unknownMethod = RpcAddressException.unknownMethod("Arith.nope");
    assertEquals(RpcAddressException.Reason.UNKNOWN_METHOD, unknownMethod.getReason());
    assertEquals("rpc: can't find method Arith.nope", unknownMethod.getMessage());
  }
}
