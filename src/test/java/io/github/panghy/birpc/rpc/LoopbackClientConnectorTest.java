package io.github.panghy.birpc.rpc;

import io.github.panghy.birpc.core.CancellationToken;
import io.github.panghy.birpc.rpc.error.RpcAddressException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for LoopbackClientConnector, including a server calling back into its
 * client while it handles a call.
 */
public class LoopbackClientConnectorTest {

  public static class Greeter {
    public void greet(CancellationToken token, ClientConnector client, String name, Ref<String> reply)
        throws Exception {
      Ref<String> salutation = new Ref<>();
      client.call(token, "Client.salutation", name, salutation);
      reply.set(salutation.get() + ", " + name);
    }
  }

  public static class Client {
    final List<String> asked = new ArrayList<>();

    public void salutation(CancellationToken token, ClientConnector server, String name, Ref<String> reply) {
      asked.add(name);
      reply.set("Hello");
    }
  }

  private Client client;
  private LoopbackClientConnector toServer;

  @BeforeEach
  public void setUp() {
    ServiceRegistry clientServices = new ServiceRegistry();
    ServiceRegistry serverServices = new ServiceRegistry();
    client = new Client();
    clientServices.register(client);
    serverServices.register(new Greeter());
    serverServices.register(new Arith());
    toServer = LoopbackClientConnector.connect(clientServices, serverServices);
  }

  @Test
  public void testPlainCall() throws Exception {
    Ref<Integer> reply = new Ref<>();
    toServer.call(new CancellationToken(), "Arith.add", new Arith.Args(2, 3), reply);
    assertEquals(5, reply.get());
  }

  @Test
  public void testServerCallsBackMidRequest() throws Exception {
    Ref<String> reply = new Ref<>();
    toServer.call(new CancellationToken(), "Greeter.greet", "Ada", reply);

    assertEquals("Hello, Ada", reply.get());
    assertEquals(List.of("Ada"), client.asked);
  }

  @Test
  public void testConnectorsArePaired() {
    assertSame(toServer, toServer.reverse().reverse());
  }

  @Test
  public void testErrorsPropagateToCaller() {
    assertThrows(ArithmeticException.class,
        () -> toServer.call(new CancellationToken(), "Arith.divide", new Arith.Args(1, 0), new Ref<Integer>()));
    assertThrows(RpcAddressException.class,
        () -> toServer.call(new CancellationToken(), "Client.salutation", "Ada", new Ref<String>()));
  }
}
