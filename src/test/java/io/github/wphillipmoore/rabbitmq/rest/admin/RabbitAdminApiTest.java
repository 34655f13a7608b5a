package io.github.wphillipmoore.rabbitmq.rest.admin;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.github.wphillipmoore.rabbitmq.rest.admin.auth.BasicAuth;
import io.github.wphillipmoore.rabbitmq.rest.admin.exception.RabbitRestArgumentException;
import io.github.wphillipmoore.rabbitmq.rest.admin.exception.RabbitRestResponseException;
import io.github.wphillipmoore.rabbitmq.rest.admin.model.ExchangeDefinition;
import io.github.wphillipmoore.rabbitmq.rest.admin.model.PasswordHash;
import io.github.wphillipmoore.rabbitmq.rest.admin.model.PermissionGrant;
import io.github.wphillipmoore.rabbitmq.rest.admin.model.PlainPassword;
import io.github.wphillipmoore.rabbitmq.rest.admin.model.PolicyDefinition;
import io.github.wphillipmoore.rabbitmq.rest.admin.model.QueueDefinition;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RabbitAdminApiTest {

  private static final String BASE_URL = "http://localhost:15672";

  @Mock private RabbitRestTransport transport;

  private RabbitAdminApi api;

  @BeforeEach
  void setUp() {
    ResourceClient client =
        new ResourceClient.Builder(BASE_URL, new BasicAuth("guest", "guest"))
            .transport(transport)
            .build();
    api = new RabbitAdminApi(client);
  }

  private void respondWith(int statusCode, String body) {
    when(transport.send(anyString(), anyString(), any(), anyMap(), any(), anyBoolean()))
        .thenReturn(
            CompletableFuture.completedFuture(new TransportResponse(statusCode, body, Map.of())));
  }

  private SentRequest sent() {
    ArgumentCaptor<String> method = ArgumentCaptor.forClass(String.class);
    ArgumentCaptor<String> url = ArgumentCaptor.forClass(String.class);
    ArgumentCaptor<String> payload = ArgumentCaptor.forClass(String.class);
    @SuppressWarnings("unchecked")
    ArgumentCaptor<Map<String, String>> headers = ArgumentCaptor.forClass(Map.class);
    verify(transport)
        .send(
            method.capture(),
            url.capture(),
            payload.capture(),
            headers.capture(),
            any(),
            anyBoolean());
    return new SentRequest(
        method.getValue(), url.getValue(), payload.getValue(), headers.getValue());
  }

  private SentRequest read(String body, Supplier<CompletableFuture<?>> call) {
    respondWith(200, body);
    call.get().join();
    return sent();
  }

  private SentRequest write(Supplier<CompletableFuture<Void>> call) {
    respondWith(204, "");
    assertThat(call.get().join()).isNull();
    return sent();
  }

  record SentRequest(String method, String url, String payload, Map<String, String> headers) {

    void isGet(String path) {
      assertThat(method).isEqualTo("GET");
      assertThat(url).isEqualTo(BASE_URL + path);
      assertThat(payload).isNull();
    }
  }

  @Nested
  class Construction {

    @Test
    void nullClientThrowsNullPointerException() {
      assertThatThrownBy(() -> new RabbitAdminApi(null))
          .isInstanceOf(NullPointerException.class)
          .hasMessage("client");
    }

    @Test
    void connectBuildsClientWithDefaults() {
      RabbitAdminApi connected =
          RabbitAdminApi.connect(BASE_URL + "/", new BasicAuth("guest", "guest"));

      assertThat(connected.getClient().getConfig().baseUrl()).isEqualTo(BASE_URL);
      assertThat(connected.getClient().getConfig().verifyTls()).isTrue();
    }
  }

  @Nested
  class ClusterAndDefinitions {

    @Test
    void overview() {
      respondWith(200, "{\"rabbitmq_version\":\"3.13.0\"}");

      Map<String, Object> overview = api.overview().join();

      assertThat(overview).containsEntry("rabbitmq_version", "3.13.0");
      sent().isGet("/api/overview");
    }

    @Test
    void getClusterName() {
      read("{\"name\":\"rabbit@rabbit1\"}", api::getClusterName).isGet("/api/cluster-name");
    }

    @Test
    void listNodes() {
      respondWith(200, "[{\"name\":\"rabbit@rabbit1\"}]");

      List<Map<String, Object>> nodes = api.listNodes().join();

      assertThat(nodes).hasSize(1);
      assertThat(nodes.get(0)).containsEntry("name", "rabbit@rabbit1");
      sent().isGet("/api/nodes");
    }

    @Test
    void getNodeEncodesName() {
      read("{}", () -> api.getNode("rabbit@rabbit1")).isGet("/api/nodes/rabbit%40rabbit1");
    }

    @Test
    void listExtensions() {
      respondWith(200, "[{\"javascript\":\"dispatcher.js\"}]");

      assertThat(api.listExtensions().join())
          .containsExactly(Map.of("javascript", "dispatcher.js"));
    }

    @Test
    void getDefinitions() {
      read("{\"users\":[],\"vhosts\":[]}", api::getDefinitions).isGet("/api/definitions");
    }

    @Test
    void postDefinitionsSendsDocument() {
      SentRequest request = write(() -> api.postDefinitions(Map.of("users", List.of())));

      assertThat(request.method()).isEqualTo("POST");
      assertThat(request.url()).isEqualTo(BASE_URL + "/api/definitions");
      assertThat(request.payload()).isEqualTo("{\"users\":[]}");
    }

    @Test
    void getDefinitionsForVhost() {
      read("{}", () -> api.getDefinitionsForVhost("/")).isGet("/api/definitions/%2F");
    }

    @Test
    void postDefinitionsForVhost() {
      SentRequest request =
          write(() -> api.postDefinitionsForVhost("orders", Map.of("queues", List.of())));

      assertThat(request.method()).isEqualTo("POST");
      assertThat(request.url()).isEqualTo(BASE_URL + "/api/definitions/orders");
    }
  }

  @Nested
  class ConnectionsAndChannels {

    @Test
    void listConnections() {
      read("[]", api::listConnections).isGet("/api/connections");
    }

    @Test
    void listConnectionsForVhost() {
      read("[]", () -> api.listConnectionsForVhost("/")).isGet("/api/vhosts/%2F/connections");
    }

    @Test
    void getConnectionEncodesName() {
      read("{}", () -> api.getConnection("127.0.0.1:5000 -> 127.0.0.1:5672"))
          .isGet("/api/connections/127.0.0.1%3A5000%20-%3E%20127.0.0.1%3A5672");
    }

    @Test
    void deleteConnectionWithoutReason() {
      SentRequest request = write(() -> api.deleteConnection("c1"));

      assertThat(request.method()).isEqualTo("DELETE");
      assertThat(request.url()).isEqualTo(BASE_URL + "/api/connections/c1");
      assertThat(request.headers()).doesNotContainKey("X-Reason");
    }

    @Test
    void deleteConnectionWithReasonSetsHeader() {
      SentRequest request = write(() -> api.deleteConnection("c1", "I don't like you"));

      assertThat(request.headers()).containsEntry("X-Reason", "I don't like you");
      assertThat(request.payload()).isNull();
    }

    @Test
    void listConnectionChannels() {
      read("[]", () -> api.listConnectionChannels("c1")).isGet("/api/connections/c1/channels");
    }

    @Test
    void listChannels() {
      read("[]", api::listChannels).isGet("/api/channels");
    }

    @Test
    void listChannelsForVhost() {
      read("[]", () -> api.listChannelsForVhost("v1")).isGet("/api/vhosts/v1/channels");
    }

    @Test
    void getChannel() {
      read("{}", () -> api.getChannel("c1 (1)")).isGet("/api/channels/c1%20%281%29");
    }

    @Test
    void listConsumers() {
      read("[]", api::listConsumers).isGet("/api/consumers");
    }

    @Test
    void listConsumersForVhost() {
      read("[]", () -> api.listConsumersForVhost("/")).isGet("/api/consumers/%2F");
    }
  }

  @Nested
  class Exchanges {

    @Test
    void listExchanges() {
      read("[]", api::listExchanges).isGet("/api/exchanges");
    }

    @Test
    void listExchangesForVhost() {
      read("[]", () -> api.listExchangesForVhost("/")).isGet("/api/exchanges/%2F");
    }

    @Test
    void getExchangeForVhostPutsVhostFirst() {
      read("{}", () -> api.getExchangeForVhost("myexchange", "/"))
          .isGet("/api/exchanges/%2F/myexchange");
    }

    @Test
    void createExchangeForVhostSendsDefinition() {
      SentRequest request =
          write(
              () ->
                  api.createExchangeForVhost(
                      "myexchange",
                      "/",
                      new ExchangeDefinition("direct", false, false, false, Map.of())));

      assertThat(request.method()).isEqualTo("PUT");
      assertThat(request.url()).isEqualTo(BASE_URL + "/api/exchanges/%2F/myexchange");
      assertThat(request.payload())
          .isEqualTo(
              "{\"type\":\"direct\",\"durable\":false,\"auto_delete\":false,"
                  + "\"internal\":false,\"arguments\":{}}");
    }

    @Test
    void deleteExchangeForVhost() {
      SentRequest request = write(() -> api.deleteExchangeForVhost("myexchange", "/"));

      assertThat(request.method()).isEqualTo("DELETE");
      assertThat(request.url()).isEqualTo(BASE_URL + "/api/exchanges/%2F/myexchange");
    }
  }

  @Nested
  class Queues {

    @Test
    void listQueues() {
      read("[]", api::listQueues).isGet("/api/queues");
    }

    @Test
    void listQueuesForVhost() {
      read("[]", () -> api.listQueuesForVhost("/")).isGet("/api/queues/%2F");
    }

    @Test
    void getQueueForVhost() {
      read("{}", () -> api.getQueueForVhost("test_queue", "/"))
          .isGet("/api/queues/%2F/test_queue");
    }

    @Test
    void createQueueForVhostSendsDefinition() {
      SentRequest request =
          write(
              () ->
                  api.createQueueForVhost(
                      "q1",
                      "/",
                      new QueueDefinition(true, false, Map.of("x-queue-type", "quorum"))));

      assertThat(request.method()).isEqualTo("PUT");
      assertThat(request.url()).isEqualTo(BASE_URL + "/api/queues/%2F/q1");
      assertThat(request.payload())
          .isEqualTo(
              "{\"durable\":true,\"auto_delete\":false,"
                  + "\"arguments\":{\"x-queue-type\":\"quorum\"}}");
    }

    @Test
    void deleteQueueForVhost() {
      SentRequest request = write(() -> api.deleteQueueForVhost("q1", "/"));

      assertThat(request.method()).isEqualTo("DELETE");
      assertThat(request.url()).isEqualTo(BASE_URL + "/api/queues/%2F/q1");
    }

    @Test
    void purgeQueueDeletesContents() {
      SentRequest request = write(() -> api.purgeQueue("q1", "/"));

      assertThat(request.method()).isEqualTo("DELETE");
      assertThat(request.url()).isEqualTo(BASE_URL + "/api/queues/%2F/q1/contents");
    }
  }

  @Nested
  class Bindings {

    @Test
    void listBindings() {
      read("[]", api::listBindings).isGet("/api/bindings");
    }

    @Test
    void listBindingsForVhost() {
      read("[]", () -> api.listBindingsForVhost("/")).isGet("/api/bindings/%2F");
    }

    @Test
    void listBindingsForQueue() {
      read("[]", () -> api.listBindingsForQueue("/", "q1")).isGet("/api/queues/%2F/q1/bindings");
    }

    @Test
    void createQueueBindingPostsRoutingKey() {
      SentRequest request =
          write(() -> api.createQueueBinding("/", "amq.direct", "q1", "orders.*", Map.of()));

      assertThat(request.method()).isEqualTo("POST");
      assertThat(request.url()).isEqualTo(BASE_URL + "/api/bindings/%2F/e/amq.direct/q/q1");
      assertThat(request.payload()).isEqualTo("{\"routing_key\":\"orders.*\",\"arguments\":{}}");
    }
  }

  @Nested
  class Vhosts {

    @Test
    void listVhosts() {
      read("[{\"name\":\"/\"}]", api::listVhosts).isGet("/api/vhosts");
    }

    @Test
    void getVhostEncodesSlash() {
      read("{\"name\":\"/\"}", () -> api.getVhost("/")).isGet("/api/vhosts/%2F");
    }

    @Test
    void createVhostWithoutTracingSendsNoBody() {
      SentRequest request = write(() -> api.createVhost("vhost2"));

      assertThat(request.method()).isEqualTo("PUT");
      assertThat(request.url()).isEqualTo(BASE_URL + "/api/vhosts/vhost2");
      assertThat(request.payload()).isNull();
    }

    @Test
    void createVhostWithTracingSendsFlag() {
      SentRequest request = write(() -> api.createVhost("vhost2", true));

      assertThat(request.payload()).isEqualTo("{\"tracing\":true}");
      assertThat(request.headers()).containsEntry("Content-Type", "application/json");
    }

    @Test
    void createVhostWithTracingDisabledStillSendsFlag() {
      SentRequest request = write(() -> api.createVhost("vhost2", false));

      assertThat(request.payload()).isEqualTo("{\"tracing\":false}");
    }

    @Test
    void deleteVhost() {
      SentRequest request = write(() -> api.deleteVhost("vhost2"));

      assertThat(request.method()).isEqualTo("DELETE");
      assertThat(request.url()).isEqualTo(BASE_URL + "/api/vhosts/vhost2");
    }

    @Test
    void listPermissionsForVhost() {
      read("[]", () -> api.listPermissionsForVhost("/")).isGet("/api/vhosts/%2F/permissions");
    }
  }

  @Nested
  class Users {

    @Test
    void listUsers() {
      read("[]", api::listUsers).isGet("/api/users");
    }

    @Test
    void getUser() {
      respondWith(200, "{\"name\":\"guest\",\"tags\":\"administrator\"}");

      assertThat(api.getUser("guest").join()).containsEntry("tags", "administrator");
      sent().isGet("/api/users/guest");
    }

    @Test
    void createUserWithPasswordHash() {
      SentRequest request =
          write(
              () ->
                  api.createUser(
                      "user2", new PasswordHash("5f4dcc3b5aa765d61d8327deb882cf99"), ""));

      assertThat(request.method()).isEqualTo("PUT");
      assertThat(request.url()).isEqualTo(BASE_URL + "/api/users/user2");
      assertThat(request.payload())
          .isEqualTo("{\"password_hash\":\"5f4dcc3b5aa765d61d8327deb882cf99\",\"tags\":\"\"}");
    }

    @Test
    void createUserWithPasswordAndTags() {
      SentRequest request =
          write(() -> api.createUser("user2", new PlainPassword("secret"), "administrator"));

      assertThat(request.payload())
          .isEqualTo("{\"password\":\"secret\",\"tags\":\"administrator\"}");
    }

    @Test
    void createUserWithEmptyPasswordIsAllowed() {
      SentRequest request = write(() -> api.createUser("user2", "", null, ""));

      assertThat(request.payload()).isEqualTo("{\"password\":\"\",\"tags\":\"\"}");
    }

    @Test
    void createUserWithoutTagsSendsEmptyTags() {
      SentRequest request = write(() -> api.createUser("user2", new PlainPassword("pw")));

      assertThat(request.payload()).isEqualTo("{\"password\":\"pw\",\"tags\":\"\"}");
    }

    @Test
    void createUserWithEmptyPasswordAndHashSendsOnlyHash() {
      SentRequest request =
          write(() -> api.createUser("user2", "", "5f4dcc3b5aa765d61d8327deb882cf99", ""));

      assertThat(request.payload())
          .isEqualTo("{\"password_hash\":\"5f4dcc3b5aa765d61d8327deb882cf99\",\"tags\":\"\"}");
    }

    @Test
    void createUserWithBothSecretsFailsBeforeDispatch() {
      assertThatThrownBy(() -> api.createUser("user2", "pw", "hash", ""))
          .isInstanceOf(RabbitRestArgumentException.class)
          .hasMessageContaining("not both");
      verifyNoInteractions(transport);
    }

    @Test
    void createUserWithNeitherSecretFailsBeforeDispatch() {
      assertThatThrownBy(() -> api.createUser("user2", null, null, ""))
          .isInstanceOf(RabbitRestArgumentException.class);
      verifyNoInteractions(transport);
    }

    @Test
    void deleteUser() {
      SentRequest request = write(() -> api.deleteUser("user2"));

      assertThat(request.method()).isEqualTo("DELETE");
      assertThat(request.url()).isEqualTo(BASE_URL + "/api/users/user2");
    }

    @Test
    void listUserPermissions() {
      read("[]", () -> api.listUserPermissions("guest")).isGet("/api/users/guest/permissions");
    }
  }

  @Nested
  class Permissions {

    @Test
    void listPermissions() {
      read("[]", api::listPermissions).isGet("/api/permissions");
    }

    @Test
    void getUserPermissionPutsVhostFirst() {
      read("{}", () -> api.getUserPermission("/", "guest")).isGet("/api/permissions/%2F/guest");
    }

    @Test
    void createUserPermissionGrantsFullAccessByDefault() {
      SentRequest request = write(() -> api.createUserPermission("test_user", "test_vhost"));

      assertThat(request.method()).isEqualTo("PUT");
      assertThat(request.url()).isEqualTo(BASE_URL + "/api/permissions/test_vhost/test_user");
      assertThat(request.payload())
          .isEqualTo("{\"configure\":\".*\",\"write\":\".*\",\"read\":\".*\"}");
    }

    @Test
    void createUserPermissionWithExplicitGrant() {
      SentRequest request =
          write(
              () ->
                  api.createUserPermission(
                      "u1", "/", new PermissionGrant("", "^amq\\.topic$", ".*")));

      assertThat(request.payload())
          .isEqualTo("{\"configure\":\"\",\"write\":\"^amq\\\\.topic$\",\"read\":\".*\"}");
    }

    @Test
    void deleteUserPermission() {
      SentRequest request = write(() -> api.deleteUserPermission("test_user", "test_vhost"));

      assertThat(request.method()).isEqualTo("DELETE");
      assertThat(request.url()).isEqualTo(BASE_URL + "/api/permissions/test_vhost/test_user");
    }

    @Test
    void whoami() {
      respondWith(200, "{\"name\":\"guest\",\"tags\":\"administrator\"}");

      assertThat(api.whoami().join())
          .isEqualTo(Map.of("name", "guest", "tags", "administrator"));
      sent().isGet("/api/whoami");
    }
  }

  @Nested
  class PoliciesAndHealth {

    @Test
    void listPolicies() {
      read("[]", api::listPolicies).isGet("/api/policies");
    }

    @Test
    void listPoliciesForVhost() {
      read("[]", () -> api.listPoliciesForVhost("/")).isGet("/api/policies/%2F");
    }

    @Test
    void getPolicyForVhost() {
      read("{}", () -> api.getPolicyForVhost("/", "ha-all")).isGet("/api/policies/%2F/ha-all");
    }

    @Test
    void createPolicyForVhostSendsDefinition() {
      SentRequest request =
          write(
              () ->
                  api.createPolicyForVhost(
                      "/", "ha-all", new PolicyDefinition("", Map.of("ha-mode", "all"))));

      assertThat(request.method()).isEqualTo("PUT");
      assertThat(request.url()).isEqualTo(BASE_URL + "/api/policies/%2F/ha-all");
      assertThat(request.payload())
          .isEqualTo(
              "{\"pattern\":\"\",\"definition\":{\"ha-mode\":\"all\"},"
                  + "\"priority\":0,\"apply-to\":\"all\"}");
    }

    @Test
    void deletePolicyForVhost() {
      SentRequest request = write(() -> api.deletePolicyForVhost("/", "ha-all"));

      assertThat(request.method()).isEqualTo("DELETE");
      assertThat(request.url()).isEqualTo(BASE_URL + "/api/policies/%2F/ha-all");
    }

    @Test
    void isVhostAlive() {
      respondWith(200, "{\"status\":\"ok\"}");

      assertThat(api.isVhostAlive("/").join()).isEqualTo(Map.of("status", "ok"));
      sent().isGet("/api/aliveness-test/%2F");
    }
  }

  @Nested
  class UnsendableHeaders {

    private final RabbitAdminApi unreachable =
        RabbitAdminApi.connect("http://localhost:1", new BasicAuth("guest", "guest"));

    @Test
    void multiLineReasonIsRejectedBeforeDispatch() {
      assertThatThrownBy(() -> unreachable.deleteConnection("c1", "line1\nline2"))
          .isInstanceOf(RabbitRestArgumentException.class)
          .hasMessageContaining("DELETE")
          .hasCauseInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void restrictedHeaderIsRejectedBeforeDispatch() {
      RequestOptions options = RequestOptions.withHeaders(Map.of("Connection", "close"));

      assertThatThrownBy(() -> unreachable.getClient().remove("/api/connections/c1", options))
          .isInstanceOf(RabbitRestArgumentException.class)
          .hasMessageContaining("Connection");
    }
  }

  @Nested
  class ResponseShapes {

    @Test
    void listEndpointRejectsObjectBody() {
      respondWith(200, "{\"name\":\"/\"}");

      CompletableFuture<List<Map<String, Object>>> future = api.listVhosts();

      assertThatThrownBy(future::join)
          .cause()
          .isInstanceOf(RabbitRestResponseException.class)
          .hasMessage("Expected a JSON array from /api/vhosts");
    }

    @Test
    void objectEndpointRejectsArrayBody() {
      respondWith(200, "[]");

      CompletableFuture<Map<String, Object>> future = api.overview();

      assertThatThrownBy(future::join)
          .cause()
          .isInstanceOf(RabbitRestResponseException.class)
          .hasMessage("Expected a JSON object from /api/overview");
    }

    @Test
    void objectEndpointRejectsEmptyBody() {
      assertThatThrownBy(() -> RabbitAdminApi.asObject("/api/overview", null))
          .isInstanceOf(RabbitRestResponseException.class);
    }

    @Test
    void listEndpointRejectsNonObjectItems() {
      assertThatThrownBy(() -> RabbitAdminApi.asList("/api/nodes", List.of("a", "b")))
          .isInstanceOf(RabbitRestResponseException.class)
          .hasMessageContaining("Expected JSON objects");
    }
  }
}
