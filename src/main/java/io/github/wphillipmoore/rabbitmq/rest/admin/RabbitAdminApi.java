package io.github.wphillipmoore.rabbitmq.rest.admin;

import static io.github.wphillipmoore.rabbitmq.rest.admin.PathSegments.path;

import io.github.wphillipmoore.rabbitmq.rest.admin.auth.Credentials;
import io.github.wphillipmoore.rabbitmq.rest.admin.exception.RabbitRestArgumentException;
import io.github.wphillipmoore.rabbitmq.rest.admin.exception.RabbitRestResponseException;
import io.github.wphillipmoore.rabbitmq.rest.admin.model.ExchangeDefinition;
import io.github.wphillipmoore.rabbitmq.rest.admin.model.PermissionGrant;
import io.github.wphillipmoore.rabbitmq.rest.admin.model.PolicyDefinition;
import io.github.wphillipmoore.rabbitmq.rest.admin.model.QueueDefinition;
import io.github.wphillipmoore.rabbitmq.rest.admin.model.UserCredential;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import org.jspecify.annotations.Nullable;

/**
 * Typed, asynchronous access to the RabbitMQ management HTTP API.
 *
 * <p>Every method builds a path from percent-encoded arguments, optionally a JSON body, and
 * delegates to exactly one {@link ResourceClient} primitive. Read methods complete with the
 * decoded JSON as maps and lists; write methods complete with {@code null}. Broker rejections
 * complete the future exceptionally with {@link
 * io.github.wphillipmoore.rabbitmq.rest.admin.exception.RabbitRestStatusException}.
 *
 * <pre>{@code
 * RabbitAdminApi api = RabbitAdminApi.connect(
 *     "http://localhost:15672", new BasicAuth("guest", "guest"));
 * api.createVhost("orders", true).join();
 * Map<String, Object> vhost = api.getVhost("orders").join();
 * }</pre>
 */
public final class RabbitAdminApi {

  static final String REASON_HEADER = "X-Reason";

  private final ResourceClient client;

  /**
   * Creates an API facade over an existing resource client.
   *
   * @param client the resource client to dispatch through
   */
  public RabbitAdminApi(ResourceClient client) {
    this.client = Objects.requireNonNull(client, "client");
  }

  /**
   * Creates an API facade with a default {@link HttpClientTransport}.
   *
   * @param baseUrl the management API root, e.g. {@code http://localhost:15672}
   * @param credentials the authentication credentials
   * @return the API facade
   */
  public static RabbitAdminApi connect(String baseUrl, Credentials credentials) {
    return new RabbitAdminApi(new ResourceClient.Builder(baseUrl, credentials).build());
  }

  /** Returns the underlying resource client, for endpoints this class does not cover. */
  public ResourceClient getClient() {
    return client;
  }

  private CompletableFuture<Map<String, Object>> fetchObject(String path) {
    return client.fetch(path).thenApply(value -> asObject(path, value));
  }

  private CompletableFuture<List<Map<String, Object>>> fetchList(String path) {
    return client.fetch(path).thenApply(value -> asList(path, value));
  }

  @SuppressWarnings("unchecked")
  static Map<String, Object> asObject(String path, @Nullable Object value) {
    if (!(value instanceof Map)) {
      throw new RabbitRestResponseException(
          "Expected a JSON object from " + path, String.valueOf(value));
    }
    return (Map<String, Object>) value;
  }

  @SuppressWarnings("unchecked")
  static List<Map<String, Object>> asList(String path, @Nullable Object value) {
    if (!(value instanceof List)) {
      throw new RabbitRestResponseException(
          "Expected a JSON array from " + path, String.valueOf(value));
    }
    List<Map<String, Object>> items = new ArrayList<>();
    for (Object item : (List<Object>) value) {
      if (!(item instanceof Map)) {
        throw new RabbitRestResponseException(
            "Expected JSON objects in the array from " + path, String.valueOf(value));
      }
      items.add((Map<String, Object>) item);
    }
    return items;
  }

  // Cluster

  /** GET /api/overview: broker-wide statistics and versions. */
  public CompletableFuture<Map<String, Object>> overview() {
    return fetchObject("/api/overview");
  }

  /** GET /api/cluster-name. */
  public CompletableFuture<Map<String, Object>> getClusterName() {
    return fetchObject("/api/cluster-name");
  }

  /** GET /api/nodes. */
  public CompletableFuture<List<Map<String, Object>>> listNodes() {
    return fetchList("/api/nodes");
  }

  /** GET /api/nodes/{name}. */
  public CompletableFuture<Map<String, Object>> getNode(String name) {
    return fetchObject(path("/api/nodes", name));
  }

  /** GET /api/extensions: management UI plugins. */
  public CompletableFuture<List<Map<String, Object>>> listExtensions() {
    return fetchList("/api/extensions");
  }

  // Definitions

  /** GET /api/definitions: the full topology and account export. */
  public CompletableFuture<Map<String, Object>> getDefinitions() {
    return fetchObject("/api/definitions");
  }

  /**
   * POST /api/definitions: imports a definitions document, merging it into the broker.
   *
   * @param definitions a document in the shape returned by {@link #getDefinitions()}
   */
  public CompletableFuture<Void> postDefinitions(Map<String, Object> definitions) {
    Objects.requireNonNull(definitions, "definitions");
    return client.create("/api/definitions", definitions);
  }

  /** GET /api/definitions/{vhost}: the export of a single virtual host. */
  public CompletableFuture<Map<String, Object>> getDefinitionsForVhost(String vhost) {
    return fetchObject(path("/api/definitions", vhost));
  }

  /** POST /api/definitions/{vhost}: imports a single virtual host's definitions. */
  public CompletableFuture<Void> postDefinitionsForVhost(
      String vhost, Map<String, Object> definitions) {
    Objects.requireNonNull(definitions, "definitions");
    return client.create(path("/api/definitions", vhost), definitions);
  }

  // Connections and channels

  /** GET /api/connections. */
  public CompletableFuture<List<Map<String, Object>>> listConnections() {
    return fetchList("/api/connections");
  }

  /** GET /api/vhosts/{vhost}/connections. */
  public CompletableFuture<List<Map<String, Object>>> listConnectionsForVhost(String vhost) {
    return fetchList(path("/api/vhosts", vhost) + "/connections");
  }

  /** GET /api/connections/{name}. */
  public CompletableFuture<Map<String, Object>> getConnection(String name) {
    return fetchObject(path("/api/connections", name));
  }

  /** DELETE /api/connections/{name}: closes a client connection. */
  public CompletableFuture<Void> deleteConnection(String name) {
    return deleteConnection(name, null);
  }

  /**
   * DELETE /api/connections/{name}: closes a client connection, telling the client why.
   *
   * @param name the connection name
   * @param reason human-readable reason sent as the {@code X-Reason} header, or {@code null}
   */
  public CompletableFuture<Void> deleteConnection(String name, @Nullable String reason) {
    RequestOptions options =
        reason != null
            ? RequestOptions.withHeaders(Map.of(REASON_HEADER, reason))
            : RequestOptions.none();
    return client.remove(path("/api/connections", name), options);
  }

  /** GET /api/connections/{name}/channels. */
  public CompletableFuture<List<Map<String, Object>>> listConnectionChannels(String name) {
    return fetchList(path("/api/connections", name) + "/channels");
  }

  /** GET /api/channels. */
  public CompletableFuture<List<Map<String, Object>>> listChannels() {
    return fetchList("/api/channels");
  }

  /** GET /api/vhosts/{vhost}/channels. */
  public CompletableFuture<List<Map<String, Object>>> listChannelsForVhost(String vhost) {
    return fetchList(path("/api/vhosts", vhost) + "/channels");
  }

  /** GET /api/channels/{name}. */
  public CompletableFuture<Map<String, Object>> getChannel(String name) {
    return fetchObject(path("/api/channels", name));
  }

  // Consumers

  /** GET /api/consumers. */
  public CompletableFuture<List<Map<String, Object>>> listConsumers() {
    return fetchList("/api/consumers");
  }

  /** GET /api/consumers/{vhost}. */
  public CompletableFuture<List<Map<String, Object>>> listConsumersForVhost(String vhost) {
    return fetchList(path("/api/consumers", vhost));
  }

  // Exchanges

  /** GET /api/exchanges. */
  public CompletableFuture<List<Map<String, Object>>> listExchanges() {
    return fetchList("/api/exchanges");
  }

  /** GET /api/exchanges/{vhost}. */
  public CompletableFuture<List<Map<String, Object>>> listExchangesForVhost(String vhost) {
    return fetchList(path("/api/exchanges", vhost));
  }

  /** GET /api/exchanges/{vhost}/{name}. */
  public CompletableFuture<Map<String, Object>> getExchangeForVhost(String name, String vhost) {
    return fetchObject(path("/api/exchanges", vhost, name));
  }

  /** PUT /api/exchanges/{vhost}/{name}: declares an exchange. */
  public CompletableFuture<Void> createExchangeForVhost(
      String name, String vhost, ExchangeDefinition definition) {
    Objects.requireNonNull(definition, "definition");
    return client.upsert(path("/api/exchanges", vhost, name), definition.toBody());
  }

  /** DELETE /api/exchanges/{vhost}/{name}. */
  public CompletableFuture<Void> deleteExchangeForVhost(String name, String vhost) {
    return client.remove(path("/api/exchanges", vhost, name));
  }

  // Queues

  /** GET /api/queues. */
  public CompletableFuture<List<Map<String, Object>>> listQueues() {
    return fetchList("/api/queues");
  }

  /** GET /api/queues/{vhost}. */
  public CompletableFuture<List<Map<String, Object>>> listQueuesForVhost(String vhost) {
    return fetchList(path("/api/queues", vhost));
  }

  /** GET /api/queues/{vhost}/{name}. */
  public CompletableFuture<Map<String, Object>> getQueueForVhost(String name, String vhost) {
    return fetchObject(path("/api/queues", vhost, name));
  }

  /** PUT /api/queues/{vhost}/{name}: declares a queue. */
  public CompletableFuture<Void> createQueueForVhost(
      String name, String vhost, QueueDefinition definition) {
    Objects.requireNonNull(definition, "definition");
    return client.upsert(path("/api/queues", vhost, name), definition.toBody());
  }

  /** DELETE /api/queues/{vhost}/{name}. */
  public CompletableFuture<Void> deleteQueueForVhost(String name, String vhost) {
    return client.remove(path("/api/queues", vhost, name));
  }

  /** DELETE /api/queues/{vhost}/{name}/contents: drops every ready message. */
  public CompletableFuture<Void> purgeQueue(String name, String vhost) {
    return client.remove(path("/api/queues", vhost, name) + "/contents");
  }

  // Bindings

  /** GET /api/bindings. */
  public CompletableFuture<List<Map<String, Object>>> listBindings() {
    return fetchList("/api/bindings");
  }

  /** GET /api/bindings/{vhost}. */
  public CompletableFuture<List<Map<String, Object>>> listBindingsForVhost(String vhost) {
    return fetchList(path("/api/bindings", vhost));
  }

  /** GET /api/queues/{vhost}/{queue}/bindings. */
  public CompletableFuture<List<Map<String, Object>>> listBindingsForQueue(
      String vhost, String queue) {
    return fetchList(path("/api/queues", vhost, queue) + "/bindings");
  }

  /**
   * POST /api/bindings/{vhost}/e/{exchange}/q/{queue}: binds a queue to an exchange.
   *
   * @param vhost the virtual host of both resources
   * @param exchange the source exchange
   * @param queue the destination queue
   * @param routingKey the binding key
   * @param arguments binding arguments, e.g. for a headers exchange
   */
  public CompletableFuture<Void> createQueueBinding(
      String vhost,
      String exchange,
      String queue,
      String routingKey,
      Map<String, Object> arguments) {
    Objects.requireNonNull(routingKey, "routingKey");
    Objects.requireNonNull(arguments, "arguments");
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("routing_key", routingKey);
    body.put("arguments", new LinkedHashMap<>(arguments));
    String bindingPath = path("/api/bindings", vhost) + path("/e", exchange) + path("/q", queue);
    return client.create(bindingPath, body);
  }

  // Virtual hosts

  /** GET /api/vhosts. */
  public CompletableFuture<List<Map<String, Object>>> listVhosts() {
    return fetchList("/api/vhosts");
  }

  /** GET /api/vhosts/{name}. */
  public CompletableFuture<Map<String, Object>> getVhost(String name) {
    return fetchObject(path("/api/vhosts", name));
  }

  /** PUT /api/vhosts/{name} with no body. */
  public CompletableFuture<Void> createVhost(String name) {
    return createVhost(name, null);
  }

  /**
   * PUT /api/vhosts/{name}.
   *
   * @param name the virtual host name
   * @param tracing whether message tracing is enabled; {@code null} sends no body at all
   */
  public CompletableFuture<Void> createVhost(String name, @Nullable Boolean tracing) {
    @Nullable Map<String, Object> body = tracing != null ? Map.of("tracing", tracing) : null;
    return client.upsert(path("/api/vhosts", name), body);
  }

  /** DELETE /api/vhosts/{name}: removes the virtual host and everything in it. */
  public CompletableFuture<Void> deleteVhost(String name) {
    return client.remove(path("/api/vhosts", name));
  }

  /** GET /api/vhosts/{vhost}/permissions. */
  public CompletableFuture<List<Map<String, Object>>> listPermissionsForVhost(String vhost) {
    return fetchList(path("/api/vhosts", vhost) + "/permissions");
  }

  // Users

  /** GET /api/users. */
  public CompletableFuture<List<Map<String, Object>>> listUsers() {
    return fetchList("/api/users");
  }

  /** GET /api/users/{name}. */
  public CompletableFuture<Map<String, Object>> getUser(String name) {
    return fetchObject(path("/api/users", name));
  }

  /**
   * PUT /api/users/{name}: creates or replaces a user.
   *
   * @param name the user name
   * @param credential the plaintext password or precomputed hash
   * @param tags comma-separated user tags, e.g. {@code "administrator"}; may be empty
   */
  public CompletableFuture<Void> createUser(String name, UserCredential credential, String tags) {
    Objects.requireNonNull(credential, "credential");
    Objects.requireNonNull(tags, "tags");
    Map<String, Object> body = new LinkedHashMap<>();
    body.put(credential.fieldName(), credential.value());
    body.put("tags", tags);
    return client.upsert(path("/api/users", name), body);
  }

  /** PUT /api/users/{name} without tags. */
  public CompletableFuture<Void> createUser(String name, UserCredential credential) {
    return createUser(name, credential, "");
  }

  /**
   * PUT /api/users/{name} from a pair of optional secrets.
   *
   * @param name the user name
   * @param password the plaintext password, or {@code null}; ignored when empty and a hash is given
   * @param passwordHash the precomputed password hash, or {@code null}
   * @param tags comma-separated user tags; may be empty
   * @throws RabbitRestArgumentException if both or neither secret is supplied; nothing is sent
   */
  public CompletableFuture<Void> createUser(
      String name, @Nullable String password, @Nullable String passwordHash, String tags) {
    return createUser(name, UserCredential.of(password, passwordHash), tags);
  }

  /** DELETE /api/users/{name}. */
  public CompletableFuture<Void> deleteUser(String name) {
    return client.remove(path("/api/users", name));
  }

  /** GET /api/users/{name}/permissions. */
  public CompletableFuture<List<Map<String, Object>>> listUserPermissions(String name) {
    return fetchList(path("/api/users", name) + "/permissions");
  }

  // Permissions

  /** GET /api/permissions. */
  public CompletableFuture<List<Map<String, Object>>> listPermissions() {
    return fetchList("/api/permissions");
  }

  /** GET /api/permissions/{vhost}/{user}. */
  public CompletableFuture<Map<String, Object>> getUserPermission(String vhost, String user) {
    return fetchObject(path("/api/permissions", vhost, user));
  }

  /** PUT /api/permissions/{vhost}/{user} granting full access. */
  public CompletableFuture<Void> createUserPermission(String user, String vhost) {
    return createUserPermission(user, vhost, PermissionGrant.ALL);
  }

  /** PUT /api/permissions/{vhost}/{user}. */
  public CompletableFuture<Void> createUserPermission(
      String user, String vhost, PermissionGrant grant) {
    Objects.requireNonNull(grant, "grant");
    return client.upsert(path("/api/permissions", vhost, user), grant.toBody());
  }

  /** DELETE /api/permissions/{vhost}/{user}. */
  public CompletableFuture<Void> deleteUserPermission(String user, String vhost) {
    return client.remove(path("/api/permissions", vhost, user));
  }

  /** GET /api/whoami: the user the client is authenticated as. */
  public CompletableFuture<Map<String, Object>> whoami() {
    return fetchObject("/api/whoami");
  }

  // Policies

  /** GET /api/policies. */
  public CompletableFuture<List<Map<String, Object>>> listPolicies() {
    return fetchList("/api/policies");
  }

  /** GET /api/policies/{vhost}. */
  public CompletableFuture<List<Map<String, Object>>> listPoliciesForVhost(String vhost) {
    return fetchList(path("/api/policies", vhost));
  }

  /** GET /api/policies/{vhost}/{name}. */
  public CompletableFuture<Map<String, Object>> getPolicyForVhost(String vhost, String name) {
    return fetchObject(path("/api/policies", vhost, name));
  }

  /** PUT /api/policies/{vhost}/{name}. */
  public CompletableFuture<Void> createPolicyForVhost(
      String vhost, String name, PolicyDefinition policy) {
    Objects.requireNonNull(policy, "policy");
    return client.upsert(path("/api/policies", vhost, name), policy.toBody());
  }

  /** DELETE /api/policies/{vhost}/{name}. */
  public CompletableFuture<Void> deletePolicyForVhost(String vhost, String name) {
    return client.remove(path("/api/policies", vhost, name));
  }

  // Health

  /**
   * GET /api/aliveness-test/{vhost}: declares a test queue, publishes and consumes a message.
   * Completes with {@code {"status": "ok"}} when the virtual host is healthy.
   */
  public CompletableFuture<Map<String, Object>> isVhostAlive(String vhost) {
    return fetchObject(path("/api/aliveness-test", vhost));
  }
}
