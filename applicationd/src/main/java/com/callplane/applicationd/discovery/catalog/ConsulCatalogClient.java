package com.callplane.applicationd.discovery.catalog;

import com.callplane.core.util.JsonUtils;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import lombok.Data;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.ByteBufFlux;
import reactor.netty.http.client.HttpClient;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link ICatalogClient} backed by the Consul HTTP API, using reactor-netty HttpClient.
 * <p>
 * Blocking queries pass {@code index} and {@code wait}; the response timeout of such
 * requests is stretched past the wait so that Consul answers before the client gives up.
 * </p>
 */
public class ConsulCatalogClient implements ICatalogClient {
    private static final Logger log = LoggerFactory.getLogger(ConsulCatalogClient.class);

    static final String INDEX_HEADER = "X-Consul-Index";
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(10);
    private static final Duration BLOCKING_MARGIN = Duration.ofSeconds(10);

    private static final TypeReference<List<HealthEntry>> HEALTH_ENTRIES = new TypeReference<>() {
    };
    private static final TypeReference<List<KvPair>> KV_PAIRS = new TypeReference<>() {
    };

    private final HttpClient httpClient;

    public ConsulCatalogClient(String consulHost, int consulPort) {
        this.httpClient = HttpClient.create()
            .host(consulHost)
            .port(consulPort)
            .headers(h -> h.set(HttpHeaderNames.ACCEPT, HttpHeaderValues.APPLICATION_JSON));

        log.info("Consul catalog client initialized with {}:{}", consulHost, consulPort);
    }

    @Override
    public Mono<Boolean> registerService(String serviceId, String name, String address, int port) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ID", serviceId);
        body.put("Name", name);
        body.put("Address", address);
        body.put("Port", port);

        return send(HttpMethod.PUT, "/v1/agent/service/register", body, REQUEST_TIMEOUT)
            .map(ConsulResponse::isOk);
    }

    @Override
    public Mono<Boolean> registerHealthCheck(String checkId, String serviceId, String httpUrl, Duration interval) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ID", checkId);
        body.put("Name", checkId);
        body.put("ServiceID", serviceId);
        body.put("HTTP", httpUrl);
        body.put("Interval", toConsulDuration(interval));

        return send(HttpMethod.PUT, "/v1/agent/check/register", body, REQUEST_TIMEOUT)
            .map(ConsulResponse::isOk);
    }

    @Override
    public Mono<Boolean> put(String key, String value) {
        return send(HttpMethod.PUT, "/v1/kv/" + key, value, REQUEST_TIMEOUT)
            .map(this::toBoolean);
    }

    @Override
    public Mono<String> get(String key) {
        return send(HttpMethod.GET, "/v1/kv/" + key, null, REQUEST_TIMEOUT)
            .flatMap(response -> {
                if (response.getStatus() == HttpResponseStatus.NOT_FOUND.code()) {
                    return Mono.empty();
                }
                KvPair pair = firstPair(response);
                return Mono.justOrEmpty(decode(pair.getValue()));
            });
    }

    @Override
    public Mono<HealthServiceResult> healthService(String serviceName, Duration wait, String index) {
        String uri = "/v1/health/service/" + serviceName + blockingQuery(wait, index, "?");

        return send(HttpMethod.GET, uri, null, timeoutFor(wait, index))
            .map(response -> {
                requireOk(response, "health query for " + serviceName);
                List<HealthEntry> entries = JsonUtils.readValue(response.getBody(), HEALTH_ENTRIES);

                List<CatalogNodeRecord> records = new ArrayList<>(entries.size());
                for (HealthEntry entry : entries) {
                    records.add(entry.toRecord());
                }
                return new HealthServiceResult(response.getIndex(), records);
            });
    }

    @Override
    public Mono<String> createSession(String name, List<String> checks) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("Name", name);
        body.put("Checks", checks);
        body.put("Behavior", "release");

        return send(HttpMethod.PUT, "/v1/session/create", body, REQUEST_TIMEOUT)
            .map(response -> {
                requireOk(response, "session creation for " + name);
                return JsonUtils.readValue(response.getBody(), SessionCreated.class).getId();
            });
    }

    @Override
    public Mono<Void> destroySession(String sessionId) {
        return send(HttpMethod.PUT, "/v1/session/destroy/" + sessionId, null, REQUEST_TIMEOUT)
            .doOnNext(response -> requireOk(response, "session destruction for " + sessionId))
            .then();
    }

    @Override
    public Mono<Boolean> acquire(String key, String value, String sessionId) {
        // a dead session is answered with 500, which must end the caller's campaign
        return send(HttpMethod.PUT, "/v1/kv/" + key + "?acquire=" + sessionId, value, REQUEST_TIMEOUT)
            .map(response -> {
                requireOk(response, "lock acquisition on " + key + " with session " + sessionId);
                return Boolean.parseBoolean(response.getBody().trim());
            });
    }

    @Override
    public Mono<Boolean> release(String key, String sessionId) {
        return send(HttpMethod.PUT, "/v1/kv/" + key + "?release=" + sessionId, "", REQUEST_TIMEOUT)
            .map(this::toBoolean);
    }

    @Override
    public Mono<KvEntry> watchKey(String key, Duration wait, String index) {
        String uri = "/v1/kv/" + key + blockingQuery(wait, index, "?");

        return send(HttpMethod.GET, uri, null, timeoutFor(wait, index))
            .map(response -> {
                if (response.getStatus() == HttpResponseStatus.NOT_FOUND.code()) {
                    return new KvEntry(response.getIndex(), null, null);
                }
                KvPair pair = firstPair(response);
                return new KvEntry(response.getIndex(), decode(pair.getValue()), pair.getSession());
            });
    }

    private Mono<ConsulResponse> send(HttpMethod method, String uri, Object body, Duration timeout) {
        HttpClient.RequestSender sender = httpClient
            .responseTimeout(timeout)
            .request(method)
            .uri(uri);

        HttpClient.ResponseReceiver<?> receiver = body == null
            ? sender
            : sender.send(ByteBufFlux.fromString(Mono.just(serialize(body))));

        log.debug("Consul {} {}", method, uri);

        return receiver
            .responseSingle((response, content) -> content.asString(StandardCharsets.UTF_8)
                .defaultIfEmpty("")
                .map(text -> new ConsulResponse(
                    response.status().code(),
                    response.responseHeaders().get(INDEX_HEADER),
                    text)))
            .onErrorMap(err -> !(err instanceof CatalogException),
                err -> new CatalogException("Consul " + method + " " + uri + " failed: " + err.getMessage(), err));
    }

    private static String serialize(Object body) {
        if (body instanceof String) {
            return (String) body;
        }
        return JsonUtils.writeValueAsString(body);
    }

    private boolean toBoolean(ConsulResponse response) {
        if (!response.isOk()) {
            log.warn("Consul refused request: status {} body {}", response.getStatus(), response.getBody());
            return false;
        }
        return Boolean.parseBoolean(response.getBody().trim());
    }

    private static KvPair firstPair(ConsulResponse response) {
        requireOk(response, "key read");
        List<KvPair> pairs = JsonUtils.readValue(response.getBody(), KV_PAIRS);
        if (pairs.isEmpty()) {
            return new KvPair();
        }
        return pairs.get(0);
    }

    private static void requireOk(ConsulResponse response, String what) {
        if (!response.isOk()) {
            throw new CatalogException(what + " returned status " + response.getStatus() + ": " + response.getBody());
        }
    }

    private static String decode(String base64) {
        if (base64 == null) {
            return null;
        }
        return new String(Base64.getDecoder().decode(base64), StandardCharsets.UTF_8);
    }

    static String blockingQuery(Duration wait, String index, String separator) {
        if (wait == null || index == null) {
            return "";
        }
        return separator + "index=" + index + "&wait=" + toConsulDuration(wait);
    }

    private static Duration timeoutFor(Duration wait, String index) {
        if (wait == null || index == null) {
            return REQUEST_TIMEOUT;
        }
        return wait.plus(BLOCKING_MARGIN);
    }

    static String toConsulDuration(Duration duration) {
        return Math.max(1, duration.toSeconds()) + "s";
    }

    @Value
    static class ConsulResponse {
        int status;
        String index;
        String body;

        boolean isOk() {
            return status == HttpResponseStatus.OK.code();
        }
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class HealthEntry {
        @JsonProperty("Node")
        private ConsulNode node;
        @JsonProperty("Service")
        private ConsulService service;
        @JsonProperty("Checks")
        private List<ConsulCheck> checks;

        CatalogNodeRecord toRecord() {
            CatalogNodeRecord.CatalogNodeRecordBuilder builder = CatalogNodeRecord.builder();
            String address = null;
            if (service != null) {
                builder.serviceId(service.getId()).port(service.getPort());
                if (service.getMeta() != null) {
                    builder.meta(service.getMeta());
                }
                address = service.getAddress();
            }
            // an empty service address means "same as the agent's node"
            if ((address == null || address.isEmpty()) && node != null) {
                address = node.getAddress();
            }
            builder.address(address);
            if (checks != null) {
                for (ConsulCheck check : checks) {
                    builder.checkStatus(check.getStatus());
                }
            }
            return builder.build();
        }
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ConsulNode {
        @JsonProperty("Node")
        private String node;
        @JsonProperty("Address")
        private String address;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ConsulService {
        @JsonProperty("ID")
        private String id;
        @JsonProperty("Service")
        private String service;
        @JsonProperty("Address")
        private String address;
        @JsonProperty("Port")
        private Integer port;
        @JsonProperty("Meta")
        private Map<String, String> meta;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ConsulCheck {
        @JsonProperty("CheckID")
        private String checkId;
        @JsonProperty("Status")
        private String status;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class KvPair {
        @JsonProperty("Key")
        private String key;
        @JsonProperty("Value")
        private String value;
        @JsonProperty("Session")
        private String session;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class SessionCreated {
        @JsonProperty("ID")
        private String id;
    }
}
