package com.callplane.applicationd.discovery;

import com.callplane.applicationd.config.ApplicationdConfig;
import com.callplane.applicationd.discovery.catalog.CatalogException;
import com.callplane.applicationd.discovery.catalog.ICatalogClient;
import com.callplane.applicationd.discovery.election.ILeaderElection;
import com.callplane.applicationd.metrics.MetricsService;
import com.callplane.core.model.Application;
import com.callplane.core.model.AsteriskNode;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public class DiscoveryService implements IDiscoveryService {
    private static final Logger log = LoggerFactory.getLogger(DiscoveryService.class);

    public static final String SERVICE_ID = "applicationd";
    static final String APPLICATIONS_PREFIX = "applications/";

    private final ICatalogClient catalog;
    private final String asteriskServiceName;
    private final List<NodeHandler> onNodeOk = new CopyOnWriteArrayList<>();
    private final List<NodeHandler> onNodeKo = new CopyOnWriteArrayList<>();

    @Getter
    private final ServiceRegistrar registrar;
    @Getter
    private final LeadershipGate gate;

    public DiscoveryService(
        ApplicationdConfig config,
        ICatalogClient catalog,
        ILeaderElection election,
        MetricsService metrics
    ) {
        this.catalog = catalog;
        this.asteriskServiceName = config.getAsteriskServiceName();
        this.registrar = new ServiceRegistrar(
            catalog,
            SERVICE_ID,
            config.getHost(),
            config.getHttpPort(),
            config.statusUrl(),
            config.getHealthCheckInterval(),
            config.getRegistrationRetry());
        this.gate = new LeadershipGate(
            election,
            config.getElectionKey(),
            List.of(registrar.checkId()),
            () -> new NodeWatchLoop(
                catalog,
                asteriskServiceName,
                config.getWatchWait(),
                config.getWatchPrimingRetry(),
                onNodeOk,
                onNodeKo,
                metrics));
    }

    @Override
    public Mono<Void> run() {
        return Mono.defer(() -> {
            log.info("Discovery start");
            return registrar.run().then(gate.run());
        });
    }

    @Override
    public void onNodeOK(NodeHandler handler) {
        onNodeOk.add(handler);
    }

    @Override
    public void onNodeKO(NodeHandler handler) {
        onNodeKo.add(handler);
    }

    @Override
    public Mono<Application> registerApplication(String name) {
        return Mono.fromCallable(() -> Application.fromName(name))
            .flatMap(application -> store(application).thenReturn(application));
    }

    @Override
    public Mono<Boolean> isApplicationRegistered(String name) {
        return Mono.fromCallable(() -> Application.fromName(name))
            .flatMap(application -> catalog.get(applicationKey(application))
                .map(application.getUuid()::equals))
            .defaultIfEmpty(false);
    }

    @Override
    public Mono<List<AsteriskNode>> retrieveAsteriskServices() {
        return catalog.healthService(asteriskServiceName, null, null)
            .map(result -> NodeRecords.toNodes(result.getRecords()))
            .onErrorResume(err -> {
                log.error("Catalog error: {}", err.getMessage());
                return Mono.just(List.of());
            });
    }

    private Mono<Void> store(Application application) {
        log.info("Registering application {} in catalog", application.getName());
        return catalog.put(applicationKey(application), application.getUuid())
            .flatMap(ok -> ok
                ? Mono.<Void>empty()
                : Mono.<Void>error(new CatalogException("registering app " + application.getName())))
            .onErrorResume(err -> {
                log.error("Catalog error: {}", err.getMessage());
                return Mono.empty();
            });
    }

    static String applicationKey(Application application) {
        return APPLICATIONS_PREFIX + application.getUuid();
    }
}
