package com.questrail.coverage.runtime;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.coverage.config.CoverageRuntimeConfig;
import com.questrail.coverage.config.CoverageTimingPolicy;
import com.questrail.coverage.controlserver.ControlServerApi;
import com.questrail.coverage.controlserver.ControlServerResultSubmitter;
import com.questrail.coverage.controlserver.HttpControlServerClient;
import com.questrail.coverage.engine.CoverageMeasurement;
import com.questrail.coverage.engine.FenceSegmentationEngine;
import com.questrail.coverage.engine.KeepMeasuringToken;
import com.questrail.coverage.engine.RadioTechnologyService;
import com.questrail.coverage.internal.time.MonotonicClock;
import com.questrail.coverage.internal.time.MonotonicScheduler;
import com.questrail.coverage.internal.time.ScheduledExecutorScheduler;
import com.questrail.coverage.internal.time.SystemMonotonicClock;
import com.questrail.coverage.internal.time.SystemWallClock;
import com.questrail.coverage.internal.time.WallClock;
import com.questrail.coverage.model.ActiveSubSession;
import com.questrail.coverage.model.IpVersion;
import com.questrail.coverage.observability.CoverageErrorEvent;
import com.questrail.coverage.observability.CoverageObservabilitySink;
import com.questrail.coverage.observability.NullCoverageObservabilitySink;
import com.questrail.coverage.persistence.JdbcCoverageStore;
import com.questrail.coverage.persistence.PersistedSessionsResender;
import com.questrail.coverage.persistence.PersistenceManagingCoverageResultsService;
import com.questrail.coverage.ping.PingPacer;
import com.questrail.coverage.ping.UdpPingSession;
import com.questrail.coverage.session.CoverageSessionController;
import com.questrail.coverage.session.ResendingSessionInitiator;
import com.questrail.coverage.transport.udp.netty.NettyUdpDatagramEndpoint;
import org.h2.jdbcx.JdbcDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * CoverageProductionRuntime
 * =============================================================================
 * Composition root and lifecycle owner for the production coverage stack.
 *
 * <p>The runtime owns what outlives a single measurement: executors, the HTTP
 * client, the fence store and the resender. Each call to
 * {@link #newMeasurement()} wires a fresh session controller, ping session,
 * pacer and segmentation engine on top of them.</p>
 */
public final class CoverageProductionRuntime {

    private static final Logger log = LoggerFactory.getLogger(CoverageProductionRuntime.class);

    private final CoverageTimingPolicy timingPolicy;
    private final ControlServerApi controlServer;
    private final JdbcCoverageStore store;
    private final ControlServerResultSubmitter submitter;
    private final PersistedSessionsResender resender;
    private final RadioTechnologyService radioTechnology;
    private final KeepMeasuringToken keepMeasuringToken;
    private final CoverageObservabilitySink observabilitySink;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final ScheduledExecutorService schedulerExecutor;
    private final MonotonicScheduler scheduler;
    private final ExecutorService controlPlaneExecutor;
    private final ExecutorService persistenceExecutor;

    private volatile CoverageSessionController currentController;

    private CoverageProductionRuntime(Builder builder,
                                      ControlServerApi controlServer,
                                      JdbcCoverageStore store) {
        this.timingPolicy = builder.config.timingPolicy();
        this.controlServer = controlServer;
        this.store = store;
        this.radioTechnology = builder.radioTechnology;
        this.keepMeasuringToken = builder.keepMeasuringToken;
        this.observabilitySink = builder.observabilitySink;
        this.clock = SystemMonotonicClock.INSTANCE;
        this.wallClock = SystemWallClock.INSTANCE;
        this.schedulerExecutor = Executors.newScheduledThreadPool(1);
        this.scheduler = new ScheduledExecutorScheduler(schedulerExecutor, clock);
        this.controlPlaneExecutor = Executors.newFixedThreadPool(2);
        this.persistenceExecutor = Executors.newSingleThreadExecutor();
        this.submitter = new ControlServerResultSubmitter(controlServer);
        this.resender = new PersistedSessionsResender(
                store, submitter, wallClock, timingPolicy.maxResendAge(), this::activeSubSession);
    }

    /**
     * Sends whatever earlier runs left in the store, in the background.
     */
    public void start() {
        try {
            controlPlaneExecutor.execute(() -> {
                try {
                    PersistedSessionsResender.Report report = resender.resendPersistentSessions(true);
                    log.info("Launch resend finished: {}", report);
                } catch (RuntimeException e) {
                    observabilitySink.onError(new CoverageErrorEvent(wallClock.now(), "Launch resend failed", e));
                }
            });
        } catch (RejectedExecutionException e) {
            observabilitySink.onError(new CoverageErrorEvent(wallClock.now(), "Launch resend not scheduled", e));
        }
    }

    /**
     * Wires a new, not yet started measurement run.
     */
    public CoverageMeasurement newMeasurement() {
        CoverageSessionController controller = new CoverageSessionController(
                controlServer,
                controlPlaneExecutor,
                clock,
                scheduler,
                wallClock,
                timingPolicy,
                observabilitySink);

        ResendingSessionInitiator initiator = new ResendingSessionInitiator(controller, resender, controlPlaneExecutor);
        UdpPingSession pingSession = new UdpPingSession(
                initiator,
                ipVersion -> NettyUdpDatagramEndpoint.ephemeral(ipVersion == IpVersion.V6),
                clock,
                scheduler,
                timingPolicy.pingTimeout());

        PersistenceManagingCoverageResultsService resultsService = new PersistenceManagingCoverageResultsService(
                store, submitter, resender);

        FenceSegmentationEngine engine = new FenceSegmentationEngine(
                timingPolicy,
                radioTechnology,
                store,
                resultsService,
                persistenceExecutor,
                wallClock,
                observabilitySink);

        CoverageMeasurement measurement = new CoverageMeasurement(
                engine,
                controller,
                outcomes -> new PingPacer(
                        pingSession,
                        clock,
                        scheduler,
                        wallClock,
                        timingPolicy.pingInterval(),
                        timingPolicy.pingFailureThreshold(),
                        outcomes),
                keepMeasuringToken,
                clock,
                scheduler,
                wallClock,
                observabilitySink);

        currentController = controller;
        return measurement;
    }

    public JdbcCoverageStore store() {
        return store;
    }

    public void stop() {
        shutdown(schedulerExecutor);
        shutdown(controlPlaneExecutor);
        shutdown(persistenceExecutor);
    }

    private Optional<ActiveSubSession> activeSubSession() {
        CoverageSessionController controller = currentController;
        return controller == null ? Optional.empty() : controller.activeSubSession();
    }

    private static void shutdown(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private CoverageRuntimeConfig config;
        private RadioTechnologyService radioTechnology = Optional::empty;
        private KeepMeasuringToken keepMeasuringToken = KeepMeasuringToken.noop();
        private CoverageObservabilitySink observabilitySink = NullCoverageObservabilitySink.INSTANCE;
        private ControlServerApi controlServer;

        public Builder withConfig(CoverageRuntimeConfig config) {
            this.config = config;
            return this;
        }

        public Builder withRadioTechnologyService(RadioTechnologyService service) {
            this.radioTechnology = service;
            return this;
        }

        public Builder withKeepMeasuringToken(KeepMeasuringToken token) {
            this.keepMeasuringToken = token;
            return this;
        }

        public Builder withObservabilitySink(CoverageObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        /**
         * Replaces the HTTP client built from the config, e.g. with a fake.
         */
        public Builder withControlServer(ControlServerApi controlServer) {
            this.controlServer = controlServer;
            return this;
        }

        public CoverageProductionRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(radioTechnology, "radioTechnology");
            Objects.requireNonNull(keepMeasuringToken, "keepMeasuringToken");
            Objects.requireNonNull(observabilitySink, "observabilitySink");

            ControlServerApi api = controlServer;
            if (api == null) {
                HttpClient httpClient = HttpClient.newBuilder()
                        .connectTimeout(config.httpRequestTimeout())
                        .build();
                api = new HttpControlServerClient(
                        config.controlServerUri(), httpClient, new ObjectMapper(), config.httpRequestTimeout());
            }

            JdbcDataSource dataSource = new JdbcDataSource();
            dataSource.setURL(config.jdbcUrl());
            JdbcCoverageStore store = new JdbcCoverageStore(dataSource);
            store.initializeSchema();

            return new CoverageProductionRuntime(this, api, store);
        }
    }
}
