package com.ciro.ncl.standalone;

import com.ciro.ncl.ObjectMapperFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.handlers.PathHandler;
import io.undertow.server.handlers.resource.ClassPathResourceManager;
import io.undertow.server.handlers.resource.ResourceHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static io.undertow.Handlers.websocket;

public class PreviewServer {

    private static final Logger log = LoggerFactory.getLogger(PreviewServer.class);

    private final PreviewServerConfig config;
    private final ObjectMapper mapper;
    private final ScheduledExecutorService scheduler;
    private final SessionManager sessionManager;
    private final PreviewService previews;

    private Undertow server;

    public PreviewServer(PreviewServerConfig config) {
        this.config = config;
        this.mapper = ObjectMapperFactory.create();
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "ncl-debounce");
            t.setDaemon(true);
            return t;
        });
        this.sessionManager = new SessionManager();
        this.previews = new PreviewService(new PreviewSessionStore(config.getSessionTtlMinutes(), config.getMaxSessions()));
    }

    public synchronized void start() {
        ClassLoader cl = PreviewServer.class.getClassLoader();

        // /static/* -> classpath:/static/*
        ResourceHandler staticHandler = new ResourceHandler(new ClassPathResourceManager(cl, "static"));
        staticHandler.setCacheTime(0);
        staticHandler.setWelcomeFiles("index.html");

        WsEndpoint wsEndpoint = new WsEndpoint(previews, mapper, scheduler, config.getDebounceMs());
        CompileEndpoint compileEndpoint = new CompileEndpoint(previews, mapper, sessionManager);
        LastPreviewEndpoint lastEndpoint = new LastPreviewEndpoint(previews.store(), mapper, sessionManager);
        ExamplesEndpoint examplesEndpoint = new ExamplesEndpoint(mapper);

        // lo que no casa con ningún prefijo: la página del editor
        HttpHandler fallback = exchange -> {
            sessionManager.ensureSession(exchange);
            sessionManager.touchNoCache(exchange);
            staticHandler.handleRequest(exchange);
        };

        PathHandler routes = new PathHandler(fallback);
        routes.addPrefixPath("/ws", websocket(wsEndpoint::onConnect));
        routes.addExactPath("/compile", compileEndpoint);
        routes.addExactPath("/preview/last", lastEndpoint);
        routes.addPrefixPath("/examples", examplesEndpoint);
        routes.addPrefixPath("/static", staticHandler);

        server = Undertow.builder()
                .addHttpListener(config.getPort(), config.getHost())
                .setHandler(routes)
                .build();
        server.start();
        log.info("🚀 NCL preview server on http://{}:{}", config.getHost(), port());
    }

    public synchronized void stop() {
        if (server != null) {
            server.stop();
            server = null;
            log.info("NCL preview server stopped");
        }
        scheduler.shutdownNow();
    }

    /** Puerto real: con {@code port = 0} lo elige el sistema. */
    public synchronized int port() {
        if (server == null) return config.getPort();
        return ((InetSocketAddress) server.getListenerInfo().get(0).getAddress()).getPort();
    }
}
