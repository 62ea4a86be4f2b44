package com.ciro.jcss.standalone;

import com.ciro.jcss.CssTools;
import com.ciro.jcss.api.CssHttpApi;
import com.ciro.jcss.process.CssProcessor;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.handlers.PathHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;

public class JcssServer {

    private static final Logger log = LoggerFactory.getLogger(JcssServer.class);

    private final ServerConfig config;
    private final CssHttpApi api;
    private final ResultCache cache;
    private Undertow server;

    public JcssServer(ServerConfig config) {
        this(config, new CssProcessor(new CssTools()));
    }

    public JcssServer(ServerConfig config, CssProcessor processor) {
        this.config = config;
        ObjectMapper mapper = ObjectMapperFactory.create();
        this.api = new CssHttpApi(processor, mapper);
        this.cache = new ResultCache(config);

        PathHandler routes = Handlers.path()
                .addPrefixPath("/css", new OperationEndpoint(api, mapper, cache));

        this.server = Undertow.builder()
                .addHttpListener(config.port(), config.host())
                .setHandler(routes)
                .build();
    }

    public void start() {
        server.start();
        log.info("jcss listening on {}:{} ({} operations)", config.host(), port(), api.operations().size());
    }

    public void stop() {
        if (server != null) {
            server.stop();
            server = null;
            log.info("jcss stopped");
        }
    }

    /** Puerto real; útil cuando se arrancó con puerto 0. */
    public int port() {
        return ((InetSocketAddress) server.getListenerInfo().get(0).getAddress()).getPort();
    }

    public ResultCache cache() {
        return cache;
    }
}
