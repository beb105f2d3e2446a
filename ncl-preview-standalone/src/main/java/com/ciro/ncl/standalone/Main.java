package com.ciro.ncl.standalone;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        PreviewServerConfig config = PreviewServerConfig.from(ConfigLoader.load(args));
        log.info("⏳ Starting NCL preview server with {}", config);

        PreviewServer server = new PreviewServer(config);
        Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "ncl-shutdown"));
        server.start();
    }
}
