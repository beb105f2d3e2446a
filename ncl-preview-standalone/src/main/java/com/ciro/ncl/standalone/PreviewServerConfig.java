package com.ciro.ncl.standalone;

import com.typesafe.config.Config;

/** Ajustes del servidor bajo {@code ncl.server}. */
public class PreviewServerConfig {

    static final String PREFIX = "ncl.server.";

    private int port = 8080;
    private String host = "0.0.0.0";
    private long debounceMs = 300;
    private long sessionTtlMinutes = 30;
    private long maxSessions = 10_000;

    public static PreviewServerConfig from(Config config) {
        PreviewServerConfig c = new PreviewServerConfig();
        c.setPort(config.getInt(PREFIX + "port"));
        c.setHost(config.getString(PREFIX + "host"));
        c.setDebounceMs(config.getLong(PREFIX + "debounce-ms"));
        c.setSessionTtlMinutes(config.getLong(PREFIX + "session-ttl-minutes"));
        c.setMaxSessions(config.getLong(PREFIX + "max-sessions"));
        return c;
    }

    public int getPort() { return port; }
    public void setPort(int port) { this.port = port; }

    public String getHost() { return host; }
    public void setHost(String host) { this.host = host; }

    public long getDebounceMs() { return debounceMs; }
    public void setDebounceMs(long debounceMs) { this.debounceMs = debounceMs; }

    public long getSessionTtlMinutes() { return sessionTtlMinutes; }
    public void setSessionTtlMinutes(long sessionTtlMinutes) { this.sessionTtlMinutes = sessionTtlMinutes; }

    public long getMaxSessions() { return maxSessions; }
    public void setMaxSessions(long maxSessions) { this.maxSessions = maxSessions; }

    @Override
    public String toString() {
        return "PreviewServerConfig{host=" + host + ", port=" + port + ", debounceMs=" + debounceMs
                + ", sessionTtlMinutes=" + sessionTtlMinutes + ", maxSessions=" + maxSessions + "}";
    }
}
