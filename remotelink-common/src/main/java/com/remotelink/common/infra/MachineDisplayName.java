package com.remotelink.common.infra;

import lombok.extern.slf4j.Slf4j;

import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * Resolves the name this client reports to the controlling server.
 * <p>
 * Prefers the {@code COMPUTERNAME} / {@code HOSTNAME} environment, then the
 * resolved local host name with any {@code .local} suffix removed.
 */
@Slf4j
public final class MachineDisplayName {

    static final String FALLBACK = "remotelink";

    private static volatile String cached;

    private MachineDisplayName() {
    }

    /**
     * Get the machine's display name, cached after first call.
     */
    public static String get() {
        if (cached != null) {
            return cached;
        }
        synchronized (MachineDisplayName.class) {
            if (cached == null) {
                cached = resolve();
            }
            return cached;
        }
    }

    private static String resolve() {
        for (String var : new String[] {"COMPUTERNAME", "HOSTNAME"}) {
            String value = clean(System.getenv(var));
            if (value != null) {
                return value;
            }
        }
        try {
            String hostname = clean(InetAddress.getLocalHost().getHostName());
            if (hostname != null) {
                return hostname;
            }
        } catch (UnknownHostException e) {
            log.debug("Local host name unavailable: {}", e.getMessage());
        }
        return FALLBACK;
    }

    static String clean(String raw) {
        if (raw == null) {
            return null;
        }
        String cleaned = raw.replaceAll("(?i)\\.local$", "").trim();
        return cleaned.isEmpty() ? null : cleaned;
    }
}
