package com.amqpclient.config;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;

/**
 * Parsed broker connection string of the form
 * {@code amqp[s]://[user[:password]@]host:port[/vhost]}.
 */
public final class BrokerUrl {

    public static final String DEFAULT_URL = "amqp://localhost:5672";
    public static final String DEFAULT_VHOST = "/";

    private static final Pattern SHAPE = Pattern.compile("amqps?://.+:\\d{1,5}(/.*)?$");

    private final ConnectionConfig.Scheme scheme;
    private final String host;
    private final int port;
    private final String username;
    private final String password;
    private final String virtualHost;

    private BrokerUrl(ConnectionConfig.Scheme scheme, String host, int port,
                      String username, String password, String virtualHost) {
        this.scheme = scheme;
        this.host = host;
        this.port = port;
        this.username = username;
        this.password = password;
        this.virtualHost = virtualHost;
    }

    public static BrokerUrl parse(String url) {
        if (url == null || !SHAPE.matcher(url).matches()) {
            throw new ConfigurationException("The broker connection string looks wrong: '" + redact(url)
                    + "'. It should be something like '" + DEFAULT_URL + "'");
        }

        URI uri;
        try {
            uri = new URI(url);
        } catch (URISyntaxException e) {
            throw new ConfigurationException("Malformed broker URL: " + redact(url), e);
        }
        if (uri.getHost() == null || uri.getPort() < 0 || uri.getPort() > 65535) {
            throw new ConfigurationException("Broker URL needs a host and a port: " + redact(url));
        }

        ConnectionConfig.Scheme scheme = "amqps".equalsIgnoreCase(uri.getScheme())
                ? ConnectionConfig.Scheme.SECURED
                : ConnectionConfig.Scheme.PLAIN;

        String username = null;
        String password = null;
        String userInfo = uri.getUserInfo();
        if (userInfo != null && !userInfo.isEmpty()) {
            int colon = userInfo.indexOf(':');
            if (colon >= 0) {
                username = userInfo.substring(0, colon);
                password = userInfo.substring(colon + 1);
            } else {
                username = userInfo;
            }
        }

        String virtualHost = DEFAULT_VHOST;
        String rawPath = uri.getRawPath();
        if (rawPath != null && rawPath.length() > 1) {
            virtualHost = URLDecoder.decode(rawPath.substring(1), StandardCharsets.UTF_8);
        }

        return new BrokerUrl(scheme, uri.getHost(), uri.getPort(), username, password, virtualHost);
    }

    /**
     * Removes credentials from a connection string so it can be logged.
     */
    public static String redact(String url) {
        if (url == null) {
            return null;
        }
        int at = url.lastIndexOf('@');
        if (at < 0) {
            return url;
        }
        int schemeEnd = url.indexOf("://");
        String prefix = schemeEnd >= 0 && schemeEnd < at ? url.substring(0, schemeEnd + 3) : "";
        return prefix + url.substring(at + 1);
    }

    public ConnectionConfig.Scheme getScheme() {
        return scheme;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public String getUsername() {
        return username;
    }

    public String getPassword() {
        return password;
    }

    public String getVirtualHost() {
        return virtualHost;
    }

    public boolean isSecured() {
        return scheme == ConnectionConfig.Scheme.SECURED;
    }

    @Override
    public String toString() {
        return (isSecured() ? "amqps" : "amqp") + "://" + host + ":" + port;
    }
}
