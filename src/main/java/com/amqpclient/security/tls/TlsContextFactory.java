package com.amqpclient.security.tls;

import com.amqpclient.config.ConnectionConfig;
import io.netty.handler.ssl.JdkSslContext;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.SslProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLException;

/**
 * Builds the client-side TLS context for mutual authentication from PEM files:
 * CA bundle, client certificate chain and PKCS#8 private key.
 */
public class TlsContextFactory {

    private static final Logger logger = LoggerFactory.getLogger(TlsContextFactory.class);

    private final ConnectionConfig config;

    public TlsContextFactory(ConnectionConfig config) {
        this.config = config;
    }

    /**
     * Netty client context using the JDK provider.
     */
    public SslContext buildClientContext() throws SSLException {
        if (!config.isSecured()) {
            throw new IllegalStateException("TLS is not enabled for " + config.describe());
        }
        SslContextBuilder builder = SslContextBuilder.forClient()
                .sslProvider(SslProvider.JDK)
                .protocols(config.getTlsProtocol())
                .trustManager(config.getCaCertPath().toFile())
                .keyManager(config.getClientCertPath().toFile(), config.getClientKeyPath().toFile());

        logger.debug("Built client SSL context with protocol={}, ca={}, cert={}",
                config.getTlsProtocol(), config.getCaCertPath(), config.getClientCertPath());
        return builder.build();
    }

    /**
     * The same context unwrapped for clients that take a plain {@link SSLContext}.
     */
    public SSLContext buildSslContext() throws SSLException {
        SslContext context = buildClientContext();
        if (!(context instanceof JdkSslContext)) {
            throw new IllegalStateException("Expected a JDK SSL context but got " + context.getClass().getName());
        }
        return ((JdkSslContext) context).context();
    }
}
