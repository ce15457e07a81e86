/*
 * Copyright Threescale Adapter Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.threescale.adapter.tls;

import java.net.http.HttpClient;
import java.net.http.HttpClient.Builder;
import java.security.KeyStore;
import java.security.SecureRandom;
import java.util.Objects;
import java.util.function.UnaryOperator;

import javax.net.ssl.KeyManager;
import javax.net.ssl.KeyManagerFactory;
import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.TrustManagerFactory;

import io.threescale.adapter.tag.VisibleForTesting;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Responsible for applying {@link TlsMaterial} to a {@link HttpClient.Builder}.
 * <br>
 * Callers only create a configurator when some TLS setting was actually supplied; a client
 * built without one keeps the platform's default SSL context untouched.
 */
public class TlsHttpClientConfigurator implements UnaryOperator<Builder> {

    private static final TrustManager[] INSECURE_TRUST_MANAGERS = { new InsecureTrustManager() };

    // only lives in memory, guards nothing
    private static final char[] KEY_STORE_PASSWORD = "threescale".toCharArray();
    private static final String CLIENT_KEY_ALIAS = "client";

    private final TlsMaterial tls;

    /**
     * Creates a TLS configurator.
     *
     * @param tls tls parameters
     */
    public TlsHttpClientConfigurator(@NonNull TlsMaterial tls) {
        this.tls = Objects.requireNonNull(tls);
    }

    @VisibleForTesting
    SSLContext sslContext() {
        try {
            SSLContext context = SSLContext.getInstance("TLS");
            context.init(getKeyManagers(tls.clientCertificate()), getTrustManagers(tls), new SecureRandom());
            return context;
        }
        catch (SslConfigurationException e) {
            throw e;
        }
        catch (Exception e) {
            throw new SslConfigurationException(e);
        }
    }

    /**
     * Trust managers for the given material; null means "use the platform's".
     */
    @VisibleForTesting
    @Nullable
    static TrustManager[] getTrustManagers(TlsMaterial tls) {
        if (tls.insecureSkipVerify()) {
            return INSECURE_TRUST_MANAGERS;
        }
        if (tls.trustPool() == null) {
            return null;
        }
        try {
            TrustManagerFactory managerFactory = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
            managerFactory.init(tls.trustPool());
            return managerFactory.getTrustManagers();
        }
        catch (Exception e) {
            throw new SslConfigurationException(e);
        }
    }

    @VisibleForTesting
    @Nullable
    static KeyManager[] getKeyManagers(@Nullable TlsMaterial.ClientCertificate clientCertificate) {
        if (clientCertificate == null) {
            return null;
        }
        try {
            KeyStore store = KeyStore.getInstance("PKCS12");
            store.load(null, null);
            store.setKeyEntry(CLIENT_KEY_ALIAS, clientCertificate.key(), KEY_STORE_PASSWORD, clientCertificate.chain());
            KeyManagerFactory instance = KeyManagerFactory.getInstance(KeyManagerFactory.getDefaultAlgorithm());
            instance.init(store, KEY_STORE_PASSWORD);
            return instance.getKeyManagers();
        }
        catch (Exception e) {
            throw new SslConfigurationException(e);
        }
    }

    /**
     * Applies TLS configuration to the supplied {@link Builder}.
     *
     * @param builder HTTP client builder
     * @return HTTP client builder
     */
    @Override
    public Builder apply(@NonNull Builder builder) {
        Objects.requireNonNull(builder);
        return builder.sslContext(sslContext());
    }
}
