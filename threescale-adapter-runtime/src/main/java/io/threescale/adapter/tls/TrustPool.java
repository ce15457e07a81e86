/*
 * Copyright Threescale Adapter Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.threescale.adapter.tls;

import java.io.IOException;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import javax.net.ssl.TrustManager;
import javax.net.ssl.TrustManagerFactory;
import javax.net.ssl.X509TrustManager;

/**
 * A mutable collection of trust anchors that can be frozen into a {@link KeyStore}.
 */
public final class TrustPool {

    /**
     * Source of the trust anchors the platform trusts by default.
     */
    @FunctionalInterface
    public interface PlatformTrustAnchors {
        X509Certificate[] load() throws GeneralSecurityException;
    }

    /**
     * Reads the anchors of the JDK's default trust manager (the {@code cacerts} store, or
     * whatever {@code javax.net.ssl.trustStore} points at).
     */
    public static final PlatformTrustAnchors JDK_TRUST_ANCHORS = () -> {
        TrustManagerFactory factory = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
        factory.init((KeyStore) null);
        for (TrustManager trustManager : factory.getTrustManagers()) {
            if (trustManager instanceof X509TrustManager x509TrustManager) {
                return x509TrustManager.getAcceptedIssuers();
            }
        }
        throw new GeneralSecurityException("platform provides no X509 trust manager");
    };

    private final List<X509Certificate> anchors = new ArrayList<>();

    private TrustPool() {
    }

    public static TrustPool empty() {
        return new TrustPool();
    }

    public static TrustPool of(PlatformTrustAnchors platform) throws GeneralSecurityException {
        var pool = new TrustPool();
        pool.anchors.addAll(Arrays.asList(platform.load()));
        return pool;
    }

    public TrustPool add(X509Certificate... certificates) {
        anchors.addAll(Arrays.asList(certificates));
        return this;
    }

    public int size() {
        return anchors.size();
    }

    /**
     * Freezes the pool into an in-memory key store holding one trusted certificate entry per anchor.
     * @return key store
     */
    public KeyStore toKeyStore() {
        try {
            KeyStore store = KeyStore.getInstance(KeyStore.getDefaultType());
            store.load(null, null);
            int i = 0;
            for (X509Certificate anchor : anchors) {
                store.setCertificateEntry("anchor-" + i++, anchor);
            }
            return store;
        }
        catch (GeneralSecurityException | IOException e) {
            throw new SslConfigurationException("failed to build trust store", e);
        }
    }
}
