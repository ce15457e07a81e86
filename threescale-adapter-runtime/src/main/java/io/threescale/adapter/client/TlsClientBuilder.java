/*
 * Copyright Threescale Adapter Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.threescale.adapter.client;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.PrivateKey;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.threescale.adapter.config.IllegalConfigurationException;
import io.threescale.adapter.config.Settings;
import io.threescale.adapter.tls.PemFiles;
import io.threescale.adapter.tls.TlsMaterial;
import io.threescale.adapter.tls.TlsMaterial.ClientCertificate;
import io.threescale.adapter.tls.TrustPool;

import edu.umd.cs.findbugs.annotations.Nullable;

import static io.threescale.adapter.config.SettingNames.ALLOW_INSECURE_CONN;
import static io.threescale.adapter.config.SettingNames.CLIENT_CERT;
import static io.threescale.adapter.config.SettingNames.CLIENT_KEY;
import static io.threescale.adapter.config.SettingNames.CLIENT_TIMEOUT_SECONDS;
import static io.threescale.adapter.config.SettingNames.ROOT_CA;

/**
 * <p>Resolves the outbound HTTP client from settings.</p>
 *
 * <p>The TLS settings are applied in a fixed order, each layering onto what came before:
 * the insecure flag, then the root CA bundle, then the client certificate. Each of them
 * that applies marks TLS as in use. When none applies the client keeps the platform's
 * default transport.</p>
 *
 * <p>Any problem with supplied TLS material is an {@link IllegalConfigurationException};
 * no client is built in that case.</p>
 */
public class TlsClientBuilder {

    private static final Logger LOGGER = LoggerFactory.getLogger(TlsClientBuilder.class);

    private final TrustPool.PlatformTrustAnchors platformTrustAnchors;

    public TlsClientBuilder() {
        this(TrustPool.JDK_TRUST_ANCHORS);
    }

    public TlsClientBuilder(TrustPool.PlatformTrustAnchors platformTrustAnchors) {
        this.platformTrustAnchors = Objects.requireNonNull(platformTrustAnchors);
    }

    /**
     * Builds the client the authorizer uses to reach 3scale.
     * @param settings settings
     * @return client
     * @throws IllegalConfigurationException if the TLS settings are incomplete or point at unusable material
     */
    public BackendHttpClient build(Settings settings) {
        return BackendHttpClient.create(resolveClientConfig(settings));
    }

    /**
     * Resolves the client configuration without building the client.
     * @param settings settings
     * @return client configuration
     */
    public ClientConfig resolveClientConfig(Settings settings) {
        Duration timeout = ClientConfig.DEFAULT_TIMEOUT;
        if (settings.isSet(CLIENT_TIMEOUT_SECONDS)) {
            timeout = settings.getSeconds(CLIENT_TIMEOUT_SECONDS);
        }

        boolean useTls = false;
        boolean insecureSkipVerify = false;
        KeyStore trustPool = null;
        ClientCertificate clientCertificate = null;

        if (settings.isSet(ALLOW_INSECURE_CONN)) {
            insecureSkipVerify = settings.getBool(ALLOW_INSECURE_CONN);
            useTls = true;
        }

        if (settings.isSet(ROOT_CA)) {
            String rootCaPath = settings.getString(ROOT_CA);
            if (!rootCaPath.isEmpty()) {
                trustPool = loadTrustPool(rootCaPath);
                useTls = true;
            }
        }

        if (settings.isSet(CLIENT_CERT) || settings.isSet(CLIENT_KEY)) {
            clientCertificate = resolveClientCertificate(settings);
            if (clientCertificate != null) {
                useTls = true;
            }
        }

        Optional<TlsMaterial> tls = useTls
                ? Optional.of(new TlsMaterial(insecureSkipVerify, trustPool, clientCertificate))
                : Optional.empty();
        LOGGER.atDebug()
                .setMessage("Resolved HTTP client: timeout {}, TLS {}")
                .addArgument(timeout)
                .addArgument(tls.isPresent() ? "configured" : "platform default")
                .log();
        return new ClientConfig(timeout, tls);
    }

    private KeyStore loadTrustPool(String rootCaPath) {
        TrustPool pool;
        try {
            pool = TrustPool.of(platformTrustAnchors);
        }
        catch (GeneralSecurityException | RuntimeException e) {
            LOGGER.warn("failed to read system certificates {}, trying to read CA certs anyway", e.toString());
            pool = TrustPool.empty();
        }

        byte[] pem;
        try {
            pem = Files.readAllBytes(Path.of(rootCaPath));
        }
        catch (IOException e) {
            throw new IllegalConfigurationException("failed to read root CA file " + rootCaPath, e);
        }

        try {
            pool.add(PemFiles.parseCertificates(pem));
        }
        catch (IOException e) {
            throw new IllegalConfigurationException("failed to parse root CA certificates", e);
        }
        return pool.toKeyStore();
    }

    @Nullable
    private static ClientCertificate resolveClientCertificate(Settings settings) {
        if (!settings.isSet(CLIENT_CERT)) {
            // a stray empty client_key on its own configures nothing
            if (settings.getString(CLIENT_KEY).isEmpty()) {
                return null;
            }
            throw new IllegalConfigurationException("both client_cert and client_key must be provided if you set any of them");
        }
        String certPath = settings.getString(CLIENT_CERT);
        if (certPath.isEmpty() || !settings.isSet(CLIENT_KEY)) {
            throw new IllegalConfigurationException("both client_cert and client_key must be provided if you set any of them");
        }
        String keyPath = settings.getString(CLIENT_KEY);
        if (keyPath.isEmpty()) {
            throw new IllegalConfigurationException("empty client_key path");
        }
        return loadKeyPair(certPath, keyPath);
    }

    private static ClientCertificate loadKeyPair(String certPath, String keyPath) {
        try {
            X509Certificate[] chain = PemFiles.parseCertificates(Files.readAllBytes(Path.of(certPath)));
            PrivateKey key = PemFiles.parsePrivateKey(Files.readAllBytes(Path.of(keyPath)));
            PemFiles.validateKeyAndCertMatch(key, chain[0]);
            return new ClientCertificate(key, chain);
        }
        catch (IOException | RuntimeException e) {
            throw new IllegalConfigurationException("error creating X509 key pair from " + certPath + " and " + keyPath, e);
        }
    }
}
