/*
 * Copyright Threescale Adapter Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.threescale.adapter.tls;

import java.security.KeyStore;
import java.security.PrivateKey;
import java.security.cert.X509Certificate;
import java.util.Arrays;
import java.util.Objects;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * TLS settings applied to the outbound HTTP client.
 *
 * @param insecureSkipVerify if true, the server's certificate chain and host name are not verified
 * @param trustPool trust anchors to verify servers against, or null to use the platform's
 * @param clientCertificate certificate presented to servers requesting client authentication, or null
 */
public record TlsMaterial(boolean insecureSkipVerify,
                          @Nullable KeyStore trustPool,
                          @Nullable ClientCertificate clientCertificate) {

    /**
     * A private key and its certificate chain, leaf first.
     *
     * @param key private key
     * @param chain certificate chain
     */
    public record ClientCertificate(PrivateKey key, X509Certificate[] chain) {
        public ClientCertificate {
            Objects.requireNonNull(key);
            Objects.requireNonNull(chain);
            if (chain.length == 0) {
                throw new IllegalArgumentException("certificate chain must not be empty");
            }
            chain = chain.clone();
        }

        @Override
        public X509Certificate[] chain() {
            return chain.clone();
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof ClientCertificate that)) {
                return false;
            }
            return key.equals(that.key) && Arrays.equals(chain, that.chain);
        }

        @Override
        public int hashCode() {
            return Objects.hash(key, Arrays.hashCode(chain));
        }

        @Override
        public String toString() {
            return "ClientCertificate[subject=" + chain[0].getSubjectX500Principal().getName() + "]";
        }
    }
}
