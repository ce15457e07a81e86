/*
 * Copyright Threescale Adapter Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.threescale.adapter.tls;

import java.io.IOException;
import java.io.StringReader;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.SecureRandom;
import java.security.Signature;
import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;
import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.util.ArrayList;
import java.util.List;

import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.openssl.PEMKeyPair;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.openssl.jcajce.JcaPEMKeyConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Utility class for parsing PEM encoded certificates and private keys.
 */
public final class PemFiles {

    private static final Logger LOGGER = LoggerFactory.getLogger(PemFiles.class);

    private PemFiles() {
        // Utility class
    }

    /**
     * Parses the PEM encoded certificates contained in the given bytes.  Other PEM objects,
     * such as a private key sharing the file, and text outside the PEM blocks are skipped.
     *
     * @param pemBytes PEM-encoded certificate bytes
     * @return parsed certificates in file order
     * @throws IOException if no certificate can be parsed
     */
    @NonNull
    public static X509Certificate[] parseCertificates(@NonNull byte[] pemBytes) throws IOException {
        var converter = new JcaX509CertificateConverter();
        List<X509Certificate> certificates = new ArrayList<>();
        try (PEMParser parser = new PEMParser(new StringReader(new String(pemBytes, StandardCharsets.US_ASCII)))) {
            Object object;
            while ((object = parser.readObject()) != null) {
                if (object instanceof X509CertificateHolder holder) {
                    certificates.add(converter.getCertificate(holder));
                }
                else {
                    LOGGER.debug("Skipping PEM object of type {} while looking for certificates", object.getClass().getSimpleName());
                }
            }
        }
        catch (CertificateException e) {
            throw new IOException("Failed to parse certificates", e);
        }
        if (certificates.isEmpty()) {
            throw new IOException("No certificates found in PEM data");
        }
        return certificates.toArray(new X509Certificate[0]);
    }

    /**
     * Parses the first private key found in PEM data.  PKCS#8 ({@code PRIVATE KEY}) as well as the
     * traditional OpenSSL ({@code RSA PRIVATE KEY}, {@code EC PRIVATE KEY}) encodings are understood.
     *
     * @param pemBytes PEM-encoded private key bytes
     * @return The parsed PrivateKey
     * @throws IOException if the key cannot be parsed
     */
    @NonNull
    public static PrivateKey parsePrivateKey(@NonNull byte[] pemBytes) throws IOException {
        var converter = new JcaPEMKeyConverter();
        try (PEMParser parser = new PEMParser(new StringReader(new String(pemBytes, StandardCharsets.US_ASCII)))) {
            Object object;
            while ((object = parser.readObject()) != null) {
                if (object instanceof PEMKeyPair keyPair) {
                    return converter.getKeyPair(keyPair).getPrivate();
                }
                if (object instanceof PrivateKeyInfo privateKeyInfo) {
                    return converter.getPrivateKey(privateKeyInfo);
                }
                LOGGER.debug("Skipping PEM object of type {} while looking for a private key", object.getClass().getSimpleName());
            }
        }
        throw new IOException("No private key found in PEM data");
    }

    /**
     * Validates that a private key matches the public key in a certificate.
     *
     * @param privateKey The private key to validate
     * @param certificate The certificate containing the public key
     * @throws IllegalStateException if the keys don't match
     */
    public static void validateKeyAndCertMatch(@NonNull PrivateKey privateKey, @NonNull X509Certificate certificate) {
        PublicKey publicKey = certificate.getPublicKey();

        if (!privateKey.getAlgorithm().equals(publicKey.getAlgorithm())) {
            throw new IllegalStateException(
                    "Private key algorithm (" + privateKey.getAlgorithm() +
                            ") does not match certificate public key algorithm (" + publicKey.getAlgorithm() + ")");
        }

        String algorithm = privateKey.getAlgorithm();
        switch (algorithm) {
            case "RSA" -> validateRsaKeyMatch(privateKey, publicKey);
            case "EC" -> validateBySignature("SHA256withECDSA", privateKey, publicKey);
            default -> LOGGER.debug("Key-certificate matching for {} validated via algorithm check", algorithm);
        }
    }

    private static void validateRsaKeyMatch(@NonNull PrivateKey privateKey, @NonNull PublicKey publicKey) {
        if (!(privateKey instanceof RSAPrivateKey rsaPrivateKey)) {
            throw new IllegalStateException("Expected RSAPrivateKey but got " + privateKey.getClass().getName());
        }
        if (!(publicKey instanceof RSAPublicKey rsaPublicKey)) {
            throw new IllegalStateException("Expected RSAPublicKey but got " + publicKey.getClass().getName());
        }

        BigInteger privateModulus = rsaPrivateKey.getModulus();
        BigInteger publicModulus = rsaPublicKey.getModulus();
        if (privateModulus == null || !privateModulus.equals(publicModulus)) {
            throw new IllegalStateException("private key does not match certificate public key");
        }
    }

    private static void validateBySignature(String signatureAlgorithm, PrivateKey privateKey, PublicKey publicKey) {
        try {
            byte[] challenge = new byte[32];
            new SecureRandom().nextBytes(challenge);

            Signature signer = Signature.getInstance(signatureAlgorithm);
            signer.initSign(privateKey);
            signer.update(challenge);
            byte[] signature = signer.sign();

            Signature verifier = Signature.getInstance(signatureAlgorithm);
            verifier.initVerify(publicKey);
            verifier.update(challenge);
            if (!verifier.verify(signature)) {
                throw new IllegalStateException("private key does not match certificate public key");
            }
        }
        catch (GeneralSecurityException e) {
            throw new IllegalStateException("unable to check private key against certificate: " + e.getMessage(), e);
        }
    }
}
