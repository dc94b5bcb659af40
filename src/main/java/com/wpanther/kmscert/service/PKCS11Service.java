package com.wpanther.kmscert.service;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.Key;
import java.security.KeyStore;
import java.security.PrivateKey;
import java.security.Provider;
import java.security.Security;

import org.bouncycastle.operator.ContentSigner;
import org.bouncycastle.operator.jcajce.JcaContentSignerBuilder;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import com.wpanther.kmscert.dto.SigningAlgorithm;
import com.wpanther.kmscert.dto.SigningEngineSettings;
import com.wpanther.kmscert.exception.SigningException;

import lombok.extern.slf4j.Slf4j;

/**
 * Opens signing handles on a PKCS#11 token, typically the AWS KMS PKCS#11
 * module, which exposes KMS keys as token objects addressed by label.
 */
@Service
@Slf4j
public class PKCS11Service {

    static final String SUN_PKCS11 = "SunPKCS11";

    @Value("${app.pkcs11.provider:SunPKCS11}")
    private String pkcs11Provider;

    @Value("${app.pkcs11.library-path:/usr/lib/x86_64-linux-gnu/pkcs11/aws_kms_pkcs11.so}")
    private String pkcs11LibraryPath;

    @Value("${app.pkcs11.pin:}")
    private String pin;

    /**
     * Looks up the private key with the configured label and wraps it in a content signer
     *
     * @param settings Label, config file and debug flag for the token
     * @param algorithm The signature algorithm the certificate is signed with
     * @return A handle that must be closed once the certificate is built
     */
    public SigningHandle openSigningHandle(SigningEngineSettings settings, SigningAlgorithm algorithm) {
        Path workspace = null;
        try {
            String configFile = settings.getPkcs11ConfigFile();
            if (configFile == null || configFile.isBlank()) {
                workspace = Files.createTempDirectory("kmscert-pkcs11-");
                configFile = writeProviderConfig(workspace, settings.isDebug()).toString();
            }

            Provider provider = configureProvider(configFile);
            PrivateKey privateKey = getPrivateKey(provider, settings.getPkcs11Label());

            ContentSigner signer = new JcaContentSignerBuilder(algorithm.getJcaName())
                .setProvider(provider)
                .build(privateKey);

            log.info("Signing with PKCS#11 key labelled '{}' on provider {}",
                settings.getPkcs11Label(), provider.getName());
            return new SigningHandle(signer, workspace);

        } catch (SigningException e) {
            SigningHandle.deleteWorkspace(workspace);
            throw e;
        } catch (Exception e) {
            SigningHandle.deleteWorkspace(workspace);
            log.error("Failed to open PKCS#11 signing handle", e);
            throw new SigningException("Failed to open PKCS#11 signing handle: " + e.getMessage(), e);
        }
    }

    /**
     * Writes a SunPKCS11 configuration naming the PKCS#11 module library
     */
    Path writeProviderConfig(Path workspace, boolean debug) throws Exception {
        StringBuilder config = new StringBuilder()
            .append("name = KmsCert\n")
            .append("library = ").append(pkcs11LibraryPath).append('\n');
        if (debug) {
            config.append("showInfo = true\n");
        }
        Path configPath = workspace.resolve("pkcs11.cfg");
        Files.writeString(configPath, config.toString(), StandardCharsets.UTF_8);
        log.debug("Wrote PKCS#11 provider config to {}", configPath);
        return configPath;
    }

    private Provider configureProvider(String configFile) throws Exception {
        if (SUN_PKCS11.equals(pkcs11Provider)) {
            log.debug("Using PKCS#11 config file: {}", configFile);
            Provider provider = Security.getProvider(SUN_PKCS11);
            if (provider == null) {
                throw new SigningException("SunPKCS11 provider is not available in this JVM");
            }
            // configure() returns a new provider instance; nothing is registered globally
            return provider.configure(configFile);
        }

        log.debug("Using custom PKCS#11 provider: {}", pkcs11Provider);
        Class<?> providerClass = Class.forName(pkcs11Provider);
        return (Provider) providerClass.getDeclaredConstructor().newInstance();
    }

    private PrivateKey getPrivateKey(Provider provider, String label) throws Exception {
        char[] pinChars = pin == null ? new char[0] : pin.toCharArray();

        KeyStore keyStore = KeyStore.getInstance("PKCS11", provider);
        keyStore.load(null, pinChars);

        if (!keyStore.containsAlias(label)) {
            throw new SigningException("No entry found on PKCS#11 token with label: " + label);
        }

        Key key = keyStore.getKey(label, pinChars);
        if (!(key instanceof PrivateKey)) {
            throw new SigningException("PKCS#11 entry does not hold a private key: " + label);
        }
        return (PrivateKey) key;
    }
}
