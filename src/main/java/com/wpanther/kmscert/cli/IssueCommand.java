package com.wpanther.kmscert.cli;

import java.util.ArrayList;
import java.util.List;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;
import com.wpanther.kmscert.dto.CertificateRequest;
import com.wpanther.kmscert.dto.IssuanceRequest;
import com.wpanther.kmscert.dto.SigningEngineSettings;

/** Arguments of the {@code issue} command */
@Parameters(commandNames = IssueCommand.NAME,
    commandDescription = "Issue a self-signed certificate for a KMS key")
public class IssueCommand {

    public static final String NAME = "issue";

    @Parameter(names = {"--kms-key-id", "-k"}, required = true,
        description = "KMS key ID, alias or ARN of the signing key")
    private String kmsKeyId;

    @Parameter(names = {"--cert-common-name", "-c"}, required = true,
        description = "Common name (CN) of the certificate subject")
    private String commonName;

    @Parameter(names = {"--validity-days", "-v"}, description = "Validity period in days")
    private int validityDays = CertificateRequest.DEFAULT_VALIDITY_DAYS;

    @Parameter(names = {"--output", "-o"},
        description = "Destination, e.g. file:<path>, json:<field>, s3:<region>|<bucket>|<key>")
    private String output = IssuanceRequest.DEFAULT_DESTINATION;

    @Parameter(names = "--cert-country", description = "Country (C)")
    private String country;

    @Parameter(names = "--cert-state", description = "State or province (ST)")
    private String state;

    @Parameter(names = "--cert-locality", description = "Locality (L)")
    private String locality;

    @Parameter(names = "--cert-org", description = "Organization (O)")
    private String organization;

    @Parameter(names = "--cert-org-unit", description = "Organizational unit (OU)")
    private String organizationalUnit;

    @Parameter(names = "--cert-email", description = "Email address")
    private String emailAddress;

    @Parameter(names = "--cert-san", description = "DNS subject alternative name; may be repeated")
    private List<String> subjectAlternativeNames = new ArrayList<>();

    @Parameter(names = "--cert-serial", description = "Certificate serial number")
    private long serial = CertificateRequest.DEFAULT_SERIAL;

    @Parameter(names = "--cert-ca", description = "Mark the certificate as a CA certificate")
    private boolean certificateAuthority;

    @Parameter(names = "--require-rsa", description = "Fail unless the KMS key is an RSA key")
    private boolean requireRsa;

    @Parameter(names = "--pkcs11-label",
        description = "Sign through the PKCS#11 module using the key with this token label")
    private String pkcs11Label;

    @Parameter(names = "--pkcs11-config-file", description = "SunPKCS11 provider configuration file")
    private String pkcs11ConfigFile;

    @Parameter(names = "--debug", description = "Verbose logging, including the PKCS#11 provider")
    private boolean debug;

    public boolean isDebug() {
        return debug;
    }

    public IssuanceRequest toIssuanceRequest() {
        CertificateRequest certificateRequest = CertificateRequest.builder()
            .commonName(commonName)
            .country(country)
            .state(state)
            .locality(locality)
            .organization(organization)
            .organizationalUnit(organizationalUnit)
            .emailAddress(emailAddress)
            .subjectAlternativeNames(subjectAlternativeNames)
            .validityDays(validityDays)
            .serial(serial)
            .certificateAuthority(certificateAuthority)
            .build();

        SigningEngineSettings engineSettings = SigningEngineSettings.builder()
            .pkcs11Label(pkcs11Label)
            .pkcs11ConfigFile(pkcs11ConfigFile)
            .debug(debug)
            .build();

        return IssuanceRequest.builder()
            .kmsKeyId(kmsKeyId)
            .certificateRequest(certificateRequest)
            .destination(output)
            .requireRsa(requireRsa)
            .engineSettings(engineSettings)
            .build();
    }
}
