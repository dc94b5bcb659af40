package com.wpanther.kmscert.cli;

import java.nio.file.Path;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;

/** Arguments of the {@code verify-kms} command */
@Parameters(commandNames = VerifyKmsKeyCommand.NAME,
    commandDescription = "Check that a certificate carries the public key of a KMS key")
public class VerifyKmsKeyCommand {

    public static final String NAME = "verify-kms";

    @Parameter(names = {"--kms-key-id", "-k"}, required = true, description = "KMS key ID, alias or ARN")
    private String kmsKeyId;

    @Parameter(names = {"--certificate", "-f"}, required = true, description = "Certificate file (PEM or DER)")
    private Path certificateFile;

    public String getKmsKeyId() {
        return kmsKeyId;
    }

    public Path getCertificateFile() {
        return certificateFile;
    }
}
