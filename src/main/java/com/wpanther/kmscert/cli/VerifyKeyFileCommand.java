package com.wpanther.kmscert.cli;

import java.nio.file.Path;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;

/** Arguments of the {@code verify-file} command */
@Parameters(commandNames = VerifyKeyFileCommand.NAME,
    commandDescription = "Check that a certificate carries the public key stored in a key file")
public class VerifyKeyFileCommand {

    public static final String NAME = "verify-file";

    @Parameter(names = {"--certificate", "-f"}, required = true, description = "Certificate file (PEM or DER)")
    private Path certificateFile;

    @Parameter(names = {"--key-file", "-p"}, required = true,
        description = "Public key, private key or certificate PEM file")
    private Path keyFile;

    public Path getCertificateFile() {
        return certificateFile;
    }

    public Path getKeyFile() {
        return keyFile;
    }
}
