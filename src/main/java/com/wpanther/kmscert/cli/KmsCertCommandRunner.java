package com.wpanther.kmscert.cli;

import java.io.PrintStream;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.stereotype.Component;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.ParameterException;
import com.wpanther.kmscert.dto.VerificationResult;
import com.wpanther.kmscert.exception.CommandExceptionHandler;
import com.wpanther.kmscert.service.CertificateIssuanceService;
import com.wpanther.kmscert.service.KeyVerificationService;

import lombok.extern.slf4j.Slf4j;

/**
 * Parses the command line and dispatches to the issue and verify commands
 */
@Component
@Slf4j
public class KmsCertCommandRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final String PROGRAM_NAME = "kmscert";
    private static final String LOGGER_NAME = "com.wpanther.kmscert";

    private final CertificateIssuanceService issuanceService;
    private final KeyVerificationService verificationService;
    private final CommandExceptionHandler exceptionHandler;
    private final LoggingSystem loggingSystem;
    private final PrintStream out;
    private final PrintStream err;

    private int exitCode = ExitCodes.SUCCESS;

    @Autowired
    public KmsCertCommandRunner(CertificateIssuanceService issuanceService,
                                KeyVerificationService verificationService,
                                CommandExceptionHandler exceptionHandler,
                                LoggingSystem loggingSystem) {
        this(issuanceService, verificationService, exceptionHandler, loggingSystem, System.out, System.err);
    }

    KmsCertCommandRunner(CertificateIssuanceService issuanceService,
                         KeyVerificationService verificationService,
                         CommandExceptionHandler exceptionHandler,
                         LoggingSystem loggingSystem,
                         PrintStream out,
                         PrintStream err) {
        this.issuanceService = issuanceService;
        this.verificationService = verificationService;
        this.exceptionHandler = exceptionHandler;
        this.loggingSystem = loggingSystem;
        this.out = out;
        this.err = err;
    }

    @Override
    public void run(String... args) {
        exitCode = execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    /**
     * Runs one command
     *
     * @param args The raw command line
     * @return The process exit code, see {@link ExitCodes}
     */
    public int execute(String... args) {
        IssueCommand issue = new IssueCommand();
        VerifyKmsKeyCommand verifyKms = new VerifyKmsKeyCommand();
        VerifyKeyFileCommand verifyFile = new VerifyKeyFileCommand();
        JCommander commander = JCommander.newBuilder()
            .programName(PROGRAM_NAME)
            .addCommand(issue)
            .addCommand(verifyKms)
            .addCommand(verifyFile)
            .build();

        try {
            commander.parse(args);
        } catch (ParameterException e) {
            err.println("ERROR: " + e.getMessage());
            printUsage(commander);
            return ExitCodes.USAGE;
        }

        String command = commander.getParsedCommand();
        if (command == null) {
            printUsage(commander);
            return ExitCodes.USAGE;
        }

        try {
            switch (command) {
                case IssueCommand.NAME:
                    return issue(issue);
                case VerifyKmsKeyCommand.NAME:
                    return report(verificationService.verifyAgainstKmsKey(verifyKms.getCertificateFile(),
                        verifyKms.getKmsKeyId()));
                case VerifyKeyFileCommand.NAME:
                    return report(verificationService.verifyAgainstKeyFile(verifyFile.getCertificateFile(),
                        verifyFile.getKeyFile()));
                default:
                    printUsage(commander);
                    return ExitCodes.USAGE;
            }
        } catch (Exception e) {
            return exceptionHandler.handle(e);
        }
    }

    private int issue(IssueCommand command) {
        if (command.isDebug()) {
            loggingSystem.setLogLevel(LOGGER_NAME, LogLevel.DEBUG);
            log.debug("Debug logging enabled");
        }
        issuanceService.issue(command.toIssuanceRequest());
        return ExitCodes.SUCCESS;
    }

    private int report(VerificationResult result) {
        if (result.isMatch()) {
            out.println("OK: certificate public key matches " + result.getReference());
            out.flush();
            return ExitCodes.SUCCESS;
        }
        err.println("WARNING: certificate public key does not match " + result.getReference());
        err.println("Certificate public key:");
        err.print(result.getCertificatePublicKeyPem());
        err.println("Reference public key:");
        err.print(result.getReferencePublicKeyPem());
        err.flush();
        return ExitCodes.KEY_MISMATCH;
    }

    private void printUsage(JCommander commander) {
        StringBuilder usage = new StringBuilder();
        commander.getUsageFormatter().usage(usage);
        err.print(usage);
        err.flush();
    }
}
