package com.wpanther.kmscert.exception;

import java.io.PrintStream;

import org.springframework.stereotype.Component;

import com.wpanther.kmscert.cli.ExitCodes;

import lombok.extern.slf4j.Slf4j;

/**
 * Turns a failed command into one diagnostic line on stderr and a process exit code
 */
@Component
@Slf4j
public class CommandExceptionHandler {

    private final PrintStream err;

    public CommandExceptionHandler() {
        this(System.err);
    }

    CommandExceptionHandler(PrintStream err) {
        this.err = err;
    }

    public int handle(Exception exception) {
        if (exception instanceof InputFileException) {
            return report("Invalid input file", exception, ExitCodes.INVALID_INPUT_FILE);
        }
        if (exception instanceof InputValidationException) {
            return report("Invalid input", exception, ExitCodes.FAILURE);
        }
        if (exception instanceof KeySpecException) {
            return report("Unsuitable KMS key", exception, ExitCodes.FAILURE);
        }
        if (exception instanceof OracleCallException) {
            return report("KMS request failed", exception, ExitCodes.FAILURE);
        }
        if (exception instanceof SigningException) {
            return report("Signing failed", exception, ExitCodes.FAILURE);
        }
        if (exception instanceof CertificateGenerationException) {
            return report("Certificate generation failed", exception, ExitCodes.FAILURE);
        }
        if (exception instanceof SinkWriteException) {
            return report("Could not write certificate", exception, ExitCodes.FAILURE);
        }
        if (exception instanceof UnsupportedPublicKeyFormatException) {
            return report("Unsupported public key", exception, ExitCodes.FAILURE);
        }

        log.error("Unexpected error", exception);
        return report("Unexpected error", exception, ExitCodes.FAILURE);
    }

    private int report(String summary, Exception exception, int exitCode) {
        log.debug("{}", summary, exception);
        err.println("ERROR: " + summary + ": " + exception.getMessage());
        err.flush();
        return exitCode;
    }
}
