package com.wpanther.kmscert.service;

import java.io.IOException;
import java.nio.file.Path;

import org.bouncycastle.operator.ContentSigner;
import org.springframework.util.FileSystemUtils;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Opaque signing handle for the remote key, plus the temporary workspace
 * that backs it. Closing the handle removes the workspace.
 */
@Slf4j
public class SigningHandle implements AutoCloseable {

    @Getter
    private final ContentSigner contentSigner;

    private final Path workspace;

    public SigningHandle(ContentSigner contentSigner) {
        this(contentSigner, null);
    }

    public SigningHandle(ContentSigner contentSigner, Path workspace) {
        this.contentSigner = contentSigner;
        this.workspace = workspace;
    }

    @Override
    public void close() {
        deleteWorkspace(workspace);
    }

    static void deleteWorkspace(Path workspace) {
        if (workspace == null) {
            return;
        }
        try {
            FileSystemUtils.deleteRecursively(workspace);
            log.debug("Removed signing workspace {}", workspace);
        } catch (IOException e) {
            log.warn("Could not remove signing workspace {}: {}", workspace, e.getMessage());
        }
    }
}
