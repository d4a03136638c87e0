/* (C)2026 */
package com.ammann.composemanager.exception;

/**
 * Runtime exception thrown when the compose root directory cannot be scanned as a whole.
 *
 * <p>Problems with individual files never raise this exception; such files are simply left
 * out of the scan result. The exception propagates through the scan cache to every waiting
 * caller and is mapped to an HTTP 503 Service Unavailable response by
 * {@link ComposeScanExceptionMapper}.
 */
public class ComposeScanException extends RuntimeException {

    private final String rootPath;

    /**
     * Constructs a new exception for the given root directory.
     *
     * @param rootPath the configured compose root directory
     * @param reason   a short description of the failure
     */
    public ComposeScanException(String rootPath, String reason) {
        super("Compose file scan failed for " + rootPath + ": " + reason);
        this.rootPath = rootPath;
    }

    /**
     * Constructs a new exception for the given root directory with an underlying cause.
     *
     * @param rootPath the configured compose root directory
     * @param reason   a short description of the failure
     * @param cause    the I/O error that aborted the scan
     */
    public ComposeScanException(String rootPath, String reason, Throwable cause) {
        super("Compose file scan failed for " + rootPath + ": " + reason, cause);
        this.rootPath = rootPath;
    }

    /**
     * Returns the compose root directory that could not be scanned.
     *
     * @return the root path
     */
    public String getRootPath() {
        return rootPath;
    }
}
