/* (C)2026 */
package com.ammann.composemanager.exception;

import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import java.util.Map;

/**
 * JAX-RS exception mapper that converts {@link ComposeScanException} into an
 * HTTP 503 Service Unavailable response with a JSON error body containing the error label,
 * message, and the compose root directory.
 */
@Provider
public class ComposeScanExceptionMapper implements ExceptionMapper<ComposeScanException> {

    @Override
    public Response toResponse(ComposeScanException exception) {
        return Response.status(Response.Status.SERVICE_UNAVAILABLE)
                .entity(
                        Map.of(
                                "error", "Service Unavailable",
                                "message", exception.getMessage(),
                                "rootPath", exception.getRootPath()))
                .build();
    }
}
