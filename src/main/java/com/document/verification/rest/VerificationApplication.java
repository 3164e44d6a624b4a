package com.document.verification.rest;

import jakarta.ws.rs.ApplicationPath;
import jakarta.ws.rs.core.Application;
import org.eclipse.microprofile.openapi.annotations.OpenAPIDefinition;
import org.eclipse.microprofile.openapi.annotations.info.Info;
import org.eclipse.microprofile.openapi.annotations.info.License;

/**
 * Jakarta RS Application class with OpenAPI metadata.
 */
@ApplicationPath("/")
@OpenAPIDefinition(
        info = @Info(
                title = "Document Verification API",
                version = "1.0.0",
                description = "Compares OCR-extracted document fields against user-edited values and " +
                        "reports a per-field similarity, combined confidence score and match status.",
                license = @License(
                        name = "Apache 2.0",
                        url = "https://www.apache.org/licenses/LICENSE-2.0.html"
                )
        )
)
public class VerificationApplication extends Application {
}
