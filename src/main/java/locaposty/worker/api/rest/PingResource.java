package locaposty.worker.api.rest;

import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

/**
 * Liveness probe for the process supervisor. The worker's only inbound endpoint besides the Quarkus management
 * routes.
 */
@Path("/ping")
@Tag(
        name = "Health",
        description = "Health check operations")
public class PingResource {

    @GET
    @Produces(MediaType.TEXT_PLAIN)
    @Operation(
            summary = "Liveness check",
            description = "Returns pong while the worker process is up")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Worker is alive")})
    public String ping() {
        return "pong";
    }
}
