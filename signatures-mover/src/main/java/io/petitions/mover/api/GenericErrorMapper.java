package io.petitions.mover.api;

import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.Objects;

@Provider
public class GenericErrorMapper implements ExceptionMapper<Throwable> {

    private static final Logger LOG = Logger.getLogger(GenericErrorMapper.class);

    @Override
    public Response toResponse(Throwable ex) {
        // 404, 405, 415 and friends keep the status JAX-RS chose for them
        if (ex instanceof WebApplicationException wae) {
            return wae.getResponse();
        }
        LOG.error("Admin request failed", ex);
        var body = Map.of(
                "error", "Internal Server Error",
                "detail", Objects.toString(ex.getMessage(), ex.getClass().getSimpleName()),
                "at", OffsetDateTime.now().toString()
        );
        return Response.status(500).type(MediaType.APPLICATION_JSON).entity(body).build();
    }
}
