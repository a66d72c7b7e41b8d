package villagecompute.talentqueue.api.rest;

import java.util.Map;

import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import villagecompute.talentqueue.exceptions.JobSystemShutdownException;

@Provider
public class JobSystemShutdownExceptionMapper implements ExceptionMapper<JobSystemShutdownException> {

    @Override
    public Response toResponse(JobSystemShutdownException exception) {
        return Response.status(Response.Status.SERVICE_UNAVAILABLE).type(MediaType.APPLICATION_JSON)
                .entity(Map.of("error", exception.getMessage())).build();
    }
}
