package villagecompute.talentqueue.api.rest;

import java.util.Map;

import org.jboss.logging.Logger;

import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import villagecompute.talentqueue.exceptions.BrokerUnavailableException;

/**
 * Maps {@link BrokerUnavailableException} to 503. The cause stays in the log.
 */
@Provider
public class BrokerUnavailableExceptionMapper implements ExceptionMapper<BrokerUnavailableException> {

    private static final Logger LOG = Logger.getLogger(BrokerUnavailableExceptionMapper.class);

    @Override
    public Response toResponse(BrokerUnavailableException exception) {
        LOG.warnf("Job broker unavailable: %s", exception.getMessage());
        return Response.status(Response.Status.SERVICE_UNAVAILABLE).type(MediaType.APPLICATION_JSON)
                .entity(Map.of("error", "Job broker unavailable, try again later")).build();
    }
}
