package org.queryguard.errors;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.queryguard.dto.ApiError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.ws.rs.WebApplicationException;
import javax.ws.rs.core.MediaType;
import javax.ws.rs.core.Response;
import javax.ws.rs.ext.ExceptionMapper;
import javax.ws.rs.ext.Provider;

// Rejected and failed queries are regular responses; this only sees faults at the HTTP boundary
@Provider
public class GlobalExceptionMapper implements ExceptionMapper<Throwable> {
    private static final Logger LOG = LoggerFactory.getLogger(GlobalExceptionMapper.class);

    @Override
    public Response toResponse(Throwable e) {
        if (e instanceof JsonProcessingException) {
            return json(ApiError.badRequest("malformed JSON body"));
        }
        if (e instanceof IllegalArgumentException) {
            return json(ApiError.badRequest(e.getMessage()));
        }

        if (e instanceof WebApplicationException) {
            WebApplicationException we = (WebApplicationException) e;
            Response r = we.getResponse();
            int code = (r != null) ? r.getStatus() : 500;

            if (r != null && r.hasEntity()) return r;

            return json(new ApiError(code, messageFor(code), we.getMessage()));
        }

        LOG.error("Unhandled exception", e);
        return json(new ApiError(500, "internal error", "unexpected error"));
    }

    private static Response json(ApiError error) {
        return Response.status(error.code)
                .type(MediaType.APPLICATION_JSON)
                .entity(error)
                .build();
    }

    private static String messageFor(int code) {
        if (code == 404) return "not found";
        if (code == 405) return "method not allowed";
        if (code == 415) return "unsupported media type";
        if (code >= 400 && code < 500) return "bad request";
        return "internal error";
    }
}
