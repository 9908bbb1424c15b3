package org.queryguard.resources;

import org.queryguard.dto.AdmissionResponse;
import org.queryguard.dto.QueryResponse;
import org.queryguard.dto.SubmitQueryRequest;
import org.queryguard.model.CandidateQuery;
import org.queryguard.service.QueryService;

import javax.ws.rs.Consumes;
import javax.ws.rs.POST;
import javax.ws.rs.Path;
import javax.ws.rs.Produces;
import javax.ws.rs.WebApplicationException;
import javax.ws.rs.core.MediaType;

@Path("/queries")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class QueryResource {
    private final QueryService service;

    public QueryResource(QueryService service) {
        this.service = service;
    }

    private static CandidateQuery candidate(SubmitQueryRequest req) {
        String sql = (req == null) ? null : req.getSql();
        if (sql == null || sql.trim().isEmpty()) {
            throw new WebApplicationException("sql required", 400);
        }
        return CandidateQuery.of(sql);
    }

    @POST
    public QueryResponse run(SubmitQueryRequest req) {
        return service.run(candidate(req));
    }

    @POST
    @Path("/admissions")
    public AdmissionResponse admit(SubmitQueryRequest req) {
        return service.admit(candidate(req));
    }
}
