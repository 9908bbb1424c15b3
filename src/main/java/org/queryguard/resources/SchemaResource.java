package org.queryguard.resources;

import org.queryguard.repo.SchemaRepo;

import javax.ws.rs.GET;
import javax.ws.rs.Path;
import javax.ws.rs.Produces;
import javax.ws.rs.core.MediaType;
import java.sql.SQLException;

@Path("/schema")
@Produces(MediaType.TEXT_PLAIN)
public class SchemaResource {
    static final String PREAMBLE = "You are a careful analytics engineer. Use only these tables.";

    private final SchemaRepo repo;

    public SchemaResource(SchemaRepo repo) {
        this.repo = repo;
    }

    // Instructions an agent is primed with: preamble, blank line, schema description
    @GET
    public String instructions() throws SQLException {
        return PREAMBLE + "\n\n" + repo.describe();
    }
}
