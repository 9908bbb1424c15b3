package org.queryguard.resources;

import org.queryguard.dto.ToolDescriptor;

import javax.ws.rs.GET;
import javax.ws.rs.Path;
import javax.ws.rs.Produces;
import javax.ws.rs.core.MediaType;

@Path("/tool")
@Produces(MediaType.APPLICATION_JSON)
public class ToolResource {
    private static final ToolDescriptor DESCRIPTOR = ToolDescriptor.executeSql();

    @GET
    public ToolDescriptor descriptor() {
        return DESCRIPTOR;
    }
}
