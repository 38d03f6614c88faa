package dev.ebullient.detective.lookup;

import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

import org.eclipse.microprofile.rest.client.inject.RegisterRestClient;

import com.fasterxml.jackson.databind.JsonNode;

@RegisterRestClient(configKey = "wikipedia")
@Path("/page/summary")
public interface WikipediaClient {

    @GET
    @Path("/{title}")
    @Produces(MediaType.APPLICATION_JSON)
    JsonNode summary(@PathParam("title") String title);
}
