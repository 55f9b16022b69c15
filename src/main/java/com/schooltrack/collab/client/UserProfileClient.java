package com.schooltrack.collab.client;

import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.rest.client.inject.RegisterRestClient;

@RegisterRestClient(configKey = "user-service")
@Path("/api/users")
@Produces(MediaType.APPLICATION_JSON)
public interface UserProfileClient {

    @GET
    @Path("/{id}")
    UserProfileResponse getById(@PathParam("id") String id);
}
