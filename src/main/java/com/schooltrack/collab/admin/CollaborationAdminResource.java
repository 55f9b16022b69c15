package com.schooltrack.collab.admin;

import com.schooltrack.collab.lock.LockManager;
import com.schooltrack.collab.presence.DocumentViewer;
import com.schooltrack.collab.presence.PresenceBroadcaster;
import com.schooltrack.collab.session.ConnectionRegistry;
import com.schooltrack.collab.session.RoomDirectory;
import com.schooltrack.collab.websocket.CollaborationHub;
import jakarta.annotation.security.RolesAllowed;
import jakarta.inject.Inject;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.jboss.logging.Logger;

import java.util.List;

/**
 * Operator view of the hub and the force-unlock used when an editor walks away from a lock.
 */
@Path("/api/collab")
@Produces(MediaType.APPLICATION_JSON)
@RolesAllowed("admin")
public class CollaborationAdminResource {

    private static final Logger LOG = Logger.getLogger(CollaborationAdminResource.class);

    @Inject
    CollaborationHub hub;

    @Inject
    ConnectionRegistry registry;

    @Inject
    RoomDirectory rooms;

    @Inject
    LockManager locks;

    @Inject
    PresenceBroadcaster presence;

    @GET
    @Path("/stats")
    public HubStats stats() {
        return new HubStats(hub.openConnections(), registry.connectionCount(), rooms.size(), locks.activeLocks());
    }

    @GET
    @Path("/rooms/{documentId}/viewers")
    public List<DocumentViewer> viewers(@PathParam("documentId") String documentId) {
        return presence.viewers(documentId);
    }

    @DELETE
    @Path("/locks/{documentId}")
    public void forceUnlock(@PathParam("documentId") String documentId) {
        locks.forceRelease(documentId)
            .ifPresentOrElse(
                lock -> LOG.infof("Lock on %s held by %s force-released", documentId, lock.holderId()),
                () -> {
                    throw new NotFoundException("No lock on document " + documentId);
                });
    }
}
