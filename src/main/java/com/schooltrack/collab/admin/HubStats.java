package com.schooltrack.collab.admin;

import com.schooltrack.collab.lock.DocumentLock;

import java.util.List;

public record HubStats(
    int openConnections,
    int joinedConnections,
    int rooms,
    List<DocumentLock> activeLocks
) {}
