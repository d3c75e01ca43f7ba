/*
 * Copyright (c) 2002-2018 "Neo Technology,"
 * Network Engine for Objects in Lund AB [http://neotechnology.com]
 *
 * This file is part of Neo4j.
 *
 * Neo4j is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */
package org.neo4j.pathfinding.impl.util;

import java.util.Collections;
import java.util.List;

import org.neo4j.logging.Log;
import org.neo4j.pathfinding.graph.Direction;
import org.neo4j.pathfinding.graph.EntityNotFoundException;
import org.neo4j.pathfinding.graph.GraphAccessException;
import org.neo4j.pathfinding.graph.GraphReadOperations;
import org.neo4j.pathfinding.graph.Node;
import org.neo4j.pathfinding.graph.Relationship;

/**
 * Reads used while walking a graph. A read that fails only affects the node
 * or relationship it was about: the failure is logged and an empty answer is
 * returned, so the walk carries on with the rest of the graph.
 */
public final class GraphReads
{
    private final GraphReadOperations graph;
    private final Log log;

    public GraphReads( GraphReadOperations graph, Log log )
    {
        this.graph = graph;
        this.log = log;
    }

    /**
     * @return the node, or {@code null} if it could not be read.
     */
    public Node node( long id )
    {
        try
        {
            return graph.getNode( id );
        }
        catch ( GraphAccessException e )
        {
            skipped( "node " + id, e );
            return null;
        }
    }

    public List<Relationship> relationships( Node node, String relationshipFilter )
    {
        try
        {
            return graph.getNodeRelationships( node.getId(), relationshipFilter, Direction.BOTH );
        }
        catch ( GraphAccessException e )
        {
            skipped( "relationships of " + node, e );
            return Collections.emptyList();
        }
    }

    public List<Node> neighbors( Node node, String relationshipFilter )
    {
        try
        {
            return graph.getNodeNeighbors( node.getId(), relationshipFilter, Direction.BOTH );
        }
        catch ( GraphAccessException e )
        {
            skipped( "neighbors of " + node, e );
            return Collections.emptyList();
        }
    }

    private void skipped( String what, GraphAccessException e )
    {
        if ( e instanceof EntityNotFoundException )
        {
            log.debug( "Skipping %s: %s", what, e.getMessage() );
        }
        else
        {
            log.warn( "Skipping " + what + " after a failed read", e );
        }
    }
}
