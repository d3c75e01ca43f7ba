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
package org.neo4j.pathfinding.impl.path;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.neo4j.logging.Log;
import org.neo4j.pathfinding.graph.GraphAccessException;
import org.neo4j.pathfinding.graph.GraphReadOperations;
import org.neo4j.pathfinding.graph.Node;
import org.neo4j.pathfinding.graph.Path;

final class AllPaths
{
    private AllPaths()
    {
    }

    static List<Path> find( GraphReadOperations graph, Node start, Node end, String relationshipFilter, int maxHops,
            Log log )
    {
        Objects.requireNonNull( start, "start" );
        Objects.requireNonNull( end, "end" );
        try
        {
            return graph.findAllPaths( start.getId(), end.getId(), relationshipFilter, maxHops );
        }
        catch ( GraphAccessException e )
        {
            log.debug( "No paths between %s and %s: %s", start, end, e.getMessage() );
            return Collections.emptyList();
        }
    }
}
