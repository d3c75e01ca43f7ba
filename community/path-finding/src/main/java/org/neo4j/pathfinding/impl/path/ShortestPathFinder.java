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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.neo4j.logging.Log;
import org.neo4j.logging.LogProvider;
import org.neo4j.pathfinding.PathFinder;
import org.neo4j.pathfinding.graph.GraphAccessException;
import org.neo4j.pathfinding.graph.GraphReadOperations;
import org.neo4j.pathfinding.graph.Node;
import org.neo4j.pathfinding.graph.Path;

/**
 * Finds shortest paths using the search primitives of the underlying
 * {@link GraphReadOperations}. {@link #findSinglePath(Node, Node)} returns
 * whatever the graph's shortest path search comes up with;
 * {@link #findAllPaths(Node, Node)} asks the graph for every path within
 * {@code maxHops} and keeps the ones of minimal length.
 * <p>
 * A failing search is treated as if no path was found.
 */
public class ShortestPathFinder implements PathFinder
{
    private final GraphReadOperations graph;
    private final String relationshipFilter;
    private final int maxHops;
    private final Log log;

    public ShortestPathFinder( GraphReadOperations graph, String relationshipFilter, int maxHops,
            LogProvider logProvider )
    {
        this.graph = graph;
        this.relationshipFilter = relationshipFilter;
        this.maxHops = maxHops;
        this.log = logProvider.getLog( getClass() );
    }

    @Override
    public Path findSinglePath( Node start, Node end )
    {
        Objects.requireNonNull( start, "start" );
        Objects.requireNonNull( end, "end" );
        try
        {
            return graph.findShortestPath( start.getId(), end.getId(), relationshipFilter, maxHops );
        }
        catch ( GraphAccessException e )
        {
            log.debug( "No shortest path between %s and %s: %s", start, end, e.getMessage() );
            return null;
        }
    }

    @Override
    public List<Path> findAllPaths( Node start, Node end )
    {
        return shortestOf( AllPaths.find( graph, start, end, relationshipFilter, maxHops, log ) );
    }

    /**
     * @return the paths among {@code paths} having the smallest length, in
     * their original order.
     */
    static List<Path> shortestOf( List<Path> paths )
    {
        if ( paths.isEmpty() )
        {
            return Collections.emptyList();
        }
        int minLength = Integer.MAX_VALUE;
        for ( Path path : paths )
        {
            minLength = Math.min( minLength, path.length() );
        }
        List<Path> shortest = new ArrayList<>();
        for ( Path path : paths )
        {
            if ( path.length() == minLength )
            {
                shortest.add( path );
            }
        }
        return shortest;
    }
}
