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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Queue;

import org.eclipse.collections.api.set.primitive.MutableLongSet;
import org.eclipse.collections.impl.set.mutable.primitive.LongHashSet;
import org.neo4j.logging.Log;
import org.neo4j.logging.LogProvider;
import org.neo4j.pathfinding.TraversalConfig;
import org.neo4j.pathfinding.graph.GraphReadOperations;
import org.neo4j.pathfinding.graph.Node;
import org.neo4j.pathfinding.graph.Path;
import org.neo4j.pathfinding.graph.Relationship;
import org.neo4j.pathfinding.impl.util.GraphReads;

/**
 * Builds a spanning tree rooted at a start node: one path to every node
 * reachable within {@link TraversalConfig#maxLevel()} hops.
 * <p>
 * Nodes are visited breadth-first and stay visited once discovered, so each
 * node gets exactly one path and that path is a shortest one. The start node
 * itself gets no path. {@link TraversalConfig#minLevel()} and
 * {@link TraversalConfig#uniqueness()} do not apply.
 */
public class SpanningTreeBuilder
{
    private final GraphReads reads;
    private final Log log;

    public SpanningTreeBuilder( GraphReadOperations graph, LogProvider logProvider )
    {
        this.log = logProvider.getLog( getClass() );
        this.reads = new GraphReads( graph, log );
    }

    public List<Path> spanningTree( Node start, TraversalConfig config )
    {
        Objects.requireNonNull( start, "start" );
        if ( !config.isSatisfiable() )
        {
            return Collections.emptyList();
        }

        List<Path> paths = new ArrayList<>();
        MutableLongSet visited = new LongHashSet();
        Queue<Path.Builder> queue = new ArrayDeque<>();
        visited.add( start.getId() );
        queue.add( new Path.Builder( start ) );

        while ( !queue.isEmpty() && !config.limitReached( paths.size() ) )
        {
            Path.Builder path = queue.poll();
            if ( path.length() > 0 )
            {
                paths.add( path.build() );
            }
            if ( path.length() >= config.maxLevel() )
            {
                continue;
            }
            long nodeId = path.endNode().getId();
            for ( Relationship relationship : reads.relationships( path.endNode(), config.relationshipFilter() ) )
            {
                long neighborId = relationship.getOtherNodeId( nodeId );
                if ( visited.contains( neighborId ) )
                {
                    continue;
                }
                Node neighbor = reads.node( neighborId );
                if ( neighbor != null )
                {
                    visited.add( neighborId );
                    queue.add( path.push( relationship, neighbor ) );
                }
            }
        }

        log.debug( "Spanning tree of %s with %s: %d paths", start, config, paths.size() );
        return paths;
    }
}
