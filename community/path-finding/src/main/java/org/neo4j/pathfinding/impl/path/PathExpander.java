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
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Queue;

import org.eclipse.collections.api.set.primitive.MutableLongSet;
import org.eclipse.collections.impl.set.mutable.primitive.LongHashSet;
import org.neo4j.logging.Log;
import org.neo4j.logging.LogProvider;
import org.neo4j.pathfinding.TraversalConfig;
import org.neo4j.pathfinding.Uniqueness;
import org.neo4j.pathfinding.graph.GraphReadOperations;
import org.neo4j.pathfinding.graph.Node;
import org.neo4j.pathfinding.graph.Path;
import org.neo4j.pathfinding.graph.Relationship;
import org.neo4j.pathfinding.impl.util.GraphReads;

/**
 * Enumerates the paths leading out from a start node.
 * <p>
 * Every path of a length between {@link TraversalConfig#minLevel()} and
 * {@link TraversalConfig#maxLevel()} is returned, so for a chain
 * {@code A-B-C} both {@code [A,B]} and {@code [A,B,C]} come back, not only the
 * longest one. With {@link Uniqueness#NODE_GLOBAL} a node is only excluded
 * from the branch it is currently on: it is marked before the walk descends
 * into it and unmarked again when the walk backtracks.
 * <p>
 * Paths are produced depth-first, in pre-order. If {@link TraversalConfig#isBfs()}
 * is set the same paths are produced breadth-first instead, shortest first.
 * At most {@link TraversalConfig#limit()} paths are returned.
 * <p>
 * A configuration that is not {@link TraversalConfig#isBounded() bounded}
 * could walk back and forth forever and gives an empty result.
 */
public class PathExpander
{
    private final GraphReads reads;
    private final Log log;

    public PathExpander( GraphReadOperations graph, LogProvider logProvider )
    {
        this.log = logProvider.getLog( getClass() );
        this.reads = new GraphReads( graph, log );
    }

    public List<Path> expand( Node start, TraversalConfig config )
    {
        Objects.requireNonNull( start, "start" );
        if ( !config.isSatisfiable() )
        {
            return Collections.emptyList();
        }
        if ( !config.isBounded() )
        {
            log.debug( "Not expanding %s, %s does not bound the number of paths", start, config );
            return Collections.emptyList();
        }
        List<Path> paths = config.isBfs()
                           ? expandBreadthFirst( start, config )
                           : new DepthFirstWalk( config ).walk( start );
        log.debug( "Expanded %s with %s: %d paths", start, config, paths.size() );
        return paths;
    }

    private List<Path> expandBreadthFirst( Node start, TraversalConfig config )
    {
        boolean unique = config.uniqueness() == Uniqueness.NODE_GLOBAL;
        List<Path> paths = new ArrayList<>();
        Queue<Path.Builder> queue = new ArrayDeque<>();
        queue.add( new Path.Builder( start ) );
        while ( !queue.isEmpty() && !config.limitReached( paths.size() ) )
        {
            Path.Builder path = queue.poll();
            if ( path.length() >= config.minLevel() )
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
                if ( unique && path.contains( neighborId ) )
                {
                    continue;
                }
                Node neighbor = reads.node( neighborId );
                if ( neighbor != null )
                {
                    queue.add( path.push( relationship, neighbor ) );
                }
            }
        }
        return paths;
    }

    /**
     * State of one depth-first expansion. Lives for a single call only.
     * The branch being walked is kept on an explicit stack, one frame per
     * node on the current path, so deep graphs do not exhaust the call stack.
     */
    private final class DepthFirstWalk
    {
        private final TraversalConfig config;
        private final boolean unique;
        private final MutableLongSet visited = new LongHashSet();
        private final Deque<Frame> branch = new ArrayDeque<>();
        private final List<Path> paths = new ArrayList<>();

        DepthFirstWalk( TraversalConfig config )
        {
            this.config = config;
            this.unique = config.uniqueness() == Uniqueness.NODE_GLOBAL;
        }

        List<Path> walk( Node start )
        {
            visited.add( start.getId() );
            enter( new Path.Builder( start ) );
            while ( !branch.isEmpty() && !config.limitReached( paths.size() ) )
            {
                Frame frame = branch.peek();
                if ( !frame.relationships.hasNext() )
                {
                    branch.pop();
                    leave( frame.path );
                    continue;
                }

                Relationship relationship = frame.relationships.next();
                long neighborId = relationship.getOtherNodeId( frame.path.endNode().getId() );
                if ( unique && visited.contains( neighborId ) )
                {
                    continue;
                }
                Node neighbor = reads.node( neighborId );
                if ( neighbor == null )
                {
                    continue;
                }

                if ( unique )
                {
                    visited.add( neighborId );
                }
                enter( frame.path.push( relationship, neighbor ) );
            }
            return paths;
        }

        private void enter( Path.Builder path )
        {
            if ( path.length() >= config.minLevel() )
            {
                paths.add( path.build() );
            }
            if ( path.length() < config.maxLevel() )
            {
                branch.push( new Frame( path, reads.relationships( path.endNode(), config.relationshipFilter() ) ) );
            }
            else
            {
                leave( path );
            }
        }

        private void leave( Path.Builder path )
        {
            if ( unique && path.length() > 0 )
            {
                visited.remove( path.endNode().getId() );
            }
        }
    }

    private static final class Frame
    {
        private final Path.Builder path;
        private final Iterator<Relationship> relationships;

        Frame( Path.Builder path, List<Relationship> relationships )
        {
            this.path = path;
            this.relationships = relationships.iterator();
        }
    }
}
