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
import org.neo4j.pathfinding.Subgraph;
import org.neo4j.pathfinding.TraversalConfig;
import org.neo4j.pathfinding.graph.GraphReadOperations;
import org.neo4j.pathfinding.graph.Node;
import org.neo4j.pathfinding.graph.Relationship;
import org.neo4j.pathfinding.impl.util.GraphReads;
import org.neo4j.pathfinding.impl.util.PathState;

/**
 * Breadth-first exploration of everything reachable from a start node.
 * <p>
 * Nodes are marked visited when they are queued, so every node is queued at
 * most once and its level is its shortest distance from the start node. A
 * node is part of the result if its level is at least
 * {@link TraversalConfig#minLevel()}; it is expanded if its level is less
 * than {@link TraversalConfig#maxLevel()}.
 */
public class SubgraphExplorer
{
    private final GraphReads reads;
    private final Log log;

    public SubgraphExplorer( GraphReadOperations graph, LogProvider logProvider )
    {
        this.log = logProvider.getLog( getClass() );
        this.reads = new GraphReads( graph, log );
    }

    /**
     * @param start the node to explore from.
     * @param config depth bounds, relationship filter and limit.
     * @return the reachable nodes in breadth-first order, at most
     * {@link TraversalConfig#limit()} of them.
     */
    public List<Node> subgraphNodes( Node start, TraversalConfig config )
    {
        Objects.requireNonNull( start, "start" );
        if ( !config.isSatisfiable() )
        {
            return Collections.emptyList();
        }

        List<Node> result = new ArrayList<>();
        MutableLongSet visited = new LongHashSet();
        Queue<PathState> queue = new ArrayDeque<>();
        visited.add( start.getId() );
        queue.add( new PathState( start, 0 ) );

        while ( !queue.isEmpty() )
        {
            PathState state = queue.poll();
            if ( state.depth() >= config.minLevel() )
            {
                result.add( state.node() );
            }
            if ( state.depth() < config.maxLevel() )
            {
                for ( Node neighbor : reads.neighbors( state.node(), config.relationshipFilter() ) )
                {
                    if ( visited.add( neighbor.getId() ) )
                    {
                        queue.add( new PathState( neighbor, state.depth() + 1 ) );
                    }
                }
            }
            if ( config.limitReached( result.size() ) )
            {
                break;
            }
        }

        log.debug( "Subgraph of %s with %s: %d nodes", start, config, result.size() );
        return result;
    }

    /**
     * Like {@link #subgraphNodes(Node, TraversalConfig)}, but also returns the
     * relationships seen while expanding nodes. That includes relationships
     * leading to nodes which were already visited through some other
     * relationship; each relationship is returned once. The limit does not
     * apply here.
     *
     * @param start the node to explore from.
     * @param config depth bounds and relationship filter.
     * @return the reachable nodes and the relationships between them.
     */
    public Subgraph subgraphAll( Node start, TraversalConfig config )
    {
        Objects.requireNonNull( start, "start" );
        if ( !config.isSatisfiable() )
        {
            return Subgraph.empty();
        }

        List<Node> nodes = new ArrayList<>();
        List<Relationship> relationships = new ArrayList<>();
        MutableLongSet visited = new LongHashSet();
        MutableLongSet seenRelationships = new LongHashSet();
        Queue<PathState> queue = new ArrayDeque<>();
        visited.add( start.getId() );
        queue.add( new PathState( start, 0 ) );

        while ( !queue.isEmpty() )
        {
            PathState state = queue.poll();
            if ( state.depth() >= config.minLevel() )
            {
                nodes.add( state.node() );
            }
            if ( state.depth() >= config.maxLevel() )
            {
                continue;
            }
            long nodeId = state.node().getId();
            for ( Relationship relationship : reads.relationships( state.node(), config.relationshipFilter() ) )
            {
                long neighborId = relationship.getOtherNodeId( nodeId );
                if ( !visited.contains( neighborId ) )
                {
                    Node neighbor = reads.node( neighborId );
                    if ( neighbor == null )
                    {
                        continue;
                    }
                    visited.add( neighborId );
                    queue.add( new PathState( neighbor, state.depth() + 1 ) );
                }
                if ( seenRelationships.add( relationship.getId() ) )
                {
                    relationships.add( relationship );
                }
            }
        }

        log.debug( "Subgraph of %s with %s: %d nodes, %d relationships",
                start, config, nodes.size(), relationships.size() );
        return new Subgraph( nodes, relationships );
    }
}
