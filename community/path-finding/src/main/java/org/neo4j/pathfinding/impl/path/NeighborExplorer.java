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

import org.eclipse.collections.api.set.primitive.MutableLongSet;
import org.eclipse.collections.impl.set.mutable.primitive.LongHashSet;
import org.neo4j.logging.LogProvider;
import org.neo4j.pathfinding.graph.GraphReadOperations;
import org.neo4j.pathfinding.graph.Node;
import org.neo4j.pathfinding.impl.util.GraphReads;

/**
 * Finds the neighborhood of a node, level by level. The distance of a node is
 * its shortest distance from the start node in hops.
 */
public class NeighborExplorer
{
    private final GraphReads reads;

    public NeighborExplorer( GraphReadOperations graph, LogProvider logProvider )
    {
        this.reads = new GraphReads( graph, logProvider.getLog( getClass() ) );
    }

    /**
     * @return the nodes at exactly {@code hops} distance. For {@code hops == 0}
     * that is the node itself, for negative {@code hops} nothing.
     */
    public List<Node> atHop( Node node, String relationshipFilter, int hops )
    {
        Objects.requireNonNull( node, "node" );
        if ( hops < 0 )
        {
            return Collections.emptyList();
        }
        List<List<Node>> levels = levels( node, relationshipFilter, hops );
        return levels.size() > hops ? levels.get( hops ) : Collections.<Node>emptyList();
    }

    /**
     * @return the nodes at distance 1 to {@code maxHops}, closest first. The
     * start node is not included.
     */
    public List<Node> toHop( Node node, String relationshipFilter, int maxHops )
    {
        Objects.requireNonNull( node, "node" );
        List<Node> result = new ArrayList<>();
        List<List<Node>> levels = levels( node, relationshipFilter, maxHops );
        for ( int hop = 1; hop < levels.size(); hop++ )
        {
            result.addAll( levels.get( hop ) );
        }
        return result;
    }

    /**
     * Visits the nodes within {@code maxDepth} hops depth-first, in pre-order,
     * starting with {@code node} itself. A node is visited once, at the depth
     * it is first reached at along the walk, which need not be its shortest
     * distance. Negative {@code maxDepth} gives nothing.
     */
    public List<Node> depthFirst( Node node, String relationshipFilter, int maxDepth )
    {
        Objects.requireNonNull( node, "node" );
        List<Node> result = new ArrayList<>();
        if ( maxDepth < 0 )
        {
            return result;
        }
        MutableLongSet visited = new LongHashSet();
        Deque<Iterator<Node>> branch = new ArrayDeque<>();
        visited.add( node.getId() );
        result.add( node );
        if ( maxDepth > 0 )
        {
            branch.push( reads.neighbors( node, relationshipFilter ).iterator() );
        }
        while ( !branch.isEmpty() )
        {
            Iterator<Node> neighbors = branch.peek();
            if ( !neighbors.hasNext() )
            {
                branch.pop();
                continue;
            }
            Node neighbor = neighbors.next();
            if ( !visited.add( neighbor.getId() ) )
            {
                continue;
            }
            result.add( neighbor );
            // the branch holds one iterator per node from the start to the neighbor's parent
            if ( branch.size() < maxDepth )
            {
                branch.push( reads.neighbors( neighbor, relationshipFilter ).iterator() );
            }
        }
        return result;
    }

    public int countAtHop( Node node, String relationshipFilter, int hops )
    {
        return atHop( node, relationshipFilter, hops ).size();
    }

    public boolean existsAtHop( Node node, String relationshipFilter, int hops )
    {
        return !atHop( node, relationshipFilter, hops ).isEmpty();
    }

    /**
     * Level 0 is the start node. Stops early when a level comes out empty,
     * so the returned list may be shorter than {@code maxHops + 1}.
     */
    private List<List<Node>> levels( Node start, String relationshipFilter, int maxHops )
    {
        List<List<Node>> levels = new ArrayList<>();
        MutableLongSet visited = new LongHashSet();
        visited.add( start.getId() );
        List<Node> current = Collections.singletonList( start );
        levels.add( current );
        for ( int hop = 0; hop < maxHops; hop++ )
        {
            List<Node> next = new ArrayList<>();
            for ( Node node : current )
            {
                for ( Node neighbor : reads.neighbors( node, relationshipFilter ) )
                {
                    if ( visited.add( neighbor.getId() ) )
                    {
                        next.add( neighbor );
                    }
                }
            }
            if ( next.isEmpty() )
            {
                break;
            }
            levels.add( next );
            current = next;
        }
        return levels;
    }
}
