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
package org.neo4j.pathfinding;

import java.util.List;
import java.util.Objects;

import org.neo4j.logging.LogProvider;
import org.neo4j.logging.NullLogProvider;
import org.neo4j.pathfinding.graph.GraphReadOperations;
import org.neo4j.pathfinding.graph.Node;
import org.neo4j.pathfinding.graph.Path;
import org.neo4j.pathfinding.impl.path.NeighborExplorer;
import org.neo4j.pathfinding.impl.path.PathExpander;
import org.neo4j.pathfinding.impl.path.PathSelector;
import org.neo4j.pathfinding.impl.path.ShortestPathFinder;
import org.neo4j.pathfinding.impl.path.SpanningTreeBuilder;
import org.neo4j.pathfinding.impl.path.SubgraphExplorer;

/**
 * Entry point to the traversals over a graph. Every method is a single,
 * synchronous walk over the given {@link GraphReadOperations}; no state is
 * kept between calls, so one instance can serve concurrent callers as long as
 * the graph can.
 * <p>
 * Nothing here throws for a search that comes up empty: no reachable nodes
 * or no paths give an empty list, no shortest path gives {@code null}.
 * Nodes and relationships the graph fails to read are skipped.
 */
public class PathExplorer
{
    /**
     * Max length used by {@link #distance(Node, Node, String)} when the caller
     * gives none.
     */
    public static final int DEFAULT_MAX_HOPS = 100;

    private final GraphReadOperations graph;
    private final LogProvider logProvider;
    private final SubgraphExplorer subgraphExplorer;
    private final PathExpander pathExpander;
    private final SpanningTreeBuilder spanningTreeBuilder;
    private final PathSelector pathSelector;
    private final NeighborExplorer neighborExplorer;

    public PathExplorer( GraphReadOperations graph )
    {
        this( graph, NullLogProvider.getInstance() );
    }

    public PathExplorer( GraphReadOperations graph, LogProvider logProvider )
    {
        this.graph = Objects.requireNonNull( graph, "graph" );
        this.logProvider = Objects.requireNonNull( logProvider, "logProvider" );
        this.subgraphExplorer = new SubgraphExplorer( graph, logProvider );
        this.pathExpander = new PathExpander( graph, logProvider );
        this.spanningTreeBuilder = new SpanningTreeBuilder( graph, logProvider );
        this.pathSelector = new PathSelector( graph, logProvider );
        this.neighborExplorer = new NeighborExplorer( graph, logProvider );
    }

    // Subgraphs

    public List<Node> subgraphNodes( Node start, TraversalConfig config )
    {
        return subgraphExplorer.subgraphNodes( start, config );
    }

    public Subgraph subgraphAll( Node start, TraversalConfig config )
    {
        return subgraphExplorer.subgraphAll( start, config );
    }

    // Expansion

    public List<Path> expandConfig( Node start, TraversalConfig config )
    {
        return pathExpander.expand( start, config );
    }

    public List<Path> spanningTree( Node start, TraversalConfig config )
    {
        return spanningTreeBuilder.spanningTree( start, config );
    }

    // Shortest paths

    /**
     * @return a {@link PathFinder} looking for shortest paths along
     * relationships matching {@code relationshipFilter}, at most
     * {@code maxHops} long.
     */
    public PathFinder shortestPathFinder( String relationshipFilter, int maxHops )
    {
        return new ShortestPathFinder( graph, relationshipFilter, maxHops, logProvider );
    }

    /**
     * @return a shortest path between the two nodes, or {@code null} if there is none.
     */
    public Path shortestPath( Node start, Node end, String relationshipFilter, int maxHops )
    {
        return shortestPathFinder( relationshipFilter, maxHops ).findSinglePath( start, end );
    }

    /**
     * @return every path between the two nodes which is as short as possible,
     * or an empty list if there are none.
     */
    public List<Path> allShortestPaths( Node start, Node end, String relationshipFilter, int maxHops )
    {
        return shortestPathFinder( relationshipFilter, maxHops ).findAllPaths( start, end );
    }

    /**
     * @return the length of a shortest path between the two nodes, or -1 if
     * there is none within {@code maxHops}.
     */
    public int distance( Node start, Node end, String relationshipFilter, int maxHops )
    {
        Path path = shortestPath( start, end, relationshipFilter, maxHops );
        return path == null ? -1 : path.length();
    }

    public int distance( Node start, Node end, String relationshipFilter )
    {
        return distance( start, end, relationshipFilter, DEFAULT_MAX_HOPS );
    }

    public boolean pathExists( Node start, Node end, String relationshipFilter, int maxHops )
    {
        return shortestPath( start, end, relationshipFilter, maxHops ) != null;
    }

    // Paths selected by length

    public List<Path> allPaths( Node start, Node end, String relationshipFilter, int maxLength )
    {
        return pathSelector.allPaths( start, end, relationshipFilter, maxLength );
    }

    public int countPaths( Node start, Node end, String relationshipFilter, int maxLength )
    {
        return pathSelector.countPaths( start, end, relationshipFilter, maxLength );
    }

    public List<Path> longestPaths( Node start, Node end, String relationshipFilter, int maxLength )
    {
        return pathSelector.longestPaths( start, end, relationshipFilter, maxLength );
    }

    public List<Path> pathsWithLength( Node start, Node end, String relationshipFilter, int length )
    {
        return pathSelector.pathsWithLength( start, end, relationshipFilter, length );
    }

    public List<Path> pathsWithinLength( Node start, Node end, String relationshipFilter, int minLength,
            int maxLength )
    {
        return pathSelector.pathsWithinLength( start, end, relationshipFilter, minLength, maxLength );
    }

    public List<Path> kShortestPaths( Node start, Node end, String relationshipFilter, int maxLength, int k )
    {
        return pathSelector.kShortestPaths( start, end, relationshipFilter, maxLength, k );
    }

    // Paths selected by shape

    public List<Path> simplePaths( Node start, Node end, String relationshipFilter, int maxLength )
    {
        return pathSelector.simplePaths( start, end, relationshipFilter, maxLength );
    }

    public List<Path> elementaryPaths( Node start, Node end, String relationshipFilter, int maxLength )
    {
        return pathSelector.elementaryPaths( start, end, relationshipFilter, maxLength );
    }

    public List<Path> disjointPaths( Node start, Node end, String relationshipFilter, int maxLength, int count )
    {
        return pathSelector.disjointPaths( start, end, relationshipFilter, maxLength, count );
    }

    public List<Path> edgeDisjointPaths( Node start, Node end, String relationshipFilter, int maxLength,
            int count )
    {
        return pathSelector.edgeDisjointPaths( start, end, relationshipFilter, maxLength, count );
    }

    /**
     * @return the cycles through {@code start} of length at most {@code maxLength}, each one once.
     */
    public List<Path> cycles( Node start, String relationshipFilter, int maxLength )
    {
        return pathSelector.cycles( start, relationshipFilter, maxLength );
    }

    // Neighbors

    public List<Node> neighborsAtHop( Node node, String relationshipFilter, int hops )
    {
        return neighborExplorer.atHop( node, relationshipFilter, hops );
    }

    public List<Node> neighborsToHop( Node node, String relationshipFilter, int maxHops )
    {
        return neighborExplorer.toHop( node, relationshipFilter, maxHops );
    }

    public List<Node> neighborsDepthFirst( Node node, String relationshipFilter, int maxDepth )
    {
        return neighborExplorer.depthFirst( node, relationshipFilter, maxDepth );
    }

    public int countNeighborsAtHop( Node node, String relationshipFilter, int hops )
    {
        return neighborExplorer.countAtHop( node, relationshipFilter, hops );
    }

    public boolean neighborsExistAtHop( Node node, String relationshipFilter, int hops )
    {
        return neighborExplorer.existsAtHop( node, relationshipFilter, hops );
    }
}
