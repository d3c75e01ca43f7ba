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

import common.PathFindingTestCase;
import common.StandardGraphs;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import org.eclipse.collections.api.set.primitive.MutableLongSet;
import org.eclipse.collections.impl.set.mutable.primitive.LongHashSet;
import org.neo4j.logging.NullLogProvider;
import org.neo4j.pathfinding.TraversalConfig;
import org.neo4j.pathfinding.graph.Node;
import org.neo4j.pathfinding.graph.Path;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.empty;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SpanningTreeBuilderTest extends PathFindingTestCase
{
    private SpanningTreeBuilder trees()
    {
        return new SpanningTreeBuilder( graphDb, NullLogProvider.getInstance() );
    }

    @Test
    public void onePathPerReachedNode()
    {
        Node a = StandardGraphs.DIAMOND.create( graph );

        assertPathsInOrder( trees().spanningTree( a, TraversalConfig.defaults() ), "A,B", "A,C", "A,B,D" );
    }

    @Test
    public void pathsAreShortestPaths()
    {
        Node start = StandardGraphs.CROSS_PATHS_GRAPH.create( graph );

        assertPathsInOrder( trees().spanningTree( start, TraversalConfig.defaults() ),
                "start,a", "start,b", "start,a,c", "start,a,d", "start,a,c,end" );
    }

    @Test
    public void startNodeGetsNoPath()
    {
        graph.makeNode( "lonely" );

        assertThat( trees().spanningTree( node( "lonely" ), TraversalConfig.defaults() ), empty() );
        assertThat( trees().spanningTree( node( "lonely" ), TraversalConfig.defaults().withMinLevel( 0 ) ), empty() );
    }

    @Test
    public void maxLevelBoundsTheTree()
    {
        Node start = StandardGraphs.CROSS_PATHS_GRAPH.create( graph );

        assertPathsInOrder( trees().spanningTree( start, TraversalConfig.builder().withMaxLevel( 1 ).build() ),
                "start,a", "start,b" );
    }

    @Test
    public void limitBoundsTheTree()
    {
        Node start = StandardGraphs.CROSS_PATHS_GRAPH.create( graph );

        assertPathsInOrder( trees().spanningTree( start, TraversalConfig.defaults().withLimit( 2 ) ),
                "start,a", "start,b" );
    }

    @Test
    public void contradictingConfigurationGivesEmptyResult()
    {
        Node start = StandardGraphs.CROSS_PATHS_GRAPH.create( graph );

        assertThat( trees().spanningTree( start, TraversalConfig.builder().withMinLevel( 2 ).withMaxLevel( 1 )
                .build() ), empty() );
        assertThat( trees().spanningTree( start, TraversalConfig.defaults().withLimit( -1 ) ), empty() );
    }

    @Test
    public void numberOfPathsEqualsNumberOfReachedNodes()
    {
        Random random = new Random( 42 );
        for ( int round = 0; round < 20; round++ )
        {
            setUpGraph();
            int nodeCount = 2 + random.nextInt( 15 );
            for ( int i = 0; i < nodeCount; i++ )
            {
                graph.makeNode( "n" + i );
            }
            int edgeCount = random.nextInt( nodeCount * 3 );
            for ( int i = 0; i < edgeCount; i++ )
            {
                graph.makeEdge( "n" + random.nextInt( nodeCount ), "n" + random.nextInt( nodeCount ) );
            }
            SubgraphExplorer subgraphs = new SubgraphExplorer( graphDb, NullLogProvider.getInstance() );
            Node start = node( "n0" );
            TraversalConfig config = TraversalConfig.builder().withMaxLevel( 1 + random.nextInt( 4 ) ).build();

            List<Path> tree = trees().spanningTree( start, config );
            List<Node> reached = subgraphs.subgraphNodes( start, config );

            assertEquals( reached.size() - 1, tree.size(), "round " + round );
            MutableLongSet ends = new LongHashSet();
            for ( Path path : tree )
            {
                assertNotEquals( start, path.endNode() );
                assertTrue( ends.add( path.endNode().getId() ), "node reached twice in round " + round );
                assertTrue( path.length() <= config.maxLevel() );
            }
        }
    }
}
