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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import org.neo4j.logging.NullLogProvider;
import org.neo4j.pathfinding.graph.GraphReadOperations;
import org.neo4j.pathfinding.graph.Node;
import org.neo4j.pathfinding.graph.Path;
import org.neo4j.pathfinding.graph.Relationship;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class PathSelectorTest extends PathFindingTestCase
{
    private PathSelector selector;
    private Node start;
    private Node end;

    @BeforeEach
    public void createCrossPaths()
    {
        start = StandardGraphs.CROSS_PATHS_GRAPH.create( graph );
        end = node( "end" );
        selector = new PathSelector( graphDb, NullLogProvider.getInstance() );
    }

    @Test
    public void allPathsWithinMaxLength()
    {
        assertThat( selector.allPaths( start, end, "", 5 ), hasSize( 8 ) );
        assertEquals( 4, selector.countPaths( start, end, "", 3 ) );
        assertEquals( 0, selector.countPaths( start, end, "", 2 ) );
    }

    @Test
    public void longestPaths()
    {
        assertPaths( selector.longestPaths( start, end, "", 5 ),
                "start,a,c,b,d,end", "start,a,d,b,c,end", "start,b,c,a,d,end", "start,b,d,a,c,end" );
        assertThat( selector.longestPaths( start, end, "", 2 ), empty() );
    }

    @Test
    public void pathsOfGivenLength()
    {
        assertThat( selector.pathsWithLength( start, end, "", 3 ), hasSize( 4 ) );
        assertThat( selector.pathsWithLength( start, end, "", 4 ), empty() );
        assertThat( selector.pathsWithinLength( start, end, "", 4, 5 ), hasSize( 4 ) );
        assertThat( selector.pathsWithinLength( start, end, "", 3, 5 ), hasSize( 8 ) );
        assertThat( selector.pathsWithinLength( start, end, "", 5, 3 ), empty() );
    }

    @Test
    public void kShortestPathsAreSortedByLength()
    {
        List<Path> paths = selector.kShortestPaths( start, end, "", 5, 5 );

        assertThat( paths, hasSize( 5 ) );
        for ( int i = 0; i < 4; i++ )
        {
            assertEquals( 3, paths.get( i ).length() );
        }
        assertEquals( 5, paths.get( 4 ).length() );
        assertThat( selector.kShortestPaths( start, end, "", 5, 0 ), empty() );
        assertThat( selector.kShortestPaths( start, end, "", 5, 100 ), hasSize( 8 ) );
    }

    @Test
    public void simpleAndElementaryPaths() throws Exception
    {
        Node one = new Node( 1 );
        Node two = new Node( 2 );
        Node three = new Node( 3 );
        Relationship oneTwo = new Relationship( 1, KNOWS, 1, 2 );
        Relationship twoOne = new Relationship( 2, KNOWS, 2, 1 );
        Relationship oneThree = new Relationship( 3, KNOWS, 1, 3 );
        Path revisitsNode = new Path.Builder( one ).push( oneTwo, two ).push( twoOne, one ).push( oneThree, three )
                .build();
        Path revisitsRelationship = new Path.Builder( one ).push( oneTwo, two ).push( oneTwo, one )
                .push( oneThree, three ).build();
        Path direct = new Path.Builder( one ).push( oneThree, three ).build();
        GraphReadOperations walks = mock( GraphReadOperations.class );
        when( walks.findAllPaths( 1, 3, "", 5 ) ).thenReturn( Arrays.asList( revisitsNode, revisitsRelationship, direct ) );
        PathSelector paths = new PathSelector( walks, NullLogProvider.getInstance() );

        assertEquals( Arrays.asList( direct ), paths.simplePaths( one, three, "", 5 ) );
        assertEquals( Arrays.asList( revisitsNode, direct ), paths.elementaryPaths( one, three, "", 5 ) );
    }

    @Test
    public void pathsFoundInTheGraphAreSimple()
    {
        assertThat( selector.simplePaths( start, end, "", 5 ), hasSize( 8 ) );
        assertThat( selector.elementaryPaths( start, end, "", 5 ), hasSize( 8 ) );
    }

    @Test
    public void disjointPathsAreTakenGreedily()
    {
        assertPathsInOrder( selector.disjointPaths( start, end, "", 3, 10 ), "start,a,c,end", "start,b,d,end" );
        assertPathsInOrder( selector.disjointPaths( start, end, "", 3, 1 ), "start,a,c,end" );
        assertThat( selector.disjointPaths( start, end, "", 3, 0 ), empty() );
    }

    @Test
    public void pathsThroughACommonNodeCanStillBeEdgeDisjoint()
    {
        graph.makeEdgeChain( "S,P,X,Q,E" );
        graph.makeEdgeChain( "S,R,X,T,E" );

        assertPathsInOrder( selector.disjointPaths( node( "S" ), node( "E" ), "", 4, 5 ), "S,P,X,Q,E" );
        assertPathsInOrder( selector.edgeDisjointPaths( node( "S" ), node( "E" ), "", 4, 5 ),
                "S,P,X,Q,E", "S,R,X,T,E" );
        assertPathsInOrder( selector.edgeDisjointPaths( node( "S" ), node( "E" ), "", 4, 1 ), "S,P,X,Q,E" );
        assertThat( selector.edgeDisjointPaths( node( "S" ), node( "E" ), "", 4, -1 ), empty() );
    }

    @Test
    public void eachCycleIsFoundOnce()
    {
        graph.setCurrentRelType( KNOWS );
        graph.makeEdgeChain( "A,B,C,A" );

        assertPathsInOrder( selector.cycles( node( "A" ), "", 3 ), "A,B,C,A" );
        assertPathsInOrder( explorer.cycles( node( "A" ), "KNOWS>", 5 ), "A,B,C,A" );
        assertThat( selector.cycles( node( "A" ), "", 2 ), empty() );
        assertThat( selector.cycles( node( "A" ), "", 0 ), empty() );
    }

    @Test
    public void parallelRelationshipsAndSelfLoopsAreCycles()
    {
        graph.makeEdge( "U", "V" );
        graph.makeEdge( "V", "U" );
        graph.makeEdge( "U", "U" );

        List<Path> cycles = selector.cycles( node( "U" ), "", 5 );

        assertPathsInOrder( cycles, "U,V,U", "U,U" );
        assertEquals( 2, cycles.get( 0 ).length() );
        assertEquals( 1, cycles.get( 1 ).length() );
        assertPaths( selector.cycles( start, "", 5 ), "start,a,c,b,start", "start,a,d,b,start" );
    }
}
