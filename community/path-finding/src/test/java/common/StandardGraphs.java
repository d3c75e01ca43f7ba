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
package common;

import java.util.Collections;

import org.neo4j.pathfinding.graph.Node;

/**
 * Small named graphs shared by the tests. {@link #create(SimpleGraphBuilder)}
 * builds the graph and returns the node traversals usually start from.
 */
public enum StandardGraphs
{
    /**
     * start->a, start->b, a->c, a->d, b->c, b->d, c->end, d->end
     */
    CROSS_PATHS_GRAPH
    {
        @Override
        public Node create( SimpleGraphBuilder graph )
        {
            graph.setCurrentRelType( "CROSS" );
            graph.makeEdge( "start", "a" );
            graph.makeEdge( "start", "b" );
            graph.makeEdge( "a", "c" );
            graph.makeEdge( "a", "d" );
            graph.makeEdge( "b", "c" );
            graph.makeEdge( "b", "d" );
            graph.makeEdge( "c", "end" );
            graph.makeEdge( "d", "end" );
            return graph.getNode( "start" );
        }
    },
    /**
     * A->B, A->C, B->D, C->D
     */
    DIAMOND
    {
        @Override
        public Node create( SimpleGraphBuilder graph )
        {
            graph.setCurrentRelType( "KNOWS" );
            graph.makeEdgeChain( "A,B,D" );
            graph.makeEdgeChain( "A,C,D" );
            return graph.getNode( "A" );
        }
    },
    /**
     * start->end, end->start
     */
    SMALL_CIRCLE
    {
        @Override
        public Node create( SimpleGraphBuilder graph )
        {
            graph.setCurrentRelType( "CIRCLE" );
            graph.makeEdge( "start", "end" );
            graph.makeEdge( "end", "start" );
            return graph.getNode( "start" );
        }
    },
    MATRIX_EXAMPLE
    {
        @Override
        public Node create( SimpleGraphBuilder graph )
        {
            Node neo = graph.makeNode( "Thomas Anderson", "Person" );
            graph.makeNode( "Trinity", "Person" );
            graph.makeNode( "Morpheus", "Person" );
            graph.makeNode( "Cypher", "Person" );
            graph.makeNode( "Agent Smith", "Program" );
            graph.makeNode( "The Architect", "Program" );

            graph.setCurrentRelType( KNOWS );
            graph.makeEdge( "Thomas Anderson", "Morpheus" );
            graph.makeEdge( "Thomas Anderson", "Trinity" );
            graph.makeEdge( "Morpheus", "Trinity",
                    Collections.<String,Object>singletonMap( "since", "a year before the movie" ) );
            graph.setCurrentRelType( LOVES );
            graph.makeEdge( "Trinity", "Thomas Anderson" );
            graph.setCurrentRelType( KNOWS );
            graph.makeEdge( "Morpheus", "Cypher" );
            graph.makeEdge( "Cypher", "Agent Smith",
                    Collections.<String,Object>singletonMap( "disclosure", "secret" ) );
            graph.setCurrentRelType( CODED_BY );
            graph.makeEdge( "Agent Smith", "The Architect" );
            return neo;
        }
    };

    public static final String KNOWS = "KNOWS";
    public static final String CODED_BY = "CODED_BY";
    public static final String LOVES = "LOVES";

    public abstract Node create( SimpleGraphBuilder graph );
}
