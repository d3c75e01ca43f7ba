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
package org.neo4j.pathfinding.graph;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.neo4j.pathfinding.graph.Direction.BOTH;
import static org.neo4j.pathfinding.graph.Direction.INCOMING;
import static org.neo4j.pathfinding.graph.Direction.OUTGOING;

public class RelationshipFilterTest
{
    private static final long A = 1;
    private static final long B = 2;

    private final Relationship knows = new Relationship( 10, "KNOWS", A, B );
    private final Relationship likes = new Relationship( 11, "LIKES", B, A );

    @Test
    public void blankFilterAcceptsEverything()
    {
        for ( String filter : new String[]{null, "", "  ", "|"} )
        {
            RelationshipFilter parsed = RelationshipFilter.parse( filter );
            assertTrue( parsed.accepts( knows, A, BOTH ) );
            assertTrue( parsed.accepts( knows, B, BOTH ) );
            assertTrue( parsed.accepts( likes, A, BOTH ) );
        }
    }

    @Test
    public void typeWithoutArrowMatchesBothDirections()
    {
        RelationshipFilter filter = RelationshipFilter.parse( "KNOWS" );

        assertTrue( filter.accepts( knows, A, BOTH ) );
        assertTrue( filter.accepts( knows, B, BOTH ) );
        assertFalse( filter.accepts( likes, A, BOTH ) );
    }

    @Test
    public void arrowsRestrictDirection()
    {
        RelationshipFilter filter = RelationshipFilter.parse( "KNOWS>|<LIKES" );

        assertTrue( filter.accepts( knows, A, BOTH ) );
        assertFalse( filter.accepts( knows, B, BOTH ) );
        assertTrue( filter.accepts( likes, A, BOTH ) );
        assertFalse( filter.accepts( likes, B, BOTH ) );
    }

    @Test
    public void bareArrowMatchesAnyType()
    {
        assertTrue( RelationshipFilter.parse( ">" ).accepts( likes, B, BOTH ) );
        assertFalse( RelationshipFilter.parse( ">" ).accepts( likes, A, BOTH ) );
        assertTrue( RelationshipFilter.parse( "<" ).accepts( knows, B, BOTH ) );
    }

    @Test
    public void requestedDirectionIsIntersected()
    {
        RelationshipFilter filter = RelationshipFilter.parse( "KNOWS" );

        assertTrue( filter.accepts( knows, A, OUTGOING ) );
        assertFalse( filter.accepts( knows, A, INCOMING ) );
        assertFalse( RelationshipFilter.parse( "KNOWS>" ).accepts( knows, B, INCOMING ) );
    }

    @Test
    public void selfLoopGoesBothWays()
    {
        Relationship loop = new Relationship( 12, "SELF", A, A );

        assertTrue( RelationshipFilter.parse( "SELF>" ).accepts( loop, A, BOTH ) );
        assertTrue( RelationshipFilter.parse( "<SELF" ).accepts( loop, A, BOTH ) );
        assertTrue( Direction.INCOMING.matches( loop, A ) );
    }
}
