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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

/**
 * Parsed form of a relationship filter string such as {@code "KNOWS>|<LIKES|WORKS_AT"}.
 * <p>
 * Entries are separated by {@code |}. A trailing {@code >} restricts an entry to
 * outgoing relationships, a leading {@code <} to incoming ones, no arrow means
 * both directions. An arrow on its own matches every type in that direction.
 * A blank filter matches every relationship.
 */
public final class RelationshipFilter
{
    private static final RelationshipFilter ALL =
            new RelationshipFilter( Collections.singletonList( new Entry( null, Direction.BOTH ) ) );

    private final List<Entry> entries;

    private RelationshipFilter( List<Entry> entries )
    {
        this.entries = entries;
    }

    public static RelationshipFilter parse( String filter )
    {
        if ( StringUtils.isBlank( filter ) )
        {
            return ALL;
        }
        List<Entry> entries = new ArrayList<>();
        for ( String part : StringUtils.split( filter, '|' ) )
        {
            String entry = part.trim();
            if ( entry.isEmpty() )
            {
                continue;
            }
            Direction direction = Direction.BOTH;
            if ( entry.endsWith( ">" ) )
            {
                direction = Direction.OUTGOING;
                entry = entry.substring( 0, entry.length() - 1 );
            }
            else if ( entry.startsWith( "<" ) )
            {
                direction = Direction.INCOMING;
                entry = entry.substring( 1 );
            }
            entry = entry.trim();
            entries.add( new Entry( entry.isEmpty() ? null : entry, direction ) );
        }
        return entries.isEmpty() ? ALL : new RelationshipFilter( entries );
    }

    /**
     * @param relationship the relationship to test.
     * @param nodeId the node the relationship is reached from.
     * @param direction the direction asked for by the caller, intersected with
     * the directions of this filter.
     * @return whether the relationship passes this filter.
     */
    public boolean accepts( Relationship relationship, long nodeId, Direction direction )
    {
        if ( !direction.matches( relationship, nodeId ) )
        {
            return false;
        }
        for ( Entry entry : entries )
        {
            if ( entry.accepts( relationship, nodeId ) )
            {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString()
    {
        return "RelationshipFilter" + entries;
    }

    private static final class Entry
    {
        private final String type;
        private final Direction direction;

        Entry( String type, Direction direction )
        {
            this.type = type;
            this.direction = direction;
        }

        boolean accepts( Relationship relationship, long nodeId )
        {
            return (type == null || type.equals( relationship.getType() )) && direction.matches( relationship, nodeId );
        }

        @Override
        public String toString()
        {
            String name = type == null ? "*" : type;
            switch ( direction )
            {
                case OUTGOING:
                    return name + ">";
                case INCOMING:
                    return "<" + name;
                default:
                    return name;
            }
        }
    }
}
