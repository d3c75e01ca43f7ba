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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A node as read from a {@link GraphReadOperations}. Instances are immutable
 * snapshots; two nodes are equal if they have the same id.
 */
public final class Node
{
    private final long id;
    private final List<String> labels;
    private final Map<String,Object> properties;

    public Node( long id )
    {
        this( id, Collections.<String>emptyList(), Collections.<String,Object>emptyMap() );
    }

    public Node( long id, List<String> labels, Map<String,Object> properties )
    {
        this.id = id;
        this.labels = Collections.unmodifiableList( new ArrayList<>( labels ) );
        this.properties = Collections.unmodifiableMap( new LinkedHashMap<>( properties ) );
    }

    public long getId()
    {
        return id;
    }

    public List<String> getLabels()
    {
        return labels;
    }

    /**
     * @param key the property key.
     * @return the value of the property, or {@code null} if this node has no
     * such property.
     */
    public Object getProperty( String key )
    {
        return properties.get( key );
    }

    @Override
    public boolean equals( Object o )
    {
        return o instanceof Node && ((Node) o).id == id;
    }

    @Override
    public int hashCode()
    {
        return Long.hashCode( id );
    }

    @Override
    public String toString()
    {
        StringBuilder builder = new StringBuilder( "(" ).append( id );
        for ( String label : labels )
        {
            builder.append( ':' ).append( label );
        }
        return builder.append( ')' ).toString();
    }
}
