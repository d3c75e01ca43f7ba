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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A directed, typed relationship between two nodes, referenced by id.
 * Traversing a relationship in both directions is a matter of the
 * {@link Direction} a caller asks for, not of the relationship itself.
 */
public final class Relationship
{
    private final long id;
    private final String type;
    private final long startNodeId;
    private final long endNodeId;
    private final Map<String,Object> properties;

    public Relationship( long id, String type, long startNodeId, long endNodeId )
    {
        this( id, type, startNodeId, endNodeId, Collections.<String,Object>emptyMap() );
    }

    public Relationship( long id, String type, long startNodeId, long endNodeId, Map<String,Object> properties )
    {
        this.id = id;
        this.type = type;
        this.startNodeId = startNodeId;
        this.endNodeId = endNodeId;
        this.properties = Collections.unmodifiableMap( new LinkedHashMap<>( properties ) );
    }

    public long getId()
    {
        return id;
    }

    public String getType()
    {
        return type;
    }

    public long getStartNodeId()
    {
        return startNodeId;
    }

    public long getEndNodeId()
    {
        return endNodeId;
    }

    /**
     * Returns the id of the node on the other side of this relationship.
     * If {@code nodeId} is the start node the end node is returned, in every
     * other case the start node is returned.
     *
     * @param nodeId id of the node the relationship is looked at from.
     * @return the id of the opposite node.
     */
    public long getOtherNodeId( long nodeId )
    {
        return startNodeId == nodeId ? endNodeId : startNodeId;
    }

    public boolean isOutgoingFrom( long nodeId )
    {
        return startNodeId == nodeId;
    }

    public Object getProperty( String key )
    {
        return properties.get( key );
    }

    @Override
    public boolean equals( Object o )
    {
        return o instanceof Relationship && ((Relationship) o).id == id;
    }

    @Override
    public int hashCode()
    {
        return Long.hashCode( id );
    }

    @Override
    public String toString()
    {
        return "(" + startNodeId + ")-[" + type + "," + id + "]->(" + endNodeId + ")";
    }
}
