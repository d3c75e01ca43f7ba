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

/**
 * This exception will be thrown if a request is made to a node or
 * relationship that does not exist, for example using
 * {@link GraphReadOperations#getNode(long)} passing in an id that does not
 * exist.
 */
public class EntityNotFoundException extends GraphAccessException
{
    public enum EntityType
    {
        NODE, RELATIONSHIP
    }

    private final EntityType entityType;
    private final long entityId;

    public EntityNotFoundException( EntityType entityType, long entityId )
    {
        super( "Unable to load " + entityType.name() + " with id " + entityId + "." );
        this.entityType = entityType;
        this.entityId = entityId;
    }

    public EntityType entityType()
    {
        return entityType;
    }

    public long entityId()
    {
        return entityId;
    }
}
