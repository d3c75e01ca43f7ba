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
 * Defines relationship directions used when reading relationships of a node.
 * <p>
 * A relationship has a direction from a node's point of view. If a node is the
 * start node of a relationship it will be an {@link #OUTGOING} relationship
 * from that node's point of view. If a node is the end node of a relationship
 * it will be an {@link #INCOMING} relationship from that node's point of view.
 * {@link #BOTH} is used when direction is of no importance.
 */
public enum Direction
{
    OUTGOING,
    INCOMING,
    BOTH;

    /**
     * @param relationship the relationship to test.
     * @param nodeId the node the relationship is seen from.
     * @return whether {@code relationship} goes in this direction as seen from
     * {@code nodeId}.
     */
    public boolean matches( Relationship relationship, long nodeId )
    {
        switch ( this )
        {
            case OUTGOING:
                return relationship.isOutgoingFrom( nodeId );
            case INCOMING:
                return relationship.getEndNodeId() == nodeId;
            default:
                return true;
        }
    }
}
