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
package org.neo4j.pathfinding.impl.util;

import org.neo4j.pathfinding.graph.Node;

/**
 * A node waiting in a breadth-first work queue, together with the depth it
 * was discovered at.
 */
public final class PathState
{
    private final Node node;
    private final int depth;

    public PathState( Node node, int depth )
    {
        this.node = node;
        this.depth = depth;
    }

    public Node node()
    {
        return node;
    }

    public int depth()
    {
        return depth;
    }

    @Override
    public String toString()
    {
        return node + "@" + depth;
    }
}
