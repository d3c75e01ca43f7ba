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
package org.neo4j.pathfinding;

/**
 * Rules for whether a node may be visited again while expanding paths.
 */
public enum Uniqueness
{
    /**
     * A node is never visited twice on the same branch. Nodes are marked when
     * the traversal descends into them and unmarked when it backtracks, so a
     * node can still show up on several different paths, but no path
     * contains a cycle.
     */
    NODE_GLOBAL,

    /**
     * No restriction, paths may walk back and forth over the same nodes.
     * Only depth and limit bound the traversal.
     */
    NONE
}
