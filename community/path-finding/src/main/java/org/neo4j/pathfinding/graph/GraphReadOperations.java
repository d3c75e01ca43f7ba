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

import java.util.List;

/**
 * Read-only access to a graph store. This is the only way the traversal
 * algorithms look at a graph; they never write through it.
 * <p>
 * Relationship filters are passed through untouched, their syntax is defined
 * by the implementation (see {@link RelationshipFilter} for the one used by
 * {@link InMemoryGraph}). Implementations must be safe for concurrent reads if
 * traversals are run from several threads.
 */
public interface GraphReadOperations
{
    /**
     * @param id id of the node to read.
     * @return the node with the given id.
     * @throws EntityNotFoundException if there is no such node.
     * @throws GraphAccessException if the node could not be read.
     */
    Node getNode( long id ) throws GraphAccessException;

    /**
     * @param id id of the node whose neighbors to read.
     * @param relationshipFilter the relationships to follow.
     * @param direction the direction to follow them in.
     * @return the distinct nodes on the other side of the matching relationships.
     * @throws EntityNotFoundException if there is no node with the given id.
     * @throws GraphAccessException if the neighbors could not be read.
     */
    List<Node> getNodeNeighbors( long id, String relationshipFilter, Direction direction )
            throws GraphAccessException;

    /**
     * @param id id of the node whose relationships to read.
     * @param relationshipFilter the relationships to return.
     * @param direction the direction, seen from the node, of the relationships to return.
     * @return the matching relationships.
     * @throws EntityNotFoundException if there is no node with the given id.
     * @throws GraphAccessException if the relationships could not be read.
     */
    List<Relationship> getNodeRelationships( long id, String relationshipFilter, Direction direction )
            throws GraphAccessException;

    /**
     * @param startId id of the first node of the path.
     * @param endId id of the last node of the path.
     * @param relationshipFilter the relationships the path may use.
     * @param maxHops the maximum {@link Path#length()} of the path.
     * @return a shortest path between the two nodes, or {@code null} if there
     * is none within {@code maxHops}.
     * @throws GraphAccessException if the search could not be carried out.
     */
    Path findShortestPath( long startId, long endId, String relationshipFilter, int maxHops )
            throws GraphAccessException;

    /**
     * @param startId id of the first node of the paths.
     * @param endId id of the last node of the paths.
     * @param relationshipFilter the relationships the paths may use.
     * @param maxHops the maximum {@link Path#length()} of returned paths.
     * @return every path between the two nodes within {@code maxHops}, never {@code null}.
     * @throws GraphAccessException if the search could not be carried out.
     */
    List<Path> findAllPaths( long startId, long endId, String relationshipFilter, int maxHops )
            throws GraphAccessException;
}
