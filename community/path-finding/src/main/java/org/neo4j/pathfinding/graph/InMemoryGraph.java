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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Queue;

import org.eclipse.collections.api.map.primitive.MutableLongObjectMap;
import org.eclipse.collections.api.set.primitive.MutableLongSet;
import org.eclipse.collections.impl.map.mutable.primitive.LongObjectHashMap;
import org.eclipse.collections.impl.set.mutable.primitive.LongHashSet;

import static org.neo4j.pathfinding.graph.EntityNotFoundException.EntityType.NODE;
import static org.neo4j.pathfinding.graph.EntityNotFoundException.EntityType.RELATIONSHIP;

/**
 * A {@link GraphReadOperations} keeping the whole graph in memory. Relationship
 * filters are interpreted as described by {@link RelationshipFilter}.
 * <p>
 * Relationships of a node are returned in creation order, which makes every
 * traversal over this graph deterministic. Reads may run concurrently, but
 * not concurrently with {@link #createNode(String...)} and friends.
 */
public class InMemoryGraph implements GraphReadOperations
{
    private final MutableLongObjectMap<Node> nodes = new LongObjectHashMap<>();
    private final MutableLongObjectMap<Relationship> relationships = new LongObjectHashMap<>();
    private final MutableLongObjectMap<List<Relationship>> relationshipsByNode = new LongObjectHashMap<>();
    private long nextNodeId = 1;
    private long nextRelationshipId = 1;

    public Node createNode( String... labels )
    {
        return createNode( Arrays.asList( labels ), Collections.<String,Object>emptyMap() );
    }

    public Node createNode( List<String> labels, Map<String,Object> properties )
    {
        Node node = new Node( nextNodeId++, labels, properties );
        nodes.put( node.getId(), node );
        relationshipsByNode.put( node.getId(), new ArrayList<>() );
        return node;
    }

    public Relationship createRelationship( long startNodeId, long endNodeId, String type )
            throws EntityNotFoundException
    {
        return createRelationship( startNodeId, endNodeId, type, Collections.<String,Object>emptyMap() );
    }

    public Relationship createRelationship( long startNodeId, long endNodeId, String type,
            Map<String,Object> properties ) throws EntityNotFoundException
    {
        requireNode( startNodeId );
        requireNode( endNodeId );
        Relationship relationship = new Relationship( nextRelationshipId++, type, startNodeId, endNodeId, properties );
        relationships.put( relationship.getId(), relationship );
        relationshipsByNode.get( startNodeId ).add( relationship );
        if ( endNodeId != startNodeId )
        {
            relationshipsByNode.get( endNodeId ).add( relationship );
        }
        return relationship;
    }

    public Relationship getRelationship( long id ) throws EntityNotFoundException
    {
        Relationship relationship = relationships.get( id );
        if ( relationship == null )
        {
            throw new EntityNotFoundException( RELATIONSHIP, id );
        }
        return relationship;
    }

    public int nodeCount()
    {
        return nodes.size();
    }

    public int relationshipCount()
    {
        return relationships.size();
    }

    @Override
    public Node getNode( long id ) throws EntityNotFoundException
    {
        return requireNode( id );
    }

    @Override
    public List<Node> getNodeNeighbors( long id, String relationshipFilter, Direction direction )
            throws EntityNotFoundException
    {
        List<Node> neighbors = new ArrayList<>();
        MutableLongSet seen = new LongHashSet();
        for ( Relationship relationship : getNodeRelationships( id, relationshipFilter, direction ) )
        {
            long neighborId = relationship.getOtherNodeId( id );
            if ( seen.add( neighborId ) )
            {
                neighbors.add( requireNode( neighborId ) );
            }
        }
        return neighbors;
    }

    @Override
    public List<Relationship> getNodeRelationships( long id, String relationshipFilter, Direction direction )
            throws EntityNotFoundException
    {
        requireNode( id );
        RelationshipFilter filter = RelationshipFilter.parse( relationshipFilter );
        List<Relationship> result = new ArrayList<>();
        for ( Relationship relationship : relationshipsByNode.get( id ) )
        {
            if ( filter.accepts( relationship, id, direction ) )
            {
                result.add( relationship );
            }
        }
        return result;
    }

    @Override
    public Path findShortestPath( long startId, long endId, String relationshipFilter, int maxHops )
            throws EntityNotFoundException
    {
        Node start = requireNode( startId );
        requireNode( endId );
        if ( startId == endId )
        {
            return Path.singleNodePath( start );
        }

        MutableLongSet visited = new LongHashSet();
        visited.add( startId );
        Queue<Path.Builder> queue = new ArrayDeque<>();
        queue.add( new Path.Builder( start ) );
        while ( !queue.isEmpty() )
        {
            Path.Builder current = queue.poll();
            if ( current.length() >= maxHops )
            {
                continue;
            }
            long currentId = current.endNode().getId();
            for ( Relationship relationship : getNodeRelationships( currentId, relationshipFilter, Direction.BOTH ) )
            {
                long neighborId = relationship.getOtherNodeId( currentId );
                if ( visited.add( neighborId ) )
                {
                    Path.Builder next = current.push( relationship, requireNode( neighborId ) );
                    if ( neighborId == endId )
                    {
                        return next.build();
                    }
                    queue.add( next );
                }
            }
        }
        return null;
    }

    @Override
    public List<Path> findAllPaths( long startId, long endId, String relationshipFilter, int maxHops )
            throws EntityNotFoundException
    {
        Node start = requireNode( startId );
        requireNode( endId );
        List<Path> paths = new ArrayList<>();
        if ( startId == endId )
        {
            paths.add( Path.singleNodePath( start ) );
            return paths;
        }
        collectPaths( new Path.Builder( start ), endId, relationshipFilter, maxHops, paths );
        return paths;
    }

    private void collectPaths( Path.Builder current, long endId, String relationshipFilter, int maxHops,
            List<Path> paths ) throws EntityNotFoundException
    {
        if ( current.length() >= maxHops )
        {
            return;
        }
        long currentId = current.endNode().getId();
        for ( Relationship relationship : getNodeRelationships( currentId, relationshipFilter, Direction.BOTH ) )
        {
            long neighborId = relationship.getOtherNodeId( currentId );
            if ( current.contains( neighborId ) )
            {
                continue;
            }
            Path.Builder next = current.push( relationship, requireNode( neighborId ) );
            if ( neighborId == endId )
            {
                paths.add( next.build() );
            }
            else
            {
                collectPaths( next, endId, relationshipFilter, maxHops, paths );
            }
        }
    }

    private Node requireNode( long id ) throws EntityNotFoundException
    {
        Node node = nodes.get( id );
        if ( node == null )
        {
            throw new EntityNotFoundException( NODE, id );
        }
        return node;
    }
}
