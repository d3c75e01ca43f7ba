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
package common;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import org.neo4j.pathfinding.graph.EntityNotFoundException;
import org.neo4j.pathfinding.graph.InMemoryGraph;
import org.neo4j.pathfinding.graph.Node;
import org.neo4j.pathfinding.graph.Relationship;

/**
 * Builds graphs of named nodes, the name of each node being stored in its
 * {@link #KEY_ID} property.
 */
public class SimpleGraphBuilder
{
    public static final String KEY_ID = "name";

    private final InMemoryGraph graphDb;
    private final Map<String,Node> nodes = new HashMap<>();
    private final Map<Long,String> nodeNames = new HashMap<>();
    private final Set<Relationship> edges = new LinkedHashSet<>();
    private String currentRelType;

    public SimpleGraphBuilder( InMemoryGraph graphDb, String relationshipType )
    {
        this.graphDb = graphDb;
        setCurrentRelType( relationshipType );
    }

    public InMemoryGraph graphDb()
    {
        return graphDb;
    }

    public Set<Relationship> getAllEdges()
    {
        return edges;
    }

    public void setCurrentRelType( String currentRelType )
    {
        this.currentRelType = currentRelType;
    }

    public Node makeNode( String id, String... labels )
    {
        return makeNode( id, labels, Collections.<String,Object>emptyMap() );
    }

    public Node makeNode( String id, String[] labels, Map<String,Object> properties )
    {
        Map<String,Object> allProperties = new HashMap<>( properties );
        if ( allProperties.containsKey( KEY_ID ) )
        {
            throw new IllegalArgumentException( "Can't use '" + KEY_ID + "'" );
        }
        allProperties.put( KEY_ID, id );
        Node node = graphDb.createNode( Arrays.asList( labels ), allProperties );
        nodes.put( id, node );
        nodeNames.put( node.getId(), id );
        return node;
    }

    public Node getNode( String id )
    {
        return getNode( id, false );
    }

    public Node getNode( String id, boolean force )
    {
        Node node = nodes.get( id );
        if ( node == null && force )
        {
            node = makeNode( id );
        }
        return node;
    }

    public String getNodeId( Node node )
    {
        return nodeNames.get( node.getId() );
    }

    public Relationship makeEdge( String node1, String node2 )
    {
        return makeEdge( node1, node2, Collections.<String,Object>emptyMap() );
    }

    public Relationship makeEdge( String node1, String node2, Map<String,Object> edgeProperties )
    {
        Node n1 = getNode( node1, true );
        Node n2 = getNode( node2, true );
        try
        {
            Relationship relationship =
                    graphDb.createRelationship( n1.getId(), n2.getId(), currentRelType, edgeProperties );
            edges.add( relationship );
            return relationship;
        }
        catch ( EntityNotFoundException e )
        {
            throw new IllegalStateException( e );
        }
    }

    /**
     * This creates a chain by adding a number of edges. Example: The input
     * string "a,b,c,d,e" makes the chain a->b->c->d->e
     * @param commaSeparatedNodeNames
     *            A string with the node names separated by commas.
     */
    public void makeEdgeChain( String commaSeparatedNodeNames )
    {
        String[] names = commaSeparatedNodeNames.split( "," );
        for ( int i = 0; i < names.length - 1; ++i )
        {
            makeEdge( names[i], names[i + 1] );
        }
    }
}
