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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Represents a path in the graph. A path starts with a node followed by
 * pairs of {@link Relationship} and {@link Node} objects, where
 * {@code relationships().get( i )} connects {@code nodes().get( i )} and
 * {@code nodes().get( i + 1 )} in either direction. The shortest non-empty
 * path is of length 0, it contains only one node and no relationships.
 * <p>
 * Paths are immutable. {@link #EMPTY} has neither nodes nor relationships
 * and is what operations return when there is no path to return.
 */
public final class Path
{
    public static final Path EMPTY = new Path( Collections.<Node>emptyList(), Collections.<Relationship>emptyList() );

    private final List<Node> nodes;
    private final List<Relationship> relationships;

    public Path( List<Node> nodes, List<Relationship> relationships )
    {
        this.nodes = Collections.unmodifiableList( new ArrayList<>( nodes ) );
        this.relationships = Collections.unmodifiableList( new ArrayList<>( relationships ) );
    }

    public static Path singleNodePath( Node node )
    {
        return new Path( Collections.singletonList( node ), Collections.<Relationship>emptyList() );
    }

    /**
     * @return the first node of this path, or {@code null} for the empty path.
     */
    public Node startNode()
    {
        return nodes.isEmpty() ? null : nodes.get( 0 );
    }

    /**
     * @return the last node of this path, or {@code null} for the empty path.
     * For a path of length 0 this is the same node as {@link #startNode()}.
     */
    public Node endNode()
    {
        return nodes.isEmpty() ? null : nodes.get( nodes.size() - 1 );
    }

    public List<Node> nodes()
    {
        return nodes;
    }

    public List<Relationship> relationships()
    {
        return relationships;
    }

    /**
     * Returns the length of this path. That is the number of relationships
     * (which is the same as the number of nodes minus one for paths built by
     * a traversal).
     *
     * @return the number of relationships in the path.
     */
    public int length()
    {
        return relationships.size();
    }

    public boolean isEmpty()
    {
        return nodes.isEmpty();
    }

    @Override
    public boolean equals( Object o )
    {
        if ( this == o )
        {
            return true;
        }
        if ( !(o instanceof Path) )
        {
            return false;
        }
        Path other = (Path) o;
        return nodes.equals( other.nodes ) && relationships.equals( other.relationships );
    }

    @Override
    public int hashCode()
    {
        return 31 * nodes.hashCode() + relationships.hashCode();
    }

    @Override
    public String toString()
    {
        if ( nodes.isEmpty() )
        {
            return "()";
        }
        StringBuilder builder = new StringBuilder();
        builder.append( '(' ).append( nodes.get( 0 ).getId() ).append( ')' );
        for ( int i = 0; i < relationships.size() && i + 1 < nodes.size(); i++ )
        {
            Relationship relationship = relationships.get( i );
            boolean forward = relationship.isOutgoingFrom( nodes.get( i ).getId() );
            builder.append( forward ? "-[" : "<-[" )
                   .append( relationship.getType() ).append( ',' ).append( relationship.getId() )
                   .append( forward ? "]->(" : "]-(" )
                   .append( nodes.get( i + 1 ).getId() ).append( ')' );
        }
        return builder.toString();
    }

    /**
     * Persistent builder of paths. Every {@link #push(Relationship, Node)}
     * returns a new builder sharing the prefix with this one, so branching
     * traversals can extend the same prefix in several ways without copying.
     */
    public static final class Builder
    {
        private final Builder previous;
        private final Node node;
        private final Relationship relationship;
        private final int size;

        public Builder( Node start )
        {
            this( null, start, null );
        }

        private Builder( Builder previous, Node node, Relationship relationship )
        {
            this.previous = previous;
            this.node = node;
            this.relationship = relationship;
            this.size = previous == null ? 0 : previous.size + 1;
        }

        /**
         * @param relationship the relationship leading to {@code node}.
         * @param node the node at the other end of {@code relationship}.
         * @return a builder for this path extended by one step.
         */
        public Builder push( Relationship relationship, Node node )
        {
            return new Builder( this, node, relationship );
        }

        public Node endNode()
        {
            return node;
        }

        public int length()
        {
            return size;
        }

        /**
         * @param nodeId the node to look for.
         * @return whether a node with the given id is part of the path built so far.
         */
        public boolean contains( long nodeId )
        {
            for ( Builder current = this; current != null; current = current.previous )
            {
                if ( current.node.getId() == nodeId )
                {
                    return true;
                }
            }
            return false;
        }

        public Path build()
        {
            Node[] nodes = new Node[size + 1];
            Relationship[] relationships = new Relationship[size];
            for ( Builder current = this; current != null; current = current.previous )
            {
                nodes[current.size] = current.node;
                if ( current.relationship != null )
                {
                    relationships[current.size - 1] = current.relationship;
                }
            }
            return new Path( Arrays.asList( nodes ), Arrays.asList( relationships ) );
        }
    }
}
