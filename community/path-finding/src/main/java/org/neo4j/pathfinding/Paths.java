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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.eclipse.collections.api.map.primitive.MutableLongIntMap;
import org.eclipse.collections.api.set.primitive.MutableLongSet;
import org.eclipse.collections.impl.map.mutable.primitive.LongIntHashMap;
import org.eclipse.collections.impl.set.mutable.primitive.LongHashSet;
import org.neo4j.pathfinding.graph.Node;
import org.neo4j.pathfinding.graph.Path;
import org.neo4j.pathfinding.graph.Relationship;

/**
 * Utilities for paths that have already been built. None of these touch the
 * graph; the ones returning a {@link Path} return a new one.
 */
public final class Paths
{
    private Paths()
    {
    }

    /**
     * Concatenates the nodes and the relationships of {@code paths}, in
     * argument order. Nothing is removed and nothing is checked: combining
     * {@code [A,B]} with {@code [B,C]} gives the nodes {@code [A,B,B,C]}.
     * It is up to the caller to pass paths that make sense together.
     *
     * @param paths the paths to combine.
     * @return the combined path, {@link Path#EMPTY} if no paths were given.
     */
    public static Path combine( Path... paths )
    {
        return combine( Arrays.asList( paths ) );
    }

    public static Path combine( List<Path> paths )
    {
        if ( paths.isEmpty() )
        {
            return Path.EMPTY;
        }
        List<Node> nodes = new ArrayList<>();
        List<Relationship> relationships = new ArrayList<>();
        for ( Path path : paths )
        {
            nodes.addAll( path.nodes() );
            relationships.addAll( path.relationships() );
        }
        return new Path( nodes, relationships );
    }

    /**
     * @param path the path to flatten.
     * @return nodes and relationships interleaved, i.e.
     * {@code [node0, rel0, node1, rel1, ..., nodeN]}. Relationship {@code i}
     * follows node {@code i}; relationships without a node in front of them
     * are left out.
     */
    public static List<Object> elements( Path path )
    {
        List<Node> nodes = path.nodes();
        List<Relationship> relationships = path.relationships();
        List<Object> elements = new ArrayList<>( nodes.size() + relationships.size() );
        for ( int i = 0; i < nodes.size(); i++ )
        {
            elements.add( nodes.get( i ) );
            if ( i < relationships.size() )
            {
                elements.add( relationships.get( i ) );
            }
        }
        return elements;
    }

    /**
     * Returns the part of {@code path} from node index {@code start} to node
     * index {@code end}, both inclusive, together with the relationships in
     * between. Indexes out of range are clamped to the path. If, after
     * clamping, {@code start} is not before {@code end} the empty path is returned.
     * A slice therefore always contains at least one relationship: a single
     * node cannot be sliced out, {@code slice( path, 2, 2 )} is {@link Path#EMPTY}.
     * <p>
     * For a path {@code [n0,n1,n2,n3,n4]}, {@code slice( path, 1, 3 )} is
     * {@code [n1,n2,n3]} with the two relationships connecting them.
     *
     * @param path the path to take a slice of.
     * @param start index of the first node of the slice.
     * @param end index of the last node of the slice.
     * @return the slice.
     */
    public static Path slice( Path path, int start, int end )
    {
        List<Node> nodes = path.nodes();
        List<Relationship> relationships = path.relationships();
        int from = Math.max( start, 0 );
        int to = Math.min( end, nodes.size() - 1 );
        if ( from >= to )
        {
            return Path.EMPTY;
        }
        int relationshipsFrom = Math.min( from, relationships.size() );
        int relationshipsTo = Math.max( relationshipsFrom, Math.min( to, relationships.size() ) );
        return new Path( nodes.subList( from, to + 1 ), relationships.subList( relationshipsFrom, relationshipsTo ) );
    }

    /**
     * @return {@code path} walked from its end node to its start node.
     */
    public static Path reverse( Path path )
    {
        List<Node> nodes = new ArrayList<>( path.nodes() );
        List<Relationship> relationships = new ArrayList<>( path.relationships() );
        Collections.reverse( nodes );
        Collections.reverse( relationships );
        return new Path( nodes, relationships );
    }

    /**
     * @param paths the paths to look at.
     * @return the nodes that are part of every one of {@code paths}, in the
     * order they first appear. Empty if no paths are given.
     */
    public static List<Node> commonNodes( List<Path> paths )
    {
        if ( paths.isEmpty() )
        {
            return Collections.emptyList();
        }
        MutableLongIntMap occurrences = new LongIntHashMap();
        List<Node> candidates = new ArrayList<>();
        for ( Path path : paths )
        {
            MutableLongSet seen = new LongHashSet();
            for ( Node node : path.nodes() )
            {
                if ( seen.add( node.getId() ) && occurrences.addToValue( node.getId(), 1 ) == 1 )
                {
                    candidates.add( node );
                }
            }
        }
        List<Node> common = new ArrayList<>();
        for ( Node candidate : candidates )
        {
            if ( occurrences.get( candidate.getId() ) == paths.size() )
            {
                common.add( candidate );
            }
        }
        return common;
    }

    /**
     * @param paths the paths to look at.
     * @return every node of {@code paths} once, in the order they first appear.
     */
    public static List<Node> distinctNodes( List<Path> paths )
    {
        MutableLongSet seen = new LongHashSet();
        List<Node> nodes = new ArrayList<>();
        for ( Path path : paths )
        {
            for ( Node node : path.nodes() )
            {
                if ( seen.add( node.getId() ) )
                {
                    nodes.add( node );
                }
            }
        }
        return nodes;
    }
}
