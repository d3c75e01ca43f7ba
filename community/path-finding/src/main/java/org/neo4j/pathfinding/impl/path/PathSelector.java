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
package org.neo4j.pathfinding.impl.path;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import org.eclipse.collections.api.list.primitive.MutableLongList;
import org.eclipse.collections.api.set.primitive.LongSet;
import org.eclipse.collections.api.set.primitive.MutableLongSet;
import org.eclipse.collections.impl.list.mutable.primitive.LongArrayList;
import org.eclipse.collections.impl.set.mutable.primitive.LongHashSet;
import org.neo4j.logging.Log;
import org.neo4j.logging.LogProvider;
import org.neo4j.pathfinding.graph.GraphReadOperations;
import org.neo4j.pathfinding.graph.Node;
import org.neo4j.pathfinding.graph.Path;
import org.neo4j.pathfinding.graph.Relationship;
import org.neo4j.pathfinding.impl.util.GraphReads;

/**
 * Picks paths between two nodes by their length, out of every path the
 * underlying {@link GraphReadOperations} finds within a maximum length.
 * A failing search yields no paths.
 */
public class PathSelector
{
    private final GraphReadOperations graph;
    private final GraphReads reads;
    private final Log log;

    public PathSelector( GraphReadOperations graph, LogProvider logProvider )
    {
        this.graph = graph;
        this.log = logProvider.getLog( getClass() );
        this.reads = new GraphReads( graph, log );
    }

    public List<Path> allPaths( Node start, Node end, String relationshipFilter, int maxLength )
    {
        return AllPaths.find( graph, start, end, relationshipFilter, maxLength, log );
    }

    public int countPaths( Node start, Node end, String relationshipFilter, int maxLength )
    {
        return allPaths( start, end, relationshipFilter, maxLength ).size();
    }

    public List<Path> longestPaths( Node start, Node end, String relationshipFilter, int maxLength )
    {
        List<Path> paths = allPaths( start, end, relationshipFilter, maxLength );
        if ( paths.isEmpty() )
        {
            return paths;
        }
        int longest = 0;
        for ( Path path : paths )
        {
            longest = Math.max( longest, path.length() );
        }
        return withinLength( paths, longest, longest );
    }

    public List<Path> pathsWithLength( Node start, Node end, String relationshipFilter, int length )
    {
        return pathsWithinLength( start, end, relationshipFilter, length, length );
    }

    public List<Path> pathsWithinLength( Node start, Node end, String relationshipFilter, int minLength,
            int maxLength )
    {
        if ( minLength > maxLength )
        {
            return Collections.emptyList();
        }
        return withinLength( allPaths( start, end, relationshipFilter, maxLength ), minLength, maxLength );
    }

    /**
     * @return the {@code k} shortest paths, shortest first. Paths of equal
     * length keep the order the graph found them in.
     */
    public List<Path> kShortestPaths( Node start, Node end, String relationshipFilter, int maxLength, int k )
    {
        if ( k <= 0 )
        {
            return Collections.emptyList();
        }
        List<Path> paths = new ArrayList<>( allPaths( start, end, relationshipFilter, maxLength ) );
        paths.sort( Comparator.comparingInt( Path::length ) );
        return paths.size() > k ? new ArrayList<>( paths.subList( 0, k ) ) : paths;
    }

    /**
     * @return the paths that visit no node twice.
     */
    public List<Path> simplePaths( Node start, Node end, String relationshipFilter, int maxLength )
    {
        List<Path> result = new ArrayList<>();
        for ( Path path : allPaths( start, end, relationshipFilter, maxLength ) )
        {
            if ( hasDistinctNodes( path ) )
            {
                result.add( path );
            }
        }
        return result;
    }

    /**
     * @return the paths that use no relationship twice.
     */
    public List<Path> elementaryPaths( Node start, Node end, String relationshipFilter, int maxLength )
    {
        List<Path> result = new ArrayList<>();
        for ( Path path : allPaths( start, end, relationshipFilter, maxLength ) )
        {
            if ( hasDistinctRelationships( path ) )
            {
                result.add( path );
            }
        }
        return result;
    }

    /**
     * Picks paths greedily, in the order the graph found them: a path is taken
     * if none of its nodes, other than {@code start} and {@code end}, is on a
     * path taken before.
     *
     * @return at most {@code count} node-disjoint paths.
     */
    public List<Path> disjointPaths( Node start, Node end, String relationshipFilter, int maxLength, int count )
    {
        List<Path> result = new ArrayList<>();
        if ( count <= 0 )
        {
            return result;
        }
        MutableLongSet used = new LongHashSet();
        for ( Path path : allPaths( start, end, relationshipFilter, maxLength ) )
        {
            MutableLongList inner = new LongArrayList();
            for ( Node node : path.nodes() )
            {
                if ( !node.equals( start ) && !node.equals( end ) )
                {
                    inner.add( node.getId() );
                }
            }
            if ( !anyOf( inner, used ) )
            {
                used.addAll( inner );
                result.add( path );
                if ( result.size() >= count )
                {
                    break;
                }
            }
        }
        return result;
    }

    /**
     * Like {@link #disjointPaths(Node, Node, String, int, int)}, but the paths
     * only have to be disjoint in their relationships.
     *
     * @return at most {@code count} relationship-disjoint paths.
     */
    public List<Path> edgeDisjointPaths( Node start, Node end, String relationshipFilter, int maxLength, int count )
    {
        List<Path> result = new ArrayList<>();
        if ( count <= 0 )
        {
            return result;
        }
        MutableLongSet used = new LongHashSet();
        for ( Path path : allPaths( start, end, relationshipFilter, maxLength ) )
        {
            MutableLongList relationships = new LongArrayList();
            for ( Relationship relationship : path.relationships() )
            {
                relationships.add( relationship.getId() );
            }
            if ( !anyOf( relationships, used ) )
            {
                used.addAll( relationships );
                result.add( path );
                if ( result.size() >= count )
                {
                    break;
                }
            }
        }
        return result;
    }

    /**
     * Finds the cycles through {@code start}: paths of length 1 to
     * {@code maxLength} that begin and end at {@code start} and visit no other
     * node twice. A cycle is returned once, in the direction it is first found
     * in, so {@code A-B-C-A} and {@code A-C-B-A} count as the same cycle.
     * Self-loops are cycles of length 1.
     */
    public List<Path> cycles( Node start, String relationshipFilter, int maxLength )
    {
        Objects.requireNonNull( start, "start" );
        List<Path> result = new ArrayList<>();
        if ( maxLength < 1 )
        {
            return result;
        }
        Set<LongSet> seen = new HashSet<>();
        long startId = start.getId();
        for ( Relationship first : reads.relationships( start, relationshipFilter ) )
        {
            long neighborId = first.getOtherNodeId( startId );
            if ( neighborId == startId )
            {
                addCycle( new Path.Builder( start ).push( first, start ).build(), seen, result );
                continue;
            }
            Node neighbor = reads.node( neighborId );
            if ( neighbor == null )
            {
                continue;
            }
            for ( Path back : AllPaths.find( graph, neighbor, start, relationshipFilter, maxLength - 1, log ) )
            {
                if ( back.length() == 0 || back.relationships().contains( first ) )
                {
                    continue;
                }
                Path.Builder cycle = new Path.Builder( start ).push( first, neighbor );
                for ( int i = 0; i < back.length(); i++ )
                {
                    cycle = cycle.push( back.relationships().get( i ), back.nodes().get( i + 1 ) );
                }
                addCycle( cycle.build(), seen, result );
            }
        }
        return result;
    }

    private static void addCycle( Path cycle, Set<LongSet> seen, List<Path> result )
    {
        MutableLongSet relationships = new LongHashSet();
        for ( Relationship relationship : cycle.relationships() )
        {
            relationships.add( relationship.getId() );
        }
        if ( seen.add( relationships.toImmutable() ) )
        {
            result.add( cycle );
        }
    }

    private static boolean anyOf( MutableLongList ids, MutableLongSet used )
    {
        for ( int i = 0; i < ids.size(); i++ )
        {
            if ( used.contains( ids.get( i ) ) )
            {
                return true;
            }
        }
        return false;
    }

    private static boolean hasDistinctNodes( Path path )
    {
        MutableLongSet seen = new LongHashSet();
        for ( Node node : path.nodes() )
        {
            if ( !seen.add( node.getId() ) )
            {
                return false;
            }
        }
        return true;
    }

    private static boolean hasDistinctRelationships( Path path )
    {
        MutableLongSet seen = new LongHashSet();
        for ( Relationship relationship : path.relationships() )
        {
            if ( !seen.add( relationship.getId() ) )
            {
                return false;
            }
        }
        return true;
    }

    private static List<Path> withinLength( List<Path> paths, int minLength, int maxLength )
    {
        List<Path> result = new ArrayList<>();
        for ( Path path : paths )
        {
            if ( path.length() >= minLength && path.length() <= maxLength )
            {
                result.add( path );
            }
        }
        return result;
    }
}
