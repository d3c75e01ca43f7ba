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
import java.util.Collections;
import java.util.List;

import org.neo4j.pathfinding.graph.Node;
import org.neo4j.pathfinding.graph.Relationship;

/**
 * Nodes and relationships reached by a subgraph exploration, in the order
 * they were discovered. Neither list contains duplicates.
 */
public final class Subgraph
{
    private final List<Node> nodes;
    private final List<Relationship> relationships;

    public Subgraph( List<Node> nodes, List<Relationship> relationships )
    {
        this.nodes = Collections.unmodifiableList( new ArrayList<>( nodes ) );
        this.relationships = Collections.unmodifiableList( new ArrayList<>( relationships ) );
    }

    public static Subgraph empty()
    {
        return new Subgraph( Collections.<Node>emptyList(), Collections.<Relationship>emptyList() );
    }

    public List<Node> nodes()
    {
        return nodes;
    }

    public List<Relationship> relationships()
    {
        return relationships;
    }

    public boolean isEmpty()
    {
        return nodes.isEmpty() && relationships.isEmpty();
    }

    @Override
    public String toString()
    {
        return "Subgraph{nodes=" + nodes + ", relationships=" + relationships + "}";
    }
}
