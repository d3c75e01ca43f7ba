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

import java.util.Arrays;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;

/**
 * Immutable settings of a traversal. Absent values mean "no bound":
 * <ul>
 * <li>{@code minLevel} 0</li>
 * <li>{@code maxLevel} {@link #UNBOUNDED}</li>
 * <li>{@code relationshipFilter} and {@code labelFilter} empty, i.e. everything</li>
 * <li>{@code limit} 0, i.e. no limit</li>
 * <li>{@code uniqueness} {@link Uniqueness#NODE_GLOBAL}</li>
 * <li>{@code bfs} {@code false}</li>
 * </ul>
 * Values are not validated. Contradicting settings, see {@link #isSatisfiable()},
 * make every traversal return an empty result.
 */
public final class TraversalConfig
{
    public static final int UNBOUNDED = Integer.MAX_VALUE;

    public static final String MIN_LEVEL = "minLevel";
    public static final String MAX_LEVEL = "maxLevel";
    public static final String RELATIONSHIP_FILTER = "relationshipFilter";
    public static final String LABEL_FILTER = "labelFilter";
    public static final String LIMIT = "limit";
    public static final String UNIQUENESS = "uniqueness";
    public static final String BFS = "bfs";

    private static final TraversalConfig DEFAULTS = builder().build();

    /**
     * Uniqueness names of APOC's path expander that have no guard of their own
     * here and are read as {@link Uniqueness#NONE}.
     */
    private static final Set<String> UNGUARDED_UNIQUENESS = new HashSet<>( Arrays.asList(
            "NODE_PATH", "NODE_RECENT", "NODE_LEVEL",
            "RELATIONSHIP_GLOBAL", "RELATIONSHIP_PATH", "RELATIONSHIP_RECENT", "RELATIONSHIP_LEVEL" ) );

    private final int minLevel;
    private final int maxLevel;
    private final String relationshipFilter;
    private final String labelFilter;
    private final int limit;
    private final Uniqueness uniqueness;
    private final boolean bfs;

    private TraversalConfig( Builder builder )
    {
        this.minLevel = builder.minLevel;
        this.maxLevel = builder.maxLevel;
        this.relationshipFilter = builder.relationshipFilter;
        this.labelFilter = builder.labelFilter;
        this.limit = builder.limit;
        this.uniqueness = builder.uniqueness;
        this.bfs = builder.bfs;
    }

    public static TraversalConfig defaults()
    {
        return DEFAULTS;
    }

    public static Builder builder()
    {
        return new Builder();
    }

    /**
     * Reads a configuration from the kind of map a procedure call receives,
     * e.g. {@code {maxLevel: 3, relationshipFilter: 'KNOWS>'}}. Missing keys
     * and {@code null} values keep their defaults, unknown keys are ignored.
     * <p>
     * Integer values outside the range of {@code int} are clamped to it.
     * Besides {@code NODE_GLOBAL} and {@code NONE} the uniqueness may be any
     * other APOC uniqueness name, such as {@code NODE_PATH} or
     * {@code RELATIONSHIP_GLOBAL}; those all mean {@link Uniqueness#NONE}.
     *
     * @param config the configuration map, may be {@code null}.
     * @return the configuration.
     * @throws IllegalArgumentException if a value is of the wrong type, a
     * number has a fractional part, or the uniqueness name is unknown.
     */
    public static TraversalConfig from( Map<String,?> config )
    {
        Builder builder = builder();
        if ( config == null )
        {
            return builder.build();
        }
        Integer minLevel = intValue( config, MIN_LEVEL );
        if ( minLevel != null )
        {
            builder.withMinLevel( minLevel );
        }
        Integer maxLevel = intValue( config, MAX_LEVEL );
        if ( maxLevel != null )
        {
            builder.withMaxLevel( maxLevel );
        }
        Integer limit = intValue( config, LIMIT );
        if ( limit != null )
        {
            builder.withLimit( limit );
        }
        String relationshipFilter = stringValue( config, RELATIONSHIP_FILTER );
        if ( relationshipFilter != null )
        {
            builder.withRelationshipFilter( relationshipFilter );
        }
        String labelFilter = stringValue( config, LABEL_FILTER );
        if ( labelFilter != null )
        {
            builder.withLabelFilter( labelFilter );
        }
        String uniqueness = stringValue( config, UNIQUENESS );
        if ( StringUtils.isNotBlank( uniqueness ) )
        {
            builder.withUniqueness( uniquenessValue( uniqueness ) );
        }
        Object bfs = config.get( BFS );
        if ( bfs != null )
        {
            builder.withBfs( bfs instanceof Boolean ? (Boolean) bfs : Boolean.parseBoolean( bfs.toString() ) );
        }
        return builder.build();
    }

    public int minLevel()
    {
        return minLevel;
    }

    public int maxLevel()
    {
        return maxLevel;
    }

    public String relationshipFilter()
    {
        return relationshipFilter;
    }

    /**
     * The label filter is carried along for callers and storage layers that
     * understand it; the traversals themselves do not interpret it.
     */
    public String labelFilter()
    {
        return labelFilter;
    }

    public int limit()
    {
        return limit;
    }

    public Uniqueness uniqueness()
    {
        return uniqueness;
    }

    public boolean isBfs()
    {
        return bfs;
    }

    /**
     * @param collected number of results collected so far.
     * @return whether {@code collected} results satisfy the limit.
     */
    public boolean limitReached( int collected )
    {
        return limit > 0 && collected >= limit;
    }

    /**
     * @return {@code false} if {@code minLevel > maxLevel} or {@code limit}
     * is negative, in which case no traversal can produce any result.
     */
    public boolean isSatisfiable()
    {
        return minLevel <= maxLevel && limit >= 0;
    }

    /**
     * @return {@code false} if nothing bounds the number of paths a walk
     * without uniqueness can produce: {@link Uniqueness#NONE} with neither a
     * {@code maxLevel} nor a {@code limit}.
     */
    public boolean isBounded()
    {
        return uniqueness != Uniqueness.NONE || maxLevel != UNBOUNDED || limit > 0;
    }

    public TraversalConfig withMinLevel( int minLevel )
    {
        return toBuilder().withMinLevel( minLevel ).build();
    }

    public TraversalConfig withMaxLevel( int maxLevel )
    {
        return toBuilder().withMaxLevel( maxLevel ).build();
    }

    public TraversalConfig withRelationshipFilter( String relationshipFilter )
    {
        return toBuilder().withRelationshipFilter( relationshipFilter ).build();
    }

    public TraversalConfig withLimit( int limit )
    {
        return toBuilder().withLimit( limit ).build();
    }

    public TraversalConfig withUniqueness( Uniqueness uniqueness )
    {
        return toBuilder().withUniqueness( uniqueness ).build();
    }

    public TraversalConfig withBfs( boolean bfs )
    {
        return toBuilder().withBfs( bfs ).build();
    }

    public Builder toBuilder()
    {
        return builder().withMinLevel( minLevel ).withMaxLevel( maxLevel )
                .withRelationshipFilter( relationshipFilter ).withLabelFilter( labelFilter )
                .withLimit( limit ).withUniqueness( uniqueness ).withBfs( bfs );
    }

    @Override
    public boolean equals( Object o )
    {
        if ( this == o )
        {
            return true;
        }
        if ( !(o instanceof TraversalConfig) )
        {
            return false;
        }
        TraversalConfig that = (TraversalConfig) o;
        return minLevel == that.minLevel && maxLevel == that.maxLevel && limit == that.limit && bfs == that.bfs &&
               relationshipFilter.equals( that.relationshipFilter ) && labelFilter.equals( that.labelFilter ) &&
               uniqueness == that.uniqueness;
    }

    @Override
    public int hashCode()
    {
        return Objects.hash( minLevel, maxLevel, relationshipFilter, labelFilter, limit, uniqueness, bfs );
    }

    @Override
    public String toString()
    {
        return "TraversalConfig{" + MIN_LEVEL + "=" + minLevel + ", " + MAX_LEVEL + "=" +
               (maxLevel == UNBOUNDED ? "unbounded" : String.valueOf( maxLevel )) + ", " +
               RELATIONSHIP_FILTER + "='" + relationshipFilter + "', " + LABEL_FILTER + "='" + labelFilter + "', " +
               LIMIT + "=" + limit + ", " + UNIQUENESS + "=" + uniqueness + ", " + BFS + "=" + bfs + "}";
    }

    private static Integer intValue( Map<String,?> config, String key )
    {
        Object value = config.get( key );
        if ( value == null )
        {
            return null;
        }
        if ( value instanceof Double || value instanceof Float )
        {
            double number = ((Number) value).doubleValue();
            if ( Double.isNaN( number ) || number != Math.rint( number ) )
            {
                throw new IllegalArgumentException( "Expected an integer for '" + key + "', but got " + value );
            }
            return clamp( (long) number );
        }
        if ( value instanceof Number )
        {
            return clamp( ((Number) value).longValue() );
        }
        if ( value instanceof String )
        {
            try
            {
                return clamp( Long.parseLong( ((String) value).trim() ) );
            }
            catch ( NumberFormatException e )
            {
                throw new IllegalArgumentException( "Expected an integer for '" + key + "', but got " + value, e );
            }
        }
        throw new IllegalArgumentException( "Expected an integer for '" + key + "', but got " + value );
    }

    private static int clamp( long value )
    {
        return (int) Math.max( Integer.MIN_VALUE, Math.min( Integer.MAX_VALUE, value ) );
    }

    private static String stringValue( Map<String,?> config, String key )
    {
        Object value = config.get( key );
        if ( value == null || value instanceof String )
        {
            return (String) value;
        }
        throw new IllegalArgumentException( "Expected a string for '" + key + "', but got " + value );
    }

    private static Uniqueness uniquenessValue( String name )
    {
        String normalized = name.trim().toUpperCase( Locale.ROOT );
        if ( UNGUARDED_UNIQUENESS.contains( normalized ) )
        {
            return Uniqueness.NONE;
        }
        try
        {
            return Uniqueness.valueOf( normalized );
        }
        catch ( IllegalArgumentException e )
        {
            throw new IllegalArgumentException( "Unknown uniqueness '" + name + "', expected one of " +
                    StringUtils.join( Uniqueness.values(), ", " ) + " or " +
                    StringUtils.join( UNGUARDED_UNIQUENESS, ", " ), e );
        }
    }

    public static final class Builder
    {
        private int minLevel;
        private int maxLevel = UNBOUNDED;
        private String relationshipFilter = "";
        private String labelFilter = "";
        private int limit;
        private Uniqueness uniqueness = Uniqueness.NODE_GLOBAL;
        private boolean bfs;

        private Builder()
        {
        }

        public Builder withMinLevel( int minLevel )
        {
            this.minLevel = minLevel;
            return this;
        }

        public Builder withMaxLevel( int maxLevel )
        {
            this.maxLevel = maxLevel;
            return this;
        }

        public Builder withRelationshipFilter( String relationshipFilter )
        {
            this.relationshipFilter = StringUtils.defaultString( relationshipFilter );
            return this;
        }

        public Builder withLabelFilter( String labelFilter )
        {
            this.labelFilter = StringUtils.defaultString( labelFilter );
            return this;
        }

        public Builder withLimit( int limit )
        {
            this.limit = limit;
            return this;
        }

        public Builder withUniqueness( Uniqueness uniqueness )
        {
            this.uniqueness = Objects.requireNonNull( uniqueness, "uniqueness" );
            return this;
        }

        public Builder withBfs( boolean bfs )
        {
            this.bfs = bfs;
            return this;
        }

        public TraversalConfig build()
        {
            return new TraversalConfig( this );
        }
    }
}
