package com.ammann.connectorstats.enumeration;

/**
 * Kind of connector a statistics stream belongs to.
 */
public enum ConnectorType
{
    /** Ingests data from an external system. */
    SOURCE,
    /** Writes data to an external system. */
    SINK
}
