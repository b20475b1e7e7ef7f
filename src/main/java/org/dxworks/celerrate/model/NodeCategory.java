package org.dxworks.celerrate.model;

public enum NodeCategory {
    FILE,
    DECLARATION,
    STATEMENT,
    EXPRESSION,
    CLAUSE
}
