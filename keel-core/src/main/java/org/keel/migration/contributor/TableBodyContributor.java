package org.keel.migration.contributor;

/**
 * Renders lines inside the parentheses of {@code CREATE TABLE}.
 */
public interface TableBodyContributor {
}
