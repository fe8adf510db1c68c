package org.keel.migration.contributor;

/**
 * Renders statements that follow {@code CREATE TABLE}.
 */
public interface PostCreateContributor {
}
