package org.keel.migration.spi.visitor;

public interface SqlGeneratingVisitor {
    String getGeneratedSql();
}
