package org.keel.model.naming;

import java.util.Locale;

/**
 * How a provider compares identifiers. SQLite folds case, PostgreSQL and MySQL (with quoted
 * identifiers) preserve it.
 */
@FunctionalInterface
public interface CaseNormalizer {
    String normalize(String raw);

    static CaseNormalizer lower()   { return s -> s == null ? "" : s.trim().toLowerCase(Locale.ROOT); }
    static CaseNormalizer preserve(){ return s -> s == null ? "" : s.trim(); }
}
