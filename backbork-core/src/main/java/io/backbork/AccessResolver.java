package io.backbork;

import java.util.List;

/**
 * Resolves the accounts an owner may back up. Consulted each time a wildcard selection is
 * expanded; results must not be cached across passes.
 */
@FunctionalInterface
public interface AccessResolver {

    List<String> accessibleAccounts(String owner);
}
