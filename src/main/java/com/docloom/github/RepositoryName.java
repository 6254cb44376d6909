package com.docloom.github;

import java.util.Optional;

public record RepositoryName(String owner, String repo) {

    public static Optional<RepositoryName> parse(String qualifiedName) {
        if (qualifiedName == null) {
            return Optional.empty();
        }
        int slash = qualifiedName.indexOf('/');
        if (slash <= 0 || slash == qualifiedName.length() - 1 || qualifiedName.indexOf('/', slash + 1) >= 0) {
            return Optional.empty();
        }
        return Optional.of(new RepositoryName(qualifiedName.substring(0, slash), qualifiedName.substring(slash + 1)));
    }

    public String qualified() {
        return owner + "/" + repo;
    }
}
