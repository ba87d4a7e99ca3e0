package org.example.nitro.model;

import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;

/**
 * A request for a package that will be fulfilled later.
 *
 * <p><b>Identity:</b> two requests are equal, and hash identically, if and only
 * if their ids match. Source, repository and content version are ignored. Every
 * request for the same id therefore lands on the same dependency record during
 * resolution, however many dependents asked for it.</p>
 *
 * <p><b>Ordering:</b> requests order by source kind, then id, then repository,
 * then content version. The ordering is only used to make iteration
 * deterministic and is not consistent with {@link #equals(Object)}.</p>
 *
 * <p>Requests are immutable. Derived requests are built with {@link #withSource}
 * and {@link #withContentVersion}.</p>
 */
public final class PackageRequest implements Comparable<PackageRequest> {

    private static final Comparator<PackageRequest> ORDERING = Comparator
            .comparing(PackageRequest::getSource)
            .thenComparing(PackageRequest::getId)
            .thenComparing(r -> r.repository, Comparator.nullsFirst(Comparator.<String>naturalOrder()))
            .thenComparing(PackageRequest::getContentVersion);

    private final String id;
    private final RequestSource source;
    private final String repository;
    private final VersionPattern contentVersion;

    public PackageRequest(String id, RequestSource source, VersionPattern contentVersion, String repository) {
        this.id = Objects.requireNonNull(id, "id cannot be null");
        this.source = Objects.requireNonNull(source, "source cannot be null");
        this.contentVersion = contentVersion != null ? contentVersion : VersionPattern.any();
        this.repository = repository;
    }

    /**
     * Creates a request that matches all content versions and repositories.
     */
    public static PackageRequest any(String id, RequestSource source) {
        return new PackageRequest(id, source, VersionPattern.any(), null);
    }

    /**
     * Parses a request of the form {@code [repository:]id[@version]}.
     * An empty repository is treated as no repository.
     */
    public static PackageRequest parse(String text, RequestSource source) {
        Objects.requireNonNull(text, "text cannot be null");

        String idAndRepo = text;
        VersionPattern version = VersionPattern.any();
        int at = text.indexOf('@');
        if (at != -1) {
            idAndRepo = text.substring(0, at);
            version = VersionPattern.parse(text.substring(at + 1));
        }

        String id = idAndRepo;
        String repository = null;
        int colon = idAndRepo.indexOf(':');
        if (colon != -1) {
            id = idAndRepo.substring(colon + 1);
            String repo = idAndRepo.substring(0, colon);
            repository = repo.isEmpty() ? null : repo;
        }

        return new PackageRequest(id, source, version, repository);
    }

    public String getId() {
        return id;
    }

    public RequestSource getSource() {
        return source;
    }

    public Optional<String> getRepository() {
        return Optional.ofNullable(repository);
    }

    public VersionPattern getContentVersion() {
        return contentVersion;
    }

    public PackageRequest withSource(RequestSource newSource) {
        return new PackageRequest(id, newSource, contentVersion, repository);
    }

    public PackageRequest withContentVersion(VersionPattern newVersion) {
        return new PackageRequest(id, source, newVersion, repository);
    }

    /**
     * Renders the provenance chain of this request, root first.
     * For example {@code Repository -> baz -> bar -> foo}.
     */
    public String debugSources() {
        return switch (source.getKind()) {
            case USER_REQUIRE -> id;
            case DEPENDENCY -> parentSources() + " -> " + id;
            case BUNDLED -> parentSources() + " => " + id;
            case REFUSED -> parentSources() + " =X=> " + id;
            case REPOSITORY -> "Repository -> " + id;
        };
    }

    private String parentSources() {
        return source.getParent().map(PackageRequest::debugSources).orElse("?");
    }

    /**
     * Renders the full request text, the inverse of {@link #parse}.
     */
    public String toRequestString() {
        StringBuilder sb = new StringBuilder();
        if (repository != null) {
            sb.append(repository).append(':');
        }
        sb.append(id);
        if (!contentVersion.isAny()) {
            sb.append('@').append(contentVersion);
        }
        return sb.toString();
    }

    @Override
    public int compareTo(PackageRequest other) {
        return ORDERING.compare(this, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return id.equals(((PackageRequest) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return id;
    }
}
