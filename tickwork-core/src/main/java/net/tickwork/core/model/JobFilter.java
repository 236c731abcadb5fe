package net.tickwork.core.model;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;

public record JobFilter(
        Set<Job.Type> types,
        Set<Job.Status> statuses,
        String name,
        String nameContains,
        List<String> anyTags,
        List<String> allTags,
        String platformId,
        String createdBy,
        Instant nextRunAfter,
        Instant nextRunBefore,
        SortBy sortBy,
        boolean descending,
        int limit,
        int offset
) {
    public static final int DEFAULT_LIMIT = 100;

    public enum SortBy { CREATED_AT, NEXT_RUN, NAME, PRIORITY }

    public JobFilter {
        types = types == null ? Set.of() : Set.copyOf(types);
        statuses = statuses == null ? Set.of() : Set.copyOf(statuses);
        anyTags = anyTags == null ? List.of() : List.copyOf(anyTags);
        allTags = allTags == null ? List.of() : List.copyOf(allTags);
        if (sortBy == null) sortBy = SortBy.CREATED_AT;
        if (limit <= 0) limit = DEFAULT_LIMIT;
        if (offset < 0) offset = 0;
    }

    public static JobFilter all() { return builder().build(); }

    public static Builder builder() { return new Builder(); }

    public boolean hasTagCriteria() { return !anyTags.isEmpty() || !allTags.isEmpty(); }

    public boolean matchesTags(Job j) {
        if (!anyTags.isEmpty() && anyTags.stream().noneMatch(j.tags()::contains)) return false;
        return j.tags().containsAll(allTags);
    }

    public boolean matches(Job j) {
        if (!types.isEmpty() && !types.contains(j.type())) return false;
        if (!statuses.isEmpty() && !statuses.contains(j.status())) return false;
        if (name != null && !name.equals(j.name())) return false;
        if (nameContains != null && (j.name() == null
                || !j.name().toLowerCase(Locale.ROOT).contains(nameContains.toLowerCase(Locale.ROOT)))) return false;
        if (platformId != null && !platformId.equals(j.platformId())) return false;
        if (createdBy != null && !createdBy.equals(j.createdBy())) return false;
        if (nextRunAfter != null && (j.nextRun() == null || !j.nextRun().isAfter(nextRunAfter))) return false;
        if (nextRunBefore != null && (j.nextRun() == null || !j.nextRun().isBefore(nextRunBefore))) return false;
        return matchesTags(j);
    }

    public Comparator<Job> comparator() {
        Comparator<Job> c;
        switch (sortBy) {
            case NEXT_RUN:
                c = Comparator.comparing(Job::nextRun, Comparator.nullsLast(Comparator.naturalOrder()));
                break;
            case NAME:
                c = Comparator.comparing(Job::name, Comparator.nullsLast(Comparator.naturalOrder()));
                break;
            case PRIORITY:
                c = Comparator.comparingInt(j -> j.priority().weight());
                break;
            default:
                c = Comparator.comparing(Job::createdAt, Comparator.nullsLast(Comparator.naturalOrder()));
        }
        c = c.thenComparing(Job::id);
        return descending ? c.reversed() : c;
    }

    public static final class Builder {
        private Set<Job.Type> types;
        private Set<Job.Status> statuses;
        private String name;
        private String nameContains;
        private List<String> anyTags;
        private List<String> allTags;
        private String platformId;
        private String createdBy;
        private Instant nextRunAfter;
        private Instant nextRunBefore;
        private SortBy sortBy;
        private boolean descending;
        private int limit;
        private int offset;

        private Builder() {}

        public Builder types(Job.Type... v) { types = Set.of(v); return this; }
        public Builder statuses(Job.Status... v) { statuses = Set.of(v); return this; }
        public Builder name(String v) { name = v; return this; }
        public Builder nameContains(String v) { nameContains = v; return this; }
        public Builder anyTags(String... v) { anyTags = List.of(v); return this; }
        public Builder allTags(String... v) { allTags = List.of(v); return this; }
        public Builder platformId(String v) { platformId = v; return this; }
        public Builder createdBy(String v) { createdBy = v; return this; }
        public Builder nextRunAfter(Instant v) { nextRunAfter = v; return this; }
        public Builder nextRunBefore(Instant v) { nextRunBefore = v; return this; }
        public Builder sortBy(SortBy v, boolean desc) { sortBy = v; descending = desc; return this; }
        public Builder limit(int v) { limit = v; return this; }
        public Builder offset(int v) { offset = v; return this; }

        public JobFilter build() {
            return new JobFilter(types, statuses, name, nameContains, anyTags, allTags, platformId, createdBy,
                    nextRunAfter, nextRunBefore, sortBy, descending, limit, offset);
        }
    }
}
