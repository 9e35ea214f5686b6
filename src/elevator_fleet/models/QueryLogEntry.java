package elevator_fleet.models;

import java.time.Instant;
import java.util.Objects;

/** One audited store statement. */
public final class QueryLogEntry {
    public final String id;
    public final String query;
    public final String executedBy;
    public final Instant executedAt;
    // store operation that ran the statement, e.g. "updateElevator"
    public final String source;
    // JSON array of the bound values, null when the statement had none
    public final String parameters;

    public QueryLogEntry(String id, String query, String executedBy, Instant executedAt, String source,
                         String parameters) {
        this.id = Objects.requireNonNull(id, "id");
        this.query = Objects.requireNonNull(query, "query");
        this.executedBy = Objects.requireNonNull(executedBy, "executedBy");
        this.executedAt = Objects.requireNonNull(executedAt, "executedAt");
        this.source = Objects.requireNonNull(source, "source");
        this.parameters = parameters;
    }

    @Override
    public String toString() {
        return source + " by " + executedBy + ": " + query + (parameters == null ? "" : " " + parameters);
    }
}
