package elevator_fleet.storage;

import elevator_fleet.models.QueryLogEntry;
import java.util.List;

/** Audit trail of the statements a database-backed store has run. */
public interface QueryLog {

    /** Newest first; a non-positive limit yields an empty list. */
    List<QueryLogEntry> recent(int limit);

    // backends without statements have nothing to audit
    static QueryLog none() {
        return limit -> List.of();
    }
}
