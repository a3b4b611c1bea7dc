package uncharted.settlement;

/**
 * A queued or active build. {@code startedAt} and {@code completesAt} stay null until the
 * entry is promoted into an active slot. {@code reportedProgress} is the last progress step,
 * in percent, announced for the build.
 */
public record ConstructionQueueEntry(String id,
                                     String settlementId,
                                     String structureType,
                                     String tileId,
                                     boolean emergency,
                                     long queuedAt,
                                     Long startedAt,
                                     Long completesAt,
                                     int position,
                                     int reportedProgress) {

    public boolean active() {
        return startedAt != null && completesAt != null;
    }

    public ConstructionQueueEntry started(long now, long completesAtMillis) {
        return new ConstructionQueueEntry(id, settlementId, structureType, tileId, emergency, queuedAt,
            now, completesAtMillis, position, 0);
    }

    public ConstructionQueueEntry withPosition(int newPosition) {
        return new ConstructionQueueEntry(id, settlementId, structureType, tileId, emergency, queuedAt,
            startedAt, completesAt, newPosition, reportedProgress);
    }

    public ConstructionQueueEntry withReportedProgress(int progress) {
        return new ConstructionQueueEntry(id, settlementId, structureType, tileId, emergency, queuedAt,
            startedAt, completesAt, position, progress);
    }
}
