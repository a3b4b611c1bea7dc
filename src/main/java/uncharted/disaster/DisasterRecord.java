package uncharted.disaster;

/**
 * Archived summary of a disaster that reached RESOLVED.
 */
public record DisasterRecord(String id,
                             DisasterType type,
                             int severity,
                             SeverityLevel severityLevel,
                             long warningAt,
                             long resolvedAt,
                             int casualties,
                             int structuresDamaged,
                             int structuresDestroyed,
                             int resilienceGain) {
}
