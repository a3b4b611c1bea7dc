package uncharted.population;

/**
 * The six happiness factors, each 0..100, and their weighted total.
 */
public record HappinessBreakdown(double resourceSufficiency,
                                 double housingQuality,
                                 double disasterPreparedness,
                                 double recentTrauma,
                                 double morale,
                                 double npcRelations,
                                 double total) {
}
