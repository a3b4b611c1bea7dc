package uncharted.disaster;

/**
 * Damage fixed for a disaster at the start of its impact.
 *
 * @param baseDamage {@code max(0, severity - preparedness)}
 * @param variance the random factor applied, within [-0.2, 0.2]
 * @param netDamage {@code clamp(baseDamage × (1 + variance), 0, 100)}: health an unresisting
 *                  structure loses over the whole impact
 * @param casualties settlers expected to die over the whole impact
 */
public record DamagePlan(double preparedness, double baseDamage, double variance, double netDamage, int casualties) {
}
