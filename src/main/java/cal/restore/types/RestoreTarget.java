package cal.restore.types;

/**
 * Everything a database adapter needs to run a restore: its configured
 * settings and the overrides of this particular request.
 */
public record RestoreTarget(AdapterSettings settings, RestoreOverrides overrides) {
}
